package com.buffrhost.inventory.api.controller;

import com.buffrhost.common.dto.BaseResponse;
import com.buffrhost.common.util.Constants;
import com.buffrhost.inventory.api.dto.AdjustStockRequest;
import com.buffrhost.inventory.api.dto.CreateItemRequest;
import com.buffrhost.inventory.api.dto.ItemResponse;
import com.buffrhost.inventory.api.dto.RecordTransactionRequest;
import com.buffrhost.inventory.api.dto.StockTransactionResponse;
import com.buffrhost.inventory.api.dto.UpdateItemRequest;
import com.buffrhost.inventory.domain.service.LedgerReconciliation;
import com.buffrhost.inventory.domain.service.StockLedgerService;
import com.buffrhost.inventory.domain.service.StockMovementCommand;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the stock ledger.
 * Every mutation records the X-Actor header on the ledger entry.
 */
@RestController
@RequestMapping("/api/v1/inventory/items")
@RequiredArgsConstructor
public class InventoryController {

    private final StockLedgerService ledgerService;

    @PostMapping
    public ResponseEntity<BaseResponse<ItemResponse>> createItem(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @RequestHeader(value = Constants.ACTOR_HEADER, defaultValue = Constants.SYSTEM_ACTOR) String actor,
            @Valid @RequestBody CreateItemRequest request) {
        ItemResponse response = ItemResponse.from(ledgerService.createItem(propertyId, request.toNewItem(), actor));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Inventory item created successfully", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<ItemResponse>>> listItems(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @RequestParam(defaultValue = "false") boolean includeInactive,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(BaseResponse.success(
                ledgerService.listItems(propertyId, includeInactive, page, size).stream().map(ItemResponse::from).toList()));
    }

    /**
     * Updates name, unit, thresholds, expiry or the active flag. Never moves stock.
     */
    @PutMapping("/{id}")
    public ResponseEntity<BaseResponse<ItemResponse>> updateItem(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id,
            @Valid @RequestBody UpdateItemRequest request) {
        ItemResponse response = ItemResponse.from(ledgerService.updateItem(propertyId, id, request.toUpdate()));
        return ResponseEntity.ok(BaseResponse.success("Inventory item updated", response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<ItemResponse>> getItem(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(ItemResponse.from(ledgerService.getItem(propertyId, id))));
    }

    /**
     * Records a purchase, sale, waste or return. Fails with 422 if stock would go negative.
     */
    @PostMapping("/{id}/transactions")
    public ResponseEntity<BaseResponse<StockTransactionResponse>> recordTransaction(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @RequestHeader(Constants.ACTOR_HEADER) String actor,
            @PathVariable Long id,
            @Valid @RequestBody RecordTransactionRequest request) {
        StockMovementCommand command = new StockMovementCommand(
                id, request.kind(), request.quantity(), request.reason(), actor, request.referenceId());
        StockTransactionResponse response = StockTransactionResponse.from(
                ledgerService.recordTransaction(propertyId, command));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Stock transaction recorded", response));
    }

    /**
     * Sets the stock to a counted level through a synthetic adjustment entry.
     */
    @PostMapping("/{id}/adjustments")
    public ResponseEntity<BaseResponse<StockTransactionResponse>> adjustStock(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @RequestHeader(Constants.ACTOR_HEADER) String actor,
            @PathVariable Long id,
            @Valid @RequestBody AdjustStockRequest request) {
        StockTransactionResponse response = StockTransactionResponse.from(
                ledgerService.adjustStock(propertyId, id, request.targetLevel(), request.reason(), actor));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Stock adjusted", response));
    }

    @GetMapping("/{id}/transactions")
    public ResponseEntity<BaseResponse<List<StockTransactionResponse>>> getTransactionHistory(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id,
            @RequestParam(required = false) Integer limit) {
        List<StockTransactionResponse> history = ledgerService.getTransactionHistory(propertyId, id, limit)
                .stream()
                .map(StockTransactionResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(history));
    }

    @GetMapping("/{id}/reconciliation")
    public ResponseEntity<BaseResponse<LedgerReconciliation>> verifyLedger(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(ledgerService.verifyLedger(propertyId, id)));
    }

    @GetMapping("/low-stock")
    public ResponseEntity<BaseResponse<List<ItemResponse>>> getLowStockItems(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId) {
        return ResponseEntity.ok(BaseResponse.success(
                ledgerService.getLowStockItems(propertyId).stream().map(ItemResponse::from).toList()));
    }

    @GetMapping("/expiring")
    public ResponseEntity<BaseResponse<List<ItemResponse>>> getExpiringItems(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @RequestParam(defaultValue = "7") int withinDays) {
        return ResponseEntity.ok(BaseResponse.success(
                ledgerService.getExpiringItems(propertyId, withinDays).stream().map(ItemResponse::from).toList()));
    }
}
