package com.buffrhost.order.api.controller;

import com.buffrhost.common.dto.BaseResponse;
import com.buffrhost.common.util.Constants;
import com.buffrhost.order.api.dto.CreateOrderRequest;
import com.buffrhost.order.api.dto.OrderItemRequest;
import com.buffrhost.order.api.dto.OrderResponse;
import com.buffrhost.order.api.dto.StatusHistoryResponse;
import com.buffrhost.order.api.dto.TransitionStatusRequest;
import com.buffrhost.order.api.dto.UpdateChargesRequest;
import com.buffrhost.order.api.dto.UpdateOrderItemRequest;
import com.buffrhost.order.domain.model.OrderStatus;
import com.buffrhost.order.domain.service.OrderLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for orders and their status lifecycle.
 */
@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderLifecycleService lifecycleService;

    @PostMapping
    public ResponseEntity<BaseResponse<OrderResponse>> createOrder(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @RequestHeader(Constants.ACTOR_HEADER) String actor,
            @Valid @RequestBody CreateOrderRequest request) {
        OrderResponse response = OrderResponse.from(
                lifecycleService.createOrder(propertyId, request.toNewOrder(), actor));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Order created successfully", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<OrderResponse>>> listOrders(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @RequestParam(required = false) OrderStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(BaseResponse.success(
                lifecycleService.listOrders(propertyId, status, page, size).stream().map(OrderResponse::from).toList()));
    }

    @GetMapping("/customer/{customerId}")
    public ResponseEntity<BaseResponse<List<OrderResponse>>> listCustomerOrders(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long customerId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(BaseResponse.success(
                lifecycleService.listCustomerOrders(propertyId, customerId, page, size).stream()
                        .map(OrderResponse::from)
                        .toList()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<OrderResponse>> getOrder(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(OrderResponse.from(lifecycleService.getOrder(propertyId, id))));
    }

    @PostMapping("/{id}/items")
    public ResponseEntity<BaseResponse<OrderResponse>> addItem(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id,
            @Valid @RequestBody OrderItemRequest request) {
        OrderResponse response = OrderResponse.from(lifecycleService.addItem(propertyId, id, request.toLine()));
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success("Item added", response));
    }

    @PutMapping("/{id}/items/{itemId}")
    public ResponseEntity<BaseResponse<OrderResponse>> updateItem(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id,
            @PathVariable Long itemId,
            @Valid @RequestBody UpdateOrderItemRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Item updated", OrderResponse.from(
                lifecycleService.updateItem(propertyId, id, itemId, request.quantity(), request.unitPrice()))));
    }

    @DeleteMapping("/{id}/items/{itemId}")
    public ResponseEntity<BaseResponse<OrderResponse>> removeItem(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id,
            @PathVariable Long itemId) {
        return ResponseEntity.ok(BaseResponse.success("Item removed",
                OrderResponse.from(lifecycleService.removeItem(propertyId, id, itemId))));
    }

    /**
     * Tip and delivery fee, editable until the order is confirmed.
     */
    @PutMapping("/{id}/charges")
    public ResponseEntity<BaseResponse<OrderResponse>> updateCharges(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id,
            @Valid @RequestBody UpdateChargesRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Order charges updated", OrderResponse.from(
                lifecycleService.updateCharges(propertyId, id, request.tipAmount(), request.deliveryFee()))));
    }

    /**
     * Fails with 409 INVALID_TRANSITION if the edge is not allowed or {@code expectedStatus} is stale.
     */
    @PostMapping("/{id}/status")
    public ResponseEntity<BaseResponse<OrderResponse>> transitionStatus(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @RequestHeader(Constants.ACTOR_HEADER) String actor,
            @PathVariable Long id,
            @Valid @RequestBody TransitionStatusRequest request) {
        OrderResponse response = OrderResponse.from(lifecycleService.transitionOrderStatus(
                propertyId, id, request.status(), actor, request.notes(), request.expectedStatus()));
        return ResponseEntity.ok(BaseResponse.success("Order status updated", response));
    }

    @GetMapping("/{id}/status-history")
    public ResponseEntity<BaseResponse<List<StatusHistoryResponse>>> getStatusHistory(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id) {
        List<StatusHistoryResponse> history = lifecycleService.getStatusHistory(propertyId, id).stream()
                .map(StatusHistoryResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(history));
    }
}
