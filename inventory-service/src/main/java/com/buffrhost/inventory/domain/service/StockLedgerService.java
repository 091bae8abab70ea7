package com.buffrhost.inventory.domain.service;

import com.buffrhost.common.exception.InsufficientStockException;
import com.buffrhost.common.exception.ResourceNotFoundException;
import com.buffrhost.common.exception.ValidationException;
import com.buffrhost.common.util.Constants;
import com.buffrhost.inventory.domain.model.InventoryItem;
import com.buffrhost.inventory.domain.model.ItemDetailsUpdate;
import com.buffrhost.inventory.domain.model.StockTransaction;
import com.buffrhost.inventory.domain.model.TransactionKind;
import com.buffrhost.inventory.domain.repository.InventoryItemRepository;
import com.buffrhost.inventory.domain.repository.StockTransactionRepository;
import com.buffrhost.inventory.events.LowStockEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only stock ledger.
 *
 * Every movement runs as one transaction that moves the cached {@code current_stock} with a guarded
 * atomic UPDATE and appends the matching {@link StockTransaction}. If the guard rejects the movement
 * nothing is written, so {@code current_stock} always equals the sum of the item's deltas and is
 * never negative.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StockLedgerService {

    static final String OPENING_BALANCE_REASON = "Opening balance";
    static final String INVALID_PRECISION = "INVALID_QUANTITY_PRECISION";
    static final String STOCK_LIMIT_EXCEEDED = "STOCK_LIMIT_EXCEEDED";

    // Matches NUMERIC(12,3) on every stock column.
    static final int STOCK_SCALE = 3;
    static final int STOCK_INTEGER_DIGITS = 9;
    static final BigDecimal MAX_STOCK = new BigDecimal("999999999.999");

    private final InventoryItemRepository itemRepository;
    private final StockTransactionRepository transactionRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Value("${inventory.history.default-limit:50}")
    private int defaultHistoryLimit;

    /**
     * Records a purchase, sale, waste or return.
     *
     * @throws InsufficientStockException if the movement would take stock below zero; nothing is recorded
     */
    @Transactional
    public StockTransaction recordTransaction(Long propertyId, StockMovementCommand command) {
        if (command.kind() == null) {
            throw new ValidationException("kind is required");
        }
        if (!command.kind().isRecordable()) {
            throw new ValidationException("Adjustments are recorded through a stock adjustment, not as a movement",
                    Map.of("kind", command.kind()));
        }
        requirePositive(command.quantity());
        requireStockPrecision("quantity", command.quantity());
        requireActor(command.actor());

        InventoryItem item = findItem(propertyId, command.itemId());
        BigDecimal delta = command.kind().toDelta(command.quantity());
        return append(item, command.kind(), command.quantity(), delta,
                command.reason(), command.actor(), command.referenceId());
    }

    /**
     * Brings the item to a counted level by appending a synthetic ADJUSTMENT of
     * {@code targetLevel - current_stock}. The stock column is never overwritten.
     * A zero difference is still recorded, as a count confirmation.
     */
    @Transactional
    public StockTransaction adjustStock(Long propertyId, Long itemId, BigDecimal targetLevel,
                                        String reason, String actor) {
        if (targetLevel == null || targetLevel.signum() < 0) {
            throw new ValidationException("targetLevel must be zero or positive",
                    targetLevel == null ? Map.of() : Map.of("targetLevel", targetLevel));
        }
        requireStockPrecision("targetLevel", targetLevel);
        requireActor(actor);

        InventoryItem item = itemRepository.findByIdAndPropertyIdForUpdate(itemId, propertyId)
                .orElseThrow(() -> new ResourceNotFoundException("InventoryItem", itemId));
        BigDecimal delta = targetLevel.subtract(item.getCurrentStock());
        log.debug("Adjusting item {} from {} to {} (delta {})", itemId, item.getCurrentStock(), targetLevel, delta);
        return append(item, TransactionKind.ADJUSTMENT, delta.abs(), delta, reason, actor, null);
    }

    /**
     * Most recent first, ties by insertion order. {@code limit} defaults to the configured
     * history limit and is capped.
     */
    @Transactional(readOnly = true)
    public List<StockTransaction> getTransactionHistory(Long propertyId, Long itemId, Integer limit) {
        int effectiveLimit = limit == null ? defaultHistoryLimit : limit;
        if (effectiveLimit <= 0) {
            throw new ValidationException("limit must be positive", Map.of("limit", effectiveLimit));
        }
        effectiveLimit = Math.min(effectiveLimit, Constants.MAX_HISTORY_LIMIT);

        InventoryItem item = findItem(propertyId, itemId);
        return transactionRepository.findByItemIdOrderByCreatedAtDescIdDesc(item.getId(), PageRequest.of(0, effectiveLimit));
    }

    @Transactional(readOnly = true)
    public List<InventoryItem> getLowStockItems(Long propertyId) {
        return itemRepository.findLowStock(propertyId);
    }

    /**
     * Active items whose expiry date falls within the next {@code withinDays} days, already expired ones included.
     */
    @Transactional(readOnly = true)
    public List<InventoryItem> getExpiringItems(Long propertyId, int withinDays) {
        if (withinDays < 0) {
            throw new ValidationException("withinDays must not be negative", Map.of("withinDays", withinDays));
        }
        return itemRepository.findExpiringOnOrBefore(propertyId, LocalDate.now().plusDays(withinDays));
    }

    /**
     * Replays the ledger and compares it with the cached stock column.
     */
    @Transactional(readOnly = true)
    public LedgerReconciliation verifyLedger(Long propertyId, Long itemId) {
        InventoryItem item = findItem(propertyId, itemId);
        BigDecimal ledgerStock = transactionRepository.sumDeltas(itemId);
        LedgerReconciliation result = new LedgerReconciliation(
                itemId,
                item.getCurrentStock(),
                ledgerStock == null ? BigDecimal.ZERO : ledgerStock,
                transactionRepository.countByItemId(itemId));
        if (!result.isConsistent()) {
            log.warn("Ledger mismatch on item {}: cached={}, ledger={}",
                    itemId, result.cachedStock(), result.ledgerStock());
        }
        return result;
    }

    @Transactional
    public InventoryItem createItem(Long propertyId, NewInventoryItem request, String actor) {
        if (itemRepository.existsByPropertyIdAndSku(propertyId, request.sku())) {
            throw new ValidationException("SKU " + request.sku() + " already exists in property " + propertyId,
                    "DUPLICATE_SKU", Map.of("propertyId", propertyId, "sku", request.sku()));
        }
        if (request.minStock() != null && request.maxStock() != null
                && request.minStock().compareTo(request.maxStock()) > 0) {
            throw new ValidationException("minStock must not exceed maxStock",
                    Map.of("minStock", request.minStock(), "maxStock", request.maxStock()));
        }
        if (request.openingBalance() != null && request.openingBalance().signum() < 0) {
            throw new ValidationException("openingBalance must not be negative",
                    Map.of("openingBalance", request.openingBalance()));
        }
        requireStockPrecision("openingBalance", request.openingBalance());
        requireStockLevels(request.minStock(), request.maxStock(), request.reorderPoint(), request.reorderQuantity());

        InventoryItem item = itemRepository.save(InventoryItem.builder()
                .propertyId(propertyId)
                .sku(request.sku())
                .name(request.name())
                .unit(request.unit())
                .minStock(request.minStock() == null ? BigDecimal.ZERO : request.minStock())
                .maxStock(request.maxStock())
                .reorderPoint(request.reorderPoint())
                .reorderQuantity(request.reorderQuantity())
                .expiryDate(request.expiryDate())
                .build());
        log.info("Created inventory item {} ({}) in property {}", item.getId(), item.getSku(), propertyId);

        if (request.openingBalance() != null && request.openingBalance().signum() > 0) {
            requireActor(actor);
            append(item, TransactionKind.ADJUSTMENT, request.openingBalance(), request.openingBalance(),
                    OPENING_BALANCE_REASON, actor, null);
            return itemRepository.findById(item.getId()).orElseThrow();
        }
        return item;
    }

    @Transactional(readOnly = true)
    public InventoryItem getItem(Long propertyId, Long itemId) {
        return findItem(propertyId, itemId);
    }

    /**
     * Items of the property, newest first. Deactivated items are left out unless asked for.
     */
    @Transactional(readOnly = true)
    public List<InventoryItem> listItems(Long propertyId, boolean includeInactive, int page, int size) {
        if (page < 0 || size <= 0) {
            throw new ValidationException("page must not be negative and size must be positive",
                    Map.of("page", page, "size", size));
        }
        PageRequest pageable = PageRequest.of(page, Math.min(size, Constants.MAX_PAGE_SIZE));
        return includeInactive
                ? itemRepository.findByPropertyIdOrderByCreatedAtDescIdDesc(propertyId, pageable)
                : itemRepository.findByPropertyIdAndActiveTrueOrderByCreatedAtDescIdDesc(propertyId, pageable);
    }

    /**
     * Changes descriptive and threshold fields. Stock only moves through the ledger, so
     * {@code current_stock} is untouched and no transaction is appended.
     */
    @Transactional
    public InventoryItem updateItem(Long propertyId, Long itemId, ItemDetailsUpdate update) {
        if (update.name() != null && update.name().isBlank()) {
            throw new ValidationException("name must not be blank");
        }
        requireStockLevels(update.minStock(), update.maxStock(), update.reorderPoint(), update.reorderQuantity());

        InventoryItem item = itemRepository.findByIdAndPropertyIdForUpdate(itemId, propertyId)
                .orElseThrow(() -> new ResourceNotFoundException("InventoryItem", itemId));
        BigDecimal minStock = update.minStock() != null ? update.minStock() : item.getMinStock();
        BigDecimal maxStock = update.maxStock() != null ? update.maxStock() : item.getMaxStock();
        if (maxStock != null && minStock.compareTo(maxStock) > 0) {
            throw new ValidationException("minStock must not exceed maxStock",
                    Map.of("minStock", minStock, "maxStock", maxStock));
        }

        item.updateDetails(update);
        InventoryItem saved = itemRepository.saveAndFlush(item);
        log.info("Updated details of inventory item {} ({})", saved.getId(), saved.getSku());
        return saved;
    }

    private StockTransaction append(InventoryItem item, TransactionKind kind, BigDecimal quantity, BigDecimal delta,
                                    String reason, String actor, String referenceId) {
        if (item.getCurrentStock().add(delta).compareTo(MAX_STOCK) > 0) {
            throw stockLimitExceeded(item.getId(), delta);
        }
        int updated = itemRepository.applyDelta(item.getId(), delta, LocalDateTime.now());
        if (updated == 0) {
            BigDecimal available = itemRepository.findCurrentStock(item.getId());
            if (available.add(delta).compareTo(MAX_STOCK) > 0) {
                throw stockLimitExceeded(item.getId(), delta);
            }
            throw new InsufficientStockException(item.getId(), quantity, available);
        }
        BigDecimal balanceAfter = itemRepository.findCurrentStock(item.getId());

        StockTransaction transaction = transactionRepository.save(StockTransaction.builder()
                .itemId(item.getId())
                .kind(kind)
                .quantity(quantity)
                .delta(delta)
                .balanceAfter(balanceAfter)
                .reason(reason)
                .actor(actor)
                .referenceId(referenceId)
                .build());
        log.info("Recorded {} of {} on item {} by {}: balance {}",
                kind, delta.toPlainString(), item.getId(), actor, balanceAfter.toPlainString());

        publishIfCrossedMinimum(item, balanceAfter.subtract(delta), balanceAfter);
        return transaction;
    }

    private void publishIfCrossedMinimum(InventoryItem item, BigDecimal before, BigDecimal after) {
        BigDecimal min = item.getMinStock();
        if (before.compareTo(min) > 0 && after.compareTo(min) <= 0) {
            log.warn("Item {} ({}) fell to {} at or below minimum {}", item.getId(), item.getSku(), after, min);
            eventPublisher.publishEvent(LowStockEvent.builder()
                    .itemId(item.getId())
                    .propertyId(item.getPropertyId())
                    .sku(item.getSku())
                    .name(item.getName())
                    .currentStock(after)
                    .minStock(min)
                    .reorderQuantity(item.getReorderQuantity())
                    .timestamp(Instant.now())
                    .build());
        }
    }

    private static ValidationException stockLimitExceeded(Long itemId, BigDecimal delta) {
        return new ValidationException("Stock of item " + itemId + " would exceed " + MAX_STOCK.toPlainString(),
                STOCK_LIMIT_EXCEEDED, Map.of("itemId", itemId, "delta", delta));
    }

    private InventoryItem findItem(Long propertyId, Long itemId) {
        return itemRepository.findByIdAndPropertyId(itemId, propertyId)
                .orElseThrow(() -> new ResourceNotFoundException("InventoryItem", itemId));
    }

    private static void requirePositive(BigDecimal quantity) {
        if (quantity == null || quantity.signum() <= 0) {
            Map<String, Object> details = new HashMap<>();
            details.put("quantity", quantity);
            throw new ValidationException("quantity must be positive", details);
        }
    }

    private static void requireStockLevels(BigDecimal... levels) {
        for (BigDecimal level : levels) {
            if (level != null && level.signum() < 0) {
                throw new ValidationException("Stock thresholds must not be negative", Map.of("value", level));
            }
            requireStockPrecision("threshold", level);
        }
    }

    /**
     * Rejects values the stock columns would round or overflow.
     */
    static void requireStockPrecision(String field, BigDecimal value) {
        if (value == null) {
            return;
        }
        BigDecimal normalized = value.stripTrailingZeros();
        int integerDigits = normalized.precision() - normalized.scale();
        if (normalized.scale() > STOCK_SCALE || integerDigits > STOCK_INTEGER_DIGITS) {
            throw new ValidationException(field + " allows at most " + STOCK_INTEGER_DIGITS
                    + " integer digits and " + STOCK_SCALE + " decimal places",
                    INVALID_PRECISION, Map.of(field, value.toPlainString()));
        }
    }

    private static void requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new ValidationException("actor is required");
        }
    }
}
