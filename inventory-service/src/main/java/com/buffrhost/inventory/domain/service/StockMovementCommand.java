package com.buffrhost.inventory.domain.service;

import com.buffrhost.inventory.domain.model.TransactionKind;

import java.math.BigDecimal;

/**
 * A stock movement as entered by staff or a POS: an unsigned quantity whose direction comes from the kind.
 *
 * @param referenceId Optional. Order, purchase order or delivery note the movement belongs to.
 */
public record StockMovementCommand(
        Long itemId,
        TransactionKind kind,
        BigDecimal quantity,
        String reason,
        String actor,
        String referenceId
) {
}
