package com.buffrhost.inventory.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial update of an item's descriptive fields. Null keeps the current value.
 */
public record ItemDetailsUpdate(
        String name,
        UnitOfMeasure unit,
        BigDecimal minStock,
        BigDecimal maxStock,
        BigDecimal reorderPoint,
        BigDecimal reorderQuantity,
        LocalDate expiryDate,
        Boolean active
) {
}
