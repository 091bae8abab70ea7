package com.buffrhost.inventory.api.dto;

import com.buffrhost.inventory.domain.model.ItemDetailsUpdate;
import com.buffrhost.inventory.domain.model.UnitOfMeasure;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Only the fields present are changed. Stock levels are changed through transactions and adjustments.
 */
public record UpdateItemRequest(
        @Size(min = 1, max = 255)
        String name,

        UnitOfMeasure unit,

        @PositiveOrZero
        @Digits(integer = 9, fraction = 3)
        BigDecimal minStock,

        @PositiveOrZero
        @Digits(integer = 9, fraction = 3)
        BigDecimal maxStock,

        @PositiveOrZero
        @Digits(integer = 9, fraction = 3)
        BigDecimal reorderPoint,

        @PositiveOrZero
        @Digits(integer = 9, fraction = 3)
        BigDecimal reorderQuantity,

        LocalDate expiryDate,

        Boolean active
) {
    public ItemDetailsUpdate toUpdate() {
        return new ItemDetailsUpdate(name, unit, minStock, maxStock, reorderPoint, reorderQuantity, expiryDate, active);
    }
}
