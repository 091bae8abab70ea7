package com.buffrhost.inventory.api.dto;

import com.buffrhost.inventory.domain.model.UnitOfMeasure;
import com.buffrhost.inventory.domain.service.NewInventoryItem;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

public record CreateItemRequest(
        @NotBlank(message = "SKU cannot be blank")
        @Size(max = 64)
        String sku,

        @NotBlank(message = "Name cannot be blank")
        String name,

        @NotNull(message = "Unit cannot be null")
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

        @PositiveOrZero(message = "Opening balance cannot be negative")
        @Digits(integer = 9, fraction = 3)
        BigDecimal openingBalance
) {
    public NewInventoryItem toNewItem() {
        return new NewInventoryItem(sku, name, unit, minStock, maxStock, reorderPoint, reorderQuantity,
                expiryDate, openingBalance);
    }
}
