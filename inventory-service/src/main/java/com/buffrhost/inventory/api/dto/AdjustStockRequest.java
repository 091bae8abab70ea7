package com.buffrhost.inventory.api.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record AdjustStockRequest(
        @NotNull(message = "Target level cannot be null")
        @PositiveOrZero(message = "Target level cannot be negative")
        @Digits(integer = 9, fraction = 3)
        BigDecimal targetLevel,

        @Size(max = 255)
        String reason
) {
}
