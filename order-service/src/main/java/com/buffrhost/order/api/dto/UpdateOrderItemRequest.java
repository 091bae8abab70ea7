package com.buffrhost.order.api.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Either field may be omitted to keep its current value.
 */
public record UpdateOrderItemRequest(
        @Positive(message = "Quantity must be positive")
        Integer quantity,

        @PositiveOrZero(message = "Unit price cannot be negative")
        @Digits(integer = 10, fraction = 2)
        BigDecimal unitPrice
) {
}
