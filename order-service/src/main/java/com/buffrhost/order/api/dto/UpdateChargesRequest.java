package com.buffrhost.order.api.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Either field may be omitted to keep its current amount.
 */
public record UpdateChargesRequest(
        @PositiveOrZero(message = "Tip cannot be negative")
        @Digits(integer = 10, fraction = 2)
        BigDecimal tipAmount,

        @PositiveOrZero(message = "Delivery fee cannot be negative")
        @Digits(integer = 10, fraction = 2)
        BigDecimal deliveryFee
) {
}
