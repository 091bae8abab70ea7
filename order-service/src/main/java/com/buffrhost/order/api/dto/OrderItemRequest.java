package com.buffrhost.order.api.dto;

import com.buffrhost.order.domain.service.NewOrderLine;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record OrderItemRequest(
        @NotNull(message = "Menu item ID cannot be null")
        Long menuItemId,

        @NotBlank(message = "Name cannot be blank")
        String name,

        @NotNull(message = "Quantity cannot be null")
        @Positive(message = "Quantity must be positive")
        Integer quantity,

        @NotNull(message = "Unit price cannot be null")
        @PositiveOrZero(message = "Unit price cannot be negative")
        @Digits(integer = 10, fraction = 2)
        BigDecimal unitPrice
) {
    public NewOrderLine toLine() {
        return new NewOrderLine(menuItemId, name, quantity, unitPrice);
    }
}
