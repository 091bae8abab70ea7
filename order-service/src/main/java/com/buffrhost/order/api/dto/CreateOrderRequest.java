package com.buffrhost.order.api.dto;

import com.buffrhost.order.domain.model.OrderType;
import com.buffrhost.order.domain.service.NewOrder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.util.List;

public record CreateOrderRequest(
        Long customerId,

        @NotNull(message = "Order type cannot be null")
        OrderType orderType,

        List<@Valid OrderItemRequest> items,

        @PositiveOrZero(message = "Tip cannot be negative")
        @Digits(integer = 10, fraction = 2)
        BigDecimal tipAmount,

        @PositiveOrZero(message = "Delivery fee cannot be negative")
        @Digits(integer = 10, fraction = 2)
        BigDecimal deliveryFee
) {
    public NewOrder toNewOrder() {
        return new NewOrder(customerId, orderType,
                items == null ? List.of() : items.stream().map(OrderItemRequest::toLine).toList(),
                tipAmount, deliveryFee);
    }
}
