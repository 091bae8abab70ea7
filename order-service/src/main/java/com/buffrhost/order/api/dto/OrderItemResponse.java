package com.buffrhost.order.api.dto;

import com.buffrhost.order.domain.model.OrderItem;

import java.math.BigDecimal;

public record OrderItemResponse(
        Long id,
        Long menuItemId,
        String name,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal lineTotal
) {
    public static OrderItemResponse from(OrderItem item) {
        return new OrderItemResponse(item.getId(), item.getMenuItemId(), item.getName(),
                item.getQuantity(), item.getUnitPrice(), item.getLineTotal());
    }
}
