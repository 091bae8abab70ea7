package com.buffrhost.order.api.dto;

import com.buffrhost.order.domain.model.Order;
import com.buffrhost.order.domain.model.OrderStatus;
import com.buffrhost.order.domain.model.OrderType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record OrderResponse(
        Long id,
        String orderNumber,
        Long propertyId,
        Long customerId,
        OrderType orderType,
        OrderStatus status,
        List<OrderItemResponse> items,
        BigDecimal subtotal,
        BigDecimal taxAmount,
        BigDecimal tipAmount,
        BigDecimal deliveryFee,
        BigDecimal totalAmount,
        boolean totalsFinal,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static OrderResponse from(Order order) {
        return new OrderResponse(
                order.getId(),
                order.getOrderNumber(),
                order.getPropertyId(),
                order.getCustomerId(),
                order.getOrderType(),
                order.getStatus(),
                order.getItems().stream().map(OrderItemResponse::from).toList(),
                order.getSubtotal(),
                order.getTaxAmount(),
                order.getTipAmount(),
                order.getDeliveryFee(),
                order.getTotalAmount(),
                order.getTotalsFinalizedAt() != null,
                order.getCreatedAt(),
                order.getUpdatedAt());
    }
}
