package com.buffrhost.order.api.dto;

import com.buffrhost.order.domain.model.OrderStatus;
import com.buffrhost.order.domain.model.OrderStatusHistory;

import java.time.LocalDateTime;

public record StatusHistoryResponse(
        Long id,
        OrderStatus previousStatus,
        OrderStatus status,
        String actor,
        String notes,
        LocalDateTime createdAt
) {
    public static StatusHistoryResponse from(OrderStatusHistory entry) {
        return new StatusHistoryResponse(entry.getId(), entry.getPreviousStatus(), entry.getStatus(),
                entry.getActor(), entry.getNotes(), entry.getCreatedAt());
    }
}
