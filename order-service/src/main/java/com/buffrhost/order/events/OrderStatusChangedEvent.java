package com.buffrhost.order.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Published for every recorded status change, creation included (previousStatus null).
 * Consumed by kitchen displays and notification delivery.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusChangedEvent {
    private Long orderId;
    private String orderNumber;
    private Long propertyId;
    private String previousStatus;
    private String status;
    private String actor;
    private BigDecimal totalAmount;
    private Instant timestamp;
}
