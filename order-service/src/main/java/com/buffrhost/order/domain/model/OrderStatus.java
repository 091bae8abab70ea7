package com.buffrhost.order.domain.model;

import java.util.Set;

/**
 * Order lifecycle: PENDING -> CONFIRMED -> PREPARING -> READY -> COMPLETED.
 * CANCELLED is reachable from PENDING, CONFIRMED and PREPARING only.
 */
public enum OrderStatus {
    PENDING,
    CONFIRMED,
    PREPARING,
    READY,
    COMPLETED,
    CANCELLED;

    public Set<OrderStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> Set.of(CONFIRMED, CANCELLED);
            case CONFIRMED -> Set.of(PREPARING, CANCELLED);
            case PREPARING -> Set.of(READY, CANCELLED);
            case READY -> Set.of(COMPLETED);
            case COMPLETED, CANCELLED -> Set.of();
        };
    }

    public boolean canTransitionTo(OrderStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }

    /** Line items can only change before the kitchen has accepted the order. */
    public boolean isEditable() {
        return this == PENDING;
    }
}
