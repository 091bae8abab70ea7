package com.buffrhost.inventory.domain.model;

import java.math.BigDecimal;

/**
 * Kind of stock movement. The kind decides the sign of the movement; callers always pass
 * an unsigned quantity.
 */
public enum TransactionKind {
    PURCHASE,
    SALE,
    /** Manual correction to a counted level. Produced only by a stock adjustment, which supplies its own signed delta. */
    ADJUSTMENT,
    WASTE,
    RETURN;

    /**
     * Signed change in stock for a movement of {@code quantity} units of this kind.
     *
     * @throws IllegalStateException for ADJUSTMENT, whose delta is not derived from a quantity
     */
    public BigDecimal toDelta(BigDecimal quantity) {
        return switch (this) {
            case PURCHASE, RETURN -> quantity;
            case SALE, WASTE -> quantity.negate();
            case ADJUSTMENT -> throw new IllegalStateException("Adjustment deltas are computed from a target level");
        };
    }

    public boolean isRecordable() {
        return this != ADJUSTMENT;
    }
}
