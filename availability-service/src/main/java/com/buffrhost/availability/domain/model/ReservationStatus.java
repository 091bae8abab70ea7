package com.buffrhost.availability.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Reservation lifecycle: HELD -> CONFIRMED, and either of them -> CANCELLED.
 * Only active reservations take part in the overlap check.
 */
public enum ReservationStatus {
    HELD,
    CONFIRMED,
    CANCELLED;

    public boolean isActive() {
        return this != CANCELLED;
    }

    public static Set<ReservationStatus> active() {
        return EnumSet.of(HELD, CONFIRMED);
    }
}
