package com.buffrhost.availability.domain.strategy;

import com.buffrhost.availability.domain.model.Reservation;
import com.buffrhost.availability.domain.service.ReservationCommand;

import java.time.LocalDateTime;

/**
 * Concurrency control for the check-and-insert of a reservation.
 * Each implementation guarantees that the overlap check and the insert commit as one unit
 * with respect to other bookings of the same resource.
 *
 * Implementations (bean names):
 * - pessimistic: SELECT FOR UPDATE on the resource row
 * - optimistic: forced version increment on the resource row, retried on conflict
 * - distributed: Redisson lock keyed by resource around a programmatic transaction
 */
public interface ReservationStrategy {

    /**
     * Creates a HELD reservation or fails with ReservationConflictException.
     *
     * @param command       Validated reservation request
     * @param holdExpiresAt Moment after which an unconfirmed hold may be swept
     * @return The persisted reservation
     */
    Reservation reserve(ReservationCommand command, LocalDateTime holdExpiresAt);

    /**
     * @return Strategy type (PESSIMISTIC_LOCK, OPTIMISTIC_LOCK, DISTRIBUTED_LOCK)
     */
    String getStrategyType();
}
