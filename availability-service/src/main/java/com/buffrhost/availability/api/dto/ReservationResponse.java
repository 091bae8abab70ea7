package com.buffrhost.availability.api.dto;

import com.buffrhost.availability.domain.model.Reservation;
import com.buffrhost.availability.domain.model.ReservationStatus;

import java.time.LocalDateTime;

/**
 * Response DTO for a reservation.
 */
public record ReservationResponse(
        Long id,
        Long resourceId,
        Long customerId,
        LocalDateTime start,
        LocalDateTime end,
        Integer partySize,
        ReservationStatus status,
        LocalDateTime holdExpiresAt,
        String cancellationReason,
        LocalDateTime cancelledAt,
        LocalDateTime createdAt
) {
    public static ReservationResponse from(Reservation reservation) {
        return new ReservationResponse(
                reservation.getId(),
                reservation.getResourceId(),
                reservation.getCustomerId(),
                reservation.getStartAt(),
                reservation.getEndAt(),
                reservation.getPartySize(),
                reservation.getStatus(),
                reservation.getHoldExpiresAt(),
                reservation.getCancellationReason(),
                reservation.getCancelledAt(),
                reservation.getCreatedAt());
    }
}
