package com.buffrhost.availability.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDateTime;

/**
 * Request DTO for reserving a room or table for [start, end).
 * The idempotency key travels in the Idempotency-Key header, not in the body.
 */
public record CreateReservationRequest(
        @NotNull(message = "Resource ID cannot be null")
        Long resourceId,

        @NotNull(message = "Start cannot be null")
        LocalDateTime start,

        @NotNull(message = "End cannot be null")
        LocalDateTime end,

        @NotNull(message = "Customer ID cannot be null")
        Long customerId,

        @Positive(message = "Party size must be positive")
        Integer partySize
) {
}
