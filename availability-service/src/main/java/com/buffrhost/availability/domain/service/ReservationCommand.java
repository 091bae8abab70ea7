package com.buffrhost.availability.domain.service;

import com.buffrhost.availability.domain.model.Reservation;
import com.buffrhost.common.exception.ValidationException;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;

/**
 * Request to reserve {@code resourceId} for [start, end) on behalf of a customer,
 * scoped to the caller's property.
 *
 * @param partySize      Optional. Checked against the resource capacity when present.
 * @param idempotencyKey Optional. A repeated identical request with the same key returns the original reservation.
 */
public record ReservationCommand(
        Long propertyId,
        Long resourceId,
        LocalDateTime start,
        LocalDateTime end,
        Long customerId,
        Integer partySize,
        String idempotencyKey
) {
    public static final String IDEMPOTENCY_KEY_REUSED = "IDEMPOTENCY_KEY_REUSED";

    public boolean hasIdempotencyKey() {
        return idempotencyKey != null && !idempotencyKey.isBlank();
    }

    /**
     * Returns {@code existing}, the reservation stored under this command's key, if this command
     * asks for exactly that reservation.
     *
     * @throws ValidationException if the key was used for another property, resource, interval, customer or party size
     */
    public Reservation replayOf(Reservation existing) {
        boolean same = Objects.equals(propertyId, existing.getPropertyId())
                && Objects.equals(resourceId, existing.getResourceId())
                && sameTimestamp(start, existing.getStartAt())
                && sameTimestamp(end, existing.getEndAt())
                && Objects.equals(customerId, existing.getCustomerId())
                && Objects.equals(partySize, existing.getPartySize());
        if (!same) {
            throw new ValidationException("Idempotency key " + idempotencyKey + " was already used for a different reservation",
                    IDEMPOTENCY_KEY_REUSED, Map.of("idempotencyKey", idempotencyKey));
        }
        return existing;
    }

    // PostgreSQL keeps microseconds
    private static boolean sameTimestamp(LocalDateTime requested, LocalDateTime stored) {
        return requested != null && stored != null
                && requested.truncatedTo(ChronoUnit.MICROS).equals(stored.truncatedTo(ChronoUnit.MICROS));
    }
}
