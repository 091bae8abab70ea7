package com.buffrhost.common.exception;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A reservation would overlap an active reservation on the same resource.
 * The caller must re-query availability before trying again.
 */
public class ReservationConflictException extends BusinessException {
    public static final String ERROR_CODE = "RESERVATION_CONFLICT";

    public ReservationConflictException(Long resourceId, LocalDateTime start, LocalDateTime end,
                                        Long conflictingReservationId) {
        super(String.format("Resource %d is not available for [%s, %s)", resourceId, start, end),
                ERROR_CODE, details(resourceId, start, end, conflictingReservationId));
    }

    private static Map<String, Object> details(Long resourceId, LocalDateTime start, LocalDateTime end,
                                               Long conflictingReservationId) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("resourceId", resourceId);
        details.put("start", String.valueOf(start));
        details.put("end", String.valueOf(end));
        if (conflictingReservationId != null) {
            details.put("conflictingReservationId", conflictingReservationId);
        }
        return details;
    }
}
