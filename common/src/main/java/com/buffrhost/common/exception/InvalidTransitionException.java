package com.buffrhost.common.exception;

import java.util.Map;

/**
 * A status change that the lifecycle graph does not allow from the entity's current status,
 * or one based on a status the entity no longer has.
 */
public class InvalidTransitionException extends BusinessException {
    public static final String ERROR_CODE = "INVALID_TRANSITION";

    public InvalidTransitionException(String entityType, Object id, Enum<?> currentStatus, Enum<?> requestedStatus) {
        super(String.format("%s %s cannot move from %s to %s", entityType, id, currentStatus, requestedStatus),
                ERROR_CODE,
                Map.of("id", String.valueOf(id),
                        "currentStatus", currentStatus.name(),
                        "requestedStatus", requestedStatus.name()));
    }

    /**
     * Stale read: the caller expected {@code expectedStatus} but the entity has moved on.
     */
    public InvalidTransitionException(String entityType, Object id, Enum<?> currentStatus, Enum<?> requestedStatus,
                                      Enum<?> expectedStatus) {
        super(String.format("%s %s is %s, not %s; refusing move to %s",
                        entityType, id, currentStatus, expectedStatus, requestedStatus),
                ERROR_CODE,
                Map.of("id", String.valueOf(id),
                        "currentStatus", currentStatus.name(),
                        "requestedStatus", requestedStatus.name(),
                        "expectedStatus", expectedStatus.name()));
    }
}
