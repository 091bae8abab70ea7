package com.buffrhost.common.exception;

/**
 * Thrown when a required dependency (idempotency store, distributed lock) is temporarily unavailable.
 * This is the only failure a caller may retry, and the retry must re-run the whole operation.
 * Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
