package com.buffrhost.common.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of all business-rule rejections.
 * These are returned to the caller as-is and never retried by the core.
 * {@link #getDetails()} carries the context a caller needs to decide what to do next.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;
    private final Map<String, Object> details;

    public BusinessException(String message) {
        this(message, "BUSINESS_ERROR");
    }

    public BusinessException(String message, String errorCode) {
        this(message, errorCode, Map.of());
    }

    public BusinessException(String message, String errorCode, Map<String, ?> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }
}
