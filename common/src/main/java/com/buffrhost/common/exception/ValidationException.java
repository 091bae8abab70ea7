package com.buffrhost.common.exception;

import java.util.Map;

/**
 * Malformed or rule-breaking input: empty interval, non-positive quantity, edits to a frozen order.
 */
public class ValidationException extends BusinessException {
    public static final String ERROR_CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(message, ERROR_CODE);
    }

    public ValidationException(String message, Map<String, ?> details) {
        super(message, ERROR_CODE, details);
    }

    public ValidationException(String message, String errorCode, Map<String, ?> details) {
        super(message, errorCode, details);
    }
}
