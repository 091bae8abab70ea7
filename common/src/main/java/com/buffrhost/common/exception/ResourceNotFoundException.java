package com.buffrhost.common.exception;

import java.util.Map;

/**
 * Thrown when a referenced entity does not exist, or exists but belongs to another property.
 * Both cases look the same to the caller so that scope violations are not leaked.
 */
public class ResourceNotFoundException extends BusinessException {
    public static final String ERROR_CODE = "RESOURCE_NOT_FOUND";

    public ResourceNotFoundException(String message) {
        super(message, ERROR_CODE);
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s with identifier %s not found", resourceType, identifier), ERROR_CODE,
                Map.of("type", resourceType, "id", String.valueOf(identifier)));
    }
}
