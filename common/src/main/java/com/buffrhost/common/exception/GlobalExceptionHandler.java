package com.buffrhost.common.exception;

import com.buffrhost.common.dto.BaseResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps the core's exception taxonomy onto HTTP status codes for every service.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<BaseResponse<Map<String, Object>>> handleValidation(ValidationException ex) {
        log.warn("Validation rejected: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<BaseResponse<Map<String, Object>>> handleResourceNotFoundException(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(ReservationConflictException.class)
    public ResponseEntity<BaseResponse<Map<String, Object>>> handleConflict(ReservationConflictException ex) {
        log.warn("Reservation conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<BaseResponse<Map<String, Object>>> handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Invalid transition: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<BaseResponse<Map<String, Object>>> handleInsufficientStock(InsufficientStockException ex) {
        log.warn("Insufficient stock: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<BaseResponse<Map<String, Object>>> handleBusinessException(BusinessException ex) {
        log.error("Business exception occurred: {}", ex.getMessage(), ex);
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(ServiceUnavailableException.class)
    public ResponseEntity<BaseResponse<?>> handleServiceUnavailable(ServiceUnavailableException ex) {
        log.warn("Service unavailable: {}", ex.getMessage());
        BaseResponse<?> response = BaseResponse.error(ex.getMessage(), "SERVICE_UNAVAILABLE");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    @ExceptionHandler(TransientDataAccessException.class)
    public ResponseEntity<BaseResponse<?>> handleTransientDataAccess(TransientDataAccessException ex) {
        log.warn("Transient data access failure: {}", ex.getMessage());
        BaseResponse<?> response = BaseResponse.error(
                "Temporarily unable to complete the operation. Retry the whole request.", "SERVICE_UNAVAILABLE");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<BaseResponse<Map<String, String>>> handleValidationException(
            MethodArgumentNotValidException ex) {
        log.warn("Validation exception: {}", ex.getMessage());
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });
        BaseResponse<Map<String, String>> response = BaseResponse.error(
                "Validation failed", ValidationException.ERROR_CODE, errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<BaseResponse<?>> handleMalformedRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        BaseResponse<?> response = BaseResponse.error("Malformed request: " + ex.getMessage(),
                ValidationException.ERROR_CODE);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<BaseResponse<?>> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);
        BaseResponse<?> response = BaseResponse.error(
                "An unexpected error occurred", "INTERNAL_ERROR");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private ResponseEntity<BaseResponse<Map<String, Object>>> respond(HttpStatus status, BusinessException ex) {
        Map<String, Object> details = ex.getDetails().isEmpty() ? null : ex.getDetails();
        return ResponseEntity.status(status).body(BaseResponse.error(ex.getMessage(), ex.getErrorCode(), details));
    }
}
