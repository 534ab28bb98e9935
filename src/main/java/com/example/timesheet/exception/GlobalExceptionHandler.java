package com.example.timesheet.exception;

import com.example.timesheet.common.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(RuleViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleRuleViolation(RuleViolationException ex) {
        List<Map<String, String>> details = ex.getViolations().stream()
                .map(v -> Map.of("code", v.code(), "message", v.message()))
                .toList();

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("errorCode", ex.getErrorCode());
        meta.put("violations", details);
        meta.put("timestamp", Instant.now(clock).toString());

        HttpStatus status = statusOf(ex.getPrimaryViolation().category());
        logger.warn("Business rule violated ({}): {}", status.value(), ex.getMessage());
        return ResponseEntity.status(status).body(ApiResponse.failure(ex.getMessage(), meta));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(ResourceNotFoundException ex) {
        logger.warn("Resource not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.failure(ex.getMessage(), Map.of("errorCode", ex.getErrorCode())));
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException ex) {
        logger.warn("Business error {}: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.failure(ex.getMessage(), Map.of("errorCode", ex.getErrorCode())));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, Object> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> errors.put(fieldOf(error), error.getDefaultMessage()));

        logger.warn("Request validation failed: {}", errors);
        return ResponseEntity.badRequest().body(ApiResponse.failure("Invalid request", errors));
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception ex) {
        logger.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.failure(ex.getMessage()));
    }

    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<ApiResponse<Void>> handleConcurrencyFailure(ConcurrencyFailureException ex) {
        logger.warn("Concurrent modification detected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.failure("The record was modified concurrently, reload and retry"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(IllegalArgumentException ex) {
        logger.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.failure(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        logger.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.failure("An unexpected error occurred"));
    }

    private static String fieldOf(ObjectError error) {
        if (error instanceof FieldError) {
            return ((FieldError) error).getField();
        }
        return error.getObjectName();
    }

    static HttpStatus statusOf(RuleViolation.Category category) {
        return switch (category) {
            case MALFORMED_INPUT -> HttpStatus.BAD_REQUEST;
            case CONFLICT, STATE -> HttpStatus.CONFLICT;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
        };
    }
}
