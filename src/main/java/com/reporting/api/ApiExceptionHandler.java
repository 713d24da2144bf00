package com.reporting.api;

import com.reporting.domain.exception.AggregationCancelledException;
import com.reporting.domain.exception.ErrorCategory;
import com.reporting.domain.exception.NotFoundException;
import com.reporting.domain.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders every failure as:
 * {
 *   "error_code": "VALIDATION_ERROR",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(ValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return errorResponse(ex.getCategory(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : error.getField())
                .collect(Collectors.joining("; "));
        log.warn("Validation error: {}", message);
        return errorResponse(ErrorCategory.VALIDATION_ERROR, message);
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse(ErrorCategory.VALIDATION_ERROR, "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NotFoundException ex) {
        return errorResponse(ex.getCategory(), ex.getMessage());
    }

    @ExceptionHandler(AggregationCancelledException.class)
    @ResponseStatus(HttpStatus.REQUEST_TIMEOUT)
    public Map<String, Object> handleCancelled(AggregationCancelledException ex) {
        log.warn("Aggregation cancelled: {}", ex.getMessage());
        return errorResponse(ex.getCategory(), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse(ErrorCategory.INTERNAL_ERROR, "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(ErrorCategory category, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", category.name());
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
