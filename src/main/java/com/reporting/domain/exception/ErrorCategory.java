package com.reporting.domain.exception;

/**
 * Stable error categories surfaced to callers as {@code error_code}.
 */
public enum ErrorCategory {
    VALIDATION_ERROR,
    NOT_FOUND,
    RULE_EXECUTION_ERROR,
    CANCELLED,
    INTERNAL_ERROR
}
