package com.reporting.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AggregationStatus {
    SUCCESS("success"),
    PARTIAL("partial"),
    FAILED("failed");

    private final String value;

    AggregationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Derives the overall status of a pipeline run from its rule counts.
     */
    public static AggregationStatus derive(int appliedCount, int failedCount) {
        if (failedCount > 0 && appliedCount == 0) {
            return FAILED;
        }
        if (failedCount > 0) {
            return PARTIAL;
        }
        return SUCCESS;
    }
}
