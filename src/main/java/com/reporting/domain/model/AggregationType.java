package com.reporting.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Aggregation domains accepted by the engine.
 */
public enum AggregationType {
    BUSINESS_METRICS("business_metrics"),
    RISK_ASSESSMENT("risk_assessment"),
    PERFORMANCE_METRICS("performance_metrics"),
    COMPLIANCE("compliance"),
    FINANCIAL("financial"),
    CUSTOM("custom");

    private final String value;

    AggregationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<AggregationType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.value.equals(normalized))
                .findFirst();
    }
}
