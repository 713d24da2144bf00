package com.reporting.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of operations a rule can apply.
 *
 * Rules carry the operation as its wire name; {@link #resolve(String)} maps it
 * to a constant, or to nothing when the name is unknown.
 */
public enum AggregationOperation {
    COUNT("count"),
    SUM("sum"),
    AVERAGE("average", "avg", "mean"),
    MIN("min"),
    MAX("max"),
    MEDIAN("median"),
    PERCENTILE("percentile"),
    GROUP_BY("group_by"),
    PIVOT("pivot"),
    CUSTOM("custom");

    private final String wireName;
    private final String[] aliases;

    AggregationOperation(String wireName, String... aliases) {
        this.wireName = wireName;
        this.aliases = aliases;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Statistical operations reduce a list of values to a single value and can
     * be nested inside group_by and pivot.
     */
    public boolean isStatistical() {
        return switch (this) {
            case COUNT, SUM, AVERAGE, MIN, MAX, MEDIAN, PERCENTILE -> true;
            case GROUP_BY, PIVOT, CUSTOM -> false;
        };
    }

    public static Optional<AggregationOperation> resolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(op -> op.wireName.equals(normalized) || Arrays.asList(op.aliases).contains(normalized))
                .findFirst();
    }
}
