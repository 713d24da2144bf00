package com.reporting.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A single aggregation step.
 *
 * {@code operation} is kept as the wire string; an unknown name fails only
 * this rule when the pipeline runs.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AggregationRule {

    String field;
    String operation;

    @Singular(ignoreNullCollections = true)
    Map<String, Object> parameters;

    /** Optional boolean expression evaluated against the current data. */
    String condition;

    @Builder.Default
    boolean enabled = true;

    int order;
    String description;

    public boolean hasCondition() {
        return condition != null && !condition.isBlank();
    }
}
