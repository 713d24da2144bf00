package com.reporting.domain.condition;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Compiled rule condition, evaluated against the pipeline's working data.
 */
@FunctionalInterface
public interface Condition {

    boolean test(JsonNode data);
}
