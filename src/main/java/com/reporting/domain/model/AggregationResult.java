package com.reporting.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one pipeline run. Never mutated after construction, so it is
 * handed to concurrent readers by reference.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AggregationResult {

    String aggregationId;
    AggregationStatus status;

    JsonNode originalData;
    JsonNode aggregatedData;

    List<AggregationRule> appliedRules;
    List<AggregationRule> skippedRules;
    List<RuleFailure> failedRules;

    AggregationSummary summary;

    Instant aggregatedAt;

    @JsonProperty("processing_time")
    long processingTimeMs;

    @JsonProperty("is_successful")
    public boolean isSuccessful() {
        return status == AggregationStatus.SUCCESS;
    }
}
