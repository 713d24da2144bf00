package com.reporting.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request model for an aggregation run, synchronous or as a job.
 *
 * The effective rule set comes from {@code schemaId} when it resolves,
 * otherwise from the inline {@code rules}; with neither the run is an
 * identity pass.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AggregationRequest {

    private String businessId;

    @NotBlank(message = "aggregation_type is required")
    private String aggregationType;

    private JsonNode data;

    private List<AggregationRule> rules;
    private String schemaId;

    @Builder.Default
    private List<String> groupBy = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> filters = new LinkedHashMap<>();

    private TimeRange timeRange;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
