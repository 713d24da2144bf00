package com.reporting.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Named, versioned rule set held by the schema registry.
 *
 * Instances are immutable, so a pipeline that resolved a schema keeps working
 * on the same rules even if the registry entry is replaced mid-run.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AggregationSchema {

    String id;
    String name;
    String description;
    String type;
    String version;

    @Singular(ignoreNullCollections = true)
    List<AggregationRule> rules;

    Instant createdAt;
    Instant updatedAt;
}
