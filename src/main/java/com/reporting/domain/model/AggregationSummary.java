package com.reporting.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AggregationSummary {

    int totalRules;
    int appliedCount;
    int skippedCount;
    int failedCount;

    /** applied / total, 0 when there are no rules. */
    double successRate;

    int dataCount;
}
