package com.reporting.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RuleFailure {

    AggregationRule rule;
    String error;
}
