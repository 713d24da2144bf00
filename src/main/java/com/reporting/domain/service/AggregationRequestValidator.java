package com.reporting.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.reporting.domain.exception.ValidationException;
import com.reporting.domain.model.AggregationRequest;
import com.reporting.domain.model.AggregationType;
import com.reporting.domain.model.TimeRange;
import org.springframework.stereotype.Component;

/**
 * Rejects malformed requests before any rule runs.
 */
@Component
public class AggregationRequestValidator {

    public AggregationType validate(AggregationRequest request) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        String rawType = request.getAggregationType();
        if (rawType == null || rawType.isBlank()) {
            throw new ValidationException("aggregation_type is required");
        }
        AggregationType type = AggregationType.fromValue(rawType)
                .orElseThrow(() -> new ValidationException("unsupported aggregation_type: " + rawType));

        JsonNode data = request.getData();
        if (data == null || data.isNull() || data.isMissingNode()) {
            throw new ValidationException("data is required");
        }

        TimeRange range = request.getTimeRange();
        if (range != null && range.getStart() != null && range.getEnd() != null
                && range.getStart().isAfter(range.getEnd())) {
            throw new ValidationException("time_range start must not be after end");
        }
        return type;
    }
}
