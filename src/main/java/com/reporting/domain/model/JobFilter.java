package com.reporting.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Optional criteria for listing jobs. A null criterion matches everything.
 */
@Value
@Builder
public class JobFilter {

    String businessId;
    AggregationJob.JobStatus status;
    String aggregationType;

    public boolean matches(AggregationJob job) {
        if (businessId != null && !businessId.equals(job.getBusinessId())) {
            return false;
        }
        if (status != null && status != job.getStatus()) {
            return false;
        }
        return aggregationType == null || aggregationType.equalsIgnoreCase(job.getAggregationType());
    }

    public static JobFilter none() {
        return JobFilter.builder().build();
    }
}
