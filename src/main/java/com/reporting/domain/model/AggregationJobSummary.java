package com.reporting.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Listing view of a job, without the result payload.
 */
@Value
@Builder
public class AggregationJobSummary {

    String id;
    String businessId;
    String aggregationType;
    AggregationJob.JobStatus status;
    int progress;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;
    AggregationStatus resultStatus;
    String error;

    public static AggregationJobSummary from(AggregationJob job) {
        return AggregationJobSummary.builder()
                .id(job.getId())
                .businessId(job.getBusinessId())
                .aggregationType(job.getAggregationType())
                .status(job.getStatus())
                .progress(job.getProgress())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .resultStatus(job.getResult() != null ? job.getResult().getStatus() : null)
                .error(job.getError())
                .build();
    }
}
