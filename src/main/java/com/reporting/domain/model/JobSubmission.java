package com.reporting.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class JobSubmission {

    String jobId;
    AggregationJob.JobStatus status;
    Instant createdAt;

    public static JobSubmission from(AggregationJob job) {
        return JobSubmission.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .createdAt(job.getCreatedAt())
                .build();
    }
}
