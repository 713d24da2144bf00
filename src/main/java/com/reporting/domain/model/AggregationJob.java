package com.reporting.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Tracks one asynchronous aggregation run.
 *
 * Lifecycle: PENDING -> PROCESSING -> COMPLETED | FAILED.
 * Only the worker executing the job mutates it, and always through the job
 * store's write lock; readers receive copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AggregationJob {

    private String id;
    private String businessId;
    private String aggregationType;

    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Builder.Default
    private int progress = 0;

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    private AggregationResult result;
    private String error;

    public enum JobStatus {
        PENDING("pending"),
        PROCESSING("processing"),
        COMPLETED("completed"),
        FAILED("failed");

        private final String value;

        JobStatus(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }

        public static Optional<JobStatus> fromValue(String value) {
            if (value == null) {
                return Optional.empty();
            }
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            return Arrays.stream(values())
                    .filter(status -> status.value.equals(normalized))
                    .findFirst();
        }
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Moves the job to PROCESSING. {@code startedAt} is recorded only once.
     */
    public void markStarted() {
        if (isTerminal()) {
            return;
        }
        this.status = JobStatus.PROCESSING;
        if (this.startedAt == null) {
            this.startedAt = Instant.now();
        }
    }

    /**
     * Progress never moves backwards and stays below 100 until completion.
     */
    public void markProgress(int value) {
        if (isTerminal()) {
            return;
        }
        int bounded = Math.max(0, Math.min(99, value));
        if (bounded > this.progress) {
            this.progress = bounded;
        }
    }

    public void markCompleted(AggregationResult result) {
        if (isTerminal()) {
            return;
        }
        this.status = JobStatus.COMPLETED;
        this.result = result;
        this.error = null;
        this.progress = 100;
        this.completedAt = Instant.now();
    }

    public void markFailed(String error) {
        if (isTerminal()) {
            return;
        }
        this.status = JobStatus.FAILED;
        this.error = error;
        this.result = null;
        this.completedAt = Instant.now();
    }

    @JsonIgnore
    public long getExecutionTimeMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }

    /**
     * Snapshot handed to readers. The result is shared since it is immutable.
     */
    public AggregationJob copy() {
        return toBuilder().build();
    }
}
