package com.reporting.domain.service;

import com.reporting.domain.exception.AggregationCancelledException;
import com.reporting.domain.exception.NotFoundException;
import com.reporting.domain.exception.ValidationException;
import com.reporting.domain.model.AggregationJob;
import com.reporting.domain.model.AggregationRequest;
import com.reporting.domain.model.AggregationResult;
import com.reporting.domain.model.AggregationType;
import com.reporting.domain.model.JobFilter;
import com.reporting.domain.model.JobPage;
import com.reporting.domain.model.JobSubmission;
import com.reporting.infrastructure.store.AggregationJobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs aggregation pipelines as tracked background jobs.
 *
 * Processing Flow:
 * 1. Caller submits a request -> job stored as PENDING, id returned at once
 * 2. A worker from the bounded pool marks it PROCESSING and runs the pipeline
 * 3. Progress is reported after every rule
 * 4. Result stored, job marked COMPLETED (or FAILED with an error)
 *
 * Each job is written only by the worker running it. Cancellation is a signal
 * to that worker, which then fails the job itself.
 */
@Slf4j
@Service
public class AggregationJobProcessor {

    private final AggregationJobStore jobStore;
    private final AggregationService aggregationService;
    private final AggregationRequestValidator validator;
    private final Executor jobExecutor;
    private final MeterRegistry meterRegistry;

    static final String CANCELLED_BY_REQUEST = "cancelled by request";

    private final ConcurrentMap<String, CancellationToken> activeJobs = new ConcurrentHashMap<>();

    @Value("${app.jobs.retention-minutes:0}")
    private long retentionMinutes;

    public AggregationJobProcessor(AggregationJobStore jobStore,
                                   AggregationService aggregationService,
                                   AggregationRequestValidator validator,
                                   @Qualifier("aggregationJobExecutor") Executor jobExecutor,
                                   MeterRegistry meterRegistry) {
        this.jobStore = jobStore;
        this.aggregationService = aggregationService;
        this.validator = validator;
        this.jobExecutor = jobExecutor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Submit an aggregation job. Returns as soon as the job is queued.
     */
    public JobSubmission submitJob(AggregationRequest request) {
        AggregationType type = validator.validate(request);

        AggregationJob job = AggregationJob.builder()
                .id(jobStore.nextId())
                .businessId(request.getBusinessId())
                .aggregationType(type.getValue())
                .createdAt(Instant.now())
                .build();
        jobStore.save(job);

        // later changes to the caller's request must not leak into the run
        AggregationRequest snapshot = request.toBuilder()
                .data(request.getData().deepCopy())
                .rules(request.getRules() != null ? new ArrayList<>(request.getRules()) : null)
                .groupBy(request.getGroupBy() != null ? new ArrayList<>(request.getGroupBy()) : null)
                .build();

        CancellationToken token = CancellationToken.none();
        activeJobs.put(job.getId(), token);

        try {
            jobExecutor.execute(() -> processJob(job.getId(), snapshot, token));
        } catch (RejectedExecutionException e) {
            activeJobs.remove(job.getId());
            AggregationJob rejected = jobStore.update(job.getId(),
                    j -> j.markFailed("job rejected: worker pool is saturated"));
            countJob("rejected");
            log.warn("Aggregation job {} rejected: {}", job.getId(), e.getMessage());
            return JobSubmission.from(rejected);
        }

        countJob("submitted");
        log.info("Aggregation job submitted: {} (type: {}, business: {})",
                job.getId(), type.getValue(), job.getBusinessId());

        return JobSubmission.from(job);
    }

    /**
     * Worker body for a single job.
     */
    void processJob(String jobId, AggregationRequest request, CancellationToken token) {
        try {
            token.throwIfCancelled();

            jobStore.update(jobId, AggregationJob::markStarted);
            log.info("Processing aggregation job: {} (type: {})", jobId, request.getAggregationType());

            AggregationResult result = aggregationService.aggregate(request, token,
                    (processed, total) -> jobStore.update(jobId, j -> j.markProgress(processed * 100 / total)));

            // decided under the store lock, so a cancel that reported true always wins
            AggregationJob finished = jobStore.update(jobId, j -> token.reason().ifPresentOrElse(
                    why -> j.markFailed(new AggregationCancelledException(why).getMessage()),
                    () -> j.markCompleted(result)));

            if (finished.getStatus() == AggregationJob.JobStatus.FAILED) {
                log.info("Aggregation job {} cancelled after its last rule: {}", jobId, finished.getError());
                countJob("cancelled");
            } else {
                countJob("completed");
                log.info("Aggregation job completed: {} ({}, {} ms)",
                        jobId, result.getStatus().getValue(), finished.getExecutionTimeMs());
            }

        } catch (AggregationCancelledException e) {
            log.info("Aggregation job {} cancelled: {}", jobId, e.getMessage());
            jobStore.update(jobId, j -> j.markFailed(e.getMessage()));
            countJob("cancelled");

        } catch (Exception e) {
            log.error("Error processing aggregation job {}: {}", jobId, e.getMessage(), e);
            jobStore.update(jobId, j -> j.markFailed(e.getMessage()));
            countJob("failed");

        } finally {
            activeJobs.remove(jobId);
        }
    }

    public AggregationJob getJob(String jobId) {
        return jobStore.find(jobId)
                .orElseThrow(() -> new NotFoundException("job", jobId));
    }

    public JobPage listJobs(String businessId, String status, String aggregationType, Integer page, Integer limit) {
        AggregationJob.JobStatus statusFilter = null;
        if (status != null && !status.isBlank()) {
            statusFilter = AggregationJob.JobStatus.fromValue(status)
                    .orElseThrow(() -> new ValidationException("unsupported job status: " + status));
        }
        JobFilter filter = JobFilter.builder()
                .businessId(blankToNull(businessId))
                .status(statusFilter)
                .aggregationType(blankToNull(aggregationType))
                .build();
        return jobStore.list(filter, page, limit);
    }

    /**
     * Signals a pending or running job to stop. A job for which this returns
     * true ends FAILED, even when its last rule had already run.
     *
     * @return false when the job already finished
     */
    public boolean cancelJob(String jobId) {
        CancellationToken token = activeJobs.get(jobId);
        AtomicBoolean cancelled = new AtomicBoolean();

        // same lock as the worker's final transition
        jobStore.update(jobId, job -> {
            if (!job.isTerminal() && token != null) {
                token.cancel(CANCELLED_BY_REQUEST);
                cancelled.set(true);
            }
        });

        if (cancelled.get()) {
            log.info("Cancellation requested for aggregation job {}", jobId);
        }
        return cancelled.get();
    }

    /**
     * Evicts finished jobs older than the retention window. Disabled when
     * retention is 0.
     */
    @Scheduled(fixedDelayString = "${app.jobs.eviction-interval-ms:60000}")
    public void evictExpiredJobs() {
        if (retentionMinutes <= 0) {
            return;
        }
        try {
            jobStore.evictFinishedBefore(Instant.now().minus(Duration.ofMinutes(retentionMinutes)));
        } catch (Exception e) {
            log.error("Error evicting expired jobs: {}", e.getMessage(), e);
        }
    }

    int activeJobCount() {
        return activeJobs.size();
    }

    private void countJob(String status) {
        Counter.builder("aggregation.jobs")
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
