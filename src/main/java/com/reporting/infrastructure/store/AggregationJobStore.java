package com.reporting.infrastructure.store;

import com.reporting.domain.exception.NotFoundException;
import com.reporting.domain.model.AggregationJob;
import com.reporting.domain.model.AggregationJobSummary;
import com.reporting.domain.model.JobFilter;
import com.reporting.domain.model.JobPage;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * In-memory job records keyed by id, in creation order.
 *
 * Guarded by a read/write lock: status queries take the read lock and get a
 * copy, mutations go through {@link #update} under the write lock.
 */
@Slf4j
public class AggregationJobStore {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final Map<String, AggregationJob> jobs = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Ids are unique within the process and sort by creation time.
     */
    public String nextId() {
        return String.format("job_%d_%06d", System.currentTimeMillis(), sequence.incrementAndGet());
    }

    public AggregationJob save(AggregationJob job) {
        lock.writeLock().lock();
        try {
            AggregationJob stored = job.copy();
            jobs.put(stored.getId(), stored);
            return stored.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<AggregationJob> find(String id) {
        lock.readLock().lock();
        try {
            AggregationJob job = jobs.get(id);
            return job == null ? Optional.empty() : Optional.of(job.copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies {@code mutation} to the stored job under the write lock and
     * returns a snapshot of the updated record.
     */
    public AggregationJob update(String id, Consumer<AggregationJob> mutation) {
        lock.writeLock().lock();
        try {
            AggregationJob job = jobs.get(id);
            if (job == null) {
                throw new NotFoundException("job", id);
            }
            mutation.accept(job);
            return job.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Filters first, then paginates over the filtered set.
     */
    public JobPage list(JobFilter filter, Integer page, Integer limit) {
        int effectiveLimit = clampLimit(limit);
        int effectivePage = page == null || page < 1 ? 1 : page;

        List<AggregationJob> matching;
        lock.readLock().lock();
        try {
            matching = jobs.values().stream()
                    .filter(filter::matches)
                    .map(AggregationJob::copy)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }

        int total = matching.size();
        long offset = (long) (effectivePage - 1) * effectiveLimit;
        List<AggregationJobSummary> items = offset >= total
                ? new ArrayList<>()
                : matching.subList((int) offset, (int) Math.min(total, offset + effectiveLimit)).stream()
                        .map(AggregationJobSummary::from)
                        .collect(Collectors.toList());

        int totalPages = (int) Math.ceil((double) total / effectiveLimit);

        return JobPage.builder()
                .jobs(items)
                .pagination(JobPage.Pagination.builder()
                        .page(effectivePage)
                        .limit(effectiveLimit)
                        .total(total)
                        .totalPages(totalPages)
                        .build())
                .build();
    }

    /**
     * Removes terminal jobs that completed before {@code cutoff}.
     *
     * @return number of evicted jobs
     */
    public int evictFinishedBefore(Instant cutoff) {
        lock.writeLock().lock();
        try {
            int evicted = 0;
            Iterator<AggregationJob> iterator = jobs.values().iterator();
            while (iterator.hasNext()) {
                AggregationJob job = iterator.next();
                if (job.isTerminal() && job.getCompletedAt() != null && job.getCompletedAt().isBefore(cutoff)) {
                    iterator.remove();
                    evicted++;
                }
            }
            if (evicted > 0) {
                log.info("Evicted {} finished aggregation jobs", evicted);
            }
            return evicted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return jobs.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    static int clampLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
