package com.reporting.domain.service;

import com.reporting.domain.exception.AggregationCancelledException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal checked by the pipeline between rules.
 *
 * A token trips when {@link #cancel(String)} is called, when its deadline
 * passes, or when the running thread is interrupted.
 */
public final class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final Instant deadline;

    private CancellationToken(Instant deadline) {
        this.deadline = deadline;
    }

    public static CancellationToken none() {
        return new CancellationToken(null);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        return new CancellationToken(Instant.now().plus(timeout));
    }

    public void cancel(String why) {
        reason.compareAndSet(null, why);
    }

    public boolean isCancelled() {
        return cancellationReason() != null;
    }

    public Optional<String> reason() {
        return Optional.ofNullable(cancellationReason());
    }

    public void throwIfCancelled() {
        String why = cancellationReason();
        if (why != null) {
            throw new AggregationCancelledException(why);
        }
    }

    private String cancellationReason() {
        String explicit = reason.get();
        if (explicit != null) {
            return explicit;
        }
        if (deadline != null && Instant.now().isAfter(deadline)) {
            return "deadline exceeded";
        }
        if (Thread.currentThread().isInterrupted()) {
            return "worker interrupted";
        }
        return null;
    }
}
