package com.delta.acquisition.acquire.service;

import com.delta.acquisition.acquire.model.AcquisitionOutcome;
import com.delta.acquisition.acquire.model.OutcomeKind;
import com.delta.acquisition.acquire.util.ReasonCodeClassifier;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for an acquisition running in the background.
 */
public final class AcquisitionTask {
    private final String requestId;
    private final CompletableFuture<AcquisitionOutcome> result = new CompletableFuture<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Future<?> runner;

    AcquisitionTask(String requestId) {
        this.requestId = requestId;
    }

    void attach(Future<?> runner) {
        this.runner = runner;
    }

    boolean markStarted() {
        return started.compareAndSet(false, true);
    }

    void complete(AcquisitionOutcome outcome) {
        result.complete(outcome);
    }

    void fail(Throwable error) {
        result.completeExceptionally(error);
    }

    public String requestId() {
        return requestId;
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * Interrupts the running acquisition. A task that never started completes as cancelled right away; a running
     * one completes once it has released its leases.
     */
    public void cancel() {
        Future<?> current = runner;
        if (current != null) {
            current.cancel(true);
        }
        if (started.compareAndSet(false, true)) {
            result.complete(AcquisitionOutcome.failure(
                OutcomeKind.CANCELLED,
                null,
                ReasonCodeClassifier.CANCELLED,
                "cancelled before start"
            ));
        }
    }

    public AcquisitionOutcome await(Duration timeout) throws TimeoutException, InterruptedException {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(cause);
        }
    }
}
