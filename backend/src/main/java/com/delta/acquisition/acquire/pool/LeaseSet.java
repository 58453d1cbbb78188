package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.acquire.model.LeaseOutcome;
import com.delta.acquisition.acquire.model.ResourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Leases held by one acquisition attempt. {@link #close()} releases each lease exactly once with the outcome
 * recorded for it; leases nobody marked are released {@code NEUTRAL}.
 */
public final class LeaseSet implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LeaseSet.class);

    private final ResourcePoolManager manager;
    private final Map<ResourceKind, ResourceLease> leases = new EnumMap<>(ResourceKind.class);
    private final Map<ResourceKind, LeaseOutcome> outcomes = new EnumMap<>(ResourceKind.class);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    LeaseSet(ResourcePoolManager manager) {
        this.manager = manager;
    }

    synchronized void add(ResourceLease lease) {
        leases.put(lease.kind(), lease);
        outcomes.put(lease.kind(), LeaseOutcome.NEUTRAL);
    }

    public synchronized Optional<ResourceLease> get(ResourceKind kind) {
        return Optional.ofNullable(leases.get(kind));
    }

    public synchronized String valueOf(ResourceKind kind) {
        ResourceLease lease = leases.get(kind);
        return lease == null ? null : lease.value();
    }

    public synchronized Set<ResourceKind> kinds() {
        return Collections.unmodifiableSet(new TreeSet<>(leases.keySet()));
    }

    public synchronized LeaseOutcome outcomeOf(ResourceKind kind) {
        return outcomes.get(kind);
    }

    public synchronized void mark(ResourceKind kind, LeaseOutcome outcome) {
        if (leases.containsKey(kind)) {
            outcomes.put(kind, outcome);
        }
    }

    public synchronized void markUnhealthy(Collection<ResourceKind> kinds) {
        for (ResourceKind kind : kinds) {
            mark(kind, LeaseOutcome.UNHEALTHY);
        }
    }

    /**
     * Marks every lease healthy except those already flagged unhealthy.
     */
    public synchronized void markSucceeded() {
        for (ResourceKind kind : leases.keySet()) {
            if (outcomes.get(kind) != LeaseOutcome.UNHEALTHY) {
                outcomes.put(kind, LeaseOutcome.HEALTHY);
            }
        }
    }

    public synchronized void markAllNeutral() {
        outcomes.replaceAll((kind, outcome) -> LeaseOutcome.NEUTRAL);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Map<ResourceKind, ResourceLease> toRelease;
        Map<ResourceKind, LeaseOutcome> releaseOutcomes;
        synchronized (this) {
            toRelease = new EnumMap<>(leases);
            releaseOutcomes = new EnumMap<>(outcomes);
        }
        for (Map.Entry<ResourceKind, ResourceLease> entry : toRelease.entrySet()) {
            LeaseOutcome outcome = releaseOutcomes.getOrDefault(entry.getKey(), LeaseOutcome.NEUTRAL);
            try {
                manager.release(entry.getValue(), outcome);
            } catch (RuntimeException e) {
                log.warn("Failed to release {} lease on slot {}", entry.getKey(), entry.getValue().slot(), e);
            }
        }
    }
}
