package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.acquire.model.LeaseOutcome;
import com.delta.acquisition.acquire.model.PoolHealthStats;
import com.delta.acquisition.acquire.model.PoolItemState;
import com.delta.acquisition.acquire.model.ResourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Fixed arena of items for one resource kind. Slot indexes never move; retired slots are refilled in place.
 * All methods synchronize on the pool so selection and state transitions are atomic.
 */
public class ResourcePool {
    private static final Logger log = LoggerFactory.getLogger(ResourcePool.class);

    private final ResourceKind kind;
    private final int capacity;
    private final PoolItem[] slots;
    private final Duration ttl;
    private final PoolTuning tuning;
    private final Clock clock;
    private long useSequence;
    private int leasedCount;

    public ResourcePool(
        ResourceKind kind,
        int capacity,
        List<String> values,
        Duration ttl,
        PoolTuning tuning,
        Clock clock
    ) {
        this.kind = kind;
        this.capacity = Math.max(0, capacity);
        this.ttl = kind.expires() ? ttl : null;
        this.tuning = tuning;
        this.clock = clock;
        List<String> safeValues = values == null ? List.of() : values;
        this.slots = new PoolItem[safeValues.size()];
        Instant now = clock.instant();
        for (int i = 0; i < safeValues.size(); i++) {
            slots[i] = new PoolItem(i, safeValues.get(i), expiryFrom(now));
        }
    }

    public ResourceKind kind() {
        return kind;
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        return slots.length;
    }

    public boolean isEnabled() {
        return capacity > 0 && slots.length > 0;
    }

    /**
     * Leases the available item with the highest health, least recently used first on ties.
     * Never blocks.
     */
    public synchronized ResourceLease tryLease() {
        if (!isEnabled()) {
            throw new PoolExhaustedException(kind, kind + " pool is disabled");
        }
        if (leasedCount >= capacity) {
            throw new PoolExhaustedException(kind, kind + " pool at capacity " + capacity);
        }
        Instant now = clock.instant();
        PoolItem best = null;
        for (PoolItem item : slots) {
            if (item.state() != PoolItemState.AVAILABLE) {
                continue;
            }
            if (item.isExpired(now)) {
                item.state(PoolItemState.UNHEALTHY);
                log.debug("{} slot {} expired, marked unhealthy", kind, item.slot());
                continue;
            }
            if (best == null
                || item.health() > best.health()
                || (item.health() == best.health() && item.lastUsedSequence() < best.lastUsedSequence())) {
                best = item;
            }
        }
        if (best == null) {
            throw new PoolExhaustedException(kind, "no available " + kind + " items");
        }
        String token = UUID.randomUUID().toString();
        best.state(PoolItemState.LEASED);
        best.leaseToken(token);
        best.markUsed(now, ++useSequence);
        leasedCount++;
        return new ResourceLease(kind, best.slot(), token, best.value());
    }

    /**
     * Returns false when the lease token no longer matches its slot, i.e. the lease was already released.
     */
    public synchronized boolean release(ResourceLease lease, LeaseOutcome outcome) {
        if (lease == null || lease.kind() != kind || lease.slot() < 0 || lease.slot() >= slots.length) {
            return false;
        }
        PoolItem item = slots[lease.slot()];
        if (item.state() != PoolItemState.LEASED || !lease.token().equals(item.leaseToken())) {
            log.warn("Ignoring stale release of {} slot {}", kind, lease.slot());
            return false;
        }
        item.leaseToken(null);
        leasedCount--;
        LeaseOutcome safeOutcome = outcome == null ? LeaseOutcome.NEUTRAL : outcome;
        switch (safeOutcome) {
            case HEALTHY -> item.health(item.health() + tuning.recoveryStep());
            case UNHEALTHY -> item.health(item.health() * tuning.decayFactor());
            case NEUTRAL -> {
            }
        }
        if (item.health() < tuning.healthFloor()) {
            item.state(PoolItemState.UNHEALTHY);
            log.info("{} slot {} marked unhealthy at health {}", kind, item.slot(), item.health());
        } else {
            item.state(PoolItemState.AVAILABLE);
        }
        return true;
    }

    public synchronized List<PoolItemView> unhealthyItems() {
        List<PoolItemView> out = new ArrayList<>();
        for (PoolItem item : slots) {
            if (item.state() == PoolItemState.UNHEALTHY) {
                out.add(item.view(kind));
            }
        }
        return out;
    }

    public synchronized PoolItemView view(int slot) {
        return slots[slot].view(kind);
    }

    public synchronized void restore(int slot, double health) {
        PoolItem item = slots[slot];
        if (item.state() != PoolItemState.UNHEALTHY) {
            return;
        }
        item.health(health);
        item.resetProbeFailures();
        if (item.isExpired(clock.instant())) {
            item.replace(item.value(), expiryFrom(clock.instant()));
            item.health(health);
        }
        item.state(PoolItemState.AVAILABLE);
    }

    /**
     * Records a failed probe and returns the consecutive failure count.
     */
    public synchronized int recordProbeFailure(int slot) {
        return slots[slot].incrementProbeFailures();
    }

    public synchronized void retire(int slot) {
        PoolItem item = slots[slot];
        if (item.state() == PoolItemState.LEASED) {
            return;
        }
        item.state(PoolItemState.RETIRED);
    }

    public synchronized void replace(int slot, String value) {
        PoolItem item = slots[slot];
        if (item.state() != PoolItemState.RETIRED) {
            return;
        }
        item.replace(value, expiryFrom(clock.instant()));
    }

    public synchronized PoolHealthStats stats() {
        int available = 0;
        int leased = 0;
        int unhealthy = 0;
        int retired = 0;
        double healthSum = 0.0;
        for (PoolItem item : slots) {
            switch (item.state()) {
                case AVAILABLE -> available++;
                case LEASED -> leased++;
                case UNHEALTHY -> unhealthy++;
                case RETIRED -> retired++;
            }
            healthSum += item.health();
        }
        double meanHealth = slots.length == 0 ? 0.0 : healthSum / slots.length;
        return new PoolHealthStats(kind, capacity, slots.length, available, leased, unhealthy, retired, meanHealth);
    }

    public synchronized int leasedCount() {
        return leasedCount;
    }

    private Instant expiryFrom(Instant now) {
        return ttl == null ? null : now.plus(ttl);
    }
}
