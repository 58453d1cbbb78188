package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.acquire.model.LeaseOutcome;
import com.delta.acquisition.acquire.model.PoolHealthStats;
import com.delta.acquisition.acquire.model.ResourceKind;
import com.delta.acquisition.acquire.service.AcquisitionCancelledException;
import com.delta.acquisition.config.AcquisitionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class ResourcePoolManager {
    private static final Logger log = LoggerFactory.getLogger(ResourcePoolManager.class);

    private final AcquisitionProperties properties;
    private final Map<ResourceKind, ResourcePool> pools = new EnumMap<>(ResourceKind.class);

    public ResourcePoolManager(
        AcquisitionProperties properties,
        ReplenishmentSource replenishmentSource,
        Clock clock
    ) {
        this.properties = properties;
        PoolTuning tuning = PoolTuning.from(properties.getPools());
        for (ResourceKind kind : ResourceKind.values()) {
            AcquisitionProperties.Pool config = properties.getPools().forKind(kind);
            List<String> items = replenishmentSource.initialItems(kind);
            ResourcePool pool = new ResourcePool(
                kind,
                config.getCapacity(),
                items,
                Duration.ofMinutes(config.getTtlMinutes()),
                tuning,
                clock
            );
            pools.put(kind, pool);
            if (pool.isEnabled()) {
                log.info("{} pool ready: {} items, capacity {}", kind, pool.size(), pool.capacity());
            } else {
                log.info("{} pool disabled", kind);
            }
        }
    }

    public ResourceLease lease(ResourceKind kind) {
        return pool(kind).tryLease();
    }

    public boolean release(ResourceLease lease, LeaseOutcome outcome) {
        if (lease == null) {
            return false;
        }
        return pool(lease.kind()).release(lease, outcome);
    }

    public boolean isEnabled(ResourceKind kind) {
        return pool(kind).isEnabled();
    }

    public ResourcePool pool(ResourceKind kind) {
        return pools.get(kind);
    }

    public Collection<ResourcePool> pools() {
        return pools.values();
    }

    public List<PoolHealthStats> health() {
        List<PoolHealthStats> out = new ArrayList<>();
        for (ResourcePool pool : pools.values()) {
            out.add(pool.stats());
        }
        return out;
    }

    /**
     * Leases every enabled kind in {@code kinds}, worker slot first, waiting up to the configured lease wait
     * for each. Disabled kinds are skipped. On failure nothing stays leased.
     */
    public LeaseSet leaseAll(Set<ResourceKind> kinds) {
        LeaseSet leases = new LeaseSet(this);
        List<ResourceKind> order = new ArrayList<>();
        if (kinds.contains(ResourceKind.WORKER)) {
            order.add(ResourceKind.WORKER);
        }
        for (ResourceKind kind : ResourceKind.values()) {
            if (kind != ResourceKind.WORKER && kinds.contains(kind)) {
                order.add(kind);
            }
        }
        try {
            for (ResourceKind kind : order) {
                if (!isEnabled(kind)) {
                    continue;
                }
                leases.add(leaseWithWait(kind));
            }
            return leases;
        } catch (RuntimeException e) {
            leases.markAllNeutral();
            leases.close();
            throw e;
        }
    }

    private ResourceLease leaseWithWait(ResourceKind kind) {
        long deadline = System.nanoTime() + Duration.ofMillis(properties.getPools().getLeaseWaitMs()).toNanos();
        long backoffMs = properties.getPools().getLeaseBackoffMs();
        while (true) {
            try {
                return lease(kind);
            } catch (PoolExhaustedException e) {
                long remainingMs = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
                if (remainingMs <= 0) {
                    throw e;
                }
                try {
                    Thread.sleep(Math.min(backoffMs, remainingMs));
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new AcquisitionCancelledException("interrupted while waiting for " + kind, interrupted);
                }
                backoffMs = Math.min(backoffMs * 2, Math.max(1, remainingMs));
            }
        }
    }
}
