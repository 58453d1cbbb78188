package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.config.AcquisitionProperties;
import com.delta.acquisition.acquire.model.ResourceKind;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically probes unhealthy items. A passing probe restores the item; repeated failures retire it and
 * refill the same slot from the {@link ReplenishmentSource}.
 */
@Component
public class PoolReconciler {
    private static final Logger log = LoggerFactory.getLogger(PoolReconciler.class);

    private final ResourcePoolManager poolManager;
    private final ResourceProbe probe;
    private final ReplenishmentSource replenishmentSource;
    private final AcquisitionProperties properties;
    private final List<PoolRetirementListener> retirementListeners;
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;

    public PoolReconciler(
        ResourcePoolManager poolManager,
        ResourceProbe probe,
        ReplenishmentSource replenishmentSource,
        AcquisitionProperties properties
    ) {
        this(poolManager, probe, replenishmentSource, properties, List.of());
    }

    @Autowired
    public PoolReconciler(
        ResourcePoolManager poolManager,
        ResourceProbe probe,
        ReplenishmentSource replenishmentSource,
        AcquisitionProperties properties,
        List<PoolRetirementListener> retirementListeners
    ) {
        this.poolManager = poolManager;
        this.probe = probe;
        this.replenishmentSource = replenishmentSource;
        this.properties = properties;
        this.retirementListeners = retirementListeners == null ? List.of() : List.copyOf(retirementListeners);
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getPools().isReconcileEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                return;
            }
            int interval = properties.getPools().getReconcileIntervalSeconds();
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("pool-reconciler");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleWithFixedDelay(this::safeReconcile, interval, interval, TimeUnit.SECONDS);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (scheduler == null) {
                return;
            }
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
    }

    private void safeReconcile() {
        try {
            reconcileOnce();
        } catch (RuntimeException e) {
            log.warn("Pool reconciliation pass failed", e);
        }
    }

    /**
     * One pass over every pool. Probes run outside the pool monitor.
     */
    public void reconcileOnce() {
        Duration timeout = Duration.ofMillis(properties.getPools().getProbeTimeoutMs());
        int maxFailures = properties.getPools().getMaxProbeFailures();
        double restoreHealth = properties.getPools().getRestoreHealth();
        for (ResourcePool pool : poolManager.pools()) {
            for (PoolItemView item : pool.unhealthyItems()) {
                boolean healthy;
                try {
                    healthy = probe.probe(item, timeout);
                } catch (RuntimeException e) {
                    log.warn("Probe threw for {} slot {}", item.kind(), item.slot(), e);
                    healthy = false;
                }
                if (healthy) {
                    pool.restore(item.slot(), restoreHealth);
                    log.info("{} slot {} restored", item.kind(), item.slot());
                    continue;
                }
                int failures = pool.recordProbeFailure(item.slot());
                if (failures < maxFailures) {
                    continue;
                }
                pool.retire(item.slot());
                notifyRetired(item.kind(), item.value());
                Optional<String> replacement = replenishmentSource.replacement(item.kind(), item.value());
                if (replacement.isPresent()) {
                    pool.replace(item.slot(), replacement.get());
                    log.info("{} slot {} retired after {} failed probes and replenished", item.kind(), item.slot(), failures);
                } else {
                    log.warn("{} slot {} retired after {} failed probes, no replacement available", item.kind(), item.slot(), failures);
                }
            }
        }
    }

    private void notifyRetired(ResourceKind kind, String value) {
        for (PoolRetirementListener listener : retirementListeners) {
            try {
                listener.retired(kind, value);
            } catch (RuntimeException e) {
                log.warn("Retirement listener failed for {} item", kind, e);
            }
        }
    }
}
