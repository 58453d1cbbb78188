package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.acquire.MutableClock;
import com.delta.acquisition.acquire.model.LeaseOutcome;
import com.delta.acquisition.acquire.model.PoolItemState;
import com.delta.acquisition.acquire.model.ResourceKind;
import com.delta.acquisition.config.AcquisitionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class PoolReconcilerTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
    private AcquisitionProperties properties;
    private ReplenishmentSource replenishment;

    @BeforeEach
    void setUp() {
        properties = new AcquisitionProperties();
        properties.getPools().setReconcileEnabled(false);
        properties.getPools().setMaxProbeFailures(2);
        properties.getPools().setRestoreHealth(0.5);
        properties.getPools().getProxy().setCapacity(2);
        properties.getPools().getProxy().setItems(List.of("http://p1:8080", "http://p2:8080"));
        properties.getPools().getProxy().setReserve(List.of("http://p3:8080"));
    }

    @Test
    void passingProbeRestoresItemAtRestoreHealth() {
        ResourcePoolManager manager = newManager();
        ResourcePool proxies = manager.pool(ResourceKind.PROXY);
        decayUntilUnhealthy(proxies, 0);

        reconciler(manager, (item, timeout) -> true).reconcileOnce();

        PoolItemView view = proxies.view(0);
        assertEquals(PoolItemState.AVAILABLE, view.state());
        assertEquals(0.5, view.health(), 1e-9);
        assertEquals(0, view.probeFailures());
        assertThat(proxies.unhealthyItems()).isEmpty();
    }

    @Test
    void repeatedProbeFailuresRetireAndReplenishFromReserve() {
        ResourcePoolManager manager = newManager();
        ResourcePool proxies = manager.pool(ResourceKind.PROXY);
        decayUntilUnhealthy(proxies, 0);
        AtomicInteger probes = new AtomicInteger();
        PoolReconciler reconciler = reconciler(manager, (item, timeout) -> {
            probes.incrementAndGet();
            return false;
        });

        reconciler.reconcileOnce();
        assertEquals(PoolItemState.UNHEALTHY, proxies.view(0).state());
        assertEquals(1, proxies.view(0).probeFailures());

        reconciler.reconcileOnce();

        PoolItemView view = proxies.view(0);
        assertEquals(2, probes.get());
        assertEquals("http://p3:8080", view.value());
        assertEquals(PoolItemState.AVAILABLE, view.state());
        assertEquals(1.0, view.health(), 1e-9);
        assertEquals("http://p2:8080", proxies.view(1).value());
    }

    @Test
    void retiredSlotWithoutReplacementStaysRetired() {
        properties.getPools().getProxy().setReserve(List.of());
        properties.getPools().setMaxProbeFailures(1);
        ResourcePoolManager manager = newManager();
        ResourcePool proxies = manager.pool(ResourceKind.PROXY);
        decayUntilUnhealthy(proxies, 1);

        reconciler(manager, (item, timeout) -> false).reconcileOnce();

        assertEquals(PoolItemState.RETIRED, proxies.view(1).state());
        assertEquals(1, proxies.stats().retired());
    }

    @Test
    void retirementIsReportedToListenersWithTheOldValue() {
        properties.getPools().setMaxProbeFailures(1);
        ResourcePoolManager manager = newManager();
        decayUntilUnhealthy(manager.pool(ResourceKind.PROXY), 0);
        List<String> retired = new ArrayList<>();
        PoolRetirementListener failing = (kind, value) -> {
            throw new IllegalStateException("listener broke");
        };
        PoolRetirementListener recording = (kind, value) -> retired.add(kind + " " + value);

        new PoolReconciler(manager, (item, timeout) -> false, replenishment, properties, List.of(failing, recording))
            .reconcileOnce();

        assertThat(retired).containsExactly("PROXY http://p1:8080");
        assertEquals("http://p3:8080", manager.pool(ResourceKind.PROXY).view(0).value());
    }

    @Test
    void throwingProbeCountsAsFailure() {
        ResourcePoolManager manager = newManager();
        ResourcePool proxies = manager.pool(ResourceKind.PROXY);
        decayUntilUnhealthy(proxies, 0);

        reconciler(manager, (item, timeout) -> {
            throw new IllegalStateException("probe broke");
        }).reconcileOnce();

        assertEquals(1, proxies.view(0).probeFailures());
        assertEquals(PoolItemState.UNHEALTHY, proxies.view(0).state());
    }

    @Test
    void expiredSessionIsRetiredAndRenamedByDefaultProbe() {
        properties.getPools().setMaxProbeFailures(1);
        properties.getPools().getSession().setCapacity(1);
        properties.getPools().getSession().setTtlMinutes(5);
        ResourcePoolManager manager = newManager();
        ResourcePool sessions = manager.pool(ResourceKind.SESSION);
        String original = sessions.view(0).value();
        clock.advance(Duration.ofMinutes(6));
        assertThat(sessions.stats().available()).isEqualTo(1);
        assertThatThrownBy(sessions::tryLease).isInstanceOf(PoolExhaustedException.class);

        reconciler(manager, new DefaultResourceProbe(clock)).reconcileOnce();

        PoolItemView view = sessions.view(0);
        assertEquals(PoolItemState.AVAILABLE, view.state());
        assertThat(view.value()).startsWith("session-").isNotEqualTo(original);
        assertThat(view.expiresAt()).isAfter(clock.instant());
    }

    private ResourcePoolManager newManager() {
        replenishment = new ConfiguredReplenishmentSource(properties);
        return new ResourcePoolManager(properties, replenishment, clock);
    }

    private PoolReconciler reconciler(ResourcePoolManager manager, ResourceProbe probe) {
        return new PoolReconciler(manager, probe, replenishment, properties);
    }

    private static void decayUntilUnhealthy(ResourcePool pool, int slot) {
        while (pool.view(slot).state() != PoolItemState.UNHEALTHY) {
            List<ResourceLease> others = new ArrayList<>();
            ResourceLease target = null;
            while (target == null) {
                ResourceLease lease = pool.tryLease();
                if (lease.slot() == slot) {
                    target = lease;
                } else {
                    others.add(lease);
                }
            }
            pool.release(target, LeaseOutcome.UNHEALTHY);
            for (ResourceLease other : others) {
                pool.release(other, LeaseOutcome.NEUTRAL);
            }
        }
    }
}
