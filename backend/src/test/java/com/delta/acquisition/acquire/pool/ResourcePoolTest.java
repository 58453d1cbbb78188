package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.acquire.MutableClock;
import com.delta.acquisition.acquire.model.LeaseOutcome;
import com.delta.acquisition.acquire.model.PoolHealthStats;
import com.delta.acquisition.acquire.model.PoolItemState;
import com.delta.acquisition.acquire.model.ResourceKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResourcePoolTest {
    private static final PoolTuning TUNING = new PoolTuning(0.5, 0.2, 0.1);

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));

    @Test
    void leastRecentlyUsedWinsAmongEquallyHealthyItems() {
        ResourcePool pool = pool(ResourceKind.IDENTITY, 3, List.of("ua-a", "ua-b", "ua-c"));

        assertEquals("ua-a", leaseAndRelease(pool, LeaseOutcome.HEALTHY));
        assertEquals("ua-b", leaseAndRelease(pool, LeaseOutcome.HEALTHY));
        assertEquals("ua-c", leaseAndRelease(pool, LeaseOutcome.HEALTHY));
        assertEquals("ua-a", leaseAndRelease(pool, LeaseOutcome.HEALTHY));
    }

    @Test
    void healthierItemIsPreferredOverLessRecentlyUsedOne() {
        ResourcePool pool = pool(ResourceKind.PROXY, 2, List.of("http://p1:8080", "http://p2:8080"));

        ResourceLease first = pool.tryLease();
        assertEquals("http://p1:8080", first.value());
        pool.release(first, LeaseOutcome.UNHEALTHY);

        assertEquals("http://p2:8080", leaseAndRelease(pool, LeaseOutcome.NEUTRAL));
        // p1 is now least recently used but carries health 0.5
        assertEquals("http://p2:8080", leaseAndRelease(pool, LeaseOutcome.NEUTRAL));
        assertEquals(0.5, pool.view(0).health(), 1e-9);
    }

    @Test
    void repeatedUnhealthyReleasesDropItemBelowFloor() {
        ResourcePool pool = pool(ResourceKind.PROXY, 1, List.of("http://p1:8080"));

        leaseAndRelease(pool, LeaseOutcome.UNHEALTHY);
        leaseAndRelease(pool, LeaseOutcome.UNHEALTHY);
        assertEquals(PoolItemState.AVAILABLE, pool.view(0).state());
        assertEquals(0.25, pool.view(0).health(), 1e-9);

        leaseAndRelease(pool, LeaseOutcome.UNHEALTHY);

        PoolItemView view = pool.view(0);
        assertEquals(PoolItemState.UNHEALTHY, view.state());
        assertEquals(0.125, view.health(), 1e-9);
        assertThat(pool.unhealthyItems()).extracting(PoolItemView::slot).containsExactly(0);
        assertThatThrownBy(pool::tryLease).isInstanceOf(PoolExhaustedException.class);
    }

    @Test
    void healthyReleaseRecoversButNeverExceedsOne() {
        ResourcePool pool = pool(ResourceKind.IDENTITY, 1, List.of("ua-a"));

        leaseAndRelease(pool, LeaseOutcome.UNHEALTHY);
        leaseAndRelease(pool, LeaseOutcome.HEALTHY);
        assertEquals(0.6, pool.view(0).health(), 1e-9);

        for (int i = 0; i < 10; i++) {
            leaseAndRelease(pool, LeaseOutcome.HEALTHY);
        }
        assertEquals(1.0, pool.view(0).health(), 1e-9);
    }

    @Test
    void capacityBoundsConcurrentLeasesEvenWithSpareItems() {
        ResourcePool pool = pool(ResourceKind.WORKER, 1, List.of("worker-1", "worker-2"));

        ResourceLease lease = pool.tryLease();
        assertThatThrownBy(pool::tryLease)
            .isInstanceOf(PoolExhaustedException.class)
            .extracting(e -> ((PoolExhaustedException) e).getKind())
            .isEqualTo(ResourceKind.WORKER);

        assertTrue(pool.release(lease, LeaseOutcome.NEUTRAL));
        assertEquals(0, pool.leasedCount());
    }

    @Test
    void zeroCapacityPoolIsDisabled() {
        ResourcePool pool = pool(ResourceKind.PROXY, 0, List.of("http://p1:8080"));

        assertFalse(pool.isEnabled());
        assertThatThrownBy(pool::tryLease).isInstanceOf(PoolExhaustedException.class);
    }

    @Test
    void secondReleaseOfSameLeaseIsIgnored() {
        ResourcePool pool = pool(ResourceKind.IDENTITY, 2, List.of("ua-a", "ua-b"));

        ResourceLease lease = pool.tryLease();
        assertTrue(pool.release(lease, LeaseOutcome.UNHEALTHY));
        assertFalse(pool.release(lease, LeaseOutcome.UNHEALTHY));

        assertEquals(0, pool.leasedCount());
        assertEquals(0.5, pool.view(0).health(), 1e-9);
    }

    @Test
    void releaseOfLeaseFromPreviousHolderDoesNotFreeCurrentHolder() {
        ResourcePool pool = pool(ResourceKind.IDENTITY, 1, List.of("ua-a"));

        ResourceLease stale = pool.tryLease();
        pool.release(stale, LeaseOutcome.NEUTRAL);
        ResourceLease current = pool.tryLease();

        assertEquals(stale.slot(), current.slot());
        assertFalse(pool.release(stale, LeaseOutcome.NEUTRAL));
        assertEquals(PoolItemState.LEASED, pool.view(0).state());
        assertEquals(1, pool.leasedCount());
    }

    @Test
    void expiredSessionIsMarkedUnhealthyAtSelection() {
        ResourcePool pool = new ResourcePool(
            ResourceKind.SESSION, 2, List.of("session-1"), Duration.ofMinutes(10), TUNING, clock
        );

        clock.advance(Duration.ofMinutes(11));

        assertThatThrownBy(pool::tryLease).isInstanceOf(PoolExhaustedException.class);
        assertEquals(PoolItemState.UNHEALTHY, pool.view(0).state());
    }

    @Test
    void restoringExpiredItemRenewsItsExpiry() {
        ResourcePool pool = new ResourcePool(
            ResourceKind.TOKEN, 1, List.of("sk-test"), Duration.ofMinutes(10), TUNING, clock
        );
        clock.advance(Duration.ofMinutes(11));
        assertThatThrownBy(pool::tryLease).isInstanceOf(PoolExhaustedException.class);

        pool.restore(0, 0.5);

        ResourceLease lease = pool.tryLease();
        assertEquals("sk-test", lease.value());
        assertThat(pool.view(0).expiresAt()).isAfter(clock.instant());
        assertEquals(0.5, pool.view(0).health(), 1e-9);
    }

    @Test
    void nonExpiringKindsIgnoreTtl() {
        ResourcePool pool = new ResourcePool(
            ResourceKind.IDENTITY, 1, List.of("ua-a"), Duration.ofMinutes(1), TUNING, clock
        );
        clock.advance(Duration.ofDays(3));

        assertEquals("ua-a", pool.tryLease().value());
        assertThat(pool.view(0).expiresAt()).isNull();
    }

    @Test
    void retiredSlotIsRefilledInPlace() {
        ResourcePool pool = pool(ResourceKind.PROXY, 2, List.of("http://p1:8080", "http://p2:8080"));
        forceUnhealthy(pool, 0);

        pool.retire(0);
        assertEquals(PoolItemState.RETIRED, pool.view(0).state());
        pool.replace(0, "http://p3:8080");

        PoolItemView view = pool.view(0);
        assertEquals("http://p3:8080", view.value());
        assertEquals(PoolItemState.AVAILABLE, view.state());
        assertEquals(1.0, view.health(), 1e-9);
        assertEquals(2, pool.size());
    }

    @Test
    void leasedItemIsNeverRetired() {
        ResourcePool pool = pool(ResourceKind.PROXY, 1, List.of("http://p1:8080"));
        ResourceLease lease = pool.tryLease();

        pool.retire(lease.slot());

        assertEquals(PoolItemState.LEASED, pool.view(lease.slot()).state());
    }

    @Test
    void statsCountEachState() {
        ResourcePool pool = pool(ResourceKind.IDENTITY, 3, List.of("ua-a", "ua-b", "ua-c"));
        ResourceLease held = pool.tryLease();
        forceUnhealthy(pool, 1);

        PoolHealthStats stats = pool.stats();

        assertEquals(ResourceKind.IDENTITY, stats.kind());
        assertEquals(3, stats.size());
        assertEquals(1, stats.leased());
        assertEquals(1, stats.unhealthy());
        assertEquals(1, stats.available());
        assertEquals(0, stats.retired());
        assertThat(held.slot()).isEqualTo(0);
    }

    private ResourcePool pool(ResourceKind kind, int capacity, List<String> values) {
        return new ResourcePool(kind, capacity, values, Duration.ofMinutes(60), TUNING, clock);
    }

    private static String leaseAndRelease(ResourcePool pool, LeaseOutcome outcome) {
        ResourceLease lease = pool.tryLease();
        pool.release(lease, outcome);
        return lease.value();
    }

    /**
     * Holds other items until the slot comes up, then decays it. Repeats until it drops below the floor.
     */
    private static void forceUnhealthy(ResourcePool pool, int slot) {
        while (pool.view(slot).state() != PoolItemState.UNHEALTHY) {
            List<ResourceLease> held = new ArrayList<>();
            ResourceLease target = null;
            while (target == null) {
                ResourceLease lease = pool.tryLease();
                if (lease.slot() == slot) {
                    target = lease;
                } else {
                    held.add(lease);
                }
            }
            pool.release(target, LeaseOutcome.UNHEALTHY);
            for (ResourceLease lease : held) {
                pool.release(lease, LeaseOutcome.NEUTRAL);
            }
        }
    }
}
