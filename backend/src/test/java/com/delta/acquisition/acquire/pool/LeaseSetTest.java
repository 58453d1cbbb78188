package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.acquire.MutableClock;
import com.delta.acquisition.acquire.model.LeaseOutcome;
import com.delta.acquisition.acquire.model.ResourceKind;
import com.delta.acquisition.config.AcquisitionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LeaseSetTest {
    private AcquisitionProperties properties;
    private ResourcePoolManager manager;

    @BeforeEach
    void setUp() {
        properties = new AcquisitionProperties();
        properties.getPools().setLeaseWaitMs(0);
        properties.getPools().getParser().setCapacity(1);
        properties.getPools().getParser().setItems(List.of("http://localhost:11434"));
        manager = newManager();
    }

    @Test
    void disabledKindsAreSkipped() {
        try (LeaseSet leases = manager.leaseAll(EnumSet.of(ResourceKind.WORKER, ResourceKind.IDENTITY, ResourceKind.PROXY))) {
            assertThat(leases.kinds()).containsExactly(ResourceKind.IDENTITY, ResourceKind.WORKER);
            assertThat(leases.get(ResourceKind.PROXY)).isEmpty();
            assertThat(leases.valueOf(ResourceKind.WORKER)).startsWith("worker-");
        }
        assertEquals(0, manager.pool(ResourceKind.WORKER).leasedCount());
        assertEquals(0, manager.pool(ResourceKind.IDENTITY).leasedCount());
    }

    @Test
    void closeReleasesEachLeaseExactlyOnce() {
        LeaseSet leases = manager.leaseAll(EnumSet.of(ResourceKind.IDENTITY));
        int slot = leases.get(ResourceKind.IDENTITY).orElseThrow().slot();
        leases.mark(ResourceKind.IDENTITY, LeaseOutcome.UNHEALTHY);

        leases.close();
        leases.close();

        assertTrue(leases.isClosed());
        assertEquals(0, manager.pool(ResourceKind.IDENTITY).leasedCount());
        assertEquals(0.5, manager.pool(ResourceKind.IDENTITY).view(slot).health(), 1e-9);
    }

    @Test
    void unmarkedLeasesAreReleasedNeutral() {
        LeaseSet leases = manager.leaseAll(EnumSet.of(ResourceKind.IDENTITY));
        int slot = leases.get(ResourceKind.IDENTITY).orElseThrow().slot();
        assertEquals(LeaseOutcome.NEUTRAL, leases.outcomeOf(ResourceKind.IDENTITY));

        leases.close();

        assertEquals(1.0, manager.pool(ResourceKind.IDENTITY).view(slot).health(), 1e-9);
    }

    @Test
    void successKeepsExplicitUnhealthyMarks() {
        LeaseSet leases = manager.leaseAll(EnumSet.of(ResourceKind.IDENTITY, ResourceKind.SESSION));
        leases.markUnhealthy(List.of(ResourceKind.SESSION));

        leases.markSucceeded();

        assertEquals(LeaseOutcome.HEALTHY, leases.outcomeOf(ResourceKind.IDENTITY));
        assertEquals(LeaseOutcome.UNHEALTHY, leases.outcomeOf(ResourceKind.SESSION));

        leases.markAllNeutral();
        assertEquals(LeaseOutcome.NEUTRAL, leases.outcomeOf(ResourceKind.SESSION));
        leases.close();
    }

    @Test
    void failedLeaseAllKeepsNothingLeased() {
        ResourceLease parser = manager.lease(ResourceKind.PARSER);

        assertThatThrownBy(() -> manager.leaseAll(EnumSet.of(ResourceKind.WORKER, ResourceKind.IDENTITY, ResourceKind.PARSER)))
            .isInstanceOf(PoolExhaustedException.class)
            .extracting(e -> ((PoolExhaustedException) e).getKind())
            .isEqualTo(ResourceKind.PARSER);

        assertEquals(0, manager.pool(ResourceKind.WORKER).leasedCount());
        assertEquals(0, manager.pool(ResourceKind.IDENTITY).leasedCount());
        assertEquals(1, manager.pool(ResourceKind.PARSER).leasedCount());
        manager.release(parser, LeaseOutcome.NEUTRAL);
    }

    @Test
    void leaseAllWaitsForSlotFreedByAnotherHolder() throws Exception {
        properties.getPools().setLeaseWaitMs(2000);
        properties.getPools().setLeaseBackoffMs(10);
        ResourceLease parser = manager.lease(ResourceKind.PARSER);

        CompletableFuture<Void> releaser = CompletableFuture.runAsync(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            manager.release(parser, LeaseOutcome.NEUTRAL);
        });

        try (LeaseSet leases = manager.leaseAll(EnumSet.of(ResourceKind.PARSER))) {
            assertThat(leases.valueOf(ResourceKind.PARSER)).isEqualTo("http://localhost:11434");
        }
        releaser.get(5, TimeUnit.SECONDS);
    }

    private ResourcePoolManager newManager() {
        return new ResourcePoolManager(
            properties,
            new ConfiguredReplenishmentSource(properties),
            new MutableClock(Instant.parse("2026-03-02T10:00:00Z"))
        );
    }
}
