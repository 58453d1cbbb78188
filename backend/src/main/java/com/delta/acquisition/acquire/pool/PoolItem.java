package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.acquire.model.PoolItemState;
import com.delta.acquisition.acquire.model.ResourceKind;

import java.time.Instant;

/**
 * Mutable slot state. Only touched while holding the owning {@link ResourcePool}'s monitor.
 */
final class PoolItem {
    private final int slot;
    private String value;
    private PoolItemState state = PoolItemState.AVAILABLE;
    private double health = 1.0;
    private Instant expiresAt;
    private Instant lastUsedAt;
    private long lastUsedSequence;
    private int probeFailures;
    private String leaseToken;

    PoolItem(int slot, String value, Instant expiresAt) {
        this.slot = slot;
        this.value = value;
        this.expiresAt = expiresAt;
    }

    int slot() {
        return slot;
    }

    String value() {
        return value;
    }

    PoolItemState state() {
        return state;
    }

    void state(PoolItemState state) {
        this.state = state;
    }

    double health() {
        return health;
    }

    void health(double health) {
        this.health = Math.max(0.0, Math.min(1.0, health));
    }

    Instant expiresAt() {
        return expiresAt;
    }

    long lastUsedSequence() {
        return lastUsedSequence;
    }

    void markUsed(Instant at, long sequence) {
        this.lastUsedAt = at;
        this.lastUsedSequence = sequence;
    }

    int probeFailures() {
        return probeFailures;
    }

    int incrementProbeFailures() {
        return ++probeFailures;
    }

    void resetProbeFailures() {
        this.probeFailures = 0;
    }

    String leaseToken() {
        return leaseToken;
    }

    void leaseToken(String leaseToken) {
        this.leaseToken = leaseToken;
    }

    boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    void replace(String newValue, Instant newExpiry) {
        this.value = newValue;
        this.expiresAt = newExpiry;
        this.state = PoolItemState.AVAILABLE;
        this.health = 1.0;
        this.probeFailures = 0;
        this.leaseToken = null;
    }

    PoolItemView view(ResourceKind kind) {
        return new PoolItemView(kind, slot, value, state, health, expiresAt, lastUsedAt, probeFailures);
    }
}
