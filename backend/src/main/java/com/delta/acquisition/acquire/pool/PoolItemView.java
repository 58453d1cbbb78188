package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.acquire.model.PoolItemState;
import com.delta.acquisition.acquire.model.ResourceKind;

import java.time.Instant;

public record PoolItemView(
    ResourceKind kind,
    int slot,
    String value,
    PoolItemState state,
    double health,
    Instant expiresAt,
    Instant lastUsedAt,
    int probeFailures
) {
    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
