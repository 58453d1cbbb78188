package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.acquire.model.ResourceKind;

/**
 * Exclusive handle on one pool slot. The token goes stale once the lease is released.
 */
public record ResourceLease(
    ResourceKind kind,
    int slot,
    String token,
    String value
) {
}
