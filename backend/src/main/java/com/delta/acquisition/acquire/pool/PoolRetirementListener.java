package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.acquire.model.ResourceKind;

/**
 * Told when the reconciler retires an item, so components holding per-item state can drop it.
 */
public interface PoolRetirementListener {
    void retired(ResourceKind kind, String value);
}
