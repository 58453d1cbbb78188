package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.acquire.model.ResourceKind;

public class PoolExhaustedException extends RuntimeException {
    private final ResourceKind kind;

    public PoolExhaustedException(ResourceKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ResourceKind getKind() {
        return kind;
    }
}
