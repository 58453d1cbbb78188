package com.delta.acquisition.acquire.model;

public record PoolHealthStats(
    ResourceKind kind,
    int capacity,
    int size,
    int available,
    int leased,
    int unhealthy,
    int retired,
    double meanHealth
) {
}
