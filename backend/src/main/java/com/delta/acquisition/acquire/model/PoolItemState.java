package com.delta.acquisition.acquire.model;

public enum PoolItemState {
    AVAILABLE,
    LEASED,
    UNHEALTHY,
    RETIRED
}
