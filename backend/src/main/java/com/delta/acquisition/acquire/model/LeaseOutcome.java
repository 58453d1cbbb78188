package com.delta.acquisition.acquire.model;

/**
 * How a lease is handed back. {@code NEUTRAL} leaves the health score untouched and is used for
 * cancellations and failures that are not the resource's fault.
 */
public enum LeaseOutcome {
    HEALTHY,
    UNHEALTHY,
    NEUTRAL
}
