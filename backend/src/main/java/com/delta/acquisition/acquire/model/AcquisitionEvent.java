package com.delta.acquisition.acquire.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record AcquisitionEvent(
    String requestId,
    String target,
    String host,
    String strategy,
    OutcomeKind outcomeKind,
    double cost,
    Duration duration,
    int attempts,
    int jobCount,
    String errorCode,
    String errorMessage,
    List<String> failures,
    Instant occurredAt
) {
    public AcquisitionEvent {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
