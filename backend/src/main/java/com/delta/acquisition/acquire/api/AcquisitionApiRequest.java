package com.delta.acquisition.acquire.api;

public record AcquisitionApiRequest(
    String requestId,
    String target,
    String query,
    String location,
    Integer maxResults,
    Boolean costSensitive,
    Boolean accuracyCritical
) {
}
