package com.delta.acquisition.acquire.model;

import java.util.UUID;

public record AcquisitionRequest(
    String requestId,
    String target,
    SearchParameters search,
    boolean costSensitive,
    boolean accuracyCritical
) {
    public AcquisitionRequest {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target is required");
        }
        target = target.trim();
        requestId = (requestId == null || requestId.isBlank()) ? UUID.randomUUID().toString() : requestId;
        search = search == null ? SearchParameters.none() : search;
    }

    public static AcquisitionRequest of(String target) {
        return new AcquisitionRequest(null, target, null, false, false);
    }
}
