package com.delta.acquisition.acquire.vision;

import com.delta.acquisition.acquire.model.ActionableElement;
import com.delta.acquisition.acquire.model.JobListingCandidate;

import java.util.List;

/**
 * What a single vision provider returned for one snapshot, with the dollar cost of the call.
 */
public record ProviderResult(
    String providerId,
    List<JobListingCandidate> candidates,
    double confidence,
    ActionableElement actionableElement,
    double cost
) {
    public ProviderResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}
