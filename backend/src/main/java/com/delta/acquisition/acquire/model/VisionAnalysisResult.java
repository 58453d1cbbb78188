package com.delta.acquisition.acquire.model;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public record VisionAnalysisResult(
    List<JobListingCandidate> candidates,
    double confidence,
    VisionMode mode,
    Duration elapsed,
    ActionableElement actionableElement,
    Map<String, Double> costByProvider,
    List<String> failures
) {
    public VisionAnalysisResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        costByProvider = costByProvider == null ? Map.of() : Map.copyOf(costByProvider);
        failures = failures == null ? List.of() : List.copyOf(failures);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public double totalCost() {
        return costByProvider.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public VisionAnalysisResult withElapsed(Duration value) {
        return new VisionAnalysisResult(candidates, confidence, mode, value, actionableElement, costByProvider, failures);
    }

    public VisionAnalysisResult withFailures(List<String> value) {
        return new VisionAnalysisResult(candidates, confidence, mode, elapsed, actionableElement, costByProvider, value);
    }

    public VisionAnalysisResult withCosts(Map<String, Double> value) {
        return new VisionAnalysisResult(candidates, confidence, mode, elapsed, actionableElement, value, failures);
    }
}
