package com.delta.acquisition.acquire.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record AcquisitionOutcome(
    OutcomeKind kind,
    List<NormalizedJobPosting> jobs,
    StrategyDecision strategy,
    Map<String, Double> costByProvider,
    Duration elapsed,
    int attempts,
    String errorCode,
    String errorMessage,
    List<String> failures
) {
    public AcquisitionOutcome {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
        costByProvider = costByProvider == null ? Map.of() : Map.copyOf(costByProvider);
        failures = failures == null ? List.of() : List.copyOf(failures);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
        attempts = Math.max(0, attempts);
    }

    public static AcquisitionOutcome success(
        List<NormalizedJobPosting> jobs,
        StrategyDecision strategy,
        Map<String, Double> costByProvider,
        List<String> failures
    ) {
        return new AcquisitionOutcome(OutcomeKind.SUCCESS, jobs, strategy, costByProvider, null, 1, null, null, failures);
    }

    public static AcquisitionOutcome failure(OutcomeKind kind, StrategyDecision strategy, String errorCode, String errorMessage) {
        if (kind == OutcomeKind.SUCCESS) {
            throw new IllegalArgumentException("failure outcome cannot be SUCCESS");
        }
        return new AcquisitionOutcome(kind, List.of(), strategy, Map.of(), null, 1, errorCode, errorMessage, List.of());
    }

    public boolean isSuccess() {
        return kind == OutcomeKind.SUCCESS;
    }

    public double totalCost() {
        return costByProvider.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public AcquisitionOutcome withElapsed(Duration value) {
        return new AcquisitionOutcome(kind, jobs, strategy, costByProvider, value, attempts, errorCode, errorMessage, failures);
    }

    public AcquisitionOutcome withAttempts(int value) {
        return new AcquisitionOutcome(kind, jobs, strategy, costByProvider, elapsed, value, errorCode, errorMessage, failures);
    }

    public AcquisitionOutcome withStrategy(StrategyDecision value) {
        return new AcquisitionOutcome(kind, jobs, value, costByProvider, elapsed, attempts, errorCode, errorMessage, failures);
    }

    /**
     * Adds spend incurred by earlier attempts so the ledger sees every paid call.
     */
    public AcquisitionOutcome plusCosts(Map<String, Double> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Map<String, Double> merged = new LinkedHashMap<>(costByProvider);
        extra.forEach((provider, cost) -> merged.merge(provider, cost, Double::sum));
        return new AcquisitionOutcome(kind, jobs, strategy, merged, elapsed, attempts, errorCode, errorMessage, failures);
    }

    public AcquisitionOutcome plusFailures(List<String> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(extra);
        merged.addAll(failures);
        return new AcquisitionOutcome(kind, jobs, strategy, costByProvider, elapsed, attempts, errorCode, errorMessage, merged);
    }
}
