package com.delta.acquisition.acquire.vision;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vision analysis could not produce a result: malformed input, an unparseable model response, or every
 * requested provider failed. Paid calls that completed before the failure are reported in
 * {@link #getIncurredCosts()}.
 */
public class AnalysisException extends RuntimeException {
    private final List<String> failures;
    private final Map<String, Double> incurredCosts;

    public AnalysisException(String message) {
        this(message, List.of(), Map.of(), null);
    }

    public AnalysisException(String message, Throwable cause) {
        this(message, List.of(), Map.of(), cause);
    }

    public AnalysisException(String message, List<String> failures, Throwable cause) {
        this(message, failures, Map.of(), cause);
    }

    public AnalysisException(String message, List<String> failures, Map<String, Double> incurredCosts, Throwable cause) {
        super(message, cause);
        this.failures = failures == null ? List.of() : List.copyOf(failures);
        this.incurredCosts = incurredCosts == null ? Map.of() : Map.copyOf(incurredCosts);
    }

    public List<String> getFailures() {
        return failures;
    }

    public Map<String, Double> getIncurredCosts() {
        return incurredCosts;
    }

    public AnalysisException withIncurredCost(String providerId, double cost) {
        if (cost <= 0.0) {
            return this;
        }
        Map<String, Double> merged = new LinkedHashMap<>(incurredCosts);
        merged.merge(providerId, cost, Double::sum);
        return new AnalysisException(getMessage(), failures, merged, getCause());
    }
}
