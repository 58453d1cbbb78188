package com.delta.acquisition.acquire.service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when an acquisition step observes interruption or an explicit cancel. Carries the spend of paid calls
 * that finished before the cancel landed.
 */
public class AcquisitionCancelledException extends RuntimeException {
    private final Map<String, Double> incurredCosts;

    public AcquisitionCancelledException(String message) {
        this(message, null, Map.of());
    }

    public AcquisitionCancelledException(String message, Throwable cause) {
        this(message, cause, Map.of());
    }

    public AcquisitionCancelledException(String message, Throwable cause, Map<String, Double> incurredCosts) {
        super(message, cause);
        this.incurredCosts = incurredCosts == null ? Map.of() : Map.copyOf(incurredCosts);
    }

    public Map<String, Double> getIncurredCosts() {
        return incurredCosts;
    }

    public AcquisitionCancelledException plusIncurredCosts(Map<String, Double> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Map<String, Double> merged = new LinkedHashMap<>(incurredCosts);
        extra.forEach((provider, cost) -> merged.merge(provider, cost, Double::sum));
        return new AcquisitionCancelledException(getMessage(), getCause(), merged);
    }
}
