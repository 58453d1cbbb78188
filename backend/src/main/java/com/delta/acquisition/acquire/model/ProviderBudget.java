package com.delta.acquisition.acquire.model;

public record ProviderBudget(
    String provider,
    double spent,
    Double dailyCap
) {
    public boolean isExceeded() {
        return dailyCap != null && spent >= dailyCap;
    }

    public boolean wouldExceed(double estimatedCost) {
        return dailyCap != null && spent + Math.max(0.0, estimatedCost) > dailyCap;
    }
}
