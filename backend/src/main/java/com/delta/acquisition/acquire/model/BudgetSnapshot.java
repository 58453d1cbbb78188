package com.delta.acquisition.acquire.model;

import java.time.LocalDate;
import java.util.Map;

public record BudgetSnapshot(
    LocalDate windowStart,
    String remoteVisionProvider,
    Map<String, ProviderBudget> providers
) {
    public BudgetSnapshot {
        providers = providers == null ? Map.of() : Map.copyOf(providers);
    }

    public static BudgetSnapshot unlimited(String remoteVisionProvider) {
        return new BudgetSnapshot(null, remoteVisionProvider, Map.of());
    }

    public boolean isExceeded(String provider) {
        ProviderBudget budget = providers.get(provider);
        return budget != null && budget.isExceeded();
    }

    public boolean remoteVisionExceeded() {
        return remoteVisionProvider != null && isExceeded(remoteVisionProvider);
    }
}
