package com.delta.acquisition.acquire.cost;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-provider spend for the current daily window. Not thread-safe; {@link CostController} serializes access.
 */
final class BudgetLedger {
    private LocalDate windowStart;
    private final Map<String, Double> spent = new LinkedHashMap<>();

    BudgetLedger(LocalDate windowStart) {
        this.windowStart = windowStart;
    }

    /**
     * @return true when the window rolled over and spend was reset
     */
    boolean rollTo(LocalDate today) {
        if (today.equals(windowStart)) {
            return false;
        }
        windowStart = today;
        spent.clear();
        return true;
    }

    void add(String provider, double amount) {
        if (provider == null || amount <= 0.0 || Double.isNaN(amount)) {
            return;
        }
        spent.merge(provider, amount, Double::sum);
    }

    double spent(String provider) {
        return spent.getOrDefault(provider, 0.0);
    }

    Map<String, Double> spentByProvider() {
        return new LinkedHashMap<>(spent);
    }

    LocalDate windowStart() {
        return windowStart;
    }
}
