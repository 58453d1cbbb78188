package com.delta.acquisition.acquire.service;

import com.delta.acquisition.acquire.model.StrategyDecision;

class BudgetExceededException extends RuntimeException {
    private final StrategyDecision decision;

    BudgetExceededException(StrategyDecision decision, String message) {
        super(message);
        this.decision = decision;
    }

    StrategyDecision getDecision() {
        return decision;
    }
}
