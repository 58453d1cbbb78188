package com.delta.acquisition.acquire.model;

public enum OutcomeKind {
    SUCCESS,
    POOL_EXHAUSTED,
    ANALYSIS_ERROR,
    BLOCKED,
    BUDGET_EXCEEDED,
    CANCELLED,
    TARGET_ERROR;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
