package com.delta.acquisition.acquire.strategy;

import com.delta.acquisition.acquire.model.OutcomeKind;

/**
 * Scores how hard a host is to scrape, 0 (trivial) to 1 (hostile).
 */
public interface SiteDifficultyEstimator {
    double estimate(String host);

    default void observe(String host, OutcomeKind outcome) {
    }
}
