package com.delta.acquisition.acquire.model;

/**
 * Acquisition methods ordered cheapest to most expensive.
 */
public enum StrategyTier {
    DIRECT_API,
    FEED_SUBSCRIBE,
    VISUAL_SCRAPE
}
