package com.delta.acquisition.acquire.model;

/**
 * Spend ceiling used by the time-of-day policy. Ordinal order is cheapest first.
 */
public enum CostTier {
    DIRECT_API,
    FEED,
    LOCAL_VISION,
    REMOTE_VISION;

    public boolean allows(CostTier requested) {
        return requested.ordinal() <= ordinal();
    }
}
