package com.delta.acquisition.acquire.scraper;

public enum ScrapeState {
    NAVIGATE,
    STABILIZE,
    CAPTURE,
    ANALYZE,
    INTERACT_AND_RECAPTURE,
    EXTRACTED,
    ABORTED
}
