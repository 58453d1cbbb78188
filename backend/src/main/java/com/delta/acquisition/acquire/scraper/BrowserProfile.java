package com.delta.acquisition.acquire.scraper;

/**
 * What a browser session is opened with: the leased identity, proxy and session plus viewport settings.
 */
public record BrowserProfile(
    String userAgent,
    String proxy,
    String sessionId,
    int viewportWidth,
    int viewportHeight,
    boolean headless
) {
    public boolean hasProxy() {
        return proxy != null && !proxy.isBlank();
    }

    public boolean hasSession() {
        return sessionId != null && !sessionId.isBlank();
    }
}
