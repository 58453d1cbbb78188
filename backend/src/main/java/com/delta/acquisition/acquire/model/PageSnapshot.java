package com.delta.acquisition.acquire.model;

import java.time.Instant;

public record PageSnapshot(
    String url,
    byte[] screenshotPng,
    String html,
    Instant capturedAt
) {
    public boolean hasScreenshot() {
        return screenshotPng != null && screenshotPng.length > 0;
    }

    public boolean hasDom() {
        return html != null && !html.isBlank();
    }

    public boolean isUsable() {
        return hasScreenshot() || hasDom();
    }
}
