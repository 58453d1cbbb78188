package com.delta.acquisition.acquire.scraper;

/**
 * Main-document response of a navigation. Status is 0 when the browser got no response object.
 */
public record NavigationResult(int status, String finalUrl) {
    public boolean isSuccessful() {
        return status == 0 || (status >= 200 && status < 300);
    }
}
