package com.delta.acquisition.acquire.scraper;

/**
 * Navigation failed before any response arrived (DNS, TLS, timeout, connection reset).
 */
public class BrowserNavigationException extends RuntimeException {
    private final String reasonCode;

    public BrowserNavigationException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
