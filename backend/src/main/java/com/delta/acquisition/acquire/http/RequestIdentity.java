package com.delta.acquisition.acquire.http;

/**
 * Per-request network identity taken from leased pool items. Any field may be null.
 */
public record RequestIdentity(
    String userAgent,
    String proxy,
    String bearerToken
) {
    public static RequestIdentity anonymous() {
        return new RequestIdentity(null, null, null);
    }

    public boolean hasProxy() {
        return proxy != null && !proxy.isBlank();
    }

    public boolean hasBearerToken() {
        return bearerToken != null && !bearerToken.isBlank();
    }
}
