package com.delta.acquisition.acquire.vision;

import java.time.Duration;

/**
 * Per-call inputs that come from leased resources: the local parser endpoint and the paid API token.
 */
public record VisionCallContext(
    String parserEndpoint,
    String apiToken,
    Duration timeout
) {
    public static VisionCallContext defaults(Duration timeout) {
        return new VisionCallContext(null, null, timeout);
    }

    public boolean hasParserEndpoint() {
        return parserEndpoint != null && !parserEndpoint.isBlank();
    }

    public boolean hasApiToken() {
        return apiToken != null && !apiToken.isBlank();
    }
}
