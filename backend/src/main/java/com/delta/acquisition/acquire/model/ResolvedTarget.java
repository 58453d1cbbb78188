package com.delta.acquisition.acquire.model;

public record ResolvedTarget(
    String siteId,
    String url,
    String host,
    String directType,
    String directBoard,
    String feedUrl
) {
    public SourceAvailability availability() {
        return new SourceAvailability(
            directType != null && !directType.isBlank(),
            feedUrl != null && !feedUrl.isBlank()
        );
    }
}
