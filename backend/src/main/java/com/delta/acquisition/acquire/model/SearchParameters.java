package com.delta.acquisition.acquire.model;

import java.util.Locale;

public record SearchParameters(
    String query,
    String location,
    Integer maxResults
) {
    public static SearchParameters none() {
        return new SearchParameters(null, null, null);
    }

    public boolean matchesTitle(String title) {
        if (query == null || query.isBlank()) {
            return true;
        }
        if (title == null) {
            return false;
        }
        String lowerTitle = title.toLowerCase(Locale.ROOT);
        for (String token : query.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (!lowerTitle.contains(token)) {
                return false;
            }
        }
        return true;
    }

    public int resultLimit(int fallback) {
        return maxResults == null || maxResults <= 0 ? fallback : maxResults;
    }
}
