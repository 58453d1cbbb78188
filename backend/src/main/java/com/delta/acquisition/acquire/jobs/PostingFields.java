package com.delta.acquisition.acquire.jobs;

import com.delta.acquisition.acquire.model.NormalizedJobPosting;
import com.delta.acquisition.acquire.model.SearchParameters;
import com.fasterxml.jackson.databind.JsonNode;
import org.jsoup.Jsoup;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class PostingFields {
    public static final int DEFAULT_RESULT_LIMIT = 100;

    private PostingFields() {
    }

    public static String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            String text = value.asText().trim();
            return text.isEmpty() ? null : text;
        }
        return value.toString();
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    public static LocalDate parseIsoDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String candidate = value.trim();
        if (candidate.length() >= 10) {
            candidate = candidate.substring(0, 10);
        }
        try {
            return LocalDate.parse(candidate);
        } catch (Exception ignored) {
            return null;
        }
    }

    public static String htmlToText(String html) {
        if (html == null || html.isBlank()) {
            return null;
        }
        return Jsoup.parse(html).text();
    }

    public static List<String> pathSegments(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String part : rawPath.split("/")) {
            if (!part.isBlank()) {
                out.add(part);
            }
        }
        return out;
    }

    public static URI safeUri(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            String value = raw.trim();
            if (!value.startsWith("http://") && !value.startsWith("https://")) {
                value = "https://" + value;
            }
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * Applies the query, location and result limit of a search to postings fetched from a structured source.
     */
    public static List<NormalizedJobPosting> filter(List<NormalizedJobPosting> postings, SearchParameters search) {
        SearchParameters safeSearch = search == null ? SearchParameters.none() : search;
        String location = safeSearch.location() == null ? null : safeSearch.location().trim().toLowerCase(Locale.ROOT);
        int limit = safeSearch.resultLimit(DEFAULT_RESULT_LIMIT);
        List<NormalizedJobPosting> out = new ArrayList<>();
        for (NormalizedJobPosting posting : postings) {
            if (!safeSearch.matchesTitle(posting.title())) {
                continue;
            }
            if (location != null && !location.isEmpty()) {
                String postingLocation = posting.locationText();
                if (postingLocation == null || !postingLocation.toLowerCase(Locale.ROOT).contains(location)) {
                    continue;
                }
            }
            out.add(posting);
            if (out.size() >= limit) {
                break;
            }
        }
        return out;
    }
}
