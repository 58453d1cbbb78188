package com.delta.acquisition.acquire.source;

import com.delta.acquisition.acquire.http.RequestIdentity;
import com.delta.acquisition.acquire.model.NormalizedJobPosting;
import com.delta.acquisition.acquire.model.SearchParameters;

import java.util.List;
import java.util.Optional;

/**
 * A site's own job API.
 */
public interface DirectSource {
    String type();

    /**
     * Board or account identifier when {@code url} points at this source, empty otherwise.
     */
    Optional<String> detectBoard(String url);

    default boolean requiresToken() {
        return false;
    }

    List<NormalizedJobPosting> fetch(String board, SearchParameters search, RequestIdentity identity);
}
