package com.delta.acquisition.acquire.source;

import com.delta.acquisition.acquire.http.PoliteHttpClient;
import com.delta.acquisition.acquire.http.RequestIdentity;
import com.delta.acquisition.acquire.jobs.PostingFields;
import com.delta.acquisition.acquire.jobs.PostingNormalizer;
import com.delta.acquisition.acquire.model.HttpFetchResult;
import com.delta.acquisition.acquire.model.NormalizedJobPosting;
import com.delta.acquisition.acquire.model.SearchParameters;
import com.delta.acquisition.acquire.util.ReasonCodeClassifier;
import com.delta.acquisition.config.AcquisitionProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.delta.acquisition.acquire.jobs.PostingFields.firstNonBlank;
import static com.delta.acquisition.acquire.jobs.PostingFields.text;

/**
 * Lever postings API: {@code /v0/postings/{account}?mode=json}.
 */
@Component
public class LeverDirectSource implements DirectSource {
    public static final String TYPE = "lever";
    private static final Logger log = LoggerFactory.getLogger(LeverDirectSource.class);
    private static final String JSON_ACCEPT = "application/json,*/*;q=0.8";

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final PostingNormalizer normalizer;
    private final AcquisitionProperties properties;

    public LeverDirectSource(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        PostingNormalizer normalizer,
        AcquisitionProperties properties
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.normalizer = normalizer;
        this.properties = properties;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Optional<String> detectBoard(String url) {
        URI uri = PostingFields.safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return Optional.empty();
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        List<String> segments = PostingFields.pathSegments(uri.getPath());
        if ((host.equals("jobs.lever.co") || host.equals("apply.lever.co")) && !segments.isEmpty()) {
            return Optional.of(segments.get(0));
        }
        if (host.equals("api.lever.co") && segments.size() >= 3 && "postings".equals(segments.get(1))) {
            return Optional.of(segments.get(2));
        }
        return Optional.empty();
    }

    @Override
    public List<NormalizedJobPosting> fetch(String account, SearchParameters search, RequestIdentity identity) {
        String feedUrl = properties.getDirect().getLeverApiBase() + "/v0/postings/" + account + "?mode=json";
        HttpFetchResult fetch = httpClient.get(feedUrl, JSON_ACCEPT, identity);
        if (!fetch.isSuccessful() || fetch.body() == null) {
            throw SourceFetchException.fromFetch(TYPE, fetch);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(fetch.body());
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse Lever payload for account {}", account, e);
            throw new SourceFetchException(ReasonCodeClassifier.PARSING_FAILED, "lever_parse_error", e);
        }
        if (!root.isArray()) {
            throw new SourceFetchException(ReasonCodeClassifier.PARSING_FAILED, fetch.statusCode(), "lever_invalid_payload");
        }
        List<NormalizedJobPosting> postings = new ArrayList<>();
        for (JsonNode job : root) {
            NormalizedJobPosting posting = normalize(account, job, feedUrl);
            if (posting != null) {
                postings.add(posting);
            }
        }
        return PostingFields.filter(postings, search);
    }

    NormalizedJobPosting normalize(String account, JsonNode job, String sourceUrl) {
        LocalDate datePosted = null;
        JsonNode createdAtNode = job.get("createdAt");
        if (createdAtNode != null && createdAtNode.canConvertToLong()) {
            datePosted = Instant.ofEpochMilli(createdAtNode.asLong()).atZone(ZoneOffset.UTC).toLocalDate();
        }
        JsonNode categories = job.path("categories");
        return normalizer.build(
            sourceUrl,
            firstNonBlank(text(job, "hostedUrl"), text(job, "applyUrl")),
            text(job, "text"),
            account,
            text(categories, "location"),
            text(categories, "commitment"),
            datePosted,
            firstNonBlank(text(job, "descriptionPlain"), PostingFields.htmlToText(text(job, "description"))),
            extractSalary(job.path("salaryRange")),
            text(job, "id"),
            "direct_api:" + TYPE,
            1.0
        );
    }

    private String extractSalary(JsonNode range) {
        if (range == null || !range.isObject()) {
            return null;
        }
        String min = text(range, "min");
        String max = text(range, "max");
        if (min == null && max == null) {
            return null;
        }
        StringBuilder out = new StringBuilder(min == null ? max : min);
        if (min != null && max != null && !max.equals(min)) {
            out.append(" - ").append(max);
        }
        String currency = text(range, "currency");
        if (currency != null) {
            out.append(' ').append(currency);
        }
        return out.toString();
    }
}
