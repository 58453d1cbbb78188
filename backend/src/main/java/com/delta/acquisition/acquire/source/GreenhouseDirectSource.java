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
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.delta.acquisition.acquire.jobs.PostingFields.firstNonBlank;
import static com.delta.acquisition.acquire.jobs.PostingFields.text;

/**
 * Greenhouse job board API: {@code /v1/boards/{token}/jobs?content=true}.
 */
@Component
public class GreenhouseDirectSource implements DirectSource {
    public static final String TYPE = "greenhouse";
    private static final Logger log = LoggerFactory.getLogger(GreenhouseDirectSource.class);
    private static final String JSON_ACCEPT = "application/json,*/*;q=0.8";

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final PostingNormalizer normalizer;
    private final AcquisitionProperties properties;

    public GreenhouseDirectSource(
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
        if ((host.equals("api.greenhouse.io") || host.equals("boards-api.greenhouse.io"))
            && segments.size() >= 3
            && "boards".equals(segments.get(1))) {
            return Optional.of(segments.get(2));
        }
        if ((host.equals("boards.greenhouse.io") || host.equals("job-boards.greenhouse.io"))
            && !segments.isEmpty()
            && !"embed".equals(segments.get(0))) {
            return Optional.of(segments.get(0));
        }
        return Optional.empty();
    }

    @Override
    public List<NormalizedJobPosting> fetch(String board, SearchParameters search, RequestIdentity identity) {
        String feedUrl = properties.getDirect().getGreenhouseApiBase() + "/v1/boards/" + board + "/jobs?content=true";
        HttpFetchResult fetch = httpClient.get(feedUrl, JSON_ACCEPT, identity);
        if (!fetch.isSuccessful() || fetch.body() == null) {
            throw SourceFetchException.fromFetch(TYPE, fetch);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(fetch.body());
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse Greenhouse payload for board {}", board, e);
            throw new SourceFetchException(ReasonCodeClassifier.PARSING_FAILED, "greenhouse_parse_error", e);
        }
        JsonNode jobs = root.path("jobs");
        if (!jobs.isArray()) {
            throw new SourceFetchException(ReasonCodeClassifier.PARSING_FAILED, fetch.statusCode(), "greenhouse_invalid_payload");
        }
        List<NormalizedJobPosting> postings = new ArrayList<>();
        for (JsonNode job : jobs) {
            NormalizedJobPosting posting = normalize(board, job, feedUrl);
            if (posting != null) {
                postings.add(posting);
            }
        }
        return PostingFields.filter(postings, search);
    }

    NormalizedJobPosting normalize(String board, JsonNode job, String sourceUrl) {
        String rawHtml = text(job, "content");
        String description = rawHtml == null ? null : PostingFields.htmlToText(Parser.unescapeEntities(rawHtml, false));
        String identifier = text(job, "id");
        String derivedUrl = identifier == null ? null : "https://boards.greenhouse.io/" + board + "/jobs/" + identifier;
        return normalizer.build(
            sourceUrl,
            firstNonBlank(text(job, "absolute_url"), derivedUrl),
            text(job, "title"),
            firstNonBlank(text(job, "company_name"), board),
            text(job.path("location"), "name"),
            extractEmploymentType(job.path("metadata")),
            PostingFields.parseIsoDate(text(job, "updated_at")),
            description,
            null,
            identifier,
            "direct_api:" + TYPE,
            1.0
        );
    }

    private String extractEmploymentType(JsonNode metadata) {
        if (!metadata.isArray()) {
            return null;
        }
        List<String> values = new ArrayList<>();
        for (JsonNode entry : metadata) {
            String name = text(entry, "name");
            if (name == null || !name.toLowerCase(Locale.ROOT).contains("employment")) {
                continue;
            }
            JsonNode valueNode = entry.path("value");
            if (valueNode.isArray()) {
                for (JsonNode item : valueNode) {
                    String val = item.asText(null);
                    if (val != null && !val.isBlank()) {
                        values.add(val.trim());
                    }
                }
            } else {
                String val = valueNode.asText(null);
                if (val != null && !val.isBlank()) {
                    values.add(val.trim());
                }
            }
        }
        return values.isEmpty() ? null : String.join(", ", values);
    }
}
