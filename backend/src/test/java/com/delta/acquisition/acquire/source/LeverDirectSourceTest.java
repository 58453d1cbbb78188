package com.delta.acquisition.acquire.source;

import com.delta.acquisition.acquire.http.PoliteHttpClient;
import com.delta.acquisition.acquire.http.RequestIdentity;
import com.delta.acquisition.acquire.jobs.PostingNormalizer;
import com.delta.acquisition.acquire.model.NormalizedJobPosting;
import com.delta.acquisition.acquire.model.SearchParameters;
import com.delta.acquisition.acquire.util.ReasonCodeClassifier;
import com.delta.acquisition.config.AcquisitionProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LeverDirectSourceTest {
    private MockWebServer server;
    private ExecutorService executor;
    private LeverDirectSource source;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        AcquisitionProperties properties = new AcquisitionProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestMaxRetries(0);
        properties.getDirect().setLeverApiBase(server.url("/").toString().replaceAll("/$", ""));
        executor = Executors.newFixedThreadPool(1);
        ObjectMapper objectMapper = new ObjectMapper();
        source = new LeverDirectSource(
            new PoliteHttpClient(properties, executor),
            objectMapper,
            new PostingNormalizer(objectMapper),
            properties
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void detectsAccount() {
        assertEquals("globex", source.detectBoard("https://jobs.lever.co/globex/abc-123").orElseThrow());
        assertEquals("globex", source.detectBoard("https://api.lever.co/v0/postings/globex?mode=json").orElseThrow());
        assertThat(source.detectBoard("https://jobs.lever.co/")).isEmpty();
        assertThat(source.detectBoard("https://globex.com/careers")).isEmpty();
    }

    @Test
    void fetchesPostings() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("""
            [
              {"id": "a1b2", "text": "Site Reliability Engineer",
               "hostedUrl": "https://jobs.lever.co/globex/a1b2",
               "categories": {"location": "Toronto", "commitment": "Full-time"},
               "createdAt": 1709251200000,
               "descriptionPlain": "Keep things running.",
               "salaryRange": {"min": 120000, "max": 150000, "currency": "CAD"}},
              {"id": "c3d4", "text": "Account Executive",
               "applyUrl": "https://jobs.lever.co/globex/c3d4/apply",
               "description": "<p>Sell <b>widgets</b></p>"}
            ]
            """));

        List<NormalizedJobPosting> postings = source.fetch("globex", SearchParameters.none(), RequestIdentity.anonymous());

        assertEquals("/v0/postings/globex?mode=json", server.takeRequest(1, TimeUnit.SECONDS).getPath());
        assertThat(postings).hasSize(2);
        NormalizedJobPosting sre = postings.get(0);
        assertEquals("Site Reliability Engineer", sre.title());
        assertEquals("globex", sre.orgName());
        assertEquals("Toronto", sre.locationText());
        assertEquals("Full-time", sre.employmentType());
        assertEquals(LocalDate.of(2024, 3, 1), sre.datePosted());
        assertEquals("120000 - 150000 CAD", sre.salaryText());
        assertEquals("https://jobs.lever.co/globex/a1b2", sre.canonicalUrl());
        assertEquals("direct_api:lever", sre.extractionMethod());

        NormalizedJobPosting sales = postings.get(1);
        assertEquals("https://jobs.lever.co/globex/c3d4/apply", sales.canonicalUrl());
        assertEquals("Sell widgets", sales.descriptionText());
    }

    @Test
    void honoursResultLimit() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("""
            [{"id": "1", "text": "Engineer I"}, {"id": "2", "text": "Engineer II"}, {"id": "3", "text": "Engineer III"}]
            """));

        List<NormalizedJobPosting> postings = source.fetch("globex", new SearchParameters("engineer", null, 2), RequestIdentity.anonymous());

        assertThat(postings).extracting(NormalizedJobPosting::title).containsExactly("Engineer I", "Engineer II");
    }

    @Test
    void serverErrorIsRetryable() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> source.fetch("globex", SearchParameters.none(), RequestIdentity.anonymous()))
            .isInstanceOfSatisfying(SourceFetchException.class, e -> {
                assertEquals(ReasonCodeClassifier.HTTP_5XX, e.getReasonCode());
                assertThat(e.isRetryable()).isTrue();
            });
    }

    @Test
    void objectPayloadIsRejected() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"ok\": false}"));

        assertThatThrownBy(() -> source.fetch("globex", SearchParameters.none(), RequestIdentity.anonymous()))
            .isInstanceOfSatisfying(SourceFetchException.class,
                e -> assertEquals(ReasonCodeClassifier.PARSING_FAILED, e.getReasonCode()));
    }
}
