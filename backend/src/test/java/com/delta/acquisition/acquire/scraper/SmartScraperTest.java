package com.delta.acquisition.acquire.scraper;

import com.delta.acquisition.acquire.MutableClock;
import com.delta.acquisition.acquire.jobs.JobPostingExtractor;
import com.delta.acquisition.acquire.jobs.PostingNormalizer;
import com.delta.acquisition.acquire.model.AcquisitionOutcome;
import com.delta.acquisition.acquire.model.ActionableElement;
import com.delta.acquisition.acquire.model.BoundingBox;
import com.delta.acquisition.acquire.model.CandidateField;
import com.delta.acquisition.acquire.model.JobListingCandidate;
import com.delta.acquisition.acquire.model.LeaseOutcome;
import com.delta.acquisition.acquire.model.NormalizedJobPosting;
import com.delta.acquisition.acquire.model.OutcomeKind;
import com.delta.acquisition.acquire.model.PageSnapshot;
import com.delta.acquisition.acquire.model.ResolvedTarget;
import com.delta.acquisition.acquire.model.ResourceKind;
import com.delta.acquisition.acquire.model.SearchParameters;
import com.delta.acquisition.acquire.model.StrategyDecision;
import com.delta.acquisition.acquire.model.VisionAnalysisResult;
import com.delta.acquisition.acquire.model.VisionMode;
import com.delta.acquisition.acquire.pool.ConfiguredReplenishmentSource;
import com.delta.acquisition.acquire.pool.LeaseSet;
import com.delta.acquisition.acquire.pool.ResourcePoolManager;
import com.delta.acquisition.acquire.service.AcquisitionCancelledException;
import com.delta.acquisition.acquire.util.ReasonCodeClassifier;
import com.delta.acquisition.acquire.vision.AnalysisException;
import com.delta.acquisition.acquire.vision.CandidateFusion;
import com.delta.acquisition.acquire.vision.VisionAnalysisService;
import com.delta.acquisition.acquire.vision.VisionCallContext;
import com.delta.acquisition.config.AcquisitionProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SmartScraperTest {
    private static final String LISTING_URL = "https://jobs.example.com/search?q=engineer";
    private static final ResolvedTarget TARGET = new ResolvedTarget(null, LISTING_URL, "jobs.example.com", null, null, null);
    private static final StrategyDecision LOCAL = StrategyDecision.visual(VisionMode.LOCAL_ONLY);
    private static final String PLAIN_PAGE = "<html><head><title>Jobs</title></head><body><div>Open roles</div></body></html>";
    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private AcquisitionProperties properties;
    private ResourcePoolManager poolManager;
    private VisionAnalysisService visionService;
    private FakeBrowserDriver browser;
    private SmartScraper scraper;
    private LeaseSet leases;

    @BeforeEach
    void setUp() {
        properties = new AcquisitionProperties();
        properties.getPools().setLeaseWaitMs(0);
        properties.getPools().getProxy().setCapacity(1);
        properties.getPools().getProxy().setItems(List.of("http://proxy.local:3128"));
        properties.getVision().setActionThreshold(0.75);
        poolManager = new ResourcePoolManager(
            properties,
            new ConfiguredReplenishmentSource(properties),
            new MutableClock(NOW)
        );
        ObjectMapper objectMapper = new ObjectMapper();
        PostingNormalizer normalizer = new PostingNormalizer(objectMapper);
        visionService = Mockito.mock(VisionAnalysisService.class);
        browser = new FakeBrowserDriver();
        scraper = new SmartScraper(
            browser,
            new JitterPolicy(0, 0, 3, 3, 0, new Random(7)),
            new BlockSignalDetector(),
            new JobPostingExtractor(objectMapper, normalizer),
            visionService,
            new CandidateFusion(0.8),
            normalizer,
            properties,
            new MutableClock(NOW)
        );
        leases = poolManager.leaseAll(LOCAL.requiredKinds(false));
    }

    @AfterEach
    void tearDown() {
        leases.close();
    }

    @Test
    void opensBrowserWithLeasedIdentityProxyAndSession() {
        browser.pages.add(PLAIN_PAGE);
        when(visionService.analyze(any(), eq(VisionMode.LOCAL_ONLY), any())).thenReturn(result(List.of(), null));

        scraper.scrape(TARGET, LOCAL, leases, SearchParameters.none());

        BrowserProfile profile = browser.profile;
        assertEquals(leases.valueOf(ResourceKind.IDENTITY), profile.userAgent());
        assertEquals("http://proxy.local:3128", profile.proxy());
        assertEquals(leases.valueOf(ResourceKind.SESSION), profile.sessionId());
        assertTrue(browser.closed);
        assertThat(browser.pointerMoves).hasSize(3);
    }

    @Test
    void structuredDataOnThePageSkipsVision() {
        browser.pages.add("""
            <html><head>
            <script type="application/ld+json">
            {"@context": "https://schema.org", "@type": "JobPosting", "title": "Staff Engineer",
             "hiringOrganization": {"@type": "Organization", "name": "Acme"},
             "jobLocation": {"@type": "Place", "address": {"addressLocality": "Denver", "addressRegion": "CO"}}}
            </script>
            </head><body></body></html>
            """);

        AcquisitionOutcome outcome = scraper.scrape(TARGET, LOCAL, leases, SearchParameters.none());

        assertEquals(OutcomeKind.SUCCESS, outcome.kind());
        assertThat(outcome.jobs()).extracting(NormalizedJobPosting::extractionMethod).containsExactly(JobPostingExtractor.METHOD);
        assertEquals(0, browser.screenshots);
        verify(visionService, never()).analyze(any(), any(), any());
        assertThat(outcome.costByProvider()).isEmpty();
    }

    @Test
    void visionCandidatesBecomeFilteredPostings() {
        browser.pages.add(PLAIN_PAGE);
        when(visionService.analyze(any(), eq(VisionMode.LOCAL_ONLY), any())).thenReturn(result(List.of(
            candidate("Backend Engineer", "Acme", "Remote", 0.9),
            candidate("Office Manager", "Acme", "Remote", 0.9),
            candidate("Platform Engineer", "Globex", "Austin", 0.6)
        ), null));

        AcquisitionOutcome outcome = scraper.scrape(TARGET, LOCAL, leases, new SearchParameters("engineer", null, null));

        assertEquals(OutcomeKind.SUCCESS, outcome.kind());
        assertThat(outcome.jobs()).extracting(NormalizedJobPosting::title)
            .containsExactly("Backend Engineer", "Platform Engineer");
        NormalizedJobPosting first = outcome.jobs().get(0);
        assertEquals("vision:local_only", first.extractionMethod());
        assertEquals(0.9, first.confidence(), 1e-9);
        assertThat(first.contentHash()).hasSize(64);
        assertEquals(1, browser.screenshots);

        ArgumentCaptor<PageSnapshot> snapshot = ArgumentCaptor.forClass(PageSnapshot.class);
        ArgumentCaptor<VisionCallContext> context = ArgumentCaptor.forClass(VisionCallContext.class);
        verify(visionService).analyze(snapshot.capture(), eq(VisionMode.LOCAL_ONLY), context.capture());
        assertEquals(leases.valueOf(ResourceKind.PARSER), context.getValue().parserEndpoint());
        assertEquals(NOW, snapshot.getValue().capturedAt());
    }

    @Test
    void forbiddenNavigationIsBlockedAndFlagsProxyAndSession() {
        browser.status = 403;

        AcquisitionOutcome outcome = scraper.scrape(TARGET, LOCAL, leases, SearchParameters.none());

        assertEquals(OutcomeKind.BLOCKED, outcome.kind());
        assertEquals(ReasonCodeClassifier.HTTP_401_403, outcome.errorCode());
        assertEquals(LeaseOutcome.UNHEALTHY, leases.outcomeOf(ResourceKind.PROXY));
        assertEquals(LeaseOutcome.UNHEALTHY, leases.outcomeOf(ResourceKind.SESSION));
        assertEquals(LeaseOutcome.NEUTRAL, leases.outcomeOf(ResourceKind.IDENTITY));
        verify(visionService, never()).analyze(any(), any(), any());
    }

    @Test
    void rateLimitedNavigationIsBlocked() {
        browser.status = 429;

        AcquisitionOutcome outcome = scraper.scrape(TARGET, LOCAL, leases, SearchParameters.none());

        assertEquals(OutcomeKind.BLOCKED, outcome.kind());
        assertEquals(ReasonCodeClassifier.HTTP_429_RATE_LIMIT, outcome.errorCode());
    }

    @Test
    void challengePageIsBlockedBeforeAnyAnalysis() {
        browser.pages.add("<html><head><title>Just a moment...</title></head><body>Checking your browser</body></html>");

        AcquisitionOutcome outcome = scraper.scrape(TARGET, LOCAL, leases, SearchParameters.none());

        assertEquals(OutcomeKind.BLOCKED, outcome.kind());
        assertEquals(ReasonCodeClassifier.BLOCKED_CAPTCHA, outcome.errorCode());
        assertThat(outcome.errorMessage()).contains("title:just a moment");
        assertEquals(0, browser.screenshots);
    }

    @Test
    void missingPageIsATargetError() {
        browser.status = 404;

        AcquisitionOutcome outcome = scraper.scrape(TARGET, LOCAL, leases, SearchParameters.none());

        assertEquals(OutcomeKind.TARGET_ERROR, outcome.kind());
        assertEquals(ReasonCodeClassifier.HTTP_404, outcome.errorCode());
        assertEquals(LeaseOutcome.NEUTRAL, leases.outcomeOf(ResourceKind.PROXY));
    }

    @Test
    void navigationFailureKeepsItsReasonCode() {
        browser.navigationFailure = new BrowserNavigationException(ReasonCodeClassifier.DNS_FAILURE, "net::ERR_NAME_NOT_RESOLVED", null);

        AcquisitionOutcome outcome = scraper.scrape(TARGET, LOCAL, leases, SearchParameters.none());

        assertEquals(OutcomeKind.TARGET_ERROR, outcome.kind());
        assertEquals(ReasonCodeClassifier.DNS_FAILURE, outcome.errorCode());
        assertTrue(browser.closed);
    }

    @Test
    void confidentActionIsClickedAndDetailIsFused() {
        browser.pages.add(PLAIN_PAGE);
        browser.pages.add("<html><body><div>Job details</div></body></html>");
        ActionableElement showMore = new ActionableElement("Show more jobs", new BoundingBox(100, 600, 200, 40), 0.9);
        when(visionService.analyze(any(), eq(VisionMode.LOCAL_ONLY), any())).thenReturn(
            result(List.of(candidate("Data Engineer", "Acme", null, 0.6)), showMore),
            result(List.of(
                candidate("Data Engineer", "Acme", "Berlin", 0.9),
                candidate("ML Engineer", "Acme", "Munich", 0.8)
            ), null)
        );

        AcquisitionOutcome outcome = scraper.scrape(TARGET, LOCAL, leases, SearchParameters.none());

        assertEquals(OutcomeKind.SUCCESS, outcome.kind());
        assertThat(browser.clicks).hasSize(1);
        assertArrayEquals(new double[] {200.0, 620.0}, browser.clicks.get(0), 1e-9);
        assertThat(outcome.jobs()).extracting(NormalizedJobPosting::title).containsExactly("Data Engineer", "ML Engineer");
        assertEquals("Berlin", outcome.jobs().get(0).locationText());
        assertEquals(2, browser.screenshots);
        verify(visionService, times(2)).analyze(any(), eq(VisionMode.LOCAL_ONLY), any());
    }

    @Test
    void pointerMovesContinueFromTheLastPosition() {
        browser.pages.add(PLAIN_PAGE);
        browser.pages.add("<html><body><div>Job details</div></body></html>");
        ActionableElement showMore = new ActionableElement("Show more", new BoundingBox(1200, 680, 60, 20), 0.9);
        when(visionService.analyze(any(), eq(VisionMode.LOCAL_ONLY), any())).thenReturn(
            result(List.of(candidate("Data Engineer", "Acme", null, 0.6)), showMore),
            result(List.of(), null)
        );

        scraper.scrape(TARGET, LOCAL, leases, SearchParameters.none());

        assertThat(browser.pointerMoves).hasSize(6);
        double[] previous = {properties.getScraper().getViewportWidth() / 2.0, properties.getScraper().getViewportHeight() / 2.0};
        double maxStep = 0.0;
        for (double[] move : browser.pointerMoves) {
            maxStep = Math.max(maxStep, Math.hypot(move[0] - previous[0], move[1] - previous[1]));
            previous = move;
        }
        double diagonal = Math.hypot(properties.getScraper().getViewportWidth(), properties.getScraper().getViewportHeight());
        double wobble = PointerPath.MAX_OFFSET_PX * Math.sqrt(2);
        assertThat(maxStep).isLessThan(diagonal / 2 + 2 * wobble);

        double[] wanderEnd = browser.pointerMoves.get(2);
        double[] firstTowardAction = browser.pointerMoves.get(3);
        double eased = 7.0 / 27.0;
        double expectedX = wanderEnd[0] + (1230.0 - wanderEnd[0]) * eased;
        double expectedY = wanderEnd[1] + (690.0 - wanderEnd[1]) * eased;
        assertThat(Math.hypot(firstTowardAction[0] - expectedX, firstTowardAction[1] - expectedY)).isLessThanOrEqualTo(wobble + 1e-9);
        assertArrayEquals(new double[] {1230.0, 690.0}, browser.pointerMoves.get(5), 1e-9);
    }

    @Test
    void weakActionIsIgnored() {
        browser.pages.add(PLAIN_PAGE);
        ActionableElement maybe = new ActionableElement("Next", new BoundingBox(0, 0, 10, 10), 0.5);
        when(visionService.analyze(any(), eq(VisionMode.LOCAL_ONLY), any()))
            .thenReturn(result(List.of(candidate("Cook", "Diner", null, 0.8)), maybe));

        AcquisitionOutcome outcome = scraper.scrape(TARGET, LOCAL, leases, SearchParameters.none());

        assertEquals(OutcomeKind.SUCCESS, outcome.kind());
        assertThat(browser.clicks).isEmpty();
        assertThat(outcome.jobs()).hasSize(1);
    }

    @Test
    void challengeAfterClickIsBlockedButKeepsSpend() {
        StrategyDecision cloud = StrategyDecision.visual(VisionMode.CLOUD_ONLY);
        browser.pages.add(PLAIN_PAGE);
        browser.pages.add("<html><body><div class=\"g-recaptcha\" data-sitekey=\"abc\"></div></body></html>");
        ActionableElement details = new ActionableElement("View details", new BoundingBox(10, 10, 100, 20), 0.95);
        VisionAnalysisResult paid = new VisionAnalysisResult(
            List.of(candidate("Nurse", "Clinic", null, 0.9)), 0.9, VisionMode.CLOUD_ONLY, Duration.ofMillis(5),
            details, Map.of("remote-vision", 0.03), List.of()
        );
        when(visionService.analyze(any(), eq(VisionMode.CLOUD_ONLY), any())).thenReturn(paid);

        AcquisitionOutcome outcome = scraper.scrape(TARGET, cloud, leases, SearchParameters.none());

        assertEquals(OutcomeKind.BLOCKED, outcome.kind());
        assertEquals(0.03, outcome.costByProvider().get("remote-vision"), 1e-9);
        assertEquals(LeaseOutcome.UNHEALTHY, leases.outcomeOf(ResourceKind.PROXY));
    }

    @Test
    void failedDetailAnalysisKeepsListingResult() {
        browser.pages.add(PLAIN_PAGE);
        browser.pages.add("<html><body>details</body></html>");
        ActionableElement details = new ActionableElement("View details", new BoundingBox(10, 10, 100, 20), 0.95);
        when(visionService.analyze(any(), eq(VisionMode.LOCAL_ONLY), any()))
            .thenReturn(result(List.of(candidate("Pilot", "Skyways", null, 0.9)), details))
            .thenThrow(new AnalysisException("vision analysis failed: local-vision: timeout", List.of("local-vision: timeout"), null));

        AcquisitionOutcome outcome = scraper.scrape(TARGET, LOCAL, leases, SearchParameters.none());

        assertEquals(OutcomeKind.SUCCESS, outcome.kind());
        assertThat(outcome.jobs()).extracting(NormalizedJobPosting::title).containsExactly("Pilot");
        assertThat(outcome.failures()).contains("local-vision: timeout");
    }

    @Test
    void billedDetailFailureKeepsItsSpend() {
        browser.pages.add(PLAIN_PAGE);
        browser.pages.add("<html><body>details</body></html>");
        ActionableElement details = new ActionableElement("View details", new BoundingBox(10, 10, 100, 20), 0.95);
        VisionAnalysisResult paid = new VisionAnalysisResult(
            List.of(candidate("Nurse", "Clinic", null, 0.9)), 0.9, VisionMode.CLOUD_ONLY, Duration.ofMillis(5),
            details, Map.of("remote-vision", 0.03), List.of()
        );
        when(visionService.analyze(any(), eq(VisionMode.CLOUD_ONLY), any()))
            .thenReturn(paid)
            .thenThrow(new AnalysisException("empty model response").withIncurredCost("remote-vision", 0.02));

        AcquisitionOutcome outcome = scraper.scrape(TARGET, StrategyDecision.visual(VisionMode.CLOUD_ONLY), leases,
            SearchParameters.none());

        assertEquals(OutcomeKind.SUCCESS, outcome.kind());
        assertEquals(0.05, outcome.costByProvider().get("remote-vision"), 1e-9);
    }

    @Test
    void cancellationDuringRecaptureCarriesListingSpend() {
        browser.pages.add(PLAIN_PAGE);
        browser.pages.add("<html><body>details</body></html>");
        ActionableElement details = new ActionableElement("View details", new BoundingBox(10, 10, 100, 20), 0.95);
        VisionAnalysisResult paid = new VisionAnalysisResult(
            List.of(candidate("Nurse", "Clinic", null, 0.9)), 0.9, VisionMode.CLOUD_ONLY, Duration.ofMillis(5),
            details, Map.of("remote-vision", 0.03), List.of()
        );
        when(visionService.analyze(any(), eq(VisionMode.CLOUD_ONLY), any()))
            .thenReturn(paid)
            .thenThrow(new AcquisitionCancelledException("vision analysis interrupted"));

        assertThatThrownBy(() -> scraper.scrape(TARGET, StrategyDecision.visual(VisionMode.CLOUD_ONLY), leases,
            SearchParameters.none()))
            .isInstanceOf(AcquisitionCancelledException.class)
            .satisfies(e -> assertThat(((AcquisitionCancelledException) e).getIncurredCosts())
                .containsEntry("remote-vision", 0.03));
        assertTrue(browser.closed);
    }

    @Test
    void analysisFailurePropagatesAndClosesBrowser() {
        browser.pages.add(PLAIN_PAGE);
        when(visionService.analyze(any(), any(), any())).thenThrow(new AnalysisException("vision analysis failed: boom"));

        assertThatThrownBy(() -> scraper.scrape(TARGET, LOCAL, leases, SearchParameters.none()))
            .isInstanceOf(AnalysisException.class);
        assertTrue(browser.closed);
    }

    @Test
    void refusesNonVisualStrategies() {
        assertThatThrownBy(() -> scraper.scrape(TARGET, StrategyDecision.directApi(), leases, SearchParameters.none()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static VisionAnalysisResult result(List<JobListingCandidate> candidates, ActionableElement action) {
        return new VisionAnalysisResult(candidates, 0.8, VisionMode.LOCAL_ONLY, Duration.ofMillis(5), action, Map.of(), List.of());
    }

    private static JobListingCandidate candidate(String title, String company, String location, double confidence) {
        Map<CandidateField, Double> fieldConfidence = new EnumMap<>(CandidateField.class);
        for (CandidateField field : CandidateField.values()) {
            fieldConfidence.put(field, confidence);
        }
        return new JobListingCandidate(title, company, location, null, null, fieldConfidence);
    }

    private static final class FakeBrowserDriver implements BrowserDriver {
        private final Deque<String> pages = new ArrayDeque<>();
        private final List<double[]> pointerMoves = new ArrayList<>();
        private final List<double[]> clicks = new ArrayList<>();
        private int status = 200;
        private BrowserNavigationException navigationFailure;
        private BrowserProfile profile;
        private int screenshots;
        private boolean closed;
        private String current;

        @Override
        public BrowserSession open(BrowserProfile profile) {
            this.profile = profile;
            return new BrowserSession() {
                @Override
                public NavigationResult navigate(String url, Duration timeout) {
                    if (navigationFailure != null) {
                        throw navigationFailure;
                    }
                    current = pages.pollFirst();
                    return new NavigationResult(status, url);
                }

                @Override
                public String content() {
                    return current == null ? "<html></html>" : current;
                }

                @Override
                public byte[] screenshot() {
                    screenshots++;
                    return "png".getBytes(StandardCharsets.UTF_8);
                }

                @Override
                public void movePointer(double x, double y) {
                    pointerMoves.add(new double[] {x, y});
                }

                @Override
                public void click(double x, double y) {
                    clicks.add(new double[] {x, y});
                    current = pages.pollFirst();
                }

                @Override
                public void close() {
                    closed = true;
                }
            };
        }
    }
}
