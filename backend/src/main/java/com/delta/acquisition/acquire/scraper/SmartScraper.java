package com.delta.acquisition.acquire.scraper;

import com.delta.acquisition.acquire.jobs.JobPostingExtractor;
import com.delta.acquisition.acquire.jobs.PostingFields;
import com.delta.acquisition.acquire.jobs.PostingNormalizer;
import com.delta.acquisition.acquire.model.AcquisitionOutcome;
import com.delta.acquisition.acquire.model.ActionableElement;
import com.delta.acquisition.acquire.model.CandidateField;
import com.delta.acquisition.acquire.model.JobListingCandidate;
import com.delta.acquisition.acquire.model.NormalizedJobPosting;
import com.delta.acquisition.acquire.model.OutcomeKind;
import com.delta.acquisition.acquire.model.PageSnapshot;
import com.delta.acquisition.acquire.model.ResolvedTarget;
import com.delta.acquisition.acquire.model.ResourceKind;
import com.delta.acquisition.acquire.model.SearchParameters;
import com.delta.acquisition.acquire.model.StrategyDecision;
import com.delta.acquisition.acquire.model.VisionAnalysisResult;
import com.delta.acquisition.acquire.pool.LeaseSet;
import com.delta.acquisition.acquire.service.AcquisitionCancelledException;
import com.delta.acquisition.acquire.util.ReasonCodeClassifier;
import com.delta.acquisition.acquire.vision.AnalysisException;
import com.delta.acquisition.acquire.vision.CandidateFusion;
import com.delta.acquisition.acquire.vision.ProviderResult;
import com.delta.acquisition.acquire.vision.VisionAnalysisService;
import com.delta.acquisition.acquire.vision.VisionCallContext;
import com.delta.acquisition.config.AcquisitionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one visual scrape: navigate, let the page settle, capture, try structured data, then fall back to
 * vision analysis with at most one click-and-recapture on a promising element.
 */
@Service
public class SmartScraper {
    private static final Logger log = LoggerFactory.getLogger(SmartScraper.class);
    private static final List<ResourceKind> BLOCK_SENSITIVE_KINDS = List.of(ResourceKind.PROXY, ResourceKind.SESSION);

    private final BrowserDriver browserDriver;
    private final JitterPolicy jitter;
    private final BlockSignalDetector blockDetector;
    private final JobPostingExtractor structuredExtractor;
    private final VisionAnalysisService visionService;
    private final CandidateFusion fusion;
    private final PostingNormalizer normalizer;
    private final AcquisitionProperties properties;
    private final Clock clock;

    public SmartScraper(
        BrowserDriver browserDriver,
        JitterPolicy jitter,
        BlockSignalDetector blockDetector,
        JobPostingExtractor structuredExtractor,
        VisionAnalysisService visionService,
        CandidateFusion fusion,
        PostingNormalizer normalizer,
        AcquisitionProperties properties,
        Clock clock
    ) {
        this.browserDriver = browserDriver;
        this.jitter = jitter;
        this.blockDetector = blockDetector;
        this.structuredExtractor = structuredExtractor;
        this.visionService = visionService;
        this.fusion = fusion;
        this.normalizer = normalizer;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Scrapes the target with the leased identity, proxy and session. Analysis failures surface as
     * {@link AnalysisException}; navigation problems and block signals become outcomes.
     */
    public AcquisitionOutcome scrape(
        ResolvedTarget target,
        StrategyDecision decision,
        LeaseSet leases,
        SearchParameters search
    ) {
        if (!decision.isVisual()) {
            throw new IllegalArgumentException("scraper only runs visual strategies, got " + decision.label());
        }
        Run run = new Run(
            target.url(),
            properties.getScraper().getViewportWidth() / 2.0,
            properties.getScraper().getViewportHeight() / 2.0
        );
        try (BrowserSession session = browserDriver.open(profileFor(leases))) {
            NavigationResult navigation;
            try {
                navigation = session.navigate(target.url(), Duration.ofSeconds(properties.getTimeouts().getNavigationSeconds()));
            } catch (BrowserNavigationException e) {
                run.moveTo(ScrapeState.ABORTED);
                return AcquisitionOutcome.failure(OutcomeKind.TARGET_ERROR, decision, e.getReasonCode(), e.getMessage());
            }
            if (blockDetector.isBlockingStatus(navigation.status())) {
                return blocked(run, leases, decision, ReasonCodeClassifier.fromHttpStatus(navigation.status()),
                    "navigation returned " + navigation.status(), Map.of());
            }
            if (!navigation.isSuccessful()) {
                run.moveTo(ScrapeState.ABORTED);
                return AcquisitionOutcome.failure(
                    OutcomeKind.TARGET_ERROR,
                    decision,
                    ReasonCodeClassifier.fromHttpStatus(navigation.status()),
                    "navigation returned " + navigation.status()
                );
            }
            String pageUrl = navigation.finalUrl() == null ? target.url() : navigation.finalUrl();

            run.moveTo(ScrapeState.STABILIZE);
            jitter.pause(jitter.stabilizeDelay());
            wander(session, run);

            run.moveTo(ScrapeState.CAPTURE);
            String html = session.content();
            Optional<String> marker = blockDetector.detect(html);
            if (marker.isPresent()) {
                return blocked(run, leases, decision, ReasonCodeClassifier.BLOCKED_CAPTCHA,
                    "challenge marker " + marker.get(), Map.of());
            }
            List<NormalizedJobPosting> structured = structuredExtractor.extract(html, pageUrl).stream()
                .filter(JobPostingExtractor::isComplete)
                .toList();
            if (!structured.isEmpty()) {
                run.moveTo(ScrapeState.EXTRACTED);
                log.info("Structured data on {} yielded {} postings; skipping vision", pageUrl, structured.size());
                return AcquisitionOutcome.success(PostingFields.filter(structured, search), decision, Map.of(), List.of());
            }
            PageSnapshot snapshot = new PageSnapshot(pageUrl, session.screenshot(), html, clock.instant());

            run.moveTo(ScrapeState.ANALYZE);
            VisionCallContext context = new VisionCallContext(
                leases.valueOf(ResourceKind.PARSER),
                leases.valueOf(ResourceKind.TOKEN),
                Duration.ofSeconds(properties.getTimeouts().getAnalysisSeconds())
            );
            VisionAnalysisResult result = visionService.analyze(snapshot, decision.visionMode(), context);

            ActionableElement action = result.actionableElement();
            if (action != null && action.box() != null
                && action.confidence() >= properties.getVision().getActionThreshold()) {
                run.moveTo(ScrapeState.INTERACT_AND_RECAPTURE);
                Optional<VisionAnalysisResult> detail;
                try {
                    detail = interactAndRecapture(session, run, action, decision, context, result, pageUrl);
                } catch (AcquisitionCancelledException e) {
                    throw e.plusIncurredCosts(result.costByProvider());
                }
                if (detail.isEmpty()) {
                    return blocked(run, leases, decision, ReasonCodeClassifier.BLOCKED_CAPTCHA,
                        "challenge after interacting with " + action.label(), result.costByProvider());
                }
                result = detail.get();
            }

            run.moveTo(ScrapeState.EXTRACTED);
            List<NormalizedJobPosting> jobs = toPostings(result, pageUrl);
            if (jobs.isEmpty()) {
                log.info("Vision found no listings on {}", pageUrl);
            }
            return AcquisitionOutcome.success(
                PostingFields.filter(jobs, search),
                decision,
                result.costByProvider(),
                result.failures()
            );
        } catch (RuntimeException e) {
            if (run.state != ScrapeState.EXTRACTED) {
                run.moveTo(ScrapeState.ABORTED);
            }
            throw e;
        }
    }

    /**
     * Clicks the element, recaptures and fuses the detail analysis into the listing result. Empty when the click
     * led to a challenge page.
     */
    private Optional<VisionAnalysisResult> interactAndRecapture(
        BrowserSession session,
        Run run,
        ActionableElement action,
        StrategyDecision decision,
        VisionCallContext context,
        VisionAnalysisResult listing,
        String pageUrl
    ) {
        movePointer(session, run, action.box().centerX(), action.box().centerY());
        session.click(action.box().centerX(), action.box().centerY());
        jitter.pause(jitter.stabilizeDelay());

        String html = session.content();
        if (blockDetector.detect(html).isPresent()) {
            return Optional.empty();
        }
        PageSnapshot detailSnapshot = new PageSnapshot(pageUrl, session.screenshot(), html, clock.instant());
        VisionAnalysisResult detail;
        try {
            detail = visionService.analyze(detailSnapshot, decision.visionMode(), context);
        } catch (AnalysisException e) {
            List<String> failures = new ArrayList<>(listing.failures());
            failures.addAll(e.getFailures());
            failures.add("recapture: " + e.getMessage());
            Map<String, Double> costs = new LinkedHashMap<>(listing.costByProvider());
            e.getIncurredCosts().forEach((provider, cost) -> costs.merge(provider, cost, Double::sum));
            return Optional.of(listing.withFailures(failures).withCosts(costs));
        }

        CandidateFusion.Fused fused = fusion.fuse(asProviderResult(listing), asProviderResult(detail));
        Map<String, Double> costs = new LinkedHashMap<>(listing.costByProvider());
        detail.costByProvider().forEach((provider, cost) -> costs.merge(provider, cost, Double::sum));
        List<String> failures = new ArrayList<>(listing.failures());
        failures.addAll(detail.failures());
        return Optional.of(new VisionAnalysisResult(
            fused.candidates(),
            fused.confidence(),
            listing.mode(),
            listing.elapsed().plus(detail.elapsed()),
            null,
            costs,
            failures
        ));
    }

    private AcquisitionOutcome blocked(
        Run run,
        LeaseSet leases,
        StrategyDecision decision,
        String reasonCode,
        String message,
        Map<String, Double> spent
    ) {
        run.moveTo(ScrapeState.ABORTED);
        leases.markUnhealthy(BLOCK_SENSITIVE_KINDS);
        log.warn("Blocked on {}: {} ({})", run.url, message, reasonCode);
        return AcquisitionOutcome.failure(OutcomeKind.BLOCKED, decision, reasonCode, message).plusCosts(spent);
    }

    private void wander(BrowserSession session, Run run) {
        int width = properties.getScraper().getViewportWidth();
        int height = properties.getScraper().getViewportHeight();
        double x = width * (0.2 + 0.6 * jitter.random().nextDouble());
        double y = height * (0.2 + 0.6 * jitter.random().nextDouble());
        movePointer(session, run, x, y);
    }

    /**
     * Moves from wherever the pointer was left, starting at the viewport centre on a fresh page.
     */
    private void movePointer(BrowserSession session, Run run, double toX, double toY) {
        List<PointerPath.Point> path = PointerPath.between(
            run.pointerX, run.pointerY, toX, toY, jitter.pointerSteps(), jitter.random()
        );
        for (PointerPath.Point point : path) {
            session.movePointer(point.x(), point.y());
            run.pointerX = point.x();
            run.pointerY = point.y();
            jitter.pause(jitter.pointerStepDelay());
        }
    }

    private List<NormalizedJobPosting> toPostings(VisionAnalysisResult result, String pageUrl) {
        String method = "vision:" + result.mode().name().toLowerCase(Locale.ROOT);
        List<NormalizedJobPosting> postings = new ArrayList<>();
        for (JobListingCandidate candidate : result.candidates()) {
            NormalizedJobPosting posting = normalizer.build(
                pageUrl,
                pageUrl,
                candidate.title(),
                candidate.company(),
                candidate.location(),
                null,
                null,
                null,
                candidate.salary() == null ? null : candidate.salary().display(),
                null,
                method,
                candidateConfidence(candidate)
            );
            if (posting != null) {
                postings.add(posting);
            }
        }
        return postings;
    }

    private static double candidateConfidence(JobListingCandidate candidate) {
        double sum = 0.0;
        int fields = 0;
        for (CandidateField field : CandidateField.values()) {
            if (candidate.valueOf(field) != null) {
                sum += candidate.confidenceOf(field);
                fields++;
            }
        }
        return fields == 0 ? 0.0 : sum / fields;
    }

    private static ProviderResult asProviderResult(VisionAnalysisResult result) {
        return new ProviderResult(result.mode().name(), result.candidates(), result.confidence(), result.actionableElement(), 0.0);
    }

    private BrowserProfile profileFor(LeaseSet leases) {
        AcquisitionProperties.Scraper scraper = properties.getScraper();
        return new BrowserProfile(
            leases.valueOf(ResourceKind.IDENTITY),
            leases.valueOf(ResourceKind.PROXY),
            leases.valueOf(ResourceKind.SESSION),
            scraper.getViewportWidth(),
            scraper.getViewportHeight(),
            scraper.isHeadless()
        );
    }

    private static final class Run {
        private final String url;
        private ScrapeState state = ScrapeState.NAVIGATE;
        private double pointerX;
        private double pointerY;

        private Run(String url, double pointerX, double pointerY) {
            this.url = url;
            this.pointerX = pointerX;
            this.pointerY = pointerY;
            log.debug("Scrape {} entering {}", url, state);
        }

        private void moveTo(ScrapeState next) {
            log.debug("Scrape {} {} -> {}", url, state, next);
            state = next;
        }
    }
}
