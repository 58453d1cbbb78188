package com.delta.acquisition.acquire.service;

import com.delta.acquisition.acquire.cost.CostController;
import com.delta.acquisition.acquire.http.RequestIdentity;
import com.delta.acquisition.acquire.model.AcquisitionEvent;
import com.delta.acquisition.acquire.model.AcquisitionOutcome;
import com.delta.acquisition.acquire.model.AcquisitionRequest;
import com.delta.acquisition.acquire.model.NormalizedJobPosting;
import com.delta.acquisition.acquire.model.OutcomeKind;
import com.delta.acquisition.acquire.model.ResolvedTarget;
import com.delta.acquisition.acquire.model.ResourceKind;
import com.delta.acquisition.acquire.model.SourceAvailability;
import com.delta.acquisition.acquire.model.StrategyDecision;
import com.delta.acquisition.acquire.pool.LeaseSet;
import com.delta.acquisition.acquire.pool.PoolExhaustedException;
import com.delta.acquisition.acquire.pool.ResourcePoolManager;
import com.delta.acquisition.acquire.scraper.SmartScraper;
import com.delta.acquisition.acquire.source.DirectSource;
import com.delta.acquisition.acquire.source.DirectSourceRegistry;
import com.delta.acquisition.acquire.source.FeedSource;
import com.delta.acquisition.acquire.source.SourceFetchException;
import com.delta.acquisition.acquire.strategy.AcquisitionStrategySelector;
import com.delta.acquisition.acquire.strategy.SiteDifficultyEstimator;
import com.delta.acquisition.acquire.strategy.TargetResolver;
import com.delta.acquisition.acquire.util.ReasonCodeClassifier;
import com.delta.acquisition.acquire.vision.AnalysisException;
import com.delta.acquisition.config.AcquisitionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one acquisition end to end: resolve the target, pick and authorize a strategy, lease resources, execute
 * with retries, record spend, release leases, update site difficulty and emit an event.
 */
@Service
public class AcquisitionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(AcquisitionOrchestrator.class);

    private final TargetResolver targetResolver;
    private final SiteDifficultyEstimator difficultyEstimator;
    private final AcquisitionStrategySelector strategySelector;
    private final CostController costController;
    private final ResourcePoolManager poolManager;
    private final DirectSourceRegistry directSources;
    private final FeedSource feedSource;
    private final SmartScraper scraper;
    private final AcquisitionEventSink eventSink;
    private final ExecutorService acquisitionExecutor;
    private final ExecutorService acquisitionRunExecutor;
    private final AcquisitionProperties properties;
    private final Clock clock;

    public AcquisitionOrchestrator(
        TargetResolver targetResolver,
        SiteDifficultyEstimator difficultyEstimator,
        AcquisitionStrategySelector strategySelector,
        CostController costController,
        ResourcePoolManager poolManager,
        DirectSourceRegistry directSources,
        FeedSource feedSource,
        SmartScraper scraper,
        AcquisitionEventSink eventSink,
        @Qualifier("acquisitionExecutor") ExecutorService acquisitionExecutor,
        @Qualifier("acquisitionRunExecutor") ExecutorService acquisitionRunExecutor,
        AcquisitionProperties properties,
        Clock clock
    ) {
        this.targetResolver = targetResolver;
        this.difficultyEstimator = difficultyEstimator;
        this.strategySelector = strategySelector;
        this.costController = costController;
        this.poolManager = poolManager;
        this.directSources = directSources;
        this.feedSource = feedSource;
        this.scraper = scraper;
        this.eventSink = eventSink;
        this.acquisitionExecutor = acquisitionExecutor;
        this.acquisitionRunExecutor = acquisitionRunExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Blocks until the acquisition finishes or the overall request timeout elapses. Malformed targets raise
     * {@link IllegalArgumentException}; every other failure is reported through the outcome.
     */
    public AcquisitionOutcome acquire(AcquisitionRequest request) {
        long startedNanos = System.nanoTime();
        ResolvedTarget target = targetResolver.resolve(request);
        AtomicReference<StrategyDecision> chosen = new AtomicReference<>();
        AtomicBoolean stepStarted = new AtomicBoolean(false);
        CountDownLatch stepFinished = new CountDownLatch(1);

        Future<AcquisitionOutcome> step = acquisitionExecutor.submit(() -> {
            stepStarted.set(true);
            try {
                return execute(request, target, chosen);
            } finally {
                stepFinished.countDown();
            }
        });

        int requestSeconds = properties.getTimeouts().getRequestSeconds();
        AcquisitionOutcome outcome;
        try {
            outcome = step.get(requestSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            cancelStep(step, stepStarted, stepFinished);
            outcome = cancelled(chosen.get(), "request timed out after " + requestSeconds + "s");
        } catch (InterruptedException e) {
            cancelStep(step, stepStarted, stepFinished);
            Thread.currentThread().interrupt();
            outcome = cancelled(chosen.get(), "cancelled by caller");
        } catch (CancellationException e) {
            outcome = cancelled(chosen.get(), "cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Acquisition {} failed unexpectedly", request.requestId(), cause);
            outcome = AcquisitionOutcome.failure(
                OutcomeKind.TARGET_ERROR,
                chosen.get(),
                ReasonCodeClassifier.UNKNOWN,
                cause.getMessage()
            );
        }

        outcome = outcome.withElapsed(Duration.ofNanos(System.nanoTime() - startedNanos));
        difficultyEstimator.observe(target.host(), outcome.kind());
        emit(request, target, outcome);
        log.info(
            "Acquisition {} for {} finished {} via {} with {} jobs in {}ms (cost {})",
            request.requestId(),
            target.url(),
            outcome.kind(),
            outcome.strategy() == null ? "none" : outcome.strategy().label(),
            outcome.jobs().size(),
            outcome.elapsed().toMillis(),
            outcome.totalCost()
        );
        return outcome;
    }

    /**
     * Starts the acquisition in the background. The target is validated up front.
     */
    public AcquisitionTask submit(AcquisitionRequest request) {
        targetResolver.resolve(request);
        AcquisitionTask task = new AcquisitionTask(request.requestId());
        Future<?> runner = acquisitionRunExecutor.submit(() -> {
            if (!task.markStarted()) {
                return;
            }
            try {
                task.complete(acquire(request));
            } catch (RuntimeException e) {
                task.fail(e);
            }
        });
        task.attach(runner);
        return task;
    }

    private AcquisitionOutcome execute(
        AcquisitionRequest request,
        ResolvedTarget target,
        AtomicReference<StrategyDecision> chosen
    ) {
        SourceAvailability availability = target.availability();
        double difficulty = difficultyEstimator.estimate(target.host());
        StrategyDecision decision = strategySelector.select(request, difficulty, costController.snapshot(), availability);
        chosen.set(decision);
        log.debug("Acquisition {} difficulty {} selected {}", request.requestId(), difficulty, decision.label());

        AcquisitionOutcome outcome;
        try {
            decision = authorize(decision, availability);
            chosen.set(decision);
            outcome = runPlan(request, target, decision, availability, chosen, true);
        } catch (BudgetExceededException e) {
            outcome = AcquisitionOutcome.failure(
                OutcomeKind.BUDGET_EXCEEDED,
                e.getDecision(),
                ReasonCodeClassifier.BUDGET_EXCEEDED,
                e.getMessage()
            );
        } catch (AcquisitionCancelledException e) {
            outcome = cancelled(chosen.get(), e.getMessage()).plusCosts(e.getIncurredCosts());
        }
        costController.record(outcome);
        return outcome;
    }

    private StrategyDecision authorize(StrategyDecision decision, SourceAvailability availability) {
        if (costController.authorize(decision)) {
            return decision;
        }
        Optional<StrategyDecision> cheaper = strategySelector.downgrade(decision, availability);
        if (cheaper.isPresent() && costController.authorize(cheaper.get())) {
            log.info("Budget denied {}; downgraded to {}", decision.label(), cheaper.get().label());
            return cheaper.get();
        }
        throw new BudgetExceededException(decision, "budget denied " + decision.label() + " and every cheaper option");
    }

    private AcquisitionOutcome runPlan(
        AcquisitionRequest request,
        ResolvedTarget target,
        StrategyDecision decision,
        SourceAvailability availability,
        AtomicReference<StrategyDecision> chosen,
        boolean allowFallback
    ) {
        LeaseSet leases;
        try {
            leases = poolManager.leaseAll(decision.requiredKinds(directSources.requiresToken(target.directType())));
        } catch (PoolExhaustedException e) {
            Optional<StrategyDecision> fallback = allowFallback ? structuredFallback(decision, availability) : Optional.empty();
            if (fallback.isPresent() && costController.authorize(fallback.get())) {
                log.info("{} pool exhausted for {}; falling back to {}", e.getKind(), decision.label(), fallback.get().label());
                chosen.set(fallback.get());
                return runPlan(request, target, fallback.get(), availability, chosen, false)
                    .plusFailures(List.of("pool_exhausted: " + e.getKind()));
            }
            return AcquisitionOutcome.failure(
                OutcomeKind.POOL_EXHAUSTED,
                decision,
                ReasonCodeClassifier.POOL_EXHAUSTED,
                e.getMessage()
            );
        }

        try (leases) {
            AcquisitionOutcome outcome = runAttempts(request, target, decision, leases);
            if (outcome.isSuccess()) {
                leases.markSucceeded();
            } else if (outcome.kind() == OutcomeKind.CANCELLED) {
                leases.markAllNeutral();
            }
            return outcome;
        }
    }

    private AcquisitionOutcome runAttempts(
        AcquisitionRequest request,
        ResolvedTarget target,
        StrategyDecision decision,
        LeaseSet leases
    ) {
        int maxAttempts = Math.max(1, properties.getRetry().getMaxAttempts());
        Map<String, Double> earlierSpend = new LinkedHashMap<>();
        List<String> earlierFailures = new ArrayList<>();
        AcquisitionOutcome outcome = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            boolean retryable;
            try {
                outcome = executeOnce(request, target, decision, leases);
                retryable = outcome.kind() == OutcomeKind.TARGET_ERROR
                    && ReasonCodeClassifier.isRetryable(outcome.errorCode());
            } catch (AnalysisException e) {
                outcome = AcquisitionOutcome.failure(
                    OutcomeKind.ANALYSIS_ERROR,
                    decision,
                    ReasonCodeClassifier.ANALYSIS_FAILED,
                    e.getMessage()
                ).plusFailures(e.getFailures()).plusCosts(e.getIncurredCosts());
                retryable = true;
            } catch (SourceFetchException e) {
                if (ReasonCodeClassifier.CANCELLED.equals(e.getReasonCode())) {
                    throw new AcquisitionCancelledException(e.getMessage(), e);
                }
                outcome = AcquisitionOutcome.failure(OutcomeKind.TARGET_ERROR, decision, e.getReasonCode(), e.getMessage());
                retryable = e.isRetryable();
            } catch (AcquisitionCancelledException e) {
                return cancelled(decision, e.getMessage())
                    .plusCosts(e.getIncurredCosts())
                    .plusCosts(earlierSpend)
                    .plusFailures(earlierFailures)
                    .withAttempts(attempt);
            } catch (RuntimeException e) {
                log.warn("Attempt {} of {} on {} failed", attempt, decision.label(), target.url(), e);
                outcome = AcquisitionOutcome.failure(
                    OutcomeKind.TARGET_ERROR,
                    decision,
                    ReasonCodeClassifier.UNKNOWN,
                    e.getMessage()
                );
                retryable = false;
            }
            outcome = outcome.withAttempts(attempt);
            if (Thread.currentThread().isInterrupted()) {
                return cancelled(decision, "interrupted")
                    .plusCosts(outcome.costByProvider())
                    .plusCosts(earlierSpend)
                    .plusFailures(earlierFailures)
                    .withAttempts(attempt);
            }
            if (outcome.isSuccess() || !retryable || attempt == maxAttempts) {
                break;
            }
            log.info(
                "Attempt {} of {} on {} failed with {}; retrying",
                attempt,
                decision.label(),
                target.url(),
                outcome.errorCode()
            );
            outcome.costByProvider().forEach((provider, cost) -> earlierSpend.merge(provider, cost, Double::sum));
            earlierFailures.add("attempt " + attempt + ": " + outcome.errorCode() + " " + outcome.errorMessage());
            earlierFailures.addAll(outcome.failures());
            backoff(attempt);
        }
        return outcome.plusCosts(earlierSpend).plusFailures(earlierFailures);
    }

    private AcquisitionOutcome executeOnce(
        AcquisitionRequest request,
        ResolvedTarget target,
        StrategyDecision decision,
        LeaseSet leases
    ) {
        RequestIdentity identity = new RequestIdentity(
            leases.valueOf(ResourceKind.IDENTITY),
            leases.valueOf(ResourceKind.PROXY),
            leases.valueOf(ResourceKind.TOKEN)
        );
        return switch (decision.tier()) {
            case DIRECT_API -> {
                DirectSource source = directSources.find(target.directType())
                    .orElseThrow(() -> new SourceFetchException(
                        ReasonCodeClassifier.INVALID_TARGET,
                        0,
                        "no direct source for " + target.directType()
                    ));
                List<NormalizedJobPosting> jobs = source.fetch(target.directBoard(), request.search(), identity);
                yield AcquisitionOutcome.success(jobs, decision, Map.of(), List.of());
            }
            case FEED_SUBSCRIBE -> AcquisitionOutcome.success(
                feedSource.fetch(target.feedUrl(), request.search(), identity),
                decision,
                Map.of(),
                List.of()
            );
            case VISUAL_SCRAPE -> scraper.scrape(target, decision, leases, request.search());
        };
    }

    private Optional<StrategyDecision> structuredFallback(StrategyDecision decision, SourceAvailability availability) {
        return switch (decision.tier()) {
            case VISUAL_SCRAPE -> {
                if (availability.directApiKnown()) {
                    yield Optional.of(StrategyDecision.directApi());
                }
                yield availability.feedKnown() ? Optional.of(StrategyDecision.feedSubscribe()) : Optional.empty();
            }
            case FEED_SUBSCRIBE -> availability.directApiKnown()
                ? Optional.of(StrategyDecision.directApi())
                : Optional.empty();
            case DIRECT_API -> Optional.empty();
        };
    }

    private void backoff(int attempt) {
        long delayMs = (long) properties.getRetry().getBackoffMs() * attempt;
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionCancelledException("interrupted during retry backoff", e);
        }
    }

    private void cancelStep(Future<?> step, AtomicBoolean stepStarted, CountDownLatch stepFinished) {
        step.cancel(true);
        if (!stepStarted.get()) {
            return;
        }
        try {
            if (!stepFinished.await(properties.getTimeouts().getCleanupGraceMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Cancelled acquisition step did not finish within the cleanup grace period");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static AcquisitionOutcome cancelled(StrategyDecision decision, String message) {
        return AcquisitionOutcome.failure(OutcomeKind.CANCELLED, decision, ReasonCodeClassifier.CANCELLED, message);
    }

    private void emit(AcquisitionRequest request, ResolvedTarget target, AcquisitionOutcome outcome) {
        AcquisitionEvent event = new AcquisitionEvent(
            request.requestId(),
            request.target(),
            target.host(),
            outcome.strategy() == null ? null : outcome.strategy().label(),
            outcome.kind(),
            outcome.totalCost(),
            outcome.elapsed(),
            outcome.attempts(),
            outcome.jobs().size(),
            outcome.errorCode(),
            outcome.errorMessage(),
            outcome.failures(),
            clock.instant()
        );
        try {
            eventSink.emit(event);
        } catch (RuntimeException e) {
            log.warn("Failed to emit acquisition event for {}", request.requestId(), e);
        }
    }
}
