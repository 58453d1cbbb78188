package com.delta.acquisition.acquire.vision;

import com.delta.acquisition.acquire.model.ActionableElement;
import com.delta.acquisition.acquire.model.JobListingCandidate;
import com.delta.acquisition.acquire.model.PageSnapshot;
import com.delta.acquisition.acquire.model.VisionAnalysisResult;
import com.delta.acquisition.acquire.model.VisionMode;
import com.delta.acquisition.acquire.service.AcquisitionCancelledException;
import com.delta.acquisition.config.AcquisitionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the local and/or remote vision providers for a snapshot. In hybrid mode both run concurrently and
 * their candidates are fused; if one of them fails the other's result is returned with the failure noted.
 */
@Service
public class VisionAnalysisService {
    private static final Logger log = LoggerFactory.getLogger(VisionAnalysisService.class);

    private final VisionProvider localProvider;
    private final VisionProvider remoteProvider;
    private final CandidateFusion fusion;
    private final ExecutorService visionExecutor;
    private final Duration defaultTimeout;

    @Autowired
    public VisionAnalysisService(
        LocalModelVisionProvider localProvider,
        RemoteVisionProvider remoteProvider,
        CandidateFusion fusion,
        @Qualifier("visionExecutor") ExecutorService visionExecutor,
        AcquisitionProperties properties
    ) {
        this(
            (VisionProvider) localProvider,
            (VisionProvider) remoteProvider,
            fusion,
            visionExecutor,
            Duration.ofSeconds(properties.getTimeouts().getAnalysisSeconds())
        );
    }

    public VisionAnalysisService(
        VisionProvider localProvider,
        VisionProvider remoteProvider,
        CandidateFusion fusion,
        ExecutorService visionExecutor,
        Duration defaultTimeout
    ) {
        this.localProvider = localProvider;
        this.remoteProvider = remoteProvider;
        this.fusion = fusion;
        this.visionExecutor = visionExecutor;
        this.defaultTimeout = defaultTimeout;
    }

    public VisionAnalysisResult analyze(PageSnapshot snapshot, VisionMode mode, VisionCallContext context) {
        if (snapshot == null || !snapshot.isUsable()) {
            throw new AnalysisException("snapshot has neither a screenshot nor DOM content");
        }
        VisionMode requested = mode == null ? VisionMode.LOCAL_ONLY : mode;
        Duration timeout = context == null || context.timeout() == null ? defaultTimeout : context.timeout();
        VisionCallContext callContext = context == null
            ? VisionCallContext.defaults(timeout)
            : new VisionCallContext(context.parserEndpoint(), context.apiToken(), timeout);

        long startedAt = System.nanoTime();
        long deadline = startedAt + timeout.toNanos();
        Future<ProviderResult> localFuture = requested.usesLocal() ? submit(localProvider, snapshot, callContext) : null;
        Future<ProviderResult> remoteFuture = requested.usesRemote() ? submit(remoteProvider, snapshot, callContext) : null;

        List<String> failures = new ArrayList<>();
        Map<String, Double> costs = new LinkedHashMap<>();
        ProviderResult local = null;
        ProviderResult remote;
        boolean localAwaited = false;
        try {
            local = await(localFuture, localProvider, deadline, failures, costs);
            localAwaited = true;
            remote = await(remoteFuture, remoteProvider, deadline, failures, costs);
        } catch (AcquisitionCancelledException e) {
            cancel(localFuture);
            cancel(remoteFuture);
            if (localAwaited) {
                addCost(costs, local);
            } else {
                harvest(localFuture, costs);
            }
            harvest(remoteFuture, costs);
            throw e.plusIncurredCosts(costs);
        }

        if (local == null && remote == null) {
            throw new AnalysisException("vision analysis failed: " + String.join("; ", failures), failures, costs, null);
        }
        addCost(costs, local);
        addCost(costs, remote);

        VisionAnalysisResult result;
        if (local != null && remote != null) {
            CandidateFusion.Fused fused = fusion.fuse(local, remote);
            result = build(fused.candidates(), fused.confidence(), VisionMode.HYBRID, fused.actionableElement(), costs, failures);
        } else if (local != null) {
            result = build(local.candidates(), local.confidence(), VisionMode.LOCAL_ONLY, local.actionableElement(), costs, failures);
        } else {
            result = build(remote.candidates(), remote.confidence(), VisionMode.CLOUD_ONLY, remote.actionableElement(), costs, failures);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
        if (!failures.isEmpty()) {
            log.warn("Vision {} degraded to {} on {}: {}", requested, result.mode(), snapshot.url(), failures);
        }
        log.info(
            "Vision {} found {} candidates on {} (confidence {})",
            result.mode(),
            result.candidates().size(),
            snapshot.url(),
            String.format(Locale.ROOT, "%.2f", result.confidence())
        );
        return result.withElapsed(elapsed);
    }

    private Future<ProviderResult> submit(VisionProvider provider, PageSnapshot snapshot, VisionCallContext context) {
        return visionExecutor.submit(() -> provider.analyze(snapshot, context));
    }

    private ProviderResult await(
        Future<ProviderResult> future,
        VisionProvider provider,
        long deadline,
        List<String> failures,
        Map<String, Double> failedSpend
    ) {
        if (future == null) {
            return null;
        }
        long remaining = Math.max(0L, deadline - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            failures.add(provider.providerId() + ": timeout");
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof AcquisitionCancelledException cancelled) {
                throw cancelled;
            }
            if (cause instanceof AnalysisException analysis) {
                analysis.getIncurredCosts().forEach((id, cost) -> failedSpend.merge(id, cost, Double::sum));
            }
            failures.add(provider.providerId() + ": " + cause.getMessage());
            return null;
        } catch (CancellationException e) {
            throw new AcquisitionCancelledException("vision call cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionCancelledException("vision analysis interrupted", e);
        }
    }

    /**
     * Collects the spend of a provider call that had already completed when the analysis was cancelled.
     */
    private static void harvest(Future<ProviderResult> future, Map<String, Double> costs) {
        if (future == null || !future.isDone() || future.isCancelled()) {
            return;
        }
        try {
            addCost(costs, future.get());
        } catch (ExecutionException e) {
            if (e.getCause() instanceof AnalysisException analysis) {
                analysis.getIncurredCosts().forEach((id, cost) -> costs.merge(id, cost, Double::sum));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void cancel(Future<?> future) {
        if (future != null) {
            future.cancel(true);
        }
    }

    private static void addCost(Map<String, Double> costs, ProviderResult result) {
        if (result != null && result.cost() > 0.0) {
            costs.merge(result.providerId(), result.cost(), Double::sum);
        }
    }

    private static VisionAnalysisResult build(
        List<JobListingCandidate> candidates,
        double confidence,
        VisionMode mode,
        ActionableElement action,
        Map<String, Double> costs,
        List<String> failures
    ) {
        return new VisionAnalysisResult(candidates, confidence, mode, Duration.ZERO, action, costs, failures);
    }
}
