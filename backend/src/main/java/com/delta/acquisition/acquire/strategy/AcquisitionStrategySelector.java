package com.delta.acquisition.acquire.strategy;

import com.delta.acquisition.acquire.model.AcquisitionRequest;
import com.delta.acquisition.acquire.model.BudgetSnapshot;
import com.delta.acquisition.acquire.model.SourceAvailability;
import com.delta.acquisition.acquire.model.StrategyDecision;
import com.delta.acquisition.acquire.model.VisionMode;
import com.delta.acquisition.config.AcquisitionProperties;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Picks the cheapest acquisition strategy that should still work. The result depends only on the arguments.
 */
@Component
public class AcquisitionStrategySelector {
    private final double cloudThreshold;
    private final double hybridThreshold;

    public AcquisitionStrategySelector(AcquisitionProperties properties) {
        this.cloudThreshold = properties.getStrategy().getCloudThreshold();
        this.hybridThreshold = properties.getStrategy().getHybridThreshold();
    }

    public StrategyDecision select(
        AcquisitionRequest request,
        double siteDifficulty,
        BudgetSnapshot budget,
        SourceAvailability availability
    ) {
        SourceAvailability sources = availability == null ? SourceAvailability.none() : availability;
        StrategyDecision decision = baseDecision(request, clampDifficulty(siteDifficulty), sources);
        return applyBudget(decision, budget);
    }

    /**
     * The next cheaper strategy, or empty when nothing cheaper is known.
     */
    public Optional<StrategyDecision> downgrade(StrategyDecision decision, SourceAvailability availability) {
        SourceAvailability sources = availability == null ? SourceAvailability.none() : availability;
        return switch (decision.tier()) {
            case VISUAL_SCRAPE -> switch (decision.visionMode()) {
                case CLOUD_ONLY, HYBRID -> Optional.of(StrategyDecision.visual(VisionMode.LOCAL_ONLY));
                case LOCAL_ONLY -> structuredPath(sources);
            };
            case FEED_SUBSCRIBE -> sources.directApiKnown()
                ? Optional.of(StrategyDecision.directApi())
                : Optional.empty();
            case DIRECT_API -> Optional.empty();
        };
    }

    private StrategyDecision baseDecision(AcquisitionRequest request, double difficulty, SourceAvailability sources) {
        if (request.costSensitive()) {
            return structuredPath(sources).orElse(StrategyDecision.visual(VisionMode.LOCAL_ONLY));
        }
        if (request.accuracyCritical()) {
            return StrategyDecision.visual(VisionMode.CLOUD_ONLY);
        }
        if (difficulty > cloudThreshold) {
            return StrategyDecision.visual(VisionMode.CLOUD_ONLY);
        }
        if (difficulty > hybridThreshold) {
            return StrategyDecision.visual(VisionMode.HYBRID);
        }
        return StrategyDecision.visual(VisionMode.LOCAL_ONLY);
    }

    private StrategyDecision applyBudget(StrategyDecision decision, BudgetSnapshot budget) {
        if (budget != null && decision.usesRemoteVision() && budget.remoteVisionExceeded()) {
            return StrategyDecision.visual(VisionMode.LOCAL_ONLY);
        }
        return decision;
    }

    private Optional<StrategyDecision> structuredPath(SourceAvailability sources) {
        if (sources.directApiKnown()) {
            return Optional.of(StrategyDecision.directApi());
        }
        if (sources.feedKnown()) {
            return Optional.of(StrategyDecision.feedSubscribe());
        }
        return Optional.empty();
    }

    private double clampDifficulty(double difficulty) {
        if (Double.isNaN(difficulty)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, difficulty));
    }
}
