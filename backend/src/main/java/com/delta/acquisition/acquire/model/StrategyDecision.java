package com.delta.acquisition.acquire.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

public record StrategyDecision(
    StrategyTier tier,
    VisionMode visionMode
) {
    public StrategyDecision {
        Objects.requireNonNull(tier, "tier");
        if (tier == StrategyTier.VISUAL_SCRAPE && visionMode == null) {
            throw new IllegalArgumentException("visual scrape requires a vision mode");
        }
        if (tier != StrategyTier.VISUAL_SCRAPE && visionMode != null) {
            throw new IllegalArgumentException("vision mode only applies to visual scrape");
        }
    }

    public static StrategyDecision directApi() {
        return new StrategyDecision(StrategyTier.DIRECT_API, null);
    }

    public static StrategyDecision feedSubscribe() {
        return new StrategyDecision(StrategyTier.FEED_SUBSCRIBE, null);
    }

    public static StrategyDecision visual(VisionMode mode) {
        return new StrategyDecision(StrategyTier.VISUAL_SCRAPE, mode);
    }

    public boolean isVisual() {
        return tier == StrategyTier.VISUAL_SCRAPE;
    }

    public boolean usesRemoteVision() {
        return isVisual() && visionMode.usesRemote();
    }

    public CostTier costTier() {
        return switch (tier) {
            case DIRECT_API -> CostTier.DIRECT_API;
            case FEED_SUBSCRIBE -> CostTier.FEED;
            case VISUAL_SCRAPE -> visionMode.usesRemote() ? CostTier.REMOTE_VISION : CostTier.LOCAL_VISION;
        };
    }

    /**
     * Resource kinds this decision leases before executing. The worker slot always comes first.
     */
    public Set<ResourceKind> requiredKinds(boolean directSourceNeedsToken) {
        Set<ResourceKind> kinds = EnumSet.of(ResourceKind.WORKER, ResourceKind.IDENTITY, ResourceKind.PROXY);
        switch (tier) {
            case DIRECT_API -> {
                if (directSourceNeedsToken) {
                    kinds.add(ResourceKind.TOKEN);
                }
            }
            case FEED_SUBSCRIBE -> {
            }
            case VISUAL_SCRAPE -> {
                kinds.add(ResourceKind.SESSION);
                if (visionMode.usesLocal()) {
                    kinds.add(ResourceKind.PARSER);
                }
                if (visionMode.usesRemote()) {
                    kinds.add(ResourceKind.TOKEN);
                }
            }
        }
        return kinds;
    }

    public String label() {
        return isVisual() ? tier.name() + "/" + visionMode.name() : tier.name();
    }
}
