package com.delta.acquisition.acquire.cost;

import com.delta.acquisition.acquire.model.CostTier;
import com.delta.acquisition.config.AcquisitionProperties;

import java.util.List;

/**
 * Hour ranges mapped to the most expensive tier allowed in them. Hours without a rule allow every tier;
 * the first matching rule wins.
 */
public class TimeOfDayPolicy {
    private final List<AcquisitionProperties.TimeOfDayRule> rules;

    public TimeOfDayPolicy(List<AcquisitionProperties.TimeOfDayRule> rules) {
        this.rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public CostTier maxTierAt(int hour) {
        for (AcquisitionProperties.TimeOfDayRule rule : rules) {
            if (rule.covers(hour) && rule.getMaxTier() != null) {
                return rule.getMaxTier();
            }
        }
        return CostTier.REMOTE_VISION;
    }

    public boolean allows(CostTier requested, int hour) {
        return maxTierAt(hour).allows(requested);
    }
}
