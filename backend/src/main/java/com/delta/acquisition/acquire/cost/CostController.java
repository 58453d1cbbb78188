package com.delta.acquisition.acquire.cost;

import com.delta.acquisition.acquire.model.AcquisitionOutcome;
import com.delta.acquisition.acquire.model.BudgetSnapshot;
import com.delta.acquisition.acquire.model.CostTier;
import com.delta.acquisition.acquire.model.ProviderBudget;
import com.delta.acquisition.acquire.model.StrategyDecision;
import com.delta.acquisition.config.AcquisitionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Owns the process-wide budget ledger. Every read and write of the ledger goes through a synchronized method.
 */
@Service
public class CostController {
    private static final Logger log = LoggerFactory.getLogger(CostController.class);

    private final Clock clock;
    private final ZoneId zone;
    private final Map<String, Double> dailyCaps;
    private final TimeOfDayPolicy timeOfDayPolicy;
    private final String remoteProviderId;
    private final double estimatedRemoteCallCost;
    private final BudgetLedger ledger;

    public CostController(AcquisitionProperties properties, Clock clock) {
        this.clock = clock;
        this.zone = ZoneId.of(properties.getCost().getZone());
        this.dailyCaps = new LinkedHashMap<>(properties.getCost().getDailyCaps());
        this.timeOfDayPolicy = new TimeOfDayPolicy(properties.getCost().getTimeOfDay());
        this.remoteProviderId = properties.getVision().getRemote().getProviderId();
        this.estimatedRemoteCallCost = properties.getVision().getRemote().getEstimatedCallCost();
        this.ledger = new BudgetLedger(today());
    }

    /**
     * Allowed when the time-of-day policy permits the decision's tier and no paid provider it uses would go
     * over its daily cap.
     */
    public synchronized boolean authorize(StrategyDecision decision) {
        rollIfNeeded();
        CostTier tier = decision.costTier();
        int hour = now().getHour();
        if (!timeOfDayPolicy.allows(tier, hour)) {
            log.info("Denied {}: tier {} not allowed at hour {}", decision.label(), tier, hour);
            return false;
        }
        if (decision.usesRemoteVision()) {
            ProviderBudget budget = budgetFor(remoteProviderId);
            if (budget.isExceeded() || budget.wouldExceed(estimatedRemoteCallCost)) {
                log.info(
                    "Denied {}: {} spent {} of cap {}",
                    decision.label(),
                    remoteProviderId,
                    budget.spent(),
                    budget.dailyCap()
                );
                return false;
            }
        }
        return true;
    }

    public synchronized void record(AcquisitionOutcome outcome) {
        if (outcome == null || outcome.costByProvider().isEmpty()) {
            return;
        }
        rollIfNeeded();
        outcome.costByProvider().forEach(ledger::add);
    }

    public synchronized BudgetSnapshot snapshot() {
        rollIfNeeded();
        Set<String> providers = new LinkedHashSet<>(dailyCaps.keySet());
        providers.addAll(ledger.spentByProvider().keySet());
        Map<String, ProviderBudget> budgets = new LinkedHashMap<>();
        for (String provider : providers) {
            budgets.put(provider, budgetFor(provider));
        }
        return new BudgetSnapshot(ledger.windowStart(), remoteProviderId, budgets);
    }

    private ProviderBudget budgetFor(String provider) {
        return new ProviderBudget(provider, ledger.spent(provider), dailyCaps.get(provider));
    }

    private void rollIfNeeded() {
        LocalDate today = today();
        if (ledger.rollTo(today)) {
            log.info("Budget window rolled over to {}", today);
        }
    }

    private ZonedDateTime now() {
        return ZonedDateTime.now(clock.withZone(zone));
    }

    private LocalDate today() {
        return now().toLocalDate();
    }
}
