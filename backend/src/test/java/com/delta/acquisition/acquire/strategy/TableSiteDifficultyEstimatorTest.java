package com.delta.acquisition.acquire.strategy;

import com.delta.acquisition.acquire.model.OutcomeKind;
import com.delta.acquisition.config.AcquisitionProperties;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TableSiteDifficultyEstimatorTest {

    @Test
    void curatedTableMatchesHostAndParentDomains() {
        TableSiteDifficultyEstimator estimator = estimator(new AcquisitionProperties());

        assertEquals(0.95, estimator.estimate("www.linkedin.com"), 1e-9);
        assertEquals(0.95, estimator.estimate("careers.LinkedIn.com"), 1e-9);
        assertEquals(0.7, estimator.estimate("acme.wd5.myworkdayjobs.com"), 1e-9);
        assertEquals(0.1, estimator.estimate("boards.greenhouse.io"), 1e-9);
    }

    @Test
    void unknownHostUsesConfiguredDefault() {
        AcquisitionProperties properties = new AcquisitionProperties();
        properties.getStrategy().setDefaultDifficulty(0.4);
        TableSiteDifficultyEstimator estimator = estimator(properties);

        assertEquals(0.4, estimator.estimate("jobs.example.org"), 1e-9);
        assertEquals(0.4, estimator.estimate(null), 1e-9);
        assertEquals(0.4, estimator.estimate("  "), 1e-9);
    }

    @Test
    void configuredSiteOverridesTable() {
        AcquisitionProperties properties = new AcquisitionProperties();
        AcquisitionProperties.Site site = new AcquisitionProperties.Site();
        site.setUrl("https://www.indeed.com/jobs");
        site.setDifficulty(0.55);
        properties.getSites().put("indeed", site);

        assertEquals(0.55, estimator(properties).estimate("indeed.com"), 1e-9);
    }

    @Test
    void missingTableFallsBackToDefault() {
        AcquisitionProperties properties = new AcquisitionProperties();
        properties.getStrategy().setDifficultyTable("classpath:does-not-exist.csv");

        assertEquals(0.3, estimator(properties).estimate("linkedin.com"), 1e-9);
    }

    @Test
    void blockedOutcomesRaiseAndSuccessesLowerDifficulty() {
        AcquisitionProperties properties = new AcquisitionProperties();
        properties.getStrategy().setLearningRate(0.5);
        TableSiteDifficultyEstimator estimator = estimator(properties);

        estimator.observe("jobs.example.org", OutcomeKind.BLOCKED);
        assertEquals(0.65, estimator.estimate("jobs.example.org"), 1e-9);

        estimator.observe("jobs.example.org", OutcomeKind.SUCCESS);
        assertEquals(0.325, estimator.estimate("jobs.example.org"), 1e-9);
    }

    @Test
    void neutralOutcomesDoNotMoveTheEstimate() {
        TableSiteDifficultyEstimator estimator = estimator(new AcquisitionProperties());

        estimator.observe("indeed.com", OutcomeKind.CANCELLED);
        estimator.observe("indeed.com", OutcomeKind.POOL_EXHAUSTED);
        estimator.observe("indeed.com", OutcomeKind.BUDGET_EXCEEDED);

        assertEquals(0.9, estimator.estimate("indeed.com"), 1e-9);
    }

    @Test
    void learnedEstimateStaysWithinBounds() {
        AcquisitionProperties properties = new AcquisitionProperties();
        properties.getStrategy().setLearningRate(1.0);
        TableSiteDifficultyEstimator estimator = estimator(properties);

        for (int i = 0; i < 5; i++) {
            estimator.observe("linkedin.com", OutcomeKind.BLOCKED);
        }
        double estimate = estimator.estimate("linkedin.com");
        assertTrue(estimate <= 1.0 && estimate >= 0.0);
        assertEquals(1.0, estimate, 1e-9);
    }

    private static TableSiteDifficultyEstimator estimator(AcquisitionProperties properties) {
        return new TableSiteDifficultyEstimator(properties, new DefaultResourceLoader());
    }
}
