package com.delta.acquisition.acquire.scraper;

import com.delta.acquisition.acquire.service.AcquisitionCancelledException;
import com.delta.acquisition.config.AcquisitionProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Random;

/**
 * Randomized pauses and pointer wander parameters.
 */
@Component
public class JitterPolicy {
    private final int stabilizeMinMs;
    private final int stabilizeMaxMs;
    private final int pointerStepsMin;
    private final int pointerStepsMax;
    private final int pointerStepDelayMs;
    private final Random random;

    @Autowired
    public JitterPolicy(AcquisitionProperties properties) {
        this(
            properties.getScraper().getStabilizeMinMs(),
            properties.getScraper().getStabilizeMaxMs(),
            properties.getScraper().getPointerStepsMin(),
            properties.getScraper().getPointerStepsMax(),
            properties.getScraper().getPointerStepDelayMs(),
            new Random()
        );
    }

    public JitterPolicy(
        int stabilizeMinMs,
        int stabilizeMaxMs,
        int pointerStepsMin,
        int pointerStepsMax,
        int pointerStepDelayMs,
        Random random
    ) {
        this.stabilizeMinMs = Math.max(0, stabilizeMinMs);
        this.stabilizeMaxMs = Math.max(this.stabilizeMinMs, stabilizeMaxMs);
        this.pointerStepsMin = Math.max(1, pointerStepsMin);
        this.pointerStepsMax = Math.max(this.pointerStepsMin, pointerStepsMax);
        this.pointerStepDelayMs = Math.max(0, pointerStepDelayMs);
        this.random = random;
    }

    public Duration stabilizeDelay() {
        return Duration.ofMillis(between(stabilizeMinMs, stabilizeMaxMs));
    }

    public int pointerSteps() {
        return between(pointerStepsMin, pointerStepsMax);
    }

    public Duration pointerStepDelay() {
        return Duration.ofMillis(pointerStepDelayMs);
    }

    public Random random() {
        return random;
    }

    /**
     * Sleeps for the given duration; interruption surfaces as cancellation with the interrupt flag kept.
     */
    public void pause(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionCancelledException("interrupted while waiting", e);
        }
    }

    private int between(int min, int max) {
        if (max <= min) {
            return min;
        }
        return min + random.nextInt(max - min + 1);
    }
}
