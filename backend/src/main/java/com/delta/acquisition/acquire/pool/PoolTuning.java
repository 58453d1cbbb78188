package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.config.AcquisitionProperties;

public record PoolTuning(
    double decayFactor,
    double healthFloor,
    double recoveryStep
) {
    public static PoolTuning from(AcquisitionProperties.Pools pools) {
        return new PoolTuning(pools.getDecayFactor(), pools.getHealthFloor(), pools.getRecoveryStep());
    }
}
