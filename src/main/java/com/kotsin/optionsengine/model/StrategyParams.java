package com.kotsin.optionsengine.model;

import lombok.Builder;
import lombok.Value;

/**
 * Adaptive-scalp thresholds for one leg, rewritten on every retune.
 */
@Value
@Builder(toBuilder = true)
public class StrategyParams {

    public static final StrategyParams BASE = StrategyParams.builder()
            .targetMultiplier(2.0)
            .maxHoldingMinutes(4)
            .minSignalStrength(2.0)
            .trailingActivationPct(0.5)
            .entryThreshold(3.0)
            .build();

    double targetMultiplier;
    int maxHoldingMinutes;
    double minSignalStrength;
    double trailingActivationPct;
    double entryThreshold;
}
