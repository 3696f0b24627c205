package com.kotsin.optionsengine.model;

import lombok.Builder;
import lombok.Value;

/**
 * Latest directional read for one leg. Positive direction favours buying the leg.
 */
@Value
@Builder
public class Signal {

    public static final Signal NEUTRAL = Signal.builder()
            .direction(0)
            .strength(0.0)
            .trend(TrendDirection.NEUTRAL)
            .build();

    int direction;
    double strength;
    TrendDirection trend;
}
