package com.kotsin.optionsengine.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MarketState {

    VolatilityRegime volatilityRegime;
    TrendDirection trend;
    double volatility;

    public static MarketState of(double volatility, TrendDirection trend) {
        return MarketState.builder()
                .volatility(volatility)
                .volatilityRegime(VolatilityRegime.of(volatility))
                .trend(trend)
                .build();
    }
}
