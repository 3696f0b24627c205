package com.kotsin.optionsengine.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StrategyPerformance {

    StrategyKind strategy;
    int totalTrades;
    int wins;
    double winRatePct;
    double avgReturnPct;
    double totalPnl;
    double avgDurationMinutes;
    double bestTrade;
    double worstTrade;

    public static StrategyPerformance empty(StrategyKind kind) {
        return StrategyPerformance.builder().strategy(kind).build();
    }
}
