package com.kotsin.optionsengine.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ScalpingSummary {
    int totalTrades;
    double weightedWinRatePct;
    double avgReturnPct;
    double totalPnl;
    StrategyKind bestStrategy;
    Map<StrategyKind, StrategyPerformance> breakdown;
}
