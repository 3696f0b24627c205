package com.kotsin.optionsengine.model;

import lombok.Builder;
import lombok.Value;

/** Counters for one strategy kind or one time-of-day bucket. */
@Value
@Builder
public class StrategyStats {

    public static final StrategyStats EMPTY = StrategyStats.builder().build();

    int trades;
    int wins;
    int losses;
    double pnl;
}
