package com.kotsin.optionsengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Point-in-time copy of the session counters kept by the position store.
 */
@Value
@Builder
public class AggregateStats {
    double totalPnl;
    double dailyPnl;
    int wins;
    int losses;
    int tradesToday;
    LocalDate tradingDay;
    Map<IndexName, Double> indexPnl;
    Map<IndexName, Integer> indexTrades;
    Map<StrategyKind, StrategyStats> strategyStats;
    Map<LocalDate, DailyPerformance> scalpingPerformanceByDay;
    Map<TimeOfDayBucket, StrategyStats> timeOfDayStats;

    public int totalTrades() {
        return wins + losses;
    }

    public double winRatePct() {
        int closed = totalTrades();
        return closed == 0 ? 0.0 : wins * 100.0 / closed;
    }
}
