package com.kotsin.optionsengine.service;

import com.kotsin.optionsengine.model.ScalpingSummary;
import com.kotsin.optionsengine.model.StrategyKind;
import com.kotsin.optionsengine.model.StrategyPerformance;
import com.kotsin.optionsengine.model.TradeRecord;
import com.kotsin.optionsengine.trading.PositionStore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-strategy performance views computed from the closed-trade history.
 */
@Service
public class TradePerformanceService {

    private final PositionStore positionStore;

    public TradePerformanceService(PositionStore positionStore) {
        this.positionStore = positionStore;
    }

    public StrategyPerformance performance(StrategyKind kind) {
        return performance(kind, positionStore.history());
    }

    public ScalpingSummary scalpingSummary() {
        List<TradeRecord> history = positionStore.history();
        Map<StrategyKind, StrategyPerformance> breakdown = new EnumMap<>(StrategyKind.class);
        int totalTrades = 0;
        double weightedWins = 0.0;
        double returnSum = 0.0;
        double totalPnl = 0.0;
        StrategyKind best = null;
        double bestWinRate = -1.0;

        for (StrategyKind kind : StrategyKind.values()) {
            if (!kind.isScalping()) {
                continue;
            }
            StrategyPerformance perf = performance(kind, history);
            breakdown.put(kind, perf);
            if (perf.getTotalTrades() == 0) {
                continue;
            }
            totalTrades += perf.getTotalTrades();
            weightedWins += perf.getWinRatePct() * perf.getTotalTrades();
            returnSum += perf.getAvgReturnPct() * perf.getTotalTrades();
            totalPnl += perf.getTotalPnl();
            if (perf.getWinRatePct() > bestWinRate) {
                bestWinRate = perf.getWinRatePct();
                best = kind;
            }
        }

        return ScalpingSummary.builder()
                .totalTrades(totalTrades)
                .weightedWinRatePct(totalTrades == 0 ? 0.0 : weightedWins / totalTrades)
                .avgReturnPct(totalTrades == 0 ? 0.0 : returnSum / totalTrades)
                .totalPnl(totalPnl)
                .bestStrategy(best)
                .breakdown(breakdown)
                .build();
    }

    static StrategyPerformance performance(StrategyKind kind, List<TradeRecord> history) {
        List<TradeRecord> trades = new ArrayList<>();
        for (TradeRecord record : history) {
            if (record.getStrategyKind() == kind) {
                trades.add(record);
            }
        }
        if (trades.isEmpty()) {
            return StrategyPerformance.empty(kind);
        }
        int wins = 0;
        double returns = 0.0;
        double pnl = 0.0;
        double minutes = 0.0;
        double bestTrade = Double.NEGATIVE_INFINITY;
        double worstTrade = Double.POSITIVE_INFINITY;
        for (TradeRecord record : trades) {
            if (record.isWin()) wins++;
            returns += record.getPnlPct();
            pnl += record.getPnl();
            minutes += record.durationMinutes();
            bestTrade = Math.max(bestTrade, record.getPnl());
            worstTrade = Math.min(worstTrade, record.getPnl());
        }
        int n = trades.size();
        return StrategyPerformance.builder()
                .strategy(kind)
                .totalTrades(n)
                .wins(wins)
                .winRatePct(wins * 100.0 / n)
                .avgReturnPct(returns / n)
                .totalPnl(pnl)
                .avgDurationMinutes(minutes / n)
                .bestTrade(bestTrade)
                .worstTrade(worstTrade)
                .build();
    }
}
