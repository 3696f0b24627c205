package com.kotsin.optionsengine.strategy;

import com.kotsin.optionsengine.analysis.MarketStateClassifier;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.MarketState;
import com.kotsin.optionsengine.model.OptionLeg;
import com.kotsin.optionsengine.model.StrategyKind;
import com.kotsin.optionsengine.model.StrategyParams;
import com.kotsin.optionsengine.model.TradeRecord;
import com.kotsin.optionsengine.model.TrendDirection;
import com.kotsin.optionsengine.model.VolatilityRegime;
import com.kotsin.optionsengine.trading.TradeRecordListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Re-derives the adaptive-scalp thresholds of each leg from its current set, using the market
 * state of the index and the recent adaptive win rate. Successive retunes compound until
 * {@link #reset()}. Never opens or closes positions.
 */
@Service
@Slf4j
public class AdaptiveTuner implements TradeRecordListener {

    public static final int PERFORMANCE_WINDOW = 20;
    static final double DEFAULT_WIN_RATE = 0.5;
    static final double MIN_TARGET_MULTIPLIER = 1.5;
    static final double MIN_ENTRY_THRESHOLD = 2.0;
    static final int MIN_HOLDING_MINUTES = 2;
    static final int MAX_HOLDING_MINUTES = 8;

    private final MarketStateClassifier classifier;
    private final Map<InstrumentKey, StrategyParams> params = new ConcurrentHashMap<>();
    private final Deque<TradeRecord> recentTrades = new ArrayDeque<>();

    public AdaptiveTuner(MarketStateClassifier classifier) {
        this.classifier = classifier;
        reset();
    }

    public void retune() {
        double winRate = winRate();
        for (IndexName index : IndexName.values()) {
            MarketState state = classifier.classify(index);
            for (OptionLeg leg : OptionLeg.values()) {
                InstrumentKey key = InstrumentKey.of(index, leg);
                params.put(key, tune(params(key), state, winRate, leg));
            }
        }
        log.debug("[AdaptiveTuner] Retuned with winRate={}", winRate);
    }

    static StrategyParams tune(StrategyParams current, MarketState state, double winRate, OptionLeg leg) {
        double factor = (winRate - 0.5) * 2;
        VolatilityRegime regime = state.getVolatilityRegime();

        double targetMultiplier = Math.max(MIN_TARGET_MULTIPLIER, current.getTargetMultiplier() * (1 + factor * 0.2));
        int maxHolding = current.getMaxHoldingMinutes();
        if (regime == VolatilityRegime.HIGH) {
            maxHolding = Math.max(MIN_HOLDING_MINUTES, (int) (maxHolding * 0.7));
        } else if (regime == VolatilityRegime.LOW) {
            maxHolding = Math.min(MAX_HOLDING_MINUTES, (int) (maxHolding * 1.3));
        }
        double minStrength = current.getMinSignalStrength() * regime.getWeight();
        double trailingActivation = current.getTrailingActivationPct() / regime.getWeight();
        double entryThreshold = Math.max(MIN_ENTRY_THRESHOLD, current.getEntryThreshold() * (1 - factor * 0.3));

        TrendDirection favourable = leg.favourableTrend();
        if (state.getTrend() == favourable) {
            targetMultiplier *= 1.1;
            entryThreshold *= 0.9;
        } else if (state.getTrend() == favourable.opposite()) {
            targetMultiplier *= 0.9;
            entryThreshold *= 1.1;
        }

        return StrategyParams.builder()
                .targetMultiplier(targetMultiplier)
                .maxHoldingMinutes(maxHolding)
                .minSignalStrength(minStrength)
                .trailingActivationPct(trailingActivation)
                .entryThreshold(entryThreshold)
                .build();
    }

    public StrategyParams params(InstrumentKey key) {
        return params.getOrDefault(key, StrategyParams.BASE);
    }

    public Map<InstrumentKey, StrategyParams> snapshot() {
        Map<InstrumentKey, StrategyParams> out = new LinkedHashMap<>();
        for (InstrumentKey key : InstrumentKey.all()) {
            out.put(key, params(key));
        }
        return out;
    }

    public void reset() {
        for (InstrumentKey key : InstrumentKey.all()) {
            params.put(key, StrategyParams.BASE);
        }
    }

    /** Share of winners among the last adaptive trades; 0.5 before any closed. */
    public double winRate() {
        synchronized (recentTrades) {
            if (recentTrades.isEmpty()) {
                return DEFAULT_WIN_RATE;
            }
            long wins = recentTrades.stream().filter(TradeRecord::isWin).count();
            return (double) wins / recentTrades.size();
        }
    }

    @Override
    public void onTradeClosed(TradeRecord record) {
        if (record.getStrategyKind() != StrategyKind.ADAPTIVE_SCALP) {
            return;
        }
        synchronized (recentTrades) {
            recentTrades.addLast(record);
            while (recentTrades.size() > PERFORMANCE_WINDOW) {
                recentTrades.removeFirst();
            }
        }
    }
}
