package com.kotsin.optionsengine.analysis;

import com.kotsin.optionsengine.market.PriceHistoryStore;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.MarketState;
import com.kotsin.optionsengine.model.PriceChannel;
import com.kotsin.optionsengine.model.TrendDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Buckets each index into a volatility regime and a short-term spot trend.
 */
@Service
@Slf4j
public class MarketStateClassifier {

    static final double DEFAULT_VOLATILITY = 1.0;
    static final int MIN_VOLATILITY_SAMPLES = 5;
    static final int TREND_WINDOW = 10;
    static final double TREND_THRESHOLD_PCT = 0.3;

    private final PriceHistoryStore historyStore;
    private final Map<IndexName, MarketState> latest = new ConcurrentHashMap<>();

    public MarketStateClassifier(PriceHistoryStore historyStore) {
        this.historyStore = historyStore;
    }

    public MarketState classify(IndexName index) {
        MarketState state = MarketState.of(volatility(index), trend(index));
        MarketState previous = latest.put(index, state);
        if (previous != null && previous.getVolatilityRegime() != state.getVolatilityRegime()) {
            log.info("🌡️ [MarketState] {} regime {} -> {} (volatility={})",
                    index, previous.getVolatilityRegime(), state.getVolatilityRegime(),
                    String.format("%.4f", state.getVolatility()));
        }
        return state;
    }

    /** Population standard deviation of the recent spot percentage changes. */
    public double volatility(IndexName index) {
        List<Double> samples = historyStore.volatilitySamples(index);
        if (samples.size() < MIN_VOLATILITY_SAMPLES) {
            return DEFAULT_VOLATILITY;
        }
        double mean = 0.0;
        for (double s : samples) {
            mean += s;
        }
        mean /= samples.size();
        double variance = 0.0;
        for (double s : samples) {
            variance += (s - mean) * (s - mean);
        }
        return Math.sqrt(variance / samples.size());
    }

    public TrendDirection trend(IndexName index) {
        double[] spot = historyStore.series(index, PriceChannel.SPOT).prices(TREND_WINDOW);
        if (spot.length < TREND_WINDOW || spot[0] <= 0) {
            return TrendDirection.NEUTRAL;
        }
        double change = (spot[spot.length - 1] - spot[0]) / spot[0] * 100.0;
        if (change > TREND_THRESHOLD_PCT) {
            return TrendDirection.BULLISH;
        }
        if (change < -TREND_THRESHOLD_PCT) {
            return TrendDirection.BEARISH;
        }
        return TrendDirection.NEUTRAL;
    }

    /** Last classification per index; unclassified indices are classified now. */
    public Map<IndexName, MarketState> latestStates() {
        Map<IndexName, MarketState> out = new EnumMap<>(IndexName.class);
        for (IndexName index : IndexName.values()) {
            MarketState state = latest.get(index);
            out.put(index, state != null ? state : classify(index));
        }
        return out;
    }
}
