package com.kotsin.optionsengine.analysis;

import com.kotsin.optionsengine.indicator.BollingerBands;
import com.kotsin.optionsengine.indicator.IndicatorLibrary;
import com.kotsin.optionsengine.indicator.MacdResult;
import com.kotsin.optionsengine.market.PriceHistoryStore;
import com.kotsin.optionsengine.market.PriceSeries;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.OptionLeg;
import com.kotsin.optionsengine.model.Signal;
import com.kotsin.optionsengine.model.TrendDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Combines RSI, MACD, Bollinger and EMA alignment into one signal per option leg.
 * Each indicator votes +1/-1 on direction and adds a magnitude to strength.
 */
@Service
@Slf4j
public class SignalEngine {

    public static final int RSI_PERIOD = 14;
    public static final int MACD_FAST = 12;
    public static final int MACD_SLOW = 26;
    public static final int MACD_SIGNAL = 9;
    public static final int BOLLINGER_PERIOD = 20;
    public static final double BOLLINGER_STD = 2.0;
    public static final int EMA_SHORT = 5;
    public static final int EMA_MEDIUM = 10;
    public static final int EMA_LONG = 20;
    /** Signals need strictly more points than the long EMA period. */
    public static final int MIN_POINTS = EMA_LONG + 1;
    static final int LOOKBACK = 300;

    private final PriceHistoryStore historyStore;
    private final IndicatorLibrary indicators;
    private final Map<InstrumentKey, Signal> signals = new ConcurrentHashMap<>();

    public SignalEngine(PriceHistoryStore historyStore, IndicatorLibrary indicators) {
        this.historyStore = historyStore;
        this.indicators = indicators;
        for (InstrumentKey key : InstrumentKey.all()) {
            signals.put(key, Signal.NEUTRAL);
        }
    }

    /** Recomputes both legs of {@code index}; a leg with too little history keeps its last signal. */
    public void evaluate(IndexName index) {
        for (OptionLeg leg : OptionLeg.values()) {
            PriceSeries series = historyStore.series(index, leg.channel());
            if (series.size() < MIN_POINTS) {
                log.debug("[Signal] {} {} has {} points, need {}", index, leg, series.size(), MIN_POINTS);
                continue;
            }
            signals.put(InstrumentKey.of(index, leg), compute(series.prices(LOOKBACK)));
        }
    }

    public Signal compute(double[] prices) {
        double price = prices[prices.length - 1];
        int direction = 0;
        double strength = 0.0;

        double rsi = indicators.rsi(prices, RSI_PERIOD);
        if (rsi < 30) {
            direction += 1;
            strength += (30 - rsi) / 10;
        } else if (rsi > 70) {
            direction -= 1;
            strength -= (rsi - 70) / 10;
        }

        MacdResult macd = indicators.macd(prices, MACD_FAST, MACD_SLOW, MACD_SIGNAL);
        double histogram = macd.histogram();
        if (histogram > 0) {
            direction += 1;
            strength += Math.abs(histogram) / 2;
        } else if (histogram < 0) {
            direction -= 1;
            strength -= Math.abs(histogram) / 2;
        }

        BollingerBands bands = indicators.bollinger(prices, BOLLINGER_PERIOD, BOLLINGER_STD);
        if (price < bands.lower()) {
            direction += 1;
            strength += (bands.lower() - price) / price * 10;
        } else if (price > bands.upper()) {
            direction -= 1;
            strength -= (price - bands.upper()) / price * 10;
        }

        double emaShort = indicators.ema(prices, EMA_SHORT);
        double emaMedium = indicators.ema(prices, EMA_MEDIUM);
        double emaLong = indicators.ema(prices, EMA_LONG);
        if (emaShort > emaMedium && emaMedium > emaLong) {
            direction += 1;
            strength += 0.5;
        } else if (emaShort < emaMedium && emaMedium < emaLong) {
            direction -= 1;
            strength -= 0.5;
        }

        TrendDirection trend = direction > 1 ? TrendDirection.BULLISH
                : direction < -1 ? TrendDirection.BEARISH
                : TrendDirection.NEUTRAL;
        return Signal.builder().direction(direction).strength(strength).trend(trend).build();
    }

    public Signal signal(InstrumentKey key) {
        return signals.getOrDefault(key, Signal.NEUTRAL);
    }

    public Map<InstrumentKey, Signal> snapshot() {
        Map<InstrumentKey, Signal> out = new LinkedHashMap<>();
        for (InstrumentKey key : InstrumentKey.all()) {
            out.put(key, signal(key));
        }
        return out;
    }
}
