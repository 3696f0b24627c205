package com.kotsin.optionsengine.strategy;

import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.MarketState;
import com.kotsin.optionsengine.model.PatternScore;
import com.kotsin.optionsengine.model.Signal;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Everything a strategy sees for one leg in one pass, read once up front.
 */
@Value
@Builder
public class StrategyContext {
    InstrumentKey key;
    double price;
    Signal signal;
    MarketState marketState;
    PatternScore patternScore;
    /** Most recent momentum readings, oldest first. */
    List<Double> momentum;
    boolean expiryDay;
    LocalDateTime now;

    public double volatility() {
        return marketState.getVolatility();
    }
}
