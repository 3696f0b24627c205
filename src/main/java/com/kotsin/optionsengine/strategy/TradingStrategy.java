package com.kotsin.optionsengine.strategy;

import com.kotsin.optionsengine.model.ExitReason;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.PositionSnapshot;
import com.kotsin.optionsengine.model.StrategyKind;

import java.util.Optional;

/**
 * One entry/exit policy. Implementations only decide; the engine sizes, opens and closes.
 */
public interface TradingStrategy {

    StrategyKind kind();

    boolean shouldEnter(StrategyContext context);

    /** Strategy-specific reason to leave before stop, target or time. */
    Optional<ExitReason> earlyExit(StrategyContext context, PositionSnapshot position);

    /** Target distance as a multiple of the stop distance. */
    double targetMultiplier(StrategyContext context);

    int maxHoldingMinutes(InstrumentKey key);

    /** Trailing activation stored on the position instead of the kind default. */
    default Double customTrailingActivationPct(InstrumentKey key) {
        return null;
    }
}
