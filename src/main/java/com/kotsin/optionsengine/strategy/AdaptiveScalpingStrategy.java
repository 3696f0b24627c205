package com.kotsin.optionsengine.strategy;

import com.kotsin.optionsengine.model.ExitReason;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.PositionSnapshot;
import com.kotsin.optionsengine.model.Signal;
import com.kotsin.optionsengine.model.StrategyKind;
import com.kotsin.optionsengine.model.StrategyParams;
import com.kotsin.optionsengine.service.TradingHoursService;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Scalp whose thresholds come from the adaptive tuner.
 */
@Component
public class AdaptiveScalpingStrategy extends AbstractScalpingStrategy {

    static final double MIN_VOLATILITY = 0.03;

    private final AdaptiveTuner tuner;

    public AdaptiveScalpingStrategy(TradingHoursService tradingHours, AdaptiveTuner tuner) {
        super(tradingHours);
        this.tuner = tuner;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.ADAPTIVE_SCALP;
    }

    @Override
    public boolean shouldEnter(StrategyContext context) {
        StrategyParams params = tuner.params(context.getKey());
        Signal signal = context.getSignal();
        return signal.getDirection() >= params.getEntryThreshold()
                && signal.getStrength() >= params.getMinSignalStrength()
                && context.volatility() >= MIN_VOLATILITY
                && outsideEdgeWindows(context);
    }

    @Override
    public Optional<ExitReason> earlyExit(StrategyContext context, PositionSnapshot position) {
        StrategyParams params = tuner.params(context.getKey());
        int direction = context.getSignal().getDirection();
        if (direction < 0) {
            return Optional.of(ExitReason.ADAPTIVE_EXIT);
        }
        if (context.getPrice() > position.getEntryPrice() && direction < params.getEntryThreshold() / 2) {
            return Optional.of(ExitReason.ADAPTIVE_EXIT);
        }
        return Optional.empty();
    }

    @Override
    public double targetMultiplier(StrategyContext context) {
        return tuner.params(context.getKey()).getTargetMultiplier();
    }

    @Override
    public int maxHoldingMinutes(InstrumentKey key) {
        return tuner.params(key).getMaxHoldingMinutes();
    }

    @Override
    public Double customTrailingActivationPct(InstrumentKey key) {
        return tuner.params(key).getTrailingActivationPct();
    }
}
