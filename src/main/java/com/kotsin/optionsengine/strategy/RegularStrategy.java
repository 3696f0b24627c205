package com.kotsin.optionsengine.strategy;

import com.kotsin.optionsengine.config.StrategySettings;
import com.kotsin.optionsengine.model.ExitReason;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.PositionSnapshot;
import com.kotsin.optionsengine.model.Signal;
import com.kotsin.optionsengine.model.StrategyKind;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** Swing entry on a confirmed signal, exit on a reversal of the same strength. */
@Component
public class RegularStrategy implements TradingStrategy {

    static final int MIN_DIRECTION = 2;
    static final double MIN_STRENGTH = 1.0;
    static final int REVERSAL_DIRECTION = -2;
    static final double RISK_REWARD = 2.0;

    private final StrategySettings settings;

    public RegularStrategy(StrategySettings settings) {
        this.settings = settings;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.REGULAR;
    }

    @Override
    public boolean shouldEnter(StrategyContext context) {
        Signal signal = context.getSignal();
        return signal.getDirection() >= MIN_DIRECTION && signal.getStrength() >= MIN_STRENGTH;
    }

    @Override
    public Optional<ExitReason> earlyExit(StrategyContext context, PositionSnapshot position) {
        if (context.getSignal().getDirection() <= REVERSAL_DIRECTION) {
            return Optional.of(ExitReason.SIGNAL_REVERSAL);
        }
        return Optional.empty();
    }

    @Override
    public double targetMultiplier(StrategyContext context) {
        return RISK_REWARD;
    }

    @Override
    public int maxHoldingMinutes(InstrumentKey key) {
        return settings.getRegularMaxHoldingMinutes();
    }
}
