package com.kotsin.optionsengine.strategy;

import com.kotsin.optionsengine.config.StrategySettings;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.Signal;
import com.kotsin.optionsengine.model.StrategyKind;
import com.kotsin.optionsengine.service.TradingHoursService;
import org.springframework.stereotype.Component;

/**
 * Tick-driven scalp on a strong signal. Stays out of the opening window and off expiry day,
 * where the expiry variant takes over.
 */
@Component
public class StandardScalpingStrategy extends AbstractScalpingStrategy {

    static final int MIN_DIRECTION = 3;
    static final double MIN_STRENGTH = 1.5;
    static final double MIN_VOLATILITY = 0.05;
    static final double RISK_REWARD = 1.5;

    private final StrategySettings settings;

    public StandardScalpingStrategy(TradingHoursService tradingHours, StrategySettings settings) {
        super(tradingHours);
        this.settings = settings;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.SCALPING;
    }

    @Override
    public boolean shouldEnter(StrategyContext context) {
        if (context.isExpiryDay()) {
            return false;
        }
        Signal signal = context.getSignal();
        return signal.getDirection() >= MIN_DIRECTION
                && signal.getStrength() >= MIN_STRENGTH
                && context.volatility() >= MIN_VOLATILITY
                && !tradingHours.isInOpeningWindow(context.getNow().toLocalTime());
    }

    @Override
    public double targetMultiplier(StrategyContext context) {
        return RISK_REWARD;
    }

    @Override
    public int maxHoldingMinutes(InstrumentKey key) {
        return settings.getScalpingMaxHoldingMinutes();
    }
}
