package com.kotsin.optionsengine.strategy;

import com.kotsin.optionsengine.config.StrategySettings;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.Signal;
import com.kotsin.optionsengine.model.StrategyKind;
import com.kotsin.optionsengine.service.TradingHoursService;
import org.springframework.stereotype.Component;

/**
 * Expiry-day scalp. All thresholds are configuration under {@code engine.strategy.expiry}.
 */
@Component
public class ExpiryScalpingStrategy extends AbstractScalpingStrategy {

    private final StrategySettings settings;

    public ExpiryScalpingStrategy(TradingHoursService tradingHours, StrategySettings settings) {
        super(tradingHours);
        this.settings = settings;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.EXPIRY_SCALPING;
    }

    @Override
    public boolean shouldEnter(StrategyContext context) {
        if (!context.isExpiryDay()) {
            return false;
        }
        StrategySettings.Expiry expiry = settings.getExpiry();
        Signal signal = context.getSignal();
        return signal.getDirection() >= expiry.getMinDirection()
                && signal.getStrength() >= expiry.getMinStrength()
                && volatilityBetween(context, expiry.getMinVolatility(), expiry.getMaxVolatility())
                && outsideEdgeWindows(context);
    }

    @Override
    public double targetMultiplier(StrategyContext context) {
        return settings.getExpiry().getRiskRewardMultiplier();
    }

    @Override
    public int maxHoldingMinutes(InstrumentKey key) {
        return settings.getExpiry().getMaxHoldingMinutes();
    }
}
