package com.kotsin.optionsengine.strategy;

import com.kotsin.optionsengine.analysis.MomentumTracker;
import com.kotsin.optionsengine.config.StrategySettings;
import com.kotsin.optionsengine.model.ExitReason;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.PositionSnapshot;
import com.kotsin.optionsengine.model.StrategyKind;
import com.kotsin.optionsengine.service.TradingHoursService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Rides an accelerating premium: three rising momentum readings ending above the surge
 * threshold.
 */
@Component
public class MomentumScalpingStrategy extends AbstractScalpingStrategy {

    static final int SURGE_READINGS = 3;
    static final double SURGE_THRESHOLD = 0.15;
    static final double MIN_MOMENTUM = 2.0;
    static final double REVERSAL_MOMENTUM = -1.0;
    static final double MIN_VOLATILITY = 0.05;
    static final double MAX_VOLATILITY = 0.5;
    static final double RISK_REWARD = 2.0;

    private final MomentumTracker momentumTracker;
    private final StrategySettings settings;

    public MomentumScalpingStrategy(TradingHoursService tradingHours, MomentumTracker momentumTracker,
                                    StrategySettings settings) {
        super(tradingHours);
        this.momentumTracker = momentumTracker;
        this.settings = settings;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.MOMENTUM_SCALP;
    }

    @Override
    public boolean shouldEnter(StrategyContext context) {
        if (!volatilityBetween(context, MIN_VOLATILITY, MAX_VOLATILITY) || !outsideEdgeWindows(context)) {
            return false;
        }
        List<Double> readings = context.getMomentum();
        if (readings == null || readings.size() < SURGE_READINGS) {
            return false;
        }
        List<Double> last = readings.subList(readings.size() - SURGE_READINGS, readings.size());
        for (int i = 1; i < last.size(); i++) {
            if (last.get(i) <= last.get(i - 1)) {
                return false;
            }
        }
        double current = last.get(last.size() - 1);
        return current > SURGE_THRESHOLD && current >= 0 && Math.abs(current) >= MIN_MOMENTUM;
    }

    @Override
    public Optional<ExitReason> earlyExit(StrategyContext context, PositionSnapshot position) {
        Double current = momentumTracker.current(context.getKey());
        if (current != null && current < REVERSAL_MOMENTUM) {
            return Optional.of(ExitReason.MOMENTUM_REVERSAL);
        }
        return scalpExit(context, position);
    }

    @Override
    public double targetMultiplier(StrategyContext context) {
        return RISK_REWARD;
    }

    @Override
    public int maxHoldingMinutes(InstrumentKey key) {
        return settings.getMomentumMaxHoldingMinutes();
    }
}
