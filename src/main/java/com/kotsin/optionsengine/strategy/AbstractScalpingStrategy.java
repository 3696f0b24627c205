package com.kotsin.optionsengine.strategy;

import com.kotsin.optionsengine.model.ExitReason;
import com.kotsin.optionsengine.model.PositionSnapshot;
import com.kotsin.optionsengine.service.TradingHoursService;

import java.util.Optional;

/**
 * Shared gates and exits of the short-horizon variants.
 */
public abstract class AbstractScalpingStrategy implements TradingStrategy {

    static final double QUICK_PROFIT_PCT = 0.2;
    static final int REVERSAL_DIRECTION = -2;

    protected final TradingHoursService tradingHours;

    protected AbstractScalpingStrategy(TradingHoursService tradingHours) {
        this.tradingHours = tradingHours;
    }

    protected boolean outsideEdgeWindows(StrategyContext context) {
        return tradingHours.isOutsideEdgeWindows(context.getNow().toLocalTime());
    }

    protected static boolean volatilityBetween(StrategyContext context, double min, double max) {
        double v = context.volatility();
        return v >= min && v <= max;
    }

    /** Take a small profit once the signal fades, or leave on a clear reversal. */
    protected Optional<ExitReason> scalpExit(StrategyContext context, PositionSnapshot position) {
        int direction = context.getSignal().getDirection();
        if (position.profitPct(context.getPrice()) > QUICK_PROFIT_PCT && direction < 1) {
            return Optional.of(ExitReason.WEAKENING_SIGNAL);
        }
        if (direction <= REVERSAL_DIRECTION) {
            return Optional.of(ExitReason.SIGNAL_REVERSAL);
        }
        return Optional.empty();
    }

    @Override
    public Optional<ExitReason> earlyExit(StrategyContext context, PositionSnapshot position) {
        return scalpExit(context, position);
    }
}
