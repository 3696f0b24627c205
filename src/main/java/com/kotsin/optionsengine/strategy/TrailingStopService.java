package com.kotsin.optionsengine.strategy;

import com.kotsin.optionsengine.config.RiskSettings;
import com.kotsin.optionsengine.model.MarketState;
import com.kotsin.optionsengine.model.PositionSnapshot;
import com.kotsin.optionsengine.trading.PositionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Trailing Stop Service - locks in profit on open long option positions.
 * <p>
 * Trailing starts once profit reaches the activation threshold (base activation times the
 * strategy's factor, or the position's own activation for adaptive trades). From then on
 * the stop follows the price at a distance of the base trail percentage scaled by the
 * volatility regime, and only ever moves up.
 */
@Service
@Slf4j
public class TrailingStopService {

    private final PositionStore positionStore;
    private final RiskSettings riskSettings;

    public TrailingStopService(PositionStore positionStore, RiskSettings riskSettings) {
        this.positionStore = positionStore;
        this.riskSettings = riskSettings;
    }

    /**
     * @return true when the stop loss moved
     */
    public boolean update(PositionSnapshot position, double price, MarketState state) {
        if (!position.isActive()) {
            return false;
        }
        double profitPct = position.profitPct(price);
        boolean activateNow = !position.isTrailingActivated() && profitPct >= activationPct(position);
        if (!position.isTrailingActivated() && !activateNow) {
            return false;
        }
        if (activateNow) {
            log.info("🎯 [TrailingStop] Trailing activated for {} at {}% profit",
                    position.getKey(), String.format("%.2f", profitPct));
        }

        double candidate = price * (1 - trailPct(state) / 100.0);
        boolean moved = positionStore.applyTrailing(position, activateNow, candidate);
        if (moved) {
            log.info("🔄 [TrailingStop] Updated trailing stop for {}: Price={}, New SL={}, Previous SL={}",
                    position.getKey(), price, String.format("%.3f", candidate), position.getStopLoss());
        }
        return moved;
    }

    public double activationPct(PositionSnapshot position) {
        if (position.getCustomTrailingActivationPct() != null) {
            return position.getCustomTrailingActivationPct();
        }
        return riskSettings.getTrailingActivationPct() * position.getStrategyKind().getTrailingFactor();
    }

    public double trailPct(MarketState state) {
        return riskSettings.getTrailingStopPct() * state.getVolatilityRegime().getTrailScale();
    }
}
