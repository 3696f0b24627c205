package com.kotsin.optionsengine.risk;

import com.kotsin.optionsengine.config.RiskSettings;
import com.kotsin.optionsengine.indicator.IndicatorLibrary;
import com.kotsin.optionsengine.market.PriceHistoryStore;
import com.kotsin.optionsengine.market.PriceSeries;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.OptionLeg;
import com.kotsin.optionsengine.model.SizingResult;
import com.kotsin.optionsengine.model.StrategyKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fixed-fractional sizing: quantity = risk amount / stop distance.
 * Scalping variants derive the stop distance from ATR when enough history exists.
 */
@Service
@Slf4j
public class PositionSizer {

    public static final int ATR_PERIOD = 14;
    public static final double STANDARD_STOP_PCT = 1.0;

    private final RiskSettings riskSettings;
    private final PriceHistoryStore historyStore;
    private final IndicatorLibrary indicators;

    public PositionSizer(RiskSettings riskSettings, PriceHistoryStore historyStore, IndicatorLibrary indicators) {
        this.riskSettings = riskSettings;
        this.historyStore = historyStore;
        this.indicators = indicators;
    }

    public SizingResult size(IndexName index, OptionLeg leg, double price, StrategyKind kind) {
        double capital = riskSettings.getCapital();
        if (capital <= 0 || price <= 0) {
            log.debug("[Sizer] No size for {} {}: capital={} price={}", index, leg, capital, price);
            return SizingResult.NONE;
        }
        double riskAmount = capital * riskSettings.getRiskPerTradePct() / 100.0 * kind.getRiskMultiplier();
        double distance = stopDistance(index, leg, price, kind);
        if (distance <= 0) {
            return SizingResult.NONE;
        }

        int quantity = Math.max(1, (int) Math.floor(riskAmount / distance));
        if (kind.isCapitalCapped()) {
            int cap = (int) Math.floor(capital * StrategyKind.MAX_POSITION_CAPITAL_SHARE / price);
            quantity = Math.min(quantity, cap);
        }
        if (quantity <= 0) {
            log.debug("[Sizer] {} {} {} capped to zero at price {}", index, leg, kind, price);
            return new SizingResult(0, distance);
        }
        return new SizingResult(quantity, distance);
    }

    double stopDistance(IndexName index, OptionLeg leg, double price, StrategyKind kind) {
        if (!kind.isAtrSized()) {
            return price * STANDARD_STOP_PCT / 100.0;
        }
        PriceSeries series = historyStore.series(index, leg.channel());
        if (series.size() > ATR_PERIOD) {
            double atr = indicators.atr(series.prices(ATR_PERIOD + 1), ATR_PERIOD);
            return Math.max(atr * kind.getAtrMultiplier(), price * riskSettings.getScalpingStopLossPct() / 100.0);
        }
        return price * kind.fallbackStopPct(riskSettings.getScalpingStopLossPct()) / 100.0;
    }
}
