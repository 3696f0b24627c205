package com.kotsin.optionsengine.config;

import com.kotsin.optionsengine.model.IndexName;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * Risk knobs. A single mutable instance shared by every decision path; values are read on
 * each decision and may be changed at runtime through the risk endpoint.
 */
@Data
@ConfigurationProperties(prefix = "engine.risk")
public class RiskSettings {

    private volatile double capital = 100_000.0;
    private volatile double riskPerTradePct = 1.0;
    private volatile int maxTradesPerDay = 40;
    private volatile double maxDailyLossPct = 5.0;
    private volatile double trailingActivationPct = 1.0;
    private volatile double trailingStopPct = 0.4;
    private volatile double scalpingStopLossPct = 0.3;
    private volatile boolean scalpingEnabled = true;
    private Map<IndexName, IndexToggle> indices = defaultToggles();

    @Data
    @NoArgsConstructor
    public static class IndexToggle {
        private volatile boolean tradingEnabled = true;
        private volatile boolean scalpingEnabled = true;
    }

    public double maxDailyLoss() {
        return capital * maxDailyLossPct / 100.0;
    }

    public boolean tradingAllowed(IndexName index) {
        return toggle(index).isTradingEnabled();
    }

    /** Global switch and the index's own switch must both be on. */
    public boolean scalpingAllowed(IndexName index) {
        return scalpingEnabled && toggle(index).isScalpingEnabled();
    }

    public IndexToggle toggle(IndexName index) {
        IndexToggle toggle = indices.get(index);
        if (toggle == null) {
            toggle = new IndexToggle();
            indices.put(index, toggle);
        }
        return toggle;
    }

    /** Applies the non-null fields of a partial update. */
    public synchronized void apply(RiskSettingsUpdate update) {
        if (update.getCapital() != null) capital = update.getCapital();
        if (update.getRiskPerTradePct() != null) riskPerTradePct = update.getRiskPerTradePct();
        if (update.getMaxTradesPerDay() != null) maxTradesPerDay = update.getMaxTradesPerDay();
        if (update.getMaxDailyLossPct() != null) maxDailyLossPct = update.getMaxDailyLossPct();
        if (update.getTrailingActivationPct() != null) trailingActivationPct = update.getTrailingActivationPct();
        if (update.getTrailingStopPct() != null) trailingStopPct = update.getTrailingStopPct();
        if (update.getScalpingStopLossPct() != null) scalpingStopLossPct = update.getScalpingStopLossPct();
        if (update.getScalpingEnabled() != null) scalpingEnabled = update.getScalpingEnabled();
        if (update.getIndices() != null) {
            update.getIndices().forEach((index, change) -> {
                IndexToggle toggle = toggle(index);
                if (change.getTradingEnabled() != null) toggle.setTradingEnabled(change.getTradingEnabled());
                if (change.getScalpingEnabled() != null) toggle.setScalpingEnabled(change.getScalpingEnabled());
            });
        }
    }

    private static Map<IndexName, IndexToggle> defaultToggles() {
        Map<IndexName, IndexToggle> toggles = new EnumMap<>(IndexName.class);
        for (IndexName index : IndexName.values()) {
            toggles.put(index, new IndexToggle());
        }
        return toggles;
    }
}
