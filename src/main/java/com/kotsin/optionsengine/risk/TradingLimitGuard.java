package com.kotsin.optionsengine.risk;

import com.kotsin.optionsengine.config.RiskSettings;
import com.kotsin.optionsengine.model.AggregateStats;
import com.kotsin.optionsengine.model.LimitStatus;
import com.kotsin.optionsengine.trading.PositionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Daily trade-count and loss limits. Once either is hit no entries are allowed until the
 * next trading day.
 */
@Service
@Slf4j
public class TradingLimitGuard {

    private final PositionStore positionStore;
    private final RiskSettings riskSettings;
    private final AtomicReference<LocalDate> breachLoggedFor = new AtomicReference<>();

    public TradingLimitGuard(PositionStore positionStore, RiskSettings riskSettings) {
        this.positionStore = positionStore;
        this.riskSettings = riskSettings;
    }

    public boolean isEntryAllowed() {
        LimitStatus status = status();
        if (!status.isEntryAllowed()) {
            warnOnce(status);
            return false;
        }
        return true;
    }

    public LimitStatus status() {
        AggregateStats stats = positionStore.stats();
        double maxLoss = riskSettings.maxDailyLoss();
        return LimitStatus.builder()
                .tradesToday(stats.getTradesToday())
                .maxTradesPerDay(riskSettings.getMaxTradesPerDay())
                .dailyPnl(stats.getDailyPnl())
                .maxDailyLoss(maxLoss)
                .tradeCapReached(stats.getTradesToday() >= riskSettings.getMaxTradesPerDay())
                .lossCapReached(stats.getDailyPnl() <= -maxLoss)
                .build();
    }

    private void warnOnce(LimitStatus status) {
        LocalDate day = positionStore.stats().getTradingDay();
        if (!day.equals(breachLoggedFor.getAndSet(day))) {
            log.warn("🛑 [Limits] No more trades today: tradesToday={}/{} dailyPnl={} lossLimit={}",
                    status.getTradesToday(), status.getMaxTradesPerDay(),
                    String.format("%.2f", status.getDailyPnl()), String.format("%.2f", -status.getMaxDailyLoss()));
        }
    }
}
