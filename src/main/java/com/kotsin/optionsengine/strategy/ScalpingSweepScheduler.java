package com.kotsin.optionsengine.strategy;

import com.kotsin.optionsengine.service.ErrorMonitoringService;
import com.kotsin.optionsengine.service.TradingHoursService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the strategy sweep on a fixed delay while the market is open; a failed sweep is
 * recorded and the next one still runs.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "engine.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class ScalpingSweepScheduler {

    private final StrategyEngine strategyEngine;
    private final ErrorMonitoringService errorMonitoring;
    private final TradingHoursService tradingHours;

    @Scheduled(fixedDelayString = "${engine.sweep.interval-ms:2000}",
            initialDelayString = "${engine.sweep.initial-delay-ms:5000}")
    public void runSweep() {
        if (!tradingHours.isMarketOpenNow()) {
            log.debug("[Sweep] Market closed at {}, skipping", tradingHours.now());
            return;
        }
        try {
            strategyEngine.sweep();
        } catch (Exception e) {
            errorMonitoring.recordError("sweep", e.getMessage(), e);
        }
    }
}
