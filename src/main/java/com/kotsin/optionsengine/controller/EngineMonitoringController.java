package com.kotsin.optionsengine.controller;

import com.kotsin.optionsengine.analysis.MarketAnalyticsService;
import com.kotsin.optionsengine.analysis.MarketStateClassifier;
import com.kotsin.optionsengine.analysis.PatternScoreService;
import com.kotsin.optionsengine.analysis.SignalEngine;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.OptionLeg;
import com.kotsin.optionsengine.model.PositionSnapshot;
import com.kotsin.optionsengine.model.StrategyKind;
import com.kotsin.optionsengine.model.TradeRecord;
import com.kotsin.optionsengine.risk.TradingLimitGuard;
import com.kotsin.optionsengine.service.ErrorMonitoringService;
import com.kotsin.optionsengine.service.ExpiryCalendar;
import com.kotsin.optionsengine.service.OptionContractResolver;
import com.kotsin.optionsengine.service.TradePerformanceService;
import com.kotsin.optionsengine.strategy.AdaptiveTuner;
import com.kotsin.optionsengine.trading.PositionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Read-only views over the engine state.
 */
@RestController
@RequestMapping("/api/v1/engine")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class EngineMonitoringController {

    private final SignalEngine signalEngine;
    private final MarketStateClassifier marketStateClassifier;
    private final PatternScoreService patternScoreService;
    private final PositionStore positionStore;
    private final AdaptiveTuner adaptiveTuner;
    private final TradePerformanceService performanceService;
    private final MarketAnalyticsService analyticsService;
    private final OptionContractResolver contractResolver;
    private final ExpiryCalendar expiryCalendar;
    private final TradingLimitGuard limitGuard;
    private final ErrorMonitoringService errorMonitoring;
    private final Clock clock;

    @GetMapping("/signals")
    public ResponseEntity<Map<String, Object>> getSignals() {
        return respond("signals", () -> byKey(signalEngine.snapshot()));
    }

    @GetMapping("/market-states")
    public ResponseEntity<Map<String, Object>> getMarketStates() {
        return respond("marketStates", marketStateClassifier::latestStates);
    }

    @GetMapping("/patterns")
    public ResponseEntity<Map<String, Object>> getPatternScores() {
        return respond("patterns", () -> byKey(patternScoreService.snapshot()));
    }

    @GetMapping("/positions")
    public ResponseEntity<Map<String, Object>> getPositions() {
        return respond("positions", () -> {
            List<PositionSnapshot> active = new ArrayList<>();
            for (PositionSnapshot snapshot : positionStore.snapshots()) {
                if (snapshot.isActive()) {
                    active.add(snapshot);
                }
            }
            return active;
        });
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return respond("stats", positionStore::stats);
    }

    @GetMapping("/limits")
    public ResponseEntity<Map<String, Object>> getLimits() {
        return respond("limits", limitGuard::status);
    }

    /**
     * GET /api/v1/engine/history?index=NIFTY&strategy=MOMENTUM_SCALP
     */
    @GetMapping("/history")
    public ResponseEntity<Map<String, Object>> getHistory(@RequestParam(required = false) IndexName index,
                                                          @RequestParam(required = false) StrategyKind strategy) {
        return respond("trades", () -> {
            List<TradeRecord> out = new ArrayList<>();
            for (TradeRecord record : positionStore.history()) {
                if ((index == null || record.getIndex() == index)
                        && (strategy == null || record.getStrategyKind() == strategy)) {
                    out.add(record);
                }
            }
            return out;
        });
    }

    @GetMapping("/history/today")
    public ResponseEntity<Map<String, Object>> getTodaysHistory() {
        return respond("trades", () -> positionStore.historyFor(LocalDate.now(clock)));
    }

    @GetMapping("/adaptive-params")
    public ResponseEntity<Map<String, Object>> getAdaptiveParams() {
        return respond("params", () -> {
            Map<String, Object> out = new LinkedHashMap<>(byKey(adaptiveTuner.snapshot()));
            out.put("winRate", adaptiveTuner.winRate());
            return out;
        });
    }

    @GetMapping("/performance/scalping")
    public ResponseEntity<Map<String, Object>> getScalpingPerformance() {
        return respond("performance", performanceService::scalpingSummary);
    }

    @GetMapping("/performance/{strategy}")
    public ResponseEntity<Map<String, Object>> getStrategyPerformance(@PathVariable StrategyKind strategy) {
        return respond("performance", () -> performanceService.performance(strategy));
    }

    @GetMapping("/analytics/{index}")
    public ResponseEntity<Map<String, Object>> getIndexAnalytics(@PathVariable IndexName index) {
        return respond("analytics", () -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("putCallRatio", analyticsService.putCallRatio(index));
            out.put("predictedRange", analyticsService.predictedRange(index).orElse(null));
            out.put("expiry", expiryCalendar.currentExpiry(index));
            out.put("expiryDay", expiryCalendar.isExpiryDay(index));
            Map<OptionLeg, Object> contracts = new EnumMap<>(OptionLeg.class);
            for (OptionLeg leg : OptionLeg.values()) {
                contracts.put(leg, contractResolver.atm(index, leg).orElse(null));
            }
            out.put("atmContracts", contracts);
            return out;
        });
    }

    @GetMapping("/errors")
    public ResponseEntity<Map<String, Object>> getErrorCounts() {
        return respond("errors", errorMonitoring::errorCounts);
    }

    private ResponseEntity<Map<String, Object>> respond(String field, Supplier<Object> body) {
        try {
            Map<String, Object> response = new HashMap<>();
            response.put(field, body.get());
            response.put("timestamp", LocalDateTime.now(clock));
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            log.error("🚨 Error building {} view: {}", field, e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to fetch " + field, "message", String.valueOf(e.getMessage())));
        }
    }

    private static <V> Map<String, V> byKey(Map<InstrumentKey, V> values) {
        Map<String, V> out = new LinkedHashMap<>();
        values.forEach((key, value) -> out.put(key.toString(), value));
        return out;
    }
}
