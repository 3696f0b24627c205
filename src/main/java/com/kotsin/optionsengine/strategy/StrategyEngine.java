package com.kotsin.optionsengine.strategy;

import com.kotsin.optionsengine.analysis.MarketStateClassifier;
import com.kotsin.optionsengine.analysis.MomentumTracker;
import com.kotsin.optionsengine.analysis.PatternScoreService;
import com.kotsin.optionsengine.analysis.SignalEngine;
import com.kotsin.optionsengine.config.RiskSettings;
import com.kotsin.optionsengine.market.PriceHistoryStore;
import com.kotsin.optionsengine.market.PriceUpdateListener;
import com.kotsin.optionsengine.model.EntryOutcome;
import com.kotsin.optionsengine.model.ExitReason;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.MarketState;
import com.kotsin.optionsengine.model.PositionSnapshot;
import com.kotsin.optionsengine.model.PriceChannel;
import com.kotsin.optionsengine.model.SizingResult;
import com.kotsin.optionsengine.model.StrategyKind;
import com.kotsin.optionsengine.model.TradeRecord;
import com.kotsin.optionsengine.risk.PositionSizer;
import com.kotsin.optionsengine.risk.TradingLimitGuard;
import com.kotsin.optionsengine.service.EngineMetrics;
import com.kotsin.optionsengine.service.ErrorMonitoringService;
import com.kotsin.optionsengine.service.ExpiryCalendar;
import com.kotsin.optionsengine.trading.EntryOrder;
import com.kotsin.optionsengine.trading.PositionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives every leg through FLAT → ACTIVE → FLAT.
 * <p>
 * Two passes share the same rules. The tick pass runs on the ingesting thread for the
 * ticked index and handles regular and standard-scalp entries. The sweep runs on the
 * scheduler across all six legs and handles the momentum, pattern, adaptive and expiry
 * variants. In both, an active leg is only managed (exit, then trailing) and a flat leg is
 * only considered for entry, so a leg is never closed and re-opened in the same pass.
 */
@Service
@Slf4j
public class StrategyEngine implements PriceUpdateListener {

    static final List<StrategyKind> TICK_ENTRIES = List.of(StrategyKind.REGULAR, StrategyKind.SCALPING);
    static final List<StrategyKind> SWEEP_ENTRIES = List.of(
            StrategyKind.MOMENTUM_SCALP, StrategyKind.PATTERN_SCALP,
            StrategyKind.ADAPTIVE_SCALP, StrategyKind.EXPIRY_SCALPING);
    static final int MOMENTUM_READINGS = 3;

    private final PriceHistoryStore historyStore;
    private final SignalEngine signalEngine;
    private final MarketStateClassifier classifier;
    private final MomentumTracker momentumTracker;
    private final PatternScoreService patternScores;
    private final PositionStore positionStore;
    private final PositionSizer sizer;
    private final TradingLimitGuard limitGuard;
    private final ExitEvaluator exitEvaluator;
    private final TrailingStopService trailingStops;
    private final AdaptiveTuner adaptiveTuner;
    private final ExpiryCalendar expiryCalendar;
    private final RiskSettings riskSettings;
    private final ErrorMonitoringService errorMonitoring;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final Map<StrategyKind, TradingStrategy> strategies = new EnumMap<>(StrategyKind.class);

    public StrategyEngine(PriceHistoryStore historyStore,
                          SignalEngine signalEngine,
                          MarketStateClassifier classifier,
                          MomentumTracker momentumTracker,
                          PatternScoreService patternScores,
                          PositionStore positionStore,
                          PositionSizer sizer,
                          TradingLimitGuard limitGuard,
                          ExitEvaluator exitEvaluator,
                          TrailingStopService trailingStops,
                          AdaptiveTuner adaptiveTuner,
                          ExpiryCalendar expiryCalendar,
                          RiskSettings riskSettings,
                          ErrorMonitoringService errorMonitoring,
                          EngineMetrics metrics,
                          Clock clock,
                          List<TradingStrategy> strategyList) {
        this.historyStore = historyStore;
        this.signalEngine = signalEngine;
        this.classifier = classifier;
        this.momentumTracker = momentumTracker;
        this.patternScores = patternScores;
        this.positionStore = positionStore;
        this.sizer = sizer;
        this.limitGuard = limitGuard;
        this.exitEvaluator = exitEvaluator;
        this.trailingStops = trailingStops;
        this.adaptiveTuner = adaptiveTuner;
        this.expiryCalendar = expiryCalendar;
        this.riskSettings = riskSettings;
        this.errorMonitoring = errorMonitoring;
        this.metrics = metrics;
        this.clock = clock;
        for (TradingStrategy strategy : strategyList) {
            strategies.put(strategy.kind(), strategy);
        }
        for (StrategyKind kind : StrategyKind.values()) {
            if (!strategies.containsKey(kind)) {
                throw new IllegalStateException("No strategy registered for " + kind);
            }
        }
    }

    @Override
    public void onPriceUpdate(IndexName index) {
        onTick(index);
    }

    public void onTick(IndexName index) {
        positionStore.checkDayRollover();
        signalEngine.evaluate(index);
        MarketState state = classifier.classify(index);
        for (InstrumentKey key : InstrumentKey.forIndex(index)) {
            try {
                runPass(key, state, TICK_ENTRIES);
            } catch (Exception e) {
                errorMonitoring.recordError("tick:" + key, e.getMessage(), e);
            }
        }
    }

    public void sweep() {
        long start = System.nanoTime();
        try {
            positionStore.checkDayRollover();
            try {
                adaptiveTuner.retune();
            } catch (Exception e) {
                errorMonitoring.recordError("sweep:retune", e.getMessage(), e);
            }
            for (InstrumentKey key : InstrumentKey.all()) {
                try {
                    momentumTracker.update(key);
                    patternScores.update(key);
                } catch (Exception e) {
                    errorMonitoring.recordError("sweep:analysis:" + key, e.getMessage(), e);
                }
            }
            Map<IndexName, MarketState> states = new EnumMap<>(IndexName.class);
            for (IndexName index : IndexName.values()) {
                states.put(index, classifier.classify(index));
            }
            for (InstrumentKey key : InstrumentKey.all()) {
                try {
                    runPass(key, states.get(key.index()), SWEEP_ENTRIES);
                } catch (Exception e) {
                    errorMonitoring.recordError("sweep:" + key, e.getMessage(), e);
                }
            }
        } finally {
            metrics.recordSweep(System.nanoTime() - start);
        }
    }

    private void runPass(InstrumentKey key, MarketState state, List<StrategyKind> entryKinds) {
        Optional<StrategyContext> context = buildContext(key, state);
        if (context.isEmpty()) {
            log.debug("[Strategy] No price yet for {}, skipped", key);
            return;
        }
        PositionSnapshot position = positionStore.snapshot(key);
        if (position.isActive()) {
            manage(context.get(), position);
            return;
        }
        for (StrategyKind kind : entryKinds) {
            try {
                if (tryEnter(context.get(), kind)) {
                    return;
                }
            } catch (Exception e) {
                errorMonitoring.recordError("entry:" + key + ":" + kind, e.getMessage(), e);
            }
        }
    }

    private void manage(StrategyContext context, PositionSnapshot position) {
        TradingStrategy strategy = strategies.get(position.getStrategyKind());
        Optional<ExitReason> reason = exitEvaluator.evaluate(context, position, strategy);
        if (reason.isPresent()) {
            positionStore.close(position, context.getPrice(), reason.get()).ifPresent(this::recordExit);
            return;
        }
        trailingStops.update(position, context.getPrice(), context.getMarketState());
    }

    private boolean tryEnter(StrategyContext context, StrategyKind kind) {
        if (!entryGatesOpen(context.getKey(), kind)) {
            return false;
        }
        TradingStrategy strategy = strategies.get(kind);
        if (!strategy.shouldEnter(context)) {
            return false;
        }
        return open(context, strategy).isEntered();
    }

    /** Limits first, then the leg must be flat, then the enable switches. */
    private boolean entryGatesOpen(InstrumentKey key, StrategyKind kind) {
        if (!limitGuard.isEntryAllowed()) {
            return false;
        }
        if (positionStore.snapshot(key).isActive()) {
            return false;
        }
        if (!riskSettings.tradingAllowed(key.index())) {
            return false;
        }
        return !kind.isScalping() || riskSettings.scalpingAllowed(key.index());
    }

    private EntryOutcome open(StrategyContext context, TradingStrategy strategy) {
        InstrumentKey key = context.getKey();
        StrategyKind kind = strategy.kind();
        double price = context.getPrice();
        SizingResult sizing = sizer.size(key.index(), key.leg(), price, kind);
        if (!sizing.isValid()) {
            log.warn("⚠️ [Strategy] Invalid sizing for {} {} at {}: {}", key, kind, price, sizing);
            return EntryOutcome.INVALID_SIZING;
        }
        double targetMultiplier = strategy.targetMultiplier(context);
        if (targetMultiplier <= 0) {
            log.warn("⚠️ [Strategy] No target for {} {} (multiplier={}), entry rejected", key, kind, targetMultiplier);
            return EntryOutcome.NO_TARGET;
        }
        double distance = sizing.stopLossDistance();
        EntryOrder order = EntryOrder.builder()
                .key(key)
                .strategyKind(kind)
                .entryPrice(price)
                .stopLoss(price - distance)
                .target(price + distance * targetMultiplier)
                .quantity(sizing.quantity())
                .underlyingEntryPrice(historyStore.lastPrice(key.index(), PriceChannel.SPOT))
                .customTrailingActivationPct(strategy.customTrailingActivationPct(key))
                .expiryDate(expiryCalendar.currentExpiry(key.index()))
                .build();
        if (!positionStore.open(order)) {
            return positionStore.snapshot(key).isActive() ? EntryOutcome.POSITION_ACTIVE : EntryOutcome.DAILY_LIMIT;
        }
        metrics.recordEntry(kind);
        return EntryOutcome.ENTERED;
    }

    private Optional<StrategyContext> buildContext(InstrumentKey key, MarketState state) {
        Double price = historyStore.lastPrice(key.index(), key.leg().channel());
        if (price == null || price <= 0) {
            return Optional.empty();
        }
        return Optional.of(StrategyContext.builder()
                .key(key)
                .price(price)
                .signal(signalEngine.signal(key))
                .marketState(state)
                .patternScore(patternScores.score(key))
                .momentum(momentumTracker.recent(key, MOMENTUM_READINGS))
                .expiryDay(expiryCalendar.isExpiryDay(key.index()))
                .now(LocalDateTime.now(clock))
                .build());
    }

    private void recordExit(TradeRecord record) {
        metrics.recordExit(record.getStrategyKind(), record.getExitReason());
    }

    /** All entry gates plus the strategy's own criteria, without entering. */
    public boolean shouldEnterTrade(InstrumentKey key, StrategyKind kind) {
        Optional<StrategyContext> context = buildContext(key, classifier.classify(key.index()));
        return context.isPresent()
                && entryGatesOpen(key, kind)
                && strategies.get(kind).shouldEnter(context.get());
    }

    /**
     * Manual entry at the leg's last price. Bypasses the strategy criteria but not the
     * position invariants or the daily limits.
     */
    public EntryOutcome enterTrade(InstrumentKey key, StrategyKind kind) {
        Optional<StrategyContext> context = buildContext(key, classifier.classify(key.index()));
        if (context.isEmpty()) {
            log.warn("⚠️ [Strategy] Manual entry for {} rejected, no price", key);
            return EntryOutcome.NO_PRICE;
        }
        return open(context.get(), strategies.get(kind));
    }

    /** Manual exit at the leg's last price. */
    public Optional<TradeRecord> exitTrade(InstrumentKey key, ExitReason reason) {
        Double price = historyStore.lastPrice(key.index(), key.leg().channel());
        if (price == null) {
            log.warn("⚠️ [Strategy] Manual exit for {} rejected, no price", key);
            return Optional.empty();
        }
        Optional<TradeRecord> record = positionStore.close(key, price, reason);
        record.ifPresent(this::recordExit);
        return record;
    }
}
