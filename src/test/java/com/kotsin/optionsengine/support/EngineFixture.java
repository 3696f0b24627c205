package com.kotsin.optionsengine.support;

import com.kotsin.optionsengine.analysis.MarketStateClassifier;
import com.kotsin.optionsengine.analysis.MomentumTracker;
import com.kotsin.optionsengine.analysis.PatternDetector;
import com.kotsin.optionsengine.analysis.PatternScoreService;
import com.kotsin.optionsengine.analysis.SignalEngine;
import com.kotsin.optionsengine.config.MarketDataSettings;
import com.kotsin.optionsengine.config.RiskSettings;
import com.kotsin.optionsengine.config.StrategySettings;
import com.kotsin.optionsengine.indicator.IndicatorLibrary;
import com.kotsin.optionsengine.indicator.StandardIndicatorLibrary;
import com.kotsin.optionsengine.market.MarketDataService;
import com.kotsin.optionsengine.market.PriceHistoryStore;
import com.kotsin.optionsengine.market.PriceUpdateListener;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.PriceChannel;
import com.kotsin.optionsengine.model.StrategyKind;
import com.kotsin.optionsengine.model.TradeRecord;
import com.kotsin.optionsengine.risk.PositionSizer;
import com.kotsin.optionsengine.risk.TradingLimitGuard;
import com.kotsin.optionsengine.service.EngineMetrics;
import com.kotsin.optionsengine.service.ErrorMonitoringService;
import com.kotsin.optionsengine.service.ExpiryCalendar;
import com.kotsin.optionsengine.service.TradingHoursService;
import com.kotsin.optionsengine.strategy.AdaptiveScalpingStrategy;
import com.kotsin.optionsengine.strategy.AdaptiveTuner;
import com.kotsin.optionsengine.strategy.ExitEvaluator;
import com.kotsin.optionsengine.strategy.ExpiryScalpingStrategy;
import com.kotsin.optionsengine.strategy.MomentumScalpingStrategy;
import com.kotsin.optionsengine.strategy.PatternScalpingStrategy;
import com.kotsin.optionsengine.strategy.RegularStrategy;
import com.kotsin.optionsengine.strategy.StandardScalpingStrategy;
import com.kotsin.optionsengine.strategy.StrategyEngine;
import com.kotsin.optionsengine.strategy.TradingStrategy;
import com.kotsin.optionsengine.strategy.TrailingStopService;
import com.kotsin.optionsengine.trading.EntryOrder;
import com.kotsin.optionsengine.trading.PositionStore;
import com.kotsin.optionsengine.trading.TradeRecordListener;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The whole engine wired by hand around a {@link MutableClock}, the way Spring would wire it.
 */
public class EngineFixture {

    /** A Wednesday, mid-session, not an expiry day. */
    public static final LocalDateTime MIDDAY = LocalDateTime.of(2026, 1, 14, 11, 0);
    /** A Thursday, mid-session, weekly expiry day. */
    public static final LocalDateTime EXPIRY_MIDDAY = LocalDateTime.of(2026, 1, 15, 11, 0);

    public final MutableClock clock;
    public final RiskSettings risk = new RiskSettings();
    public final StrategySettings strategySettings = new StrategySettings();
    public final MarketDataSettings marketSettings = new MarketDataSettings();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final List<TradeRecord> closedTrades = new CopyOnWriteArrayList<>();

    public final IndicatorLibrary indicators;
    public final PriceHistoryStore history;
    public final SignalEngine signals;
    public final MarketStateClassifier classifier;
    public final MomentumTracker momentum;
    public final PatternDetector detector;
    public final PatternScoreService patterns;
    public final AdaptiveTuner tuner;
    public final PositionStore store;
    public final PositionSizer sizer;
    public final TradingLimitGuard limits;
    public final TradingHoursService hours;
    public final ExpiryCalendar expiry;
    public final EngineMetrics metrics;
    public final ErrorMonitoringService errors;
    public final ExitEvaluator exitEvaluator;
    public final TrailingStopService trailing;
    public final List<TradingStrategy> strategies;
    public final StrategyEngine engine;
    public final MarketDataService marketData;

    public EngineFixture(LocalDateTime start) {
        this(start, new StandardIndicatorLibrary());
    }

    public EngineFixture(LocalDateTime start, IndicatorLibrary indicators) {
        this.clock = MutableClock.at(start);
        this.indicators = indicators;
        this.history = new PriceHistoryStore(marketSettings);
        this.signals = new SignalEngine(history, indicators);
        this.classifier = new MarketStateClassifier(history);
        this.momentum = new MomentumTracker(history);
        this.detector = new PatternDetector();
        this.patterns = new PatternScoreService(history, detector);
        this.tuner = new AdaptiveTuner(classifier);
        this.store = new PositionStore(risk, List.<TradeRecordListener>of(tuner, closedTrades::add), clock);
        this.sizer = new PositionSizer(risk, history, indicators);
        this.limits = new TradingLimitGuard(store, risk);
        this.hours = new TradingHoursService(clock);
        this.expiry = new ExpiryCalendar(clock);
        this.metrics = new EngineMetrics(meterRegistry);
        this.errors = new ErrorMonitoringService(metrics);
        this.exitEvaluator = new ExitEvaluator();
        this.trailing = new TrailingStopService(store, risk);
        this.strategies = List.of(
                new RegularStrategy(strategySettings),
                new StandardScalpingStrategy(hours, strategySettings),
                new MomentumScalpingStrategy(hours, momentum, strategySettings),
                new PatternScalpingStrategy(hours, patterns, strategySettings),
                new AdaptiveScalpingStrategy(hours, tuner),
                new ExpiryScalpingStrategy(hours, strategySettings));
        this.engine = engineWith(strategies);
        this.marketData = new MarketDataService(history, List.<PriceUpdateListener>of(engine), clock);
    }

    /** A second engine over the same state, with a different strategy set. */
    public StrategyEngine engineWith(List<TradingStrategy> strategyList) {
        return new StrategyEngine(history, signals, classifier, momentum, patterns, store, sizer, limits,
                exitEvaluator, trailing, tuner, expiry, risk, errors, metrics, clock, new ArrayList<>(strategyList));
    }

    public TradingStrategy strategy(StrategyKind kind) {
        for (TradingStrategy strategy : strategies) {
            if (strategy.kind() == kind) {
                return strategy;
            }
        }
        throw new IllegalArgumentException(kind.name());
    }

    /** Appends straight to history; no tick pass runs. */
    public void append(IndexName index, PriceChannel channel, double... prices) {
        for (double price : prices) {
            history.append(index, channel, price, 100L, LocalDateTime.now(clock));
        }
    }

    public void appendLeg(InstrumentKey key, double... prices) {
        append(key.index(), key.leg().channel(), prices);
    }

    /** Spot alternating 20000/20020: volatility about 0.1 (MEDIUM), no trend. */
    public void mediumVolatilitySpot(IndexName index, int points) {
        for (int i = 0; i < points; i++) {
            append(index, PriceChannel.SPOT, i % 2 == 0 ? 20000.0 : 20020.0);
        }
    }

    public static double[] repeat(double price, int count) {
        double[] out = new double[count];
        Arrays.fill(out, price);
        return out;
    }

    public EntryOrder order(InstrumentKey key, StrategyKind kind, double entry, double stop, double target, int quantity) {
        return EntryOrder.builder()
                .key(key)
                .strategyKind(kind)
                .entryPrice(entry)
                .stopLoss(stop)
                .target(target)
                .quantity(quantity)
                .expiryDate(expiry.currentExpiry(key.index()))
                .build();
    }
}
