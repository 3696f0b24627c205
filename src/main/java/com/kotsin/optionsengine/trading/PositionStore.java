package com.kotsin.optionsengine.trading;

import com.kotsin.optionsengine.config.RiskSettings;
import com.kotsin.optionsengine.model.AggregateStats;
import com.kotsin.optionsengine.model.DailyPerformance;
import com.kotsin.optionsengine.model.ExitReason;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.PositionSnapshot;
import com.kotsin.optionsengine.model.StrategyKind;
import com.kotsin.optionsengine.model.StrategyStats;
import com.kotsin.optionsengine.model.TimeOfDayBucket;
import com.kotsin.optionsengine.model.TradeRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owner of all trade state: the six positions, closed-trade history and session counters.
 * <p>
 * Every transition runs under one lock and re-validates the position state, so a decision
 * taken on a stale snapshot becomes a rejected no-op. Listeners are notified after the
 * lock is released.
 */
@Service
@Slf4j
public class PositionStore {

    private final ReentrantLock tradeLock = new ReentrantLock();
    private final Map<InstrumentKey, Position> positions = new HashMap<>();
    private final List<TradeRecord> history = new ArrayList<>();
    private final RiskSettings riskSettings;
    private final List<TradeRecordListener> listeners;
    private final Clock clock;

    private long positionSequence;
    private double totalPnl;
    private double dailyPnl;
    private int wins;
    private int losses;
    private int tradesToday;
    private LocalDate tradingDay;
    private final Map<IndexName, Double> indexPnl = new EnumMap<>(IndexName.class);
    private final Map<IndexName, Integer> indexTrades = new EnumMap<>(IndexName.class);
    private final Map<StrategyKind, Tally> strategyTallies = new EnumMap<>(StrategyKind.class);
    private final Map<TimeOfDayBucket, Tally> timeOfDayTallies = new EnumMap<>(TimeOfDayBucket.class);
    private final Map<LocalDate, DailyPerformance> scalpingByDay = new TreeMap<>();

    public PositionStore(RiskSettings riskSettings, List<TradeRecordListener> listeners, Clock clock) {
        this.riskSettings = riskSettings;
        this.listeners = listeners;
        this.clock = clock;
        this.tradingDay = LocalDate.now(clock);
        for (InstrumentKey key : InstrumentKey.all()) {
            positions.put(key, new Position(key));
        }
        for (IndexName index : IndexName.values()) {
            indexPnl.put(index, 0.0);
            indexTrades.put(index, 0);
        }
        for (StrategyKind kind : StrategyKind.values()) {
            strategyTallies.put(kind, new Tally());
        }
        for (TimeOfDayBucket bucket : TimeOfDayBucket.values()) {
            timeOfDayTallies.put(bucket, new Tally());
        }
    }

    /**
     * Opens a position from a fully priced order.
     *
     * @return false without any mutation when the leg is already active, the order is
     * malformed or a daily limit has been reached
     */
    public boolean open(EntryOrder order) {
        InstrumentKey key = order.getKey();
        tradeLock.lock();
        try {
            rollOverIfNeeded();
            Position position = positions.get(key);
            if (position.isActive()) {
                log.debug("[PositionStore] {} already active, entry rejected", key);
                return false;
            }
            if (!order.isWellFormed()) {
                log.warn("⚠️ [PositionStore] Malformed entry for {}: {}", key, order);
                return false;
            }
            if (tradesToday >= riskSettings.getMaxTradesPerDay() || dailyPnl <= -riskSettings.maxDailyLoss()) {
                log.debug("[PositionStore] Daily limit reached, entry for {} rejected", key);
                return false;
            }
            position.open(++positionSequence, order, LocalDateTime.now(clock));
            tradesToday++;
            indexTrades.merge(key.index(), 1, Integer::sum);
            strategyTallies.get(order.getStrategyKind()).trades++;
            log.info("🟢 [PositionStore] ENTER {} kind={} price={} qty={} SL={} target={}",
                    key, order.getStrategyKind(), order.getEntryPrice(), order.getQuantity(),
                    round(order.getStopLoss()), round(order.getTarget()));
            return true;
        } finally {
            tradeLock.unlock();
        }
    }

    /** Closes whatever is active on the leg. */
    public Optional<TradeRecord> close(InstrumentKey key, double exitPrice, ExitReason reason) {
        return close(key, 0L, exitPrice, reason);
    }

    /** Closes the leg only if it still holds the position the snapshot was taken from. */
    public Optional<TradeRecord> close(PositionSnapshot expected, double exitPrice, ExitReason reason) {
        if (!expected.isActive()) {
            return Optional.empty();
        }
        return close(expected.getKey(), expected.getPositionId(), exitPrice, reason);
    }

    private Optional<TradeRecord> close(InstrumentKey key, long expectedId, double exitPrice, ExitReason reason) {
        if (exitPrice <= 0) {
            log.warn("⚠️ [PositionStore] Exit for {} ignored, no valid price ({})", key, exitPrice);
            return Optional.empty();
        }
        TradeRecord record;
        tradeLock.lock();
        try {
            rollOverIfNeeded();
            Position position = positions.get(key);
            if (!position.isActive() || (expectedId > 0 && position.getPositionId() != expectedId)) {
                log.debug("[PositionStore] {} has no matching active position, exit ignored", key);
                return Optional.empty();
            }
            LocalDateTime now = LocalDateTime.now(clock);
            double pnl = (exitPrice - position.getEntryPrice()) * position.getQuantity();
            double pnlPct = (exitPrice - position.getEntryPrice()) / position.getEntryPrice() * 100.0;
            record = TradeRecord.builder()
                    .id(key + "-" + position.getPositionId())
                    .index(key.index())
                    .leg(key.leg())
                    .strategyKind(position.getStrategyKind())
                    .entryTime(position.getEntryTime())
                    .exitTime(now)
                    .entryPrice(position.getEntryPrice())
                    .exitPrice(exitPrice)
                    .quantity(position.getQuantity())
                    .pnl(pnl)
                    .pnlPct(pnlPct)
                    .exitReason(reason)
                    .expiryDate(position.getExpiryDate())
                    .build();
            history.add(record);
            settle(record);
            position.reset();
        } finally {
            tradeLock.unlock();
        }

        log.info("{} [PositionStore] EXIT {} kind={} reason={} entry={} exit={} pnl={} ({}%)",
                record.isWin() ? "✅" : "❌", key, record.getStrategyKind(), reason,
                record.getEntryPrice(), exitPrice, round(record.getPnl()), round(record.getPnlPct()));
        for (TradeRecordListener listener : listeners) {
            try {
                listener.onTradeClosed(record);
            } catch (Exception e) {
                log.error("🚨 [PositionStore] Listener {} failed for {}: {}",
                        listener.getClass().getSimpleName(), record.getId(), e.getMessage(), e);
            }
        }
        return Optional.of(record);
    }

    /**
     * Applies a trailing-stop decision to the position the snapshot was taken from.
     * The stop only moves when the candidate is strictly higher.
     *
     * @return true when the stop moved
     */
    public boolean applyTrailing(PositionSnapshot expected, boolean activate, double candidateStop) {
        tradeLock.lock();
        try {
            Position position = positions.get(expected.getKey());
            if (!position.isActive() || position.getPositionId() != expected.getPositionId()) {
                return false;
            }
            if (activate && !position.isTrailingActivated()) {
                position.activateTrailing();
            }
            if (position.isTrailingActivated() && candidateStop > position.getStopLoss()) {
                position.setStopLoss(candidateStop);
                return true;
            }
            return false;
        } finally {
            tradeLock.unlock();
        }
    }

    public PositionSnapshot snapshot(InstrumentKey key) {
        tradeLock.lock();
        try {
            return positions.get(key).snapshot();
        } finally {
            tradeLock.unlock();
        }
    }

    public List<PositionSnapshot> snapshots() {
        tradeLock.lock();
        try {
            List<PositionSnapshot> out = new ArrayList<>();
            for (InstrumentKey key : InstrumentKey.all()) {
                out.add(positions.get(key).snapshot());
            }
            return out;
        } finally {
            tradeLock.unlock();
        }
    }

    public List<TradeRecord> history() {
        tradeLock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(history));
        } finally {
            tradeLock.unlock();
        }
    }

    public List<TradeRecord> historyFor(LocalDate day) {
        List<TradeRecord> out = new ArrayList<>();
        for (TradeRecord record : history()) {
            if (record.getExitTime() != null && record.getExitTime().toLocalDate().equals(day)) {
                out.add(record);
            }
        }
        return out;
    }

    public AggregateStats stats() {
        tradeLock.lock();
        try {
            rollOverIfNeeded();
            Map<StrategyKind, StrategyStats> strategies = new EnumMap<>(StrategyKind.class);
            strategyTallies.forEach((kind, tally) -> strategies.put(kind, tally.toStats()));
            Map<TimeOfDayBucket, StrategyStats> buckets = new EnumMap<>(TimeOfDayBucket.class);
            timeOfDayTallies.forEach((bucket, tally) -> buckets.put(bucket, tally.toStats()));
            return AggregateStats.builder()
                    .totalPnl(totalPnl)
                    .dailyPnl(dailyPnl)
                    .wins(wins)
                    .losses(losses)
                    .tradesToday(tradesToday)
                    .tradingDay(tradingDay)
                    .indexPnl(new EnumMap<>(indexPnl))
                    .indexTrades(new EnumMap<>(indexTrades))
                    .strategyStats(strategies)
                    .scalpingPerformanceByDay(new TreeMap<>(scalpingByDay))
                    .timeOfDayStats(buckets)
                    .build();
        } finally {
            tradeLock.unlock();
        }
    }

    /**
     * Resets the daily counters when the clock has moved to a new day. Safe to call from
     * any thread any number of times.
     *
     * @return true if this call performed the rollover
     */
    public boolean checkDayRollover() {
        tradeLock.lock();
        try {
            return rollOverIfNeeded();
        } finally {
            tradeLock.unlock();
        }
    }

    private boolean rollOverIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        if (today.equals(tradingDay)) {
            return false;
        }
        LocalDate finished = tradingDay;
        summariseScalpingDay(finished);
        log.info("📅 [PositionStore] Day rollover {} -> {}: trades={} dailyPnl={}",
                finished, today, tradesToday, round(dailyPnl));
        tradesToday = 0;
        dailyPnl = 0.0;
        tradingDay = today;
        return true;
    }

    private void settle(TradeRecord record) {
        double pnl = record.getPnl();
        totalPnl += pnl;
        dailyPnl += pnl;
        if (pnl > 0) {
            wins++;
        } else {
            losses++;
        }
        indexPnl.merge(record.getIndex(), pnl, Double::sum);
        strategyTallies.get(record.getStrategyKind()).settle(pnl);
        timeOfDayTallies.get(TimeOfDayBucket.of(record.getEntryTime().toLocalTime())).settleRoundTrip(pnl);
        if (record.getStrategyKind().countsTowardDailyScalping()) {
            LocalDate day = record.getExitTime().toLocalDate();
            DailyPerformance current = scalpingByDay.get(day);
            scalpingByDay.put(day, DailyPerformance.builder()
                    .date(day)
                    .trades(current == null ? 1 : current.getTrades() + 1)
                    .wins((current == null ? 0 : current.getWins()) + (pnl > 0 ? 1 : 0))
                    .pnl((current == null ? 0.0 : current.getPnl()) + pnl)
                    .build());
        }
    }

    /** Rebuilds the finished day's scalping entry from history. */
    private void summariseScalpingDay(LocalDate day) {
        int trades = 0;
        int dayWins = 0;
        double pnl = 0.0;
        for (TradeRecord record : history) {
            if (record.getStrategyKind().countsTowardDailyScalping() && record.getExitTime().toLocalDate().equals(day)) {
                trades++;
                if (record.isWin()) dayWins++;
                pnl += record.getPnl();
            }
        }
        if (trades > 0) {
            scalpingByDay.put(day, DailyPerformance.builder().date(day).trades(trades).wins(dayWins).pnl(pnl).build());
            log.info("📊 [PositionStore] Scalping {}: trades={} wins={} pnl={}", day, trades, dayWins, round(pnl));
        }
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static final class Tally {
        int trades;
        int wins;
        int losses;
        double pnl;

        void settle(double result) {
            pnl += result;
            if (result > 0) wins++;
            else losses++;
        }

        void settleRoundTrip(double result) {
            trades++;
            settle(result);
        }

        StrategyStats toStats() {
            return StrategyStats.builder().trades(trades).wins(wins).losses(losses).pnl(pnl).build();
        }
    }
}
