package com.kotsin.optionsengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A closed round trip. Appended to history on exit and published downstream.
 */
@Value
@Builder
public class TradeRecord {

    String id;
    IndexName index;
    OptionLeg leg;
    StrategyKind strategyKind;
    LocalDateTime entryTime;
    LocalDateTime exitTime;
    double entryPrice;
    double exitPrice;
    int quantity;
    double pnl;
    double pnlPct;
    ExitReason exitReason;
    LocalDate expiryDate;

    public InstrumentKey key() {
        return InstrumentKey.of(index, leg);
    }

    public boolean isWin() {
        return pnl > 0;
    }

    public double durationMinutes() {
        if (entryTime == null || exitTime == null) {
            return 0.0;
        }
        return Duration.between(entryTime, exitTime).getSeconds() / 60.0;
    }
}
