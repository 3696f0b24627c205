package com.kotsin.optionsengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Immutable copy of one leg's position, taken under the trade-state lock.
 * Price fields are null while FLAT.
 */
@Value
@Builder
public class PositionSnapshot {

    InstrumentKey key;
    PositionStatus status;
    long positionId;

    Double entryPrice;
    LocalDateTime entryTime;
    Double stopLoss;
    Double initialStopLoss;
    Double target;
    boolean trailingActivated;
    int quantity;
    StrategyKind strategyKind;
    Double underlyingEntryPrice;
    Double customTrailingActivationPct;
    LocalDate expiryDate;

    public static PositionSnapshot flat(InstrumentKey key) {
        return PositionSnapshot.builder().key(key).status(PositionStatus.FLAT).build();
    }

    public boolean isActive() {
        return status == PositionStatus.ACTIVE;
    }

    public double profitPct(double price) {
        if (!isActive() || entryPrice == null || entryPrice <= 0) {
            return 0.0;
        }
        return (price - entryPrice) / entryPrice * 100.0;
    }

    public double minutesHeld(LocalDateTime now) {
        if (entryTime == null) {
            return 0.0;
        }
        return Duration.between(entryTime, now).getSeconds() / 60.0;
    }
}
