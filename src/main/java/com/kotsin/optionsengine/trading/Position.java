package com.kotsin.optionsengine.trading;

import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.PositionSnapshot;
import com.kotsin.optionsengine.model.PositionStatus;
import com.kotsin.optionsengine.model.StrategyKind;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Mutable per-leg position. Only touched by {@link PositionStore} while holding its lock.
 */
class Position {

    private final InstrumentKey key;
    private PositionStatus status = PositionStatus.FLAT;
    private long positionId;
    private double entryPrice;
    private LocalDateTime entryTime;
    private double stopLoss;
    private double initialStopLoss;
    private double target;
    private boolean trailingActivated;
    private int quantity;
    private StrategyKind strategyKind;
    private Double underlyingEntryPrice;
    private Double customTrailingActivationPct;
    private LocalDate expiryDate;

    Position(InstrumentKey key) {
        this.key = key;
    }

    void open(long id, EntryOrder order, LocalDateTime now) {
        status = PositionStatus.ACTIVE;
        positionId = id;
        entryPrice = order.getEntryPrice();
        entryTime = now;
        stopLoss = order.getStopLoss();
        initialStopLoss = order.getStopLoss();
        target = order.getTarget();
        trailingActivated = false;
        quantity = order.getQuantity();
        strategyKind = order.getStrategyKind();
        underlyingEntryPrice = order.getUnderlyingEntryPrice();
        customTrailingActivationPct = order.getCustomTrailingActivationPct();
        expiryDate = order.getExpiryDate();
    }

    void reset() {
        status = PositionStatus.FLAT;
        positionId = 0;
        entryPrice = 0;
        entryTime = null;
        stopLoss = 0;
        initialStopLoss = 0;
        target = 0;
        trailingActivated = false;
        quantity = 0;
        strategyKind = null;
        underlyingEntryPrice = null;
        customTrailingActivationPct = null;
        expiryDate = null;
    }

    boolean isActive() {
        return status == PositionStatus.ACTIVE;
    }

    long getPositionId() {
        return positionId;
    }

    double getEntryPrice() {
        return entryPrice;
    }

    LocalDateTime getEntryTime() {
        return entryTime;
    }

    double getStopLoss() {
        return stopLoss;
    }

    void setStopLoss(double stopLoss) {
        this.stopLoss = stopLoss;
    }

    boolean isTrailingActivated() {
        return trailingActivated;
    }

    void activateTrailing() {
        trailingActivated = true;
    }

    int getQuantity() {
        return quantity;
    }

    StrategyKind getStrategyKind() {
        return strategyKind;
    }

    LocalDate getExpiryDate() {
        return expiryDate;
    }

    PositionSnapshot snapshot() {
        if (!isActive()) {
            return PositionSnapshot.flat(key);
        }
        return PositionSnapshot.builder()
                .key(key)
                .status(status)
                .positionId(positionId)
                .entryPrice(entryPrice)
                .entryTime(entryTime)
                .stopLoss(stopLoss)
                .initialStopLoss(initialStopLoss)
                .target(target)
                .trailingActivated(trailingActivated)
                .quantity(quantity)
                .strategyKind(strategyKind)
                .underlyingEntryPrice(underlyingEntryPrice)
                .customTrailingActivationPct(customTrailingActivationPct)
                .expiryDate(expiryDate)
                .build();
    }
}
