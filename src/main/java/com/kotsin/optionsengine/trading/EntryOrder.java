package com.kotsin.optionsengine.trading;

import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.StrategyKind;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Fully priced entry intent. Stop and target are fixed before the order reaches the store.
 */
@Value
@Builder
public class EntryOrder {
    InstrumentKey key;
    StrategyKind strategyKind;
    double entryPrice;
    double stopLoss;
    double target;
    int quantity;
    Double underlyingEntryPrice;
    Double customTrailingActivationPct;
    LocalDate expiryDate;

    boolean isWellFormed() {
        return quantity > 0 && entryPrice > 0 && stopLoss < entryPrice && target > entryPrice;
    }
}
