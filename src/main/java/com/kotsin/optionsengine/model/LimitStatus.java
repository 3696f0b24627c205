package com.kotsin.optionsengine.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LimitStatus {
    int tradesToday;
    int maxTradesPerDay;
    double dailyPnl;
    double maxDailyLoss;
    boolean tradeCapReached;
    boolean lossCapReached;

    public boolean isEntryAllowed() {
        return !tradeCapReached && !lossCapReached;
    }
}
