package com.kotsin.optionsengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class DailyPerformance {
    LocalDate date;
    int trades;
    int wins;
    double pnl;

    public double winRatePct() {
        return trades == 0 ? 0.0 : wins * 100.0 / trades;
    }
}
