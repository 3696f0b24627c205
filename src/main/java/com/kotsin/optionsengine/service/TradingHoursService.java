package com.kotsin.optionsengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Market-hours guard for NSE/BSE: 09:15–15:30 IST, Mon–Fri, plus the 15-minute edge
 * windows after the open and before the close in which scalping stays out.
 */
@Service
@Slf4j
public class TradingHoursService {

    public static final LocalTime OPEN = LocalTime.of(9, 15);
    public static final LocalTime CLOSE = LocalTime.of(15, 30);
    public static final int EDGE_WINDOW_MINUTES = 15;

    private final Clock clock;

    public TradingHoursService(Clock clock) {
        this.clock = clock;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public boolean isMarketOpen(LocalDateTime at) {
        DayOfWeek dow = at.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) return false;
        LocalTime t = at.toLocalTime();
        return !t.isBefore(OPEN) && !t.isAfter(CLOSE);
    }

    public boolean isMarketOpenNow() {
        return isMarketOpen(now());
    }

    /** Before the open, or within the first 15 minutes of the session. */
    public boolean isInOpeningWindow(LocalTime t) {
        return t.isBefore(OPEN.plusMinutes(EDGE_WINDOW_MINUTES));
    }

    /** Within the last 15 minutes of the session, or after the close. */
    public boolean isInClosingWindow(LocalTime t) {
        return t.isAfter(CLOSE.minusMinutes(EDGE_WINDOW_MINUTES));
    }

    public boolean isOutsideEdgeWindows(LocalTime t) {
        return !isInOpeningWindow(t) && !isInClosingWindow(t);
    }
}
