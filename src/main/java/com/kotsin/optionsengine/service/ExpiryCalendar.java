package com.kotsin.optionsengine.service;

import com.kotsin.optionsengine.model.IndexName;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Weekly Thursday expiry. From 15:00 on expiry Thursday the next week's contract is current.
 */
@Service
public class ExpiryCalendar {

    public static final DayOfWeek EXPIRY_DAY = DayOfWeek.THURSDAY;
    public static final int ROLL_HOUR = 15;

    private final Clock clock;

    public ExpiryCalendar(Clock clock) {
        this.clock = clock;
    }

    public LocalDate currentExpiry(IndexName index) {
        return expiryFor(index, LocalDateTime.now(clock));
    }

    public LocalDate expiryFor(IndexName index, LocalDateTime at) {
        int daysAhead = (EXPIRY_DAY.getValue() - at.getDayOfWeek().getValue() + 7) % 7;
        if (daysAhead == 0 && at.getHour() >= ROLL_HOUR) {
            daysAhead = 7;
        }
        return at.toLocalDate().plusDays(daysAhead);
    }

    public boolean isExpiryDay(IndexName index) {
        LocalDateTime now = LocalDateTime.now(clock);
        return expiryFor(index, now).equals(now.toLocalDate());
    }
}
