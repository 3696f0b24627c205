package com.kotsin.optionsengine.service;

import com.kotsin.optionsengine.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TradingHoursService
 * Tests NSE/BSE session hours and the scalping edge windows
 */
class TradingHoursServiceTest {

    private final MutableClock clock = MutableClock.at(LocalDateTime.of(2026, 1, 14, 12, 0));
    private final TradingHoursService service = new TradingHoursService(clock);

    @Test
    @DisplayName("Market is open at noon on a weekday")
    void testMarketHours() {
        assertTrue(service.isMarketOpenNow(), "Market should be open at 12:00 PM");
    }

    @Test
    @DisplayName("Market is closed after 3:30 PM")
    void testAfterClose() {
        clock.set(LocalDateTime.of(2026, 1, 14, 15, 45));
        assertFalse(service.isMarketOpenNow(), "Market should be closed at 3:45 PM");
    }

    @Test
    @DisplayName("Market is closed on weekends")
    void testWeekendRejected() {
        LocalDateTime saturday = LocalDateTime.of(2026, 1, 17, 12, 0);
        LocalDateTime sunday = LocalDateTime.of(2026, 1, 18, 12, 0);

        assertFalse(service.isMarketOpen(saturday), "Should reject Saturday");
        assertFalse(service.isMarketOpen(sunday), "Should reject Sunday");
    }

    @ParameterizedTest
    @CsvSource({
        "9, 14, false",   // before open
        "9, 15, true",    // open (edge)
        "15, 30, true",   // close (edge)
        "15, 31, false",  // after close
        "20, 30, false",
    })
    @DisplayName("Session boundary tests")
    void testSessionBoundaries(int hour, int minute, boolean expected) {
        LocalDateTime time = LocalDateTime.of(2026, 1, 14, hour, minute);
        assertEquals(expected, service.isMarketOpen(time),
                String.format("%02d:%02d should be %s", hour, minute, expected ? "open" : "closed"));
    }

    @ParameterizedTest
    @CsvSource({
        "9, 0, true, false",    // pre-open counts as opening window
        "9, 29, true, false",
        "9, 30, false, false",
        "12, 0, false, false",
        "15, 15, false, false",
        "15, 16, false, true",
        "16, 0, false, true",
    })
    @DisplayName("Opening and closing edge windows")
    void testEdgeWindows(int hour, int minute, boolean opening, boolean closing) {
        LocalTime t = LocalTime.of(hour, minute);
        assertEquals(opening, service.isInOpeningWindow(t), "opening window at " + t);
        assertEquals(closing, service.isInClosingWindow(t), "closing window at " + t);
        assertEquals(!opening && !closing, service.isOutsideEdgeWindows(t));
    }
}
