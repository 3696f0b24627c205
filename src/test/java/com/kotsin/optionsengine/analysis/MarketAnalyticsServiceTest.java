package com.kotsin.optionsengine.analysis;

import com.kotsin.optionsengine.config.MarketDataSettings;
import com.kotsin.optionsengine.market.PriceHistoryStore;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.PriceChannel;
import com.kotsin.optionsengine.model.PriceRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MarketAnalyticsService
 */
class MarketAnalyticsServiceTest {

    private static final LocalDateTime TS = LocalDateTime.of(2026, 1, 14, 11, 0);

    private final PriceHistoryStore history = new PriceHistoryStore(new MarketDataSettings());
    private final MarketAnalyticsService analytics = new MarketAnalyticsService(history);

    @Test
    @DisplayName("Put/call ratio is 1.0 without volume")
    void testPcrNoData() {
        assertEquals(1.0, analytics.putCallRatio(IndexName.NIFTY), 1e-9);
    }

    @Test
    @DisplayName("Put/call ratio divides total put volume by total call volume")
    void testPcr() {
        history.append(IndexName.NIFTY, PriceChannel.PUT, 120, 200L, TS);
        history.append(IndexName.NIFTY, PriceChannel.PUT, 121, 100L, TS);
        history.append(IndexName.NIFTY, PriceChannel.CALL, 95, 150L, TS);

        assertEquals(2.0, analytics.putCallRatio(IndexName.NIFTY), 1e-9);
    }

    @Test
    @DisplayName("Missing call volume counts as one")
    void testPcrNoCallVolume() {
        history.append(IndexName.BANKNIFTY, PriceChannel.PUT, 300, 40L, TS);
        assertEquals(40.0, analytics.putCallRatio(IndexName.BANKNIFTY), 1e-9);
    }

    @Test
    @DisplayName("No predicted range below thirty spot points")
    void testRangeNeedsHistory() {
        for (int i = 0; i < MarketAnalyticsService.MIN_RANGE_POINTS - 1; i++) {
            history.append(IndexName.NIFTY, PriceChannel.SPOT, 20000 + i, 0L, TS);
        }
        assertTrue(analytics.predictedRange(IndexName.NIFTY).isEmpty());
    }

    @Test
    @DisplayName("Predicted range brackets the last spot by the annualised volatility")
    void testRange() {
        for (int i = 0; i < 40; i++) {
            history.append(IndexName.NIFTY, PriceChannel.SPOT, i % 2 == 0 ? 20000 : 20020, 0L, TS);
        }

        Optional<PriceRange> range = analytics.predictedRange(IndexName.NIFTY);

        assertTrue(range.isPresent());
        double last = 20020;
        PriceRange r = range.get();
        assertTrue(r.annualisedVolatility() > 0);
        assertEquals(last * (1 - r.annualisedVolatility()), r.low(), 1e-6);
        assertEquals(last * (1 + r.annualisedVolatility()), r.high(), 1e-6);
    }
}
