package com.kotsin.optionsengine.market;

import com.kotsin.optionsengine.config.MarketDataSettings;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.MarketTick;
import com.kotsin.optionsengine.model.PriceChannel;
import com.kotsin.optionsengine.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MarketDataService
 */
class MarketDataServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 14, 11, 0);

    private final MutableClock clock = MutableClock.at(NOW);
    private final PriceHistoryStore history = new PriceHistoryStore(new MarketDataSettings());
    private final List<IndexName> notified = new ArrayList<>();
    private final MarketDataService service = new MarketDataService(history, List.<PriceUpdateListener>of(notified::add), clock);

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -5.0, Double.NaN})
    @DisplayName("Non-positive prices are rejected without touching history")
    void testRejectsNonPositive(double price) {
        assertFalse(service.updatePrice(IndexName.NIFTY, PriceChannel.CALL, price, 10L, NOW));
        assertEquals(0, history.series(IndexName.NIFTY, PriceChannel.CALL).size());
        assertTrue(notified.isEmpty(), "Listeners should not run for a rejected tick");
    }

    @Test
    @DisplayName("Valid tick is appended and the index handed to listeners")
    void testAcceptsTick() {
        assertTrue(service.updatePrice(IndexName.NIFTY, PriceChannel.CALL, 120.5, 10L, NOW));

        assertEquals(120.5, history.lastPrice(IndexName.NIFTY, PriceChannel.CALL), 1e-9);
        assertEquals(List.of(IndexName.NIFTY), notified);
    }

    @Test
    @DisplayName("Implausible spot without a previous spot is dropped")
    void testImplausibleSpotDropped() {
        assertFalse(service.updatePrice(IndexName.SENSEX, PriceChannel.SPOT, 500.0, 0L, NOW));
        assertNull(history.lastPrice(IndexName.SENSEX, PriceChannel.SPOT));
    }

    @Test
    @DisplayName("Implausible spot is replaced by the last plausible spot")
    void testImplausibleSpotReplaced() {
        service.updatePrice(IndexName.NIFTY, PriceChannel.SPOT, 24500.0, 0L, NOW);

        assertTrue(service.updatePrice(IndexName.NIFTY, PriceChannel.SPOT, 12.0, 0L, NOW));

        PriceSeries spot = history.series(IndexName.NIFTY, PriceChannel.SPOT);
        assertEquals(2, spot.size());
        assertEquals(24500.0, spot.last().price(), 1e-9);
        assertEquals(List.of(0.0), history.volatilitySamples(IndexName.NIFTY));
    }

    @Test
    @DisplayName("Option premiums below the spot floor are accepted")
    void testLowPremiumAccepted() {
        assertTrue(service.updatePrice(IndexName.NIFTY, PriceChannel.PUT, 3.5, 0L, NOW));
    }

    @Test
    @DisplayName("Tick without timestamp is stamped with the clock; epoch millis are converted")
    void testTickTimestamps() {
        service.onTick(MarketTick.builder().index(IndexName.NIFTY).channel(PriceChannel.CALL).price(100).build());
        assertEquals(NOW, history.lastUpdate(IndexName.NIFTY, PriceChannel.CALL));

        LocalDateTime earlier = NOW.minusMinutes(5);
        long millis = earlier.atZone(MutableClock.IST).toInstant().toEpochMilli();
        service.onTick(MarketTick.builder().index(IndexName.NIFTY).channel(PriceChannel.CALL).price(101).timestamp(millis).build());
        assertEquals(earlier, history.lastUpdate(IndexName.NIFTY, PriceChannel.CALL));
    }

    @Test
    @DisplayName("Tick without index is dropped")
    void testTickWithoutIndex() {
        assertFalse(service.onTick(MarketTick.builder().channel(PriceChannel.CALL).price(100).build()));
    }

    @Test
    @DisplayName("A failing listener does not reject the tick")
    void testListenerFailureIsolated() {
        MarketDataService failing = new MarketDataService(history, List.<PriceUpdateListener>of(index -> {
            throw new IllegalStateException("boom");
        }), clock);

        assertTrue(failing.updatePrice(IndexName.NIFTY, PriceChannel.CALL, 99.0, 1L, NOW));
        assertEquals(1, history.series(IndexName.NIFTY, PriceChannel.CALL).size());
    }
}
