package com.kotsin.optionsengine.market;

import com.kotsin.optionsengine.config.MarketDataSettings;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.PriceChannel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PriceHistoryStore
 */
class PriceHistoryStoreTest {

    private static final LocalDateTime TS = LocalDateTime.of(2026, 1, 14, 11, 0);

    @Test
    @DisplayName("Series are trimmed to the configured retention, oldest first")
    void testRetention() {
        MarketDataSettings settings = new MarketDataSettings();
        settings.setMaxHistoryPoints(5);
        PriceHistoryStore store = new PriceHistoryStore(settings);

        for (int i = 1; i <= 8; i++) {
            store.append(IndexName.NIFTY, PriceChannel.CALL, i, 0L, TS);
        }

        PriceSeries series = store.series(IndexName.NIFTY, PriceChannel.CALL);
        assertEquals(5, series.size());
        assertArrayEquals(new double[]{4, 5, 6, 7, 8}, series.prices(100), 1e-9);
        assertArrayEquals(new double[]{7, 8}, series.prices(2), 1e-9);
    }

    @Test
    @DisplayName("Volatility window keeps the last thirty spot changes in percent")
    void testVolatilityWindow() {
        PriceHistoryStore store = new PriceHistoryStore(new MarketDataSettings());

        store.append(IndexName.NIFTY, PriceChannel.SPOT, 20000, 0L, TS);
        store.append(IndexName.NIFTY, PriceChannel.SPOT, 20020, 0L, TS);
        assertEquals(0.1, store.volatilitySamples(IndexName.NIFTY).get(0), 1e-9);

        for (int i = 0; i < 40; i++) {
            store.append(IndexName.NIFTY, PriceChannel.SPOT, 20000 + i, 0L, TS);
        }
        assertEquals(PriceHistoryStore.VOLATILITY_WINDOW, store.volatilitySamples(IndexName.NIFTY).size());
    }

    @Test
    @DisplayName("Option channels do not feed the volatility window")
    void testOptionChannelsIgnoredForVolatility() {
        PriceHistoryStore store = new PriceHistoryStore(new MarketDataSettings());
        store.append(IndexName.NIFTY, PriceChannel.CALL, 100, 0L, TS);
        store.append(IndexName.NIFTY, PriceChannel.CALL, 110, 0L, TS);

        assertTrue(store.volatilitySamples(IndexName.NIFTY).isEmpty());
        assertNull(store.lastPrice(IndexName.BANKNIFTY, PriceChannel.CALL));
    }
}
