package com.kotsin.optionsengine.config;

import com.kotsin.optionsengine.model.IndexName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RiskSettings runtime updates
 */
class RiskSettingsTest {

    private final RiskSettings settings = new RiskSettings();

    @Test
    @DisplayName("Defaults allow trading and scalping on every index")
    void testDefaults() {
        for (IndexName index : IndexName.values()) {
            assertTrue(settings.tradingAllowed(index));
            assertTrue(settings.scalpingAllowed(index));
        }
        assertEquals(5000.0, settings.maxDailyLoss(), 1e-9);
    }

    @Test
    @DisplayName("Partial update changes only the supplied fields")
    void testPartialUpdate() {
        settings.apply(RiskSettingsUpdate.builder()
                .capital(200_000.0)
                .maxTradesPerDay(10)
                .build());

        assertEquals(200_000.0, settings.getCapital(), 1e-9);
        assertEquals(10, settings.getMaxTradesPerDay());
        assertEquals(1.0, settings.getRiskPerTradePct(), 1e-9);
        assertEquals(5.0, settings.getMaxDailyLossPct(), 1e-9);
        assertEquals(10_000.0, settings.maxDailyLoss(), 1e-9);
    }

    @Test
    @DisplayName("Index toggles update independently of the global scalping switch")
    void testToggles() {
        settings.apply(RiskSettingsUpdate.builder()
                .indices(Map.of(IndexName.BANKNIFTY, new RiskSettingsUpdate.IndexToggleUpdate(false, null)))
                .build());

        assertFalse(settings.tradingAllowed(IndexName.BANKNIFTY));
        assertTrue(settings.scalpingAllowed(IndexName.BANKNIFTY));
        assertTrue(settings.tradingAllowed(IndexName.NIFTY));

        settings.apply(RiskSettingsUpdate.builder().scalpingEnabled(false).build());
        assertFalse(settings.scalpingAllowed(IndexName.NIFTY), "Global switch off disables every index");

        settings.apply(RiskSettingsUpdate.builder().scalpingEnabled(true).build());
        settings.toggle(IndexName.SENSEX).setScalpingEnabled(false);
        assertFalse(settings.scalpingAllowed(IndexName.SENSEX));
        assertTrue(settings.scalpingAllowed(IndexName.NIFTY));
    }
}
