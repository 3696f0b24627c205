package com.kotsin.optionsengine.indicator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StandardIndicatorLibrary
 */
class StandardIndicatorLibraryTest {

    private final StandardIndicatorLibrary indicators = new StandardIndicatorLibrary();

    private static double[] rising(int n) {
        double[] p = new double[n];
        for (int i = 0; i < n; i++) p[i] = 100 + i;
        return p;
    }

    private static double[] falling(int n) {
        double[] p = new double[n];
        for (int i = 0; i < n; i++) p[i] = 200 - i;
        return p;
    }

    @Test
    @DisplayName("RSI is neutral when history is not longer than the period")
    void testRsiShortHistory() {
        assertEquals(50.0, indicators.rsi(rising(14), 14), 1e-9);
    }

    @Test
    @DisplayName("RSI hits the extremes on one-way series")
    void testRsiExtremes() {
        assertEquals(100.0, indicators.rsi(rising(30), 14), 1e-9, "No losses should give RSI 100");
        assertEquals(0.0, indicators.rsi(falling(30), 14), 1e-9, "No gains should give RSI 0");
    }

    @Test
    @DisplayName("RSI of a flat series is neutral")
    void testRsiFlat() {
        double[] flat = new double[30];
        Arrays.fill(flat, 100.0);
        assertEquals(50.0, indicators.rsi(flat, 14), 1e-9);
    }

    @Test
    @DisplayName("EMA seeded with the first price follows a two-point series")
    void testEmaTwoPoints() {
        // alpha = 2/(3+1) = 0.5
        assertEquals(105.0, indicators.ema(new double[]{100.0, 110.0}, 3), 1e-9);
    }

    @Test
    @DisplayName("Shorter EMA sits above longer EMA on a rising series")
    void testEmaOrdering() {
        double[] prices = rising(40);
        double ema5 = indicators.ema(prices, 5);
        double ema10 = indicators.ema(prices, 10);
        double ema20 = indicators.ema(prices, 20);
        assertTrue(ema5 > ema10 && ema10 > ema20, "EMAs should be stacked up on a rising series");
    }

    @Test
    @DisplayName("MACD histogram is zero on a flat series and the line positive on a rising one")
    void testMacd() {
        double[] flat = new double[40];
        Arrays.fill(flat, 250.0);
        assertEquals(0.0, indicators.macd(flat, 12, 26, 9).histogram(), 1e-9);

        MacdResult rising = indicators.macd(rising(40), 12, 26, 9);
        assertTrue(rising.macd() > 0, "Fast EMA should lead on a rising series");
        assertEquals(rising.macd() - rising.signal(), rising.histogram(), 1e-9);
    }

    @Test
    @DisplayName("Bollinger bands collapse on a flat series")
    void testBollingerFlat() {
        double[] flat = new double[25];
        Arrays.fill(flat, 80.0);
        BollingerBands bands = indicators.bollinger(flat, 20, 2.0);
        assertEquals(80.0, bands.upper(), 1e-9);
        assertEquals(80.0, bands.middle(), 1e-9);
        assertEquals(80.0, bands.lower(), 1e-9);
    }

    @Test
    @DisplayName("Bollinger bands use the sample deviation of the last period")
    void testBollingerSampleDeviation() {
        // last 4 of {1, 2, 4, 6, 8}: mean 5, sample variance 20/3
        BollingerBands bands = indicators.bollinger(new double[]{1, 2, 4, 6, 8}, 4, 2.0);
        double std = Math.sqrt(20.0 / 3.0);
        assertEquals(5.0, bands.middle(), 1e-9);
        assertEquals(5.0 + 2 * std, bands.upper(), 1e-9);
        assertEquals(5.0 - 2 * std, bands.lower(), 1e-9);
    }

    @Test
    @DisplayName("ATR is the mean absolute close-to-close change")
    void testAtr() {
        assertEquals(4.0 / 3.0, indicators.atr(new double[]{100, 101, 103, 102}, 14), 1e-9);
        assertEquals(2.0, indicators.atr(new double[]{100, 102, 100, 102, 100}, 2), 1e-9);
        assertEquals(0.0, indicators.atr(new double[]{100}, 14), 1e-9);
    }
}
