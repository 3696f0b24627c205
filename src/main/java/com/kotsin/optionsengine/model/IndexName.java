package com.kotsin.optionsengine.model;

/**
 * Traded index underlyings. Each carries the strike step used for ATM resolution
 * and the lowest spot value accepted as a plausible tick.
 */
public enum IndexName {
    NIFTY(50, 100.0, "NFO"),
    BANKNIFTY(100, 100.0, "NFO"),
    SENSEX(500, 1000.0, "BFO");

    private final int strikeInterval;
    private final double minPlausibleSpot;
    private final String exchange;

    IndexName(int strikeInterval, double minPlausibleSpot, String exchange) {
        this.strikeInterval = strikeInterval;
        this.minPlausibleSpot = minPlausibleSpot;
        this.exchange = exchange;
    }

    public int getStrikeInterval() {
        return strikeInterval;
    }

    public double getMinPlausibleSpot() {
        return minPlausibleSpot;
    }

    public String getExchange() {
        return exchange;
    }
}
