package com.kotsin.optionsengine.model;

public enum TrendDirection {
    BULLISH,
    BEARISH,
    NEUTRAL;

    public TrendDirection opposite() {
        switch (this) {
            case BULLISH:
                return BEARISH;
            case BEARISH:
                return BULLISH;
            default:
                return NEUTRAL;
        }
    }
}
