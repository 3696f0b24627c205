package com.kotsin.optionsengine.model;

public enum OptionLeg {
    CALL("C"),
    PUT("P");

    private final String symbolCode;

    OptionLeg(String symbolCode) {
        this.symbolCode = symbolCode;
    }

    public String getSymbolCode() {
        return symbolCode;
    }

    /** Price channel carrying this leg's option premium. */
    public PriceChannel channel() {
        return this == CALL ? PriceChannel.CALL : PriceChannel.PUT;
    }

    /** Trend under which a bought option of this leg gains. */
    public TrendDirection favourableTrend() {
        return this == CALL ? TrendDirection.BULLISH : TrendDirection.BEARISH;
    }
}
