package com.kotsin.optionsengine.model;

public enum PatternType {
    DOUBLE_BOTTOM(OptionLeg.CALL),
    DOUBLE_TOP(OptionLeg.PUT),
    BULLISH_ENGULFING(OptionLeg.CALL),
    BEARISH_ENGULFING(OptionLeg.PUT);

    private final OptionLeg leg;

    PatternType(OptionLeg leg) {
        this.leg = leg;
    }

    /** Leg this pattern argues for. */
    public OptionLeg getLeg() {
        return leg;
    }
}
