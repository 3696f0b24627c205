package com.kotsin.optionsengine.model;

/**
 * Strategy variants and their sizing / trailing constants.
 * <p>
 * An ATR multiplier of zero means the variant is sized off a flat 1% stop distance.
 * A null fallback stop means the configured scalping stop-loss percentage applies.
 */
public enum StrategyKind {
    REGULAR(1.0, 0.0, null, 1.0, false, false),
    SCALPING(1.0, 0.7, null, 0.5, true, false),
    MOMENTUM_SCALP(1.2, 0.5, 0.5, 0.4, true, true),
    PATTERN_SCALP(1.1, 0.6, 0.6, 0.5, true, true),
    ADAPTIVE_SCALP(1.0, 0.0, null, 1.0, true, false),
    EXPIRY_SCALPING(1.5, 0.4, 0.4, 0.6, true, true);

    /** Share of capital a capped variant may put into one position. */
    public static final double MAX_POSITION_CAPITAL_SHARE = 0.05;

    private final double riskMultiplier;
    private final double atrMultiplier;
    private final Double fallbackStopPct;
    private final double trailingFactor;
    private final boolean scalping;
    private final boolean capitalCapped;

    StrategyKind(double riskMultiplier, double atrMultiplier, Double fallbackStopPct,
                 double trailingFactor, boolean scalping, boolean capitalCapped) {
        this.riskMultiplier = riskMultiplier;
        this.atrMultiplier = atrMultiplier;
        this.fallbackStopPct = fallbackStopPct;
        this.trailingFactor = trailingFactor;
        this.scalping = scalping;
        this.capitalCapped = capitalCapped;
    }

    public double getRiskMultiplier() {
        return riskMultiplier;
    }

    public double getAtrMultiplier() {
        return atrMultiplier;
    }

    public boolean isAtrSized() {
        return atrMultiplier > 0.0;
    }

    public double fallbackStopPct(double configuredScalpingStopPct) {
        return fallbackStopPct != null ? fallbackStopPct : configuredScalpingStopPct;
    }

    public double getTrailingFactor() {
        return trailingFactor;
    }

    public boolean isScalping() {
        return scalping;
    }

    /** Adaptive scalps stay out of the daily scalping book. */
    public boolean countsTowardDailyScalping() {
        return scalping && this != ADAPTIVE_SCALP;
    }

    public boolean isCapitalCapped() {
        return capitalCapped;
    }
}
