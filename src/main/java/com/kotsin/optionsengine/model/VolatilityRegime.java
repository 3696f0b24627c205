package com.kotsin.optionsengine.model;

/**
 * Volatility bucket of an index. The weight scales adaptive thresholds, the trail scale
 * widens or tightens the trailing-stop distance.
 */
public enum VolatilityRegime {
    LOW(0.7, 1.3),
    MEDIUM(1.0, 1.0),
    HIGH(1.3, 0.7);

    public static final double LOW_CEILING = 0.05;
    public static final double MEDIUM_CEILING = 0.15;

    private final double weight;
    private final double trailScale;

    VolatilityRegime(double weight, double trailScale) {
        this.weight = weight;
        this.trailScale = trailScale;
    }

    public double getWeight() {
        return weight;
    }

    public double getTrailScale() {
        return trailScale;
    }

    public static VolatilityRegime of(double volatility) {
        if (volatility < LOW_CEILING) {
            return LOW;
        }
        if (volatility < MEDIUM_CEILING) {
            return MEDIUM;
        }
        return HIGH;
    }
}
