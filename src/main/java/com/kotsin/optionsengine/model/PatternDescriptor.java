package com.kotsin.optionsengine.model;

import lombok.Builder;
import lombok.Value;

/**
 * Reference levels of a detected pattern. For double bottoms/tops the extremes are the two
 * minima/maxima and the intervening level is the peak/trough between them; for engulfing
 * patterns the extremes are the previous and current prices.
 */
@Value
@Builder
public class PatternDescriptor {
    PatternType type;
    double quality;
    double firstExtreme;
    double secondExtreme;
    double interveningLevel;
    double moveRatio;
}
