package com.kotsin.optionsengine.model;

import lombok.Value;

@Value
public class PatternScore {

    public static final PatternScore NONE = new PatternScore(0.0, null);

    double quality;
    PatternDescriptor pattern;

    public boolean hasPattern() {
        return pattern != null;
    }

    public static PatternScore of(PatternDescriptor descriptor) {
        return new PatternScore(descriptor.getQuality(), descriptor);
    }
}
