package com.kotsin.optionsengine.analysis;

import com.kotsin.optionsengine.model.PatternDescriptor;

public record PatternMatch(boolean found, double quality, PatternDescriptor descriptor) {

    public static final PatternMatch NONE = new PatternMatch(false, 0.0, null);

    static PatternMatch of(PatternDescriptor descriptor) {
        return new PatternMatch(true, descriptor.getQuality(), descriptor);
    }
}
