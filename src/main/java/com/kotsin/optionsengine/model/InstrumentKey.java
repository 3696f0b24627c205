package com.kotsin.optionsengine.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One tradable option leg of one index. There are exactly six.
 */
public record InstrumentKey(IndexName index, OptionLeg leg) {

    private static final List<InstrumentKey> ALL;

    static {
        List<InstrumentKey> keys = new ArrayList<>();
        for (IndexName index : IndexName.values()) {
            for (OptionLeg leg : OptionLeg.values()) {
                keys.add(new InstrumentKey(index, leg));
            }
        }
        ALL = Collections.unmodifiableList(keys);
    }

    public InstrumentKey {
        if (index == null || leg == null) {
            throw new IllegalArgumentException("index and leg are required");
        }
    }

    public static InstrumentKey of(IndexName index, OptionLeg leg) {
        return new InstrumentKey(index, leg);
    }

    public static List<InstrumentKey> all() {
        return ALL;
    }

    public static List<InstrumentKey> forIndex(IndexName index) {
        return List.of(of(index, OptionLeg.CALL), of(index, OptionLeg.PUT));
    }

    @Override
    public String toString() {
        return index + "_" + leg;
    }
}
