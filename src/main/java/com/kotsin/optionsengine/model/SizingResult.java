package com.kotsin.optionsengine.model;

public record SizingResult(int quantity, double stopLossDistance) {

    public static final SizingResult NONE = new SizingResult(0, 0.0);

    public boolean isValid() {
        return quantity > 0 && stopLossDistance > 0;
    }
}
