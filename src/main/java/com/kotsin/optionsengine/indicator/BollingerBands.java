package com.kotsin.optionsengine.indicator;

public record BollingerBands(double upper, double middle, double lower) {
}
