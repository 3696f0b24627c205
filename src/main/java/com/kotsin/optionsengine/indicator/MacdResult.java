package com.kotsin.optionsengine.indicator;

public record MacdResult(double macd, double signal, double histogram) {
}
