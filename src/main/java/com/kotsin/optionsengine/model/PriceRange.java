package com.kotsin.optionsengine.model;

public record PriceRange(double low, double high, double annualisedVolatility) {
}
