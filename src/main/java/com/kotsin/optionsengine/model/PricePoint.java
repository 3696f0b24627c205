package com.kotsin.optionsengine.model;

import java.time.LocalDateTime;

public record PricePoint(LocalDateTime timestamp, double price, long volume) {
}
