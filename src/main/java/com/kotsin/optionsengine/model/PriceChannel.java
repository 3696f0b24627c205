package com.kotsin.optionsengine.model;

public enum PriceChannel {
    SPOT,
    CALL,
    PUT
}
