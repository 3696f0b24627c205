package com.kotsin.optionsengine.model;

public enum PositionStatus {
    FLAT,
    ACTIVE
}
