package com.kotsin.optionsengine.model;

public enum ExitReason {
    STOP_LOSS,
    TARGET,
    WEAKENING_SIGNAL,
    SIGNAL_REVERSAL,
    MOMENTUM_REVERSAL,
    PATTERN_INVALIDATION,
    ADAPTIVE_EXIT,
    TIME_EXIT,
    MANUAL
}
