package com.kotsin.optionsengine.model;

/**
 * Result of an entry attempt, with the text returned to manual callers.
 */
public enum EntryOutcome {
    ENTERED("Entered"),
    NO_PRICE("No price for the leg yet"),
    INVALID_SIZING("Position sizing produced no tradable quantity"),
    NO_TARGET("Strategy has no target for the leg (for a pattern scalp: no pattern detected)"),
    POSITION_ACTIVE("A position is already active on the leg"),
    DAILY_LIMIT("Daily trade or loss limit reached");

    private final String description;

    EntryOutcome(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isEntered() {
        return this == ENTERED;
    }
}
