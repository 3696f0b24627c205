package com.kotsin.optionsengine.model;

import java.time.LocalTime;

public enum TimeOfDayBucket {
    MORNING(LocalTime.of(9, 15), LocalTime.of(11, 30)),
    MIDDAY(LocalTime.of(11, 30), LocalTime.of(13, 30)),
    AFTERNOON(LocalTime.of(13, 30), LocalTime.of(15, 30));

    private final LocalTime start;
    private final LocalTime end;

    TimeOfDayBucket(LocalTime start, LocalTime end) {
        this.start = start;
        this.end = end;
    }

    public LocalTime getStart() {
        return start;
    }

    public LocalTime getEnd() {
        return end;
    }

    /** Pre-open times fall into MORNING, post-close times into AFTERNOON. */
    public static TimeOfDayBucket of(LocalTime time) {
        if (time.isBefore(MIDDAY.start)) {
            return MORNING;
        }
        if (time.isBefore(AFTERNOON.start)) {
            return MIDDAY;
        }
        return AFTERNOON;
    }
}
