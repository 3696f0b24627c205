package com.kotsin.optionsengine.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Test clock pinned to IST that only moves when told to.
 */
public class MutableClock extends Clock {

    public static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private volatile Instant instant;
    private final ZoneId zone;

    private MutableClock(Instant instant, ZoneId zone) {
        this.instant = instant;
        this.zone = zone;
    }

    public static MutableClock at(LocalDateTime ist) {
        return new MutableClock(ist.atZone(IST).toInstant(), IST);
    }

    public void advance(Duration duration) {
        instant = instant.plus(duration);
    }

    public void set(LocalDateTime ist) {
        instant = ist.atZone(IST).toInstant();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
