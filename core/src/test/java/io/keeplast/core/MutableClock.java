package io.keeplast.core;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Test clock whose time only moves when told to. */
public final class MutableClock extends Clock {

    private long millis;

    public MutableClock(long millis) {
        this.millis = millis;
    }

    public void set(long millis) { this.millis = millis; }

    public void advance(long delta) { this.millis += delta; }

    @Override public long millis() { return millis; }

    @Override public ZoneId getZone() { return ZoneOffset.UTC; }

    @Override public Clock withZone(ZoneId zone) { return this; }

    @Override public Instant instant() { return Instant.ofEpochMilli(millis); }
}
