/* (C)2026 */
package com.ammann.updatetracker.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Clock whose time only moves when a test advances it. */
public final class MutableClock extends Clock {

    private volatile Instant current;

    public MutableClock(Instant current) {
        this.current = current;
    }

    public void advance(Duration duration) {
        current = current.plus(duration);
    }

    public void set(Instant instant) {
        current = instant;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return current;
    }
}
