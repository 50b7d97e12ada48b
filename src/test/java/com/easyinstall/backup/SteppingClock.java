package com.easyinstall.backup;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock that moves forward by a fixed step every time it is read.
 */
public class SteppingClock extends Clock {

    private final Duration step;
    private Instant current;

    public SteppingClock(Instant start, Duration step) {
        this.current = start;
        this.step = step;
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
    public synchronized Instant instant() {
        Instant now = current;
        current = current.plus(step);
        return now;
    }
}
