package com.threatsentinel.core.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * A {@link Clock} whose current instant is set explicitly.
 *
 * <p>
 * Used to replay buffered events at their own timestamps when dry-running a
 * rule, so that window pruning follows event time rather than wall-clock
 * time.
 * </p>
 *
 * @since 1.0.0
 */
public final class SettableClock extends Clock {

    private volatile Instant instant;
    private final ZoneId zone;

    public SettableClock(Instant initial) {
        this(initial, ZoneOffset.UTC);
    }

    private SettableClock(Instant initial, ZoneId zone) {
        this.instant = Objects.requireNonNull(initial, "initial instant must not be null");
        this.zone = zone;
    }

    public void set(Instant instant) {
        this.instant = Objects.requireNonNull(instant, "instant must not be null");
    }

    public void advance(Duration duration) {
        this.instant = instant.plus(duration);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new SettableClock(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
