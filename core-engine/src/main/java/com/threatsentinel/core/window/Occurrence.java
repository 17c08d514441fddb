package com.threatsentinel.core.window;

import com.threatsentinel.core.model.SecurityEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A counted occurrence: its timestamp and, when recorded from a full event,
 * the event itself.
 *
 * @since 1.0.0
 */
public final class Occurrence {

    private final Instant timestamp;
    private final SecurityEvent event;

    public Occurrence(Instant timestamp, SecurityEvent event) {
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must not be null");
        this.event = event;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Optional<SecurityEvent> getEvent() {
        return Optional.ofNullable(event);
    }

    @Override
    public String toString() {
        return "Occurrence{" + timestamp + (event != null ? ", " + event.getId() : "") + '}';
    }
}
