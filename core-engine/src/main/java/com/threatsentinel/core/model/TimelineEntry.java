package com.threatsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One append-only entry in an {@link Incident}'s timeline.
 *
 * @since 1.0.0
 */
public class TimelineEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String CREATED = "CREATED";
    public static final String SYSTEM_ACTOR = "SYSTEM";

    private Instant timestamp;
    private String action;
    private String description;
    private String actor;

    /** No-arg constructor required by Jackson. */
    public TimelineEntry() {
    }

    public TimelineEntry(Instant timestamp, String action, String description, String actor) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.description = description;
        this.actor = actor;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getActor() {
        return actor;
    }

    public void setActor(String actor) {
        this.actor = actor;
    }

    @Override
    public String toString() {
        return "TimelineEntry{" + timestamp + ' ' + action + " by " + actor + ": " + description + '}';
    }
}
