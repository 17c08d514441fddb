package com.threatsentinel.core.window;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identifies one rolling counter: event type, optional group and window
 * length in minutes.
 *
 * @since 1.0.0
 */
public final class WindowCounterKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String eventType;
    private final GroupKey group;
    private final int windowMinutes;

    public WindowCounterKey(String eventType, GroupKey group, int windowMinutes) {
        this.eventType = Objects.requireNonNull(eventType, "Event type must not be null");
        this.group = group;
        this.windowMinutes = windowMinutes;
    }

    public String getEventType() {
        return eventType;
    }

    /**
     * @return the group, or {@code null} for the ungrouped counter
     */
    public GroupKey getGroup() {
        return group;
    }

    public int getWindowMinutes() {
        return windowMinutes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WindowCounterKey that))
            return false;
        return windowMinutes == that.windowMinutes
                && eventType.equals(that.eventType)
                && Objects.equals(group, that.group);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, group, windowMinutes);
    }

    @Override
    public String toString() {
        return eventType + (group != null ? ":" + group : "") + ':' + windowMinutes + 'm';
    }
}
