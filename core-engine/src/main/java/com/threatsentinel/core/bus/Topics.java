package com.threatsentinel.core.bus;

import com.threatsentinel.core.model.Alert;
import com.threatsentinel.core.model.Incident;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Threat;

import java.util.Objects;

/**
 * Well-known bus channels.
 */
public final class Topics {

    /** Every accepted event. */
    public static final Topic<SecurityEvent> EVENT = new Topic<>("event", SecurityEvent.class);
    public static final Topic<Threat> THREAT = new Topic<>("threat", Threat.class);
    public static final Topic<Alert> ALERT = new Topic<>("alert", Alert.class);
    public static final Topic<Incident> INCIDENT = new Topic<>("incident", Incident.class);

    /** Prefix keeping per-type channels apart from the fixed ones. */
    public static final String EVENT_TYPE_PREFIX = "type:";

    private Topics() {
        // utility class, not instantiable
    }

    /**
     * @return the channel carrying events of one type, e.g. {@code auth:failure};
     *         named {@code type:auth:failure}
     */
    public static Topic<SecurityEvent> eventType(String type) {
        Objects.requireNonNull(type, "Event type must not be null");
        return new Topic<>(EVENT_TYPE_PREFIX + type, SecurityEvent.class);
    }
}
