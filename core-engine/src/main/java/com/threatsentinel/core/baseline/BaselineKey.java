package com.threatsentinel.core.baseline;

import java.util.Objects;

/**
 * Identifies one behavioral baseline: actor, event type and observed field.
 *
 * @since 1.0.0
 */
public final class BaselineKey {

    private final String userId;
    private final String eventType;
    private final String fieldPath;

    public BaselineKey(String userId, String eventType, String fieldPath) {
        this.userId = Objects.requireNonNull(userId, "userId must not be null");
        this.eventType = Objects.requireNonNull(eventType, "eventType must not be null");
        this.fieldPath = Objects.requireNonNull(fieldPath, "fieldPath must not be null");
    }

    public String getUserId() {
        return userId;
    }

    public String getEventType() {
        return eventType;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaselineKey that))
            return false;
        return userId.equals(that.userId) && eventType.equals(that.eventType)
                && fieldPath.equals(that.fieldPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, eventType, fieldPath);
    }

    @Override
    public String toString() {
        return userId + '/' + eventType + '/' + fieldPath;
    }
}
