package com.threatsentinel.flink;

import com.threatsentinel.core.model.ContainmentAction;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Containment request published to Kafka for the identity/session service
 * to enforce.
 *
 * @since 1.0.0
 */
public class ContainmentCommand implements Serializable {

    private static final long serialVersionUID = 1L;

    private ContainmentAction action;
    private String userId;
    private Instant requestedAt;

    /** No-arg constructor required by Jackson and Flink's POJO serializer. */
    public ContainmentCommand() {
    }

    public ContainmentCommand(ContainmentAction action, String userId, Instant requestedAt) {
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.userId = Objects.requireNonNull(userId, "userId must not be null");
        this.requestedAt = Objects.requireNonNull(requestedAt, "requestedAt must not be null");
    }

    public ContainmentAction getAction() {
        return action;
    }

    public void setAction(ContainmentAction action) {
        this.action = action;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public Instant getRequestedAt() {
        return requestedAt;
    }

    public void setRequestedAt(Instant requestedAt) {
        this.requestedAt = requestedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ContainmentCommand that))
            return false;
        return action == that.action
                && Objects.equals(userId, that.userId)
                && Objects.equals(requestedAt, that.requestedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, userId, requestedAt);
    }

    @Override
    public String toString() {
        return "ContainmentCommand{" +
                "action=" + action +
                ", userId='" + userId + '\'' +
                ", requestedAt=" + requestedAt +
                '}';
    }
}
