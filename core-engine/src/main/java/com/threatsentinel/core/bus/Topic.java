package com.threatsentinel.core.bus;

import java.util.Objects;

/**
 * A named, typed channel on the {@link SecurityEventBus}.
 *
 * @param <T> payload type
 * @since 1.0.0
 */
public final class Topic<T> {

    private final String name;
    private final Class<T> payloadType;

    Topic(String name, Class<T> payloadType) {
        this.name = Objects.requireNonNull(name, "Topic name must not be null");
        this.payloadType = Objects.requireNonNull(payloadType, "Payload type must not be null");
    }

    public String getName() {
        return name;
    }

    public Class<T> getPayloadType() {
        return payloadType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Topic<?> topic))
            return false;
        return name.equals(topic.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
