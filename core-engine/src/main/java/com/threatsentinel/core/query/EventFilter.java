package com.threatsentinel.core.query;

import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;

import java.time.Instant;
import java.util.function.Predicate;

/**
 * Conjunctive filter over buffered events. Unset criteria match everything.
 *
 * <pre>
 * EventFilter filter = EventFilter.builder()
 *         .type("auth:failure")
 *         .userId("U1")
 *         .from(Instant.now().minus(Duration.ofHours(1)))
 *         .build();
 * </pre>
 *
 * @since 1.0.0
 */
public final class EventFilter implements Predicate<SecurityEvent> {

    private static final EventFilter ALL = builder().build();

    private final String type;
    private final Severity severity;
    private final Instant from;
    private final Instant to;
    private final String userId;

    private EventFilter(Builder builder) {
        this.type = builder.type;
        this.severity = builder.severity;
        this.from = builder.from;
        this.to = builder.to;
        this.userId = builder.userId;
    }

    public static EventFilter all() {
        return ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return {@code true} if the event satisfies every set criterion; the
     *         time range is inclusive at both ends
     */
    @Override
    public boolean test(SecurityEvent event) {
        if (type != null && !type.equals(event.getType())) {
            return false;
        }
        if (severity != null && severity != event.getSeverity()) {
            return false;
        }
        if (from != null && event.getTimestamp().isBefore(from)) {
            return false;
        }
        if (to != null && event.getTimestamp().isAfter(to)) {
            return false;
        }
        return userId == null || event.getUserId().filter(userId::equals).isPresent();
    }

    @Override
    public String toString() {
        return "EventFilter{type='" + type + "', severity=" + severity + ", from=" + from + ", to=" + to
                + ", userId='" + userId + "'}";
    }

    public static class Builder {
        private String type;
        private Severity severity;
        private Instant from;
        private Instant to;
        private String userId;

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder from(Instant from) {
            this.from = from;
            return this;
        }

        public Builder to(Instant to) {
            this.to = to;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code from} is after {@code to}
         */
        public EventFilter build() {
            if (from != null && to != null && from.isAfter(to)) {
                throw new IllegalArgumentException("from must not be after to, got: " + from + " > " + to);
            }
            return new EventFilter(this);
        }
    }
}
