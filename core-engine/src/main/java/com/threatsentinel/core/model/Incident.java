package com.threatsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Incident opened for a severe or policy-flagged alert.
 *
 * <p>
 * The {@link #getTimeline() timeline} is append-only; instances are created
 * with a single {@link TimelineEntry#CREATED} entry.
 * </p>
 *
 * @since 1.0.0
 */
public class Incident implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String name;
    private String description;
    private Severity severity;
    private IncidentType type;
    private Instant timestamp;
    private String sourceAlertId;
    private volatile IncidentStatus status = IncidentStatus.OPEN;
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private final List<TimelineEntry> timeline = new ArrayList<>();

    /** No-arg constructor required by Jackson. */
    public Incident() {
    }

    private Incident(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.description = builder.description;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.type = builder.type != null ? builder.type : IncidentType.OTHER;
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.sourceAlertId = Objects.requireNonNull(builder.sourceAlertId, "sourceAlertId must not be null");
        this.metadata = new LinkedHashMap<>(builder.metadata);
        this.timeline.add(new TimelineEntry(timestamp, TimelineEntry.CREATED,
                "Incident created", TimelineEntry.SYSTEM_ACTOR));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Incident} instances.
     */
    public static class Builder {
        private String id;
        private String name;
        private String description;
        private Severity severity;
        private IncidentType type;
        private Instant timestamp;
        private String sourceAlertId;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder type(IncidentType type) {
            this.type = type;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder sourceAlertId(String sourceAlertId) {
            this.sourceAlertId = sourceAlertId;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Incident build() {
            return new Incident(this);
        }
    }

    /**
     * Append a timeline entry.
     */
    public synchronized void appendTimeline(TimelineEntry entry) {
        timeline.add(Objects.requireNonNull(entry, "entry must not be null"));
    }

    /**
     * @return snapshot of the timeline, oldest first
     */
    public synchronized List<TimelineEntry> getTimeline() {
        return Collections.unmodifiableList(new ArrayList<>(timeline));
    }

    /**
     * Replace the timeline wholesale (used by Jackson).
     */
    public synchronized void setTimeline(List<TimelineEntry> entries) {
        timeline.clear();
        if (entries != null) {
            timeline.addAll(entries);
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public IncidentType getType() {
        return type;
    }

    public void setType(IncidentType type) {
        this.type = type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getSourceAlertId() {
        return sourceAlertId;
    }

    public void setSourceAlertId(String sourceAlertId) {
        this.sourceAlertId = sourceAlertId;
    }

    public IncidentStatus getStatus() {
        return status;
    }

    public void setStatus(IncidentStatus status) {
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Incident incident))
            return false;
        return Objects.equals(id, incident.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Incident{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", severity=" + severity +
                ", type=" + type +
                ", status=" + status +
                ", sourceAlertId='" + sourceAlertId + '\'' +
                '}';
    }
}
