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
 * Alert raised for every detected threat.
 *
 * <p>
 * Persisted through the record store, serialized to JSON and published to
 * the configured alerts topic by the streaming job.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder} to construct instances. The builder enforces that
 * {@code id}, {@code name}, {@code severity}, {@code timestamp} and
 * {@code sourceEventId} are present; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String name;
    private String description;
    private Severity severity;
    private Instant timestamp;

    /** Id of the event whose evaluation produced this alert. */
    private String sourceEventId;

    /** Name of the correlation rule, for correlation alerts only. */
    private String correlationRule;

    private String ruleId;
    private DetectionMechanism mechanism;
    private ThreatType threatType;
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private volatile AlertStatus status = AlertStatus.OPEN;
    private List<String> relatedEvents = new ArrayList<>();

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public Alert() {
    }

    private Alert(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.description = builder.description;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.sourceEventId = Objects.requireNonNull(builder.sourceEventId, "sourceEventId must not be null");
        this.correlationRule = builder.correlationRule;
        this.ruleId = builder.ruleId;
        this.mechanism = builder.mechanism;
        this.threatType = builder.threatType;
        // Defensive copies to prevent mutation by callers
        this.metadata = new LinkedHashMap<>(builder.metadata);
        this.relatedEvents = new ArrayList<>(builder.relatedEvents);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String id;
        private String name;
        private String description;
        private Severity severity;
        private Instant timestamp;
        private String sourceEventId;
        private String correlationRule;
        private String ruleId;
        private DetectionMechanism mechanism;
        private ThreatType threatType;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private List<String> relatedEvents = List.of();

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

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder sourceEventId(String sourceEventId) {
            this.sourceEventId = sourceEventId;
            return this;
        }

        public Builder correlationRule(String correlationRule) {
            this.correlationRule = correlationRule;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder mechanism(DetectionMechanism mechanism) {
            this.mechanism = mechanism;
            return this;
        }

        public Builder threatType(ThreatType threatType) {
            this.threatType = threatType;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder relatedEvents(List<String> relatedEvents) {
            this.relatedEvents = relatedEvents != null ? relatedEvents : List.of();
            return this;
        }

        /**
         * @return a new {@link Alert} with status {@link AlertStatus#OPEN}
         * @throws NullPointerException if a required field is missing
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

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

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getSourceEventId() {
        return sourceEventId;
    }

    public void setSourceEventId(String sourceEventId) {
        this.sourceEventId = sourceEventId;
    }

    public String getCorrelationRule() {
        return correlationRule;
    }

    public void setCorrelationRule(String correlationRule) {
        this.correlationRule = correlationRule;
    }

    public String getRuleId() {
        return ruleId;
    }

    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
    }

    public DetectionMechanism getMechanism() {
        return mechanism;
    }

    public void setMechanism(DetectionMechanism mechanism) {
        this.mechanism = mechanism;
    }

    public ThreatType getThreatType() {
        return threatType;
    }

    public void setThreatType(ThreatType threatType) {
        this.threatType = threatType;
    }

    /**
     * @return unmodifiable view of the alert metadata
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    public AlertStatus getStatus() {
        return status;
    }

    public void setStatus(AlertStatus status) {
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    public List<String> getRelatedEvents() {
        return Collections.unmodifiableList(relatedEvents);
    }

    public void setRelatedEvents(List<String> relatedEvents) {
        this.relatedEvents = relatedEvents != null ? new ArrayList<>(relatedEvents) : new ArrayList<>();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(id, alert.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", severity=" + severity +
                ", status=" + status +
                ", sourceEventId='" + sourceEventId + '\'' +
                '}';
    }
}
