package com.threatsentinel.core.model;

import com.threatsentinel.core.rule.ResponsePolicy;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A positive detection produced by the rule engine or the correlation
 * engine, before it is escalated into an {@link Alert}.
 *
 * <p>
 * Use the {@link Builder}; {@code ruleName}, {@code mechanism},
 * {@code severity}, {@code timestamp} and {@code sourceEventId} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class Threat implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String ruleId;
    private final String ruleName;
    private final String description;
    private final ThreatType type;
    private final DetectionMechanism mechanism;
    private final Severity severity;
    private final Instant timestamp;
    private final String sourceEventId;
    private final Map<String, Object> metadata;
    private final List<String> relatedEventIds;
    private final ResponsePolicy response;

    private Threat(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.ruleId = builder.ruleId;
        this.ruleName = Objects.requireNonNull(builder.ruleName, "ruleName must not be null");
        this.description = builder.description;
        this.type = builder.type;
        this.mechanism = Objects.requireNonNull(builder.mechanism, "mechanism must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.sourceEventId = Objects.requireNonNull(builder.sourceEventId, "sourceEventId must not be null");
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.relatedEventIds = List.copyOf(builder.relatedEventIds);
        this.response = builder.response;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Threat} instances.
     */
    public static class Builder {
        private String id;
        private String ruleId;
        private String ruleName;
        private String description;
        private ThreatType type;
        private DetectionMechanism mechanism;
        private Severity severity;
        private Instant timestamp;
        private String sourceEventId;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private List<String> relatedEventIds = List.of();
        private ResponsePolicy response;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(ThreatType type) {
            this.type = type;
            return this;
        }

        public Builder mechanism(DetectionMechanism mechanism) {
            this.mechanism = mechanism;
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

        public Builder relatedEventIds(List<String> relatedEventIds) {
            this.relatedEventIds = relatedEventIds != null ? relatedEventIds : List.of();
            return this;
        }

        public Builder response(ResponsePolicy response) {
            this.response = response;
            return this;
        }

        public Threat build() {
            return new Threat(this);
        }
    }

    public String getId() {
        return id;
    }

    /**
     * @return the detection rule id, or {@code null} for correlation matches
     */
    public String getRuleId() {
        return ruleId;
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return the threat category, or {@code null} for correlation matches
     */
    public ThreatType getType() {
        return type;
    }

    public DetectionMechanism getMechanism() {
        return mechanism;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSourceEventId() {
        return sourceEventId;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public List<String> getRelatedEventIds() {
        return relatedEventIds;
    }

    /**
     * @return the response policy, or {@code null} when none applies
     */
    public ResponsePolicy getResponse() {
        return response;
    }

    public boolean isCorrelation() {
        return mechanism == DetectionMechanism.CORRELATION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Threat threat))
            return false;
        return id.equals(threat.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Threat{" +
                "id='" + id + '\'' +
                ", rule='" + ruleName + '\'' +
                ", type=" + type +
                ", mechanism=" + mechanism +
                ", severity=" + severity +
                ", sourceEventId='" + sourceEventId + '\'' +
                '}';
    }
}
