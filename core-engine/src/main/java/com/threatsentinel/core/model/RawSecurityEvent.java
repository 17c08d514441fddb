package com.threatsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Inbound, not-yet-validated security occurrence.
 *
 * <p>
 * Producers (auth service, access-control middleware, file handlers) fill
 * in what they know; {@link com.threatsentinel.core.ingress.EventIngress}
 * validates it and turns it into an immutable {@link SecurityEvent}. Any JSON
 * property that is not a known top-level field is collected into
 * {@link #getMetadata() metadata}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe; it is a transfer object
 * owned by the submitting thread.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawSecurityEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String type;
    private String severity;
    private Instant timestamp;
    private String message;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    public RawSecurityEvent() {
    }

    /**
     * Convenience factory used by in-process producers.
     *
     * @param type event type tag, e.g. {@code auth:failure}
     * @return a new raw event with the given type
     */
    public static RawSecurityEvent of(String type) {
        RawSecurityEvent raw = new RawSecurityEvent();
        raw.setType(type);
        return raw;
    }

    /**
     * Fluent metadata setter.
     *
     * @param key   metadata key; must not be {@code null}
     * @param value metadata value
     * @return this instance
     */
    public RawSecurityEvent with(String key, Object value) {
        putMetadata(key, value);
        return this;
    }

    /**
     * Fluent timestamp setter.
     *
     * @param timestamp occurrence time
     * @return this instance
     */
    public RawSecurityEvent at(Instant timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Merge the given entries into the metadata map. Entries collected from
     * unrecognised top-level properties are kept.
     *
     * @param metadata entries to add; {@code null} is ignored
     */
    public void setMetadata(Map<String, Object> metadata) {
        if (metadata != null) {
            this.metadata.putAll(metadata);
        }
    }

    /**
     * Collect an unrecognised top-level property into the metadata map.
     *
     * @param key   property name; must not be {@code null}
     * @param value property value
     */
    @JsonAnySetter
    public void putMetadata(String key, Object value) {
        Objects.requireNonNull(key, "Metadata key must not be null");
        metadata.put(key, value);
    }

    @Override
    public String toString() {
        return "RawSecurityEvent{type='" + type + "', severity=" + severity
                + ", timestamp=" + timestamp + ", metadata=" + metadata + '}';
    }
}
