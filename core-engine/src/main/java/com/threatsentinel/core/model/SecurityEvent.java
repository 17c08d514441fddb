package com.threatsentinel.core.model;

import com.threatsentinel.core.util.FieldPaths;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, validated record of a security-relevant occurrence.
 *
 * <p>
 * Created once by {@link com.threatsentinel.core.ingress.EventIngress} and
 * never mutated afterwards, so instances may be shared freely between the
 * rolling event buffer, the window counters and any subscriber.
 * </p>
 *
 * <h3>Field lookup</h3>
 * <p>
 * {@link #resolve(String)} accepts dot-paths such as
 * {@code metadata.dataSize} or {@code timestamp}. A bare key that is not one
 * of the top-level fields ({@code id, type, severity, timestamp, message})
 * is looked up in {@code metadata}, so {@code userId} and
 * {@code metadata.userId} are equivalent.
 * </p>
 *
 * @since 1.0.0
 */
public final class SecurityEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String USER_ID = "userId";
    public static final String IP_ADDRESS = "ipAddress";

    private final String id;
    private final String type;
    private final Severity severity;
    private final Instant timestamp;
    private final String message;
    private final Map<String, Object> metadata;

    public SecurityEvent(String id, String type, Severity severity, Instant timestamp,
            String message, Map<String, Object> metadata) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.message = message;
        this.metadata = metadata == null ? Collections.emptyMap() : freezeMap(metadata);
    }

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    /** Copies nested maps and lists into unmodifiable ones. */
    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return unmodifiable metadata map
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * @return the acting user, if the producer supplied one
     */
    public Optional<String> getUserId() {
        return getMetadataString(USER_ID);
    }

    /**
     * @return the source IP address, if the producer supplied one
     */
    public Optional<String> getIpAddress() {
        return getMetadataString(IP_ADDRESS);
    }

    /**
     * @param key metadata key
     * @return the value rendered as a string, or empty when absent
     */
    public Optional<String> getMetadataString(String key) {
        Object raw = metadata.get(key);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    /**
     * Resolve a dot-path against this event.
     *
     * @param path dot-separated field path; must not be {@code null}
     * @return the value, or empty if any segment is missing
     */
    public Optional<Object> resolve(String path) {
        Objects.requireNonNull(path, "Field path must not be null");
        int dot = path.indexOf('.');
        String head = dot < 0 ? path : path.substring(0, dot);
        String rest = dot < 0 ? null : path.substring(dot + 1);

        Object root;
        switch (head) {
            case "id" -> root = id;
            case "type" -> root = type;
            case "severity" -> root = severity.name();
            case "timestamp" -> root = timestamp;
            case "message" -> root = message;
            case "metadata" -> root = metadata;
            default -> {
                return FieldPaths.resolve(metadata, path);
            }
        }
        if (rest == null) {
            return Optional.ofNullable(root);
        }
        return FieldPaths.resolve(root, rest);
    }

    /**
     * Resolve a dot-path and coerce the value to a {@code double}.
     *
     * @param path dot-separated field path
     * @return numeric value, or empty if absent or not numeric
     */
    public Optional<Double> resolveNumber(String path) {
        return resolve(path).flatMap(FieldPaths::toDouble);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SecurityEvent that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "SecurityEvent{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", severity=" + severity +
                ", timestamp=" + timestamp +
                ", metadata=" + metadata +
                '}';
    }
}
