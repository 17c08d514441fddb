package com.threatsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SecurityEvent}.
 */
class SecurityEventTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    @DisplayName("Nested metadata should not change when the producer mutates its own maps and lists")
    void shouldCopyNestedMetadata() {
        Map<String, Object> geo = new HashMap<>();
        geo.put("country", "US");
        List<Object> hosts = new ArrayList<>(List.of("10.0.0.1"));
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("geo", geo);
        metadata.put("hosts", hosts);

        SecurityEvent event = new SecurityEvent("e1", "net:connection", Severity.LOW, T0, null, metadata);
        geo.put("country", "DE");
        hosts.add("10.0.0.2");
        metadata.put("userId", "U1");

        assertThat(event.resolve("metadata.geo.country")).contains("US");
        assertThat(event.resolve("hosts.1")).isEmpty();
        assertThat(event.getUserId()).isEmpty();
    }

    @Test
    @DisplayName("Nested metadata should be read-only")
    void shouldExposeReadOnlyNestedMetadata() {
        SecurityEvent event = new SecurityEvent("e1", "net:connection", Severity.LOW, T0, null,
                Map.of("geo", Map.of("country", "US"), "hosts", List.of("10.0.0.1")));

        @SuppressWarnings("unchecked")
        Map<String, Object> geo = (Map<String, Object>) event.getMetadata().get("geo");
        @SuppressWarnings("unchecked")
        List<Object> hosts = (List<Object>) event.getMetadata().get("hosts");

        assertThatThrownBy(() -> geo.put("country", "DE")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> hosts.add("10.0.0.2")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> event.getMetadata().put("userId", "U1"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Bare keys should resolve against metadata and top-level names against the event")
    void shouldResolveFieldPaths() {
        SecurityEvent event = new SecurityEvent("e1", "data:access", Severity.HIGH, T0, "bulk export",
                Map.of("userId", "U1", "dataSize", "2048"));

        assertThat(event.resolve("userId")).contains("U1");
        assertThat(event.resolve("metadata.userId")).contains("U1");
        assertThat(event.resolve("type")).contains("data:access");
        assertThat(event.resolveNumber("metadata.dataSize")).contains(2048.0);
        assertThat(event.resolve("metadata.missing")).isEmpty();
    }
}
