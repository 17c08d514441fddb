package com.threatsentinel.core.baseline;

import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BehavioralBaselineStore}.
 */
class BehavioralBaselineStoreTest {

    private BehavioralBaselineStore store;

    @BeforeEach
    void setUp() {
        store = new BehavioralBaselineStore();
    }

    @Test
    @DisplayName("Should not score before the minimum sample count")
    void shouldNotScoreDuringColdStart() {
        for (int i = 0; i < BehavioralBaselineStore.MIN_SAMPLES - 1; i++) {
            store.observe("U1", "data:access", "metadata.dataSize", i % 2 == 0 ? 8 : 12);
        }

        ActorBaseline baseline = store.baseline("U1", "data:access", "metadata.dataSize").orElseThrow();
        assertThat(store.zScore("U1", "data:access", "metadata.dataSize", 1000)).isEmpty();
        assertThat(BehavioralBaselineStore.isAnomaly(1000, baseline, 3.0)).isFalse();
    }

    @Test
    @DisplayName("Should flag values whose z-score exceeds the threshold")
    void shouldFlagOutliers() {
        // mean 10, population stdDev 2
        for (int i = 0; i < 10; i++) {
            store.observe("U1", "data:access", "metadata.dataSize", i % 2 == 0 ? 8 : 12);
        }

        ActorBaseline baseline = store.baseline("U1", "data:access", "metadata.dataSize").orElseThrow();
        assertThat(baseline.getMean()).isCloseTo(10.0, within(1e-9));
        assertThat(baseline.getStdDev()).isCloseTo(2.0, within(1e-9));
        assertThat(BehavioralBaselineStore.isAnomaly(17, baseline, 3.0)).isTrue();
        assertThat(BehavioralBaselineStore.isAnomaly(15, baseline, 3.0)).isFalse();
        assertThat(store.zScore("U1", "data:access", "metadata.dataSize", 17)).hasValueSatisfying(
                z -> assertThat(z).isCloseTo(3.5, within(1e-9)));
    }

    @Test
    @DisplayName("Should never flag when all samples are identical")
    void shouldIgnoreZeroDeviation() {
        for (int i = 0; i < 20; i++) {
            store.observe("U1", "auth:success", "timestamp", 9);
        }

        ActorBaseline baseline = store.baseline("U1", "auth:success", "timestamp").orElseThrow();
        assertThat(baseline.getStdDev()).isZero();
        assertThat(BehavioralBaselineStore.isAnomaly(3, baseline, 3.0)).isFalse();
        assertThat(store.zScore("U1", "auth:success", "timestamp", 3)).isEmpty();
    }

    @Test
    @DisplayName("Should keep only the most recent samples")
    void shouldBoundSamples() {
        for (int i = 0; i < BehavioralBaselineStore.MAX_SAMPLES + 20; i++) {
            store.observe("U1", "x", "metadata.v", i);
        }

        ActorBaseline baseline = store.baseline("U1", "x", "metadata.v").orElseThrow();
        assertThat(baseline.getSampleCount()).isEqualTo(BehavioralBaselineStore.MAX_SAMPLES);
        assertThat(baseline.getSamples().get(0)).isEqualTo(20.0);
    }

    @Test
    @DisplayName("Should observe login hour and numeric metadata of an event")
    void shouldObserveEvent() {
        SecurityEvent event = new SecurityEvent("e1", "data:access", Severity.LOW,
                Instant.parse("2024-03-01T14:25:00Z"), null,
                Map.of("userId", "U1", "dataSize", 2048, "resource", "/reports"));

        store.observeEvent(event);

        assertThat(store.baseline("U1", "data:access", "timestamp").orElseThrow().getSamples())
                .containsExactly(14.0);
        assertThat(store.baseline("U1", "data:access", "metadata.dataSize").orElseThrow().getSamples())
                .containsExactly(2048.0);
        assertThat(store.baseline("U1", "data:access", "metadata.resource")).isEmpty();
        assertThat(BehavioralBaselineStore.observedValue(event, "timestamp")).contains(14.0);
    }

    @Test
    @DisplayName("Should ignore non-finite metadata values so the baseline stays usable")
    void shouldIgnoreNonFiniteValues() {
        for (int i = 0; i < 12; i++) {
            store.observeEvent(new SecurityEvent("e" + i, "data:access", Severity.LOW,
                    Instant.parse("2024-03-01T14:25:00Z"), null,
                    Map.of("userId", "U1", "dataSize", i % 2 == 0 ? 100 : 300, "ratio", "NaN",
                            "score", "Infinity", "delta", Double.NEGATIVE_INFINITY)));
        }

        assertThat(store.baseline("U1", "data:access", "metadata.ratio")).isEmpty();
        assertThat(store.baseline("U1", "data:access", "metadata.score")).isEmpty();
        assertThat(store.baseline("U1", "data:access", "metadata.delta")).isEmpty();
        assertThat(store.zScore("U1", "data:access", "metadata.dataSize", 500)).hasValue(3.0);
        assertThatThrownBy(() -> store.observe("U1", "data:access", "metadata.x", Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should skip events without a user")
    void shouldSkipAnonymousEvents() {
        store.observeEvent(new SecurityEvent("e1", "data:access", Severity.LOW, Instant.now(), null,
                Map.of("dataSize", 10)));

        assertThat(store.size()).isZero();
    }
}
