package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.DetectionMechanism;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Threat;
import com.threatsentinel.core.rule.DetectionRule;
import com.threatsentinel.core.rule.ThresholdSpec;
import com.threatsentinel.core.util.SettableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static com.threatsentinel.core.detection.DetectionFixtures.T0;
import static com.threatsentinel.core.detection.DetectionFixtures.countRule;
import static com.threatsentinel.core.detection.DetectionFixtures.event;
import static com.threatsentinel.core.detection.DetectionFixtures.ingest;
import static com.threatsentinel.core.detection.DetectionFixtures.rule;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PatternMatchingDetector}.
 */
class PatternMatchingDetectorTest {

    private SettableClock clock;
    private DetectionContext context;

    @BeforeEach
    void setUp() {
        clock = new SettableClock(T0);
        context = DetectionFixtures.context(clock);
    }

    @Test
    @DisplayName("Should NOT fire while the count is below threshold")
    void shouldNotFireBelowThreshold() {
        PatternMatchingDetector detector = new PatternMatchingDetector(
                countRule("P1", "auth:failure", 5, 5), context);

        for (int i = 0; i < 4; i++) {
            SecurityEvent e = ingest(context, event(clock, "auth:failure", "userId", "U1"));
            assertThat(detector.evaluate(e)).isEmpty();
        }
    }

    @Test
    @DisplayName("Should fire once the count reaches the threshold and report it under the count key")
    void shouldFireAtThreshold() {
        DetectionRule rule = countRule("P1", "auth:failure", 5, 5);
        rule.getThreshold().setCountKey("failureCount");
        PatternMatchingDetector detector = new PatternMatchingDetector(rule, context);

        Optional<Threat> threat = Optional.empty();
        for (int i = 0; i < 5; i++) {
            threat = detector.evaluate(ingest(context, event(clock, "auth:failure", "userId", "U1")));
        }

        assertThat(threat).isPresent();
        assertThat(threat.get().getRuleId()).isEqualTo("P1");
        assertThat(threat.get().getMetadata())
                .containsEntry("failureCount", 5)
                .containsEntry("userId", "U1")
                .containsEntry("timeWindowMinutes", 5);
    }

    @Test
    @DisplayName("Should count each group separately")
    void shouldCountPerGroup() {
        PatternMatchingDetector detector = new PatternMatchingDetector(
                countRule("P1", "auth:failure", 3, 5), context);

        ingest(context, event(clock, "auth:failure", "userId", "U1"));
        ingest(context, event(clock, "auth:failure", "userId", "U1"));
        SecurityEvent other = ingest(context, event(clock, "auth:failure", "userId", "U2"));

        assertThat(detector.evaluate(other)).isEmpty();
    }

    @Test
    @DisplayName("Should forget occurrences that left the window")
    void shouldRespectWindow() {
        PatternMatchingDetector detector = new PatternMatchingDetector(
                countRule("P1", "auth:failure", 2, 5), context);

        ingest(context, event(clock, "auth:failure", "userId", "U1"));
        clock.advance(Duration.ofMinutes(6));
        SecurityEvent late = ingest(context, event(clock, "auth:failure", "userId", "U1"));

        assertThat(detector.evaluate(late)).isEmpty();
    }

    @Test
    @DisplayName("Should ignore events of another type")
    void shouldFilterByEventType() {
        PatternMatchingDetector detector = new PatternMatchingDetector(
                countRule("P1", "auth:failure", 1, 5), context);

        SecurityEvent e = ingest(context, event(clock, "auth:success", "userId", "U1"));

        assertThat(detector.evaluate(e)).isEmpty();
    }

    @Test
    @DisplayName("Should skip events that lack the group field")
    void shouldSkipMissingGroup() {
        PatternMatchingDetector detector = new PatternMatchingDetector(
                countRule("P1", "auth:failure", 1, 5), context);

        SecurityEvent e = ingest(context, event(clock, "auth:failure", "ipAddress", "10.0.0.1"));

        assertThat(detector.evaluate(e)).isEmpty();
    }

    @Test
    @DisplayName("Value form should fire when the field reaches the minimum")
    void shouldFireOnValueThreshold() {
        DetectionRule rule = rule("P2", DetectionMechanism.PATTERN_MATCHING);
        rule.setEventType("data:access");
        ThresholdSpec spec = new ThresholdSpec();
        spec.setField("metadata.dataSize");
        spec.setMinValue(10_485_760);
        rule.setThreshold(spec);
        PatternMatchingDetector detector = new PatternMatchingDetector(rule, context);

        Optional<Threat> big = detector.evaluate(event(clock, "data:access", "dataSize", 15_000_000));
        Optional<Threat> small = detector.evaluate(event(clock, "data:access", "dataSize", 5_000_000));
        Optional<Threat> missing = detector.evaluate(event(clock, "data:access"));

        assertThat(big).isPresent();
        assertThat(big.get().getMetadata())
                .containsEntry("dataSize", 15_000_000d)
                .containsEntry("threshold", 10_485_760d);
        assertThat(small).isEmpty();
        assertThat(missing).isEmpty();
    }
}
