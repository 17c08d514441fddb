package com.threatsentinel.core.detection;

import com.threatsentinel.core.baseline.BehavioralBaselineStore;
import com.threatsentinel.core.model.DetectionMechanism;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.model.Threat;
import com.threatsentinel.core.rule.DetectionRule;
import com.threatsentinel.core.util.SettableClock;
import com.threatsentinel.core.window.EventBuffer;
import com.threatsentinel.core.window.GroupKey;
import com.threatsentinel.core.window.WindowCounterStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.threatsentinel.core.detection.DetectionFixtures.T0;
import static com.threatsentinel.core.detection.DetectionFixtures.countRule;
import static com.threatsentinel.core.detection.DetectionFixtures.event;
import static com.threatsentinel.core.detection.DetectionFixtures.ingest;
import static com.threatsentinel.core.detection.DetectionFixtures.rule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleEngine}.
 */
class RuleEngineTest {

    private SettableClock clock;
    private RuleEngine engine;

    @BeforeEach
    void setUp() {
        clock = new SettableClock(T0);
        engine = new RuleEngine(DetectionFixtures.context(clock));
        engine.loadDefaults(List.of(
                countRule("R1", "auth:failure", 1, 5),
                downloadRule("R2", "malware")));
    }

    @Test
    @DisplayName("Should evaluate every matching rule without short-circuit")
    void shouldEvaluateAllRules() {
        engine.addRule(countRule("R3", "auth:failure", 1, 15));

        List<Threat> threats = engine.evaluate(ingest(engine.getContext(),
                event(clock, "auth:failure", "userId", "U1")));

        assertThat(threats).extracting(Threat::getRuleId).containsExactly("R1", "R3");
    }

    @Test
    @DisplayName("Disabled rules should be skipped")
    void shouldSkipDisabledRules() {
        assertThat(engine.updateRule("R1", r -> r.setEnabled(false))).isTrue();

        List<Threat> threats = engine.evaluate(ingest(engine.getContext(),
                event(clock, "auth:failure", "userId", "U1")));

        assertThat(threats).isEmpty();
        assertThat(engine.getRule("R1")).hasValueSatisfying(r -> assertThat(r.isEnabled()).isFalse());
    }

    @Test
    @DisplayName("Adding a rule with an existing id should replace it in place")
    void shouldReplaceInPlace() {
        DetectionRule replacement = downloadRule("R1", "trojan");
        replacement.setName("Replaced");

        engine.addRule(replacement);

        assertThat(engine.getRules()).extracting(DetectionRule::getId).containsExactly("R1", "R2");
        assertThat(engine.getRules().get(0).getName()).isEqualTo("Replaced");
    }

    @Test
    @DisplayName("Update should patch a copy and leave the rule intact when validation fails")
    void shouldValidateUpdates() {
        assertThat(engine.updateRule("R2", r -> r.setSeverity(Severity.LOW))).isTrue();
        assertThat(engine.getRule("R2").orElseThrow().getSeverity()).isEqualTo(Severity.LOW);

        assertThatThrownBy(() -> engine.updateRule("R2", r -> r.setConditions(Map.of())))
                .isInstanceOf(IllegalStateException.class);
        assertThat(engine.getRule("R2").orElseThrow().getConditions()).isNotEmpty();
    }

    @Test
    @DisplayName("Update and delete of an unknown id should report false")
    void shouldReportUnknownIds() {
        assertThat(engine.updateRule("nope", r -> r.setName("x"))).isFalse();
        assertThat(engine.deleteRule("nope")).isFalse();
    }

    @Test
    @DisplayName("Reset should restore the default rules")
    void shouldResetToDefaults() {
        engine.deleteRule("R1");
        engine.addRule(countRule("R9", "auth:failure", 1, 5));

        engine.resetToDefaults();

        assertThat(engine.getRules()).extracting(DetectionRule::getId).containsExactly("R1", "R2");
    }

    @Test
    @DisplayName("Returned rules should be defensive copies")
    void shouldReturnCopies() {
        engine.getRules().get(0).setName("mutated");

        assertThat(engine.getRules().get(0).getName()).isEqualTo("Rule R1");
    }

    @Test
    @DisplayName("A failing rule should not prevent other rules from firing")
    void shouldIsolateFailingRule() {
        WindowCounterStore failingCounts = new WindowCounterStore(clock) {
            @Override
            public int count(String eventType, GroupKey group, int windowMinutes) {
                if (windowMinutes == 7) {
                    throw new IllegalStateException("counter unavailable");
                }
                return super.count(eventType, group, windowMinutes);
            }
        };
        DetectionContext context = new DetectionContext(clock, failingCounts, new BehavioralBaselineStore(),
                new EventBuffer(10), ThreatIntelCatalog.empty());
        RuleEngine isolated = new RuleEngine(context);
        isolated.loadDefaults(List.of(
                countRule("R7", "auth:failure", 1, 7),
                countRule("R1", "auth:failure", 1, 5)));

        SecurityEvent e = ingest(context, event(clock, "auth:failure", "userId", "U1"));

        assertThat(isolated.evaluate(e)).extracting(Threat::getRuleId).containsExactly("R1");
    }

    @Test
    @DisplayName("Should reject an invalid rule")
    void shouldRejectInvalidRule() {
        DetectionRule invalid = rule("R5", DetectionMechanism.PATTERN_MATCHING);

        assertThatThrownBy(() -> engine.addRule(invalid))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("requires 'threshold'");
    }

    private static DetectionRule downloadRule(String id, String keyword) {
        DetectionRule rule = rule(id, DetectionMechanism.RULE_BASED);
        rule.setEventType("file:download");
        rule.setConditions(Map.of("metadata.url", Map.of("op", "contains", "value", keyword)));
        return rule;
    }
}
