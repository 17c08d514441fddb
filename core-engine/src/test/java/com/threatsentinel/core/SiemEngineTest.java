package com.threatsentinel.core;

import com.threatsentinel.core.bus.Topics;
import com.threatsentinel.core.config.RulesConfig;
import com.threatsentinel.core.config.RulesLoader;
import com.threatsentinel.core.config.SiemConfig;
import com.threatsentinel.core.config.SiemConfigLoader;
import com.threatsentinel.core.detection.RuleTestReport;
import com.threatsentinel.core.model.Alert;
import com.threatsentinel.core.model.AlertStatus;
import com.threatsentinel.core.model.DetectionMechanism;
import com.threatsentinel.core.model.Incident;
import com.threatsentinel.core.model.IncidentType;
import com.threatsentinel.core.model.RawSecurityEvent;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.model.ThreatType;
import com.threatsentinel.core.query.EventFilter;
import com.threatsentinel.core.query.EventSearch;
import com.threatsentinel.core.query.SecurityAnalytics;
import com.threatsentinel.core.rule.DetectionRule;
import com.threatsentinel.core.rule.ThresholdSpec;
import com.threatsentinel.core.util.SettableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

/**
 * End-to-end tests for {@link SiemEngine} with the bundled rule set and
 * configuration.
 */
class SiemEngineTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private SettableClock clock;
    private List<Alert> alerts;
    private List<Incident> incidents;
    private List<String> containments;
    private SiemEngine engine;

    @BeforeEach
    void setUp() {
        clock = new SettableClock(T0);
        alerts = new ArrayList<>();
        incidents = new ArrayList<>();
        containments = new ArrayList<>();

        SiemConfig config = SiemConfigLoader.fromClasspath("siem.yml");
        config.setBlacklistedIps(List.of("203.0.113.7"));
        engine = newEngine(config, () -> RulesLoader.fromClasspath("default-rules.yml"));
        engine.initialize();
        engine.subscribe(Topics.ALERT, alerts::add);
        engine.subscribe(Topics.INCIDENT, incidents::add);
    }

    @Test
    @DisplayName("Should raise one brute-force alert on the fifth failure and another on the sixth")
    void shouldDetectBruteForce() {
        for (int i = 0; i < 4; i++) {
            submit(failure("U1"));
        }
        assertThat(alerts).isEmpty();

        SecurityEvent fifth = submit(failure("U1"));

        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getRuleId()).isEqualTo("TD001");
            assertThat(alert.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(alert.getThreatType()).isEqualTo(ThreatType.BRUTE_FORCE);
            assertThat(alert.getStatus()).isEqualTo(AlertStatus.OPEN);
            assertThat(alert.getSourceEventId()).isEqualTo(fifth.getId());
            assertThat(alert.getMetadata()).containsEntry("failureCount", 5);
        });
        assertThat(containments).containsExactly("LOCK_ACCOUNT:U1");

        submit(failure("U1"));

        assertThat(alerts).hasSize(2);
        assertThat(alerts.get(1).getMetadata()).containsEntry("failureCount", 6);
    }

    @Test
    @DisplayName("Should keep failure counts separate per user")
    void shouldScopeCountsPerUser() {
        for (int i = 0; i < 4; i++) {
            submit(failure("U1"));
            submit(failure("U2"));
        }

        assertThat(alerts).isEmpty();
    }

    @Test
    @DisplayName("Should correlate repeated failures followed by a successful login")
    void shouldCorrelateAuthenticationAttack() {
        for (int i = 0; i < 3; i++) {
            submit(failure("U1"));
        }
        SecurityEvent success = submit(RawSecurityEvent.of("auth:success").with("userId", "U1"));

        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getCorrelationRule()).isEqualTo("Authentication Attack");
            assertThat(alert.getMechanism()).isEqualTo(DetectionMechanism.CORRELATION);
            assertThat(alert.getSourceEventId()).isEqualTo(success.getId());
            assertThat(alert.getRelatedEvents()).contains(success.getId());
        });
    }

    @Test
    @DisplayName("Should flag a single oversized data access but not a normal one")
    void shouldDetectExfiltrationVolume() {
        submit(RawSecurityEvent.of("data:access").with("userId", "U1").with("dataSize", 5000000));
        assertThat(alerts).isEmpty();

        submit(RawSecurityEvent.of("data:access").with("userId", "U1").with("dataSize", 15000000));

        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getRuleId()).isEqualTo("TD008");
            assertThat(alert.getThreatType()).isEqualTo(ThreatType.DATA_EXFILTRATION);
            assertThat(alert.getSeverity()).isEqualTo(Severity.HIGH);
        });
    }

    @Test
    @DisplayName("Should match configured blacklisted addresses on any event type")
    void shouldDetectBlacklistedIp() {
        submit(RawSecurityEvent.of("net:connection").with("ipAddress", "203.0.113.7"));

        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getRuleId()).isEqualTo("TD007");
            assertThat(alert.getMechanism()).isEqualTo(DetectionMechanism.THREAT_INTELLIGENCE);
            assertThat(alert.getMetadata()).containsEntry("intelSource", "blacklist");
        });
    }

    @Test
    @DisplayName("Should open an incident for a critical malicious download")
    void shouldOpenIncidentForMaliciousDownload() {
        submit(RawSecurityEvent.of("file:download").with("userId", "U1")
                .with("url", "http://cdn.example.org/malware.exe"));

        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getRuleId()).isEqualTo("TD010");
            assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL);
        });
        assertThat(incidents).singleElement().satisfies(incident -> {
            assertThat(incident.getSourceAlertId()).isEqualTo(alerts.get(0).getId());
            assertThat(incident.getType()).isEqualTo(IncidentType.MALWARE);
            assertThat(incident.getTimeline()).hasSize(1);
        });
    }

    @Test
    @DisplayName("Should refuse events until initialized")
    void shouldRefuseEventsBeforeInitialize() {
        SiemEngine fresh = newEngine(SiemConfig.defaults(), () -> RulesLoader.fromClasspath("default-rules.yml"));

        assertThat(fresh.isInitialized()).isFalse();
        assertThatThrownBy(() -> fresh.submit(failure("U1")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not initialized");
    }

    @Test
    @DisplayName("Should refuse rule changes until initialized")
    void shouldRefuseRuleChangesBeforeInitialize() {
        SiemEngine fresh = newEngine(SiemConfig.defaults(), () -> RulesLoader.fromClasspath("default-rules.yml"));

        assertThatThrownBy(() -> fresh.addRule(downloadRule()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not initialized");
        assertThatThrownBy(() -> fresh.updateRule("TD001", rule -> rule.setEnabled(false)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> fresh.deleteRule("TD001"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(fresh::resetRulesToDefaults)
                .isInstanceOf(IllegalStateException.class);

        fresh.initialize();
        fresh.addRule(downloadRule());
        assertThat(fresh.getRules()).extracting(DetectionRule::getId).contains("TD001", "X1");
    }

    @Test
    @DisplayName("Should query, search and summarize submitted events")
    void shouldQueryBufferedEvents() {
        submit(failure("U1"));
        submit(failure("U2"));
        SecurityEvent access = submit(RawSecurityEvent.of("data:access").with("userId", "U1")
                .with("dataSize", 2048));

        assertThat(engine.getRecentEvents()).hasSize(3).first().isEqualTo(access);
        assertThat(engine.getRecentEvents(EventFilter.builder().userId("U1").build(), 10))
                .extracting(SecurityEvent::getType).containsExactly("data:access", "auth:failure");
        assertThat(engine.searchEvents(EventSearch.builder().text("u2").build()))
                .extracting(SecurityEvent::getType).containsExactly("auth:failure");

        SecurityAnalytics analytics = engine.getSecurityAnalytics(EventFilter.all());
        assertThat(analytics.getTotalEvents()).isEqualTo(3);
        assertThat(analytics.getEventsByType()).containsEntry("auth:failure", 2L);
        assertThat(analytics.getLatestEvent()).contains(access);
    }

    @Test
    @DisplayName("Should stay uninitialized when the rule set cannot be loaded")
    void shouldFailInitializeOnBadRules() {
        SiemEngine broken = newEngine(SiemConfig.defaults(), () -> RulesLoader.fromClasspath("missing-rules.yml"));

        assertThatThrownBy(broken::initialize)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to initialize");
        assertThat(broken.isInitialized()).isFalse();
        assertThatThrownBy(() -> broken.submit(failure("U1"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should reject an invalid configuration at build time")
    void shouldRejectInvalidConfig() {
        SiemConfig config = SiemConfig.defaults();
        config.setMaxEventsInMemory(0);

        assertThatThrownBy(() -> newEngine(config, RulesConfig::new))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("maxEventsInMemory");
    }

    @Test
    @DisplayName("Should bind threshold categories to the default rules")
    void shouldBindThresholdCategories() {
        SiemConfig config = SiemConfigLoader.fromClasspath("siem.yml");
        config.getAlertThresholds().get(SiemConfig.AUTH_FAILURES).setThreshold(2);
        SiemEngine strict = newEngine(config, () -> RulesLoader.fromClasspath("default-rules.yml"));
        strict.initialize();
        List<Alert> raised = new ArrayList<>();
        strict.subscribe(Topics.ALERT, raised::add);

        strict.submit(failure("U9"));
        strict.submit(failure("U9"));

        assertThat(raised).extracting(Alert::getRuleId).containsExactly("TD001");
    }

    @Test
    @DisplayName("Should add, update, delete and reset rules")
    void shouldAdministerRules() {
        int defaults = engine.getRules().size();

        engine.addRule(downloadRule());
        assertThat(engine.getRules()).hasSize(defaults + 1);

        assertThat(engine.updateRule("X1", rule -> rule.setSeverity(Severity.CRITICAL))).isTrue();
        assertThat(engine.getRules()).filteredOn(rule -> "X1".equals(rule.getId()))
                .singleElement().extracting(DetectionRule::getSeverity).isEqualTo(Severity.CRITICAL);
        assertThat(engine.updateRule("nope", rule -> rule.setEnabled(false))).isFalse();

        assertThat(engine.deleteRule("TD001")).isTrue();
        assertThat(engine.deleteRule("TD001")).isFalse();
        for (int i = 0; i < 5; i++) {
            submit(failure("U1"));
        }
        assertThat(alerts).isEmpty();

        engine.resetRulesToDefaults();
        assertThat(engine.getRules()).hasSize(defaults)
                .extracting(DetectionRule::getId).contains("TD001").doesNotContain("X1");
    }

    @Test
    @DisplayName("A rule added at runtime should count events recorded before it was added")
    void shouldCountHistoryForRuleAddedAtRuntime() {
        for (int i = 0; i < 4; i++) {
            submit(RawSecurityEvent.of("vpn:failure").with("deviceId", "D1"));
        }

        DetectionRule rule = new DetectionRule();
        rule.setId("X2");
        rule.setName("VPN failures per device");
        rule.setType(ThreatType.BRUTE_FORCE);
        rule.setMechanism(DetectionMechanism.PATTERN_MATCHING);
        rule.setSeverity(Severity.MEDIUM);
        rule.setEventType("vpn:failure");
        rule.setGroupBy("deviceId");
        rule.setThreshold(ThresholdSpec.ofCount(5, 20));
        engine.addRule(rule);

        submit(RawSecurityEvent.of("vpn:failure").with("deviceId", "D1"));

        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getRuleId()).isEqualTo("X2");
            assertThat(alert.getMetadata()).containsEntry("eventCount", 5);
        });
    }

    @Test
    @DisplayName("Should dry-run a rule over buffered events without raising alerts")
    void shouldTestRuleAgainstBuffer() {
        for (int i = 0; i < 5; i++) {
            submit(failure("U1"));
        }
        assertThat(alerts).hasSize(1);

        DetectionRule candidate = engine.getRules().get(0);
        candidate.setThreshold(ThresholdSpec.ofCount(3, 5));
        RuleTestReport report = engine.testRule(candidate);

        assertThat(report.getRuleId()).isEqualTo("TD001");
        assertThat(report.getEventsProcessed()).isEqualTo(5);
        assertThat(report.getDetections()).isEqualTo(3);
        assertThat(report.getFalsePositives()).isEqualTo(2);
        assertThat(report.getEffectiveness()).isCloseTo(1.0 / 3, offset(1e-9));
        assertThat(alerts).hasSize(1);
    }

    @Test
    @DisplayName("Should report stale open alerts from a maintenance pass")
    void shouldReportStaleAlerts() {
        submit(RawSecurityEvent.of("net:connection").with("ipAddress", "203.0.113.7"));

        assertThat(engine.getMaintenance().runOnce()).isEmpty();
        clock.advance(Duration.ofMinutes(61));
        assertThat(engine.getMaintenance().runOnce()).hasSize(1);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private SiemEngine newEngine(SiemConfig config, Supplier<RulesConfig> rules) {
        return SiemEngine.builder()
                .config(config)
                .clock(clock)
                .executor(Runnable::run)
                .rulesSource(rules)
                .containmentEnforcer((action, userId) -> containments.add(action + ":" + userId))
                .build();
    }

    private SecurityEvent submit(RawSecurityEvent raw) {
        clock.advance(Duration.ofSeconds(1));
        return engine.submit(raw);
    }

    private static RawSecurityEvent failure(String userId) {
        return RawSecurityEvent.of("auth:failure").with("userId", userId);
    }

    private static DetectionRule downloadRule() {
        DetectionRule rule = new DetectionRule();
        rule.setId("X1");
        rule.setName("Executable download");
        rule.setType(ThreatType.MALWARE);
        rule.setMechanism(DetectionMechanism.RULE_BASED);
        rule.setSeverity(Severity.MEDIUM);
        rule.setEventType("file:download");
        rule.setConditions(Map.of("metadata.fileName", Map.of("op", "endsWith",
                "value", ".exe")));
        return rule;
    }
}
