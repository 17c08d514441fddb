package com.threatsentinel.core.escalation;

import com.threatsentinel.core.bus.SecurityEventBus;
import com.threatsentinel.core.bus.Topics;
import com.threatsentinel.core.config.SiemConfig;
import com.threatsentinel.core.containment.ContainmentDispatcher;
import com.threatsentinel.core.model.Alert;
import com.threatsentinel.core.model.AlertStatus;
import com.threatsentinel.core.model.ContainmentAction;
import com.threatsentinel.core.model.DetectionMechanism;
import com.threatsentinel.core.model.Incident;
import com.threatsentinel.core.model.IncidentStatus;
import com.threatsentinel.core.model.IncidentType;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.model.Threat;
import com.threatsentinel.core.model.ThreatType;
import com.threatsentinel.core.model.TimelineEntry;
import com.threatsentinel.core.rule.ResponsePolicy;
import com.threatsentinel.core.spi.NotificationSender;
import com.threatsentinel.core.spi.SecurityRecordStore;
import com.threatsentinel.core.util.SettableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EscalationService}.
 */
class EscalationServiceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private SettableClock clock;
    private SiemConfig config;
    private SecurityEventBus bus;
    private RecordingStore store;
    private List<String> notified;
    private List<String> contained;
    private EscalationService service;
    private int sequence;

    @BeforeEach
    void setUp() {
        clock = new SettableClock(T0);
        config = SiemConfig.defaults();
        config.setNotificationRecipients(Map.of(
                "CRITICAL", List.of("oncall@example.com"),
                "HIGH", List.of("team@example.com")));
        bus = new SecurityEventBus();
        store = new RecordingStore();
        notified = new ArrayList<>();
        contained = new ArrayList<>();
        NotificationSender sender = (recipients, alert) -> notified.add(alert.getId() + "->" + recipients);
        service = new EscalationService(config, store,
                new NotificationDispatcher(config, sender, Runnable::run),
                new ContainmentDispatcher((action, userId) -> contained.add(action + ":" + userId)),
                bus, Runnable::run, clock);
    }

    @Test
    @DisplayName("Should turn every threat into exactly one open alert")
    void shouldCreateOneAlert() {
        List<Threat> threats = new ArrayList<>();
        List<Alert> alerts = new ArrayList<>();
        bus.subscribe(Topics.THREAT, threats::add);
        bus.subscribe(Topics.ALERT, alerts::add);
        SecurityEvent event = event("U1");
        Threat threat = threat(Severity.HIGH, new ResponsePolicy()).metadata("failureCount", 5).build();

        EscalationResult result = service.escalate(threat, event);

        Alert alert = result.getAlert();
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.OPEN);
        assertThat(alert.getName()).isEqualTo("Threat: Brute Force");
        assertThat(alert.getDescription()).endsWith("Detected by PATTERN_MATCHING mechanism.");
        assertThat(alert.getSourceEventId()).isEqualTo(event.getId());
        assertThat(alert.getRuleId()).isEqualTo("TD001");
        assertThat(alert.getCorrelationRule()).isNull();
        assertThat(alert.getMetadata())
                .containsEntry("userId", "U1")
                .containsEntry("failureCount", 5)
                .containsEntry("threatId", threat.getId())
                .containsEntry("threatType", "BRUTE_FORCE")
                .containsEntry("detectionMechanism", "PATTERN_MATCHING");
        assertThat(threats).containsExactly(threat);
        assertThat(alerts).containsExactly(alert);
        assertThat(store.alerts).containsExactly(alert);
        assertThat(service.recentAlerts()).containsExactly(alert);
        assertThat(result.getIncident()).isEmpty();
        assertThat(result.getContainment()).isEmpty();
    }

    @Test
    @DisplayName("Should notify the recipients of the alert's severity tier")
    void shouldNotifyTier() {
        Alert alert = service.escalate(threat(Severity.HIGH, new ResponsePolicy()).build(), event("U1")).getAlert();

        assertThat(notified).containsExactly(alert.getId() + "->[team@example.com]");
    }

    @Test
    @DisplayName("Should skip notification when the policy disables it or nobody is subscribed")
    void shouldSkipNotification() {
        ResponsePolicy silent = new ResponsePolicy();
        silent.setCreateAlert(false);

        EscalationResult muted = service.escalate(threat(Severity.HIGH, silent).build(), event("U1"));
        service.escalate(threat(Severity.LOW, new ResponsePolicy()).build(), event("U1"));

        assertThat(muted.getAlert()).isNotNull();
        assertThat(service.recentAlerts()).hasSize(2);
        assertThat(notified).isEmpty();
    }

    @Test
    @DisplayName("A CRITICAL threat should open exactly one incident")
    void shouldOpenIncidentForCritical() {
        List<Incident> published = new ArrayList<>();
        bus.subscribe(Topics.INCIDENT, published::add);

        EscalationResult result = service.escalate(threat(Severity.CRITICAL, new ResponsePolicy())
                .type(ThreatType.MALWARE).build(), event("U1"));

        Incident incident = result.getIncident().orElseThrow();
        assertThat(incident.getName()).isEqualTo("Critical alert: Threat: Brute Force");
        assertThat(incident.getType()).isEqualTo(IncidentType.MALWARE);
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.OPEN);
        assertThat(incident.getSourceAlertId()).isEqualTo(result.getAlert().getId());
        assertThat(incident.getTimeline()).singleElement().satisfies(entry -> {
            assertThat(entry.getAction()).isEqualTo(TimelineEntry.CREATED);
            assertThat(entry.getActor()).isEqualTo(TimelineEntry.SYSTEM_ACTOR);
        });
        assertThat(published).containsExactly(incident);
        assertThat(store.incidents).containsExactly(incident);
    }

    @Test
    @DisplayName("A CRITICAL threat whose policy also asks for an incident should still open one")
    void shouldConvergeIncidentTriggers() {
        ResponsePolicy policy = new ResponsePolicy();
        policy.setCreateIncident(true);

        service.escalate(threat(Severity.CRITICAL, policy).build(), event("U1"));

        assertThat(store.incidents).hasSize(1);
        assertThat(store.incidents.get(0).getName()).isEqualTo("Threat Incident: Brute Force");
        assertThat(store.incidents.get(0).getType()).isEqualTo(IncidentType.UNAUTHORIZED_ACCESS);
    }

    @Test
    @DisplayName("A HIGH threat should open an incident only when its policy asks for one")
    void shouldOpenIncidentOnRequest() {
        service.escalate(threat(Severity.HIGH, new ResponsePolicy()).build(), event("U1"));
        assertThat(store.incidents).isEmpty();

        ResponsePolicy policy = new ResponsePolicy();
        policy.setCreateIncident(true);
        service.escalate(threat(Severity.HIGH, policy).build(), event("U1"));
        assertThat(store.incidents).hasSize(1);
    }

    @Test
    @DisplayName("Should dispatch the requested containment")
    void shouldDispatchContainment() {
        ResponsePolicy policy = new ResponsePolicy();
        policy.setAutoContainment(true);
        policy.setContainmentAction("LOCK_ACCOUNT");

        EscalationResult result = service.escalate(threat(Severity.HIGH, policy).build(), event("U1"));

        assertThat(result.getContainment()).contains(ContainmentAction.LOCK_ACCOUNT);
        assertThat(contained).containsExactly("LOCK_ACCOUNT:U1");
    }

    @Test
    @DisplayName("Correlation threats should carry the rule name as the alert name")
    void shouldNameCorrelationAlerts() {
        Threat threat = Threat.builder()
                .id("threat-c")
                .ruleName("Authentication Attack")
                .mechanism(DetectionMechanism.CORRELATION)
                .severity(Severity.HIGH)
                .timestamp(T0)
                .sourceEventId("e9")
                .relatedEventIds(List.of("e1", "e2", "e9"))
                .build();

        Alert alert = service.escalate(threat, event("U1")).getAlert();

        assertThat(alert.getName()).isEqualTo("Authentication Attack");
        assertThat(alert.getCorrelationRule()).isEqualTo("Authentication Attack");
        assertThat(alert.getRelatedEvents()).containsExactly("e1", "e2", "e9");
        assertThat(service.isReferencedByAlert("e2")).isTrue();
        assertThat(service.isReferencedByAlert("e7")).isFalse();
    }

    @Test
    @DisplayName("Failing persistence and notification should not fail escalation")
    void shouldTolerateDownstreamFailures() {
        NotificationSender failingSender = (recipients, alert) -> {
            throw new IllegalStateException("smtp down");
        };
        SecurityRecordStore failingStore = new RecordingStore() {
            @Override
            public void saveAlert(Alert alert) {
                throw new IllegalStateException("db down");
            }
        };
        EscalationService fragile = new EscalationService(config, failingStore,
                new NotificationDispatcher(config, failingSender, Runnable::run),
                new ContainmentDispatcher((action, userId) -> {
                }), bus, Runnable::run, clock);

        EscalationResult result = fragile.escalate(threat(Severity.HIGH, new ResponsePolicy()).build(),
                event("U1"));

        assertThat(result.getAlert()).isNotNull();
        assertThat(fragile.recentAlerts()).hasSize(1);
    }

    @Test
    @DisplayName("Open alerts older than the limit should be reported as stale")
    void shouldReportStaleAlerts() {
        Alert first = service.escalate(threat(Severity.HIGH, new ResponsePolicy()).build(), event("U1")).getAlert();
        Alert second = service.escalate(threat(Severity.HIGH, new ResponsePolicy()).build(), event("U1"))
                .getAlert();
        second.setStatus(AlertStatus.INVESTIGATING);
        clock.advance(Duration.ofMinutes(61));

        assertThat(service.staleAlerts(Duration.ofMinutes(60))).containsExactly(first);
        assertThat(service.findAlert(first.getId())).contains(first);
    }

    @Test
    @DisplayName("The recent alert index should be bounded")
    void shouldBoundRecentAlerts() {
        config.setRecentAlertCapacity(2);

        service.escalate(threat(Severity.LOW, new ResponsePolicy()).build(), event("U1"));
        Alert second = service.escalate(threat(Severity.LOW, new ResponsePolicy()).build(), event("U1")).getAlert();
        Alert third = service.escalate(threat(Severity.LOW, new ResponsePolicy()).build(), event("U1")).getAlert();

        assertThat(service.recentAlerts()).containsExactly(second, third);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private SecurityEvent event(String userId) {
        return new SecurityEvent("evt-" + (++sequence), "auth:failure", Severity.MEDIUM, clock.instant(), null,
                Map.of("userId", userId));
    }

    private Threat.Builder threat(Severity severity, ResponsePolicy response) {
        return Threat.builder()
                .id("threat-" + (++sequence))
                .ruleId("TD001")
                .ruleName("Brute Force")
                .description("Brute Force: 5 failures")
                .type(ThreatType.BRUTE_FORCE)
                .mechanism(DetectionMechanism.PATTERN_MATCHING)
                .severity(severity)
                .timestamp(clock.instant())
                .sourceEventId("evt-x")
                .response(response);
    }

    private static class RecordingStore implements SecurityRecordStore {
        final List<SecurityEvent> events = new ArrayList<>();
        final List<Alert> alerts = new ArrayList<>();
        final List<Incident> incidents = new ArrayList<>();

        @Override
        public void saveEvent(SecurityEvent event) {
            events.add(event);
        }

        @Override
        public void saveAlert(Alert alert) {
            alerts.add(alert);
        }

        @Override
        public void saveIncident(Incident incident) {
            incidents.add(incident);
        }
    }
}
