package com.threatsentinel.core.escalation;

import com.threatsentinel.core.bus.SecurityEventBus;
import com.threatsentinel.core.bus.Topics;
import com.threatsentinel.core.config.SiemConfig;
import com.threatsentinel.core.containment.ContainmentDispatcher;
import com.threatsentinel.core.model.Alert;
import com.threatsentinel.core.model.AlertStatus;
import com.threatsentinel.core.model.ContainmentAction;
import com.threatsentinel.core.model.Incident;
import com.threatsentinel.core.model.IncidentType;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.model.Threat;
import com.threatsentinel.core.rule.ResponsePolicy;
import com.threatsentinel.core.spi.SecurityRecordStore;
import com.threatsentinel.core.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Turns threats into alerts, incidents and containment.
 *
 * <p>
 * Every threat is published on the {@code threat} channel and yields exactly
 * one {@link Alert} (status OPEN). An {@link Incident} is opened when the
 * threat is CRITICAL or its response policy asks for one; the two triggers
 * converge, so an alert never has more than one incident. Persistence and
 * notification run on the async executor and never fail the caller.
 * </p>
 *
 * <p>
 * A bounded index of recent alerts backs stale-alert checks and rule
 * dry-runs.
 * </p>
 *
 * @since 1.0.0
 */
public class EscalationService {

    private static final Logger LOG = LoggerFactory.getLogger(EscalationService.class);

    private final SiemConfig config;
    private final SecurityRecordStore recordStore;
    private final NotificationDispatcher notifications;
    private final ContainmentDispatcher containment;
    private final SecurityEventBus bus;
    private final Executor executor;
    private final Clock clock;

    /** Recent alerts by id, oldest first; guarded by {@code this}. */
    private final Map<String, Alert> recentAlerts = new LinkedHashMap<>();

    public EscalationService(SiemConfig config, SecurityRecordStore recordStore,
            NotificationDispatcher notifications, ContainmentDispatcher containment, SecurityEventBus bus,
            Executor executor, Clock clock) {
        this.config = Objects.requireNonNull(config, "SiemConfig must not be null");
        this.recordStore = Objects.requireNonNull(recordStore, "SecurityRecordStore must not be null");
        this.notifications = Objects.requireNonNull(notifications, "NotificationDispatcher must not be null");
        this.containment = Objects.requireNonNull(containment, "ContainmentDispatcher must not be null");
        this.bus = Objects.requireNonNull(bus, "SecurityEventBus must not be null");
        this.executor = Objects.requireNonNull(executor, "Executor must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Escalate one threat raised for {@code event}.
     */
    public EscalationResult escalate(Threat threat, SecurityEvent event) {
        Objects.requireNonNull(threat, "Threat must not be null");
        Objects.requireNonNull(event, "Event must not be null");
        ResponsePolicy response = threat.getResponse() != null ? threat.getResponse() : new ResponsePolicy();

        LOG.info("Threat detected: {} [{}] by {} on event {}", threat.getRuleName(), threat.getSeverity(),
                threat.getMechanism(), event.getId());
        bus.publish(Topics.THREAT, threat);

        Alert alert = createAlert(threat, event);
        if (response.isCreateAlert()) {
            notifications.notify(alert);
        }

        Incident incident = null;
        if (threat.getSeverity() == Severity.CRITICAL || response.isCreateIncident()) {
            incident = createIncident(threat, alert, response.isCreateIncident());
        }

        ContainmentAction action = null;
        if (response.requestsContainment()) {
            action = containment.execute(response.getContainmentAction(), event, threat).orElse(null);
        }
        return new EscalationResult(alert, incident, action);
    }

    private Alert createAlert(Threat threat, SecurityEvent event) {
        Map<String, Object> metadata = new LinkedHashMap<>(event.getMetadata());
        metadata.putAll(threat.getMetadata());
        metadata.put("threatId", threat.getId());
        if (threat.getRuleId() != null) {
            metadata.put("ruleId", threat.getRuleId());
        }
        if (threat.getType() != null) {
            metadata.put("threatType", threat.getType().name());
        }
        metadata.put("detectionMechanism", threat.getMechanism().name());

        Alert alert = Alert.builder()
                .id(Ids.next("alert"))
                .name(threat.isCorrelation() ? threat.getRuleName() : "Threat: " + threat.getRuleName())
                .description((threat.getDescription() != null ? threat.getDescription() : threat.getRuleName())
                        + ". Detected by " + threat.getMechanism() + " mechanism.")
                .severity(threat.getSeverity())
                .timestamp(clock.instant())
                .sourceEventId(event.getId())
                .correlationRule(threat.isCorrelation() ? threat.getRuleName() : null)
                .ruleId(threat.getRuleId())
                .mechanism(threat.getMechanism())
                .threatType(threat.getType())
                .metadata(metadata)
                .relatedEvents(threat.getRelatedEventIds())
                .build();

        remember(alert);
        LOG.info("Alert created: {} [{}] {}", alert.getId(), alert.getSeverity(), alert.getName());
        bus.publish(Topics.ALERT, alert);
        CompletableFuture.runAsync(() -> recordStore.saveAlert(alert), executor)
                .exceptionally(e -> {
                    LOG.error("Failed to persist alert {}", alert.getId(), e);
                    return null;
                });
        return alert;
    }

    private Incident createIncident(Threat threat, Alert alert, boolean requestedByPolicy) {
        IncidentType type = threat.getType() != null ? threat.getType().getIncidentType() : IncidentType.OTHER;
        Map<String, Object> metadata = new LinkedHashMap<>(alert.getMetadata());
        Incident incident = Incident.builder()
                .id(Ids.next("incident"))
                .name(requestedByPolicy ? "Threat Incident: " + threat.getRuleName()
                        : "Critical alert: " + alert.getName())
                .description(alert.getDescription() + " Severity: " + threat.getSeverity() + ".")
                .severity(threat.getSeverity())
                .type(type)
                .timestamp(clock.instant())
                .sourceAlertId(alert.getId())
                .metadata(metadata)
                .build();

        LOG.warn("Incident opened: {} [{}] {} for alert {}", incident.getId(), incident.getSeverity(),
                incident.getType(), alert.getId());
        bus.publish(Topics.INCIDENT, incident);
        CompletableFuture.runAsync(() -> recordStore.saveIncident(incident), executor)
                .exceptionally(e -> {
                    LOG.error("Failed to persist incident {}", incident.getId(), e);
                    return null;
                });
        return incident;
    }

    // ---------------------------------------------------------------
    // Recent alert index
    // ---------------------------------------------------------------

    private synchronized void remember(Alert alert) {
        recentAlerts.put(alert.getId(), alert);
        Iterator<String> it = recentAlerts.keySet().iterator();
        while (recentAlerts.size() > config.getRecentAlertCapacity() && it.hasNext()) {
            it.next();
            it.remove();
        }
    }

    /**
     * @return recent alerts, oldest first
     */
    public synchronized List<Alert> recentAlerts() {
        return new ArrayList<>(recentAlerts.values());
    }

    public synchronized Optional<Alert> findAlert(String alertId) {
        return Optional.ofNullable(recentAlerts.get(alertId));
    }

    /**
     * @return {@code true} if a recent alert names the event as its source or
     *         as a related event
     */
    public synchronized boolean isReferencedByAlert(String eventId) {
        for (Alert alert : recentAlerts.values()) {
            if (alert.getSourceEventId().equals(eventId) || alert.getRelatedEvents().contains(eventId)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return OPEN alerts created more than {@code maxAge} ago
     */
    public List<Alert> staleAlerts(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        return recentAlerts().stream()
                .filter(a -> a.getStatus() == AlertStatus.OPEN && a.getTimestamp().isBefore(cutoff))
                .toList();
    }
}
