package com.threatsentinel.core.ingress;

import com.threatsentinel.core.baseline.BehavioralBaselineStore;
import com.threatsentinel.core.bus.SecurityEventBus;
import com.threatsentinel.core.bus.Topics;
import com.threatsentinel.core.correlation.CorrelationEngine;
import com.threatsentinel.core.detection.RuleEngine;
import com.threatsentinel.core.escalation.EscalationService;
import com.threatsentinel.core.model.RawSecurityEvent;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.model.Threat;
import com.threatsentinel.core.spi.SecurityRecordStore;
import com.threatsentinel.core.util.Ids;
import com.threatsentinel.core.window.EventBuffer;
import com.threatsentinel.core.window.WindowCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry point of the detection pipeline.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>Validate and normalize the raw event (type required; id, severity and
 * timestamp defaulted).</li>
 * <li>Append to the rolling buffer and record window counters.</li>
 * <li>Run the rule engine, then the correlation engine.</li>
 * <li>Escalate every threat.</li>
 * <li>Observe actor baselines, so an event never scores against
 * itself.</li>
 * <li>Publish on {@code event} and {@code <type>}; persist asynchronously.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class EventIngress {

    private static final Logger LOG = LoggerFactory.getLogger(EventIngress.class);

    private final EventBuffer buffer;
    private final WindowCounterStore counters;
    private final BehavioralBaselineStore baselines;
    private final RuleEngine ruleEngine;
    private final CorrelationEngine correlationEngine;
    private final EscalationService escalation;
    private final SecurityEventBus bus;
    private final SecurityRecordStore recordStore;
    private final Executor executor;
    private final Clock clock;

    public EventIngress(EventBuffer buffer, WindowCounterStore counters, BehavioralBaselineStore baselines,
            RuleEngine ruleEngine, CorrelationEngine correlationEngine, EscalationService escalation,
            SecurityEventBus bus, SecurityRecordStore recordStore, Executor executor, Clock clock) {
        this.buffer = Objects.requireNonNull(buffer, "EventBuffer must not be null");
        this.counters = Objects.requireNonNull(counters, "WindowCounterStore must not be null");
        this.baselines = Objects.requireNonNull(baselines, "BehavioralBaselineStore must not be null");
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "RuleEngine must not be null");
        this.correlationEngine = Objects.requireNonNull(correlationEngine, "CorrelationEngine must not be null");
        this.escalation = Objects.requireNonNull(escalation, "EscalationService must not be null");
        this.bus = Objects.requireNonNull(bus, "SecurityEventBus must not be null");
        this.recordStore = Objects.requireNonNull(recordStore, "SecurityRecordStore must not be null");
        this.executor = Objects.requireNonNull(executor, "Executor must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Accept one event and run it through the pipeline.
     *
     * @return the validated, immutable event
     * @throws InvalidSecurityEventException if the event has no type
     */
    public SecurityEvent submit(RawSecurityEvent raw) {
        SecurityEvent event = normalize(raw);

        buffer.add(event);
        counters.record(event);

        List<Threat> threats = new ArrayList<>(ruleEngine.evaluate(event));
        threats.addAll(correlationEngine.evaluate(event));
        for (Threat threat : threats) {
            try {
                escalation.escalate(threat, event);
            } catch (RuntimeException e) {
                LOG.error("Escalation of threat {} for event {} failed", threat.getId(), event.getId(), e);
            }
        }

        baselines.observeEvent(event);

        bus.publish(Topics.EVENT, event);
        bus.publish(Topics.eventType(event.getType()), event);
        CompletableFuture.runAsync(() -> recordStore.saveEvent(event), executor)
                .exceptionally(e -> {
                    LOG.error("Failed to persist event {}", event.getId(), e);
                    return null;
                });

        LOG.debug("Processed event {} ({}): {} threat(s)", event.getId(), event.getType(), threats.size());
        return event;
    }

    /**
     * Validate a raw event and fill in defaults.
     *
     * @throws InvalidSecurityEventException if the event is {@code null} or
     *                                       has no type
     */
    public SecurityEvent normalize(RawSecurityEvent raw) {
        if (raw == null) {
            throw new InvalidSecurityEventException("Security event must not be null");
        }
        if (raw.getType() == null || raw.getType().isBlank()) {
            throw new InvalidSecurityEventException("Security event type is required");
        }
        String id = raw.getId() != null && !raw.getId().isBlank() ? raw.getId() : Ids.next("evt");
        Severity severity = Severity.parse(raw.getSeverity());
        if (severity == null) {
            if (raw.getSeverity() != null) {
                LOG.debug("Unknown severity '{}' on event {}, using LOW", raw.getSeverity(), id);
            }
            severity = Severity.LOW;
        }
        Instant timestamp = raw.getTimestamp() != null ? raw.getTimestamp() : clock.instant();
        return new SecurityEvent(id, raw.getType().trim(), severity, timestamp, raw.getMessage(),
                raw.getMetadata());
    }
}
