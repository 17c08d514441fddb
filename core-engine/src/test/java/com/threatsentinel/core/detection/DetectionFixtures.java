package com.threatsentinel.core.detection;

import com.threatsentinel.core.baseline.BehavioralBaselineStore;
import com.threatsentinel.core.model.DetectionMechanism;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.model.ThreatType;
import com.threatsentinel.core.rule.DetectionRule;
import com.threatsentinel.core.rule.ThresholdSpec;
import com.threatsentinel.core.util.SettableClock;
import com.threatsentinel.core.window.EventBuffer;
import com.threatsentinel.core.window.WindowCounterStore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared builders for detector tests.
 */
final class DetectionFixtures {

    static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private DetectionFixtures() {
    }

    static DetectionContext context(SettableClock clock) {
        return context(clock, ThreatIntelCatalog.empty());
    }

    static DetectionContext context(SettableClock clock, ThreatIntelCatalog threatIntel) {
        return new DetectionContext(clock, new WindowCounterStore(clock), new BehavioralBaselineStore(),
                new EventBuffer(1000), threatIntel);
    }

    static DetectionRule rule(String id, DetectionMechanism mechanism) {
        DetectionRule rule = new DetectionRule();
        rule.setId(id);
        rule.setName("Rule " + id);
        rule.setType(ThreatType.SUSPICIOUS_ACTIVITY);
        rule.setMechanism(mechanism);
        rule.setSeverity(Severity.HIGH);
        return rule;
    }

    static DetectionRule countRule(String id, String eventType, int count, int windowMinutes) {
        DetectionRule rule = rule(id, DetectionMechanism.PATTERN_MATCHING);
        rule.setEventType(eventType);
        rule.setGroupBy("userId");
        rule.setThreshold(ThresholdSpec.ofCount(count, windowMinutes));
        return rule;
    }

    /**
     * Event at the clock's current instant; {@code keyValues} alternate
     * metadata keys and values.
     */
    static SecurityEvent event(SettableClock clock, String type, Object... keyValues) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            metadata.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new SecurityEvent("evt-" + SEQUENCE.incrementAndGet(), type, Severity.LOW, clock.instant(), null,
                metadata);
    }

    /**
     * Record an event in the context's stores the way ingestion does before
     * rules are evaluated.
     */
    static SecurityEvent ingest(DetectionContext context, SecurityEvent event) {
        context.getBuffer().add(event);
        context.getCounters().record(event);
        return event;
    }
}
