package com.threatsentinel.core.detection;

import com.threatsentinel.core.baseline.BehavioralBaselineStore;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Threat;
import com.threatsentinel.core.rule.DetectionRule;
import com.threatsentinel.core.util.SettableClock;
import com.threatsentinel.core.window.EventBuffer;
import com.threatsentinel.core.window.WindowCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Dry-runs a rule by replaying the live event buffer through an isolated
 * engine.
 *
 * <p>
 * The replay gets its own counters, baselines and buffer, driven by a clock
 * that follows event time, so nothing it does is visible to the live
 * pipeline. A detection counts as a false positive when no live alert
 * references its source event.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleTester {

    private static final Logger LOG = LoggerFactory.getLogger(RuleTester.class);

    private final EventBuffer liveBuffer;
    private final ThreatIntelCatalog threatIntel;
    private final Predicate<String> alertedEvent;
    private final Clock clock;

    /**
     * @param alertedEvent tells whether a live alert references the event id
     */
    public RuleTester(EventBuffer liveBuffer, ThreatIntelCatalog threatIntel, Predicate<String> alertedEvent,
            Clock clock) {
        this.liveBuffer = Objects.requireNonNull(liveBuffer, "Event buffer must not be null");
        this.threatIntel = Objects.requireNonNull(threatIntel, "Threat intel catalog must not be null");
        this.alertedEvent = Objects.requireNonNull(alertedEvent, "Alert predicate must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * @throws IllegalStateException if the rule is invalid
     */
    public RuleTestReport test(DetectionRule rule) {
        Objects.requireNonNull(rule, "DetectionRule must not be null");
        DetectionRule candidate = rule.copy();
        candidate.setEnabled(true);
        candidate.validate();

        List<SecurityEvent> events = new ArrayList<>(liveBuffer.snapshot());
        events.sort(Comparator.comparing(SecurityEvent::getTimestamp));

        SettableClock replayClock = new SettableClock(
                events.isEmpty() ? clock.instant() : events.get(0).getTimestamp());
        WindowCounterStore counters = new WindowCounterStore(replayClock);
        BehavioralBaselineStore baselines = new BehavioralBaselineStore();
        EventBuffer buffer = new EventBuffer(Math.max(1, liveBuffer.getCapacity()));
        RuleEngine engine = new RuleEngine(new DetectionContext(replayClock, counters, baselines, buffer,
                threatIntel));
        engine.addRule(candidate);

        int detections = 0;
        int falsePositives = 0;
        for (SecurityEvent event : events) {
            replayClock.set(event.getTimestamp());
            buffer.add(event);
            counters.record(event);
            for (Threat threat : engine.evaluate(event)) {
                detections++;
                if (!alertedEvent.test(threat.getSourceEventId())) {
                    falsePositives++;
                }
            }
            baselines.observeEvent(event);
        }

        RuleTestReport report = new RuleTestReport(candidate.getId(), events.size(), detections, falsePositives,
                clock.instant());
        LOG.info("Rule test completed: {}", report);
        return report;
    }
}
