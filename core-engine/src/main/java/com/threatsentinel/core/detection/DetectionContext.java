package com.threatsentinel.core.detection;

import com.threatsentinel.core.baseline.BehavioralBaselineStore;
import com.threatsentinel.core.window.EventBuffer;
import com.threatsentinel.core.window.WindowCounterStore;

import java.time.Clock;
import java.util.Objects;

/**
 * Shared state detectors read from: clock, counters, baselines, the rolling
 * event buffer and the threat-intelligence catalog.
 *
 * @since 1.0.0
 */
public final class DetectionContext {

    private final Clock clock;
    private final WindowCounterStore counters;
    private final BehavioralBaselineStore baselines;
    private final EventBuffer buffer;
    private final ThreatIntelCatalog threatIntel;

    public DetectionContext(Clock clock, WindowCounterStore counters, BehavioralBaselineStore baselines,
            EventBuffer buffer, ThreatIntelCatalog threatIntel) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.counters = Objects.requireNonNull(counters, "Counter store must not be null");
        this.baselines = Objects.requireNonNull(baselines, "Baseline store must not be null");
        this.buffer = Objects.requireNonNull(buffer, "Event buffer must not be null");
        this.threatIntel = Objects.requireNonNull(threatIntel, "Threat intel catalog must not be null");
    }

    public Clock getClock() {
        return clock;
    }

    public WindowCounterStore getCounters() {
        return counters;
    }

    public BehavioralBaselineStore getBaselines() {
        return baselines;
    }

    public EventBuffer getBuffer() {
        return buffer;
    }

    public ThreatIntelCatalog getThreatIntel() {
        return threatIntel;
    }
}
