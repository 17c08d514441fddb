package com.threatsentinel.core.detection;

import java.time.Instant;

/**
 * Outcome of a dry-run replay of one rule over the rolling event buffer.
 *
 * @since 1.0.0
 */
public final class RuleTestReport {

    private final String ruleId;
    private final int eventsProcessed;
    private final int detections;
    private final int falsePositives;
    private final double effectiveness;
    private final Instant timestamp;

    public RuleTestReport(String ruleId, int eventsProcessed, int detections, int falsePositives,
            Instant timestamp) {
        this.ruleId = ruleId;
        this.eventsProcessed = eventsProcessed;
        this.detections = detections;
        this.falsePositives = falsePositives;
        this.effectiveness = detections == 0 ? 0.0 : (double) (detections - falsePositives) / detections;
        this.timestamp = timestamp;
    }

    public String getRuleId() {
        return ruleId;
    }

    public int getEventsProcessed() {
        return eventsProcessed;
    }

    public int getDetections() {
        return detections;
    }

    /**
     * @return detections whose source event no live alert referenced
     */
    public int getFalsePositives() {
        return falsePositives;
    }

    /**
     * @return share of detections confirmed by a live alert, {@code 0} when
     *         nothing was detected
     */
    public double getEffectiveness() {
        return effectiveness;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return String.format("RuleTestReport{ruleId='%s', events=%d, detections=%d, falsePositives=%d, "
                + "effectiveness=%.2f}", ruleId, eventsProcessed, detections, falsePositives, effectiveness);
    }
}
