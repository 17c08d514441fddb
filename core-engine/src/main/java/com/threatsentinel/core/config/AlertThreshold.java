package com.threatsentinel.core.config;

import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.rule.DetectionRule;
import com.threatsentinel.core.rule.ThresholdSpec;

import java.io.Serializable;

/**
 * One alert-threshold category ({@code authFailures}, {@code dataExfiltration},
 * ...). For count categories {@code threshold} is an event count; for value
 * categories it is the minimum field value.
 *
 * @since 1.0.0
 */
public class AlertThreshold implements Serializable {

    private static final long serialVersionUID = 1L;

    private long threshold = 1;
    private int timeWindowMinutes = 60;
    private Severity severity = Severity.MEDIUM;

    public AlertThreshold() {
    }

    public static AlertThreshold of(long threshold, int timeWindowMinutes, Severity severity) {
        AlertThreshold t = new AlertThreshold();
        t.setThreshold(threshold);
        t.setTimeWindowMinutes(timeWindowMinutes);
        t.setSeverity(severity);
        return t;
    }

    /**
     * Overwrite the rule's severity and, for pattern rules, its threshold
     * parameters with this category's values.
     */
    public void applyTo(DetectionRule rule) {
        rule.setSeverity(severity);
        ThresholdSpec spec = rule.getThreshold();
        if (spec == null) {
            return;
        }
        if (spec.isValueThreshold()) {
            spec.setMinValue(threshold);
        } else {
            spec.setCount((int) threshold);
        }
        spec.setTimeWindowMinutes(timeWindowMinutes);
    }

    public long getThreshold() {
        return threshold;
    }

    public void setThreshold(long threshold) {
        this.threshold = threshold;
    }

    public int getTimeWindowMinutes() {
        return timeWindowMinutes;
    }

    public void setTimeWindowMinutes(int timeWindowMinutes) {
        this.timeWindowMinutes = timeWindowMinutes;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    @Override
    public String toString() {
        return "AlertThreshold{threshold=" + threshold + ", timeWindowMinutes=" + timeWindowMinutes
                + ", severity=" + severity + '}';
    }
}
