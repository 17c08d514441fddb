package com.threatsentinel.core.rule;

import java.io.Serializable;

/**
 * Parameters of a {@code PATTERN_MATCHING} rule.
 *
 * <p>
 * Two forms are supported:
 * </p>
 * <ul>
 * <li>occurrence threshold: {@code count} events of the rule's event type
 * (optionally per {@code groupBy} value) within {@code timeWindowMinutes}</li>
 * <li>value threshold: the numeric {@code field} of the event is at least
 * {@code minValue}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ThresholdSpec implements Serializable {

    private static final long serialVersionUID = 1L;

    private int count;
    private int timeWindowMinutes;
    /** Metadata key under which the observed count is reported on the alert. */
    private String countKey = "eventCount";

    private String field;
    private double minValue;

    public ThresholdSpec() {
    }

    ThresholdSpec(ThresholdSpec other) {
        this.count = other.count;
        this.timeWindowMinutes = other.timeWindowMinutes;
        this.countKey = other.countKey;
        this.field = other.field;
        this.minValue = other.minValue;
    }

    public static ThresholdSpec ofCount(int count, int timeWindowMinutes) {
        ThresholdSpec spec = new ThresholdSpec();
        spec.setCount(count);
        spec.setTimeWindowMinutes(timeWindowMinutes);
        return spec;
    }

    /**
     * @return {@code true} for the value-threshold form
     */
    public boolean isValueThreshold() {
        return field != null && !field.isBlank();
    }

    public int getCount() {
        return count;
    }

    public void setCount(int count) {
        this.count = count;
    }

    public int getTimeWindowMinutes() {
        return timeWindowMinutes;
    }

    public void setTimeWindowMinutes(int timeWindowMinutes) {
        this.timeWindowMinutes = timeWindowMinutes;
    }

    public String getCountKey() {
        return countKey;
    }

    public void setCountKey(String countKey) {
        this.countKey = countKey;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public double getMinValue() {
        return minValue;
    }

    public void setMinValue(double minValue) {
        this.minValue = minValue;
    }

    @Override
    public String toString() {
        return isValueThreshold()
                ? "ThresholdSpec{field='" + field + "', minValue=" + minValue + '}'
                : "ThresholdSpec{count=" + count + ", timeWindowMinutes=" + timeWindowMinutes + '}';
    }
}
