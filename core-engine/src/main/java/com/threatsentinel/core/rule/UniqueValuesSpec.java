package com.threatsentinel.core.rule;

import java.io.Serializable;

/**
 * Cardinality threshold for {@code BEHAVIORAL_ANALYSIS} rules, e.g. "two or
 * more distinct {@code metadata.country} values per user within an hour".
 */
public class UniqueValuesSpec implements Serializable {

    private static final long serialVersionUID = 1L;

    private String field;
    private int threshold;
    private int timeWindowMinutes;

    public UniqueValuesSpec() {
    }

    UniqueValuesSpec(UniqueValuesSpec other) {
        this.field = other.field;
        this.threshold = other.threshold;
        this.timeWindowMinutes = other.timeWindowMinutes;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public int getThreshold() {
        return threshold;
    }

    public void setThreshold(int threshold) {
        this.threshold = threshold;
    }

    public int getTimeWindowMinutes() {
        return timeWindowMinutes;
    }

    public void setTimeWindowMinutes(int timeWindowMinutes) {
        this.timeWindowMinutes = timeWindowMinutes;
    }

    @Override
    public String toString() {
        return "UniqueValuesSpec{field='" + field + "', threshold=" + threshold
                + ", timeWindowMinutes=" + timeWindowMinutes + '}';
    }
}
