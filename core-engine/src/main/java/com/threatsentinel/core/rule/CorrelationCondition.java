package com.threatsentinel.core.rule;

import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.util.FieldPaths;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One stage of a {@link CorrelationRule}: at least {@code minCount}
 * occurrences of the keyed event type within {@code timeWindowMinutes},
 * optionally all later than the latest occurrence of the {@code after} type.
 *
 * <p>
 * {@code metadata} narrows which occurrences qualify. Each entry maps an
 * event field path to either a literal (equality) or a range
 * {@code {min: .., max: ..}}:
 * </p>
 *
 * <pre>
 * data:access:
 *   minCount: 5
 *   timeWindowMinutes: 15
 *   metadata:
 *     dataSize: { min: 5000000 }
 * </pre>
 *
 * @since 1.0.0
 */
public class CorrelationCondition implements Serializable {

    private static final long serialVersionUID = 1L;

    private int minCount = 1;
    private int timeWindowMinutes;
    private String after;
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public CorrelationCondition() {
    }

    CorrelationCondition(CorrelationCondition other) {
        this.minCount = other.minCount;
        this.timeWindowMinutes = other.timeWindowMinutes;
        this.after = other.after;
        this.metadata = new LinkedHashMap<>(other.metadata);
    }

    public static CorrelationCondition of(int minCount, int timeWindowMinutes, String after) {
        CorrelationCondition condition = new CorrelationCondition();
        condition.setMinCount(minCount);
        condition.setTimeWindowMinutes(timeWindowMinutes);
        condition.setAfter(after);
        return condition;
    }

    /**
     * @param event candidate occurrence
     * @return {@code true} if the event satisfies every metadata filter
     */
    public boolean matchesMetadata(SecurityEvent event) {
        if (metadata == null || metadata.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> filter : metadata.entrySet()) {
            Optional<Object> actual = event.resolve(filter.getKey());
            if (actual.isEmpty()) {
                return false;
            }
            if (filter.getValue() instanceof Map<?, ?> range) {
                Optional<Double> number = FieldPaths.toDouble(actual.get());
                if (number.isEmpty()) {
                    return false;
                }
                Optional<Double> min = FieldPaths.toDouble(range.get("min"));
                Optional<Double> max = FieldPaths.toDouble(range.get("max"));
                if (min.isPresent() && number.get() < min.get()) {
                    return false;
                }
                if (max.isPresent() && number.get() > max.get()) {
                    return false;
                }
            } else if (!String.valueOf(filter.getValue()).equals(String.valueOf(actual.get()))) {
                return false;
            }
        }
        return true;
    }

    public int getMinCount() {
        return minCount;
    }

    public void setMinCount(int minCount) {
        this.minCount = minCount;
    }

    public int getTimeWindowMinutes() {
        return timeWindowMinutes;
    }

    public void setTimeWindowMinutes(int timeWindowMinutes) {
        this.timeWindowMinutes = timeWindowMinutes;
    }

    public String getAfter() {
        return after;
    }

    public void setAfter(String after) {
        this.after = after;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "CorrelationCondition{minCount=" + minCount + ", timeWindowMinutes="
                + timeWindowMinutes + ", after='" + after + "'}";
    }
}
