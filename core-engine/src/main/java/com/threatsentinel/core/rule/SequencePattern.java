package com.threatsentinel.core.rule;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * An ordered list of event types that must all have occurred, in order,
 * within {@code timeWindowMinutes}. Other events may be interleaved.
 */
public class SequencePattern implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<String> sequence = new ArrayList<>();
    private int timeWindowMinutes;

    public SequencePattern() {
    }

    SequencePattern(SequencePattern other) {
        this.sequence = new ArrayList<>(other.sequence);
        this.timeWindowMinutes = other.timeWindowMinutes;
    }

    public static SequencePattern of(int timeWindowMinutes, String... sequence) {
        SequencePattern pattern = new SequencePattern();
        pattern.setSequence(List.of(sequence));
        pattern.setTimeWindowMinutes(timeWindowMinutes);
        return pattern;
    }

    public List<String> getSequence() {
        return sequence;
    }

    public void setSequence(List<String> sequence) {
        this.sequence = sequence != null ? new ArrayList<>(sequence) : new ArrayList<>();
    }

    public int getTimeWindowMinutes() {
        return timeWindowMinutes;
    }

    public void setTimeWindowMinutes(int timeWindowMinutes) {
        this.timeWindowMinutes = timeWindowMinutes;
    }

    @Override
    public String toString() {
        return "SequencePattern{sequence=" + sequence + ", timeWindowMinutes=" + timeWindowMinutes + '}';
    }
}
