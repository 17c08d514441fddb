package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Threat;
import com.threatsentinel.core.rule.DetectionRule;
import com.threatsentinel.core.rule.SequencePattern;
import com.threatsentinel.core.rule.UniqueValuesSpec;
import com.threatsentinel.core.window.GroupKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Behavioral-analysis detector.
 *
 * <h3>Sequences</h3>
 * <p>
 * A pattern matches when the current event completes its sequence: the
 * event's type equals the last step, and the earlier steps occur in order
 * (not necessarily adjacent) among the same group's buffered events within
 * the pattern's window.
 * </p>
 *
 * <h3>Unique values</h3>
 * <p>
 * Fires when the number of distinct values of {@code uniqueValues.field}
 * across the group's events of this type in the window reaches
 * {@code uniqueValues.threshold}.
 * </p>
 *
 * @since 1.0.0
 */
public class BehavioralDetector extends AbstractRuleDetector {

    private static final Logger LOG = LoggerFactory.getLogger(BehavioralDetector.class);

    private final List<SequencePattern> patterns;
    private final UniqueValuesSpec uniqueValues;

    public BehavioralDetector(DetectionRule rule, DetectionContext context) {
        super(rule, context);
        this.patterns = List.copyOf(this.rule.getPatterns());
        this.uniqueValues = this.rule.getUniqueValues();
        if (patterns.isEmpty() && uniqueValues == null) {
            throw new IllegalArgumentException(
                    "Behavioral rule '" + rule.getId() + "' requires patterns or uniqueValues");
        }
        if (uniqueValues != null) {
            Objects.requireNonNull(this.rule.getGroupBy(),
                    "groupBy must not be null for uniqueValues rule '" + rule.getId() + "'");
            context.getCounters().registerWindow(uniqueValues.getTimeWindowMinutes());
            context.getCounters().registerGroupField(this.rule.getGroupBy());
        }
    }

    @Override
    protected Optional<Threat> detect(SecurityEvent event) {
        for (SequencePattern pattern : patterns) {
            Optional<Threat> threat = detectSequence(event, pattern);
            if (threat.isPresent()) {
                return threat;
            }
        }
        if (uniqueValues != null) {
            return detectUniqueValues(event);
        }
        return Optional.empty();
    }

    private Optional<Threat> detectSequence(SecurityEvent event, SequencePattern pattern) {
        List<String> sequence = pattern.getSequence();
        if (sequence.isEmpty() || !sequence.get(sequence.size() - 1).equals(event.getType())) {
            return Optional.empty();
        }
        Optional<String> group = groupValue(event);
        if (rule.getGroupBy() != null && group.isEmpty()) {
            return Optional.empty();
        }

        Instant since = context.getClock().instant().minus(Duration.ofMinutes(pattern.getTimeWindowMinutes()));
        List<SecurityEvent> candidates = new ArrayList<>(context.getBuffer().since(since,
                e -> !e.getId().equals(event.getId())
                        && !e.getTimestamp().isAfter(event.getTimestamp())
                        && sameGroup(e, group)));
        candidates.sort(Comparator.comparing(SecurityEvent::getTimestamp));

        // Match backwards from the current event, which fills the last step.
        List<String> matched = new ArrayList<>();
        matched.add(event.getId());
        int step = sequence.size() - 2;
        for (int i = candidates.size() - 1; i >= 0 && step >= 0; i--) {
            SecurityEvent candidate = candidates.get(i);
            if (candidate.getType().equals(sequence.get(step))) {
                matched.add(0, candidate.getId());
                step--;
            }
        }
        if (step >= 0) {
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired: sequence {} completed within {}m", rule.getId(), sequence,
                pattern.getTimeWindowMinutes());
        Threat.Builder builder = threat(event, String.format("%s: sequence %s observed within %d minute(s)",
                rule.getName(), sequence, pattern.getTimeWindowMinutes()))
                .metadata("sequence", sequence)
                .relatedEventIds(matched);
        group.ifPresent(g -> builder.metadata(rule.getGroupBy(), g));
        return Optional.of(builder.build());
    }

    private boolean sameGroup(SecurityEvent candidate, Optional<String> group) {
        if (group.isEmpty()) {
            return true;
        }
        return candidate.resolve(rule.getGroupBy())
                .map(v -> v.toString().equals(group.get()))
                .orElse(false);
    }

    private Optional<Threat> detectUniqueValues(SecurityEvent event) {
        Optional<String> group = groupValue(event);
        if (group.isEmpty()) {
            return Optional.empty();
        }
        String eventType = rule.getEventType() != null ? rule.getEventType() : event.getType();
        Set<String> values = context.getCounters().uniqueValues(eventType,
                GroupKey.of(rule.getGroupBy(), group.get()), uniqueValues.getField(),
                uniqueValues.getTimeWindowMinutes());
        if (values.size() < uniqueValues.getThreshold()) {
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired: {} distinct {} value(s) {} for {}={}", rule.getId(), values.size(),
                uniqueValues.getField(), values, rule.getGroupBy(), group.get());
        return Optional.of(threat(event, String.format("%s: %d distinct %s value(s) within %d minute(s)",
                rule.getName(), values.size(), uniqueValues.getField(), uniqueValues.getTimeWindowMinutes()))
                .metadata(rule.getGroupBy(), group.get())
                .metadata("uniqueCount", values.size())
                .metadata("uniqueValues", List.copyOf(values))
                .build());
    }
}
