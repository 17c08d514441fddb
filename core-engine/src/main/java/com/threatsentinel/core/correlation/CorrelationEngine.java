package com.threatsentinel.core.correlation;

import com.threatsentinel.core.model.DetectionMechanism;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Threat;
import com.threatsentinel.core.rule.CorrelationCondition;
import com.threatsentinel.core.rule.CorrelationRule;
import com.threatsentinel.core.util.Ids;
import com.threatsentinel.core.window.GroupKey;
import com.threatsentinel.core.window.Occurrence;
import com.threatsentinel.core.window.WindowCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Matches multi-stage attack patterns across event types.
 *
 * <p>
 * A rule is evaluated only for events whose type is one of its triggers.
 * It matches when every condition holds: at least {@code minCount}
 * qualifying occurrences of the condition's event type within its window.
 * With {@code after: X}, an occurrence qualifies only if it is strictly
 * later than the latest occurrence of {@code X}, looked up in X's own
 * condition window when X is itself a condition, otherwise in this
 * condition's window. Counts are scoped to the triggering event's
 * {@code groupBy} value when the rule declares one.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The rule list is an immutable snapshot behind a volatile field.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationEngine.class);

    private final WindowCounterStore counters;
    private final Clock clock;
    private volatile List<CorrelationRule> rules = List.of();

    public CorrelationEngine(WindowCounterStore counters, Clock clock) {
        this.counters = Objects.requireNonNull(counters, "Counter store must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Replace the rule set.
     *
     * @throws IllegalStateException if any rule is invalid
     */
    public synchronized void setRules(List<CorrelationRule> rules) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        List<CorrelationRule> copies = new ArrayList<>();
        for (CorrelationRule rule : rules) {
            CorrelationRule copy = rule.copy();
            copy.validate();
            copy.getConditions().values().forEach(c -> counters.registerWindow(c.getTimeWindowMinutes()));
            if (copy.getGroupBy() != null) {
                counters.registerGroupField(copy.getGroupBy());
            }
            copies.add(copy);
        }
        this.rules = List.copyOf(copies);
        LOG.info("Loaded {} correlation rule(s)", copies.size());
    }

    public List<CorrelationRule> getRules() {
        return rules.stream().map(CorrelationRule::copy).toList();
    }

    /**
     * @param event validated event; its counters must already be recorded
     * @return one threat per matching rule
     */
    public List<Threat> evaluate(SecurityEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        List<Threat> threats = new ArrayList<>();
        for (CorrelationRule rule : rules) {
            if (!rule.isTriggeredBy(event.getType())) {
                continue;
            }
            try {
                match(rule, event).ifPresent(threats::add);
            } catch (RuntimeException e) {
                LOG.debug("Correlation rule '{}' failed on event {}; treating as no match", rule.getName(),
                        event.getId(), e);
            }
        }
        return threats;
    }

    private Optional<Threat> match(CorrelationRule rule, SecurityEvent event) {
        GroupKey group = null;
        if (rule.getGroupBy() != null) {
            Optional<Object> value = event.resolve(rule.getGroupBy());
            if (value.isEmpty()) {
                return Optional.empty();
            }
            group = GroupKey.of(rule.getGroupBy(), value.get().toString());
        }

        Map<String, Integer> matchedCounts = new LinkedHashMap<>();
        List<Occurrence> related = new ArrayList<>();
        for (Map.Entry<String, CorrelationCondition> entry : rule.getConditions().entrySet()) {
            String eventType = entry.getKey();
            CorrelationCondition condition = entry.getValue();
            List<Occurrence> qualifying = qualifying(rule, eventType, condition, group);
            if (qualifying.size() < condition.getMinCount()) {
                LOG.trace("Correlation '{}': {} has {} of {} required", rule.getName(), eventType,
                        qualifying.size(), condition.getMinCount());
                return Optional.empty();
            }
            matchedCounts.put(eventType, qualifying.size());
            related.addAll(qualifying);
        }

        List<String> relatedIds = eventIdsByTime(related);
        LOG.debug("Correlation '{}' matched on event {}: {}", rule.getName(), event.getId(), matchedCounts);
        Threat.Builder builder = Threat.builder()
                .id(Ids.next("threat"))
                .ruleName(rule.getName())
                .description(rule.getDescription())
                .type(rule.getThreatType())
                .mechanism(DetectionMechanism.CORRELATION)
                .severity(rule.getSeverity())
                .timestamp(clock.instant())
                .sourceEventId(event.getId())
                .metadata("correlationRule", rule.getName())
                .metadata("triggerEvent", event.getType())
                .metadata("matchedCounts", matchedCounts)
                .relatedEventIds(relatedIds)
                .response(rule.getResponse());
        if (group != null) {
            builder.metadata(group.getField(), group.getValue());
        }
        return Optional.of(builder.build());
    }

    private List<Occurrence> qualifying(CorrelationRule rule, String eventType, CorrelationCondition condition,
            GroupKey group) {
        List<Occurrence> candidates = filter(
                counters.occurrences(eventType, group, condition.getTimeWindowMinutes()), condition);
        String after = condition.getAfter();
        if (after == null) {
            return candidates;
        }

        CorrelationCondition afterCondition = rule.getConditions().get(after);
        int afterWindow = afterCondition != null
                ? afterCondition.getTimeWindowMinutes()
                : condition.getTimeWindowMinutes();
        List<Occurrence> predecessors = counters.occurrences(after, group, afterWindow);
        if (afterCondition != null) {
            predecessors = filter(predecessors, afterCondition);
        }
        Optional<Instant> latest = predecessors.stream()
                .map(Occurrence::getTimestamp)
                .max(Instant::compareTo);
        if (latest.isEmpty()) {
            return List.of();
        }
        return candidates.stream()
                .filter(o -> o.getTimestamp().isAfter(latest.get()))
                .toList();
    }

    private static List<Occurrence> filter(List<Occurrence> occurrences, CorrelationCondition condition) {
        if (condition.getMetadata().isEmpty()) {
            return occurrences;
        }
        return occurrences.stream()
                .filter(o -> o.getEvent().map(condition::matchesMetadata).orElse(false))
                .toList();
    }

    private static List<String> eventIdsByTime(List<Occurrence> occurrences) {
        return occurrences.stream()
                .sorted(Comparator.comparing(Occurrence::getTimestamp))
                .map(Occurrence::getEvent)
                .flatMap(Optional::stream)
                .map(SecurityEvent::getId)
                .distinct()
                .toList();
    }
}
