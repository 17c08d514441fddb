package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Threat;
import com.threatsentinel.core.rule.DetectionRule;
import com.threatsentinel.core.util.Ids;

import java.util.Objects;
import java.util.Optional;

/**
 * Base class holding the compiled rule and shared context.
 *
 * @since 1.0.0
 */
abstract class AbstractRuleDetector implements ThreatDetector {

    protected final DetectionRule rule;
    protected final DetectionContext context;

    protected AbstractRuleDetector(DetectionRule rule, DetectionContext context) {
        Objects.requireNonNull(rule, "DetectionRule must not be null");
        this.rule = rule.copy();
        this.context = Objects.requireNonNull(context, "DetectionContext must not be null");
    }

    @Override
    public final Optional<Threat> evaluate(SecurityEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        if (rule.getEventType() != null && !rule.getEventType().equals(event.getType())) {
            return Optional.empty();
        }
        return detect(event);
    }

    /**
     * Mechanism-specific evaluation; only called for events of the rule's
     * event type.
     */
    protected abstract Optional<Threat> detect(SecurityEvent event);

    /**
     * @return a threat builder pre-filled from the rule and event
     */
    protected Threat.Builder threat(SecurityEvent event, String description) {
        return Threat.builder()
                .id(Ids.next("threat"))
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .description(description)
                .type(rule.getType())
                .mechanism(rule.getMechanism())
                .severity(rule.getSeverity())
                .timestamp(context.getClock().instant())
                .sourceEventId(event.getId())
                .response(rule.getResponse());
    }

    /**
     * @return the value of the rule's {@code groupBy} field on the event, or
     *         empty if the rule is ungrouped or the event lacks the field
     */
    protected Optional<String> groupValue(SecurityEvent event) {
        if (rule.getGroupBy() == null) {
            return Optional.empty();
        }
        return event.resolve(rule.getGroupBy()).map(Object::toString);
    }

    @Override
    public String getRuleId() {
        return rule.getId();
    }

    @Override
    public boolean isEnabled() {
        return rule.isEnabled();
    }

    @Override
    public DetectionRule getRule() {
        return rule.copy();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + '[' + rule.getId() + ']';
    }
}
