package com.threatsentinel.core.rule;

import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.model.ThreatType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A multi-stage attack pattern spanning several event types.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * - name: Authentication Attack
 *   severity: HIGH
 *   triggerEvents: [auth:failure, auth:success]
 *   conditions:
 *     auth:failure: { minCount: 3, timeWindowMinutes: 30 }
 *     auth:success: { minCount: 1, timeWindowMinutes: 5, after: auth:failure }
 * </pre>
 *
 * <p>
 * When {@code triggerEvents} is empty the condition keys act as triggers.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationRule implements Serializable {

    private static final long serialVersionUID = 1L;

    private String name;
    private String description;
    private Severity severity;
    /** Optional category; decides the incident type when the match escalates. */
    private ThreatType threatType;
    private List<String> triggerEvents = new ArrayList<>();
    /** Optional field that scopes counting to the triggering event's value, e.g. {@code userId}. */
    private String groupBy;
    private Map<String, CorrelationCondition> conditions = new LinkedHashMap<>();
    private ResponsePolicy response = new ResponsePolicy();

    /**
     * @return a deep copy of this rule
     */
    public CorrelationRule copy() {
        CorrelationRule copy = new CorrelationRule();
        copy.name = name;
        copy.description = description;
        copy.severity = severity;
        copy.threatType = threatType;
        copy.triggerEvents = new ArrayList<>(triggerEvents);
        copy.groupBy = groupBy;
        conditions.forEach((type, condition) -> copy.conditions.put(type,
                condition != null ? new CorrelationCondition(condition) : null));
        copy.response = response != null ? new ResponsePolicy(response) : new ResponsePolicy();
        return copy;
    }

    /**
     * @param eventType type of the incoming event
     * @return {@code true} if this rule should be evaluated for the event type
     */
    public boolean isTriggeredBy(String eventType) {
        if (triggerEvents == null || triggerEvents.isEmpty()) {
            return conditions.containsKey(eventType);
        }
        return triggerEvents.contains(eventType);
    }

    /**
     * @throws IllegalStateException if the rule is incomplete or references an
     *                               unknown {@code after} type
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add("Correlation rule 'name' is required");
        }
        if (severity == null) {
            errors.add("Correlation rule '" + name + "' requires 'severity'");
        }
        if (conditions == null || conditions.isEmpty()) {
            errors.add("Correlation rule '" + name + "' requires at least one condition");
        } else {
            conditions.forEach((type, condition) -> {
                if (condition == null) {
                    errors.add("Correlation rule '" + name + "' has an empty condition for '" + type + "'");
                    return;
                }
                if (condition.getMinCount() < 1 || condition.getTimeWindowMinutes() < 1) {
                    errors.add("Correlation rule '" + name + "' condition '" + type
                            + "' requires minCount >= 1 and timeWindowMinutes >= 1");
                }
                if (type.equals(condition.getAfter())) {
                    errors.add("Correlation rule '" + name + "' condition '" + type
                            + "' cannot follow itself");
                }
            });
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid CorrelationRule: " + String.join("; ", errors));
        }
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public ThreatType getThreatType() {
        return threatType;
    }

    public void setThreatType(ThreatType threatType) {
        this.threatType = threatType;
    }

    public List<String> getTriggerEvents() {
        return triggerEvents;
    }

    public void setTriggerEvents(List<String> triggerEvents) {
        this.triggerEvents = triggerEvents != null ? new ArrayList<>(triggerEvents) : new ArrayList<>();
    }

    public String getGroupBy() {
        return groupBy;
    }

    public void setGroupBy(String groupBy) {
        this.groupBy = groupBy;
    }

    public Map<String, CorrelationCondition> getConditions() {
        return conditions;
    }

    public void setConditions(Map<String, CorrelationCondition> conditions) {
        this.conditions = conditions != null ? new LinkedHashMap<>(conditions) : new LinkedHashMap<>();
    }

    public ResponsePolicy getResponse() {
        return response;
    }

    public void setResponse(ResponsePolicy response) {
        this.response = response != null ? response : new ResponsePolicy();
    }

    @Override
    public String toString() {
        return "CorrelationRule{name='" + name + "', severity=" + severity
                + ", conditions=" + conditions.keySet() + '}';
    }
}
