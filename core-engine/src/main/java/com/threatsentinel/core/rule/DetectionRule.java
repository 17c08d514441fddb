package com.threatsentinel.core.rule;

import com.threatsentinel.core.model.ContainmentAction;
import com.threatsentinel.core.model.DetectionMechanism;
import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.model.ThreatType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Describes a single threat-detection rule loaded from configuration or
 * registered at runtime.
 *
 * <p>
 * The {@link #getMechanism() mechanism} selects which parameter block is
 * read:
 * </p>
 * <ul>
 * <li>{@code PATTERN_MATCHING}: {@link #getThreshold() threshold}</li>
 * <li>{@code BEHAVIORAL_ANALYSIS}: {@link #getPatterns() patterns} and/or
 * {@link #getUniqueValues() uniqueValues}</li>
 * <li>{@code ANOMALY_DETECTION}: {@link #getAnomaly() anomaly}</li>
 * <li>{@code THREAT_INTELLIGENCE}:
 * {@link #getThreatIntelligence() threatIntelligence}</li>
 * <li>{@code RULE_BASED}: {@link #getConditions() conditions}</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields for the declared mechanism are present and valid.
 * Instances are mutable configuration beans; the rule engine only ever holds
 * private {@link #copy() copies}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionRule implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Unique rule id, e.g. {@code TD001}. */
    private String id;
    private String name;
    private String description;
    private boolean enabled = true;
    private ThreatType type;
    private DetectionMechanism mechanism;
    private Severity severity;

    /** When set, only events of this type are evaluated. */
    private String eventType;

    /** Event field used to partition counts and sequences, e.g. {@code userId}. */
    private String groupBy;

    /** Alert-threshold category from the engine config that parameterizes this rule. */
    private String thresholdCategory;

    // --- Mechanism parameters ---
    private ThresholdSpec threshold;
    private List<SequencePattern> patterns = new ArrayList<>();
    private UniqueValuesSpec uniqueValues;
    private AnomalySpec anomaly;
    private ThreatIntelSpec threatIntelligence;
    /** Boolean condition tree for {@code RULE_BASED} rules. */
    private Map<String, Object> conditions = new LinkedHashMap<>();

    private ResponsePolicy response = new ResponsePolicy();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared mechanism are present
     * and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (isBlank(id)) {
            errors.add("Rule 'id' is required");
        }
        if (isBlank(name)) {
            errors.add("Rule '" + id + "' requires 'name'");
        }
        if (type == null) {
            errors.add("Rule '" + id + "' requires 'type'");
        }
        if (severity == null) {
            errors.add("Rule '" + id + "' requires 'severity'");
        }
        if (mechanism == null) {
            errors.add("Rule '" + id + "' requires 'mechanism'");
        } else {
            switch (mechanism) {
                case PATTERN_MATCHING -> validateThreshold(errors);
                case BEHAVIORAL_ANALYSIS -> validateBehavioral(errors);
                case ANOMALY_DETECTION -> {
                    if (anomaly == null || isBlank(anomaly.getBaselineField())) {
                        errors.add("Anomaly rule '" + id + "' requires 'anomaly.baselineField'");
                    } else if (anomaly.getDeviationThreshold() <= 0) {
                        errors.add("Anomaly rule '" + id + "' requires 'anomaly.deviationThreshold' > 0");
                    }
                }
                case THREAT_INTELLIGENCE -> {
                    if (threatIntelligence == null || isBlank(threatIntelligence.getIndicatorField())) {
                        errors.add("Threat-intelligence rule '" + id
                                + "' requires 'threatIntelligence.indicatorField'");
                    } else if (threatIntelligence.getIndicatorType() == null) {
                        errors.add("Threat-intelligence rule '" + id
                                + "' requires 'threatIntelligence.indicatorType'");
                    }
                }
                case RULE_BASED -> {
                    if (conditions == null || conditions.isEmpty()) {
                        errors.add("Rule-based rule '" + id + "' requires 'conditions'");
                    }
                }
                case CORRELATION -> errors.add("Rule '" + id
                        + "': CORRELATION is reserved for correlation rules");
            }
        }

        if (response != null && response.isAutoContainment()
                && response.getContainmentAction() != null
                && ContainmentAction.fromToken(response.getContainmentAction()).isEmpty()) {
            errors.add("Rule '" + id + "' declares unknown containmentAction '"
                    + response.getContainmentAction() + "'");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionRule: " + String.join("; ", errors));
        }
    }

    private void validateThreshold(List<String> errors) {
        if (threshold == null) {
            errors.add("Pattern rule '" + id + "' requires 'threshold'");
            return;
        }
        if (threshold.isValueThreshold()) {
            return;
        }
        if (threshold.getCount() <= 0) {
            errors.add("Pattern rule '" + id + "' requires 'threshold.count' > 0");
        }
        if (threshold.getTimeWindowMinutes() <= 0) {
            errors.add("Pattern rule '" + id + "' requires 'threshold.timeWindowMinutes' > 0");
        }
    }

    private void validateBehavioral(List<String> errors) {
        boolean hasPatterns = patterns != null && !patterns.isEmpty();
        if (!hasPatterns && uniqueValues == null) {
            errors.add("Behavioral rule '" + id + "' requires 'patterns' or 'uniqueValues'");
        }
        if (hasPatterns) {
            for (SequencePattern pattern : patterns) {
                if (pattern.getSequence().isEmpty()) {
                    errors.add("Behavioral rule '" + id + "' has an empty sequence");
                }
                if (pattern.getTimeWindowMinutes() <= 0) {
                    errors.add("Behavioral rule '" + id + "' requires sequence 'timeWindowMinutes' > 0");
                }
            }
        }
        if (uniqueValues != null) {
            if (isBlank(uniqueValues.getField())) {
                errors.add("Behavioral rule '" + id + "' requires 'uniqueValues.field'");
            }
            if (isBlank(groupBy)) {
                errors.add("Behavioral rule '" + id + "' requires 'groupBy' for uniqueValues");
            }
            if (uniqueValues.getThreshold() <= 0 || uniqueValues.getTimeWindowMinutes() <= 0) {
                errors.add("Behavioral rule '" + id
                        + "' requires 'uniqueValues.threshold' and 'timeWindowMinutes' > 0");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // ---------------------------------------------------------------
    // Copying
    // ---------------------------------------------------------------

    /**
     * @return a deep copy of this rule
     */
    public DetectionRule copy() {
        DetectionRule copy = new DetectionRule();
        copy.id = id;
        copy.name = name;
        copy.description = description;
        copy.enabled = enabled;
        copy.type = type;
        copy.mechanism = mechanism;
        copy.severity = severity;
        copy.eventType = eventType;
        copy.groupBy = groupBy;
        copy.thresholdCategory = thresholdCategory;
        copy.threshold = threshold != null ? new ThresholdSpec(threshold) : null;
        copy.patterns = new ArrayList<>();
        if (patterns != null) {
            patterns.forEach(p -> copy.patterns.add(new SequencePattern(p)));
        }
        copy.uniqueValues = uniqueValues != null ? new UniqueValuesSpec(uniqueValues) : null;
        copy.anomaly = anomaly != null ? new AnomalySpec(anomaly) : null;
        copy.threatIntelligence = threatIntelligence != null
                ? new ThreatIntelSpec(threatIntelligence)
                : null;
        copy.conditions = deepCopy(conditions);
        copy.response = response != null ? new ResponsePolicy(response) : new ResponsePolicy();
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static <T> T deepCopy(T value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
            return (T) copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>();
            list.forEach(v -> copy.add(deepCopy(v)));
            return (T) copy;
        }
        return value;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
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

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public ThreatType getType() {
        return type;
    }

    public void setType(ThreatType type) {
        this.type = type;
    }

    public DetectionMechanism getMechanism() {
        return mechanism;
    }

    public void setMechanism(DetectionMechanism mechanism) {
        this.mechanism = mechanism;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public String getGroupBy() {
        return groupBy;
    }

    public void setGroupBy(String groupBy) {
        this.groupBy = groupBy;
    }

    public String getThresholdCategory() {
        return thresholdCategory;
    }

    public void setThresholdCategory(String thresholdCategory) {
        this.thresholdCategory = thresholdCategory;
    }

    public ThresholdSpec getThreshold() {
        return threshold;
    }

    public void setThreshold(ThresholdSpec threshold) {
        this.threshold = threshold;
    }

    public List<SequencePattern> getPatterns() {
        return patterns;
    }

    public void setPatterns(List<SequencePattern> patterns) {
        this.patterns = patterns != null ? new ArrayList<>(patterns) : new ArrayList<>();
    }

    public UniqueValuesSpec getUniqueValues() {
        return uniqueValues;
    }

    public void setUniqueValues(UniqueValuesSpec uniqueValues) {
        this.uniqueValues = uniqueValues;
    }

    public AnomalySpec getAnomaly() {
        return anomaly;
    }

    public void setAnomaly(AnomalySpec anomaly) {
        this.anomaly = anomaly;
    }

    public ThreatIntelSpec getThreatIntelligence() {
        return threatIntelligence;
    }

    public void setThreatIntelligence(ThreatIntelSpec threatIntelligence) {
        this.threatIntelligence = threatIntelligence;
    }

    public Map<String, Object> getConditions() {
        return conditions;
    }

    public void setConditions(Map<String, Object> conditions) {
        this.conditions = conditions != null ? new LinkedHashMap<>(conditions) : new LinkedHashMap<>();
    }

    public ResponsePolicy getResponse() {
        return response;
    }

    public void setResponse(ResponsePolicy response) {
        this.response = response != null ? response : new ResponsePolicy();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionRule that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "DetectionRule{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", enabled=" + enabled +
                ", type=" + type +
                ", mechanism=" + mechanism +
                ", severity=" + severity +
                ", eventType='" + eventType + '\'' +
                ", groupBy='" + groupBy + '\'' +
                '}';
    }
}
