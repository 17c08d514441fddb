package com.threatsentinel.core.config;

import com.threatsentinel.core.rule.CorrelationRule;
import com.threatsentinel.core.rule.DetectionRule;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the rules YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - id: TD001
 *     name: Authentication Brute Force
 *     type: BRUTE_FORCE
 *     mechanism: PATTERN_MATCHING
 *     severity: HIGH
 *     eventType: auth:failure
 *     groupBy: userId
 *     threshold: { count: 5, timeWindowMinutes: 5 }
 * correlationRules:
 *   - name: Authentication Attack
 *     ...
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every rule is valid.
 * </p>
 *
 * @since 1.0.0
 */
public class RulesConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<DetectionRule> rules = new ArrayList<>();
    private List<CorrelationRule> correlationRules = new ArrayList<>();

    /**
     * @return unmodifiable list of detection rules
     */
    public List<DetectionRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     *
     * @param rules the detection rules
     */
    public void setRules(List<DetectionRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of correlation rules
     */
    public List<CorrelationRule> getCorrelationRules() {
        return Collections.unmodifiableList(correlationRules);
    }

    public void setCorrelationRules(List<CorrelationRule> correlationRules) {
        this.correlationRules = correlationRules != null
                ? new ArrayList<>(correlationRules)
                : new ArrayList<>();
    }

    /**
     * Validate every rule in this configuration.
     *
     * <p>
     * Delegates to {@link DetectionRule#validate()} and
     * {@link CorrelationRule#validate()}, and additionally rejects duplicate
     * detection rule ids. Collects all errors and throws a single exception if
     * anything is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more rules are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < rules.size(); i++) {
            DetectionRule rule = Objects.requireNonNull(rules.get(i),
                    "Rule at index " + i + " is null");
            try {
                rule.validate();
                if (!ids.add(rule.getId())) {
                    errors.add("Duplicate rule id '" + rule.getId() + "'");
                }
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        for (int i = 0; i < correlationRules.size(); i++) {
            CorrelationRule rule = Objects.requireNonNull(correlationRules.get(i),
                    "Correlation rule at index " + i + " is null");
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rules configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "RulesConfig{rules=" + rules + ", correlationRules=" + correlationRules + '}';
    }
}
