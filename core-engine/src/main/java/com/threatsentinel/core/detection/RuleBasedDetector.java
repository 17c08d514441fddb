package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Threat;
import com.threatsentinel.core.rule.DetectionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Rule-based detector: fires when the rule's condition tree holds for the
 * event. Stateless.
 *
 * @see ConditionEvaluator
 * @since 1.0.0
 */
public class RuleBasedDetector extends AbstractRuleDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RuleBasedDetector.class);

    private final Map<String, Object> conditions;

    public RuleBasedDetector(DetectionRule rule, DetectionContext context) {
        super(rule, context);
        this.conditions = this.rule.getConditions();
        if (conditions == null || conditions.isEmpty()) {
            throw new IllegalArgumentException("Rule-based rule '" + rule.getId() + "' requires conditions");
        }
    }

    @Override
    protected Optional<Threat> detect(SecurityEvent event) {
        if (!ConditionEvaluator.matches(event, conditions)) {
            return Optional.empty();
        }
        LOG.debug("Rule [{}] fired: conditions matched for event {}", rule.getId(), event.getId());
        return Optional.of(threat(event, rule.getName() + ": conditions matched").build());
    }
}
