package com.threatsentinel.core.detection;

import com.threatsentinel.core.rule.DetectionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Factory that compiles {@link DetectionRule} configurations into
 * {@link ThreatDetector} instances.
 *
 * <p>
 * This is the single point of extension when adding new mechanisms: add the
 * constant to {@link com.threatsentinel.core.model.DetectionMechanism} and
 * the compiler will demand a case here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create a detector for the given rule.
     *
     * @param rule    the detection rule configuration; must not be {@code null}
     * @param context shared detection state
     * @return an appropriate {@link ThreatDetector} instance
     * @throws NullPointerException     if {@code rule} or its mechanism is
     *                                  {@code null}
     * @throws IllegalArgumentException if the mechanism cannot back a
     *                                  detection rule
     */
    public static ThreatDetector create(DetectionRule rule, DetectionContext context) {
        Objects.requireNonNull(rule, "DetectionRule must not be null");
        Objects.requireNonNull(rule.getMechanism(), "Rule mechanism must not be null");

        return switch (rule.getMechanism()) {
            case PATTERN_MATCHING -> new PatternMatchingDetector(rule, context);
            case BEHAVIORAL_ANALYSIS -> new BehavioralDetector(rule, context);
            case ANOMALY_DETECTION -> new AnomalyScoreDetector(rule, context);
            case THREAT_INTELLIGENCE -> new ThreatIntelligenceDetector(rule, context);
            case RULE_BASED -> new RuleBasedDetector(rule, context);
            case CORRELATION -> throw new IllegalArgumentException(
                    "Rule '" + rule.getId() + "': CORRELATION is not a detection mechanism");
        };
    }

    /**
     * Create detectors for every rule in the supplied list.
     *
     * @return unmodifiable list of detectors (one per rule, same order)
     */
    public static List<ThreatDetector> createAll(List<DetectionRule> rules, DetectionContext context) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        LOG.info("Creating {} detector(s) from configuration", rules.size());
        return rules.stream()
                .map(rule -> create(rule, context))
                .toList();
    }
}
