package com.threatsentinel.core.model;

/**
 * How a threat was detected.
 *
 * <p>
 * The first five constants are the mechanisms a
 * {@link com.threatsentinel.core.rule.DetectionRule} can declare.
 * {@link #CORRELATION} is reserved for multi-event correlation matches.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectionMechanism {
    PATTERN_MATCHING,
    BEHAVIORAL_ANALYSIS,
    ANOMALY_DETECTION,
    THREAT_INTELLIGENCE,
    RULE_BASED,
    CORRELATION
}
