/**
 * Detection layer: per-mechanism detectors compiled from detection rules,
 * the rule engine that runs them, the condition evaluator, the static
 * threat-intelligence catalog and rule dry-runs.
 *
 * <p>
 * Key classes:
 * </p>
 * <ul>
 * <li>{@link com.threatsentinel.core.detection.ThreatDetector}: detector
 * contract</li>
 * <li>{@link com.threatsentinel.core.detection.DetectorFactory}: mechanism to
 * detector mapping</li>
 * <li>{@link com.threatsentinel.core.detection.RuleEngine}: evaluation and
 * rule administration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.detection;
