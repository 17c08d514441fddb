package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Threat;
import com.threatsentinel.core.rule.DetectionRule;

import java.util.Optional;

/**
 * Contract for the per-mechanism detectors compiled from a
 * {@link DetectionRule}.
 * <p>
 * Detectors hold only their rule's parameters; all rolling state lives in
 * the shared {@link DetectionContext}, so a detector can be replaced at any
 * time without losing history.
 * </p>
 */
public interface ThreatDetector {

    /**
     * Evaluate a single event against this detector's rule.
     *
     * @param event the incoming event
     * @return a {@link Threat} if the event triggers the rule, empty otherwise
     */
    Optional<Threat> evaluate(SecurityEvent event);

    /**
     * @return id of the rule this detector enforces
     */
    String getRuleId();

    /**
     * @return whether the underlying rule is enabled
     */
    boolean isEnabled();

    /**
     * @return a copy of the rule this detector was compiled from
     */
    DetectionRule getRule();
}
