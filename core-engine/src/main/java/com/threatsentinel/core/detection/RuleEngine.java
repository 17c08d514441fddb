package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Threat;
import com.threatsentinel.core.rule.DetectionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Evaluates every enabled detection rule against each event and administers
 * the live rule set.
 *
 * <h3>Evaluation</h3>
 * <p>
 * Rules run in registration order and never short-circuit: one event can
 * produce several threats. A detector that throws is logged and treated as
 * not matching, so one broken rule cannot starve the others.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The rule set is an immutable snapshot published through a volatile field.
 * Evaluation reads the snapshot lock-free; mutators are synchronized and
 * swap in a new snapshot, so an in-flight evaluation always sees either the
 * old or the new set, never a mix.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEngine.class);

    private final DetectionContext context;
    private volatile List<ThreatDetector> detectors = List.of();
    private volatile List<DetectionRule> defaults = List.of();

    public RuleEngine(DetectionContext context) {
        this.context = Objects.requireNonNull(context, "DetectionContext must not be null");
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * @param event validated event; its counters must already be recorded
     * @return threats raised by enabled rules, in rule order
     */
    public List<Threat> evaluate(SecurityEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        List<Threat> threats = new ArrayList<>();
        for (ThreatDetector detector : detectors) {
            if (!detector.isEnabled()) {
                continue;
            }
            try {
                detector.evaluate(event).ifPresent(threats::add);
            } catch (RuntimeException e) {
                LOG.debug("Rule [{}] failed on event {}; treating as no match", detector.getRuleId(),
                        event.getId(), e);
            }
        }
        return threats;
    }

    // ---------------------------------------------------------------
    // Administration
    // ---------------------------------------------------------------

    /**
     * Replace the whole rule set and remember it as the defaults.
     *
     * @throws IllegalStateException if any rule is invalid; the current set is
     *                               left unchanged
     */
    public synchronized void loadDefaults(List<DetectionRule> rules) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        List<DetectionRule> copies = new ArrayList<>();
        for (DetectionRule rule : rules) {
            DetectionRule copy = rule.copy();
            copy.validate();
            copies.add(copy);
        }
        detectors = DetectorFactory.createAll(copies, context);
        defaults = List.copyOf(copies);
        LOG.info("Loaded {} default detection rule(s)", copies.size());
    }

    /**
     * Restore the rule set last passed to {@link #loadDefaults(List)}.
     */
    public synchronized void resetToDefaults() {
        detectors = DetectorFactory.createAll(defaults, context);
        LOG.info("Detection rules reset to {} default(s)", defaults.size());
    }

    /**
     * Register a rule, replacing an existing rule with the same id in place.
     *
     * @throws IllegalStateException if the rule is invalid
     */
    public synchronized void addRule(DetectionRule rule) {
        Objects.requireNonNull(rule, "DetectionRule must not be null");
        rule.validate();
        ThreatDetector detector = DetectorFactory.create(rule, context);
        List<ThreatDetector> next = new ArrayList<>(detectors);
        int index = indexOf(next, rule.getId());
        if (index >= 0) {
            next.set(index, detector);
            LOG.info("Replaced detection rule [{}] {}", rule.getId(), rule.getName());
        } else {
            next.add(detector);
            LOG.info("Added detection rule [{}] {}", rule.getId(), rule.getName());
        }
        detectors = List.copyOf(next);
    }

    /**
     * Patch a copy of the rule, validate it and swap it in.
     *
     * @param patch mutation applied to a private copy; the rule id cannot be
     *              changed
     * @return {@code false} if no rule has the id
     * @throws IllegalStateException if the patched rule is invalid; the
     *                               original stays active
     */
    public synchronized boolean updateRule(String ruleId, Consumer<DetectionRule> patch) {
        Objects.requireNonNull(patch, "Patch must not be null");
        List<ThreatDetector> next = new ArrayList<>(detectors);
        int index = indexOf(next, ruleId);
        if (index < 0) {
            return false;
        }
        DetectionRule updated = next.get(index).getRule();
        patch.accept(updated);
        updated.setId(ruleId);
        updated.validate();
        next.set(index, DetectorFactory.create(updated, context));
        detectors = List.copyOf(next);
        LOG.info("Updated detection rule [{}]", ruleId);
        return true;
    }

    /**
     * @return {@code false} if no rule has the id
     */
    public synchronized boolean deleteRule(String ruleId) {
        List<ThreatDetector> next = new ArrayList<>(detectors);
        int index = indexOf(next, ruleId);
        if (index < 0) {
            return false;
        }
        next.remove(index);
        detectors = List.copyOf(next);
        LOG.info("Deleted detection rule [{}]", ruleId);
        return true;
    }

    /**
     * @return copies of the active rules, in evaluation order
     */
    public List<DetectionRule> getRules() {
        return detectors.stream().map(ThreatDetector::getRule).toList();
    }

    public Optional<DetectionRule> getRule(String ruleId) {
        return detectors.stream()
                .filter(d -> d.getRuleId().equals(ruleId))
                .findFirst()
                .map(ThreatDetector::getRule);
    }

    public DetectionContext getContext() {
        return context;
    }

    private static int indexOf(List<ThreatDetector> detectors, String ruleId) {
        for (int i = 0; i < detectors.size(); i++) {
            if (detectors.get(i).getRuleId().equals(ruleId)) {
                return i;
            }
        }
        return -1;
    }
}
