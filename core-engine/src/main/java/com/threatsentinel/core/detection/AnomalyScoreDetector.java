package com.threatsentinel.core.detection;

import com.threatsentinel.core.baseline.ActorBaseline;
import com.threatsentinel.core.baseline.BehavioralBaselineStore;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Threat;
import com.threatsentinel.core.rule.AnomalySpec;
import com.threatsentinel.core.rule.DetectionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Anomaly detector scoring an event against its actor's behavioral baseline.
 *
 * <p>
 * The event's value for {@code anomaly.baselineField} is compared to the
 * baseline for (userId, event type, field). It is anomalous when it deviates
 * from the mean by more than {@code deviationThreshold × σ}.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * Nothing fires until the baseline holds
 * {@value BehavioralBaselineStore#MIN_SAMPLES} samples, or while its
 * standard deviation is zero. The current event is observed into the
 * baseline only after rule evaluation, so it never influences its own
 * score.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyScoreDetector extends AbstractRuleDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyScoreDetector.class);

    private final String field;
    private final double deviationThreshold;

    public AnomalyScoreDetector(DetectionRule rule, DetectionContext context) {
        super(rule, context);
        AnomalySpec anomaly = Objects.requireNonNull(this.rule.getAnomaly(),
                "Anomaly spec must not be null for rule '" + rule.getId() + "'");
        this.field = Objects.requireNonNull(anomaly.getBaselineField(),
                "baselineField must not be null for rule '" + rule.getId() + "'");
        this.deviationThreshold = anomaly.getDeviationThreshold();
        if (deviationThreshold <= 0) {
            throw new IllegalArgumentException("deviationThreshold must be > 0 for rule '"
                    + rule.getId() + "', got: " + deviationThreshold);
        }
    }

    @Override
    protected Optional<Threat> detect(SecurityEvent event) {
        Optional<String> userId = event.getUserId();
        if (userId.isEmpty()) {
            return Optional.empty();
        }
        Optional<Double> value = BehavioralBaselineStore.observedValue(event, field);
        if (value.isEmpty()) {
            LOG.trace("Rule [{}]: field '{}' not present or not numeric, skipping", rule.getId(), field);
            return Optional.empty();
        }
        Optional<ActorBaseline> baseline = context.getBaselines().baseline(userId.get(), event.getType(), field);
        if (baseline.isEmpty() || !BehavioralBaselineStore.isAnomaly(value.get(), baseline.get(),
                deviationThreshold)) {
            return Optional.empty();
        }

        ActorBaseline b = baseline.get();
        double zScore = Math.abs(value.get() - b.getMean()) / b.getStdDev();
        LOG.debug("Rule [{}] fired: {}={} mean={} stdDev={} z={}", rule.getId(), field, value.get(),
                b.getMean(), b.getStdDev(), zScore);
        return Optional.of(threat(event, String.format(
                "%s: %s=%.2f deviates from baseline (mean=%.2f, stdDev=%.2f, z=%.2f)",
                rule.getName(), field, value.get(), b.getMean(), b.getStdDev(), zScore))
                .metadata(SecurityEvent.USER_ID, userId.get())
                .metadata("field", field)
                .metadata("value", value.get())
                .metadata("mean", b.getMean())
                .metadata("stdDev", b.getStdDev())
                .metadata("zScore", zScore)
                .build());
    }
}
