package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Threat;
import com.threatsentinel.core.rule.DetectionRule;
import com.threatsentinel.core.rule.ThresholdSpec;
import com.threatsentinel.core.window.GroupKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Pattern-matching (threshold) detector.
 *
 * <p>
 * Count form: fires when the number of events of the rule's type in the
 * rolling window, scoped to the event's {@code groupBy} value, reaches
 * {@code threshold.count}. The observed count is reported under
 * {@code threshold.countKey}.
 * </p>
 *
 * <p>
 * Value form ({@code threshold.field} set): fires when the numeric field on
 * the event is at least {@code threshold.minValue}. This form is
 * <strong>stateless</strong>.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternMatchingDetector extends AbstractRuleDetector {

    private static final Logger LOG = LoggerFactory.getLogger(PatternMatchingDetector.class);

    private final ThresholdSpec threshold;

    /**
     * @throws NullPointerException     if the rule has no threshold
     * @throws IllegalArgumentException if a count threshold is not positive
     */
    public PatternMatchingDetector(DetectionRule rule, DetectionContext context) {
        super(rule, context);
        this.threshold = Objects.requireNonNull(this.rule.getThreshold(),
                "Threshold must not be null for pattern rule '" + rule.getId() + "'");
        if (threshold.isValueThreshold()) {
            return;
        }
        if (threshold.getCount() <= 0 || threshold.getTimeWindowMinutes() <= 0) {
            throw new IllegalArgumentException("count and timeWindowMinutes must be > 0 for rule '"
                    + rule.getId() + "', got: " + threshold);
        }
        context.getCounters().registerWindow(threshold.getTimeWindowMinutes());
        if (this.rule.getGroupBy() != null) {
            context.getCounters().registerGroupField(this.rule.getGroupBy());
        }
    }

    @Override
    protected Optional<Threat> detect(SecurityEvent event) {
        return threshold.isValueThreshold() ? detectValue(event) : detectCount(event);
    }

    private Optional<Threat> detectCount(SecurityEvent event) {
        GroupKey group = null;
        if (rule.getGroupBy() != null) {
            Optional<String> value = groupValue(event);
            if (value.isEmpty()) {
                LOG.trace("Rule [{}]: group field '{}' missing, skipping", rule.getId(), rule.getGroupBy());
                return Optional.empty();
            }
            group = GroupKey.of(rule.getGroupBy(), value.get());
        }

        String eventType = rule.getEventType() != null ? rule.getEventType() : event.getType();
        int count = context.getCounters().count(eventType, group, threshold.getTimeWindowMinutes());
        if (count < threshold.getCount()) {
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired: count={} >= threshold={} in {}m", rule.getId(), count,
                threshold.getCount(), threshold.getTimeWindowMinutes());
        Threat.Builder builder = threat(event, String.format("%s: %d %s event(s) in %d minute(s)%s",
                rule.getName(), count, eventType, threshold.getTimeWindowMinutes(),
                group != null ? " for " + group : ""))
                .metadata(threshold.getCountKey(), count)
                .metadata("timeWindowMinutes", threshold.getTimeWindowMinutes());
        if (group != null) {
            builder.metadata(group.getField(), group.getValue());
        }
        return Optional.of(builder.build());
    }

    private Optional<Threat> detectValue(SecurityEvent event) {
        Optional<Double> value = event.resolveNumber(threshold.getField());
        if (value.isEmpty()) {
            LOG.trace("Rule [{}]: field '{}' not present or not numeric, skipping", rule.getId(),
                    threshold.getField());
            return Optional.empty();
        }
        double v = value.get();
        if (v < threshold.getMinValue()) {
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired: {}={} >= {}", rule.getId(), threshold.getField(), v, threshold.getMinValue());
        return Optional.of(threat(event, String.format("%s: %s=%.0f (threshold: %.0f)",
                rule.getName(), threshold.getField(), v, threshold.getMinValue()))
                .metadata(leaf(threshold.getField()), v)
                .metadata("threshold", threshold.getMinValue())
                .build());
    }

    private static String leaf(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? path : path.substring(dot + 1);
    }
}
