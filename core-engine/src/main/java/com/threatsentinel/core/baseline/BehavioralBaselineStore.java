package com.threatsentinel.core.baseline;

import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.util.FieldPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-actor statistical baselines used by anomaly rules.
 *
 * <p>
 * Each {@link BaselineKey} keeps the last {@value #MAX_SAMPLES} samples.
 * Scores are only produced once {@value #MIN_SAMPLES} samples exist, because
 * a standard deviation over fewer points is not meaningful.
 * </p>
 *
 * <h3>Observed fields</h3>
 * <ul>
 * <li>{@value #TIMESTAMP_FIELD}: hour of day (UTC) of the event</li>
 * <li>{@code metadata.<key>}: every numeric metadata value</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Updates to the same key are serialized through
 * {@link ConcurrentHashMap#compute}; readers get immutable
 * {@link ActorBaseline} snapshots.
 * </p>
 *
 * @since 1.0.0
 */
public class BehavioralBaselineStore {

    private static final Logger LOG = LoggerFactory.getLogger(BehavioralBaselineStore.class);

    public static final int MAX_SAMPLES = 100;
    public static final int MIN_SAMPLES = 10;
    public static final String TIMESTAMP_FIELD = "timestamp";

    private final Map<BaselineKey, Deque<Double>> samples = new ConcurrentHashMap<>();

    /**
     * Append one sample, evicting the oldest beyond {@value #MAX_SAMPLES}.
     *
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public void observe(String userId, String eventType, String fieldPath, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Baseline sample must be finite, got: " + value);
        }
        BaselineKey key = new BaselineKey(userId, eventType, fieldPath);
        samples.compute(key, (k, window) -> {
            Deque<Double> w = window != null ? window : new ArrayDeque<>();
            w.addLast(value);
            if (w.size() > MAX_SAMPLES) {
                w.pollFirst();
            }
            return w;
        });
    }

    /**
     * Observe every baseline-relevant value of an event. Events without a
     * {@code userId} are ignored.
     */
    public void observeEvent(SecurityEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        Optional<String> userId = event.getUserId();
        if (userId.isEmpty()) {
            return;
        }
        observe(userId.get(), event.getType(), TIMESTAMP_FIELD, hourOfDay(event));
        for (Map.Entry<String, Object> entry : event.getMetadata().entrySet()) {
            FieldPaths.toDouble(entry.getValue()).ifPresent(
                    v -> observe(userId.get(), event.getType(), "metadata." + entry.getKey(), v));
        }
    }

    /**
     * Value a baseline over {@code fieldPath} would record for this event.
     *
     * @return hour of day for {@value #TIMESTAMP_FIELD}, otherwise the numeric
     *         field value if present
     */
    public static Optional<Double> observedValue(SecurityEvent event, String fieldPath) {
        if (TIMESTAMP_FIELD.equals(fieldPath)) {
            return Optional.of(hourOfDay(event));
        }
        return event.resolveNumber(fieldPath);
    }

    private static double hourOfDay(SecurityEvent event) {
        return event.getTimestamp().atZone(ZoneOffset.UTC).getHour();
    }

    /**
     * @return snapshot of the baseline, or empty if nothing was observed
     */
    public Optional<ActorBaseline> baseline(String userId, String eventType, String fieldPath) {
        BaselineKey key = new BaselineKey(userId, eventType, fieldPath);
        ActorBaseline[] snapshot = new ActorBaseline[1];
        samples.computeIfPresent(key, (k, window) -> {
            snapshot[0] = new ActorBaseline(k, window);
            return window;
        });
        return Optional.ofNullable(snapshot[0]);
    }

    /**
     * @return the z-score of {@code value}, or empty while the baseline has
     *         fewer than {@value #MIN_SAMPLES} samples or zero spread
     */
    public Optional<Double> zScore(String userId, String eventType, String fieldPath, double value) {
        return baseline(userId, eventType, fieldPath)
                .filter(b -> b.getSampleCount() >= MIN_SAMPLES && b.getStdDev() > 0)
                .map(b -> Math.abs(value - b.getMean()) / b.getStdDev());
    }

    /**
     * @return {@code true} if {@code |value - mean| / stdDev > threshold};
     *         always {@code false} below {@value #MIN_SAMPLES} samples or when
     *         the standard deviation is zero
     */
    public static boolean isAnomaly(double value, ActorBaseline baseline, double threshold) {
        if (baseline == null || baseline.getSampleCount() < MIN_SAMPLES || baseline.getStdDev() == 0) {
            return false;
        }
        double z = Math.abs(value - baseline.getMean()) / baseline.getStdDev();
        if (z > threshold) {
            LOG.debug("Anomalous value {} for {} (z={}, threshold={})", value, baseline.getKey(), z, threshold);
            return true;
        }
        return false;
    }

    /**
     * @return number of tracked baselines
     */
    public int size() {
        return samples.size();
    }

    public void clear() {
        samples.clear();
    }
}
