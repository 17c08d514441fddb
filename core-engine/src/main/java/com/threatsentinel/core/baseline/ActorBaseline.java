package com.threatsentinel.core.baseline;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Immutable snapshot of an actor's recent samples for one field, with the
 * mean and population standard deviation computed over them.
 *
 * @since 1.0.0
 */
public final class ActorBaseline {

    private final BaselineKey key;
    private final List<Double> samples;
    private final double mean;
    private final double stdDev;

    ActorBaseline(BaselineKey key, Deque<Double> window) {
        this.key = key;
        this.samples = List.copyOf(new ArrayDeque<>(window));
        this.mean = computeMean(samples);
        this.stdDev = computeStdDev(samples, mean);
    }

    public BaselineKey getKey() {
        return key;
    }

    /**
     * @return samples, oldest first
     */
    public List<Double> getSamples() {
        return samples;
    }

    public int getSampleCount() {
        return samples.size();
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    private static double computeMean(List<Double> values) {
        if (values.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    private static double computeStdDev(List<Double> values, double mean) {
        if (values.isEmpty()) {
            return 0;
        }
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.size());
    }

    @Override
    public String toString() {
        return String.format("ActorBaseline{%s, n=%d, mean=%.2f, stdDev=%.2f}",
                key, samples.size(), mean, stdDev);
    }
}
