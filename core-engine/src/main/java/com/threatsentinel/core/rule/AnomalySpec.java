package com.threatsentinel.core.rule;

import java.io.Serializable;

/**
 * Parameters of an {@code ANOMALY_DETECTION} rule: the numeric event field
 * scored against the acting user's baseline, and the z-score above which the
 * value is anomalous.
 */
public class AnomalySpec implements Serializable {

    private static final long serialVersionUID = 1L;

    private String baselineField;
    private double deviationThreshold = 3.0;

    public AnomalySpec() {
    }

    AnomalySpec(AnomalySpec other) {
        this.baselineField = other.baselineField;
        this.deviationThreshold = other.deviationThreshold;
    }

    public String getBaselineField() {
        return baselineField;
    }

    public void setBaselineField(String baselineField) {
        this.baselineField = baselineField;
    }

    public double getDeviationThreshold() {
        return deviationThreshold;
    }

    public void setDeviationThreshold(double deviationThreshold) {
        this.deviationThreshold = deviationThreshold;
    }

    @Override
    public String toString() {
        return "AnomalySpec{baselineField='" + baselineField
                + "', deviationThreshold=" + deviationThreshold + '}';
    }
}
