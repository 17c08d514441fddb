package com.threatsentinel.core.rule;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of a {@code THREAT_INTELLIGENCE} rule: where to find the
 * indicator on the event and which block-list sources to consult.
 */
public class ThreatIntelSpec implements Serializable {

    private static final long serialVersionUID = 1L;

    private String indicatorField;
    private IndicatorType indicatorType;
    private List<String> sources = new ArrayList<>(List.of("local", "cloud"));

    public ThreatIntelSpec() {
    }

    ThreatIntelSpec(ThreatIntelSpec other) {
        this.indicatorField = other.indicatorField;
        this.indicatorType = other.indicatorType;
        this.sources = new ArrayList<>(other.sources);
    }

    public String getIndicatorField() {
        return indicatorField;
    }

    public void setIndicatorField(String indicatorField) {
        this.indicatorField = indicatorField;
    }

    public IndicatorType getIndicatorType() {
        return indicatorType;
    }

    public void setIndicatorType(IndicatorType indicatorType) {
        this.indicatorType = indicatorType;
    }

    public List<String> getSources() {
        return sources;
    }

    public void setSources(List<String> sources) {
        this.sources = sources != null ? new ArrayList<>(sources) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "ThreatIntelSpec{indicatorField='" + indicatorField + "', indicatorType="
                + indicatorType + ", sources=" + sources + '}';
    }
}
