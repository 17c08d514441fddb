package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Threat;
import com.threatsentinel.core.rule.DetectionRule;
import com.threatsentinel.core.rule.ThreatIntelSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Threat-intelligence detector: looks the event's indicator up in the
 * {@link ThreatIntelCatalog}. Stateless.
 *
 * @since 1.0.0
 */
public class ThreatIntelligenceDetector extends AbstractRuleDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ThreatIntelligenceDetector.class);

    private final ThreatIntelSpec spec;

    public ThreatIntelligenceDetector(DetectionRule rule, DetectionContext context) {
        super(rule, context);
        this.spec = Objects.requireNonNull(this.rule.getThreatIntelligence(),
                "threatIntelligence must not be null for rule '" + rule.getId() + "'");
        Objects.requireNonNull(spec.getIndicatorField(), "indicatorField must not be null");
        Objects.requireNonNull(spec.getIndicatorType(), "indicatorType must not be null");
    }

    @Override
    protected Optional<Threat> detect(SecurityEvent event) {
        Optional<String> indicator = event.resolve(spec.getIndicatorField()).map(Object::toString);
        if (indicator.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> source = context.getThreatIntel()
                .lookup(spec.getIndicatorType(), indicator.get(), spec.getSources());
        if (source.isEmpty()) {
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired: {} {} listed by source '{}'", rule.getId(), spec.getIndicatorType(),
                indicator.get(), source.get());
        return Optional.of(threat(event, String.format("%s: %s %s is listed as malicious (%s)",
                rule.getName(), spec.getIndicatorType(), indicator.get(), source.get()))
                .metadata("indicator", indicator.get())
                .metadata("indicatorType", spec.getIndicatorType().name())
                .metadata("intelSource", source.get())
                .build());
    }
}
