package com.threatsentinel.core.detection;

import com.threatsentinel.core.config.ThreatIntelFeeds;
import com.threatsentinel.core.rule.IndicatorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Static indicator block lists, by indicator type and source.
 *
 * <p>
 * Matching is case-insensitive. A URL also matches when it contains a
 * domain listed under the same source.
 * </p>
 *
 * <p>
 * Instances are immutable; {@link #withSource} returns a new catalog.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThreatIntelCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(ThreatIntelCatalog.class);

    public static final String DEFAULT_RESOURCE = "threat-intel.yml";

    /** Source name under which configured blacklisted IPs are registered. */
    public static final String BLACKLIST_SOURCE = "blacklist";

    private final Map<IndicatorType, Map<String, Set<String>>> indicators;

    private ThreatIntelCatalog(Map<IndicatorType, Map<String, Set<String>>> indicators) {
        this.indicators = indicators;
    }

    public static ThreatIntelCatalog empty() {
        return new ThreatIntelCatalog(new EnumMap<>(IndicatorType.class));
    }

    public static ThreatIntelCatalog of(ThreatIntelFeeds feeds) {
        Objects.requireNonNull(feeds, "Feeds must not be null");
        ThreatIntelCatalog catalog = empty();
        catalog = catalog.withSources(IndicatorType.IP, feeds.getIp());
        catalog = catalog.withSources(IndicatorType.DOMAIN, feeds.getDomain());
        catalog = catalog.withSources(IndicatorType.HASH, feeds.getHash());
        catalog = catalog.withSources(IndicatorType.URL, feeds.getUrl());
        LOG.info("Threat intelligence catalog loaded: {}", catalog);
        return catalog;
    }

    /**
     * Load the catalog from {@value #DEFAULT_RESOURCE} on the classpath.
     */
    public static ThreatIntelCatalog loadDefault() {
        return of(ThreatIntelFeeds.fromClasspath(DEFAULT_RESOURCE));
    }

    private ThreatIntelCatalog withSources(IndicatorType type, Map<String, List<String>> sources) {
        ThreatIntelCatalog catalog = this;
        for (Map.Entry<String, List<String>> entry : sources.entrySet()) {
            if (entry.getValue() != null) {
                catalog = catalog.withSource(type, entry.getKey(), entry.getValue());
            }
        }
        return catalog;
    }

    /**
     * @return a copy of this catalog with {@code values} added under
     *         {@code source}
     */
    public ThreatIntelCatalog withSource(IndicatorType type, String source, Collection<String> values) {
        Map<IndicatorType, Map<String, Set<String>>> copy = new EnumMap<>(IndicatorType.class);
        indicators.forEach((t, bySource) -> copy.put(t, new LinkedHashMap<>(bySource)));
        Map<String, Set<String>> bySource = copy.computeIfAbsent(type, t -> new LinkedHashMap<>());
        Set<String> merged = values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(ThreatIntelCatalog::normalize)
                .collect(Collectors.toSet());
        Set<String> existing = bySource.get(source);
        if (existing != null) {
            merged.addAll(existing);
        }
        bySource.put(source, Set.copyOf(merged));
        return new ThreatIntelCatalog(copy);
    }

    /**
     * Look the indicator up in the given sources, in order.
     *
     * @return the first source that lists the indicator, or empty
     */
    public Optional<String> lookup(IndicatorType type, String indicator, List<String> sources) {
        if (indicator == null || indicator.isBlank()) {
            return Optional.empty();
        }
        String value = normalize(indicator);
        for (String source : sources) {
            if (listed(type, source, value)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }

    private boolean listed(IndicatorType type, String source, String value) {
        if (sourceValues(type, source).contains(value)) {
            return true;
        }
        if (type == IndicatorType.URL) {
            for (String domain : sourceValues(IndicatorType.DOMAIN, source)) {
                if (value.contains(domain)) {
                    return true;
                }
            }
        }
        return false;
    }

    private Set<String> sourceValues(IndicatorType type, String source) {
        Map<String, Set<String>> bySource = indicators.get(type);
        if (bySource == null) {
            return Set.of();
        }
        return bySource.getOrDefault(source, Set.of());
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ThreatIntelCatalog{");
        indicators.forEach((type, bySource) -> {
            int total = bySource.values().stream().mapToInt(Set::size).sum();
            sb.append(type).append('=').append(total).append(' ');
        });
        return sb.toString().trim() + '}';
    }
}
