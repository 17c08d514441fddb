package com.threatsentinel.core.query;

import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Aggregate view over a set of buffered events.
 *
 * @since 1.0.0
 */
public final class SecurityAnalytics {

    private final int totalEvents;
    private final Map<String, Long> eventsByType;
    private final Map<Severity, Long> eventsBySeverity;
    private final SortedMap<Instant, Long> hourlyCounts;
    private final SecurityEvent latestEvent;
    private final SecurityEvent oldestEvent;

    SecurityAnalytics(int totalEvents, Map<String, Long> eventsByType, Map<Severity, Long> eventsBySeverity,
            SortedMap<Instant, Long> hourlyCounts, SecurityEvent latestEvent, SecurityEvent oldestEvent) {
        this.totalEvents = totalEvents;
        this.eventsByType = Collections.unmodifiableMap(eventsByType);
        this.eventsBySeverity = Collections.unmodifiableMap(eventsBySeverity);
        this.hourlyCounts = Collections.unmodifiableSortedMap(hourlyCounts);
        this.latestEvent = latestEvent;
        this.oldestEvent = oldestEvent;
    }

    public int getTotalEvents() {
        return totalEvents;
    }

    public Map<String, Long> getEventsByType() {
        return eventsByType;
    }

    public Map<Severity, Long> getEventsBySeverity() {
        return eventsBySeverity;
    }

    /**
     * @return event counts keyed by the start of each UTC hour, oldest first;
     *         hours without events are absent
     */
    public SortedMap<Instant, Long> getHourlyCounts() {
        return hourlyCounts;
    }

    public Optional<SecurityEvent> getLatestEvent() {
        return Optional.ofNullable(latestEvent);
    }

    public Optional<SecurityEvent> getOldestEvent() {
        return Optional.ofNullable(oldestEvent);
    }

    @Override
    public String toString() {
        return "SecurityAnalytics{totalEvents=" + totalEvents + ", byType=" + eventsByType
                + ", bySeverity=" + eventsBySeverity + ", hours=" + hourlyCounts.size() + "}";
    }
}
