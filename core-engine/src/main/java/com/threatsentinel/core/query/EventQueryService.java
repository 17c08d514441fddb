package com.threatsentinel.core.query;

import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.util.FieldPaths;
import com.threatsentinel.core.window.EventBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Read-only queries over the rolling event buffer: recent events, free-text
 * search and aggregate analytics.
 *
 * <p>
 * Every query works on a snapshot, so concurrent ingestion never changes a
 * result while it is being built. Results are ordered newest first unless a
 * search asks otherwise.
 * </p>
 *
 * @since 1.0.0
 */
public class EventQueryService {

    private static final Logger LOG = LoggerFactory.getLogger(EventQueryService.class);

    public static final int DEFAULT_LIMIT = 100;

    private final EventBuffer buffer;

    public EventQueryService(EventBuffer buffer) {
        this.buffer = Objects.requireNonNull(buffer, "EventBuffer must not be null");
    }

    /**
     * @param filter criteria, all optional
     * @param limit  maximum number of events, must be positive
     * @return matching events, newest first
     */
    public List<SecurityEvent> recentEvents(EventFilter filter, int limit) {
        Objects.requireNonNull(filter, "EventFilter must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }
        List<SecurityEvent> result = new ArrayList<>();
        for (SecurityEvent event : newestFirst()) {
            if (filter.test(event)) {
                result.add(event);
                if (result.size() == limit) {
                    break;
                }
            }
        }
        return result;
    }

    public List<SecurityEvent> search(EventSearch search) {
        Objects.requireNonNull(search, "EventSearch must not be null");
        String text = search.getText() == null || search.getText().isBlank()
                ? null : search.getText().toLowerCase(Locale.ROOT);

        List<SecurityEvent> matches = new ArrayList<>();
        for (SecurityEvent event : newestFirst()) {
            if (search.getFilter().test(event) && (text == null || containsText(event, text))) {
                matches.add(event);
            }
        }

        Comparator<SecurityEvent> order = byField(search.getSortBy());
        matches.sort(search.isAscending() ? order : order.reversed());

        int from = Math.min(search.getOffset(), matches.size());
        int to = search.getLimit() == 0 ? matches.size() : Math.min(from + search.getLimit(), matches.size());
        LOG.debug("Search matched {} event(s), returning [{}, {})", matches.size(), from, to);
        return new ArrayList<>(matches.subList(from, to));
    }

    /**
     * @param filter restricts the events counted; {@link EventFilter#all()}
     *               for the whole buffer
     */
    public SecurityAnalytics analytics(EventFilter filter) {
        Objects.requireNonNull(filter, "EventFilter must not be null");
        Map<String, Long> byType = new LinkedHashMap<>();
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        SortedMap<Instant, Long> hourly = new TreeMap<>();
        SecurityEvent latest = null;
        SecurityEvent oldest = null;
        int total = 0;

        for (SecurityEvent event : buffer.snapshot()) {
            if (!filter.test(event)) {
                continue;
            }
            total++;
            byType.merge(event.getType(), 1L, Long::sum);
            bySeverity.merge(event.getSeverity(), 1L, Long::sum);
            hourly.merge(event.getTimestamp().truncatedTo(ChronoUnit.HOURS), 1L, Long::sum);
            if (latest == null || !event.getTimestamp().isBefore(latest.getTimestamp())) {
                latest = event;
            }
            if (oldest == null || event.getTimestamp().isBefore(oldest.getTimestamp())) {
                oldest = event;
            }
        }
        return new SecurityAnalytics(total, byType, bySeverity, hourly, latest, oldest);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<SecurityEvent> newestFirst() {
        List<SecurityEvent> events = new ArrayList<>(buffer.snapshot());
        Collections.reverse(events);
        return events;
    }

    private static boolean containsText(SecurityEvent event, String text) {
        if (event.getMessage() != null && event.getMessage().toLowerCase(Locale.ROOT).contains(text)) {
            return true;
        }
        return event.getMetadata().toString().toLowerCase(Locale.ROOT).contains(text);
    }

    /**
     * Ascending order on a field path. Severity compares by rank, numbers
     * numerically, instants chronologically, anything else by its string form; events missing the
     * field sort first. The sort is stable, so ties keep buffer order.
     */
    private static Comparator<SecurityEvent> byField(String path) {
        if ("severity".equals(path)) {
            return Comparator.comparing(SecurityEvent::getSeverity);
        }
        return (a, b) -> compareValues(a.resolve(path), b.resolve(path));
    }

    private static int compareValues(Optional<Object> left, Optional<Object> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return Boolean.compare(left.isPresent(), right.isPresent());
        }
        Object l = left.get();
        Object r = right.get();
        if (l instanceof Instant li && r instanceof Instant ri) {
            return li.compareTo(ri);
        }
        Optional<Double> ln = FieldPaths.toDouble(l);
        Optional<Double> rn = FieldPaths.toDouble(r);
        if (ln.isPresent() && rn.isPresent()) {
            return Double.compare(ln.get(), rn.get());
        }
        return l.toString().compareTo(r.toString());
    }
}
