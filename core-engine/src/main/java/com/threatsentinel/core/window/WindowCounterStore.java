package com.threatsentinel.core.window;

import com.threatsentinel.core.model.SecurityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Rolling per-type, per-group, per-window occurrence counters.
 *
 * <h3>Implementation</h3>
 * <p>
 * Each {@link WindowCounterKey} owns a timestamp-ordered deque of
 * {@link Occurrence}s. Every recorded event is appended to the ungrouped
 * counter and to one grouped counter per tracked group field present on the
 * event, for every tracked window. Entries older than the window are pruned
 * lazily on each read or write of that key, relative to the injected
 * {@link Clock}; {@link #sweep()} reclaims keys that have become empty.
 * </p>
 *
 * <p>
 * A count for a window length that is not tracked is answered from the
 * smallest larger tracked window, filtered by the requested cutoff.
 * Registering a window or group field at runtime seeds the new counters from
 * the occurrences already held, so counts stay continuous across rule
 * changes.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All access to a key's deque happens inside
 * {@link ConcurrentHashMap#compute}, so operations on the same key are
 * serialized while different keys proceed in parallel. Registration takes
 * an exclusive lock so that seeding and concurrent recording never overlap.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowCounterStore {

    private static final Logger LOG = LoggerFactory.getLogger(WindowCounterStore.class);

    public static final List<Integer> DEFAULT_WINDOWS = List.of(1, 5, 15, 30, 60);
    public static final List<String> DEFAULT_GROUP_FIELDS = List.of(SecurityEvent.USER_ID, SecurityEvent.IP_ADDRESS);

    private final Clock clock;
    private final NavigableSet<Integer> windows = new ConcurrentSkipListSet<>(DEFAULT_WINDOWS);
    private final Set<String> groupFields = new CopyOnWriteArraySet<>(DEFAULT_GROUP_FIELDS);
    private final Map<WindowCounterKey, Deque<Occurrence>> counters = new ConcurrentHashMap<>();
    private final ReadWriteLock registration = new ReentrantReadWriteLock();

    public WindowCounterStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    // ---------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------

    /**
     * Track an additional window length. Existing counters are seeded from
     * the smallest larger tracked window, or the largest one if none is
     * larger, filtered by the new window's cutoff.
     */
    public void registerWindow(int windowMinutes) {
        if (windowMinutes <= 0) {
            throw new IllegalArgumentException("windowMinutes must be > 0, got: " + windowMinutes);
        }
        if (windows.contains(windowMinutes)) {
            return;
        }
        registration.writeLock().lock();
        try {
            Integer source = windows.higher(windowMinutes);
            if (source == null) {
                source = windows.last();
            }
            if (!windows.add(windowMinutes)) {
                return;
            }
            int seeded = 0;
            for (WindowCounterKey key : List.copyOf(counters.keySet())) {
                if (key.getWindowMinutes() == source) {
                    seeded += seed(new WindowCounterKey(key.getEventType(), key.getGroup(), windowMinutes),
                            occurrences(key.getEventType(), key.getGroup(), windowMinutes, source));
                }
            }
            LOG.debug("Tracking additional window of {} minute(s), seeded {} occurrence(s) from {}m",
                    windowMinutes, seeded, source);
        } finally {
            registration.writeLock().unlock();
        }
    }

    /**
     * Track an additional group field, e.g. {@code metadata.country}.
     * Grouped counters are seeded from the ungrouped occurrences that carry
     * an event reference.
     */
    public void registerGroupField(String field) {
        Objects.requireNonNull(field, "Group field must not be null");
        if (groupFields.contains(field)) {
            return;
        }
        registration.writeLock().lock();
        try {
            if (!groupFields.add(field)) {
                return;
            }
            int seeded = 0;
            for (WindowCounterKey key : List.copyOf(counters.keySet())) {
                if (key.getGroup() != null) {
                    continue;
                }
                Map<GroupKey, List<Occurrence>> byValue = new LinkedHashMap<>();
                for (Occurrence o : occurrences(key.getEventType(), null, key.getWindowMinutes(),
                        key.getWindowMinutes())) {
                    o.getEvent()
                            .flatMap(e -> e.resolve(field))
                            .ifPresent(v -> byValue.computeIfAbsent(GroupKey.of(field, v.toString()),
                                    g -> new ArrayList<>()).add(o));
                }
                for (Map.Entry<GroupKey, List<Occurrence>> entry : byValue.entrySet()) {
                    seeded += seed(new WindowCounterKey(key.getEventType(), entry.getKey(),
                            key.getWindowMinutes()), entry.getValue());
                }
            }
            LOG.debug("Tracking additional group field '{}', seeded {} occurrence(s)", field, seeded);
        } finally {
            registration.writeLock().unlock();
        }
    }

    private int seed(WindowCounterKey key, List<Occurrence> occurrences) {
        if (occurrences.isEmpty()) {
            return 0;
        }
        counters.compute(key, (k, deque) -> {
            Deque<Occurrence> d = deque != null ? deque : new ArrayDeque<>();
            for (Occurrence o : occurrences) {
                insertOrdered(d, o);
            }
            return d;
        });
        return occurrences.size();
    }

    public Set<Integer> getWindows() {
        return Set.copyOf(windows);
    }

    public Set<String> getGroupFields() {
        return Set.copyOf(groupFields);
    }

    // ---------------------------------------------------------------
    // Recording
    // ---------------------------------------------------------------

    /**
     * Record an event under its type, ungrouped and for every tracked group
     * field the event carries.
     */
    public void record(SecurityEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        Occurrence occurrence = new Occurrence(event.getTimestamp(), event);
        registration.readLock().lock();
        try {
            List<GroupKey> groups = new ArrayList<>();
            groups.add(null);
            for (String field : groupFields) {
                event.resolve(field).ifPresent(value -> groups.add(GroupKey.of(field, value.toString())));
            }
            for (GroupKey group : groups) {
                for (int window : windows) {
                    append(new WindowCounterKey(event.getType(), group, window), occurrence);
                }
            }
        } finally {
            registration.readLock().unlock();
        }
    }

    /**
     * Record a bare occurrence without an event reference.
     *
     * @param group group key, or {@code null} for the ungrouped counter
     */
    public void record(String eventType, GroupKey group, Instant timestamp) {
        Occurrence occurrence = new Occurrence(timestamp, null);
        registration.readLock().lock();
        try {
            for (int window : windows) {
                append(new WindowCounterKey(eventType, group, window), occurrence);
            }
        } finally {
            registration.readLock().unlock();
        }
    }

    private void append(WindowCounterKey key, Occurrence occurrence) {
        Instant now = clock.instant();
        counters.compute(key, (k, deque) -> {
            Deque<Occurrence> d = deque != null ? deque : new ArrayDeque<>();
            prune(d, cutoff(now, k.getWindowMinutes()));
            if (!occurrence.getTimestamp().isBefore(cutoff(now, k.getWindowMinutes()))) {
                insertOrdered(d, occurrence);
            }
            return d;
        });
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @param group         group key, or {@code null} for the ungrouped counter
     * @param windowMinutes window length in minutes
     * @return number of occurrences with {@code timestamp >= now - window}
     */
    public int count(String eventType, GroupKey group, int windowMinutes) {
        return occurrences(eventType, group, windowMinutes).size();
    }

    /**
     * @return a snapshot of the in-window occurrences, oldest first
     */
    public List<Occurrence> occurrences(String eventType, GroupKey group, int windowMinutes) {
        Objects.requireNonNull(eventType, "Event type must not be null");
        if (windowMinutes <= 0) {
            throw new IllegalArgumentException("windowMinutes must be > 0, got: " + windowMinutes);
        }
        Integer tracked = windows.ceiling(windowMinutes);
        if (tracked == null) {
            tracked = windows.last();
            LOG.debug("Window of {}m exceeds tracked windows; answering from {}m", windowMinutes, tracked);
        }
        return occurrences(eventType, group, windowMinutes, tracked);
    }

    private List<Occurrence> occurrences(String eventType, GroupKey group, int windowMinutes, int tracked) {
        Instant now = clock.instant();
        Instant cutoff = cutoff(now, windowMinutes);
        List<Occurrence> snapshot = new ArrayList<>();
        counters.computeIfPresent(new WindowCounterKey(eventType, group, tracked), (k, deque) -> {
            prune(deque, cutoff(now, k.getWindowMinutes()));
            for (Occurrence o : deque) {
                if (!o.getTimestamp().isBefore(cutoff)) {
                    snapshot.add(o);
                }
            }
            return deque;
        });
        return snapshot;
    }

    /**
     * Distinct values of {@code fieldPath} across in-window occurrences that
     * carry an event reference.
     */
    public Set<String> uniqueValues(String eventType, GroupKey group, String fieldPath, int windowMinutes) {
        Set<String> values = new LinkedHashSet<>();
        for (Occurrence o : occurrences(eventType, group, windowMinutes)) {
            o.getEvent()
                    .flatMap(e -> e.resolve(fieldPath))
                    .ifPresent(v -> values.add(v.toString()));
        }
        return values;
    }

    // ---------------------------------------------------------------
    // Maintenance
    // ---------------------------------------------------------------

    /**
     * Prune every counter and drop those left empty.
     *
     * @return number of keys removed
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        for (WindowCounterKey key : List.copyOf(counters.keySet())) {
            boolean[] dropped = new boolean[1];
            counters.computeIfPresent(key, (k, deque) -> {
                prune(deque, cutoff(now, k.getWindowMinutes()));
                dropped[0] = deque.isEmpty();
                return deque.isEmpty() ? null : deque;
            });
            if (dropped[0]) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debug("Swept {} empty counter(s), {} remaining", removed, counters.size());
        }
        return removed;
    }

    /**
     * @return number of live counter keys
     */
    public int size() {
        return counters.size();
    }

    public void clear() {
        counters.clear();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Instant cutoff(Instant now, int windowMinutes) {
        return now.minus(Duration.ofMinutes(windowMinutes));
    }

    private static void prune(Deque<Occurrence> deque, Instant cutoff) {
        while (!deque.isEmpty() && deque.peekFirst().getTimestamp().isBefore(cutoff)) {
            deque.pollFirst();
        }
    }

    /** Late arrivals are placed by timestamp so head pruning stays correct. */
    private static void insertOrdered(Deque<Occurrence> deque, Occurrence occurrence) {
        if (deque.isEmpty() || !deque.peekLast().getTimestamp().isAfter(occurrence.getTimestamp())) {
            deque.addLast(occurrence);
            return;
        }
        List<Occurrence> tail = new ArrayList<>();
        Iterator<Occurrence> it = deque.descendingIterator();
        while (it.hasNext()) {
            Occurrence o = it.next();
            if (!o.getTimestamp().isAfter(occurrence.getTimestamp())) {
                break;
            }
            tail.add(o);
            it.remove();
        }
        deque.addLast(occurrence);
        for (int i = tail.size() - 1; i >= 0; i--) {
            deque.addLast(tail.get(i));
        }
    }
}
