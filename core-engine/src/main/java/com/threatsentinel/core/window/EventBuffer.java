package com.threatsentinel.core.window;

import com.threatsentinel.core.model.SecurityEvent;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded rolling buffer of recent events; the oldest event is evicted when
 * capacity is reached.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Guarded by a {@link ReadWriteLock}: appends and pruning take the write
 * lock, snapshots take the read lock.
 * </p>
 *
 * @since 1.0.0
 */
public class EventBuffer {

    private final int capacity;
    private final Deque<SecurityEvent> events = new ArrayDeque<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public EventBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * @return the evicted event, or {@code null} if nothing was evicted
     */
    public SecurityEvent add(SecurityEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        lock.writeLock().lock();
        try {
            SecurityEvent evicted = null;
            if (events.size() >= capacity) {
                evicted = events.pollFirst();
            }
            events.addLast(event);
            return evicted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return all buffered events, oldest first
     */
    public List<SecurityEvent> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(events);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param since  inclusive lower bound on event timestamps
     * @param filter additional predicate
     * @return matching events in insertion order
     */
    public List<SecurityEvent> since(Instant since, Predicate<SecurityEvent> filter) {
        lock.readLock().lock();
        try {
            List<SecurityEvent> result = new ArrayList<>();
            for (SecurityEvent e : events) {
                if (!e.getTimestamp().isBefore(since) && filter.test(e)) {
                    result.add(e);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drop events older than {@code cutoff}.
     *
     * @return number of events removed
     */
    public int pruneOlderThan(Instant cutoff) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            Iterator<SecurityEvent> it = events.iterator();
            while (it.hasNext()) {
                if (it.next().getTimestamp().isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return events.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            events.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
