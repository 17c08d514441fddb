package com.threatsentinel.core.window;

import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.util.SettableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WindowCounterStore}.
 */
class WindowCounterStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private SettableClock clock;
    private WindowCounterStore store;
    private int sequence;

    @BeforeEach
    void setUp() {
        clock = new SettableClock(T0);
        store = new WindowCounterStore(clock);
    }

    @Test
    @DisplayName("Should count events globally and per tracked group")
    void shouldCountPerGroup() {
        store.record(event("auth:failure", "U1"));
        store.record(event("auth:failure", "U1"));
        store.record(event("auth:failure", "U2"));

        assertThat(store.count("auth:failure", null, 5)).isEqualTo(3);
        assertThat(store.count("auth:failure", GroupKey.of("userId", "U1"), 5)).isEqualTo(2);
        assertThat(store.count("auth:failure", GroupKey.of("userId", "U2"), 5)).isEqualTo(1);
        assertThat(store.count("auth:success", null, 5)).isZero();
    }

    @Test
    @DisplayName("Should drop occurrences that fall outside the window")
    void shouldPruneExpiredOccurrences() {
        store.record(event("auth:failure", "U1"));
        clock.advance(Duration.ofMinutes(3));
        store.record(event("auth:failure", "U1"));

        clock.advance(Duration.ofMinutes(3));

        assertThat(store.count("auth:failure", null, 5)).isEqualTo(1);
        assertThat(store.count("auth:failure", null, 15)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should answer an untracked window from the next larger tracked window")
    void shouldAnswerUntrackedWindow() {
        store.record(event("data:access", "U1"));
        clock.advance(Duration.ofMinutes(8));
        store.record(event("data:access", "U1"));

        // 10 minutes is answered from the 15-minute counter, filtered by cutoff
        assertThat(store.count("data:access", null, 10)).isEqualTo(2);
        assertThat(store.count("data:access", null, 7)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should answer windows beyond the largest from the largest tracked window")
    void shouldCapAtLargestWindow() {
        store.record(event("data:access", "U1"));

        assertThat(store.count("data:access", null, 240)).isEqualTo(1);
    }

    @Test
    @DisplayName("Registered windows and group fields should be tracked")
    void shouldTrackRegisteredWindowAndGroup() {
        store.registerWindow(120);
        store.registerGroupField("deviceId");

        store.record(new SecurityEvent("e1", "login", Severity.LOW, clock.instant(), null,
                Map.of("deviceId", "D9")));
        clock.advance(Duration.ofMinutes(90));

        assertThat(store.getWindows()).contains(120);
        assertThat(store.count("login", GroupKey.of("deviceId", "D9"), 120)).isEqualTo(1);
        assertThat(store.count("login", null, 60)).isZero();
    }

    @Test
    @DisplayName("Registering a window should keep occurrences recorded before registration")
    void shouldSeedRegisteredWindowFromExistingCounters() {
        store.record(event("auth:failure", "U1"));
        clock.advance(Duration.ofMinutes(12));
        store.record(event("auth:failure", "U1"));
        store.record(event("auth:failure", "U2"));
        assertThat(store.count("auth:failure", null, 10)).isEqualTo(2);

        store.registerWindow(10);
        store.registerWindow(90);

        assertThat(store.count("auth:failure", null, 10)).isEqualTo(2);
        assertThat(store.count("auth:failure", GroupKey.of("userId", "U1"), 10)).isEqualTo(1);
        assertThat(store.count("auth:failure", null, 90)).isEqualTo(3);

        clock.advance(Duration.ofMinutes(9));
        store.record(event("auth:failure", "U1"));

        assertThat(store.count("auth:failure", null, 10)).isEqualTo(3);
        assertThat(store.count("auth:failure", GroupKey.of("userId", "U1"), 10)).isEqualTo(2);
    }

    @Test
    @DisplayName("Registering a group field should group occurrences recorded before registration")
    void shouldSeedRegisteredGroupFieldFromUngroupedCounters() {
        store.record(event("auth:success", "U1", "country", "US"));
        store.record(event("auth:success", "U2", "country", "US"));
        store.record(event("auth:success", "U3", "country", "DE"));

        store.registerGroupField("metadata.country");
        store.record(event("auth:success", "U4", "country", "US"));

        assertThat(store.count("auth:success", GroupKey.of("metadata.country", "US"), 5)).isEqualTo(3);
        assertThat(store.count("auth:success", GroupKey.of("metadata.country", "DE"), 60)).isEqualTo(1);
        assertThat(store.uniqueValues("auth:success", GroupKey.of("metadata.country", "US"),
                "userId", 15)).containsExactly("U1", "U2", "U4");
    }

    @Test
    @DisplayName("Late events should be kept in timestamp order")
    void shouldInsertLateEventsInOrder() {
        store.record("x", null, T0);
        store.record("x", null, T0.minusSeconds(30));
        store.record("x", null, T0.minusSeconds(10));

        assertThat(store.occurrences("x", null, 5))
                .extracting(Occurrence::getTimestamp)
                .containsExactly(T0.minusSeconds(30), T0.minusSeconds(10), T0);
    }

    @Test
    @DisplayName("Should collect distinct values of a field within the window")
    void shouldCollectUniqueValues() {
        store.record(event("auth:success", "U1", "country", "US"));
        store.record(event("auth:success", "U1", "country", "US"));
        store.record(event("auth:success", "U1", "country", "DE"));
        store.record(event("auth:success", "U2", "country", "FR"));

        assertThat(store.uniqueValues("auth:success", GroupKey.of("userId", "U1"), "metadata.country", 60))
                .containsExactly("US", "DE");
    }

    @Test
    @DisplayName("Sweep should reclaim counters whose occurrences all expired")
    void shouldSweepEmptyCounters() {
        store.record(event("auth:failure", "U1"));
        int tracked = store.size();
        assertThat(tracked).isPositive();

        clock.advance(Duration.ofMinutes(61));

        assertThat(store.sweep()).isEqualTo(tracked);
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Should reject non-positive windows")
    void shouldRejectInvalidWindow() {
        assertThatThrownBy(() -> store.registerWindow(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.count("x", null, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private SecurityEvent event(String type, String userId) {
        return new SecurityEvent("e" + (++sequence), type, Severity.LOW, clock.instant(), null,
                Map.of("userId", userId));
    }

    private SecurityEvent event(String type, String userId, String key, Object value) {
        return new SecurityEvent("e" + (++sequence), type, Severity.LOW, clock.instant(), null,
                Map.of("userId", userId, key, value));
    }
}
