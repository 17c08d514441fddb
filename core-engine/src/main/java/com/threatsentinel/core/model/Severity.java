package com.threatsentinel.core.model;

import java.util.Locale;

/**
 * Severity scale shared by events, rules, threats, alerts and incidents.
 *
 * <p>
 * Declaration order is significant: later constants are more severe.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * @param other severity to compare against
     * @return {@code true} if this severity is the same as or above {@code other}
     */
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Lenient parser used for inbound events. Unknown or blank values yield
     * {@code null} so callers can apply their own default.
     *
     * @param value severity name in any case
     * @return the matching severity, or {@code null}
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
