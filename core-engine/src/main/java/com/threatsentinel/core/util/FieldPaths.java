package com.threatsentinel.core.util;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dot-path navigation over nested maps and lists, and lenient numeric
 * coercion for values that arrive as JSON or YAML.
 *
 * @since 1.0.0
 */
public final class FieldPaths {

    private FieldPaths() {
        // utility class, not instantiable
    }

    /**
     * Walk {@code path} (e.g. {@code geo.country} or {@code hosts.0}) starting
     * at {@code root}.
     *
     * @param root starting value, usually a {@link Map}
     * @param path dot-separated path; an empty path returns {@code root}
     * @return the value at the path, or empty if any segment is missing
     */
    public static Optional<Object> resolve(Object root, String path) {
        if (path == null || path.isEmpty()) {
            return Optional.ofNullable(root);
        }
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list) {
                int index;
                try {
                    index = Integer.parseInt(segment);
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
                current = index >= 0 && index < list.size() ? list.get(index) : null;
            } else {
                return Optional.empty();
            }
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    /**
     * Coerce a value to {@code double}. Handles {@link Number} natively and
     * parses numeric strings. NaN and infinities are not numeric here.
     *
     * @param value raw value
     * @return the finite numeric value, or empty if it is not numeric
     */
    public static Optional<Double> toDouble(Object value) {
        double d;
        if (value instanceof Number n) {
            d = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                d = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
    }
}
