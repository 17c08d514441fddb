package com.threatsentinel.core.detection;

import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.util.FieldPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates a boolean condition tree against an event.
 *
 * <p>
 * Every key of a node must hold (AND). A key maps to:
 * </p>
 * <ul>
 * <li>a literal: the field at that path must equal it;</li>
 * <li>a map {@code {op, value}}: comparison with one of {@code eq, neq, gt,
 * gte, lt, lte, contains, startsWith, endsWith, in, nin, exists};</li>
 * <li>a list of sub-trees, combined with the node's {@code operator}
 * ({@code OR} by default, or {@code AND}) and inverted when the node's
 * {@code negated} flag is set.</li>
 * </ul>
 * <p>
 * A missing field never satisfies a comparison.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConditionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionEvaluator.class);

    static final String OPERATOR = "operator";
    static final String NEGATED = "negated";

    private ConditionEvaluator() {
        // utility class, not instantiable
    }

    /**
     * @param event      event to test
     * @param conditions condition tree
     * @return {@code true} if the tree holds for the event
     */
    public static boolean matches(SecurityEvent event, Map<String, Object> conditions) {
        for (Map.Entry<String, Object> entry : conditions.entrySet()) {
            String key = entry.getKey();
            if (OPERATOR.equals(key) || NEGATED.equals(key)) {
                continue;
            }
            Object condition = entry.getValue();
            boolean result;
            if (condition instanceof List<?> subTrees) {
                result = matchesSubTrees(event, subTrees, conditions);
            } else {
                Optional<Object> actual = event.resolve(key);
                if (actual.isEmpty()) {
                    return false;
                }
                result = condition instanceof Map<?, ?> comparison
                        ? compare(actual.get(), comparison)
                        : valuesEqual(actual.get(), condition);
            }
            if (!result) {
                return false;
            }
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    private static boolean matchesSubTrees(SecurityEvent event, List<?> subTrees, Map<String, Object> node) {
        boolean and = "AND".equalsIgnoreCase(String.valueOf(node.getOrDefault(OPERATOR, "OR")));
        boolean result = and;
        for (Object subTree : subTrees) {
            if (!(subTree instanceof Map<?, ?>)) {
                LOG.debug("Ignoring non-map sub-condition: {}", subTree);
                continue;
            }
            boolean matched = matches(event, (Map<String, Object>) subTree);
            if (and && !matched) {
                result = false;
                break;
            }
            if (!and && matched) {
                result = true;
                break;
            }
        }
        return Boolean.parseBoolean(String.valueOf(node.get(NEGATED))) ? !result : result;
    }

    static boolean compare(Object actual, Map<?, ?> comparison) {
        String op = String.valueOf(comparison.get("op"));
        Object expected = comparison.get("value");
        return switch (op) {
            case "eq" -> valuesEqual(actual, expected);
            case "neq" -> !valuesEqual(actual, expected);
            case "gt" -> order(actual, expected).map(c -> c > 0).orElse(false);
            case "gte" -> order(actual, expected).map(c -> c >= 0).orElse(false);
            case "lt" -> order(actual, expected).map(c -> c < 0).orElse(false);
            case "lte" -> order(actual, expected).map(c -> c <= 0).orElse(false);
            case "contains" -> actual instanceof Collection<?> values
                    ? values.stream().anyMatch(v -> valuesEqual(v, expected))
                    : expected != null && actual.toString().contains(expected.toString());
            case "startsWith" -> expected != null && actual.toString().startsWith(expected.toString());
            case "endsWith" -> expected != null && actual.toString().endsWith(expected.toString());
            case "in" -> expected instanceof Collection<?> options
                    && options.stream().anyMatch(o -> valuesEqual(actual, o));
            case "nin" -> expected instanceof Collection<?> options
                    && options.stream().noneMatch(o -> valuesEqual(actual, o));
            case "exists" -> true;
            default -> {
                LOG.debug("Unknown comparison operator '{}'", op);
                yield false;
            }
        };
    }

    /** Numbers compare numerically, everything else by string form. */
    static boolean valuesEqual(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        if (actual instanceof Number && expected instanceof Number) {
            return ((Number) actual).doubleValue() == ((Number) expected).doubleValue();
        }
        return actual.toString().equals(expected.toString());
    }

    private static Optional<Integer> order(Object actual, Object expected) {
        if (expected == null) {
            return Optional.empty();
        }
        Optional<Double> a = FieldPaths.toDouble(actual);
        Optional<Double> b = FieldPaths.toDouble(expected);
        if (a.isPresent() && b.isPresent()) {
            return Optional.of(Double.compare(a.get(), b.get()));
        }
        if (actual instanceof Number || expected instanceof Number) {
            return Optional.empty();
        }
        return Optional.of(actual.toString().toLowerCase(Locale.ROOT)
                .compareTo(expected.toString().toLowerCase(Locale.ROOT)));
    }
}
