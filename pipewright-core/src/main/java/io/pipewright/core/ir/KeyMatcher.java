package io.pipewright.core.ir;

import io.pipewright.core.state.StatePredicate;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Value-comparable route matcher that tests one state key against an operand.
///
/// Unlike an arbitrary {@link StatePredicate} lambda, two matchers with the same operation,
/// key and operand are equal, which keeps rebuilt route trees deep-equal.
///
/// @param operation comparison to perform, not null
/// @param key state key under test, not null
/// @param operand value compared against, may be null for `EQ`
public record KeyMatcher(Operation operation, String key, Object operand)
        implements StatePredicate {

    /// Comparison applied by a {@link KeyMatcher}.
    public enum Operation {
        EQ,
        CONTAINS,
        GT,
        LT
    }

    public KeyMatcher {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(key, "key must not be null");
    }

    @Override
    public boolean test(Map<String, Object> state) {
        Object value = state.get(key);
        return switch (operation) {
            case EQ -> Objects.equals(value, operand) || looselyEqual(value, operand);
            case CONTAINS -> contains(value, operand);
            case GT -> compare(value, operand) > 0;
            case LT -> compare(value, operand) < 0;
        };
    }

    @Override
    public Set<String> reads() {
        return Set.of(key);
    }

    /// Returns a short label such as `eq:approved` for diagnostics and graph output.
    ///
    /// @return label, never null
    public String label() {
        return operation.name().toLowerCase() + ":" + operand;
    }

    // Numbers compare by value across boxed types; everything else by string form.
    private static boolean looselyEqual(Object value, Object operand) {
        if (value instanceof Number a && operand instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return value != null && operand != null && value.toString().equals(operand.toString());
    }

    private static boolean contains(Object value, Object operand) {
        if (value == null || operand == null) {
            return false;
        }
        if (value instanceof Collection<?> collection) {
            return collection.contains(operand);
        }
        if (value instanceof Map<?, ?> map) {
            return map.containsKey(operand);
        }
        return value.toString().contains(operand.toString());
    }

    private static int compare(Object value, Object operand) {
        Double left = toNumber(value);
        Double right = toNumber(operand);
        if (left == null || right == null) {
            // Unordered: neither gt nor lt holds
            return 0;
        }
        return Double.compare(left, right);
    }

    private static Double toNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.valueOf(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
