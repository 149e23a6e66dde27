package io.pipewright.core.ir;

import io.pipewright.core.state.StatePredicate;
import java.util.Objects;

/// One ordered rule of a {@link RouteNode}: when the matcher holds, the target runs.
///
/// @param label human-readable rule description, not null
/// @param matcher condition over state, not null
/// @param target branch executed when the matcher holds, not null
public record RouteRule(String label, StatePredicate matcher, Node target) {

    public RouteRule {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(matcher, "matcher must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }

    public static RouteRule eq(String key, Object value, Node target) {
        return of(new KeyMatcher(KeyMatcher.Operation.EQ, key, value), target);
    }

    public static RouteRule contains(String key, Object substring, Node target) {
        return of(new KeyMatcher(KeyMatcher.Operation.CONTAINS, key, substring), target);
    }

    public static RouteRule gt(String key, Number threshold, Node target) {
        return of(new KeyMatcher(KeyMatcher.Operation.GT, key, threshold), target);
    }

    public static RouteRule lt(String key, Number threshold, Node target) {
        return of(new KeyMatcher(KeyMatcher.Operation.LT, key, threshold), target);
    }

    public static RouteRule when(StatePredicate predicate, Node target) {
        return new RouteRule("when", predicate, target);
    }

    private static RouteRule of(KeyMatcher matcher, Node target) {
        return new RouteRule(matcher.label(), matcher, target);
    }

    /// Returns whether this rule is a free-form predicate rather than a key comparison.
    ///
    /// @return `true` for `when` rules
    public boolean isPredicateRule() {
        return !(matcher instanceof KeyMatcher);
    }
}
