package io.pipewright.core.state;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Boolean test over pipeline state, used by routes, loops, gates and assertions.
///
/// A predicate may declare the state keys it reads through {@link #reads()}. The contract
/// checker uses that declaration to verify the keys are available where the predicate is
/// evaluated; a plain lambda declares nothing and is therefore never flagged.
///
/// {@snippet :
/// StatePredicate approved = StatePredicate.reading(
///         state -> "yes".equals(state.get("verdict")), "verdict");
/// }
@FunctionalInterface
public interface StatePredicate {

    /// Evaluates the predicate against a read-only view of the state.
    ///
    /// @param state current state, not null
    /// @return `true` if the condition holds
    boolean test(Map<String, Object> state);

    /// Returns the state keys this predicate reads.
    ///
    /// @return declared keys, never null (empty for undeclared lambdas)
    default Set<String> reads() {
        return Set.of();
    }

    /// Returns the logical negation, keeping the declared reads.
    ///
    /// @return negated predicate, never null
    default StatePredicate negate() {
        StatePredicate self = this;
        return new Declared(self.reads(), state -> !self.test(state));
    }

    /// Wraps a predicate together with the keys it reads.
    ///
    /// @param predicate the condition, not null
    /// @param keys state keys read by the condition
    /// @return declared predicate, never null
    static StatePredicate reading(StatePredicate predicate, String... keys) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return new Declared(new LinkedHashSet<>(Arrays.asList(keys)), predicate);
    }

    /// Predicate with an explicit read set.
    ///
    /// @param reads keys the delegate reads, not null
    /// @param delegate the actual condition, not null
    record Declared(Set<String> reads, StatePredicate delegate) implements StatePredicate {

        public Declared {
            reads = Set.copyOf(reads);
            Objects.requireNonNull(delegate, "delegate must not be null");
        }

        @Override
        public boolean test(Map<String, Object> state) {
            return delegate.test(state);
        }
    }
}
