package io.pipewright.core.algebra;

import io.pipewright.core.exception.InvalidPipelineException;
import io.pipewright.core.state.StatePredicate;
import java.util.Objects;

/// Exit condition and iteration bound for {@link Flow#repeat(Until)}.
///
/// @param predicate condition checked after each full pass, not null
/// @param maxIterations upper bound on passes, at least 1
public record Until(StatePredicate predicate, int maxIterations) {

    public static final int DEFAULT_MAX_ITERATIONS = 10;
    public static final int DEFAULT_MAX_RETRIES = 3;

    public Until {
        Objects.requireNonNull(predicate, "predicate must not be null");
        if (maxIterations < 1) {
            throw new InvalidPipelineException("maxIterations must be >= 1, got " + maxIterations);
        }
    }

    public static Until until(StatePredicate predicate) {
        return new Until(predicate, DEFAULT_MAX_ITERATIONS);
    }

    public static Until until(StatePredicate predicate, int maxIterations) {
        return new Until(predicate, maxIterations);
    }
}
