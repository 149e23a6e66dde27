package io.pipewright.core.exception;

import io.pipewright.core.execution.ErrorType;
import java.io.Serial;

/// Wraps an exception thrown by a user predicate inside a route, gate, expect or loop
/// checkpoint.
public class PredicateEvaluationException extends StepExecutionException {
    @Serial private static final long serialVersionUID = 2207431160719936180L;

    public PredicateEvaluationException(String stepName, Throwable cause) {
        super(
                stepName,
                ErrorType.PREDICATE,
                "Predicate evaluation failed in '" + stepName + "': " + cause.getMessage(),
                cause);
    }
}
