package io.pipewright.core.exception;

import io.pipewright.core.execution.ErrorType;
import java.io.Serial;

/// Raised when a state assertion evaluates to false.
public class ExpectationFailedException extends StepExecutionException {
    @Serial private static final long serialVersionUID = 1943780231185562410L;

    public ExpectationFailedException(String stepName, String message) {
        super(stepName, ErrorType.EXPECTATION, message);
    }
}
