package io.pipewright.core.exception;

import io.pipewright.core.execution.ErrorType;
import java.io.Serial;

/// Failure of one execution step, carrying the step name and an error classification.
///
/// Backends catch these at the top of a run and convert them into
/// {@link io.pipewright.core.execution.ExecutionError} entries; they never escape
/// {@link io.pipewright.core.backend.Backend#run}.
public class StepExecutionException extends PipewrightException {
    @Serial private static final long serialVersionUID = 5216380416532296917L;

    private final String stepName;
    private final ErrorType errorType;

    public StepExecutionException(String stepName, ErrorType errorType, String message) {
        super(message);
        this.stepName = stepName;
        this.errorType = errorType;
    }

    public StepExecutionException(
            String stepName, ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.stepName = stepName;
        this.errorType = errorType;
    }

    public String getStepName() {
        return stepName;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
