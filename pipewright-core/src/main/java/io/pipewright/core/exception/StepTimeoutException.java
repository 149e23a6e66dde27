package io.pipewright.core.exception;

import io.pipewright.core.execution.ErrorType;
import java.io.Serial;
import java.time.Duration;

/// Raised when a timeout wrapper's deadline expires before its child completes.
public class StepTimeoutException extends StepExecutionException {
    @Serial private static final long serialVersionUID = -2087370418196412960L;

    public StepTimeoutException(String stepName, Duration deadline) {
        super(
                stepName,
                ErrorType.TIMEOUT,
                "Step '" + stepName + "' timed out after " + deadline.toMillis() + " ms");
    }
}
