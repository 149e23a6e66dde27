package io.pipewright.core.exception;

import io.pipewright.core.execution.ErrorType;
import java.io.Serial;

/// Raised by a gate whose approval condition is not met. Signals a pause, not a crash.
public class ApprovalRequiredException extends StepExecutionException {
    @Serial private static final long serialVersionUID = 4719553018234101712L;

    private final String gateKey;

    public ApprovalRequiredException(String stepName, String gateKey, String message) {
        super(stepName, ErrorType.APPROVAL_REQUIRED, message);
        this.gateKey = gateKey;
    }

    public String getGateKey() {
        return gateKey;
    }
}
