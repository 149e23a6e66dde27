package io.pipewright.core.exception;

import io.pipewright.core.execution.ErrorType;
import java.io.Serial;

/// Raised when no route rule matches and the route declares no default branch.
public class RouteResolutionException extends StepExecutionException {
    @Serial private static final long serialVersionUID = -8873202431671402231L;

    public RouteResolutionException(String stepName, Object dispatchValue) {
        super(
                stepName,
                ErrorType.ROUTE_UNRESOLVED,
                "No route rule matched in '"
                        + stepName
                        + "' (dispatch value: "
                        + dispatchValue
                        + ") and no default branch is declared");
    }
}
