package io.pipewright.core.execution;

import java.util.Objects;

/// One execution failure.
///
/// @param step name of the step that failed, not null
/// @param type error classification, not null
/// @param message human-readable description, not null
public record ExecutionError(String step, ErrorType type, String message) {

    public ExecutionError {
        Objects.requireNonNull(step, "step must not be null");
        Objects.requireNonNull(type, "type must not be null");
        message = message != null ? message : "";
    }
}
