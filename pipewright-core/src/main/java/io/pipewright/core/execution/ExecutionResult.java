package io.pipewright.core.execution;

import io.pipewright.core.state.StateMaps;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Outcome of one backend run.
///
/// Execution errors never escape the backend as exceptions; they are collected here and
/// never retried by the core.
///
/// @param outputState state after the run (partial if the run failed), not null
/// @param events emitted events, after visibility filtering, not null
/// @param errors execution errors in occurrence order, not null
public record ExecutionResult(
        Map<String, Object> outputState, List<AgentEvent> events, List<ExecutionError> errors) {

    public ExecutionResult {
        outputState = outputState != null ? StateMaps.copyOf(outputState) : Map.of();
        events = events != null ? List.copyOf(events) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    /// Derives the overall status: paused when the only failure is a pending gate.
    ///
    /// @return exit status, never null
    public ExitStatus exitStatus() {
        if (errors.isEmpty()) {
            return ExitStatus.COMPLETED;
        }
        boolean onlyGates = errors.stream().allMatch(e -> e.type() == ErrorType.APPROVAL_REQUIRED);
        return onlyGates ? ExitStatus.PAUSED : ExitStatus.FAILED;
    }

    /// Returns the content of the last final, non-error event.
    ///
    /// @return final text, or empty if no agent replied
    public Optional<String> finalText() {
        for (int i = events.size() - 1; i >= 0; i--) {
            AgentEvent event = events.get(i);
            if (event.finalResponse() && !event.error()) {
                return Optional.of(event.content());
            }
        }
        return Optional.empty();
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(outputState.get(key));
    }
}
