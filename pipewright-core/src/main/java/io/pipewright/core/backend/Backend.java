package io.pipewright.core.backend;

import io.pipewright.core.execution.ExecutionResult;
import io.pipewright.core.lowering.ExecutionGraph;
import java.util.Map;

/// Executes lowered pipelines.
///
/// ### Contracts
/// - **Postcondition**: `run` returns a result; execution errors are reported in
///   {@link ExecutionResult#errors()} and never thrown
/// - **Invariant**: the caller's state map is not modified
///
/// @see LocalBackend
/// @see io.pipewright.core.backend.mock.MockBackend
public interface Backend {

    /// Runs the graph against a copy of the given state.
    ///
    /// @param graph lowered pipeline, not null
    /// @param state initial state, not null
    /// @return execution result, never null
    ExecutionResult run(ExecutionGraph graph, Map<String, Object> state);

    /// Returns the backend name used in logs.
    ///
    /// @return name, never null
    String getName();
}
