package io.pipewright.core.execution;

import io.pipewright.core.lowering.ExecutionStep;

/// Listener for pipeline execution lifecycle events.
///
/// All methods have no-op defaults, so listeners override only what they need.
///
/// ### Callback order per step
/// ```
/// onStepStart(step)
///   onAgentStart(agent, instruction)     (agent steps only, before the invoker call)
///   onAgentComplete(agent, event)        (agent steps only)
/// onStepComplete(step)  or  onStepFailed(step, error)
/// ```
///
/// @implNote Backends call listeners from worker threads when parallel, race or timeout
/// steps are running. Implementations must be thread-safe.
public interface ExecutionListener {

    default void onStepStart(ExecutionStep step) {}

    default void onStepComplete(ExecutionStep step) {}

    /// Called when a step fails; the failure may still be recovered by an enclosing
    /// fallback or race.
    ///
    /// @param step the failed step, not null
    /// @param error the classified failure, not null
    default void onStepFailed(ExecutionStep step, ExecutionError error) {}

    /// Called before an agent is invoked.
    ///
    /// @param agentName agent name, not null
    /// @param instruction resolved instruction, not null
    default void onAgentStart(String agentName, String instruction) {}

    /// Called after an agent replied.
    ///
    /// @param agentName agent name, not null
    /// @param event the reply event, before visibility filtering, not null
    default void onAgentComplete(String agentName, AgentEvent event) {}

    /// No-op listener instance that ignores all events.
    ExecutionListener NOOP = new ExecutionListener() {};
}
