package io.pipewright.core.backend;

/// Boundary to the model runtime: turns one agent request into a reply.
///
/// Prompt rendering beyond `{key}` substitution, tool calling and model scheduling all
/// happen behind this interface.
///
/// @implNote Implementations must be thread-safe. Parallel and race steps invoke agents
/// concurrently. Implementations should respond to thread interruption, which is how
/// cancelled race branches and expired timeouts are signalled.
@FunctionalInterface
public interface AgentInvoker {

    /// Invokes the agent.
    ///
    /// @param request the agent call, not null
    /// @return reply, never null
    AgentReply invoke(AgentRequest request);
}
