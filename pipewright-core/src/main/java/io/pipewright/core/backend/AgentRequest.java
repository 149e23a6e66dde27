package io.pipewright.core.backend;

import io.pipewright.core.ir.AgentNode;
import io.pipewright.core.state.StateMaps;
import java.util.Map;
import java.util.Objects;

/// One agent call.
///
/// @param agent the agent definition, not null
/// @param instruction instruction with placeholders resolved, not null
/// @param state read-only snapshot of state at call time, not null
public record AgentRequest(AgentNode agent, String instruction, Map<String, Object> state) {

    public AgentRequest {
        Objects.requireNonNull(agent, "agent must not be null");
        instruction = instruction != null ? instruction : "";
        state = state != null ? StateMaps.copyOf(state) : Map.of();
    }

    public String agentName() {
        return agent.name();
    }
}
