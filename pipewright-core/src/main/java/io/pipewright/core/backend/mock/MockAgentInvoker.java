package io.pipewright.core.backend.mock;

import io.pipewright.core.backend.AgentInvoker;
import io.pipewright.core.backend.AgentReply;
import io.pipewright.core.backend.AgentRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Deterministic {@link AgentInvoker} answering from a fixed table keyed by agent name.
///
/// ### Response Resolution Order
/// 1. Table entry: a `String` becomes text content, a `Map` becomes a state delta, a
///    `Throwable` becomes a failed call
/// 2. {@link StubResponseRegistry} lookup for the agent
/// 3. `[no mock for 'name']`
public class MockAgentInvoker implements AgentInvoker {

    private static final Logger logger = Logger.getLogger(MockAgentInvoker.class.getName());

    private final Map<String, Object> responses;
    private final StubResponseRegistry registry;
    private final String scenario;

    public MockAgentInvoker(Map<String, ?> responses) {
        this(responses, StubResponseRegistry.getInstance(), null);
    }

    /// Creates an invoker.
    ///
    /// @param responses fixed responses keyed by agent name, not null
    /// @param registry registry consulted for agents missing from the table, not null
    /// @param scenario fallback stub scenario, may be null for `default`
    /// @throws IllegalArgumentException if a response is neither text, map nor throwable
    public MockAgentInvoker(
            Map<String, ?> responses, StubResponseRegistry registry, String scenario) {
        Objects.requireNonNull(responses, "responses must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.scenario = scenario;
        this.responses = new LinkedHashMap<>();
        responses.forEach((name, response) -> {
            if (!(response instanceof String
                    || response instanceof Map
                    || response instanceof Throwable)) {
                throw new IllegalArgumentException(
                        "Mock response for '" + name + "' must be a String, Map or Throwable, got "
                                + (response == null ? "null" : response.getClass().getSimpleName()));
            }
            this.responses.put(name, response);
        });
    }

    @Override
    public AgentReply invoke(AgentRequest request) {
        String name = request.agentName();
        Object response = responses.get(name);
        if (response instanceof String text) {
            return AgentReply.Text.of(text);
        }
        if (response instanceof Map<?, ?> delta) {
            Map<String, Object> values = new LinkedHashMap<>();
            delta.forEach((key, value) -> values.put(String.valueOf(key), value));
            return AgentReply.StateDelta.of(values);
        }
        if (response instanceof Throwable failure) {
            return AgentReply.Error.from(failure);
        }

        String stub = registry.getResponse(name, request.state(), scenario);
        if (stub != null) {
            return AgentReply.Text.of(stub);
        }
        logger.fine("No mock response for agent '" + name + "'");
        return AgentReply.Text.of("[no mock for '" + name + "']");
    }
}
