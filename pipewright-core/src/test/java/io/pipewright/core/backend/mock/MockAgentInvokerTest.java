package io.pipewright.core.backend.mock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pipewright.core.algebra.Agent;
import io.pipewright.core.backend.AgentReply;
import io.pipewright.core.backend.AgentRequest;
import io.pipewright.core.ir.AgentNode;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MockAgentInvoker")
class MockAgentInvokerTest {

    @AfterEach
    void tearDown() {
        StubResponseRegistry.getInstance().clearResponses();
    }

    private static AgentRequest request(String agentName, Map<String, Object> state) {
        return new AgentRequest((AgentNode) Agent.named(agentName).toIr(), "", state);
    }

    @Test
    void shouldAnswerTextFromTable() {
        MockAgentInvoker invoker = new MockAgentInvoker(Map.of("writer", "draft"));

        AgentReply reply = invoker.invoke(request("writer", Map.of()));

        assertThat(reply).isEqualTo(AgentReply.Text.of("draft"));
    }

    @Test
    void shouldAnswerStateDeltaFromMap() {
        MockAgentInvoker invoker = new MockAgentInvoker(Map.of("scorer", Map.of("score", 7)));

        AgentReply reply = invoker.invoke(request("scorer", Map.of()));

        assertThat(reply).isInstanceOf(AgentReply.StateDelta.class);
        assertThat(((AgentReply.StateDelta) reply).values()).containsEntry("score", 7);
    }

    @Test
    void shouldAnswerErrorFromThrowable() {
        MockAgentInvoker invoker = new MockAgentInvoker(Map.of("flaky", new IllegalStateException("rate limited")));

        AgentReply reply = invoker.invoke(request("flaky", Map.of()));

        assertThat(reply).isInstanceOf(AgentReply.Error.class);
        assertThat(((AgentReply.Error) reply).message()).isEqualTo("rate limited");
    }

    @Test
    void shouldRejectUnsupportedResponseType() {
        assertThatThrownBy(() -> new MockAgentInvoker(Map.of("writer", 42)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'writer'")
                .hasMessageContaining("Integer");
    }

    @Test
    void shouldConsultStubRegistryForMissingAgents() {
        StubResponseRegistry.getInstance().registerResponse("editor", "edited {{topic}}");
        MockAgentInvoker invoker = new MockAgentInvoker(Map.of());

        AgentReply reply = invoker.invoke(request("editor", Map.of("topic", "tides")));

        assertThat(reply).isEqualTo(AgentReply.Text.of("edited tides"));
    }

    @Test
    void shouldUseConfiguredScenario() {
        MockAgentInvoker invoker =
                new MockAgentInvoker(Map.of(), StubResponseRegistry.getInstance(), "low_score");

        AgentReply reply = invoker.invoke(request("scorer", Map.of()));

        assertThat(reply).isEqualTo(AgentReply.Text.of("Score: 2"));
    }

    @Test
    void shouldReturnPlaceholderWhenNothingMatches() {
        MockAgentInvoker invoker = new MockAgentInvoker(Map.of());

        AgentReply reply = invoker.invoke(request("ghost", Map.of()));

        assertThat(reply).isEqualTo(AgentReply.Text.of("[no mock for 'ghost']"));
    }
}
