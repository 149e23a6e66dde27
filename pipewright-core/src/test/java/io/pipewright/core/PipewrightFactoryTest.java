package io.pipewright.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import io.pipewright.core.algebra.Agent;
import io.pipewright.core.backend.AgentInvoker;
import io.pipewright.core.backend.AgentReply;
import io.pipewright.core.backend.mock.StubResponseRegistry;
import io.pipewright.core.execution.ExecutionResult;
import io.pipewright.core.execution.LoggingExecutionListener;
import io.pipewright.core.visibility.VisibilityPolicy;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("PipewrightFactory")
@ExtendWith(MockitoExtension.class)
class PipewrightFactoryTest {

    @Mock private AgentInvoker invoker;

    private PipewrightEnvironment environment;

    @AfterEach
    void tearDown() {
        if (environment != null) {
            environment.close();
        }
        StubResponseRegistry.getInstance().clearResponses();
        System.clearProperty(PipewrightConfig.BUILD_MODE);
    }

    @Test
    void shouldLoadBundledConfiguration() {
        PipewrightConfig config = PipewrightFactory.loadConfiguration();

        assertThat(config.getBuildMode()).isEqualTo(BuildMode.ADVISORY);
        assertThat(config.getVisibilityPolicy()).isEqualTo(VisibilityPolicy.FILTERED);
    }

    @Test
    void shouldLetSystemPropertiesOverrideBundledConfiguration() {
        System.setProperty(PipewrightConfig.BUILD_MODE, "unchecked");

        assertThat(PipewrightFactory.loadConfiguration().getBuildMode()).isEqualTo(BuildMode.UNCHECKED);
    }

    @Test
    void shouldRunPipelineInMockEnvironment() {
        // GIVEN
        environment = PipewrightFactory.createMockEnvironment(Map.of("writer", "draft"));

        // WHEN
        ExecutionResult result =
                environment.getCompiler().compile(Agent.named("writer").outputs("draft")).run(Map.of());

        // THEN
        assertThat(environment.getBackend().getName()).isEqualTo("mock");
        assertThat(environment.getListener()).isInstanceOf(LoggingExecutionListener.class);
        assertThat(result.outputState()).containsEntry("draft", "draft");
    }

    @Test
    void shouldServeStubsInDefaultEnvironment() {
        // GIVEN
        StubResponseRegistry.getInstance().registerResponse("writer", "stubbed {{topic}}");
        environment = PipewrightFactory.createEnvironment();

        // WHEN
        ExecutionResult result =
                environment.getCompiler().compile(Agent.named("writer").outputs("draft")).run(Map.of("topic", "tides"));

        // THEN
        assertThat(result.get("draft")).contains("stubbed tides");
    }

    @Test
    void shouldRouteAgentsThroughLiveInvoker() {
        // GIVEN
        when(invoker.invoke(any())).thenReturn(AgentReply.Text.of("live"));
        PipewrightConfig config = PipewrightConfig.builder().buildMode(BuildMode.STRICT).build();
        environment = PipewrightFactory.createEnvironment(config, invoker);

        // WHEN
        ExecutionResult result =
                environment.getCompiler().compile(Agent.named("writer").outputs("draft")).run(Map.of());

        // THEN
        assertThat(environment.getBackend().getName()).isEqualTo("local");
        assertThat(environment.getCompiler().getMode()).isEqualTo(BuildMode.STRICT);
        assertThat(result.get("draft")).contains("live");
    }
}
