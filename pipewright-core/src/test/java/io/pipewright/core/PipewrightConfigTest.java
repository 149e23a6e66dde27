package io.pipewright.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pipewright.core.visibility.VisibilityPolicy;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PipewrightConfig")
class PipewrightConfigTest {

    private static Properties properties(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    @Test
    void shouldUseDefaultsForEmptyProperties() {
        PipewrightConfig config = PipewrightConfig.fromProperties(new Properties());

        assertThat(config.getBuildMode()).isEqualTo(BuildMode.ADVISORY);
        assertThat(config.getVisibilityPolicy()).isEqualTo(VisibilityPolicy.FILTERED);
        assertThat(config.getThreadPoolSize()).isZero();
        assertThat(config.getAgentTimeout()).isNull();
        assertThat(config.getStubScenario()).isEqualTo("default");
    }

    @Test
    void shouldReadEveryRecognizedKey() {
        // GIVEN
        Properties properties =
                properties(
                        PipewrightConfig.BUILD_MODE, "strict",
                        PipewrightConfig.VISIBILITY_POLICY, "annotate",
                        PipewrightConfig.THREAD_POOL_SIZE, "8",
                        PipewrightConfig.AGENT_TIMEOUT, "PT30S",
                        PipewrightConfig.STUB_SCENARIO, "low_score",
                        "unrelated.key", "ignored");

        // WHEN
        PipewrightConfig config = PipewrightConfig.fromProperties(properties);

        // THEN
        assertThat(config.getBuildMode()).isEqualTo(BuildMode.STRICT);
        assertThat(config.getVisibilityPolicy()).isEqualTo(VisibilityPolicy.ANNOTATE);
        assertThat(config.getThreadPoolSize()).isEqualTo(8);
        assertThat(config.getAgentTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getStubScenario()).isEqualTo("low_score");
    }

    @Test
    void shouldReadAgentTimeoutAsMilliseconds() {
        PipewrightConfig config = PipewrightConfig.fromProperties(properties(PipewrightConfig.AGENT_TIMEOUT, "1500"));

        assertThat(config.getAgentTimeout()).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> PipewrightConfig.fromProperties(properties(PipewrightConfig.VISIBILITY_POLICY, "hidden")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown visibility policy: hidden");
        assertThatThrownBy(() -> PipewrightConfig.fromProperties(properties(PipewrightConfig.THREAD_POOL_SIZE, "many")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(PipewrightConfig.THREAD_POOL_SIZE);
        assertThatThrownBy(() -> PipewrightConfig.fromProperties(properties(PipewrightConfig.AGENT_TIMEOUT, "soon")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid duration");
        assertThatThrownBy(() -> PipewrightConfig.fromProperties(properties(PipewrightConfig.AGENT_TIMEOUT, "0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be positive");
    }

    @Test
    void shouldBuildFluently() {
        PipewrightConfig config =
                PipewrightConfig.builder()
                        .buildMode(BuildMode.UNCHECKED)
                        .visibilityPolicy(VisibilityPolicy.TRANSPARENT)
                        .agentTimeout(Duration.ofSeconds(5))
                        .build();

        assertThat(config.getBuildMode()).isEqualTo(BuildMode.UNCHECKED);
        assertThat(config.getVisibilityPolicy()).isEqualTo(VisibilityPolicy.TRANSPARENT);
        assertThat(config.getAgentTimeout()).isEqualTo(Duration.ofSeconds(5));
    }
}
