package io.pipewright.core.backend.mock;

import static org.assertj.core.api.Assertions.assertThat;

import io.pipewright.core.state.StateKeys;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("StubResponseRegistry")
class StubResponseRegistryTest {

    private final StubResponseRegistry registry = StubResponseRegistry.getInstance();

    @AfterEach
    void tearDown() {
        registry.clearResponses();
        registry.clearStubsDirectory();
    }

    @Nested
    @DisplayName("Registered responses")
    class RegisteredTest {

        @Test
        void shouldReturnRegisteredResponseForDefaultScenario() {
            registry.registerResponse("writer", "A short draft");

            assertThat(registry.getResponse("writer", Map.of())).isEqualTo("A short draft");
        }

        @Test
        void shouldPreferScenarioNamedInState() {
            // GIVEN
            registry.registerResponse("reviewer", "approved");
            registry.registerResponse("strict", "reviewer", "rejected");

            // WHEN
            String response = registry.getResponse("reviewer", Map.of(StateKeys.STUB_SCENARIO, "strict"));

            // THEN
            assertThat(response).isEqualTo("rejected");
        }

        @Test
        void shouldFallBackToDefaultScenario() {
            registry.registerResponse("reviewer", "approved");

            assertThat(registry.getResponse("reviewer", Map.of(), "unknown_scenario")).isEqualTo("approved");
        }

        @Test
        void shouldSubstituteStatePlaceholders() {
            registry.registerResponse("writer", "Draft on {{topic}} for {{audience}}");

            String response = registry.getResponse("writer", Map.of("topic", "tides"));

            assertThat(response).isEqualTo("Draft on tides for ");
        }

        @Test
        void shouldReturnNullWhenNothingIsConfigured() {
            assertThat(registry.getResponse("nobody", Map.of())).isNull();
        }

        @Test
        void shouldListScenariosSorted() {
            registry.registerResponse("zeta", "a", "x");
            registry.registerResponse("alpha", "a", "x");

            assertThat(registry.getAvailableScenarios()).containsExactly("alpha", "default", "zeta");
        }

        @Test
        void shouldForgetClearedScenario() {
            registry.registerResponse("strict", "reviewer", "rejected");

            registry.clearScenario("strict");

            assertThat(registry.getResponse("reviewer", Map.of(StateKeys.STUB_SCENARIO, "strict"))).isNull();
        }
    }

    @Nested
    @DisplayName("Resource and filesystem stubs")
    class StubFileTest {

        @TempDir Path tempDir;

        @Test
        void shouldLoadClasspathStubWithSubstitution() {
            assertThat(registry.getResponse("stubbed_agent", Map.of("topic", "tides")))
                    .isEqualTo("Stubbed reply about tides");
        }

        @Test
        void shouldLoadScenarioSpecificClasspathStub() {
            assertThat(registry.getResponse("scorer", Map.of(StateKeys.STUB_SCENARIO, "low_score")))
                    .isEqualTo("Score: 2");
            assertThat(registry.getResponse("scorer", Map.of())).isEqualTo("Score: 9");
        }

        @Test
        void shouldLoadFilesystemStub() throws IOException {
            // GIVEN
            Path scenarioDir = Files.createDirectories(tempDir.resolve("default"));
            Files.writeString(scenarioDir.resolve("fs_agent.txt"), "from disk: {{topic}}");

            // WHEN
            registry.setStubsDirectory(tempDir);

            // THEN
            assertThat(registry.getResponse("fs_agent", Map.of("topic", "x"))).isEqualTo("from disk: x");
        }

        @Test
        void shouldPreferRegisteredResponseOverFiles() {
            registry.registerResponse("stubbed_agent", "registered");

            assertThat(registry.getResponse("stubbed_agent", Map.of())).isEqualTo("registered");
        }

        @Test
        void shouldSeeNewFilesAfterDirectoryIsReset() throws IOException {
            // GIVEN
            registry.setStubsDirectory(tempDir);
            assertThat(registry.getResponse("late_agent", Map.of())).isNull();
            Path scenarioDir = Files.createDirectories(tempDir.resolve("default"));
            Files.writeString(scenarioDir.resolve("late_agent.txt"), "arrived");

            // WHEN
            registry.setStubsDirectory(tempDir);

            // THEN
            assertThat(registry.getResponse("late_agent", Map.of())).isEqualTo("arrived");
        }
    }
}
