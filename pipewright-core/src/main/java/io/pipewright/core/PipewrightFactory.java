package io.pipewright.core;

import io.pipewright.core.backend.AgentInvoker;
import io.pipewright.core.backend.Backend;
import io.pipewright.core.backend.LocalBackend;
import io.pipewright.core.backend.mock.MockAgentInvoker;
import io.pipewright.core.backend.mock.MockBackend;
import io.pipewright.core.backend.mock.StubResponseRegistry;
import io.pipewright.core.execution.ExecutionListener;
import io.pipewright.core.execution.LoggingExecutionListener;
import io.pipewright.core.template.SimpleTemplateResolver;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Factory for wiring {@link PipewrightEnvironment} instances.
///
/// ### Usage Patterns
///
/// **Live runtime**:
/// {@snippet :
/// try (var env = PipewrightFactory.createEnvironment(config, invoker)) {
///     ExecutionResult result = env.getCompiler().compile(pipeline).run(Map.of("topic", "AI"));
/// }
/// }
///
/// **Deterministic mock**:
/// {@snippet :
/// var env = PipewrightFactory.createMockEnvironment(Map.of("writer", "draft"));
/// }
///
/// @implNote This is a utility class with only static methods.
public final class PipewrightFactory {

    private static final Logger logger = Logger.getLogger(PipewrightFactory.class.getName());

    /// Classpath resource read by {@link #loadConfiguration()}.
    public static final String CONFIG_RESOURCE = "/pipewright.properties";

    private PipewrightFactory() {}

    /// Creates a stub-mode environment from the discovered configuration.
    ///
    /// Agents answer from {@link StubResponseRegistry}, so no model runtime is needed.
    ///
    /// @apiNote **Side effects**: reads the classpath configuration and system properties,
    /// creates a thread pool
    ///
    /// @return a configured environment, never null
    /// @see #loadConfiguration()
    public static PipewrightEnvironment createEnvironment() {
        return createEnvironment(loadConfiguration());
    }

    public static PipewrightEnvironment createEnvironment(PipewrightConfig config) {
        return createMockEnvironment(config, Map.of());
    }

    /// Creates an environment whose agents are served by the given invoker.
    ///
    /// @param config configuration, not null
    /// @param invoker model runtime boundary, not null
    /// @return a configured environment, never null
    public static PipewrightEnvironment createEnvironment(
            PipewrightConfig config, AgentInvoker invoker) {
        ExecutorService executor = createExecutor(config);
        ExecutionListener listener = new LoggingExecutionListener();
        Backend backend = new LocalBackend(
                invoker, executor, listener, new SimpleTemplateResolver(), config.getAgentTimeout());
        logger.info("Created environment with " + backend.getName() + " backend, mode=" + config.getBuildMode());
        return new PipewrightEnvironment(config, backend, executor, listener);
    }

    public static PipewrightEnvironment createMockEnvironment(Map<String, ?> responses) {
        return createMockEnvironment(loadConfiguration(), responses);
    }

    /// Creates an environment running on {@link MockBackend}.
    ///
    /// @param config configuration, not null
    /// @param responses fixed responses keyed by agent name, not null
    /// @return a configured environment, never null
    public static PipewrightEnvironment createMockEnvironment(
            PipewrightConfig config, Map<String, ?> responses) {
        ExecutorService executor = createExecutor(config);
        ExecutionListener listener = new LoggingExecutionListener();
        MockAgentInvoker invoker = new MockAgentInvoker(
                responses, StubResponseRegistry.getInstance(), config.getStubScenario());
        Backend backend = new MockBackend(invoker, executor, listener);
        logger.info("Created environment with mock backend, mode=" + config.getBuildMode());
        return new PipewrightEnvironment(config, backend, executor, listener);
    }

    /// Loads configuration from `pipewright.properties` on the classpath, then overlays
    /// `pipewright.*` system properties.
    ///
    /// @return the merged configuration, never null
    /// @throws IllegalArgumentException if a recognized key has an invalid value
    public static PipewrightConfig loadConfiguration() {
        Properties properties = new Properties();
        try (InputStream is = PipewrightFactory.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is != null) {
                properties.load(is);
                logger.fine("Loaded " + CONFIG_RESOURCE);
            }
        } catch (IOException e) {
            logger.warning("Failed to read " + CONFIG_RESOURCE + ": " + e.getMessage());
        }
        System.getProperties().forEach((key, value) -> {
            if (key.toString().startsWith("pipewright.")) {
                properties.setProperty(key.toString(), value.toString());
            }
        });
        return PipewrightConfig.fromProperties(properties);
    }

    private static ExecutorService createExecutor(PipewrightConfig config) {
        return config.getThreadPoolSize() > 0
                ? Executors.newFixedThreadPool(config.getThreadPoolSize())
                : Executors.newCachedThreadPool();
    }
}
