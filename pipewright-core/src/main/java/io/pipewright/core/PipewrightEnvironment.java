package io.pipewright.core;

import io.pipewright.core.backend.Backend;
import io.pipewright.core.execution.ExecutionListener;
import java.util.concurrent.ExecutorService;

/// Container for the components needed to compile and run pipelines.
///
/// Implements {@link AutoCloseable} to release the worker pool.
///
/// @apiNote Create instances via {@link PipewrightFactory} rather than direct construction.
///
/// @see PipewrightFactory#createEnvironment()
public final class PipewrightEnvironment implements AutoCloseable {

    private final PipewrightConfig config;
    private final Backend backend;
    private final ExecutorService executorService;
    private final ExecutionListener listener;
    private final PipelineCompiler compiler;

    /// Creates an environment.
    ///
    /// @param config configuration, not null
    /// @param backend backend used by compiled pipelines, not null
    /// @param executorService pool owned by this environment, not null
    /// @param listener listener wired into the backend, not null
    public PipewrightEnvironment(
            PipewrightConfig config,
            Backend backend,
            ExecutorService executorService,
            ExecutionListener listener) {
        this.config = config;
        this.backend = backend;
        this.executorService = executorService;
        this.listener = listener;
        this.compiler = new PipelineCompiler(config.getBuildMode(), config.getVisibilityPolicy(), backend);
    }

    public PipewrightConfig getConfig() {
        return config;
    }

    public Backend getBackend() {
        return backend;
    }

    public ExecutionListener getListener() {
        return listener;
    }

    /// Returns a compiler using this environment's build mode, policy and backend.
    ///
    /// @return the compiler, never null
    public PipelineCompiler getCompiler() {
        return compiler;
    }

    /// Shuts down the worker pool.
    ///
    /// @implNote Calls `ExecutorService.shutdown()`, which does not block.
    @Override
    public void close() {
        executorService.shutdown();
    }
}
