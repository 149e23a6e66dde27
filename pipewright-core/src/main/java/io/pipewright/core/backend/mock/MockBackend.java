package io.pipewright.core.backend.mock;

import io.pipewright.core.backend.LocalBackend;
import io.pipewright.core.execution.ExecutionListener;
import io.pipewright.core.template.SimpleTemplateResolver;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/// Deterministic backend for tests: a {@link LocalBackend} whose agents answer from a
/// {@link MockAgentInvoker}.
///
/// {@snippet :
/// MockBackend backend = new MockBackend(Map.of("writer", "draft"), executor);
/// ExecutionResult result = backend.run(GraphLowerer.lower(pipeline.toIr()), Map.of());
/// }
public class MockBackend extends LocalBackend {

    public MockBackend(Map<String, ?> responses, ExecutorService executor) {
        this(new MockAgentInvoker(responses), executor, ExecutionListener.NOOP);
    }

    public MockBackend(
            MockAgentInvoker invoker, ExecutorService executor, ExecutionListener listener) {
        super(invoker, executor, listener, new SimpleTemplateResolver(), null);
    }

    @Override
    public String getName() {
        return "mock";
    }
}
