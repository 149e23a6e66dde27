package io.pipewright.core.backend;

import io.pipewright.core.exception.ApprovalRequiredException;
import io.pipewright.core.exception.ExpectationFailedException;
import io.pipewright.core.exception.PredicateEvaluationException;
import io.pipewright.core.exception.RouteResolutionException;
import io.pipewright.core.exception.StepExecutionException;
import io.pipewright.core.exception.StepTimeoutException;
import io.pipewright.core.execution.AgentEvent;
import io.pipewright.core.execution.ErrorType;
import io.pipewright.core.execution.ExecutionError;
import io.pipewright.core.execution.ExecutionListener;
import io.pipewright.core.execution.ExecutionResult;
import io.pipewright.core.ir.AgentNode;
import io.pipewright.core.ir.GateNode;
import io.pipewright.core.lowering.ExecutionGraph;
import io.pipewright.core.lowering.ExecutionStep;
import io.pipewright.core.lowering.StepVisitor;
import io.pipewright.core.state.StateKeys;
import io.pipewright.core.state.StateMaps;
import io.pipewright.core.state.StatePredicate;
import io.pipewright.core.state.StateUpdate;
import io.pipewright.core.template.SimpleTemplateResolver;
import io.pipewright.core.template.TemplateResolver;
import io.pipewright.core.visibility.VisibilityPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Live backend: executes an {@link ExecutionGraph} in-process.
///
/// Agent calls go to the configured {@link AgentInvoker}; everything else (routing,
/// loops, transforms, gates) runs locally.
///
/// ### Concurrency
/// Parallel, race and timeout steps run their children on the supplied
/// {@link ExecutorService}, each on its own copy of state. Parallel writes are merged in
/// declaration order after every branch finished, so the last declared writer of a key
/// wins. Race keeps the first branch to finish and fails if that branch failed. Cancellation is cooperative: losing
/// branches and expired timeouts are interrupted and stop before their next step.
///
/// @implNote Nested concurrent steps block worker threads while waiting on their
/// children. A bounded pool smaller than the pipeline's concurrent width can stall;
/// {@link io.pipewright.core.PipewrightFactory} uses a cached pool by default.
///
/// @see io.pipewright.core.backend.mock.MockBackend
public class LocalBackend implements Backend {

    private static final Logger logger = Logger.getLogger(LocalBackend.class.getName());

    private final AgentInvoker invoker;
    private final ExecutorService executor;
    private final ExecutionListener listener;
    private final TemplateResolver templateResolver;
    private final Duration agentTimeout;

    /// Creates a backend without listener or per-agent deadline.
    ///
    /// @param invoker agent runtime boundary, not null
    /// @param executor pool for concurrent steps, not null
    public LocalBackend(AgentInvoker invoker, ExecutorService executor) {
        this(invoker, executor, ExecutionListener.NOOP, new SimpleTemplateResolver(), null);
    }

    /// Creates a fully configured backend.
    ///
    /// @param invoker agent runtime boundary, not null
    /// @param executor pool for concurrent steps, not null
    /// @param listener lifecycle listener, not null
    /// @param templateResolver resolves instruction placeholders, not null
    /// @param agentTimeout deadline applied to every agent call, may be null for none
    public LocalBackend(
            AgentInvoker invoker,
            ExecutorService executor,
            ExecutionListener listener,
            TemplateResolver templateResolver,
            Duration agentTimeout) {
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.templateResolver =
                Objects.requireNonNull(templateResolver, "templateResolver must not be null");
        this.agentTimeout = agentTimeout;
    }

    @Override
    public String getName() {
        return "local";
    }

    @Override
    public ExecutionResult run(ExecutionGraph graph, Map<String, Object> state) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(state, "state must not be null");

        logger.info(
                "Running pipeline '" + graph.root().name() + "' on " + getName() + " backend");
        Frame root = new Frame(new LinkedHashMap<>(state), new CancellationToken());
        List<ExecutionError> errors = new ArrayList<>();
        try {
            execute(graph.root(), root);
        } catch (StepExecutionException e) {
            ExecutionError error = new ExecutionError(e.getStepName(), e.getErrorType(), e.getMessage());
            errors.add(error);
            root.events.add(AgentEvent.failure(error));
            logger.warning(
                    "Pipeline '" + graph.root().name() + "' stopped at '" + e.getStepName()
                            + "' [" + e.getErrorType() + "]: " + e.getMessage());
        }
        return new ExecutionResult(root.state, applyPolicy(root.events, graph.policy()), errors);
    }

    /// Drops internal events under {@link VisibilityPolicy#FILTERED}; other policies keep
    /// every event, already tagged through {@link AgentEvent#userFacing()}.
    static List<AgentEvent> applyPolicy(List<AgentEvent> events, VisibilityPolicy policy) {
        if (policy != VisibilityPolicy.FILTERED) {
            return events;
        }
        List<AgentEvent> visible = new ArrayList<>(events.size());
        for (AgentEvent event : events) {
            if (event.userFacing() || event.error()) {
                visible.add(event);
            }
        }
        return visible;
    }

    private void execute(ExecutionStep step, Frame frame) {
        if (frame.token.isCancelled() || Thread.currentThread().isInterrupted()) {
            throw new StepExecutionException(
                    step.name(), ErrorType.CANCELLED, "Step '" + step.name() + "' was cancelled");
        }
        listener.onStepStart(step);
        try {
            step.accept(new StepRunner(frame));
        } catch (StepExecutionException e) {
            if (e.getStepName().equals(step.name())) {
                listener.onStepFailed(step, toError(e));
            }
            throw e;
        } catch (RuntimeException e) {
            StepExecutionException wrapped =
                    new StepExecutionException(step.name(), ErrorType.BACKEND, describe(e), e);
            listener.onStepFailed(step, toError(wrapped));
            throw wrapped;
        }
        listener.onStepComplete(step);
    }

    private boolean evaluate(StatePredicate predicate, String stepName, Map<String, Object> state) {
        try {
            return predicate.test(StateMaps.copyOf(state));
        } catch (RuntimeException e) {
            throw new PredicateEvaluationException(stepName, e);
        }
    }

    private <T> T await(Future<T> future, String stepName, Duration deadline) {
        try {
            return deadline == null
                    ? future.get()
                    : future.get(deadline.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StepTimeoutException(stepName, deadline);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StepExecutionException(
                    stepName, ErrorType.CANCELLED, "Interrupted while running '" + stepName + "'", e);
        } catch (CancellationException e) {
            throw new StepExecutionException(
                    stepName, ErrorType.CANCELLED, "Step '" + stepName + "' was cancelled", e);
        } catch (ExecutionException e) {
            throw unwrap(stepName, e.getCause());
        }
    }

    private static StepExecutionException unwrap(String stepName, Throwable cause) {
        if (cause instanceof StepExecutionException stepFailure) {
            return stepFailure;
        }
        return new StepExecutionException(stepName, ErrorType.BACKEND, describe(cause), cause);
    }

    private static ExecutionError toError(StepExecutionException e) {
        return new ExecutionError(e.getStepName(), e.getErrorType(), e.getMessage());
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /// State and event buffer of one branch of execution.
    ///
    /// A frame is only touched by one thread at a time: branch frames by their worker,
    /// the parent again once the worker has finished.
    private static final class Frame {

        private final Map<String, Object> state;
        private final Map<String, Object> baseline;
        private final List<AgentEvent> events = new ArrayList<>();
        private final CancellationToken token;
        private volatile boolean finished;

        Frame(Map<String, Object> state, CancellationToken token) {
            this.state = state;
            this.baseline = StateMaps.copyOf(state);
            this.token = token;
        }

        Frame branch() {
            return new Frame(new LinkedHashMap<>(state), token.child());
        }

        /// Applies a finished branch's writes and events to this frame.
        void absorb(Frame branch) {
            StateMaps.diff(branch.baseline, branch.state).applyTo(state);
            events.addAll(branch.events);
        }
    }

    private final class StepRunner implements StepVisitor<Void> {

        private final Frame frame;

        StepRunner(Frame frame) {
            this.frame = frame;
        }

        @Override
        public Void visitAgent(ExecutionStep.AgentStep step) {
            AgentNode agent = step.node();
            String instruction = templateResolver.resolve(agent.instruction(), frame.state);
            listener.onAgentStart(agent.name(), instruction);

            AgentReply reply = invoke(new AgentRequest(agent, instruction, frame.state));
            Map<String, Object> delta = new LinkedHashMap<>();
            String content;
            if (reply instanceof AgentReply.Text text) {
                content = text.content();
                if (agent.outputKey() != null) {
                    delta.put(agent.outputKey(), content);
                }
                delta.put(StateKeys.LAST_OUTPUT, content);
            } else if (reply instanceof AgentReply.StateDelta stateDelta) {
                content = "";
                delta.putAll(stateDelta.values());
                delta.put(StateKeys.LAST_OUTPUT, stateDelta.values());
            } else {
                AgentReply.Error error = (AgentReply.Error) reply;
                throw new StepExecutionException(
                        agent.name(), ErrorType.BACKEND, error.message(), error.cause());
            }

            frame.state.putAll(delta);
            AgentEvent event = AgentEvent.reply(agent.name(), content, delta, step.visibility());
            listener.onAgentComplete(agent.name(), event);
            frame.events.add(event);
            return null;
        }

        private AgentReply invoke(AgentRequest request) {
            String name = request.agentName();
            AgentReply reply;
            try {
                reply = agentTimeout == null
                        ? invoker.invoke(request)
                        : await(executor.submit(() -> invoker.invoke(request)), name, agentTimeout);
            } catch (StepExecutionException e) {
                throw e;
            } catch (RuntimeException e) {
                if (frame.token.isCancelled() || Thread.currentThread().isInterrupted()) {
                    throw new StepExecutionException(
                            name, ErrorType.CANCELLED, "Agent '" + name + "' was cancelled", e);
                }
                throw new StepExecutionException(
                        name, ErrorType.BACKEND, "Agent '" + name + "' failed: " + describe(e), e);
            }
            if (reply == null) {
                throw new StepExecutionException(
                        name, ErrorType.BACKEND, "Agent invoker returned no reply for '" + name + "'");
            }
            return reply;
        }

        @Override
        public Void visitSequence(ExecutionStep.SequenceStep step) {
            for (ExecutionStep child : step.children()) {
                execute(child, frame);
            }
            return null;
        }

        @Override
        public Void visitParallel(ExecutionStep.ParallelStep step) {
            List<Frame> branches = new ArrayList<>();
            List<Future<?>> futures = new ArrayList<>();
            for (ExecutionStep child : step.children()) {
                Frame branch = frame.branch();
                branches.add(branch);
                futures.add(executor.submit(() -> runBranch(child, branch)));
            }

            StepExecutionException failure = null;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    await(futures.get(i), step.name(), null);
                } catch (StepExecutionException e) {
                    if (failure == null) {
                        failure = e;
                    }
                }
                Frame branch = branches.get(i);
                if (branch.finished) {
                    frame.absorb(branch);
                } else {
                    branch.token.cancel();
                }
            }
            if (failure != null) {
                throw failure;
            }
            return null;
        }

        @Override
        public Void visitLoop(ExecutionStep.LoopStep step) {
            for (int iteration = 1; iteration <= step.maxIterations(); iteration++) {
                for (ExecutionStep child : step.children()) {
                    if (child instanceof ExecutionStep.CheckpointStep checkpoint) {
                        if (evaluate(checkpoint.predicate(), step.name(), frame.state)) {
                            logger.fine(
                                    "Loop '" + step.name() + "' exited after " + iteration
                                            + " iteration(s)");
                            return null;
                        }
                    } else {
                        execute(child, frame);
                    }
                }
            }
            return null;
        }

        @Override
        public Void visitCheckpoint(ExecutionStep.CheckpointStep step) {
            throw new IllegalStateException(
                    "Checkpoint of loop '" + step.loopName() + "' only runs inside its loop");
        }

        @Override
        public Void visitRoute(ExecutionStep.RouteStep step) {
            for (ExecutionStep.Branch branch : step.branches()) {
                if (evaluate(branch.matcher(), step.name(), frame.state)) {
                    logger.fine("Route '" + step.name() + "' took " + branch.label());
                    execute(branch.step(), frame);
                    return null;
                }
            }
            if (step.defaultStep() != null) {
                logger.fine("Route '" + step.name() + "' took default branch");
                execute(step.defaultStep(), frame);
                return null;
            }
            Object dispatchValue =
                    step.dispatchKey() != null ? frame.state.get(step.dispatchKey()) : null;
            throw new RouteResolutionException(step.name(), dispatchValue);
        }

        @Override
        public Void visitFallback(ExecutionStep.FallbackStep step) {
            StepExecutionException lastFailure = null;
            for (ExecutionStep child : step.children()) {
                Frame attempt = frame.branch();
                try {
                    execute(child, attempt);
                    frame.absorb(attempt);
                    return null;
                } catch (StepExecutionException e) {
                    if (frame.token.isCancelled()) {
                        throw e;
                    }
                    lastFailure = e;
                    logger.info(
                            "Fallback '" + step.name() + "': '" + child.name() + "' failed ["
                                    + e.getErrorType() + "], trying next alternative");
                }
            }
            throw lastFailure;
        }

        @Override
        public Void visitRace(ExecutionStep.RaceStep step) {
            ExecutorCompletionService<Frame> completion = new ExecutorCompletionService<>(executor);
            List<Frame> branches = new ArrayList<>();
            List<Future<Frame>> futures = new ArrayList<>();
            for (ExecutionStep child : step.children()) {
                Frame branch = frame.branch();
                branches.add(branch);
                futures.add(completion.submit(() -> {
                    runBranch(child, branch);
                    return branch;
                }));
            }

            try {
                Future<Frame> first;
                try {
                    first = completion.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new StepExecutionException(
                            step.name(), ErrorType.CANCELLED, "Race '" + step.name() + "' interrupted", e);
                }
                // First completion decides, failure included.
                frame.absorb(await(first, step.name(), null));
                return null;
            } finally {
                branches.forEach(branch -> branch.token.cancel());
                futures.forEach(future -> future.cancel(true));
            }
        }

        @Override
        public Void visitTimeout(ExecutionStep.TimeoutStep step) {
            Frame branch = frame.branch();
            Future<?> future = executor.submit(() -> runBranch(step.child(), branch));
            try {
                await(future, step.name(), step.duration());
            } catch (StepTimeoutException e) {
                branch.token.cancel();
                logger.warning("Step '" + step.child().name() + "' exceeded " + step.duration());
                throw e;
            } catch (StepExecutionException e) {
                if (branch.finished) {
                    frame.absorb(branch);
                }
                throw e;
            }
            frame.absorb(branch);
            return null;
        }

        @Override
        public Void visitMapOver(ExecutionStep.MapOverStep step) {
            Object items = frame.state.get(step.listKey());
            if (!(items instanceof Collection<?> collection)) {
                throw new StepExecutionException(
                        step.name(),
                        ErrorType.INVALID_STATE,
                        "Map-over '" + step.name() + "' expects a list at '" + step.listKey()
                                + "', found " + (items == null ? "nothing" : items.getClass().getSimpleName()));
            }

            List<Object> results = new ArrayList<>();
            for (Object item : new ArrayList<>(collection)) {
                frame.state.put(step.itemKey(), item);
                frame.state.remove(StateKeys.LAST_OUTPUT);
                execute(step.child(), frame);
                results.add(frame.state.get(StateKeys.LAST_OUTPUT));
                frame.state.put(step.outputKey(), Collections.unmodifiableList(new ArrayList<>(results)));
            }
            frame.state.remove(step.itemKey());
            frame.state.put(step.outputKey(), Collections.unmodifiableList(results));
            return null;
        }

        @Override
        public Void visitTransform(ExecutionStep.TransformStep step) {
            StateUpdate update;
            try {
                update = step.node().function().apply(StateMaps.copyOf(frame.state));
            } catch (RuntimeException e) {
                throw new StepExecutionException(
                        step.name(),
                        ErrorType.INVALID_STATE,
                        "Transform '" + step.name() + "' failed: " + describe(e),
                        e);
            }
            if (update != null) {
                update.applyTo(frame.state);
            }
            return null;
        }

        @Override
        public Void visitTap(ExecutionStep.TapStep step) {
            step.node().observer().observe(StateMaps.copyOf(frame.state));
            return null;
        }

        @Override
        public Void visitExpect(ExecutionStep.ExpectStep step) {
            if (!evaluate(step.node().predicate(), step.name(), frame.state)) {
                throw new ExpectationFailedException(step.name(), step.node().message());
            }
            return null;
        }

        @Override
        public Void visitGate(ExecutionStep.GateStep step) {
            GateNode gate = step.node();
            if (Boolean.TRUE.equals(frame.state.get(gate.gateKey()))) {
                frame.state.remove(gate.pendingKey());
                return null;
            }
            if (evaluate(gate.predicate(), gate.name(), frame.state)) {
                frame.state.put(gate.pendingKey(), Boolean.TRUE);
                logger.info("Gate '" + gate.name() + "' awaiting approval via '" + gate.gateKey() + "'");
                throw new ApprovalRequiredException(gate.name(), gate.gateKey(), gate.message());
            }
            return null;
        }

        private void runBranch(ExecutionStep child, Frame branch) {
            try {
                execute(child, branch);
            } finally {
                branch.finished = true;
            }
        }
    }
}
