package io.pipewright.core.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.pipewright.core.algebra.Agent;
import io.pipewright.core.algebra.Flow;
import io.pipewright.core.algebra.Flows;
import io.pipewright.core.algebra.Route;
import io.pipewright.core.algebra.StateTransforms;
import io.pipewright.core.backend.mock.MockBackend;
import io.pipewright.core.execution.AgentEvent;
import io.pipewright.core.execution.ErrorType;
import io.pipewright.core.execution.ExecutionError;
import io.pipewright.core.execution.ExecutionListener;
import io.pipewright.core.execution.ExecutionResult;
import io.pipewright.core.execution.ExitStatus;
import io.pipewright.core.ir.Node;
import io.pipewright.core.lowering.ExecutionGraph;
import io.pipewright.core.lowering.ExecutionStep;
import io.pipewright.core.lowering.GraphLowerer;
import io.pipewright.core.state.StateKeys;
import io.pipewright.core.state.StatePredicate;
import io.pipewright.core.template.SimpleTemplateResolver;
import io.pipewright.core.visibility.VisibilityInference;
import io.pipewright.core.visibility.VisibilityPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("LocalBackend")
@ExtendWith(MockitoExtension.class)
class LocalBackendTest {

    private ExecutorService executor;

    @Mock private AgentInvoker invoker;
    @Mock private ExecutionListener listener;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ExecutionResult runMock(Flow flow, Map<String, ?> responses, Map<String, Object> state) {
        return new MockBackend(responses, executor).run(GraphLowerer.lower(flow.toIr()), state);
    }

    private ExecutionResult runMock(Flow flow, Map<String, ?> responses) {
        return runMock(flow, responses, Map.of());
    }

    private ExecutionResult runWith(AgentInvoker agentInvoker, Flow flow, Map<String, Object> state) {
        return new LocalBackend(agentInvoker, executor).run(GraphLowerer.lower(flow.toIr()), state);
    }

    /// Replies after the configured delay; interrupted calls report an error.
    private static AgentInvoker delayed(Map<String, Long> delaysMillis) {
        return request -> {
            try {
                Thread.sleep(delaysMillis.getOrDefault(request.agentName(), 0L));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return AgentReply.Error.of("interrupted");
            }
            return AgentReply.Text.of(request.agentName() + " done");
        };
    }

    @Nested
    @DisplayName("Agents and sequences")
    class AgentTest {

        @Test
        void shouldWriteOutputKeyAndLastOutput() {
            // GIVEN
            Flow flow = Agent.named("a").outputs("draft").then(Agent.named("b").outputs("review"));

            // WHEN
            ExecutionResult result = runMock(flow, Map.of("a", "first draft", "b", "looks good"));

            // THEN
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.exitStatus()).isEqualTo(ExitStatus.COMPLETED);
            assertThat(result.outputState())
                    .containsEntry("draft", "first draft")
                    .containsEntry("review", "looks good")
                    .containsEntry(StateKeys.LAST_OUTPUT, "looks good");
            assertThat(result.finalText()).contains("looks good");
        }

        @Test
        void shouldResolveInstructionPlaceholdersFromState() {
            // GIVEN
            when(invoker.invoke(any())).thenReturn(AgentReply.Text.of("ok"));

            // WHEN
            runWith(invoker, Agent.named("writer").instruct("Write about {topic}"), Map.of("topic", "tides"));

            // THEN
            verify(invoker).invoke(argThat(request -> request.instruction().equals("Write about tides")
                    && request.agentName().equals("writer")
                    && "tides".equals(request.state().get("topic"))));
        }

        @Test
        void shouldMergeStateDeltaReply() {
            ExecutionResult result = runMock(Agent.named("a"), Map.of("a", Map.of("score", 9, "label", "high")));

            assertThat(result.outputState()).containsEntry("score", 9).containsEntry("label", "high");
            assertThat(result.outputState().get(StateKeys.LAST_OUTPUT)).isEqualTo(Map.of("score", 9, "label", "high"));
        }

        @Test
        void shouldReportBackendErrorForFailedReply() {
            ExecutionResult result =
                    runMock(Agent.named("a").then(Agent.named("b")), Map.of("a", new IllegalStateException("quota exceeded"), "b", "never"));

            assertThat(result.exitStatus()).isEqualTo(ExitStatus.FAILED);
            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.step()).isEqualTo("a");
                assertThat(error.type()).isEqualTo(ErrorType.BACKEND);
                assertThat(error.message()).isEqualTo("quota exceeded");
            });
            assertThat(result.outputState()).doesNotContainKey(StateKeys.LAST_OUTPUT);
            assertThat(result.events()).last().satisfies(event -> assertThat(event.error()).isTrue());
        }

        @Test
        void shouldWrapInvokerExceptionAsBackendError() {
            when(invoker.invoke(any())).thenThrow(new IllegalArgumentException("bad request"));

            ExecutionResult result = runWith(invoker, Agent.named("a"), Map.of());

            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.type()).isEqualTo(ErrorType.BACKEND);
                assertThat(error.message()).contains("bad request");
            });
        }

        @Test
        void shouldEnforcePerAgentDeadline() {
            LocalBackend backend =
                    new LocalBackend(
                            delayed(Map.of("slow", 5_000L)),
                            executor,
                            ExecutionListener.NOOP,
                            new SimpleTemplateResolver(),
                            Duration.ofMillis(100));

            ExecutionResult result = backend.run(GraphLowerer.lower(Agent.named("slow").toIr()), Map.of());

            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.step()).isEqualTo("slow");
                assertThat(error.type()).isEqualTo(ErrorType.TIMEOUT);
            });
        }

        @Test
        void shouldNotModifyCallerState() {
            Map<String, Object> input = new HashMap<>(Map.of("topic", "x"));

            runMock(Agent.named("a").outputs("out"), Map.of("a", "reply"), input);

            assertThat(input).containsOnlyKeys("topic");
        }
    }

    @Nested
    @DisplayName("Visibility policies")
    class VisibilityTest {

        private final Flow flow = Agent.named("a").then(Agent.named("b"));

        private ExecutionResult run(VisibilityPolicy policy) {
            Node root = flow.toIr();
            ExecutionGraph graph =
                    GraphLowerer.lower(root, VisibilityInference.infer(root, false, policy), policy);
            return new MockBackend(Map.of("a", "internal", "b", "final"), executor).run(graph, Map.of());
        }

        @Test
        void shouldDropInternalEventsWhenFiltered() {
            ExecutionResult result = run(VisibilityPolicy.FILTERED);

            assertThat(result.events()).extracting(AgentEvent::author).containsExactly("b");
            assertThat(result.finalText()).contains("final");
        }

        @Test
        void shouldTagButKeepInternalEventsWhenAnnotating() {
            ExecutionResult result = run(VisibilityPolicy.ANNOTATE);

            assertThat(result.events()).extracting(AgentEvent::author).containsExactly("a", "b");
            assertThat(result.events()).extracting(AgentEvent::userFacing).containsExactly(false, true);
        }

        @Test
        void shouldExposeEveryEventWhenTransparent() {
            ExecutionResult result = run(VisibilityPolicy.TRANSPARENT);

            assertThat(result.events()).extracting(AgentEvent::userFacing).containsExactly(true, true);
        }

        @Test
        void shouldKeepErrorEventsWhenFiltered() {
            ExecutionResult result =
                    runMock(Agent.named("a").then(Agent.named("b")), Map.of("a", new RuntimeException("boom")));

            assertThat(result.events()).singleElement().satisfies(event -> {
                assertThat(event.error()).isTrue();
                assertThat(event.author()).isEqualTo("a");
            });
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTest {

        @Test
        void shouldMergeParallelWritesInDeclarationOrder() {
            // GIVEN
            Flow flow =
                    Agent.named("a").outputs("answer")
                            .fanOut(Agent.named("b").outputs("answer"))
                            .fanOut(Agent.named("c").outputs("c_out"));

            // WHEN
            ExecutionResult result =
                    runWith(delayed(Map.of("b", 0L, "a", 200L, "c", 50L)), flow, Map.of());

            // THEN
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.outputState())
                    .containsEntry("answer", "b done")
                    .containsEntry("c_out", "c done")
                    .containsEntry(StateKeys.LAST_OUTPUT, "c done");
        }

        @Test
        void shouldRunParallelBranchesOnIsolatedCopies() {
            Flow flow =
                    StateTransforms.set(Map.of("shared", "left")).fanOut(Flows.tap("observer", state -> {
                        if (state.containsKey("shared")) {
                            throw new IllegalStateException("branch saw sibling write");
                        }
                    }));

            ExecutionResult result = runMock(flow, Map.of());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.outputState()).containsEntry("shared", "left");
        }

        @Test
        void shouldKeepFinishedBranchesWhenOneFails() {
            Flow flow = Agent.named("a").outputs("a_out").fanOut(Agent.named("b"));

            ExecutionResult result = runMock(flow, Map.of("a", "fine", "b", new RuntimeException("down")));

            assertThat(result.errors()).extracting(ExecutionError::step).containsExactly("b");
            assertThat(result.outputState()).containsEntry("a_out", "fine");
        }

        @Test
        void shouldKeepOnlyFirstRaceWinner() {
            // GIVEN
            Flow flow =
                    Flows.race(Agent.named("slow").outputs("slow_out"), Agent.named("fast").outputs("fast_out"));

            // WHEN
            ExecutionResult result =
                    runWith(delayed(Map.of("slow", 5_000L, "fast", 10L)), flow, Map.of());

            // THEN
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.outputState()).containsEntry("fast_out", "fast done").doesNotContainKey("slow_out");
        }

        @Test
        void shouldLetFirstFinisherDecideRaceEvenWhenItFails() {
            // GIVEN
            AgentInvoker fastFailure = request -> {
                if (request.agentName().equals("fast")) {
                    return AgentReply.Error.of("fast branch failed");
                }
                return delayed(Map.of("slow", 300L)).invoke(request);
            };
            Flow flow = Flows.race(Agent.named("fast").outputs("out"), Agent.named("slow").outputs("out"));

            // WHEN
            ExecutionResult result = runWith(fastFailure, flow, Map.of());

            // THEN
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.step()).isEqualTo("fast");
                assertThat(error.message()).isEqualTo("fast branch failed");
            });
            assertThat(result.outputState()).doesNotContainKey("out");
        }

        @Test
        void shouldFailRaceWhenEveryContestantFails() {
            Flow flow = Flows.race(Agent.named("a"), Agent.named("b"));

            ExecutionResult result =
                    runMock(flow, Map.of("a", new RuntimeException("a down"), "b", new RuntimeException("b down")));

            assertThat(result.errors()).singleElement().satisfies(error -> assertThat(error.type()).isEqualTo(ErrorType.BACKEND));
        }

        @Test
        void shouldTimeOutSlowBody() {
            Flow flow = Agent.named("slow").outputs("out").timeout(Duration.ofMillis(100));

            ExecutionResult result = runWith(delayed(Map.of("slow", 5_000L)), flow, Map.of());

            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.step()).isEqualTo("timeout_slow");
                assertThat(error.type()).isEqualTo(ErrorType.TIMEOUT);
            });
            assertThat(result.outputState()).doesNotContainKey("out");
        }

        @Test
        void shouldKeepBodyOutputWhenWithinDeadline() {
            Flow flow = Agent.named("quick").outputs("out").timeout(Duration.ofSeconds(5));

            ExecutionResult result = runWith(delayed(Map.of()), flow, Map.of());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.outputState()).containsEntry("out", "quick done");
        }
    }

    @Nested
    @DisplayName("Control flow")
    class ControlFlowTest {

        @Test
        void shouldTryFallbackAlternativesInOrder() {
            Flow flow = Agent.named("primary").outputs("out").fallback(Agent.named("backup").outputs("out"));

            ExecutionResult result =
                    runMock(flow, Map.of("primary", new RuntimeException("unavailable"), "backup", "from backup"));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.outputState()).containsEntry("out", "from backup");
            assertThat(result.events()).extracting(AgentEvent::author).containsExactly("backup");
        }

        @Test
        void shouldRaiseLastFailureWhenEveryAlternativeFails() {
            Flow flow = Agent.named("primary").fallback(Agent.named("backup"));

            ExecutionResult result =
                    runMock(flow, Map.of("primary", new RuntimeException("p"), "backup", new RuntimeException("b")));

            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.step()).isEqualTo("backup");
                assertThat(error.message()).isEqualTo("b");
            });
        }

        @Test
        void shouldRepeatFixedNumberOfTimes() {
            Flow flow = StateTransforms.compute("count", state -> (Integer) state.getOrDefault("count", 0) + 1).repeat(4);

            ExecutionResult result = runMock(flow, Map.of());

            assertThat(result.outputState()).containsEntry("count", 4);
        }

        @Test
        void shouldExitLoopWhenConditionHolds() {
            StatePredicate reachedThree = state -> (Integer) state.getOrDefault("count", 0) >= 3;
            Flow flow =
                    StateTransforms.compute("count", state -> (Integer) state.getOrDefault("count", 0) + 1)
                            .loopUntil(reachedThree, 10);

            ExecutionResult result = runMock(flow, Map.of());

            assertThat(result.outputState()).containsEntry("count", 3);
        }

        @Test
        void shouldStopAtIterationBoundWhenConditionNeverHolds() {
            Flow flow =
                    StateTransforms.compute("count", state -> (Integer) state.getOrDefault("count", 0) + 1)
                            .loopUntil(state -> false, 5);

            ExecutionResult result = runMock(flow, Map.of());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.outputState()).containsEntry("count", 5);
        }

        @Test
        void shouldTakeFirstMatchingRouteBranch() {
            Flow flow =
                    Route.on("kind")
                            .eq("bug", Agent.named("triage").outputs("handled_by"))
                            .contains("feat", Agent.named("planner").outputs("handled_by"))
                            .otherwise(Agent.named("inbox").outputs("handled_by"));
            Map<String, String> responses = Map.of("triage", "triage", "planner", "planner", "inbox", "inbox");

            assertThat(runMock(flow, responses, Map.of("kind", "bug")).outputState()).containsEntry("handled_by", "triage");
            assertThat(runMock(flow, responses, Map.of("kind", "feature")).outputState()).containsEntry("handled_by", "planner");
            assertThat(runMock(flow, responses, Map.of("kind", "other")).outputState()).containsEntry("handled_by", "inbox");
        }

        @Test
        void shouldFailUnresolvedRoute() {
            Flow flow = Route.on("kind").eq("bug", Agent.named("triage"));

            ExecutionResult result = runMock(flow, Map.of("triage", "x"), Map.of("kind", "question"));

            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.step()).isEqualTo("route_kind");
                assertThat(error.type()).isEqualTo(ErrorType.ROUTE_UNRESOLVED);
            });
        }

        @Test
        void shouldSkipBodyWhenProceedConditionFails() {
            Flow flow = Agent.named("publisher").outputs("published").proceedIf(state -> Boolean.TRUE.equals(state.get("approved")));

            ExecutionResult skipped = runMock(flow, Map.of("publisher", "yes"), Map.of("approved", false));
            ExecutionResult taken = runMock(flow, Map.of("publisher", "yes"), Map.of("approved", true));

            assertThat(skipped.isSuccess()).isTrue();
            assertThat(skipped.outputState()).doesNotContainKey("published");
            assertThat(taken.outputState()).containsEntry("published", "yes");
        }

        @Test
        void shouldReportPredicateFailure() {
            Flow flow = Route.keyless().when(state -> {
                throw new IllegalStateException("broken predicate");
            }, Agent.named("a")).otherwise(Agent.named("b"));

            ExecutionResult result = runMock(flow, Map.of("a", "x", "b", "y"));

            assertThat(result.errors()).singleElement().satisfies(error -> assertThat(error.type()).isEqualTo(ErrorType.PREDICATE));
        }
    }

    @Nested
    @DisplayName("Map-over")
    class MapOverTest {

        @Test
        void shouldCollectOneResultPerItemInOrder() {
            // GIVEN
            when(invoker.invoke(any())).thenAnswer(invocation -> {
                AgentRequest request = invocation.getArgument(0);
                return AgentReply.Text.of("summary of " + request.state().get("doc"));
            });
            Flow flow = Flows.mapOver("docs", "doc", "summaries", Agent.named("summariser").instruct("Summarise {doc}"));

            // WHEN
            ExecutionResult result = runWith(invoker, flow, Map.of("docs", List.of("a.txt", "b.txt")));

            // THEN
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.outputState().get("summaries")).isEqualTo(List.of("summary of a.txt", "summary of b.txt"));
            assertThat(result.outputState()).doesNotContainKey("doc");
        }

        @Test
        void shouldProduceEmptyResultsForEmptyList() {
            ExecutionResult result =
                    runMock(Flows.mapOver("docs", Agent.named("a")), Map.of("a", "x"), Map.of("docs", List.of()));

            assertThat(result.outputState().get("results")).isEqualTo(Collections.emptyList());
        }

        @Test
        void shouldRejectNonListValue() {
            ExecutionResult result =
                    runMock(Flows.mapOver("docs", Agent.named("a")), Map.of("a", "x"), Map.of("docs", "not a list"));

            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.type()).isEqualTo(ErrorType.INVALID_STATE);
                assertThat(error.message()).contains("String");
            });
        }
    }

    @Nested
    @DisplayName("Transforms, assertions and gates")
    class ZeroCostStepTest {

        @Test
        void shouldApplyTransformsWithoutEvents() {
            Flow flow =
                    StateTransforms.set(Map.of("a", 1, "b", 2))
                            .then(StateTransforms.rename(Map.of("a", "alpha")))
                            .then(StateTransforms.drop("b"));

            ExecutionResult result = runMock(flow, Map.of());

            assertThat(result.outputState()).containsOnlyKeys("alpha");
            assertThat(result.events()).isEmpty();
        }

        @Test
        void shouldReportFailedGuardAsInvalidState() {
            ExecutionResult result =
                    runMock(StateTransforms.guard(state -> state.containsKey("id"), "id required"), Map.of());

            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.step()).isEqualTo("guard");
                assertThat(error.type()).isEqualTo(ErrorType.INVALID_STATE);
                assertThat(error.message()).contains("id required");
            });
        }

        @Test
        void shouldPassStateSnapshotToTap() {
            List<Object> seen = new ArrayList<>();
            Flow flow = Agent.named("a").outputs("out").then(Flows.tap("audit", state -> seen.add(state.get("out"))));

            ExecutionResult result = runMock(flow, Map.of("a", "reply"));

            assertThat(seen).containsExactly("reply");
            assertThat(result.isSuccess()).isTrue();
        }

        @Test
        void shouldFailExpectationWithMessage() {
            Flow flow = Agent.named("a").outputs("out").expect(state -> "yes".equals(state.get("out")), "answer must be yes");

            ExecutionResult result = runMock(flow, Map.of("a", "no"));

            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.type()).isEqualTo(ErrorType.EXPECTATION);
                assertThat(error.message()).isEqualTo("answer must be yes");
            });
        }

        @Test
        void shouldPauseAtGateUntilApproved() {
            // GIVEN
            Flow flow =
                    Agent.named("drafter").outputs("draft")
                            .then(Flows.gate("review", state -> true, "Needs review", "approved"))
                            .then(Agent.named("publisher").outputs("published"));
            Map<String, String> responses = Map.of("drafter", "text", "publisher", "live");

            // WHEN
            ExecutionResult paused = runMock(flow, responses);

            // THEN
            assertThat(paused.exitStatus()).isEqualTo(ExitStatus.PAUSED);
            assertThat(paused.errors()).singleElement().satisfies(error -> {
                assertThat(error.type()).isEqualTo(ErrorType.APPROVAL_REQUIRED);
                assertThat(error.message()).isEqualTo("Needs review");
            });
            assertThat(paused.outputState())
                    .containsEntry("approved_pending", true)
                    .containsEntry("draft", "text")
                    .doesNotContainKey("published");

            // WHEN
            Map<String, Object> resumed = new HashMap<>(paused.outputState());
            resumed.put("approved", true);
            ExecutionResult approved = runMock(flow, responses, resumed);

            // THEN
            assertThat(approved.isSuccess()).isTrue();
            assertThat(approved.outputState())
                    .containsEntry("published", "live")
                    .doesNotContainKey("approved_pending");
        }

        @Test
        void shouldPassGateWhenPredicateDoesNotHold() {
            Flow flow = Flows.gate(state -> false, "Needs sign-off", "signed_off").then(Agent.named("a").outputs("out"));

            ExecutionResult result = runMock(flow, Map.of("a", "done"));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.outputState()).containsEntry("out", "done").doesNotContainKey("signed_off_pending");
        }
    }

    @Nested
    @DisplayName("Listener")
    class ListenerTest {

        @Test
        void shouldNotifyAgentAndStepLifecycle() {
            // GIVEN
            when(invoker.invoke(any())).thenReturn(AgentReply.Text.of("hi"));
            LocalBackend backend =
                    new LocalBackend(invoker, executor, listener, new SimpleTemplateResolver(), null);
            ExecutionGraph graph = GraphLowerer.lower(Agent.named("greeter").instruct("Greet {name}").toIr());

            // WHEN
            backend.run(graph, Map.of("name", "Ada"));

            // THEN
            verify(listener).onStepStart(graph.root());
            verify(listener).onAgentStart("greeter", "Greet Ada");
            verify(listener).onAgentComplete(eq("greeter"), argThat(event -> event.content().equals("hi")));
            verify(listener).onStepComplete(graph.root());
            verify(listener, never()).onStepFailed(any(), any());
        }

        @Test
        void shouldNotifyFailedStepOnce() {
            // GIVEN
            LocalBackend backend =
                    new LocalBackend(invoker, executor, listener, new SimpleTemplateResolver(), null);
            ExecutionGraph graph = GraphLowerer.lower(Flows.expect(state -> false, "nope").then(Flows.tap(state -> {})).toIr());

            // WHEN
            backend.run(graph, Map.of());

            // THEN
            verify(listener).onStepFailed(
                    argThat((ExecutionStep step) -> step.name().equals("expect")),
                    argThat((ExecutionError error) -> error.type() == ErrorType.EXPECTATION));
            verify(listener, never()).onStepComplete(any());
        }
    }
}
