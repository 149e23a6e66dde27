package io.pipewright.core.contract;

import static org.assertj.core.api.Assertions.assertThat;

import io.pipewright.core.algebra.Agent;
import io.pipewright.core.algebra.Flow;
import io.pipewright.core.algebra.Flows;
import io.pipewright.core.algebra.Route;
import io.pipewright.core.algebra.StateTransforms;
import io.pipewright.core.ir.Schema;
import io.pipewright.core.state.StatePredicate;
import io.pipewright.core.visibility.VisibilityPolicy;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ContractChecker")
class ContractCheckerTest {

    private final ContractChecker checker = new ContractChecker();

    private List<ContractIssue> check(Flow flow, String... initialKeys) {
        return checker.check(flow.toIr(), VisibilityPolicy.FILTERED, Set.of(initialKeys));
    }

    private static List<ContractIssue> inPass(List<ContractIssue> issues, CheckPass pass) {
        return issues.stream().filter(issue -> issue.pass() == pass).toList();
    }

    @Test
    void shouldReportIssuesInPassOrder() {
        // GIVEN
        Flow flow =
                Agent.named("a").instruct("Summarise {topic}").outputs("summary")
                        .then(Agent.named("b").hide());

        // WHEN
        List<ContractIssue> issues = check(flow);

        // THEN
        assertThat(issues).isNotEmpty();
        assertThat(issues).extracting(ContractIssue::pass).isSortedAccordingTo(Comparator.naturalOrder());
    }

    @Test
    void shouldAcceptWellFormedPipeline() {
        Flow flow =
                Agent.named("researcher").instruct("Research {topic}").outputs("notes")
                        .then(Agent.named("writer").instruct("Write from {notes}"));

        assertThat(check(flow, "topic")).isEmpty();
    }

    @Nested
    @DisplayName("Template variables")
    class TemplateVariableTest {

        @Test
        void shouldFlagReadOfKeyNoUpstreamStepWrites() {
            List<ContractIssue> issues = check(Agent.named("writer").instruct("Write about {topic}"));

            List<ContractIssue> errors = inPass(issues, CheckPass.TEMPLATE_VARS);
            assertThat(errors).hasSize(1);
            assertThat(errors.get(0).isError()).isTrue();
            assertThat(errors.get(0).node()).isEqualTo("writer");
            assertThat(errors.get(0).message()).contains("{topic}");
        }

        @Test
        void shouldAcceptKeyFromInitialState() {
            assertThat(inPass(check(Agent.named("writer").instruct("Write about {topic}"), "topic"), CheckPass.TEMPLATE_VARS))
                    .isEmpty();
        }

        @Test
        void shouldIgnoreOptionalPlaceholders() {
            assertThat(inPass(check(Agent.named("writer").instruct("Write about {topic?}")), CheckPass.TEMPLATE_VARS))
                    .isEmpty();
        }

        @Test
        void shouldKeepOnlyKeysEveryRouteBranchWrites() {
            // GIVEN
            Flow flow =
                    Route.on("kind")
                            .eq("long", Agent.named("longform").outputs("draft"))
                            .otherwise(Agent.named("shortform"))
                            .then(Agent.named("editor").instruct("Edit {draft}"));

            // WHEN
            List<ContractIssue> issues = check(flow, "kind");

            // THEN
            assertThat(inPass(issues, CheckPass.TEMPLATE_VARS))
                    .extracting(ContractIssue::node)
                    .containsExactly("editor");
        }

        @Test
        void shouldMakeParallelWritesAvailableAfterBlock() {
            Flow flow =
                    Agent.named("a").outputs("x").fanOut(Agent.named("b").outputs("y"))
                            .then(Agent.named("c").instruct("{x} {y}"));

            assertThat(inPass(check(flow), CheckPass.TEMPLATE_VARS)).isEmpty();
        }

        @Test
        void shouldFollowTransformKeyEffects() {
            Flow flow =
                    Agent.named("a").outputs("draft")
                            .then(StateTransforms.rename(Map.of("draft", "text")))
                            .then(Agent.named("b").instruct("{draft} {text}"));

            assertThat(inPass(check(flow), CheckPass.TEMPLATE_VARS))
                    .singleElement()
                    .satisfies(issue -> assertThat(issue.message()).contains("{draft}"));
        }
    }

    @Nested
    @DisplayName("Output keys")
    class OutputKeyTest {

        @Test
        void shouldWarnWhenParallelBranchesWriteSameKey() {
            Flow flow = Agent.named("a").outputs("answer").fanOut(Agent.named("b").outputs("answer"));

            List<ContractIssue> warnings = inPass(check(flow), CheckPass.OUTPUT_KEYS);

            assertThat(warnings).hasSize(1);
            assertThat(warnings.get(0).isError()).isFalse();
            assertThat(warnings.get(0).node()).isEqualTo("a_and_b");
            assertThat(warnings.get(0).message()).contains("'answer'");
        }
    }

    @Nested
    @DisplayName("Channel duplication")
    class ChannelDuplicationTest {

        @Test
        void shouldWarnWhenKeyReachesAgentTwice() {
            Flow flow =
                    Agent.named("a").instruct("Review {draft}").withInputSchema(Schema.of("Input", "draft"));

            List<ContractIssue> warnings = inPass(check(flow, "draft"), CheckPass.CHANNEL_DUPLICATION);

            assertThat(warnings).singleElement().satisfies(issue -> {
                assertThat(issue.isError()).isFalse();
                assertThat(issue.node()).isEqualTo("a");
            });
        }
    }

    @Nested
    @DisplayName("Route keys")
    class RouteKeyTest {

        @Test
        void shouldFlagMissingDispatchKey() {
            Flow flow = Route.on("verdict").eq("yes", Agent.named("a")).otherwise(Agent.named("b"));

            List<ContractIssue> errors = inPass(check(flow), CheckPass.ROUTE_KEYS);

            assertThat(errors).singleElement().satisfies(issue -> {
                assertThat(issue.isError()).isTrue();
                assertThat(issue.node()).isEqualTo("route_verdict");
            });
        }

        @Test
        void shouldAcceptDispatchKeyWrittenUpstream() {
            Flow flow =
                    Agent.named("judge").outputs("verdict")
                            .then(Route.on("verdict").eq("yes", Agent.named("a")).otherwise(Agent.named("b")));

            assertThat(inPass(check(flow), CheckPass.ROUTE_KEYS)).isEmpty();
        }

        @Test
        void shouldFlagDeclaredPredicateReadsOnly() {
            StatePredicate declared = StatePredicate.reading(state -> true, "score");
            Flow flow =
                    Route.keyless().when(declared, Agent.named("a")).otherwise(Agent.named("b"))
                            .then(Flows.expect(state -> true));

            assertThat(inPass(check(flow), CheckPass.ROUTE_KEYS))
                    .singleElement()
                    .satisfies(issue -> assertThat(issue.message()).contains("'score'"));
        }

        @Test
        void shouldFlagMissingMapOverList() {
            List<ContractIssue> errors = inPass(check(Flows.mapOver("docs", Agent.named("a"))), CheckPass.ROUTE_KEYS);

            assertThat(errors).singleElement().satisfies(issue -> assertThat(issue.node()).isEqualTo("map_docs"));
        }

        @Test
        void shouldCheckLoopExitAgainstBodyWrites() {
            StatePredicate approved = StatePredicate.reading(state -> true, "verdict");
            StatePredicate unknown = StatePredicate.reading(state -> true, "mystery");

            Flow ok = Agent.named("critic").outputs("verdict").loopUntil(approved);
            Flow broken = Agent.named("critic").outputs("verdict").loopUntil(unknown);

            assertThat(inPass(check(ok), CheckPass.ROUTE_KEYS)).isEmpty();
            assertThat(inPass(check(broken), CheckPass.ROUTE_KEYS)).hasSize(1);
        }

        @Test
        void shouldCheckReusedStepAtEachPosition() {
            // GIVEN
            Flow draftReady = Flows.expect(StatePredicate.reading(state -> true, "draft"));
            Flow flow = draftReady.then(Agent.named("drafter").outputs("draft")).then(draftReady);

            // WHEN
            List<ContractIssue> errors = inPass(check(flow), CheckPass.ROUTE_KEYS);

            // THEN
            assertThat(flow.toIr().children().get(0)).isSameAs(flow.toIr().children().get(2));
            assertThat(errors).singleElement().satisfies(issue -> {
                assertThat(issue.node()).isEqualTo("expect");
                assertThat(issue.message()).contains("'draft'");
            });
        }

        @Test
        void shouldReportReusedStepMissingKeyAtEveryPosition() {
            Flow needsScore = Flows.expect(StatePredicate.reading(state -> true, "score"));
            Flow flow = needsScore.then(Agent.named("a").outputs("a_out")).then(needsScore);

            assertThat(inPass(check(flow), CheckPass.ROUTE_KEYS)).hasSize(2);
        }
    }

    @Nested
    @DisplayName("Data loss")
    class DataLossTest {

        @Test
        void shouldWarnWhenOutputIsNeverRead() {
            Flow flow = Agent.named("a").outputs("draft").then(Agent.named("b"));

            assertThat(inPass(check(flow), CheckPass.DATA_LOSS))
                    .singleElement()
                    .satisfies(issue -> {
                        assertThat(issue.node()).isEqualTo("a");
                        assertThat(issue.message()).contains("'draft'");
                    });
        }

        @Test
        void shouldNotCountReadOnSiblingParallelBranch() {
            Flow flow = Agent.named("a").outputs("x").fanOut(Agent.named("b").instruct("{x?}"));

            assertThat(inPass(check(flow), CheckPass.DATA_LOSS)).extracting(ContractIssue::node).containsExactly("a");
        }

        @Test
        void shouldCountReadInNextLoopIteration() {
            Flow flow =
                    Agent.named("writer").instruct("Revise {feedback?}").outputs("draft")
                            .then(Agent.named("critic").instruct("Critique {draft}").outputs("feedback"))
                            .repeat(3);

            assertThat(inPass(check(flow), CheckPass.DATA_LOSS)).isEmpty();
        }

        @Test
        void shouldCountReadByTransformAndRoute() {
            Flow flow =
                    Agent.named("a").outputs("label")
                            .then(Route.on("label").eq("x", Agent.named("b")).otherwise(Agent.named("c")));

            assertThat(inPass(check(flow), CheckPass.DATA_LOSS)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Visibility")
    class VisibilityTest {

        @Test
        void shouldWarnWhenHiddenTerminalAgentWritesNothing() {
            List<ContractIssue> warnings =
                    inPass(check(Agent.named("a").outputs("x").then(Agent.named("final_step").instruct("{x}").hide())), CheckPass.VISIBILITY);

            assertThat(warnings).singleElement().satisfies(issue -> {
                assertThat(issue.node()).isEqualTo("final_step");
                assertThat(issue.message()).contains("output is lost");
            });
        }

        @Test
        void shouldWarnWhenInternalAgentWritesNothingUnderFilteredPolicy() {
            Flow flow = Agent.named("a").then(Agent.named("b"));

            assertThat(inPass(check(flow), CheckPass.VISIBILITY))
                    .extracting(ContractIssue::node)
                    .containsExactly("a");
            assertThat(inPass(checker.check(flow.toIr(), VisibilityPolicy.TRANSPARENT), CheckPass.VISIBILITY))
                    .isEmpty();
        }

        @Test
        void shouldAcceptInternalAgentWithOutputKey() {
            Flow flow = Agent.named("a").outputs("x").then(Agent.named("b").instruct("{x}"));

            assertThat(inPass(check(flow), CheckPass.VISIBILITY)).isEmpty();
        }
    }
}
