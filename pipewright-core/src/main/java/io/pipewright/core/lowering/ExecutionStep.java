package io.pipewright.core.lowering;

import io.pipewright.core.ir.AgentNode;
import io.pipewright.core.ir.ExpectNode;
import io.pipewright.core.ir.GateNode;
import io.pipewright.core.ir.TapNode;
import io.pipewright.core.ir.TransformNode;
import io.pipewright.core.state.StatePredicate;
import io.pipewright.core.visibility.Visibility;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Backend-native unit of work produced by {@link GraphLowerer}.
///
/// Each IR node lowers to exactly one step. Loops with an until-predicate additionally
/// carry a synthetic {@link CheckpointStep} as their last child; synthetic children are
/// excluded from {@link #structuralChildCount()}, so the structural shape always equals
/// the IR shape.
///
/// @see StepVisitor
public sealed interface ExecutionStep
        permits ExecutionStep.AgentStep,
                ExecutionStep.SequenceStep,
                ExecutionStep.ParallelStep,
                ExecutionStep.LoopStep,
                ExecutionStep.CheckpointStep,
                ExecutionStep.RouteStep,
                ExecutionStep.FallbackStep,
                ExecutionStep.RaceStep,
                ExecutionStep.TimeoutStep,
                ExecutionStep.MapOverStep,
                ExecutionStep.TransformStep,
                ExecutionStep.TapStep,
                ExecutionStep.ExpectStep,
                ExecutionStep.GateStep {

    /// Name of the synthetic checkpoint appended to loops with an until-predicate.
    String CHECKPOINT_NAME = "_until_check";

    String name();

    /// Returns all native children, synthetic ones included.
    ///
    /// @return immutable child list, never null
    default List<ExecutionStep> children() {
        return List.of();
    }

    /// Returns whether the step has no IR counterpart.
    default boolean synthetic() {
        return false;
    }

    /// Returns the number of non-synthetic children.
    ///
    /// @return child count matching the source node's `children().size()`
    default int structuralChildCount() {
        return (int) children().stream().filter(child -> !child.synthetic()).count();
    }

    /// Returns a short kind label for logs and listeners.
    default String kind() {
        String simple = getClass().getSimpleName();
        return simple.endsWith("Step") ? simple.substring(0, simple.length() - 4) : simple;
    }

    <R> R accept(StepVisitor<R> visitor);

    /// Invokes one agent.
    ///
    /// @param node source agent, not null
    /// @param visibility inferred visibility tier, not null
    record AgentStep(AgentNode node, Visibility visibility) implements ExecutionStep {

        public AgentStep {
            Objects.requireNonNull(node, "node must not be null");
            Objects.requireNonNull(visibility, "visibility must not be null");
        }

        @Override
        public String name() {
            return node.name();
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitAgent(this);
        }
    }

    record SequenceStep(String name, List<ExecutionStep> children) implements ExecutionStep {

        public SequenceStep {
            Objects.requireNonNull(name, "name must not be null");
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitSequence(this);
        }
    }

    /// Runs children concurrently on state copies and merges their writes in declaration
    /// order.
    record ParallelStep(String name, List<ExecutionStep> children) implements ExecutionStep {

        public ParallelStep {
            Objects.requireNonNull(name, "name must not be null");
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitParallel(this);
        }
    }

    /// Repeats its body; a trailing {@link CheckpointStep} ends the loop early.
    ///
    /// @param name loop name, not null
    /// @param children body steps followed by the optional checkpoint, not null
    /// @param maxIterations upper bound on passes
    record LoopStep(String name, List<ExecutionStep> children, int maxIterations)
            implements ExecutionStep {

        public LoopStep {
            Objects.requireNonNull(name, "name must not be null");
            children = List.copyOf(children);
        }

        public boolean hasCheckpoint() {
            return !children.isEmpty() && children.get(children.size() - 1).synthetic();
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitLoop(this);
        }
    }

    /// Evaluates a loop's until-predicate after each full pass.
    ///
    /// @param loopName name of the owning loop, not null
    /// @param predicate exit condition, not null
    record CheckpointStep(String loopName, StatePredicate predicate) implements ExecutionStep {

        public CheckpointStep {
            Objects.requireNonNull(loopName, "loopName must not be null");
            Objects.requireNonNull(predicate, "predicate must not be null");
        }

        @Override
        public String name() {
            return CHECKPOINT_NAME;
        }

        @Override
        public boolean synthetic() {
            return true;
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitCheckpoint(this);
        }
    }

    /// One lowered route rule.
    record Branch(String label, StatePredicate matcher, ExecutionStep step) {

        public Branch {
            Objects.requireNonNull(label, "label must not be null");
            Objects.requireNonNull(matcher, "matcher must not be null");
            Objects.requireNonNull(step, "step must not be null");
        }
    }

    /// First matching branch wins; the default runs otherwise.
    ///
    /// @param name route name, not null
    /// @param dispatchKey key compared by key-based rules, may be null
    /// @param branches ordered rules, not null
    /// @param defaultStep fallback branch, may be null
    record RouteStep(String name, String dispatchKey, List<Branch> branches, ExecutionStep defaultStep)
            implements ExecutionStep {

        public RouteStep {
            Objects.requireNonNull(name, "name must not be null");
            branches = List.copyOf(branches);
        }

        @Override
        public List<ExecutionStep> children() {
            List<ExecutionStep> steps = new ArrayList<>(branches.size() + 1);
            branches.forEach(branch -> steps.add(branch.step()));
            if (defaultStep != null) {
                steps.add(defaultStep);
            }
            return List.copyOf(steps);
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitRoute(this);
        }
    }

    /// Tries children in order; the first success wins.
    record FallbackStep(String name, List<ExecutionStep> children) implements ExecutionStep {

        public FallbackStep {
            Objects.requireNonNull(name, "name must not be null");
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitFallback(this);
        }
    }

    /// Runs children concurrently; the first completion wins and the rest are cancelled.
    record RaceStep(String name, List<ExecutionStep> children) implements ExecutionStep {

        public RaceStep {
            Objects.requireNonNull(name, "name must not be null");
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitRace(this);
        }
    }

    record TimeoutStep(String name, ExecutionStep child, Duration duration) implements ExecutionStep {

        public TimeoutStep {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(child, "child must not be null");
            Objects.requireNonNull(duration, "duration must not be null");
        }

        @Override
        public List<ExecutionStep> children() {
            return List.of(child);
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitTimeout(this);
        }
    }

    record MapOverStep(String name, String listKey, String itemKey, String outputKey, ExecutionStep child)
            implements ExecutionStep {

        public MapOverStep {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(listKey, "listKey must not be null");
            Objects.requireNonNull(itemKey, "itemKey must not be null");
            Objects.requireNonNull(outputKey, "outputKey must not be null");
            Objects.requireNonNull(child, "child must not be null");
        }

        @Override
        public List<ExecutionStep> children() {
            return List.of(child);
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitMapOver(this);
        }
    }

    record TransformStep(TransformNode node) implements ExecutionStep {

        public TransformStep {
            Objects.requireNonNull(node, "node must not be null");
        }

        @Override
        public String name() {
            return node.name();
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitTransform(this);
        }
    }

    record TapStep(TapNode node) implements ExecutionStep {

        public TapStep {
            Objects.requireNonNull(node, "node must not be null");
        }

        @Override
        public String name() {
            return node.name();
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitTap(this);
        }
    }

    record ExpectStep(ExpectNode node) implements ExecutionStep {

        public ExpectStep {
            Objects.requireNonNull(node, "node must not be null");
        }

        @Override
        public String name() {
            return node.name();
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitExpect(this);
        }
    }

    record GateStep(GateNode node) implements ExecutionStep {

        public GateStep {
            Objects.requireNonNull(node, "node must not be null");
        }

        @Override
        public String name() {
            return node.name();
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitGate(this);
        }
    }
}
