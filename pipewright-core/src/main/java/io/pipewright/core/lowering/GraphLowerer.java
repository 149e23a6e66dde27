package io.pipewright.core.lowering;

import io.pipewright.core.ir.AgentNode;
import io.pipewright.core.ir.ExpectNode;
import io.pipewright.core.ir.FallbackNode;
import io.pipewright.core.ir.GateNode;
import io.pipewright.core.ir.LoopNode;
import io.pipewright.core.ir.MapOverNode;
import io.pipewright.core.ir.Node;
import io.pipewright.core.ir.NodeVisitor;
import io.pipewright.core.ir.ParallelNode;
import io.pipewright.core.ir.RaceNode;
import io.pipewright.core.ir.RouteNode;
import io.pipewright.core.ir.RouteRule;
import io.pipewright.core.ir.SequenceNode;
import io.pipewright.core.ir.TapNode;
import io.pipewright.core.ir.TimeoutNode;
import io.pipewright.core.ir.TransformNode;
import io.pipewright.core.visibility.Visibility;
import io.pipewright.core.visibility.VisibilityInference;
import io.pipewright.core.visibility.VisibilityPolicy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Lowers an IR tree into an {@link ExecutionGraph}.
///
/// ### Contracts
/// - **Postcondition**: one step per IR node, in the same order
/// - **Postcondition**: `structuralChildCount()` of every step equals `children().size()` of
///   its source node
/// - **Invariant**: the input tree is not modified
///
/// Fallback, race and timeout steps are named after what they wrap (`fallback_a_or_b`,
/// `race_a_vs_b`, `timeout_a`).
public final class GraphLowerer {

    private static final Logger logger = Logger.getLogger(GraphLowerer.class.getName());

    private GraphLowerer() {}

    /// Lowers with visibility inferred under the default policy.
    ///
    /// @param root IR root, not null
    /// @return execution graph, never null
    public static ExecutionGraph lower(Node root) {
        return lower(root, VisibilityInference.infer(root), VisibilityPolicy.FILTERED);
    }

    public static ExecutionGraph lower(Node root, Map<String, Visibility> visibility) {
        return lower(root, visibility, VisibilityPolicy.FILTERED);
    }

    /// Lowers the tree using the given visibility map.
    ///
    /// Agents missing from the map are treated as {@link Visibility#USER}.
    ///
    /// @param root IR root, not null
    /// @param visibility visibility per agent name, not null
    /// @param policy event policy for the backend, not null
    /// @return execution graph, never null
    public static ExecutionGraph lower(
            Node root, Map<String, Visibility> visibility, VisibilityPolicy policy) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(visibility, "visibility must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        ExecutionStep step = root.accept(new Lowering(visibility));
        logger.fine("Lowered pipeline '" + root.name() + "' to " + step.kind() + " step");
        return new ExecutionGraph(step, policy, visibility);
    }

    private static String joinNames(List<ExecutionStep> steps, String separator) {
        return steps.stream().map(ExecutionStep::name).collect(Collectors.joining(separator));
    }

    private static final class Lowering implements NodeVisitor<ExecutionStep> {

        private final Map<String, Visibility> visibility;

        Lowering(Map<String, Visibility> visibility) {
            this.visibility = visibility;
        }

        private List<ExecutionStep> lowerAll(List<Node> nodes) {
            List<ExecutionStep> steps = new ArrayList<>(nodes.size());
            for (Node node : nodes) {
                steps.add(node.accept(this));
            }
            return steps;
        }

        @Override
        public ExecutionStep visitAgent(AgentNode node) {
            return new ExecutionStep.AgentStep(
                    node, visibility.getOrDefault(node.name(), Visibility.USER));
        }

        @Override
        public ExecutionStep visitSequence(SequenceNode node) {
            return new ExecutionStep.SequenceStep(node.name(), lowerAll(node.children()));
        }

        @Override
        public ExecutionStep visitParallel(ParallelNode node) {
            return new ExecutionStep.ParallelStep(node.name(), lowerAll(node.children()));
        }

        @Override
        public ExecutionStep visitLoop(LoopNode node) {
            List<ExecutionStep> children = lowerAll(node.children());
            if (node.hasUntil()) {
                children.add(new ExecutionStep.CheckpointStep(node.name(), node.untilPredicate()));
            }
            return new ExecutionStep.LoopStep(node.name(), children, node.maxIterations());
        }

        @Override
        public ExecutionStep visitRoute(RouteNode node) {
            List<ExecutionStep.Branch> branches = new ArrayList<>(node.rules().size());
            for (RouteRule rule : node.rules()) {
                branches.add(new ExecutionStep.Branch(
                        rule.label(), rule.matcher(), rule.target().accept(this)));
            }
            ExecutionStep defaultStep =
                    node.hasDefault() ? node.defaultBranch().accept(this) : null;
            return new ExecutionStep.RouteStep(node.name(), node.dispatchKey(), branches, defaultStep);
        }

        @Override
        public ExecutionStep visitFallback(FallbackNode node) {
            List<ExecutionStep> children = lowerAll(node.children());
            return new ExecutionStep.FallbackStep("fallback_" + joinNames(children, "_or_"), children);
        }

        @Override
        public ExecutionStep visitRace(RaceNode node) {
            List<ExecutionStep> children = lowerAll(node.children());
            return new ExecutionStep.RaceStep("race_" + joinNames(children, "_vs_"), children);
        }

        @Override
        public ExecutionStep visitTimeout(TimeoutNode node) {
            ExecutionStep child = node.child().accept(this);
            return new ExecutionStep.TimeoutStep("timeout_" + child.name(), child, node.duration());
        }

        @Override
        public ExecutionStep visitMapOver(MapOverNode node) {
            return new ExecutionStep.MapOverStep(
                    node.name(),
                    node.listKey(),
                    node.itemKey(),
                    node.outputKey(),
                    node.child().accept(this));
        }

        @Override
        public ExecutionStep visitTransform(TransformNode node) {
            return new ExecutionStep.TransformStep(node);
        }

        @Override
        public ExecutionStep visitTap(TapNode node) {
            return new ExecutionStep.TapStep(node);
        }

        @Override
        public ExecutionStep visitExpect(ExpectNode node) {
            return new ExecutionStep.ExpectStep(node);
        }

        @Override
        public ExecutionStep visitGate(GateNode node) {
            return new ExecutionStep.GateStep(node);
        }
    }
}
