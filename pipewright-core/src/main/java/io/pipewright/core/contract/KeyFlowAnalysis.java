package io.pipewright.core.contract;

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
import io.pipewright.core.ir.SequenceNode;
import io.pipewright.core.ir.TapNode;
import io.pipewright.core.ir.TimeoutNode;
import io.pipewright.core.ir.TransformNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Forward dataflow over the tree: which keys are guaranteed available before each node.
///
/// ### Join rules
/// - sequence and loop body: accumulate in order (the loop body is analysed for its first
///   pass only)
/// - parallel: every branch starts from the same set; writes are merged after the block
/// - route, fallback, race: only keys every alternative provides survive
/// - map-over: the body also sees the item key; afterwards only the output key is added
///
/// Environments are recorded per occurrence, numbered in pre-order, so a node instance
/// reused at several positions is checked against each position's own keys.
///
/// @implNote Not thread-safe; create one instance per analysis.
final class KeyFlowAnalysis implements NodeVisitor<Set<String>> {

    private final Map<String, AgentContract> contracts;
    private final List<Set<String>> availableBefore = new ArrayList<>();
    private final Map<Integer, Set<String>> availableAfterBody = new HashMap<>();
    private final List<ContractIssue> issues = new ArrayList<>();
    private Set<String> current = Set.of();
    private int occurrence = -1;

    KeyFlowAnalysis(Map<String, AgentContract> contracts) {
        this.contracts = contracts;
    }

    /// Runs the analysis from the given initial key set.
    ///
    /// @param root tree root, not null
    /// @param initialKeys keys present before the pipeline starts, not null
    /// @return keys available after the whole tree
    Set<String> analyze(Node root, Set<String> initialKeys) {
        return flow(root, initialKeys);
    }

    /// Returns the keys available before the node at the given pre-order position.
    Set<String> availableBefore(int occurrence) {
        return occurrence < availableBefore.size() ? availableBefore.get(occurrence) : Set.of();
    }

    Set<String> availableAfterBody(int occurrence) {
        return availableAfterBody.getOrDefault(occurrence, Set.of());
    }

    List<ContractIssue> issues() {
        return issues;
    }

    private Set<String> flow(Node node, Set<String> before) {
        Set<String> snapshot = Set.copyOf(before);
        occurrence = availableBefore.size();
        availableBefore.add(snapshot);
        current = snapshot;
        return node.accept(this);
    }

    @Override
    public Set<String> visitAgent(AgentNode node) {
        Set<String> after = new LinkedHashSet<>(current);
        after.addAll(contracts.get(node.name()).writes());
        return after;
    }

    @Override
    public Set<String> visitSequence(SequenceNode node) {
        Set<String> env = current;
        for (Node child : node.children()) {
            env = flow(child, env);
        }
        return env;
    }

    @Override
    public Set<String> visitParallel(ParallelNode node) {
        Set<String> before = current;
        Set<String> after = new LinkedHashSet<>(before);
        Map<String, List<String>> writers = new LinkedHashMap<>();
        for (Node child : node.children()) {
            Set<String> branchAfter = flow(child, before);
            for (String key : branchAfter) {
                if (!before.contains(key)) {
                    writers.computeIfAbsent(key, k -> new ArrayList<>()).add(child.name());
                }
            }
            after.addAll(branchAfter);
        }
        writers.forEach(
                (key, branches) -> {
                    if (branches.size() > 1) {
                        issues.add(
                                ContractIssue.warning(
                                        CheckPass.OUTPUT_KEYS,
                                        node.name(),
                                        "Key '"
                                                + key
                                                + "' is written by parallel branches "
                                                + branches
                                                + "; which value survives depends on merge order",
                                        "Give each branch its own output key and merge them explicitly"));
                    }
                });
        return after;
    }

    @Override
    public Set<String> visitLoop(LoopNode node) {
        int loopOccurrence = occurrence;
        Set<String> env = current;
        for (Node child : node.children()) {
            env = flow(child, env);
        }
        availableAfterBody.put(loopOccurrence, Set.copyOf(env));
        return env;
    }

    @Override
    public Set<String> visitRoute(RouteNode node) {
        return intersectBranches(node.children());
    }

    @Override
    public Set<String> visitFallback(FallbackNode node) {
        return intersectBranches(node.children());
    }

    @Override
    public Set<String> visitRace(RaceNode node) {
        return intersectBranches(node.children());
    }

    @Override
    public Set<String> visitTimeout(TimeoutNode node) {
        return flow(node.child(), current);
    }

    @Override
    public Set<String> visitMapOver(MapOverNode node) {
        Set<String> before = current;
        Set<String> bodyEnv = new LinkedHashSet<>(before);
        bodyEnv.add(node.itemKey());
        flow(node.child(), bodyEnv);
        Set<String> after = new LinkedHashSet<>(before);
        after.add(node.outputKey());
        return after;
    }

    @Override
    public Set<String> visitTransform(TransformNode node) {
        return node.keyEffect().apply(current);
    }

    @Override
    public Set<String> visitTap(TapNode node) {
        return current;
    }

    @Override
    public Set<String> visitExpect(ExpectNode node) {
        return current;
    }

    @Override
    public Set<String> visitGate(GateNode node) {
        return current;
    }

    private Set<String> intersectBranches(List<Node> branches) {
        Set<String> before = current;
        Set<String> common = null;
        for (Node branch : branches) {
            Set<String> branchAfter = flow(branch, before);
            if (common == null) {
                common = new LinkedHashSet<>(branchAfter);
            } else {
                common.retainAll(branchAfter);
            }
        }
        return common != null ? common : before;
    }
}
