package io.pipewright.core.contract;

import io.pipewright.core.ir.AgentNode;
import io.pipewright.core.ir.ExpectNode;
import io.pipewright.core.ir.GateNode;
import io.pipewright.core.ir.LoopNode;
import io.pipewright.core.ir.MapOverNode;
import io.pipewright.core.ir.Node;
import io.pipewright.core.ir.NodeType;
import io.pipewright.core.ir.RouteNode;
import io.pipewright.core.ir.RouteRule;
import io.pipewright.core.ir.TransformNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Finds agent writes that no later step reads.
///
/// The tree is linearised into read and write accesses, each tagged with its position in
/// execution order and its path from the root. A read consumes a write of the same key
/// when it comes later and the two are not on sibling branches of a parallel, race,
/// fallback or route. Inside a loop every read of the body counts, since the next pass
/// sees the previous pass's writes.
final class DataLossAnalysis {

    private record PathStep(Node container, int childIndex) {}

    private record Access(String key, String node, int index, List<PathStep> path) {}

    private final Map<String, AgentContract> contracts;
    private final List<Access> reads = new ArrayList<>();
    private final List<Access> writes = new ArrayList<>();
    private int counter;

    DataLossAnalysis(Map<String, AgentContract> contracts) {
        this.contracts = contracts;
    }

    List<ContractIssue> analyze(Node root) {
        walk(root, List.of());
        List<ContractIssue> issues = new ArrayList<>();
        for (Access write : writes) {
            boolean consumed = reads.stream().anyMatch(read -> consumes(write, read));
            if (!consumed) {
                issues.add(
                        ContractIssue.warning(
                                CheckPass.DATA_LOSS,
                                write.node(),
                                "Declared output '" + write.key() + "' is never consumed",
                                "Read {" + write.key() + "} downstream or drop the output key"));
            }
        }
        return issues;
    }

    private void walk(Node node, List<PathStep> path) {
        switch (node.nodeType()) {
            case AGENT -> {
                AgentContract contract = contracts.get(node.name());
                contract.allReads().forEach(key -> record(reads, key, node, path));
                contract.writes().forEach(key -> record(writes, key, node, path));
            }
            case TRANSFORM -> ((TransformNode) node).keyEffect().reads().forEach(key -> record(reads, key, node, path));
            case EXPECT -> ((ExpectNode) node).predicate().reads().forEach(key -> record(reads, key, node, path));
            case GATE -> ((GateNode) node).predicate().reads().forEach(key -> record(reads, key, node, path));
            case ROUTE -> {
                RouteNode route = (RouteNode) node;
                if (route.dispatchKey() != null) {
                    record(reads, route.dispatchKey(), node, path);
                }
                for (RouteRule rule : route.rules()) {
                    rule.matcher().reads().forEach(key -> record(reads, key, node, path));
                }
                walkChildren(node, path);
            }
            case MAP_OVER -> {
                record(reads, ((MapOverNode) node).listKey(), node, path);
                walkChildren(node, path);
            }
            case LOOP -> {
                walkChildren(node, path);
                LoopNode loop = (LoopNode) node;
                if (loop.hasUntil()) {
                    List<PathStep> checkpoint = extend(path, node, loop.children().size());
                    loop.untilPredicate().reads().forEach(key -> record(reads, key, node, checkpoint));
                }
            }
            case TAP -> {
                // Taps declare no reads
            }
            default -> walkChildren(node, path);
        }
    }

    private void walkChildren(Node node, List<PathStep> path) {
        List<Node> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            walk(children.get(i), extend(path, node, i));
        }
    }

    private void record(List<Access> target, String key, Node node, List<PathStep> path) {
        target.add(new Access(key, node.name(), counter++, path));
    }

    private static boolean consumes(Access write, Access read) {
        if (!write.key().equals(read.key())) {
            return false;
        }
        int common = 0;
        int limit = Math.min(write.path().size(), read.path().size());
        while (common < limit && samePosition(write.path().get(common), read.path().get(common))) {
            common++;
        }
        for (int i = 0; i < common; i++) {
            if (write.path().get(i).container().nodeType() == NodeType.LOOP) {
                return true;
            }
        }
        if (common < limit) {
            NodeType divergence = write.path().get(common).container().nodeType();
            if (divergence == NodeType.LOOP) {
                return true;
            }
            if (isBranching(divergence)) {
                return false;
            }
        }
        return read.index() > write.index();
    }

    private static boolean samePosition(PathStep a, PathStep b) {
        return a.container() == b.container() && a.childIndex() == b.childIndex();
    }

    private static boolean isBranching(NodeType type) {
        return type == NodeType.PARALLEL
                || type == NodeType.RACE
                || type == NodeType.FALLBACK
                || type == NodeType.ROUTE;
    }

    private static List<PathStep> extend(List<PathStep> path, Node container, int index) {
        List<PathStep> extended = new ArrayList<>(path.size() + 1);
        extended.addAll(path);
        extended.add(new PathStep(container, index));
        return List.copyOf(extended);
    }
}
