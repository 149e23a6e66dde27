package io.pipewright.core.visualizer;

import io.pipewright.core.ir.AgentNode;
import io.pipewright.core.ir.LoopNode;
import io.pipewright.core.ir.MapOverNode;
import io.pipewright.core.ir.Node;
import io.pipewright.core.ir.RouteNode;
import io.pipewright.core.ir.RouteRule;
import io.pipewright.core.ir.TimeoutNode;
import io.pipewright.core.ir.TransformNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Builds a {@link GraphDescription} from an IR tree.
///
/// Node ids are the node names made diagram-safe; repeated names get a numeric suffix.
public final class GraphDescriber {

    private GraphDescriber() {}

    /// Describes a tree.
    ///
    /// @param root tree root, not null
    /// @return description, never null
    public static GraphDescription describe(Node root) {
        Objects.requireNonNull(root, "root must not be null");
        Walk walk = new Walk();
        walk.visit(root, 0);
        return new GraphDescription(root.name(), walk.nodes, walk.edges);
    }

    private static final class Walk {
        private final List<GraphDescription.Node> nodes = new ArrayList<>();
        private final List<GraphDescription.Edge> edges = new ArrayList<>();
        private final Map<String, Integer> seen = new HashMap<>();
        private final Set<String> usedIds = new HashSet<>();

        String visit(Node node, int depth) {
            String id = uniqueId(node.name());
            nodes.add(new GraphDescription.Node(id, node.name(), node.nodeType(), detail(node), depth));

            switch (node.nodeType()) {
                case SEQUENCE, LOOP -> chain(id, node.children(), depth, loopLabel(node));
                case TIMEOUT, MAP_OVER -> edge(id, visit(node.children().get(0), depth + 1), EdgeKind.BODY, "");
                case PARALLEL, RACE, FALLBACK -> {
                    int index = 1;
                    for (Node child : node.children()) {
                        String label = node.nodeType().name().toLowerCase() + " " + index++;
                        edge(id, visit(child, depth + 1), EdgeKind.BRANCH, label);
                    }
                }
                case ROUTE -> {
                    RouteNode route = (RouteNode) node;
                    for (RouteRule rule : route.rules()) {
                        edge(id, visit(rule.target(), depth + 1), EdgeKind.BRANCH, rule.label());
                    }
                    if (route.hasDefault()) {
                        edge(id, visit(route.defaultBranch(), depth + 1), EdgeKind.DEFAULT, "otherwise");
                    }
                }
                default -> {
                    // leaves
                }
            }
            return id;
        }

        private void chain(String containerId, List<Node> children, int depth, String bodyLabel) {
            String previous = null;
            for (Node child : children) {
                String childId = visit(child, depth + 1);
                if (previous == null) {
                    edge(containerId, childId, EdgeKind.BODY, bodyLabel);
                } else {
                    edge(previous, childId, EdgeKind.SEQUENCE, "");
                }
                previous = childId;
            }
        }

        private void edge(String from, String to, EdgeKind kind, String label) {
            edges.add(new GraphDescription.Edge(from, to, kind, label));
        }

        // Suffixes skip ids already taken, including by nodes literally named `x_2`.
        private String uniqueId(String name) {
            String base = name.replaceAll("[^A-Za-z0-9_]", "_");
            int count = seen.getOrDefault(base, 1);
            String id = base;
            while (!usedIds.add(id)) {
                count++;
                id = base + "_" + count;
            }
            seen.put(base, count);
            return id;
        }
    }

    private static String loopLabel(Node node) {
        if (node instanceof LoopNode loop) {
            return loop.hasUntil() ? "until, max " + loop.maxIterations() : "x" + loop.maxIterations();
        }
        return "";
    }

    static String detail(Node node) {
        if (node instanceof AgentNode agent) {
            String model = agent.model().isEmpty() ? "" : agent.model();
            return agent.outputKey() != null ? join(model, "-> " + agent.outputKey()) : model;
        }
        if (node instanceof TransformNode transform) {
            return transform.kind().name().toLowerCase();
        }
        if (node instanceof LoopNode loop) {
            return loopLabel(loop);
        }
        if (node instanceof TimeoutNode timeout) {
            return timeout.duration().toMillis() + " ms";
        }
        if (node instanceof MapOverNode mapOver) {
            return mapOver.listKey() + " -> " + mapOver.outputKey();
        }
        if (node instanceof RouteNode route && route.dispatchKey() != null) {
            return "on " + route.dispatchKey();
        }
        return "";
    }

    private static String join(String left, String right) {
        return left.isEmpty() ? right : left + " " + right;
    }
}
