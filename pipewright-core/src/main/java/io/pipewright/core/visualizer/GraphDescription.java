package io.pipewright.core.visualizer;

import io.pipewright.core.ir.NodeType;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Format-neutral description of a pipeline tree, produced by {@link GraphDescriber}.
///
/// Nodes are listed in pre-order; {@link Node#depth()} is the nesting level.
///
/// @param title pipeline root name, not null
/// @param nodes described nodes in pre-order, not null
/// @param edges edges between node ids, not null
public record GraphDescription(String title, List<Node> nodes, List<Edge> edges) {

    public GraphDescription {
        Objects.requireNonNull(title, "title must not be null");
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /// One described node.
    ///
    /// @param id unique, diagram-safe identifier, not null
    /// @param name IR node name, not null
    /// @param type node type, not null
    /// @param detail short type-specific detail (model, transform kind, bound), not null
    /// @param depth nesting level, 0 for the root
    public record Node(String id, String name, NodeType type, String detail, int depth) {

        public Node {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
            detail = detail != null ? detail : "";
        }
    }

    /// @param from source node id, not null
    /// @param to target node id, not null
    /// @param kind edge kind, not null
    /// @param label edge label, not null (may be empty)
    public record Edge(String from, String to, EdgeKind kind, String label) {

        public Edge {
            Objects.requireNonNull(from, "from must not be null");
            Objects.requireNonNull(to, "to must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
            label = label != null ? label : "";
        }
    }

    /// Returns the non-sequence edge that leads into the node, if any.
    ///
    /// @param id node id, not null
    /// @return entering edge, or empty for the root and sequence followers
    public Optional<Edge> enteringEdge(String id) {
        return edges.stream()
                .filter(edge -> edge.to().equals(id) && edge.kind() != EdgeKind.SEQUENCE)
                .findFirst();
    }
}
