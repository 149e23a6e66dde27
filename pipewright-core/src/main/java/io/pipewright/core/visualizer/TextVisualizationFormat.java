package io.pipewright.core.visualizer;

/// Plain-text tree rendering.
///
/// {@snippet :
/// Pipeline: writer_then_reviewer
/// ──────────────────────────────────────────────────
/// writer_then_reviewer (SEQUENCE)
///   writer (AGENT) gemini -> draft
///   route_verdict (ROUTE) on verdict
///     [eq:ok] publish (AGENT)
///     [otherwise] rewrite (AGENT)
/// }
///
/// @implNote Thread-safe. Stateless rendering.
public class TextVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "text";
    }

    @Override
    public String render(GraphDescription description) {
        StringBuilder sb = new StringBuilder();
        sb.append("Pipeline: ").append(description.title()).append(System.lineSeparator());
        sb.append("─".repeat(50)).append(System.lineSeparator());
        for (GraphDescription.Node node : description.nodes()) {
            sb.append("  ".repeat(node.depth()));
            description.enteringEdge(node.id())
                    .filter(edge -> edge.kind() == EdgeKind.BRANCH || edge.kind() == EdgeKind.DEFAULT)
                    .ifPresent(edge -> sb.append('[').append(edge.label()).append("] "));
            sb.append(node.name()).append(" (").append(node.type()).append(')');
            if (!node.detail().isEmpty()) {
                sb.append(' ').append(node.detail());
            }
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }
}
