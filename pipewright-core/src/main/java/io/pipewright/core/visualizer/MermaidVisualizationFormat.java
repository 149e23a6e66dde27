package io.pipewright.core.visualizer;

/// Mermaid flowchart rendering wrapped in a Markdown code block.
///
/// ### Node Shape Mapping
/// - **Agent**: rectangle
/// - **Route**: diamond
/// - **Parallel, race**: double rectangle
/// - **Loop**: hexagon
/// - **Transform, tap, expect, gate**: stadium
/// - **Others**: rounded rectangle
///
/// ### Edge Styles
/// - `-->`: sequence and branch edges (branches labelled)
/// - `-.->`: body and default edges
///
/// @implNote Thread-safe. Stateless rendering.
/// @see TextVisualizationFormat for plain text output
public class MermaidVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "mermaid";
    }

    @Override
    public String render(GraphDescription description) {
        StringBuilder sb = new StringBuilder();
        sb.append("```mermaid\n");
        sb.append("flowchart TD\n");
        for (GraphDescription.Node node : description.nodes()) {
            sb.append("    ").append(shape(node)).append("\n");
        }
        for (GraphDescription.Edge edge : description.edges()) {
            sb.append("    ").append(safeId(edge.from()));
            String arrow = switch (edge.kind()) {
                case SEQUENCE, BRANCH -> " -->";
                case BODY, DEFAULT -> " -.->";
            };
            sb.append(arrow);
            if (!edge.label().isEmpty()) {
                sb.append("|").append(escape(edge.label())).append("|");
            }
            sb.append(" ").append(safeId(edge.to())).append("\n");
        }
        sb.append("```\n");
        return sb.toString();
    }

    private String shape(GraphDescription.Node node) {
        String id = safeId(node.id());
        String label = "\"" + escape(node.name())
                + (node.detail().isEmpty() ? "" : "\\n" + escape(node.detail())) + "\"";
        return switch (node.type()) {
            case AGENT -> id + "[" + label + "]";
            case ROUTE -> id + "{" + label + "}";
            case PARALLEL, RACE -> id + "[[" + label + "]]";
            case LOOP -> id + "{{" + label + "}}";
            case TRANSFORM, TAP, EXPECT, GATE -> id + "([" + label + "])";
            default -> id + "(" + label + ")";
        };
    }

    private static String escape(String text) {
        return text.replace("\"", "'");
    }

    private static String safeId(String id) {
        return isReservedKeyword(id) ? "node_" + id : id;
    }

    private static boolean isReservedKeyword(String id) {
        return switch (id.toLowerCase()) {
            case "end", "subgraph", "graph", "flowchart", "direction", "click", "style",
                    "classdef", "class", "linkstyle" -> true;
            default -> false;
        };
    }
}
