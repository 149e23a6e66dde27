package io.pipewright.core.visualizer;

/// Strategy for rendering a {@link GraphDescription}.
///
/// ### Built-in Formats
/// - `text`: indented tree ({@link TextVisualizationFormat})
/// - `mermaid`: Mermaid flowchart ({@link MermaidVisualizationFormat})
///
/// @see PipelineVisualizer
public interface VisualizationFormat {

    /// Returns the unique identifier for this format.
    ///
    /// @return format name such as "text" or "mermaid", never null
    String getName();

    /// Renders the description.
    ///
    /// @param description graph to render, not null
    /// @return rendering, never null
    String render(GraphDescription description);
}
