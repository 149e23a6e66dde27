package io.pipewright.core.visualizer;

import io.pipewright.core.ir.Node;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/// Registry and dispatcher for visualization formats.
///
/// @implNote Thread-safe after construction. The format map is immutable.
/// @see VisualizationFormat
public class PipelineVisualizer {

    public static final String DEFAULT_FORMAT = "text";

    private final Map<String, VisualizationFormat> formats;

    /// Creates a visualizer with the built-in `text` and `mermaid` formats.
    public PipelineVisualizer() {
        this(List.of(new TextVisualizationFormat(), new MermaidVisualizationFormat()));
    }

    public PipelineVisualizer(List<VisualizationFormat> formats) {
        Map<String, VisualizationFormat> byName = new LinkedHashMap<>();
        formats.forEach(format -> byName.put(format.getName(), format));
        this.formats = Map.copyOf(byName);
    }

    /// Renders a tree in the named format.
    ///
    /// @param root tree root, not null
    /// @param formatName format name, not null
    /// @return rendering, never null
    /// @throws IllegalArgumentException if the format is not registered
    public String visualize(Node root, String formatName) {
        VisualizationFormat format = formats.get(formatName);
        if (format == null) {
            throw new IllegalArgumentException(
                    "Unsupported format: " + formatName + ". Available: "
                            + String.join(", ", new TreeSet<>(formats.keySet())));
        }
        return format.render(GraphDescriber.describe(root));
    }

    public String visualize(Node root) {
        return visualize(root, DEFAULT_FORMAT);
    }

    public Set<String> getAvailableFormats() {
        return formats.keySet();
    }
}
