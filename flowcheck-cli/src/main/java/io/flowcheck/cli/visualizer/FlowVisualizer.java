package io.flowcheck.cli.visualizer;

import io.flowcheck.core.AnalysisReport;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Registry and dispatcher for visualization formats.
///
/// @implNote Thread-safe after construction. Format map is immutable.
/// @see VisualizationFormat
public class FlowVisualizer {

    private final Map<String, VisualizationFormat> formats;

    /// Creates a visualizer with the built-in text and Mermaid formats.
    public FlowVisualizer() {
        this(List.of(new TextVisualizationFormat(), new MermaidVisualizationFormat()));
    }

    /// Creates a visualizer with the given formats.
    ///
    /// @param formats format implementations, names must be unique
    /// @throws IllegalArgumentException on duplicate format names
    public FlowVisualizer(Collection<? extends VisualizationFormat> formats) {
        Map<String, VisualizationFormat> byName = new LinkedHashMap<>();
        for (VisualizationFormat format : formats) {
            if (byName.putIfAbsent(format.getName(), format) != null) {
                throw new IllegalArgumentException("Duplicate visualization format: " + format.getName());
            }
        }
        this.formats = Map.copyOf(byName);
    }

    /// Renders the report using the specified format.
    ///
    /// @param report analysis result to visualize, not null
    /// @param formatName the format name (e.g., "text", "mermaid"), not null
    /// @param useColor whether ANSI colors may be used
    /// @return formatted visualization string, never null
    /// @throws IllegalArgumentException if format is not registered
    public String visualize(AnalysisReport report, String formatName, boolean useColor) {
        VisualizationFormat format = formats.get(formatName);
        if (format == null) {
            throw new IllegalArgumentException(
                    "Unsupported format: " + formatName + ". Available: "
                            + String.join(", ", formats.keySet().stream().sorted().toList()));
        }
        return format.render(report, useColor);
    }

    public Iterable<String> getAvailableFormats() {
        return formats.keySet();
    }
}
