package io.flowcheck.cli.visualizer;

import io.flowcheck.core.AnalysisReport;

/// Strategy interface for rendering an analysed flow in different output formats.
///
/// ### Built-in Formats
/// - `text` - ASCII art with ANSI colors ({@link TextVisualizationFormat})
/// - `mermaid` - Mermaid diagram syntax ({@link MermaidVisualizationFormat})
///
/// @see FlowVisualizer
public interface VisualizationFormat {

    /// Returns the unique identifier for this format.
    ///
    /// @return format name used for CLI selection (e.g., "text", "mermaid"), never null
    String getName();

    /// Renders the annotated transition graph of the report.
    ///
    /// @param report analysis result to visualize, not null
    /// @param useColor whether ANSI colors may be used, ignored by formats without color
    /// @return formatted string representation, never null
    String render(AnalysisReport report, boolean useColor);
}
