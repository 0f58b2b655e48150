package io.flowcheck.cli.visualizer;

import io.flowcheck.core.AnalysisReport;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.graph.Edge;
import io.flowcheck.core.graph.TransitionGraph;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Mermaid diagram format visualization for analysed flows.
///
/// Generates Mermaid flowchart syntax wrapped in a Markdown code block. Output can be
/// rendered in GitHub/GitLab Markdown or at [mermaid.live](https://mermaid.live).
///
/// ### Shapes and styles
/// - **Start page**: stadium shape
/// - **Other pages**: rectangle
/// - **Non-exhaustive pages**: `unsound` class, amber fill
/// - **Edges**: solid arrow labelled with the filter, unlabelled when the filter is `true`
/// - **Self-loops**: dashed arrow back to the page
///
/// @implNote Thread-safe. Stateless rendering.
/// @see TextVisualizationFormat for ASCII output
public class MermaidVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "mermaid";
    }

    @Override
    public String render(AnalysisReport report, boolean useColor) {
        TransitionGraph graph = report.graph();
        Set<String> unsound = Set.copyOf(report.soundness().unsoundNodes());
        StringBuilder sb = new StringBuilder();

        sb.append("```mermaid\n");
        sb.append("flowchart TD\n");
        sb.append("  classDef unsound fill:#ffe0a0,stroke:#d08000\n");

        for (String node : graph.nodes()) {
            String id = sanitizeId(node);
            String label = escape(node);
            if (node.equals(report.source())) {
                sb.append("    ").append(id).append("([\"").append(label).append("\"])");
            } else {
                sb.append("    ").append(id).append("[\"").append(label).append("\"]");
            }
            if (unsound.contains(node)) {
                sb.append(":::unsound");
            }
            sb.append("\n");
        }
        sb.append("\n");

        for (Edge edge : graph.edges()) {
            sb.append("  ").append(sanitizeId(edge.source()));
            if (Atom.is(edge.filter(), true)) {
                sb.append(" --> ");
            } else {
                sb.append(" -->|\"").append(escape(edge.filter().toString())).append("\"| ");
            }
            sb.append(sanitizeId(edge.target())).append("\n");
        }
        for (Map.Entry<String, Expr> loop : graph.selfLoops().entrySet()) {
            String id = sanitizeId(loop.getKey());
            sb.append("  ").append(id).append(" -.->|\"").append(escape(loop.getValue().toString()))
                    .append("\"| ").append(id).append("\n");
        }

        sb.append("```\n");
        return sb.toString();
    }

    private String escape(String text) {
        return text.replace("\"", "#quot;");
    }

    private String sanitizeId(String id) {
        String sanitized = id.replaceAll("[^a-zA-Z0-9_]", "_");
        if (isReservedKeyword(sanitized)) {
            return "page_" + sanitized;
        }
        return sanitized;
    }

    private boolean isReservedKeyword(String id) {
        return switch (id.toLowerCase(Locale.ROOT)) {
            case "end", "subgraph", "graph", "flowchart", "direction", "click", "style",
                    "classdef", "class", "linkstyle" -> true;
            default -> false;
        };
    }
}
