package io.flowcheck.cli.visualizer;

import io.flowcheck.cli.ui.AnsiStyles;
import io.flowcheck.core.AnalysisReport;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.graph.Edge;
import io.flowcheck.core.graph.SoundnessViolation;
import io.flowcheck.core.graph.TransitionGraph;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// ASCII text visualization of an analysed flow with ANSI color support.
///
/// Pages are rendered breadth-first from the analysis source, indented by depth; pages
/// unreachable from the source follow at depth zero. Each page box lists its predicate,
/// outgoing filters and self-loop, and the uncovered case of a non-exhaustive page.
///
/// ### Page Colors
/// - **Green (success)**: exhaustive page
/// - **Yellow (warn)**: non-exhaustive page
///
/// @implNote Thread-safe. Each render call creates its own AnsiStyles instance.
/// @see MermaidVisualizationFormat for diagram output
public class TextVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "text";
    }

    @Override
    public String render(AnalysisReport report, boolean useColor) {
        AnsiStyles styles = AnsiStyles.of(useColor);
        TransitionGraph graph = report.graph();
        Map<String, SoundnessViolation> violations = new HashMap<>();
        for (SoundnessViolation violation : report.soundness().violations()) {
            violations.put(violation.node(), violation);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%s %s%n", styles.bold("Flow:"), styles.accent(report.flowId())));
        sb.append(styles.rule(50)).append(System.lineSeparator());
        sb.append(System.lineSeparator());

        Set<String> visited = new HashSet<>();
        appendTree(graph, report.source(), visited, violations, styles, sb);
        for (String node : graph.nodes()) {
            appendTree(graph, node, visited, violations, styles, sb);
        }
        return sb.toString();
    }

    private void appendTree(
            TransitionGraph graph,
            String root,
            Set<String> visited,
            Map<String, SoundnessViolation> violations,
            AnsiStyles styles,
            StringBuilder sb) {
        Deque<NodeLevel> queue = new ArrayDeque<>();
        queue.add(new NodeLevel(root, 0));
        while (!queue.isEmpty()) {
            NodeLevel current = queue.removeFirst();
            if (!visited.add(current.node())) {
                continue;
            }
            String indent = "  ".repeat(current.level());
            sb.append(renderNode(graph, current.node(), indent, violations.get(current.node()), styles));
            sb.append(System.lineSeparator());
            for (Edge edge : graph.outgoing(current.node())) {
                queue.add(new NodeLevel(edge.target(), current.level() + 1));
            }
        }
    }

    private String renderNode(
            TransitionGraph graph,
            String node,
            String indent,
            SoundnessViolation violation,
            AnsiStyles styles) {
        StringBuilder sb = new StringBuilder();
        String predicate = graph.predicate(node).map(Expr::toString).orElse("?");
        sb.append(String.format("%s%s %s %s%n", indent, styles.boxTop(),
                styles.soundOrWarn(node, violation == null), styles.gray("[" + predicate + "]")));

        for (Edge edge : graph.outgoing(node)) {
            sb.append(String.format("%s%s  %s %s %s%n", indent, styles.boxMid(), styles.arrow(),
                    styles.bold(edge.target()), styles.dim("if " + edge.filter())));
        }
        Optional<Expr> selfLoop = graph.selfLoopFilter(node);
        if (selfLoop.isPresent()) {
            sb.append(String.format("%s%s  %s %s%n", indent, styles.boxMid(), styles.loop(),
                    styles.dim("stays if " + selfLoop.get())));
        }
        if (violation != null) {
            sb.append(String.format("%s%s  %s %s%n", indent, styles.boxMid(),
                    styles.warn("uncovered:"), violation.uncovered()));
        }
        sb.append(indent).append(styles.boxBottom());
        return sb.toString();
    }

    private record NodeLevel(String node, int level) {}
}
