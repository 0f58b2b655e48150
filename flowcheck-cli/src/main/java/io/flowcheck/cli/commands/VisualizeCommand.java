package io.flowcheck.cli.commands;

import io.flowcheck.cli.visualizer.FlowVisualizer;
import io.flowcheck.core.AnalysisReport;
import java.io.IOException;
import picocli.CommandLine;

/// CLI command rendering the annotated transition graph of a flow.
///
/// ### Usage
/// ```bash
/// flowcheck visualize [--format text|mermaid] <flow.json>
/// ```
@CommandLine.Command(name = "visualize", description = "Visualize the transition graph")
class VisualizeCommand extends FlowCommand {

    @CommandLine.Option(
            names = "--format",
            defaultValue = "text",
            description = "Output format: text, mermaid")
    String format;

    FlowVisualizer visualizer = new FlowVisualizer();

    @Override
    protected int execute() throws IOException {
        AnalysisReport report = createAnalyzer().analyze(loadFlow());
        System.out.println(visualizer.visualize(report, format, !noColor));
        return EXIT_OK;
    }

    @Override
    protected String failureLabel() {
        return "Visualization failed";
    }
}
