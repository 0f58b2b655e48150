package io.flowcheck.cli.commands;

import io.flowcheck.cli.ui.AnsiStyles;
import io.flowcheck.core.AnalysisReport;
import io.flowcheck.core.ConditionError;
import io.flowcheck.core.FlowCheckConfig;
import io.flowcheck.core.graph.SoundnessViolation;
import io.flowcheck.serialization.FlowSerializer;
import java.io.IOException;
import picocli.CommandLine;

/// CLI command analysing a flow document.
///
/// Compiles every transition condition, builds the transition graph, propagates page
/// predicates from the start page and reports:
/// - conditions that failed to parse, resolve or type check
/// - pages whose outgoing conditions do not cover every answer, with the uncovered case
///
/// ### Usage
/// ```bash
/// flowcheck analyze [--format text|json] [--fail-fast] [-t <threads>] <flow.json>
/// ```
///
/// @see FlowCommand for the exit codes
@CommandLine.Command(name = "analyze", description = "Check a flow for non-exhaustive branching")
class AnalyzeCommand extends FlowCommand {

    @CommandLine.Option(
            names = "--format",
            defaultValue = "text",
            description = "Output format: text, json")
    String format;

    @CommandLine.Option(
            names = "--fail-fast",
            description = "Abort on the first condition that fails to compile")
    boolean failFast;

    @Override
    protected int execute() throws IOException {
        if (!"text".equals(format) && !"json".equals(format)) {
            throw new IllegalArgumentException("Unsupported format: " + format + ". Available: text, json");
        }
        AnalysisReport report = createAnalyzer().analyze(loadFlow());

        if ("json".equals(format)) {
            System.out.println(FlowSerializer.toJson(report));
        } else {
            printText(report, AnsiStyles.of(!noColor));
        }
        return report.isClean() ? EXIT_OK : EXIT_FINDINGS;
    }

    @Override
    protected FlowCheckConfig buildConfig() {
        FlowCheckConfig config = super.buildConfig();
        config.setFailFast(failFast);
        return config;
    }

    @Override
    protected String failureLabel() {
        return "Analysis failed";
    }

    private void printText(AnalysisReport report, AnsiStyles styles) {
        System.out.println(styles.bold("Flow: ") + styles.accent(report.flowId()));
        System.out.println("   Pages: " + report.graph().nodes().size());
        System.out.println("   Edges: " + report.graph().edges().size());
        System.out.println("   Enums: " + report.enums().size());

        for (ConditionError error : report.conditionErrors()) {
            System.out.println(
                    " " + styles.error("[ERROR]") + " " + error.page() + " " + styles.arrow() + " "
                            + error.target() + ": " + error.message());
            System.out.println("         " + styles.dim(error.condition()));
        }

        for (SoundnessViolation violation : report.soundness().violations()) {
            System.out.println(" " + styles.warn("[WARN]") + " Page " + styles.bold(violation.node())
                    + " is not exhaustive");
            System.out.println("         uncovered: " + violation.uncovered());
        }

        if (report.isClean()) {
            System.out.println(" " + styles.success("[OK]") + " All pages are exhaustive");
        } else {
            System.out.println(
                    " " + styles.error("[FAIL]") + " " + report.soundness().violations().size()
                            + " non-exhaustive pages, " + report.conditionErrors().size()
                            + " condition errors");
        }
    }
}
