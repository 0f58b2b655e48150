package io.flowcheck.cli.commands;

import io.flowcheck.core.FlowAnalyzer;
import io.flowcheck.core.FlowCheckConfig;
import io.flowcheck.core.flow.FlowDefinition;
import io.flowcheck.core.graph.SelfLoopPolicy;
import io.flowcheck.serialization.FlowSerializer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Base class for commands operating on one flow document.
///
/// Owns the flow file parameter, the analysis tuning options and the
/// {@link #call()} / {@link #execute()} contract. Failures are printed to `System.err`
/// and mapped to {@link #EXIT_ERROR}.
///
/// ### Exit codes
/// - `0` - analysis succeeded without findings
/// - `1` - the flow has condition errors or non-exhaustive pages
/// - `2` - the flow could not be read or analysed
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see AnalyzeCommand
/// @see VisualizeCommand
abstract class FlowCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FINDINGS = 1;
    static final int EXIT_ERROR = 2;

    @Parameters(index = "0", description = "Flow document (JSON)")
    protected Path flowFile;

    @Option(
            names = {"-t", "--threads"},
            description = "Worker threads simplifying edge filters (default: available processors)")
    protected Integer threads;

    @Option(
            names = "--self-loops",
            defaultValue = "count",
            description = "Self-loop handling in the soundness check: count, discard")
    protected String selfLoops;

    @Option(
            names = "--truth-table-limit",
            description = "Maximum atoms of the tautology check, 0 disables it (default: 12)")
    protected Integer truthTableLimit;

    @Option(names = "--no-color", description = "Disable ANSI colors")
    protected boolean noColor;

    @Override
    public final Integer call() {
        try {
            return execute();
        } catch (Exception e) {
            System.err.println(" [FAIL] " + failureLabel() + ": " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    protected abstract int execute() throws IOException;

    /// Returns the prefix of failure messages, e.g. `Analysis failed`.
    protected abstract String failureLabel();

    /// Reads and validates the flow document named on the command line.
    ///
    /// @return flow definition, never null
    /// @throws IOException if the file cannot be read
    protected FlowDefinition loadFlow() throws IOException {
        if (!Files.isRegularFile(flowFile)) {
            throw new IOException("Flow file not found: " + flowFile);
        }
        return FlowSerializer.fromJson(Files.readString(flowFile));
    }

    /// Builds the analyzer configuration from the command line options.
    ///
    /// @return configuration, never null
    /// @throws IllegalArgumentException for an unknown self-loop policy
    protected FlowCheckConfig buildConfig() {
        FlowCheckConfig.Builder builder = FlowCheckConfig.builder().selfLoopPolicy(parseSelfLoops());
        if (threads != null) {
            builder.parallelism(threads);
        }
        if (truthTableLimit != null) {
            builder.truthTableAtomLimit(truthTableLimit);
        }
        return builder.build();
    }

    protected FlowAnalyzer createAnalyzer() {
        return new FlowAnalyzer(buildConfig());
    }

    private SelfLoopPolicy parseSelfLoops() {
        return switch (selfLoops.toLowerCase(Locale.ROOT)) {
            case "count" -> SelfLoopPolicy.COUNT_FOR_SOUNDNESS;
            case "discard" -> SelfLoopPolicy.DISCARD;
            default ->
                    throw new IllegalArgumentException(
                            "Unsupported self-loop policy: " + selfLoops + ". Available: count, discard");
        };
    }
}
