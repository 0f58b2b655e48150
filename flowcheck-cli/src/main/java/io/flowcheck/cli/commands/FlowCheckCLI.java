package io.flowcheck.cli.commands;

import picocli.CommandLine.Command;

/// Top command of the FlowCheck CLI.
///
/// Registers all available subcommands:
/// - `analyze` - Compile conditions, propagate page predicates and report non-exhaustive pages
/// - `visualize` - Render the annotated transition graph as ASCII text or Mermaid diagram
///
/// @see AnalyzeCommand
/// @see VisualizeCommand
@Command(
        name = "flowcheck",
        description = "Branching analysis for questionnaire flows",
        mixinStandardHelpOptions = true,
        subcommands = {AnalyzeCommand.class, VisualizeCommand.class})
public class FlowCheckCLI {}
