package io.flowcheck.core;

import io.flowcheck.core.domain.EnumRegistry;
import io.flowcheck.core.graph.SoundnessReport;
import io.flowcheck.core.graph.TransitionGraph;
import java.util.List;
import java.util.Objects;

/// Outcome of analysing one flow.
///
/// @param flowId identifier of the analysed flow, not null
/// @param source node predicates were propagated from, not null
/// @param graph transition graph annotated with node predicates, not null
/// @param conditionErrors transitions whose condition failed to compile
/// @param soundness non-exhaustive nodes, not null
/// @param enums enumerations the analysis ran with, not null
public record AnalysisReport(
        String flowId,
        String source,
        TransitionGraph graph,
        List<ConditionError> conditionErrors,
        SoundnessReport soundness,
        EnumRegistry enums) {

    public AnalysisReport {
        Objects.requireNonNull(flowId, "flowId");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(graph, "graph");
        conditionErrors = List.copyOf(conditionErrors);
        Objects.requireNonNull(soundness, "soundness");
        Objects.requireNonNull(enums, "enums");
    }

    /// Returns whether every condition compiled and every node is exhaustive.
    ///
    /// @return `true` if the flow has no finding
    public boolean isClean() {
        return conditionErrors.isEmpty() && soundness.isSound();
    }
}
