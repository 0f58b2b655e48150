package io.flowcheck.core.graph;

import java.util.List;
import java.util.stream.Collectors;

/// Result of a soundness check: every non-exhaustive node, in node order.
///
/// @param violations nodes failing the check with their uncovered conditions
/// @param checkedNodes number of nodes examined
public record SoundnessReport(List<SoundnessViolation> violations, int checkedNodes) {

    public SoundnessReport {
        violations = List.copyOf(violations);
    }

    public boolean isSound() {
        return violations.isEmpty();
    }

    /// Returns the ids of the non-exhaustive nodes.
    ///
    /// @return node ids in node order, never null
    public List<String> unsoundNodes() {
        return violations.stream().map(SoundnessViolation::node).collect(Collectors.toList());
    }
}
