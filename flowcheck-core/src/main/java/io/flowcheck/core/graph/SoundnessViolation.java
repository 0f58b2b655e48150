package io.flowcheck.core.graph;

import io.flowcheck.core.expr.Expr;
import java.util.Objects;

/// Node whose outgoing filters are not exhaustive.
///
/// @param node node id, not null
/// @param covered simplified disjunction of the outgoing filters, not null
/// @param uncovered simplified condition under which no transition applies, not null
public record SoundnessViolation(String node, Expr covered, Expr uncovered) {

    public SoundnessViolation {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(covered, "covered");
        Objects.requireNonNull(uncovered, "uncovered");
    }
}
