package io.flowcheck.core.graph;

import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.Expr;
import java.util.Objects;

/// Compiled transition candidate of a node.
///
/// @param condition boolean condition, `null` meaning always
/// @param target target node id, not null
public record Transition(Expr condition, String target) {

    public Transition {
        Objects.requireNonNull(target, "target");
    }

    public static Transition always(String target) {
        return new Transition(null, target);
    }

    /// Returns the condition, treating a missing condition as `true`.
    ///
    /// @return condition, never null
    public Expr effectiveCondition() {
        return condition == null ? Atom.TRUE : condition;
    }
}
