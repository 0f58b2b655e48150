package io.flowcheck.core.graph;

import io.flowcheck.core.expr.Expr;
import java.util.Objects;

/// Directed graph edge with the exact condition under which it is taken.
///
/// The filter already includes the negation of every earlier transition of the source,
/// so filters of the edges leaving one node are pairwise disjoint.
///
/// @param source source node id, not null
/// @param target target node id, not null
/// @param filter simplified boolean filter, not null
public record Edge(String source, String target, Expr filter) {

    public Edge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(filter, "filter");
    }

    public boolean isSelfLoop() {
        return source.equals(target);
    }
}
