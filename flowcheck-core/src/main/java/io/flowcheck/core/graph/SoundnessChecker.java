package io.flowcheck.core.graph;

import io.flowcheck.core.domain.EnumEliminator;
import io.flowcheck.core.domain.EnumRegistry;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Exprs;
import io.flowcheck.core.expr.Tag;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/// Verifies that the outgoing filters of every node are exhaustive.
///
/// A node is sound when the disjunction of its outgoing filters simplifies to `true`;
/// nodes without outgoing edges are terminal and always sound. Non-exhaustiveness is a
/// finding, not an error: every node is checked and all violations are reported
/// together.
public final class SoundnessChecker {

    private static final Logger logger = Logger.getLogger(SoundnessChecker.class.getName());

    private final UnaryOperator<Expr> simplifier;
    private final EnumEliminator eliminator;
    private final SelfLoopPolicy selfLoopPolicy;

    public SoundnessChecker(UnaryOperator<Expr> simplifier, SelfLoopPolicy selfLoopPolicy) {
        this.simplifier = Objects.requireNonNull(simplifier, "simplifier");
        this.selfLoopPolicy = Objects.requireNonNull(selfLoopPolicy, "selfLoopPolicy");
        this.eliminator = new EnumEliminator(simplifier);
    }

    /// Checks every node of the graph.
    ///
    /// @param graph transition graph, not null
    /// @param enums enumerations of the analysis run, not null
    /// @return report listing every non-exhaustive node, never null
    public SoundnessReport check(TransitionGraph graph, EnumRegistry enums) {
        List<SoundnessViolation> violations = new ArrayList<>();
        for (String node : graph.nodes()) {
            List<Expr> filters = new ArrayList<>();
            graph.outgoing(node).forEach(edge -> filters.add(edge.filter()));
            if (selfLoopPolicy == SelfLoopPolicy.COUNT_FOR_SOUNDNESS) {
                graph.selfLoopFilter(node).ifPresent(filters::add);
            }
            if (filters.isEmpty()) {
                continue;
            }
            Expr covered = eliminator.eliminate(simplifier.apply(Exprs.junction(Tag.OR, filters)), enums);
            if (!Atom.is(covered, true)) {
                Expr uncovered = eliminator.eliminate(simplifier.apply(Exprs.not(covered)), enums);
                logger.warning("Node " + node + " is not exhaustive, uncovered: " + uncovered);
                violations.add(new SoundnessViolation(node, covered, uncovered));
            }
        }
        return new SoundnessReport(violations, graph.nodes().size());
    }
}
