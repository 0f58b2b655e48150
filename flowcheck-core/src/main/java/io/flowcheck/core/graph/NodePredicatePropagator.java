package io.flowcheck.core.graph;

import io.flowcheck.core.domain.EnumEliminator;
import io.flowcheck.core.domain.EnumRegistry;
import io.flowcheck.core.exception.ConfigurationException;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Exprs;
import io.flowcheck.core.expr.Tag;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/// Computes for every node the condition under which it is reached from the source.
///
/// The source and every node without inbound edges are reached under `true`. Any other
/// node is resolved once all its parents are, with predicate
/// `(pred(p1) and filter(p1, n)) or (pred(p2) and filter(p2, n)) or ...`, simplified and
/// stripped of irrelevant enumerations.
///
/// Nodes are visited in breadth-first order from the source, followed by the nodes the
/// source does not reach; sweeps repeat until every node is resolved.
///
/// @apiNote **Side effects**: assigns the predicate of every node of the graph.
public final class NodePredicatePropagator {

    private static final Logger logger = Logger.getLogger(NodePredicatePropagator.class.getName());

    private final UnaryOperator<Expr> simplifier;
    private final EnumEliminator eliminator;

    public NodePredicatePropagator(UnaryOperator<Expr> simplifier) {
        this.simplifier = Objects.requireNonNull(simplifier, "simplifier");
        this.eliminator = new EnumEliminator(simplifier);
    }

    /// Annotates every node of `graph` with its reach predicate.
    ///
    /// @param graph transition graph, not null
    /// @param source node the flow starts on, not null
    /// @param enums enumerations of the analysis run, not null
    /// @return the same graph, annotated
    /// @throws ConfigurationException if a sweep resolves no node although some remain
    /// @throws IllegalArgumentException if `source` is not a node of the graph
    public TransitionGraph propagate(TransitionGraph graph, String source, EnumRegistry enums) {
        if (!graph.nodes().contains(source)) {
            throw new IllegalArgumentException("Unknown source node: " + source);
        }
        List<String> pending = new ArrayList<>(visitOrder(graph, source));
        int sweeps = 0;
        while (!pending.isEmpty()) {
            sweeps++;
            int resolved = 0;
            for (Iterator<String> it = pending.iterator(); it.hasNext(); ) {
                String node = it.next();
                Expr predicate = tryResolve(graph, node, source, enums);
                if (predicate != null) {
                    graph.assignPredicate(node, predicate);
                    it.remove();
                    resolved++;
                }
            }
            if (resolved == 0) {
                throw new ConfigurationException("Could not resolve node predicates of " + pending);
            }
        }
        logger.info("Propagated node predicates over " + graph.nodes().size() + " nodes in "
                + sweeps + " sweeps");
        return graph;
    }

    // null while a parent is unresolved
    private Expr tryResolve(TransitionGraph graph, String node, String source, EnumRegistry enums) {
        if (node.equals(source) || graph.incoming(node).isEmpty()) {
            return Atom.TRUE;
        }
        List<Expr> reaches = new ArrayList<>();
        for (Edge edge : graph.incoming(node)) {
            Expr parent = graph.predicate(edge.source()).orElse(null);
            if (parent == null) {
                return null;
            }
            reaches.add(Exprs.junction(Tag.AND, List.of(parent, edge.filter())));
        }
        Expr predicate = eliminator.eliminate(simplifier.apply(Exprs.junction(Tag.OR, reaches)), enums);
        logger.fine(() -> "Predicate of " + node + ": " + predicate);
        return predicate;
    }

    private static Set<String> visitOrder(TransitionGraph graph, String source) {
        Set<String> order = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        order.add(source);
        queue.add(source);
        while (!queue.isEmpty()) {
            for (Edge edge : graph.outgoing(queue.poll())) {
                if (order.add(edge.target())) {
                    queue.add(edge.target());
                }
            }
        }
        order.addAll(graph.nodes());
        return order;
    }
}
