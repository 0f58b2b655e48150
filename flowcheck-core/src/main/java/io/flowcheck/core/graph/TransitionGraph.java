package io.flowcheck.core.graph;

import io.flowcheck.core.expr.Expr;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Directed transition graph of a flow.
///
/// Nodes keep insertion order. Self-loops are not edges: their filters are recorded
/// separately. After predicate propagation every processed node carries a predicate,
/// the condition under which the node is reached from the source.
///
/// @implNote Edges are fixed at construction. Predicates are the only mutable state and
/// are written by a single thread during propagation; the graph is not safe for
/// concurrent mutation.
///
/// @see TransitionGraphBuilder
/// @see NodePredicatePropagator
public final class TransitionGraph {

    private final Set<String> nodes;
    private final Map<String, Map<String, Edge>> outgoing = new LinkedHashMap<>();
    private final Map<String, Map<String, Edge>> incoming = new LinkedHashMap<>();
    private final Map<String, Expr> selfLoops;
    private final Map<String, Expr> predicates = new LinkedHashMap<>();

    TransitionGraph(Collection<String> nodes, Collection<Edge> edges, Map<String, Expr> selfLoops) {
        this.nodes = Collections.unmodifiableSet(new LinkedHashSet<>(nodes));
        for (String node : this.nodes) {
            outgoing.put(node, new LinkedHashMap<>());
            incoming.put(node, new LinkedHashMap<>());
        }
        for (Edge edge : edges) {
            if (edge.isSelfLoop()) {
                throw new IllegalArgumentException("Self-loop stored as edge: " + edge);
            }
            outgoing.get(edge.source()).put(edge.target(), edge);
            incoming.get(edge.target()).put(edge.source(), edge);
        }
        this.selfLoops = Collections.unmodifiableMap(new LinkedHashMap<>(selfLoops));
    }

    public Set<String> nodes() {
        return nodes;
    }

    /// Returns all edges, grouped by source in node order.
    ///
    /// @return new list of edges, never null
    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>();
        outgoing.values().forEach(bySource -> edges.addAll(bySource.values()));
        return edges;
    }

    public Collection<Edge> outgoing(String node) {
        return Collections.unmodifiableCollection(require(outgoing, node).values());
    }

    public Collection<Edge> incoming(String node) {
        return Collections.unmodifiableCollection(require(incoming, node).values());
    }

    public Optional<Edge> edge(String source, String target) {
        return Optional.ofNullable(require(outgoing, source).get(target));
    }

    /// Returns the filter of the removed self-loop of `node`.
    ///
    /// @param node node id, not null
    /// @return recorded self-loop filter, or empty if the node has no self-loop
    public Optional<Expr> selfLoopFilter(String node) {
        return Optional.ofNullable(selfLoops.get(node));
    }

    public Map<String, Expr> selfLoops() {
        return selfLoops;
    }

    /// Returns the predicate under which `node` is reached.
    ///
    /// @param node node id, not null
    /// @return predicate, or empty before propagation
    public Optional<Expr> predicate(String node) {
        return Optional.ofNullable(predicates.get(node));
    }

    public Map<String, Expr> predicates() {
        return Collections.unmodifiableMap(predicates);
    }

    void assignPredicate(String node, Expr predicate) {
        require(outgoing, node);
        predicates.put(node, predicate);
    }

    private static <V> V require(Map<String, V> map, String node) {
        V value = map.get(node);
        if (value == null) {
            throw new IllegalArgumentException("Unknown node: " + node);
        }
        return value;
    }
}
