package io.flowcheck.core.graph;

import io.flowcheck.core.exception.ConfigurationException;
import io.flowcheck.core.exception.FlowCheckException;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Exprs;
import io.flowcheck.core.expr.Tag;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/// Builds a {@link TransitionGraph} from ordered per-node transition lists.
///
/// ### Override semantics
/// Transitions of a node behave like an if/elif/else chain: the filter of the `i`-th
/// transition is `c_i and !c_1 and ... and !c_(i-1)`. Filters of transitions sharing
/// source and target are joined with `or`.
///
/// ### Cycles
/// A self-loop is allowed; its filter is recorded on the graph and the edge removed.
/// Any other cycle is rejected with a {@link ConfigurationException} naming it.
///
/// ### Concurrency
/// Every filter is simplified as an independent task on the supplied executor; results
/// are joined back by edge. The simplifier must be safe for concurrent use.
///
/// @implNote The builder does not own the executor and never shuts it down.
public final class TransitionGraphBuilder {

    private static final Logger logger = Logger.getLogger(TransitionGraphBuilder.class.getName());

    private record EdgeKey(String source, String target) {}

    private final UnaryOperator<Expr> simplifier;
    private final ExecutorService executor;

    /// @param simplifier filter simplification, thread-safe, not null
    /// @param executor pool running one simplification task per edge, not null
    public TransitionGraphBuilder(UnaryOperator<Expr> simplifier, ExecutorService executor) {
        this.simplifier = Objects.requireNonNull(simplifier, "simplifier");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /// Builds the graph over the sources and targets of `transitions`.
    ///
    /// @param transitions ordered transitions per source node, not null
    /// @return transition graph with simplified filters, never null
    /// @throws ConfigurationException if the transitions contain a cycle longer than one
    public TransitionGraph build(Map<String, List<Transition>> transitions) {
        return build(List.of(), transitions);
    }

    /// Builds the graph, including nodes without any transition.
    ///
    /// @param nodes nodes to include even if isolated, in the desired order, not null
    /// @param transitions ordered transitions per source node, not null
    /// @return transition graph with simplified filters, never null
    /// @throws ConfigurationException if the transitions contain a cycle longer than one
    public TransitionGraph build(Collection<String> nodes, Map<String, List<Transition>> transitions) {
        Set<String> allNodes = new LinkedHashSet<>(nodes);
        Map<EdgeKey, List<Expr>> filters = new LinkedHashMap<>();
        transitions.forEach((source, candidates) -> {
            allNodes.add(source);
            List<Expr> earlier = new ArrayList<>();
            for (Transition transition : candidates) {
                allNodes.add(transition.target());
                Expr condition = transition.effectiveCondition();
                List<Expr> conjuncts = new ArrayList<>();
                conjuncts.add(condition);
                earlier.forEach(previous -> conjuncts.add(Exprs.not(previous)));
                filters.computeIfAbsent(new EdgeKey(source, transition.target()), k -> new ArrayList<>())
                        .add(Exprs.junction(Tag.AND, conjuncts));
                earlier.add(condition);
            }
        });

        rejectCycles(allNodes, filters.keySet());

        Map<EdgeKey, Expr> simplified = simplifyAll(filters);
        List<Edge> edges = new ArrayList<>();
        Map<String, Expr> selfLoops = new LinkedHashMap<>();
        simplified.forEach((key, filter) -> {
            if (key.source().equals(key.target())) {
                logger.fine(() -> "Removing self-loop on " + key.source() + " with filter " + filter);
                selfLoops.put(key.source(), filter);
            } else {
                edges.add(new Edge(key.source(), key.target(), filter));
            }
        });
        logger.info("Built transition graph with " + allNodes.size() + " nodes, " + edges.size()
                + " edges and " + selfLoops.size() + " self-loops");
        return new TransitionGraph(allNodes, edges, selfLoops);
    }

    private Map<EdgeKey, Expr> simplifyAll(Map<EdgeKey, List<Expr>> filters) {
        List<EdgeKey> keys = new ArrayList<>(filters.keySet());
        List<Callable<Expr>> tasks = new ArrayList<>(keys.size());
        for (EdgeKey key : keys) {
            Expr raw = Exprs.junction(Tag.OR, filters.get(key));
            tasks.add(() -> simplifier.apply(raw));
        }
        List<Future<Expr>> futures;
        try {
            futures = executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FlowCheckException("Interrupted while simplifying edge filters", e);
        }
        Map<EdgeKey, Expr> result = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            result.put(keys.get(i), join(keys.get(i), futures.get(i)));
        }
        return result;
    }

    private static Expr join(EdgeKey key, Future<Expr> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FlowCheckException("Interrupted while simplifying edge filters", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new FlowCheckException(
                    "Failed to simplify filter of " + key.source() + " -> " + key.target(), e.getCause());
        }
    }

    private static void rejectCycles(Set<String> nodes, Set<EdgeKey> keys) {
        Map<String, List<String>> successors = new HashMap<>();
        for (EdgeKey key : keys) {
            if (!key.source().equals(key.target())) {
                successors.computeIfAbsent(key.source(), k -> new ArrayList<>()).add(key.target());
            }
        }
        Map<String, Integer> state = new HashMap<>();
        for (String start : nodes) {
            if (state.containsKey(start)) {
                continue;
            }
            // iterative DFS; state 1 = on stack, 2 = finished
            Deque<String> path = new ArrayDeque<>();
            Deque<Iterator<String>> pending = new ArrayDeque<>();
            state.put(start, 1);
            path.addLast(start);
            pending.push(successors.getOrDefault(start, List.of()).iterator());
            while (!pending.isEmpty()) {
                Iterator<String> it = pending.peek();
                if (!it.hasNext()) {
                    pending.pop();
                    state.put(path.removeLast(), 2);
                    continue;
                }
                String next = it.next();
                Integer seen = state.get(next);
                if (seen == null) {
                    state.put(next, 1);
                    path.addLast(next);
                    pending.push(successors.getOrDefault(next, List.of()).iterator());
                } else if (seen == 1) {
                    throw new ConfigurationException("Cycle detected: " + describeCycle(path, next));
                }
            }
        }
    }

    private static String describeCycle(Deque<String> path, String reentry) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String node : path) {
            inCycle |= node.equals(reentry);
            if (inCycle) {
                cycle.add(node);
            }
        }
        cycle.add(reentry);
        return String.join(" -> ", cycle);
    }
}
