package io.flowcheck.core.graph;

import static io.flowcheck.core.expr.Exprs.and;
import static io.flowcheck.core.expr.Exprs.bool;
import static io.flowcheck.core.expr.Exprs.not;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowcheck.core.domain.EnumDomain;
import io.flowcheck.core.domain.EnumRegistry;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.EnumIn;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Kind;
import io.flowcheck.core.pass.BooleanSimplifier;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NodePredicatePropagatorTest {

    private final Expr x = bool("x");
    private final Expr y = bool("y");
    private final EnumDomain q = EnumDomain.of("q", Kind.STRING, "a", "b", "c");

    private NodePredicatePropagator propagator;

    @BeforeEach
    void setUp() {
        propagator = new NodePredicatePropagator(new BooleanSimplifier());
    }

    @Test
    void shouldReachDiamondJoinUnconditionally() {
        // Given
        TransitionGraph graph = new TransitionGraph(
                List.of("S", "A", "B", "C"),
                List.of(
                        new Edge("S", "A", x),
                        new Edge("S", "B", not(x)),
                        new Edge("A", "C", Atom.TRUE),
                        new Edge("B", "C", Atom.TRUE)),
                Map.of());

        // When
        propagator.propagate(graph, "S", EnumRegistry.EMPTY);

        // Then
        assertThat(graph.predicates())
                .containsEntry("S", Atom.TRUE)
                .containsEntry("A", x)
                .containsEntry("B", not(x))
                .containsEntry("C", Atom.TRUE);
    }

    @Test
    void shouldConjoinFiltersAlongPath() {
        // Given
        TransitionGraph graph = new TransitionGraph(
                List.of("S", "A", "B"),
                List.of(new Edge("S", "A", x), new Edge("A", "B", y)),
                Map.of());

        // When
        propagator.propagate(graph, "S", EnumRegistry.EMPTY);

        // Then
        assertThat(graph.predicate("B")).contains(and(x, y));
    }

    @Test
    void shouldMergeEnumBranches() {
        // Given
        TransitionGraph graph = new TransitionGraph(
                List.of("S", "A", "B", "C"),
                List.of(
                        new Edge("S", "A", EnumIn.of(q, "a")),
                        new Edge("S", "B", EnumIn.of(q, "b")),
                        new Edge("A", "C", Atom.TRUE),
                        new Edge("B", "C", Atom.TRUE)),
                Map.of());

        // When
        propagator.propagate(graph, "S", EnumRegistry.of(q));

        // Then
        assertThat(graph.predicate("C")).contains(EnumIn.of(q, "a", "b"));
    }

    @Test
    void shouldReachNodesWithoutInboundEdgesUnconditionally() {
        // Given
        TransitionGraph graph = new TransitionGraph(
                List.of("S", "A", "orphan", "B"),
                List.of(new Edge("S", "A", x), new Edge("orphan", "B", y)),
                Map.of());

        // When
        propagator.propagate(graph, "S", EnumRegistry.EMPTY);

        // Then
        assertThat(graph.predicate("orphan")).contains(Atom.TRUE);
        assertThat(graph.predicate("B")).contains(y);
        assertThat(graph.predicates()).hasSize(4);
    }

    @Test
    void shouldRejectUnknownSource() {
        TransitionGraph graph = new TransitionGraph(List.of("S"), List.of(), Map.of());

        assertThatThrownBy(() -> propagator.propagate(graph, "Z", EnumRegistry.EMPTY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown source node: Z");
    }
}
