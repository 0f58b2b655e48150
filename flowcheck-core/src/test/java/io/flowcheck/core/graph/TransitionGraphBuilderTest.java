package io.flowcheck.core.graph;

import static io.flowcheck.core.expr.Exprs.bool;
import static io.flowcheck.core.expr.Exprs.not;
import static io.flowcheck.core.expr.Exprs.or;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.flowcheck.core.exception.ConfigurationException;
import io.flowcheck.core.exception.FlowCheckException;
import io.flowcheck.core.exception.SemanticException;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.pass.BooleanSimplifier;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TransitionGraphBuilderTest {

    private final Expr x = bool("x");
    private final Expr y = bool("y");

    private ExecutorService executor;
    private TransitionGraphBuilder builder;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        builder = new TransitionGraphBuilder(new BooleanSimplifier(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Map<String, List<Transition>> transitions(String source, List<Transition> list) {
        Map<String, List<Transition>> map = new LinkedHashMap<>();
        map.put(source, list);
        return map;
    }

    private static Map<String, List<Transition>> transitions(
            String first, List<Transition> firstList, String second, List<Transition> secondList) {
        Map<String, List<Transition>> map = transitions(first, firstList);
        map.put(second, secondList);
        return map;
    }

    @Nested
    class OverrideTest {

        @Test
        void shouldExcludeEarlierConditionsFromLaterFilters() {
            // Given
            Map<String, List<Transition>> transitions = transitions(
                    "A", List.of(new Transition(x, "B"), Transition.always("C")));

            // When
            TransitionGraph graph = builder.build(transitions);

            // Then
            assertThat(graph.nodes()).containsExactly("A", "B", "C");
            assertThat(graph.edge("A", "B").orElseThrow().filter()).isEqualTo(x);
            assertThat(graph.edge("A", "C").orElseThrow().filter()).isEqualTo(not(x));
        }

        @Test
        void shouldJoinFiltersOfSameTargetWithOr() {
            // Given
            Map<String, List<Transition>> transitions = transitions(
                    "A", List.of(new Transition(x, "B"), new Transition(y, "C"), Transition.always("B")));

            // When
            TransitionGraph graph = builder.build(transitions);

            // Then
            assertThat(graph.edges()).hasSize(2);
            assertThat(graph.edge("A", "B").orElseThrow().filter()).isEqualTo(or(not(y), x));
        }

        @Test
        void shouldDropTransitionsShadowedByUnconditionalOne() {
            Map<String, List<Transition>> transitions = transitions(
                    "A", List.of(Transition.always("B"), new Transition(x, "C")));

            TransitionGraph graph = builder.build(transitions);

            assertThat(graph.edge("A", "C").orElseThrow().filter()).isEqualTo(Atom.FALSE);
        }
    }

    @Nested
    class CycleTest {

        @Test
        void shouldRejectCycleAndNameIt() {
            Map<String, List<Transition>> transitions = transitions(
                    "A", List.of(Transition.always("B")),
                    "B", List.of(new Transition(x, "A"), Transition.always("C")));

            assertThatThrownBy(() -> builder.build(transitions))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("Cycle detected: A -> B -> A");
        }

        @Test
        void shouldRecordSelfLoopSeparately() {
            // Given
            Map<String, List<Transition>> transitions = transitions(
                    "A", List.of(new Transition(x, "A"), Transition.always("B")));

            // When
            TransitionGraph graph = builder.build(transitions);

            // Then
            assertThat(graph.selfLoopFilter("A")).contains(x);
            assertThat(graph.edges()).extracting(Edge::target).containsExactly("B");
            assertThat(graph.edge("A", "B").orElseThrow().filter()).isEqualTo(not(x));
        }
    }

    @Nested
    class NodesTest {

        @Test
        void shouldIncludeIsolatedNodes() {
            TransitionGraph graph = builder.build(
                    List.of("start", "orphan"), transitions("start", List.of(Transition.always("end"))));

            assertThat(graph.nodes()).containsExactly("start", "orphan", "end");
            assertThat(graph.outgoing("orphan")).isEmpty();
        }

        @Test
        void shouldRejectUnknownNodeQueries() {
            TransitionGraph graph = builder.build(transitions("A", List.of(Transition.always("B"))));

            assertThatThrownBy(() -> graph.outgoing("Z"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Unknown node: Z");
        }
    }

    @Nested
    class ConcurrencyTest {

        @Test
        void shouldRethrowSimplificationFailure() {
            // Given
            TransitionGraphBuilder failing = new TransitionGraphBuilder(expr -> {
                throw new SemanticException("boom");
            }, executor);

            // When / Then
            assertThatThrownBy(() -> failing.build(transitions("A", List.of(new Transition(x, "B")))))
                    .isInstanceOf(SemanticException.class)
                    .hasMessage("boom");
        }

        @Test
        void shouldWrapInterruption() throws Exception {
            // Given
            ExecutorService interrupted = mock(ExecutorService.class);
            when(interrupted.invokeAll(any())).thenThrow(new InterruptedException());
            TransitionGraphBuilder blocked = new TransitionGraphBuilder(new BooleanSimplifier(), interrupted);

            try {
                // When / Then
                assertThatThrownBy(() -> blocked.build(transitions("A", List.of(new Transition(x, "B")))))
                        .isInstanceOf(FlowCheckException.class)
                        .hasMessage("Interrupted while simplifying edge filters")
                        .hasCauseInstanceOf(InterruptedException.class);
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }
        }
    }
}
