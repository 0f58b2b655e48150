package io.flowcheck.core.graph;

import static io.flowcheck.core.expr.Exprs.and;
import static io.flowcheck.core.expr.Exprs.bool;
import static io.flowcheck.core.expr.Exprs.not;
import static org.assertj.core.api.Assertions.assertThat;

import io.flowcheck.core.domain.EnumDomain;
import io.flowcheck.core.domain.EnumRegistry;
import io.flowcheck.core.expr.EnumIn;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Kind;
import io.flowcheck.core.pass.BooleanSimplifier;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SoundnessCheckerTest {

    private final BooleanSimplifier simplifier = new BooleanSimplifier();
    private final Expr x = bool("x");
    private final Expr y = bool("y");

    private SoundnessReport check(TransitionGraph graph, SelfLoopPolicy policy, EnumRegistry enums) {
        return new SoundnessChecker(simplifier, policy).check(graph, enums);
    }

    @Nested
    class ExhaustivenessTest {

        @Test
        void shouldAcceptComplementaryFilters() {
            // Given
            TransitionGraph graph = new TransitionGraph(
                    List.of("S", "A", "B"),
                    List.of(new Edge("S", "A", x), new Edge("S", "B", not(x))),
                    Map.of());

            // When
            SoundnessReport report = check(graph, SelfLoopPolicy.COUNT_FOR_SOUNDNESS, EnumRegistry.EMPTY);

            // Then
            assertThat(report.isSound()).isTrue();
            assertThat(report.checkedNodes()).isEqualTo(3);
        }

        @Test
        void shouldReportUncoveredCondition() {
            // Given
            TransitionGraph graph = new TransitionGraph(
                    List.of("S", "A", "B"),
                    List.of(new Edge("S", "A", x), new Edge("S", "B", and(x, y))),
                    Map.of());

            // When
            SoundnessReport report = check(graph, SelfLoopPolicy.COUNT_FOR_SOUNDNESS, EnumRegistry.EMPTY);

            // Then
            assertThat(report.isSound()).isFalse();
            assertThat(report.unsoundNodes()).containsExactly("S");
            SoundnessViolation violation = report.violations().get(0);
            assertThat(violation.covered()).isEqualTo(x);
            assertThat(violation.uncovered()).isEqualTo(not(x));
        }

        @Test
        void shouldReportMissingEnumMembers() {
            // Given
            EnumDomain q = EnumDomain.of("q", Kind.STRING, "a", "b", "c");
            TransitionGraph graph = new TransitionGraph(
                    List.of("S", "A", "B"),
                    List.of(new Edge("S", "A", EnumIn.of(q, "a")), new Edge("S", "B", EnumIn.of(q, "b"))),
                    Map.of());

            // When
            SoundnessReport report = check(graph, SelfLoopPolicy.COUNT_FOR_SOUNDNESS, EnumRegistry.of(q));

            // Then
            assertThat(report.violations()).singleElement()
                    .satisfies(v -> assertThat(v.uncovered()).isEqualTo(EnumIn.of(q, "c")));
        }

        @Test
        void shouldTreatTerminalNodesAsSound() {
            TransitionGraph graph = new TransitionGraph(List.of("end"), List.of(), Map.of());

            assertThat(check(graph, SelfLoopPolicy.DISCARD, EnumRegistry.EMPTY).isSound()).isTrue();
        }

        @Test
        void shouldReportEveryUnsoundNode() {
            TransitionGraph graph = new TransitionGraph(
                    List.of("S", "A", "B"),
                    List.of(new Edge("S", "A", x), new Edge("A", "B", y)),
                    Map.of());

            SoundnessReport report = check(graph, SelfLoopPolicy.COUNT_FOR_SOUNDNESS, EnumRegistry.EMPTY);

            assertThat(report.unsoundNodes()).containsExactly("S", "A");
        }
    }

    @Nested
    class SelfLoopTest {

        private TransitionGraph graphWithSelfLoop() {
            return new TransitionGraph(
                    List.of("S", "A"),
                    List.of(new Edge("S", "A", x)),
                    Map.of("S", not(x)));
        }

        @Test
        void shouldCountSelfLoopAsCoveredCase() {
            SoundnessReport report = check(graphWithSelfLoop(), SelfLoopPolicy.COUNT_FOR_SOUNDNESS, EnumRegistry.EMPTY);

            assertThat(report.isSound()).isTrue();
        }

        @Test
        void shouldIgnoreSelfLoopWhenDiscarded() {
            SoundnessReport report = check(graphWithSelfLoop(), SelfLoopPolicy.DISCARD, EnumRegistry.EMPTY);

            assertThat(report.unsoundNodes()).containsExactly("S");
        }
    }
}
