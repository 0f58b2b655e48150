package io.flowcheck.core.domain;

import static org.assertj.core.api.Assertions.assertThat;

import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.EnumIn;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Exprs;
import io.flowcheck.core.expr.Kind;
import io.flowcheck.core.pass.BooleanSimplifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EnumEliminatorTest {

    private final EnumDomain q1 = EnumDomain.of("q1", Kind.STRING, "a", "b");
    private final EnumDomain q2 = EnumDomain.of("q2", Kind.STRING, "x", "y");

    private BooleanSimplifier simplifier;
    private EnumEliminator eliminator;

    @BeforeEach
    void setUp() {
        simplifier = new BooleanSimplifier();
        eliminator = new EnumEliminator(simplifier);
    }

    @Test
    void shouldKeepRelevantEnum() {
        // Given
        Expr expr = EnumIn.of(q1, "a");

        // When
        Expr result = eliminator.eliminate(expr, EnumRegistry.of(q1, q2));

        // Then
        assertThat(result).isEqualTo(expr);
    }

    @Test
    void shouldLeaveFormulaWithoutEnumsUntouched() {
        Expr expr = Exprs.bool("flag");

        assertThat(eliminator.eliminate(expr, EnumRegistry.of(q1))).isSameAs(expr);
    }

    @Test
    void shouldNullEnumThatHoldsForEveryMember() {
        // Given: unsimplified input, true for every answer of q1
        Expr expr = Exprs.or(EnumIn.of(q1, "a"), EnumIn.of(q1, "b"), Exprs.bool("flag"));

        // When
        Expr result = eliminator.eliminate(expr, EnumRegistry.of(q1, q2));

        // Then
        assertThat(result).isEqualTo(Exprs.bool("flag"));
    }

    @Test
    void shouldKeepEnumWhoseMembersDisagree() {
        Expr expr = simplifier.simplify(Exprs.or(EnumIn.of(q1, "a"), EnumIn.of(q2, "x")));

        Expr result = eliminator.eliminate(expr, EnumRegistry.of(q1, q2));

        assertThat(Exprs.domains(result)).containsExactlyInAnyOrder(q1, q2);
    }
}
