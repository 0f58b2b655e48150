package io.flowcheck.core.pass;

import static io.flowcheck.core.expr.Exprs.and;
import static io.flowcheck.core.expr.Exprs.bool;
import static io.flowcheck.core.expr.Exprs.not;
import static io.flowcheck.core.expr.Exprs.number;
import static io.flowcheck.core.expr.Exprs.or;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowcheck.core.domain.EnumDomain;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.EnumIn;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Exprs;
import io.flowcheck.core.expr.Kind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BooleanSimplifierTest {

    private final Expr a = bool("a");
    private final Expr b = bool("b");
    private final Expr c = bool("c");
    private final EnumDomain q = EnumDomain.of("q", Kind.STRING, "w", "x", "y", "z");

    private BooleanSimplifier simplifier;

    @BeforeEach
    void setUp() {
        simplifier = new BooleanSimplifier();
    }

    @Nested
    class JunctionTest {

        @Test
        void shouldFoldComplementaryPairs() {
            assertThat(simplifier.simplify(or(a, not(a)))).isEqualTo(Atom.TRUE);
            assertThat(simplifier.simplify(and(a, not(a)))).isEqualTo(Atom.FALSE);
        }

        @Test
        void shouldApplyAnnihilatorAndIdentity() {
            assertThat(simplifier.simplify(or(a, Atom.TRUE))).isEqualTo(Atom.TRUE);
            assertThat(simplifier.simplify(and(a, Atom.TRUE))).isEqualTo(a);
            assertThat(simplifier.simplify(or(Atom.FALSE, a, Atom.FALSE))).isEqualTo(a);
        }

        @Test
        void shouldFlattenAndDeduplicate() {
            Expr result = simplifier.simplify(and(b, and(a, b), a));

            assertThat(result).isEqualTo(and(a, b));
        }

        @Test
        void shouldAbsorbImpliedOperands() {
            assertThat(simplifier.simplify(or(a, and(a, b)))).isEqualTo(a);
            assertThat(simplifier.simplify(and(a, or(a, b)))).isEqualTo(a);
        }

        @Test
        void shouldResolveOnComplementaryLiteral() {
            // Given
            Expr expr = or(and(a, b), and(a, not(b)), c);

            // When
            Expr result = simplifier.simplify(expr);

            // Then
            assertThat(result).isEqualTo(or(a, c));
        }

        @Test
        void shouldDetectTautologyAcrossOperands() {
            Expr result = simplifier.simplify(or(and(a, b), not(a), not(b)));

            assertThat(result).isEqualTo(Atom.TRUE);
        }
    }

    @Nested
    class MembershipTest {

        @Test
        void shouldIntersectPredicatesUnderAnd() {
            Expr result = simplifier.simplify(and(EnumIn.of(q, "w", "x"), EnumIn.of(q, "x", "y")));

            assertThat(result).isEqualTo(EnumIn.of(q, "x"));
        }

        @Test
        void shouldUnitePredicatesUnderOr() {
            Expr result = simplifier.simplify(or(EnumIn.of(q, "w"), EnumIn.of(q, "x")));

            assertThat(result).isEqualTo(EnumIn.of(q, "w", "x"));
        }

        @Test
        void shouldFoldFullDomainToTrue() {
            Expr result = simplifier.simplify(or(EnumIn.of(q, "w", "x"), EnumIn.of(q, "y", "z")));

            assertThat(result).isEqualTo(Atom.TRUE);
        }

        @Test
        void shouldFoldDisjointPredicatesToFalse() {
            Expr result = simplifier.simplify(and(EnumIn.of(q, "w"), EnumIn.of(q, "z")));

            assertThat(result).isEqualTo(Atom.FALSE);
        }

        @Test
        void shouldNegateIntoComplement() {
            Expr result = simplifier.simplify(not(EnumIn.of(q, "w")));

            assertThat(result).isEqualTo(EnumIn.of(q, "x", "y", "z"));
        }

        @Test
        void shouldSplitSubsetWhenItShrinksTheTree() {
            // Given
            Expr input = or(and(EnumIn.of(q, "w", "x"), a), and(EnumIn.of(q, "w"), not(a)));

            // When
            Expr result = simplifier.simplify(input);

            // Then
            assertThat(result).hasToString("a and q in {'x'} or q in {'w'}");
            assertThat(Exprs.size(result)).isLessThan(Exprs.size(input));
            assertThat(simplifier.simplify(result)).isEqualTo(result);
        }
    }

    @Nested
    class RelationTest {

        @Test
        void shouldFoldLiteralRelations() {
            Expr expr = Exprs.eq(Exprs.add(Atom.of(1), Atom.of(2)), Atom.of(3));

            assertThat(simplifier.simplify(expr)).isEqualTo(Atom.TRUE);
        }

        @Test
        void shouldMoveLiteralToTheRight() {
            Expr result = simplifier.simplify(Exprs.lt(Atom.of(5), number("x")));

            assertThat(result).isEqualTo(Exprs.gt(number("x"), Atom.of(5)));
            assertThat(result.toString()).isEqualTo("x gt 5");
        }

        @Test
        void shouldReduceComparisonWithBooleanLiteral() {
            assertThat(simplifier.simplify(Exprs.eq(a, Atom.TRUE))).isEqualTo(a);
            assertThat(simplifier.simplify(Exprs.eq(a, Atom.FALSE))).isEqualTo(not(a));
        }

        @Test
        void shouldTreatComplementaryRelationsAsTautology() {
            Expr x = number("x");

            Expr result = simplifier.simplify(or(Exprs.gt(x, Atom.of(5)), Exprs.le(x, Atom.of(5))));

            assertThat(result).isEqualTo(Atom.TRUE);
        }

        @Test
        void shouldFoldReflexiveRelations() {
            Expr x = number("x");

            assertThat(simplifier.simplify(Exprs.eq(x, x))).isEqualTo(Atom.TRUE);
            assertThat(simplifier.simplify(Exprs.lt(x, x))).isEqualTo(Atom.FALSE);
        }
    }

    @Nested
    class NegationTest {

        @Test
        void shouldApplyDeMorgan() {
            Expr result = simplifier.simplify(not(and(a, b)));

            assertThat(result).isEqualTo(or(not(a), not(b)));
        }

        @Test
        void shouldCancelDoubleNegation() {
            assertThat(simplifier.simplify(not(not(a)))).isEqualTo(a);
        }
    }

    @Nested
    class ContractTest {

        @Test
        void shouldBeIdempotent() {
            // Given
            Expr expr = or(
                    and(a, EnumIn.of(q, "w", "x")),
                    and(not(b), EnumIn.of(q, "y")),
                    Exprs.gt(number("n"), Atom.of(2)));

            // When
            Expr once = simplifier.simplify(expr);
            Expr twice = simplifier.simplify(once);

            // Then
            assertThat(twice).isEqualTo(once);
        }

        @Test
        void shouldRejectAtomLimitOutOfRange() {
            assertThatThrownBy(() -> new BooleanSimplifier(31))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("truthTableAtomLimit must be within [0, 30]: 31");
            assertThatThrownBy(() -> new BooleanSimplifier(-1))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldLeaveInputUnchanged() {
            Expr expr = and(a, a);

            simplifier.simplify(expr);

            assertThat(expr).isEqualTo(and(a, a));
        }
    }
}
