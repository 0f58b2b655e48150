package io.flowcheck.core.pass;

import static io.flowcheck.core.expr.Exprs.and;
import static io.flowcheck.core.expr.Exprs.bool;
import static io.flowcheck.core.expr.Exprs.not;
import static io.flowcheck.core.expr.Exprs.number;
import static io.flowcheck.core.expr.Exprs.or;
import static org.assertj.core.api.Assertions.assertThat;

import io.flowcheck.core.domain.EnumDomain;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.EnumIn;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Exprs;
import io.flowcheck.core.expr.Kind;
import org.junit.jupiter.api.Test;

class NegationNormalizerTest {

    private final NegationNormalizer normalizer = new NegationNormalizer();

    @Test
    void shouldPushNegationThroughJunctions() {
        // Given
        Expr expr = not(and(bool("a"), Exprs.gt(number("x"), Atom.of(1))));

        // When
        Expr result = normalizer.apply(expr);

        // Then
        assertThat(result).isEqualTo(or(not(bool("a")), Exprs.le(number("x"), Atom.of(1))));
    }

    @Test
    void shouldComplementEveryRelation() {
        Expr x = number("x");
        Expr one = Atom.of(1);

        assertThat(normalizer.negate(Exprs.lt(x, one))).isEqualTo(Exprs.ge(x, one));
        assertThat(normalizer.negate(Exprs.eq(x, one))).isEqualTo(Exprs.ne(x, one));
        assertThat(normalizer.negate(Exprs.ne(x, one))).isEqualTo(Exprs.eq(x, one));
    }

    @Test
    void shouldComplementMembership() {
        EnumDomain q = EnumDomain.of("q", Kind.STRING, "a", "b", "c");

        assertThat(normalizer.apply(not(EnumIn.of(q, "a")))).isEqualTo(EnumIn.of(q, "b", "c"));
    }

    @Test
    void shouldCancelDoubleNegation() {
        assertThat(normalizer.apply(not(not(bool("a"))))).isEqualTo(bool("a"));
    }

    @Test
    void shouldFlipBooleanLiterals() {
        assertThat(normalizer.negate(Atom.TRUE)).isEqualTo(Atom.FALSE);
    }

    @Test
    void shouldNormalizeNestedNegations() {
        Expr expr = or(bool("a"), not(or(bool("b"), not(bool("c")))));

        Expr result = normalizer.apply(expr);

        assertThat(result).isEqualTo(or(bool("a"), and(not(bool("b")), bool("c"))));
    }
}
