package io.flowcheck.core.pass;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowcheck.core.domain.EnumDomain;
import io.flowcheck.core.domain.EnumRegistry;
import io.flowcheck.core.exception.SemanticException;
import io.flowcheck.core.exception.TypeMismatchException;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.EnumIn;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Exprs;
import io.flowcheck.core.expr.Kind;
import io.flowcheck.core.expr.Symbol;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EnumRelationResolverTest {

    private final EnumDomain answer = EnumDomain.of("q1", Kind.STRING, "a", "b", "c");
    private final EnumDomain codes = EnumDomain.of("q1_NUM", Kind.NUMBER, 1, 2, 3);
    private final Symbol q1 = answer.symbol();
    private final Symbol q1Num = codes.symbol();

    private EnumRelationResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new EnumRelationResolver(EnumRegistry.of(answer, codes));
    }

    @Nested
    class EqualityTest {

        @Test
        void shouldTurnEqualityIntoMembership() {
            assertThat(resolver.apply(Exprs.eq(q1, Atom.of("a")))).isEqualTo(EnumIn.of(answer, "a"));
            assertThat(resolver.apply(Exprs.eq(Atom.of("a"), q1))).isEqualTo(EnumIn.of(answer, "a"));
        }

        @Test
        void shouldTurnInequalityIntoNegativeMembership() {
            Expr result = resolver.apply(Exprs.ne(q1, Atom.of("b")));

            assertThat(result).isEqualTo(new EnumIn(answer, Set.of("b"), false));
        }

        @Test
        void shouldResolveRelationsNestedInLogic() {
            // Given
            Expr expr = Exprs.or(Exprs.bool("flag"), Exprs.not(Exprs.eq(q1, Atom.of("c"))));

            // When
            Expr result = resolver.apply(expr);

            // Then
            assertThat(result).isEqualTo(Exprs.or(Exprs.bool("flag"), Exprs.not(EnumIn.of(answer, "c"))));
        }

        @Test
        void shouldLeavePlainVariablesAlone() {
            Expr expr = Exprs.eq(Exprs.string("other"), Atom.of("a"));

            assertThat(resolver.apply(expr)).isEqualTo(expr);
        }

        @Test
        void shouldRejectUnknownMember() {
            assertThatThrownBy(() -> resolver.apply(Exprs.eq(q1, Atom.of("z"))))
                    .isInstanceOf(SemanticException.class)
                    .hasMessage("q1 must be one of [a, b, c], found 'z'");
        }

        @Test
        void shouldRejectLiteralOfOtherKind() {
            assertThatThrownBy(() -> resolver.apply(Exprs.eq(q1, Atom.of(1))))
                    .isInstanceOf(TypeMismatchException.class)
                    .hasMessageContaining("Cannot compare enum q1 of type string with number literal");
        }
    }

    @Nested
    class InequationTest {

        @Test
        void shouldSelectMembersSatisfyingInequation() {
            assertThat(resolver.apply(Exprs.gt(q1Num, Atom.of(1)))).isEqualTo(EnumIn.of(codes, 2L, 3L));
            assertThat(resolver.apply(Exprs.le(q1Num, Atom.of(2)))).isEqualTo(EnumIn.of(codes, 1L, 2L));
        }

        @Test
        void shouldHonourLiteralOnTheLeft() {
            Expr result = resolver.apply(Exprs.lt(Atom.of(2), q1Num));

            assertThat(result).isEqualTo(EnumIn.of(codes, 3L));
        }

        @Test
        void shouldRejectInequationWithoutSatisfyingMember() {
            assertThatThrownBy(() -> resolver.apply(Exprs.gt(q1Num, Atom.of(10))))
                    .isInstanceOf(SemanticException.class)
                    .hasMessageStartingWith("No member of enum q1_NUM");
        }

        @Test
        void shouldRejectInequationOnStringEnum() {
            assertThatThrownBy(() -> resolver.apply(Exprs.gt(q1, Atom.of("a"))))
                    .isInstanceOf(TypeMismatchException.class)
                    .hasMessage("Inequation 'gt' requires a numeric enum, q1 is string");
        }
    }
}
