package io.flowcheck.core.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowcheck.core.exception.ConfigurationException;
import io.flowcheck.core.exception.SemanticException;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.EnumIn;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Exprs;
import io.flowcheck.core.expr.Kind;
import io.flowcheck.core.expr.Symbol;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EnumDomainTest {

    private final EnumDomain answer = EnumDomain.of("q1", Kind.STRING, "yes", "no", "maybe");
    private final EnumDomain codes = EnumDomain.of("q1_NUM", Kind.NUMBER, 1, 2, 3);

    @Nested
    class ConstructionTest {

        @Test
        void shouldRejectEmptyDomain() {
            assertThatThrownBy(() -> new EnumDomain("e", Kind.STRING, List.of()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("Enum 'e' has no members");
        }

        @Test
        void shouldRejectBooleanDomain() {
            assertThatThrownBy(() -> EnumDomain.of("e", Kind.BOOLEAN, true, false))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        void shouldRejectDuplicateMembers() {
            assertThatThrownBy(() -> EnumDomain.of("e", Kind.STRING, "a", "a"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("declares member a twice");
        }

        @Test
        void shouldRejectMembersOfOtherKind() {
            assertThatThrownBy(() -> EnumDomain.of("e", Kind.NUMBER, 1, "two"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("cannot hold member two");
        }

        @Test
        void shouldNormalizeIntegralMembers() {
            assertThat(codes.members()).containsExactly(1L, 2L, 3L);
            assertThat(codes.contains(2)).isTrue();
            assertThat(codes.contains(4L)).isFalse();
        }

        @Test
        void shouldMatchIntegralDoublesAgainstNumericCodes() {
            assertThat(codes.contains(1.0)).isTrue();
            assertThat(codes.contains(1.5)).isFalse();
            assertThat(codes.normalize(List.of(2.0))).containsExactly(2L);
        }

        @Test
        void shouldExposeDomainVariable() {
            assertThat(answer.symbol()).isEqualTo(new Symbol("q1", Kind.STRING));
        }
    }

    @Nested
    class SetAlgebraTest {

        @Test
        void shouldComputeComplementInDomainOrder() {
            assertThat(answer.complement(List.of("no"))).containsExactly("yes", "maybe");
            assertThat(answer.complement(List.of())).containsExactly("yes", "no", "maybe");
        }

        @Test
        void shouldRejectForeignMemberWhenNormalizing() {
            assertThatThrownBy(() -> answer.normalize(List.of("yes", "never")))
                    .isInstanceOf(SemanticException.class)
                    .hasMessageContaining("'never' is not a member of enum q1");
        }

        @Test
        void shouldBuildSingletonPredicate() {
            assertThat(answer.equalTo("no")).isEqualTo(EnumIn.of(answer, "no"));
        }
    }

    @Nested
    class SubstitutionTest {

        @Test
        void shouldReplacePredicatesByTheirTruthValue() {
            // Given
            Expr expr = Exprs.or(EnumIn.of(answer, "yes"), Exprs.and(EnumIn.of(answer, "no"), Exprs.bool("b")));

            // When
            Expr substituted = answer.substituteMember("no").apply(expr);

            // Then
            assertThat(substituted).isEqualTo(Exprs.or(Atom.FALSE, Exprs.and(Atom.TRUE, Exprs.bool("b"))));
        }

        @Test
        void shouldTurnPredicatesOverNulledDomainIntoFalse() {
            Expr expr = Exprs.and(EnumIn.of(answer, "yes", "no", "maybe"), EnumIn.of(codes, 1));

            Expr substituted = answer.nullSubstitution().apply(expr);

            assertThat(substituted).isEqualTo(Exprs.and(Atom.FALSE, EnumIn.of(codes, 1)));
        }

        @Test
        void shouldLetLaterAssignmentsWin() {
            Substitution combined = answer.nullSubstitution().andThen(answer.substituteMember("yes"));

            assertThat(combined.apply(EnumIn.of(answer, "yes"))).isEqualTo(Atom.TRUE);
        }

        @Test
        void shouldNullEveryGivenDomain() {
            Substitution nulled = Substitution.nullingAll(List.of(answer, codes));

            assertThat(nulled.apply(Exprs.or(EnumIn.of(answer, "yes"), EnumIn.of(codes, 2))))
                    .isEqualTo(Exprs.or(Atom.FALSE, Atom.FALSE));
            assertThat(Substitution.EMPTY.isEmpty()).isTrue();
        }

        @Test
        void shouldRejectSubstitutionByForeignMember() {
            assertThatThrownBy(() -> answer.substituteMember("never"))
                    .isInstanceOf(SemanticException.class);
        }
    }
}
