package io.flowcheck.core.pass;

import static io.flowcheck.core.expr.Exprs.bool;
import static io.flowcheck.core.expr.Exprs.number;
import static io.flowcheck.core.expr.Exprs.string;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowcheck.core.exception.TypeMismatchException;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.Exprs;
import io.flowcheck.core.expr.Kind;
import io.flowcheck.core.expr.Lookup;
import org.junit.jupiter.api.Test;

class TypeCheckerTest {

    private final TypeChecker checker = new TypeChecker();

    @Test
    void shouldInferKindsBottomUp() {
        assertThat(checker.evaluate(Exprs.add(number("x"), Atom.of(1)))).isEqualTo(Kind.NUMBER);
        assertThat(checker.evaluate(Exprs.add(string("s"), Atom.of("t")))).isEqualTo(Kind.STRING);
        assertThat(checker.evaluate(Exprs.gt(number("x"), Atom.of(2.5)))).isEqualTo(Kind.BOOLEAN);
    }

    @Test
    void shouldAcceptWellTypedCondition() {
        assertThatCode(() -> checker.requireBoolean(
                        Exprs.and(bool("b"), Exprs.eq(string("s"), Atom.of("x")))))
                .doesNotThrowAnyException();
    }

    @Test
    void shouldRejectRelationBetweenDifferentKinds() {
        assertThatThrownBy(() -> checker.requireBoolean(Exprs.eq(number("x"), Atom.of("a"))))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("differ in type: number vs string");
    }

    @Test
    void shouldRejectNonBooleanCondition() {
        assertThatThrownBy(() -> checker.requireBoolean(Exprs.add(number("x"), Atom.of(1))))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessage("Condition must be boolean but is number: x + 1");
    }

    @Test
    void shouldRejectOrderingOfBooleans() {
        assertThatThrownBy(() -> checker.requireBoolean(Exprs.lt(bool("a"), bool("b"))))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("Booleans cannot be ordered");
    }

    @Test
    void shouldRejectNonBooleanJunctionOperand() {
        assertThatThrownBy(() -> checker.requireBoolean(Exprs.and(bool("a"), number("n"))))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("Operator 'and' expects boolean operands but got number");
    }

    @Test
    void shouldRejectUnresolvedIdentifiers() {
        assertThatThrownBy(() -> checker.requireBoolean(Lookup.of("q1.value")))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessage("Cannot determine the type of unresolved lookup 'q1.value'");
    }
}
