package io.flowcheck.core.pass;

import io.flowcheck.core.eval.Arguments;
import io.flowcheck.core.eval.Evaluator;
import io.flowcheck.core.eval.Leaves;
import io.flowcheck.core.exception.TypeMismatchException;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Kind;
import io.flowcheck.core.expr.Symbol;
import io.flowcheck.core.expr.Tag;
import java.util.List;
import java.util.Optional;

/// Infers the {@link Kind} of every sub-tree bottom-up.
///
/// ### Signatures
/// - `and`, `or`, `not`: boolean operands, boolean result
/// - relations: operands of one kind, boolean result; booleans only compare with `==`/`!=`
/// - arithmetic: number operands, number result; `+` over strings only is concatenation
/// - membership predicates are boolean
///
/// Unresolved identifiers, references and calls have no kind and are rejected.
public final class TypeChecker extends Evaluator<Kind> {

    public TypeChecker() {
        on(Tag.ATOM, Leaves.all(), (node, args) -> Optional.of(((Atom) node).kind()));
        on(Tag.SYMBOL, Leaves.all(), (node, args) -> Optional.of(((Symbol) node).kind()));
        on(Tag.ENUM_IN, Leaves.all(), (node, args) -> Optional.of(Kind.BOOLEAN));
        on(List.of(Tag.AND, Tag.OR, Tag.NOT), (node, args) -> {
            requireAll(node, args, Kind.BOOLEAN);
            return Optional.of(Kind.BOOLEAN);
        });
        on(Tag.RELATIONS, (node, args) -> {
            Kind left = args.get(0);
            Kind right = args.get(1);
            if (left != right) {
                throw new TypeMismatchException(
                        "Operands of '" + node.tag().symbol() + "' differ in type: "
                                + left.label() + " vs " + right.label() + " in " + node);
            }
            if (left == Kind.BOOLEAN && node.tag().category() == Tag.Category.INEQUATION) {
                throw new TypeMismatchException("Booleans cannot be ordered in " + node);
            }
            return Optional.of(Kind.BOOLEAN);
        });
        on(Tag.ARITHMETIC, (node, args) -> {
            if (node.tag() == Tag.ADD && args.evaluated().stream().allMatch(Kind.STRING::equals)) {
                return Optional.of(Kind.STRING);
            }
            requireAll(node, args, Kind.NUMBER);
            return Optional.of(Kind.NUMBER);
        });
    }

    /// Checks that a condition is well typed and boolean.
    ///
    /// @param condition condition tree, not null
    /// @throws TypeMismatchException if the tree is ill typed or not boolean
    public void requireBoolean(Expr condition) {
        Kind kind = evaluate(condition);
        if (kind != Kind.BOOLEAN) {
            throw new TypeMismatchException(
                    "Condition must be boolean but is " + kind.label() + ": " + condition);
        }
    }

    @Override
    protected Kind passThrough(Expr node, Arguments<Kind> args) {
        throw new TypeMismatchException("Cannot determine the type of unresolved " + node.tag().symbol()
                + " '" + node + "'");
    }

    private static void requireAll(Expr node, Arguments<Kind> args, Kind expected) {
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i) != expected) {
                throw new TypeMismatchException(
                        "Operator '" + node.tag().symbol() + "' expects " + expected.label()
                                + " operands but got " + args.get(i).label() + " in " + node);
            }
        }
    }
}
