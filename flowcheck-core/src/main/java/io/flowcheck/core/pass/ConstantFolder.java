package io.flowcheck.core.pass;

import io.flowcheck.core.eval.MacroPass;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Kind;
import io.flowcheck.core.expr.Tag;
import io.flowcheck.core.ops.ConcreteOperators;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Evaluates operators whose operands are all literals.
///
/// Arithmetic folds over numbers, `+` over strings concatenates, relations fold when both
/// sides are literals of the same kind and logic folds over boolean literals. Any node
/// with a non-literal operand, or with literals of mismatching kinds, is left for the
/// type checker.
public final class ConstantFolder extends MacroPass {

    public ConstantFolder() {
        on(Tag.ARITHMETIC, (node, args) -> foldArithmetic(node.tag(), args.evaluated()));
        on(Tag.RELATIONS, (node, args) -> foldRelation(node.tag(), args.evaluated()));
        on(List.of(Tag.AND, Tag.OR, Tag.NOT), (node, args) -> foldLogic(node.tag(), args.evaluated()));
    }

    /// Folds an arithmetic operator over literal operands.
    ///
    /// @param operator arithmetic tag, not null
    /// @param operands evaluated operands, not null
    /// @return folded literal, or empty when an operand is not a number literal
    ///     (or not a string literal, for concatenation)
    /// @throws io.flowcheck.core.exception.SemanticException on division by zero
    static Optional<Expr> foldArithmetic(Tag operator, List<Expr> operands) {
        List<Object> values = literals(operands);
        if (values == null) {
            return noOp();
        }
        boolean numbers = values.stream().allMatch(Number.class::isInstance);
        boolean strings = operator == Tag.ADD && values.stream().allMatch(String.class::isInstance);
        if (!numbers && !strings) {
            return noOp();
        }
        return replace(Atom.of(ConcreteOperators.INSTANCE.apply(operator, values)));
    }

    static Optional<Expr> foldRelation(Tag operator, List<Expr> operands) {
        List<Object> values = literals(operands);
        if (values == null || Kind.of(values.get(0)) != Kind.of(values.get(1))) {
            return noOp();
        }
        if (Kind.of(values.get(0)) == Kind.BOOLEAN && operator.category() == Tag.Category.INEQUATION) {
            return noOp();
        }
        return replace(Atom.of(ConcreteOperators.INSTANCE.apply(operator, values)));
    }

    private static Optional<Expr> foldLogic(Tag operator, List<Expr> operands) {
        List<Object> values = literals(operands);
        if (values == null || !values.stream().allMatch(Boolean.class::isInstance)) {
            return noOp();
        }
        return replace(Atom.of(ConcreteOperators.INSTANCE.apply(operator, values)));
    }

    // null when any operand is not a literal
    private static List<Object> literals(List<Expr> operands) {
        List<Object> values = new ArrayList<>(operands.size());
        for (Expr operand : operands) {
            if (!(operand instanceof Atom atom)) {
                return null;
            }
            values.add(atom.value());
        }
        return values;
    }
}
