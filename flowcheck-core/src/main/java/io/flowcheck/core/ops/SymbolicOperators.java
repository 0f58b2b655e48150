package io.flowcheck.core.ops;

import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Exprs;
import io.flowcheck.core.expr.Op;
import io.flowcheck.core.expr.Tag;
import java.util.ArrayList;
import java.util.List;

/// Operator table building canonical algebra nodes without evaluating literals.
///
/// - `and`, `or`, `+` and `*` flatten nested chains of the same operator
/// - `-` and `/` are rewritten onto `+`/`neg` and `*`/`inv`
/// - double `not`, `neg` and `inv` cancel, `pos` disappears
///
/// Stateless singleton.
public final class SymbolicOperators implements OperatorTable<Expr> {

    public static final SymbolicOperators INSTANCE = new SymbolicOperators();

    private SymbolicOperators() {}

    @Override
    public Expr apply(Tag operator, List<Expr> operands) {
        return switch (operator) {
            case AND, OR -> Exprs.junction(operator, flatten(operator, operands));
            case ADD, MUL -> chain(operator, flatten(operator, operands));
            case SUB -> chain(Tag.ADD, flatten(Tag.ADD, foldTail(Tag.NEG, operands)));
            case DIV -> chain(Tag.MUL, flatten(Tag.MUL, foldTail(Tag.INV, operands)));
            case NOT, NEG, INV -> unary(operator, operands.get(0));
            case POS -> operands.get(0);
            case EQ, NE, LT, LE, GT, GE -> new Op(operator, operands);
            default -> throw new IllegalArgumentException(operator + " is not an operator");
        };
    }

    private Expr unary(Tag operator, Expr operand) {
        if (operand.tag() == operator) {
            return operand.children().get(0);
        }
        return Op.of(operator, operand);
    }

    private List<Expr> foldTail(Tag inverse, List<Expr> operands) {
        List<Expr> result = new ArrayList<>(operands.size());
        result.add(operands.get(0));
        for (Expr operand : operands.subList(1, operands.size())) {
            result.add(unary(inverse, operand));
        }
        return result;
    }

    private static Expr chain(Tag operator, List<Expr> operands) {
        return operands.size() == 1 ? operands.get(0) : new Op(operator, operands);
    }

    private static List<Expr> flatten(Tag operator, List<Expr> operands) {
        List<Expr> result = new ArrayList<>(operands.size());
        for (Expr operand : operands) {
            result.addAll(Exprs.operands(operand, operator));
        }
        return result;
    }
}
