package io.flowcheck.core.expr;

import java.util.List;
import java.util.Objects;

/// Operator node: an operator tag applied to ordered operands.
///
/// `and`, `or`, `+`, `-`, `*` and `/` accept any positive number of operands; relations
/// take exactly two and unary operators exactly one.
///
/// @param operator operator tag, must satisfy {@link Tag#isOperator()}
/// @param args operands in order, copied on construction
public record Op(Tag operator, List<Expr> args) implements Expr {

    public Op {
        Objects.requireNonNull(operator, "operator");
        if (!operator.isOperator()) {
            throw new IllegalArgumentException(operator + " is not an operator tag");
        }
        args = List.copyOf(args);
        if (operator.isVariadic() ? args.isEmpty() : args.size() != operator.arity()) {
            throw new IllegalArgumentException(
                    "Operator " + operator.symbol() + " cannot take " + args.size() + " operands");
        }
    }

    public static Op of(Tag operator, Expr... args) {
        return new Op(operator, List.of(args));
    }

    @Override
    public Tag tag() {
        return operator;
    }

    @Override
    public List<Expr> children() {
        return args;
    }

    @Override
    public Expr withChildren(List<Expr> children) {
        return children.equals(args) ? this : new Op(operator, children);
    }

    public Expr arg(int index) {
        return args.get(index);
    }

    @Override
    public String toString() {
        return ExprFormatter.format(this);
    }
}
