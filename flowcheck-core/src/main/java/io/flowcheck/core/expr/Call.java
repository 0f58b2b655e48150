package io.flowcheck.core.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Function application as written in the condition text, e.g. `zofar.asNumber(q1)`.
///
/// The function position is child `0`; arguments follow as children `1..n`.
///
/// @param function expression denoting the function, usually a {@link Lookup}
/// @param args call arguments in order
public record Call(Expr function, List<Expr> args) implements Expr {

    public Call {
        Objects.requireNonNull(function, "function");
        args = List.copyOf(args);
    }

    @Override
    public Tag tag() {
        return Tag.CALL;
    }

    @Override
    public List<Expr> children() {
        List<Expr> children = new ArrayList<>(args.size() + 1);
        children.add(function);
        children.addAll(args);
        return List.copyOf(children);
    }

    @Override
    public Expr withChildren(List<Expr> children) {
        return new Call(children.get(0), children.subList(1, children.size()));
    }

    @Override
    public String toString() {
        return ExprFormatter.format(this);
    }
}
