package io.flowcheck.core.pass;

import io.flowcheck.core.eval.Leaves;
import io.flowcheck.core.eval.MacroPass;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.EnumIn;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Exprs;
import io.flowcheck.core.expr.Op;
import io.flowcheck.core.expr.Tag;
import java.util.List;
import java.util.stream.Collectors;

/// Pushes negation down to the leaves of a boolean tree.
///
/// - `!(a and b)` becomes `!a or !b` and dually for `or`
/// - `!(x lt y)` becomes `x ge y` (complementary relation)
/// - `!(e in S)` becomes `e in D\S` over the domain `D` of `e`
/// - `!!a` becomes `a`, `!true` becomes `false`
///
/// A `not` survives only directly above a node that has no complement, such as a
/// boolean variable.
public final class NegationNormalizer extends MacroPass {

    public NegationNormalizer() {
        on(Tag.NOT, Leaves.all(), (node, args) -> replace(negate(args.raw(0))));
    }

    /// Returns the negation normal form of `!expr`.
    ///
    /// @param expr expression to negate, not null
    /// @return negated expression with negation pushed to the leaves, never null
    public Expr negate(Expr expr) {
        if (expr instanceof Atom atom && atom.value() instanceof Boolean value) {
            return Atom.of(!value);
        }
        if (expr instanceof EnumIn in) {
            return in.negate();
        }
        Tag tag = expr.tag();
        if (tag == Tag.NOT) {
            return evaluate(expr.children().get(0));
        }
        if (tag == Tag.AND || tag == Tag.OR) {
            return Exprs.junction(tag == Tag.AND ? Tag.OR : Tag.AND, negateAll(expr.children()));
        }
        if (tag.isRelation()) {
            return new Op(tag.complement(), evaluateAll(expr.children()));
        }
        return Op.of(Tag.NOT, evaluate(expr));
    }

    private List<Expr> negateAll(List<Expr> children) {
        return children.stream().map(this::negate).collect(Collectors.toList());
    }

    private List<Expr> evaluateAll(List<Expr> children) {
        return children.stream().map(this::evaluate).collect(Collectors.toList());
    }
}
