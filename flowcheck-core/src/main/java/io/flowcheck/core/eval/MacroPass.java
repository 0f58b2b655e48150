package io.flowcheck.core.eval;

import io.flowcheck.core.expr.Expr;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/// Evaluator rewriting expression trees into expression trees.
///
/// Unhandled nodes are rebuilt from their evaluated children; leaf positions keep the
/// original sub-tree. Passes are pure: the input tree is never modified.
public abstract class MacroPass extends Evaluator<Expr> implements UnaryOperator<Expr> {

    @Override
    public Expr apply(Expr expr) {
        return evaluate(expr);
    }

    @Override
    protected Expr passThrough(Expr node, Arguments<Expr> args) {
        if (args.size() == 0) {
            return node;
        }
        return node.withChildren(rebuilt(args));
    }

    /// Returns the children to rebuild a node from: evaluated where evaluated, raw at
    /// leaf positions.
    ///
    /// @param args arguments of the current node, not null
    /// @return children list, never null
    protected static List<Expr> rebuilt(Arguments<Expr> args) {
        List<Expr> children = new ArrayList<>(args.size());
        for (int i = 0; i < args.size(); i++) {
            children.add(args.isLeaf(i) ? args.raw(i) : args.get(i));
        }
        return children;
    }

    protected static Optional<Expr> noOp() {
        return Optional.empty();
    }

    protected static Optional<Expr> replace(Expr expr) {
        return Optional.of(expr);
    }
}
