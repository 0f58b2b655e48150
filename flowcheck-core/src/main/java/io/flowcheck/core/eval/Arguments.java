package io.flowcheck.core.eval;

import io.flowcheck.core.expr.Expr;
import java.util.Collections;
import java.util.List;

/// Children of the node being evaluated, in raw and evaluated form.
///
/// @param <R> result type of the evaluator
public final class Arguments<R> {

    private final List<Expr> raw;
    private final List<R> evaluated;
    private final Leaves leaves;

    Arguments(List<Expr> raw, List<R> evaluated, Leaves leaves) {
        this.raw = raw;
        this.evaluated = Collections.unmodifiableList(evaluated);
        this.leaves = leaves;
    }

    /// Returns the evaluated child at `index`.
    ///
    /// @param index zero-based child position
    /// @return evaluation result of the child
    /// @throws IllegalStateException if the position was declared a leaf
    public R get(int index) {
        if (leaves.contains(index)) {
            throw new IllegalStateException("Child " + index + " is a leaf and was not evaluated");
        }
        return evaluated.get(index);
    }

    /// Returns the unevaluated child at `index`.
    ///
    /// @param index zero-based child position
    /// @return original child sub-tree, never null
    public Expr raw(int index) {
        return raw.get(index);
    }

    public boolean isLeaf(int index) {
        return leaves.contains(index);
    }

    public int size() {
        return raw.size();
    }

    /// Returns all evaluated children; leaf positions hold `null`.
    ///
    /// @return unmodifiable list, never null
    public List<R> evaluated() {
        return evaluated;
    }

    public List<Expr> raw() {
        return raw;
    }
}
