package io.flowcheck.core.expr;

/// Host object that stands for an expression when it is looked up in a scope.
public interface ExprConvertible {

    /// Returns the expression this object denotes.
    ///
    /// @return expression fragment, never null
    Expr toExpr();
}
