package io.flowcheck.core.expr;

import java.util.List;

/// Immutable node of a condition expression tree.
///
/// Expressions are value types: structural equality (record equality) is algebraic
/// identity, which is what lets predicates over the same symbol be recognised and merged.
/// Trees are strict trees; sub-trees may be shared since nothing mutates them.
///
/// ### Variants
/// - {@link Atom} - literal number, string or boolean
/// - {@link Symbol} - named variable with a declared {@link Kind}
/// - {@link Op} - operator applied to ordered operands
/// - {@link EnumIn} - membership of an enumeration value in a member subset
/// - {@link Lookup}, {@link Call}, {@link Ref} - unresolved forms produced by the parser
///   and consumed by lookup resolution
///
/// @see io.flowcheck.core.eval.Evaluator for the recursive rewriting engine
public sealed interface Expr permits Atom, Symbol, Op, EnumIn, Lookup, Call, Ref {

    /// Returns the dispatch tag of this node.
    ///
    /// @return operator tag for {@link Op}, structural tag otherwise, never null
    Tag tag();

    /// Returns the ordered child expressions.
    ///
    /// @return immutable list of children, empty for leaf variants
    default List<Expr> children() {
        return List.of();
    }

    /// Returns a node of the same shape with the given children.
    ///
    /// @param children replacement children, same count as {@link #children()}
    /// @return rebuilt node, `this` for leaf variants
    default Expr withChildren(List<Expr> children) {
        if (!children.isEmpty()) {
            throw new IllegalArgumentException(tag() + " node has no children");
        }
        return this;
    }
}
