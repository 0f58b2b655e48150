package io.flowcheck.core.expr;

import java.util.Objects;

/// Named variable of a declared kind.
///
/// Two symbols are the same variable only if both name and kind match.
///
/// @param name variable name, not null
/// @param kind declared value kind, not null
public record Symbol(String name, Kind kind) implements Expr {

    public Symbol {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    @Override
    public Tag tag() {
        return Tag.SYMBOL;
    }

    @Override
    public String toString() {
        return ExprFormatter.format(this);
    }
}
