package io.flowcheck.core.expr;

import java.util.Objects;

/// Opaque host object found by a scope lookup that is not itself an expression,
/// such as a variable scope or a macro. Only macro calls can consume it.
///
/// @param value referenced object, not null
public record Ref(Object value) implements Expr {

    public Ref {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Tag tag() {
        return Tag.REF;
    }

    @Override
    public String toString() {
        return ExprFormatter.format(this);
    }
}
