package io.flowcheck.core.expr;

import java.util.Objects;

/// Literal value: a `Long`, `Double`, `Boolean` or `String`.
///
/// Integral Java numbers are widened to `Long` so that literals parsed from text and
/// literals built in code compare equal.
///
/// @param value literal value, not null
public record Atom(Object value) implements Expr {

    public static final Atom TRUE = new Atom(Boolean.TRUE);
    public static final Atom FALSE = new Atom(Boolean.FALSE);

    public Atom {
        Objects.requireNonNull(value, "value");
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            value = ((Number) value).longValue();
        } else if (value instanceof Float f) {
            value = f.doubleValue();
        }
        if (!(value instanceof Long
                || value instanceof Double
                || value instanceof Boolean
                || value instanceof String)) {
            throw new IllegalArgumentException(
                    "Unsupported literal type: " + value.getClass().getName());
        }
    }

    public static Atom of(Object value) {
        if (value instanceof Boolean b) {
            return of(b.booleanValue());
        }
        return new Atom(value);
    }

    public static Atom of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public Tag tag() {
        return Tag.ATOM;
    }

    public Kind kind() {
        return Kind.of(value);
    }

    public boolean isTrue() {
        return Boolean.TRUE.equals(value);
    }

    public boolean isFalse() {
        return Boolean.FALSE.equals(value);
    }

    /// Returns whether the given expression is the boolean literal `value`.
    ///
    /// @param expr expression to test, may be null
    /// @param value boolean to compare against
    /// @return `true` if `expr` is an atom holding exactly `value`
    public static boolean is(Expr expr, boolean value) {
        return expr instanceof Atom atom && Boolean.valueOf(value).equals(atom.value);
    }

    @Override
    public String toString() {
        return ExprFormatter.format(this);
    }
}
