package io.flowcheck.core.expr;

import java.util.Locale;

/// Value kinds a condition subtree can evaluate to.
///
/// Every symbol declares its kind, every literal derives it from its Java value, and the
/// type checker infers it for every operator node.
public enum Kind {
    NUMBER,
    STRING,
    BOOLEAN;

    /// Derives the kind of a literal Java value.
    ///
    /// @param value a `Long`, `Double`, `Integer`, `Boolean` or `String`, not null
    /// @return the matching kind, never null
    /// @throws IllegalArgumentException if the value has no condition kind
    public static Kind of(Object value) {
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof String) {
            return STRING;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        throw new IllegalArgumentException(
                "No condition kind for value of type "
                        + (value == null ? "null" : value.getClass().getName()));
    }

    /// Parses a lower-case kind name as used in flow documents (`number`, `string`, `boolean`).
    ///
    /// @param name kind name, not null
    /// @return the kind, never null
    /// @throws IllegalArgumentException for unknown names
    public static Kind fromName(String name) {
        return Kind.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }

    /// Returns the lower-case name used in messages and documents.
    ///
    /// @return kind name, never null
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
