package io.flowcheck.core.expr;

import java.util.List;

/// Unresolved scoped identifier such as `page.question.value`.
///
/// @param path identifier segments, at least one
public record Lookup(List<String> path) implements Expr {

    public Lookup {
        path = List.copyOf(path);
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Lookup path is empty");
        }
    }

    public static Lookup of(String dottedPath) {
        return new Lookup(List.of(dottedPath.split("\\.")));
    }

    @Override
    public Tag tag() {
        return Tag.LOOKUP;
    }

    @Override
    public String toString() {
        return ExprFormatter.format(this);
    }
}
