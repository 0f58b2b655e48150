package io.flowcheck.core.scope;

import io.flowcheck.core.exception.SemanticException;
import java.util.List;
import java.util.Optional;

/// Hierarchical name lookup used to resolve identifiers in condition text.
///
/// A dot path such as `zofar.asNumber` is resolved segment by segment: every segment
/// but the last must resolve to a nested {@link Scope}.
public interface Scope {

    /// Resolves a single identifier in this scope.
    ///
    /// @param name identifier without dots, not null
    /// @return bound value, or empty if the name is unbound here
    Optional<Object> find(String name);

    /// Resolves a path through nested scopes.
    ///
    /// @param path identifier segments, not empty
    /// @return bound value, never null
    /// @throws SemanticException if a segment is unbound or an intermediate value is not a scope
    default Object lookup(List<String> path) {
        Object current = this;
        for (int i = 0; i < path.size(); i++) {
            if (!(current instanceof Scope scope)) {
                throw new SemanticException(
                        "'" + String.join(".", path.subList(0, i)) + "' is not a scope");
            }
            String segment = path.get(i);
            current = scope.find(segment)
                    .orElseThrow(() -> new SemanticException(
                            "Unknown identifier: " + String.join(".", path)));
        }
        return current;
    }

    default Object lookup(String dottedPath) {
        return lookup(List.of(dottedPath.split("\\.")));
    }
}
