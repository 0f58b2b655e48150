package io.flowcheck.core.scope;

import io.flowcheck.core.exception.ConfigurationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Map-backed scope; nested paths are stored as nested {@link MapScope}s.
///
/// Filled while an analysis environment is assembled and only read afterwards.
public class MapScope implements Scope {

    private final Map<String, Object> bindings = new LinkedHashMap<>();

    public MapScope() {}

    public MapScope(Map<String, ?> bindings) {
        bindings.forEach(this::register);
    }

    /// Binds a value under a dot path, creating intermediate scopes as needed.
    ///
    /// @param dottedPath path such as `zofar.isMobile`, not null
    /// @param value value to bind, not null
    /// @return this scope for chaining
    /// @throws ConfigurationException if the path is already bound or crosses a non-scope value
    public MapScope register(String dottedPath, Object value) {
        String[] segments = dottedPath.split("\\.");
        MapScope target = this;
        for (int i = 0; i < segments.length - 1; i++) {
            Object existing = target.bindings.computeIfAbsent(segments[i], k -> new MapScope());
            if (!(existing instanceof MapScope nested)) {
                throw new ConfigurationException(
                        "Cannot register '" + dottedPath + "': '" + segments[i] + "' is not a scope");
            }
            target = nested;
        }
        String last = segments[segments.length - 1];
        if (target.bindings.putIfAbsent(last, value) != null) {
            throw new ConfigurationException("Identifier already bound: " + dottedPath);
        }
        return this;
    }

    @Override
    public Optional<Object> find(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    public Set<String> names() {
        return bindings.keySet();
    }

    @Override
    public String toString() {
        return "MapScope" + bindings.keySet();
    }
}
