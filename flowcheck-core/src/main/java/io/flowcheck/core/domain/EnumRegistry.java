package io.flowcheck.core.domain;

import io.flowcheck.core.exception.ConfigurationException;
import io.flowcheck.core.exception.SemanticException;
import io.flowcheck.core.expr.Symbol;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Immutable name-indexed set of enumerations for one analysis run.
///
/// Built once from the flow document before any condition is compiled, then shared
/// read-only by every pass and worker thread.
public final class EnumRegistry {

    public static final EnumRegistry EMPTY = new EnumRegistry(Map.of());

    private final Map<String, EnumDomain> byName;

    private EnumRegistry(Map<String, EnumDomain> byName) {
        this.byName = byName;
    }

    /// Creates a registry from domains with unique names.
    ///
    /// @param domains enumerations, not null
    /// @return registry preserving the given order, never null
    /// @throws ConfigurationException if two domains share a name
    public static EnumRegistry of(Collection<EnumDomain> domains) {
        Map<String, EnumDomain> map = new LinkedHashMap<>();
        for (EnumDomain domain : domains) {
            if (map.putIfAbsent(domain.name(), domain) != null) {
                throw new ConfigurationException("Duplicate enum: " + domain.name());
            }
        }
        return new EnumRegistry(Collections.unmodifiableMap(map));
    }

    public static EnumRegistry of(EnumDomain... domains) {
        return of(List.of(domains));
    }

    public Optional<EnumDomain> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /// Returns the enumeration named `name`.
    ///
    /// @param name enum name, not null
    /// @return domain, never null
    /// @throws SemanticException if no enumeration has this name
    public EnumDomain require(String name) {
        EnumDomain domain = byName.get(name);
        if (domain == null) {
            throw new SemanticException("Unknown enum: " + name);
        }
        return domain;
    }

    /// Returns the enumeration whose domain variable is `symbol`.
    ///
    /// @param symbol symbol to match by name and kind, not null
    /// @return matching domain, or empty when the symbol is a plain variable
    public Optional<EnumDomain> forSymbol(Symbol symbol) {
        EnumDomain domain = byName.get(symbol.name());
        return domain != null && domain.kind() == symbol.kind()
                ? Optional.of(domain)
                : Optional.empty();
    }

    /// Returns the enumeration named like `symbol`, regardless of kind.
    ///
    /// @param symbol symbol, not null
    /// @return domain sharing the symbol's name, or empty
    public Optional<EnumDomain> byName(Symbol symbol) {
        return get(symbol.name());
    }

    public Collection<EnumDomain> all() {
        return byName.values();
    }

    public int size() {
        return byName.size();
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }
}
