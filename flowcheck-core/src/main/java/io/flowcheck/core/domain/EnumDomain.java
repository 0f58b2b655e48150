package io.flowcheck.core.domain;

import io.flowcheck.core.exception.ConfigurationException;
import io.flowcheck.core.exception.SemanticException;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.EnumIn;
import io.flowcheck.core.expr.Kind;
import io.flowcheck.core.expr.Symbol;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Finite enumeration a questionnaire variable ranges over.
///
/// An enumeration has one domain variable (its current value, exposed as
/// {@link #symbol()}) and an ordered list of member identifiers. Numeric enumerations hold
/// `Long` codes, string enumerations hold uid strings. Conditions mention an enumeration
/// only through {@link EnumIn} predicates, so two enumerations with colliding member ids
/// never share a symbolic identity.
///
/// Instances are immutable and safe to share across analysis worker threads.
///
/// ### Contracts
/// - **Precondition**: at least one member, no duplicates, every member of the declared kind
/// - **Postcondition**: member order is preserved and defines the order of every
///   {@link EnumIn} built over this domain
public final class EnumDomain {

    private final String name;
    private final Kind kind;
    private final List<Object> members;
    private final Map<Object, Integer> positions;
    private final int hash;

    public EnumDomain(String name, Kind kind, List<?> members) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        if (kind == Kind.BOOLEAN) {
            throw new ConfigurationException("Enum '" + name + "' cannot be boolean");
        }
        if (members.isEmpty()) {
            throw new ConfigurationException("Enum '" + name + "' has no members");
        }
        List<Object> normalized = new ArrayList<>(members.size());
        Map<Object, Integer> index = new HashMap<>();
        for (Object member : members) {
            Object value = normalizeValue(member);
            if (Kind.of(value) != kind) {
                throw new ConfigurationException(
                        "Enum '" + name + "' of kind " + kind.label()
                                + " cannot hold member " + member);
            }
            if (index.putIfAbsent(value, normalized.size()) != null) {
                throw new ConfigurationException(
                        "Enum '" + name + "' declares member " + member + " twice");
            }
            normalized.add(value);
        }
        this.members = List.copyOf(normalized);
        this.positions = Map.copyOf(index);
        this.hash = Objects.hash(name, kind, this.members);
    }

    public static EnumDomain of(String name, Kind kind, Object... members) {
        return new EnumDomain(name, kind, List.of(members));
    }

    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    /// Returns the members in declaration order.
    ///
    /// @return immutable member list, never empty
    public List<Object> members() {
        return members;
    }

    /// Returns the domain variable.
    ///
    /// @return symbol named after this enumeration with its kind, never null
    public Symbol symbol() {
        return new Symbol(name, kind);
    }

    public boolean contains(Object member) {
        return member != null && positions.containsKey(normalizeValue(member));
    }

    /// Orders and validates a member collection.
    ///
    /// @param candidates members to normalise, not null
    /// @return immutable set iterating in domain order, never null
    /// @throws SemanticException if a candidate is not a member of this enumeration
    public Set<Object> normalize(Collection<?> candidates) {
        boolean[] selected = new boolean[members.size()];
        for (Object candidate : candidates) {
            Integer position = candidate == null ? null : positions.get(normalizeValue(candidate));
            if (position == null) {
                throw new SemanticException(
                        "'" + candidate + "' is not a member of enum " + name + members);
            }
            selected[position] = true;
        }
        Set<Object> result = new LinkedHashSet<>();
        for (int i = 0; i < selected.length; i++) {
            if (selected[i]) {
                result.add(members.get(i));
            }
        }
        return Collections.unmodifiableSet(result);
    }

    /// Returns the members not contained in `subset`, in domain order.
    ///
    /// @param subset members to exclude, each must belong to this enumeration
    /// @return complement within the domain, never null
    public Set<Object> complement(Collection<?> subset) {
        Set<Object> excluded = normalize(subset);
        List<Object> rest = new ArrayList<>(members);
        rest.removeAll(excluded);
        return normalize(rest);
    }

    /// Returns the predicate "the domain variable equals `member`".
    ///
    /// @param member member id, must belong to this enumeration
    /// @return singleton membership predicate, never null
    public EnumIn equalTo(Object member) {
        return EnumIn.of(this, member);
    }

    /// Returns the substitution fixing the domain variable to `member`.
    ///
    /// @param member member id, must belong to this enumeration
    /// @return single-assignment substitution, never null
    public Substitution substituteMember(Object member) {
        if (!contains(member)) {
            throw new SemanticException("'" + member + "' is not a member of enum " + name);
        }
        return Substitution.member(this, normalizeValue(member));
    }

    /// Returns the substitution removing every trace of this enumeration from a formula.
    ///
    /// @return null substitution, never null
    public Substitution nullSubstitution() {
        return Substitution.nulled(this);
    }

    // integral doubles denote the same code as the equal long in numeric enumerations
    private Object normalizeValue(Object member) {
        Object value = new Atom(member).value();
        if (kind == Kind.NUMBER && value instanceof Double d
                && d == Math.rint(d) && Math.abs(d) < 0x1p63) {
            return d.longValue();
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EnumDomain other)) {
            return false;
        }
        return hash == other.hash
                && name.equals(other.name)
                && kind == other.kind
                && members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return name + members;
    }
}
