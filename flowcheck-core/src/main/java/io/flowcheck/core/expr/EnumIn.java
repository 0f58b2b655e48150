package io.flowcheck.core.expr;

import io.flowcheck.core.domain.EnumDomain;
import io.flowcheck.core.exception.SemanticException;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/// Membership predicate: the value of an enumeration lies in (or, with negative polarity,
/// outside) a subset of its domain.
///
/// Members are normalised to domain order on construction so that equal sets give equal
/// records regardless of how they were built.
///
/// ### Contracts
/// - **Precondition**: every member belongs to `domain`
/// - **Postcondition**: `members` is an immutable set iterating in domain order
///
/// @param domain enumeration the predicate ranges over, not null
/// @param members subset of the domain members
/// @param positive `true` for "in", `false` for "not in"
public record EnumIn(EnumDomain domain, Set<Object> members, boolean positive) implements Expr {

    public EnumIn {
        Objects.requireNonNull(domain, "domain");
        members = domain.normalize(members);
    }

    /// Creates a positive membership predicate.
    ///
    /// @param domain enumeration, not null
    /// @param members members, each must belong to the domain
    /// @return predicate `domain in members`, never null
    /// @throws SemanticException if a member is foreign to the domain
    public static EnumIn of(EnumDomain domain, Collection<?> members) {
        return new EnumIn(domain, Set.copyOf(members), true);
    }

    public static EnumIn of(EnumDomain domain, Object... members) {
        return of(domain, Set.of(members));
    }

    @Override
    public Tag tag() {
        return Tag.ENUM_IN;
    }

    /// Returns the members for which this predicate holds, resolving polarity.
    ///
    /// @return satisfying members in domain order, never null
    public Set<Object> satisfying() {
        return positive ? members : domain.complement(members);
    }

    /// Returns the domain complement of this predicate as a positive predicate.
    ///
    /// @return predicate over the members this one rejects, never null
    public EnumIn negate() {
        return new EnumIn(domain, positive ? domain.complement(members) : members, true);
    }

    /// Folds this predicate structurally.
    ///
    /// An empty satisfying set reduces to `false`, the full domain to `true`; any other
    /// predicate becomes its positive form.
    ///
    /// @return `Atom.FALSE`, `Atom.TRUE` or a positive `EnumIn`, never null
    public Expr reduce() {
        Set<Object> satisfying = satisfying();
        if (satisfying.isEmpty()) {
            return Atom.FALSE;
        }
        if (satisfying.size() == domain.members().size()) {
            return Atom.TRUE;
        }
        return positive ? this : new EnumIn(domain, satisfying, true);
    }

    @Override
    public String toString() {
        return ExprFormatter.format(this);
    }
}
