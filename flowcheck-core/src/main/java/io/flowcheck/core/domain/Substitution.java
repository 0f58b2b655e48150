package io.flowcheck.core.domain;

import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.EnumIn;
import io.flowcheck.core.expr.Expr;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Assignment of enumerations to fixed members or to "absent".
///
/// Applying a substitution replaces every {@link EnumIn} over an assigned enumeration by
/// the boolean constant it evaluates to; membership predicates over a nulled enumeration
/// become `false`. Expressions are rebuilt, never mutated.
public final class Substitution {

    public static final Substitution EMPTY = new Substitution(Map.of());

    // empty optional marks a nulled enumeration
    private final Map<EnumDomain, Optional<Object>> assignments;

    private Substitution(Map<EnumDomain, Optional<Object>> assignments) {
        this.assignments = Collections.unmodifiableMap(assignments);
    }

    static Substitution member(EnumDomain domain, Object member) {
        Map<EnumDomain, Optional<Object>> map = new LinkedHashMap<>();
        map.put(domain, Optional.of(member));
        return new Substitution(map);
    }

    static Substitution nulled(EnumDomain domain) {
        Map<EnumDomain, Optional<Object>> map = new LinkedHashMap<>();
        map.put(domain, Optional.empty());
        return new Substitution(map);
    }

    /// Builds the union of the null substitutions of the given enumerations.
    ///
    /// @param domains enumerations to remove, not null
    /// @return combined substitution, never null
    public static Substitution nullingAll(Collection<EnumDomain> domains) {
        Substitution result = EMPTY;
        for (EnumDomain domain : domains) {
            result = result.andThen(domain.nullSubstitution());
        }
        return result;
    }

    /// Combines two substitutions; assignments of `other` win on overlap.
    ///
    /// @param other substitution to merge in, not null
    /// @return merged substitution, never null
    public Substitution andThen(Substitution other) {
        Map<EnumDomain, Optional<Object>> map = new LinkedHashMap<>(assignments);
        map.putAll(other.assignments);
        return new Substitution(map);
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    /// Applies this substitution to an expression.
    ///
    /// @param expr expression, not null
    /// @return rebuilt expression without predicates over assigned enumerations
    public Expr apply(Expr expr) {
        if (assignments.isEmpty()) {
            return expr;
        }
        if (expr instanceof EnumIn in) {
            Optional<Object> assignment = assignments.get(in.domain());
            if (assignment == null) {
                return in;
            }
            return assignment
                    .map(member -> (Expr) Atom.of(in.satisfying().contains(member)))
                    .orElse(Atom.FALSE);
        }
        List<Expr> children = expr.children();
        if (children.isEmpty()) {
            return expr;
        }
        List<Expr> replaced = new ArrayList<>(children.size());
        for (Expr child : children) {
            replaced.add(apply(child));
        }
        return expr.withChildren(replaced);
    }

    @Override
    public String toString() {
        return "Substitution" + assignments;
    }
}
