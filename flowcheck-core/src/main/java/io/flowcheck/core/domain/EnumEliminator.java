package io.flowcheck.core.domain;

import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Exprs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/// Drops enumerations that are provably irrelevant to a formula.
///
/// An enumeration `E` is irrelevant when, with every other enumeration nulled, the
/// formula simplifies to `true` for every member of `E`. Irrelevant enumerations are
/// removed by applying their null substitution, and the result is simplified again.
///
/// @implNote Stateless apart from the injected simplifier; safe for concurrent use when
/// the simplifier is.
public final class EnumEliminator {

    private static final Logger logger = Logger.getLogger(EnumEliminator.class.getName());

    private final UnaryOperator<Expr> simplifier;

    /// @param simplifier boolean simplification applied after each substitution, not null
    public EnumEliminator(UnaryOperator<Expr> simplifier) {
        this.simplifier = Objects.requireNonNull(simplifier, "simplifier");
    }

    /// Removes irrelevant enumerations from `expr`.
    ///
    /// Only enumerations that occur in `expr` or in `enums` are considered; an
    /// enumeration mentioned by the formula but missing from `enums` is still tested.
    ///
    /// @param expr simplified boolean formula, not null
    /// @param enums enumerations of the analysis run, not null
    /// @return formula without irrelevant enumerations, never null
    public Expr eliminate(Expr expr, EnumRegistry enums) {
        Expr result = expr;
        for (EnumDomain domain : new ArrayList<>(Exprs.domains(expr))) {
            if (!Exprs.domains(result).contains(domain)) {
                continue;
            }
            List<EnumDomain> others = new ArrayList<>(enums.all());
            others.addAll(Exprs.domains(result));
            others.removeIf(domain::equals);
            Substitution nullOthers = Substitution.nullingAll(others);
            if (isIrrelevant(result, domain, nullOthers)) {
                logger.fine(() -> "Enum " + domain.name() + " is irrelevant, removing it");
                result = simplifier.apply(domain.nullSubstitution().apply(result));
            }
        }
        return result;
    }

    private boolean isIrrelevant(Expr expr, EnumDomain domain, Substitution nullOthers) {
        for (Object member : domain.members()) {
            Expr substituted = nullOthers.andThen(domain.substituteMember(member)).apply(expr);
            if (!Atom.is(simplifier.apply(substituted), true)) {
                return false;
            }
        }
        return true;
    }
}
