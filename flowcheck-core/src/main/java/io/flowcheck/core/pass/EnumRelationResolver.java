package io.flowcheck.core.pass;

import io.flowcheck.core.domain.EnumDomain;
import io.flowcheck.core.domain.EnumRegistry;
import io.flowcheck.core.eval.MacroPass;
import io.flowcheck.core.exception.SemanticException;
import io.flowcheck.core.exception.TypeMismatchException;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.EnumIn;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Kind;
import io.flowcheck.core.expr.Symbol;
import io.flowcheck.core.expr.Tag;
import io.flowcheck.core.ops.ConcreteOperators;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Rewrites relations between an enumeration variable and a literal into membership
/// predicates.
///
/// `q1 == 'a'` becomes `q1 in {'a'}` and `q1 != 'a'` becomes `q1 not in {'a'}`. An
/// inequation against a numeric enumeration becomes the set of members satisfying it;
/// the literal may stand on either side (`3 lt q1_NUM` selects members greater than 3).
/// Relations not of this shape are left unchanged, including those nested under logic
/// operators at any depth.
///
/// ### Contracts
/// - **Precondition**: the tree is type checked
/// - **Postcondition**: no relation between an enumeration variable and a literal remains
///
/// ### Failures
/// - {@link SemanticException} if the literal is not a member or an inequation selects
///   no member
/// - {@link TypeMismatchException} if the literal kind differs from the enumeration kind,
///   or an inequation targets a string enumeration
public final class EnumRelationResolver extends MacroPass {

    private final EnumRegistry enums;

    public EnumRelationResolver(EnumRegistry enums) {
        this.enums = Objects.requireNonNull(enums, "enums");
        on(Tag.RELATIONS, (node, args) -> {
            Expr left = args.get(0);
            Expr right = args.get(1);
            if (left instanceof Symbol symbol && right instanceof Atom literal) {
                return resolve(node.tag(), symbol, literal, false);
            }
            if (left instanceof Atom literal && right instanceof Symbol symbol) {
                return resolve(node.tag(), symbol, literal, true);
            }
            return noOp();
        });
    }

    private Optional<Expr> resolve(Tag relation, Symbol symbol, Atom literal, boolean literalFirst) {
        Optional<EnumDomain> match = enums.get(symbol.name());
        if (match.isEmpty()) {
            return noOp();
        }
        EnumDomain domain = match.get();
        if (symbol.kind() != domain.kind() || literal.kind() != domain.kind()) {
            throw new TypeMismatchException(
                    "Cannot compare enum " + domain.name() + " of type " + domain.kind().label()
                            + " with " + literal.kind().label() + " literal " + literal);
        }
        if (relation == Tag.EQ || relation == Tag.NE) {
            if (!domain.contains(literal.value())) {
                throw new SemanticException(
                        domain.name() + " must be one of " + domain.members() + ", found " + literal);
            }
            return replace(new EnumIn(domain, Set.of(literal.value()), relation == Tag.EQ));
        }
        if (domain.kind() != Kind.NUMBER) {
            throw new TypeMismatchException(
                    "Inequation '" + relation.symbol() + "' requires a numeric enum, "
                            + domain.name() + " is " + domain.kind().label());
        }
        List<Object> selected = new ArrayList<>();
        for (Object member : domain.members()) {
            List<Object> operands = literalFirst
                    ? List.of(literal.value(), member)
                    : List.of(member, literal.value());
            if (Boolean.TRUE.equals(ConcreteOperators.INSTANCE.apply(relation, operands))) {
                selected.add(member);
            }
        }
        if (selected.isEmpty()) {
            throw new SemanticException(
                    "No member of enum " + domain + " satisfies "
                            + (literalFirst ? literal + " " + relation.symbol() + " " + symbol
                                    : symbol + " " + relation.symbol() + " " + literal));
        }
        return replace(EnumIn.of(domain, selected));
    }
}
