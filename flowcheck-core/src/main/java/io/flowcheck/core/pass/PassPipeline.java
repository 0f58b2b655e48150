package io.flowcheck.core.pass;

import io.flowcheck.core.domain.EnumRegistry;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.scope.Scope;
import java.util.Objects;
import java.util.logging.Logger;

/// Ordered compilation of a parsed condition into a simplified boolean expression.
///
/// ### Stages
/// 1. {@link LookupResolver} - identifiers, macro calls, literal arithmetic
/// 2. {@link ConstantFolder} - remaining literal-only operators
/// 3. {@link TypeChecker} - kind inference; the condition must be boolean
/// 4. {@link EnumRelationResolver} - enumeration relations become membership predicates
/// 5. {@link NegationNormalizer} - negation pushed to the leaves
/// 6. {@link BooleanSimplifier} - canonical simplified form
///
/// Every stage is a pure function of its input; failures propagate to the caller
/// unchanged.
public final class PassPipeline {

    private static final Logger logger = Logger.getLogger(PassPipeline.class.getName());

    private final ConstantFolder folder = new ConstantFolder();
    private final TypeChecker typeChecker = new TypeChecker();
    private final NegationNormalizer negation = new NegationNormalizer();
    private final BooleanSimplifier simplifier;

    public PassPipeline() {
        this(new BooleanSimplifier());
    }

    public PassPipeline(BooleanSimplifier simplifier) {
        this.simplifier = Objects.requireNonNull(simplifier, "simplifier");
    }

    /// Runs all stages on a parsed condition.
    ///
    /// @param tree parsed condition, not null
    /// @param scope identifiers visible to the condition, not null
    /// @param enums enumerations of the analysis run, not null
    /// @return simplified boolean expression, never null
    /// @throws io.flowcheck.core.exception.SemanticException on unknown identifiers,
    ///     foreign enum members or empty inequation results
    /// @throws io.flowcheck.core.exception.TypeMismatchException on ill-typed conditions
    public Expr run(Expr tree, Scope scope, EnumRegistry enums) {
        Expr resolved = folder.apply(new LookupResolver(scope).apply(tree));
        typeChecker.requireBoolean(resolved);
        Expr normalized = negation.apply(new EnumRelationResolver(enums).apply(resolved));
        Expr result = simplifier.simplify(normalized);
        logger.fine(() -> "Compiled '" + tree + "' to '" + result + "'");
        return result;
    }

    public BooleanSimplifier simplifier() {
        return simplifier;
    }
}
