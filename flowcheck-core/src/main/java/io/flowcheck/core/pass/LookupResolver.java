package io.flowcheck.core.pass;

import io.flowcheck.core.eval.Leaves;
import io.flowcheck.core.eval.MacroPass;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.Call;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.ExprConvertible;
import io.flowcheck.core.expr.Lookup;
import io.flowcheck.core.expr.Ref;
import io.flowcheck.core.expr.Tag;
import io.flowcheck.core.scope.Macro;
import io.flowcheck.core.scope.Scope;
import java.util.Objects;

/// Resolves identifiers and macro calls against a scope.
///
/// - A {@link Lookup} is replaced by the value bound to its path: expressions are used
///   as they are, {@link ExprConvertible}s convert themselves, literal Java values become
///   atoms and any other object is wrapped in a {@link Ref}.
/// - A {@link Call} whose function resolves to a {@link Macro} is expanded; calls of
///   anything else are left in place and rejected later by the type checker.
/// - Arithmetic over literals is folded.
///
/// @implNote The scope is only read; a resolver may be shared by threads as long as the
/// scope is not modified.
public final class LookupResolver extends MacroPass {

    private final Scope scope;

    public LookupResolver(Scope scope) {
        this.scope = Objects.requireNonNull(scope, "scope");
        on(Tag.LOOKUP, Leaves.all(), (node, args) -> replace(resolve((Lookup) node)));
        on(Tag.CALL, (node, args) -> {
            Expr function = args.get(0);
            if (function instanceof Ref ref && ref.value() instanceof Macro macro) {
                return replace(macro.expand(args.evaluated().subList(1, args.size())));
            }
            return noOp();
        });
        on(Tag.ARITHMETIC, (node, args) -> ConstantFolder.foldArithmetic(node.tag(), args.evaluated()));
    }

    private Expr resolve(Lookup lookup) {
        Object value = scope.lookup(lookup.path());
        if (value instanceof Expr expr) {
            return expr;
        }
        if (value instanceof ExprConvertible convertible) {
            return convertible.toExpr();
        }
        if (value instanceof Number || value instanceof String || value instanceof Boolean) {
            return Atom.of(value);
        }
        return new Ref(value);
    }
}
