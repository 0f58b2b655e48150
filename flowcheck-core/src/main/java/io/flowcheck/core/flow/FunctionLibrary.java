package io.flowcheck.core.flow;

import io.flowcheck.core.exception.SemanticException;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Kind;
import io.flowcheck.core.expr.Ref;
import io.flowcheck.core.expr.Symbol;
import io.flowcheck.core.expr.Tag;
import io.flowcheck.core.scope.Macro;
import io.flowcheck.core.scope.MapScope;
import java.util.List;

/// Built-in functions of the questionnaire condition language, bound under `zofar`.
///
/// | Call | Expansion |
/// |---|---|
/// | `zofar.asNumber(v)` | number symbol `v` (number variables) or `v_NUM` (others) |
/// | `zofar.isMissing(v)` | boolean symbol `v_IS_MISSING` |
/// | `zofar.baseUrl()` | string symbol `ZOFAR_BASE_URL` |
/// | `zofar.isMobile()` | boolean symbol `ZOFAR_IS_MOBILE` |
public final class FunctionLibrary {

    public static final String NAMESPACE = "zofar";

    private FunctionLibrary() {}

    /// Creates the scope holding the built-in macros.
    ///
    /// @return new scope with one macro per function, never null
    public static MapScope create() {
        MapScope scope = new MapScope();
        scope.register("asNumber", new Macro(NAMESPACE + ".asNumber", List.of(Tag.REF), args -> {
            VariableDefinition variable = variableOf(args.get(0), "asNumber");
            String name = variable.type() == VariableType.NUMBER
                    ? variable.name()
                    : variable.name() + EnumCatalog.NUMERIC_SUFFIX;
            return new Symbol(name, Kind.NUMBER);
        }));
        scope.register("isMissing", new Macro(NAMESPACE + ".isMissing", List.of(Tag.REF), args ->
                new Symbol(variableOf(args.get(0), "isMissing").name() + "_IS_MISSING", Kind.BOOLEAN)));
        scope.register("baseUrl", new Macro(NAMESPACE + ".baseUrl", List.of(), args ->
                new Symbol("ZOFAR_BASE_URL", Kind.STRING)));
        scope.register("isMobile", new Macro(NAMESPACE + ".isMobile", List.of(), args ->
                new Symbol("ZOFAR_IS_MOBILE", Kind.BOOLEAN)));
        return scope;
    }

    private static VariableDefinition variableOf(Expr arg, String function) {
        if (arg instanceof Ref ref && ref.value() instanceof VariableScope scope) {
            return scope.variable();
        }
        throw new SemanticException(
                NAMESPACE + "." + function + " expects a variable but got " + arg);
    }
}
