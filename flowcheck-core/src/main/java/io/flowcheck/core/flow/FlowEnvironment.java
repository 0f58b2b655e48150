package io.flowcheck.core.flow;

import io.flowcheck.core.domain.EnumRegistry;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.parse.ConditionParser;
import io.flowcheck.core.pass.PassPipeline;
import io.flowcheck.core.scope.MapScope;
import io.flowcheck.core.scope.Scope;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Compilation context of one flow: its variables, built-in functions and enumerations.
///
/// ### Contracts
/// - **Precondition**: built once per analysis run, before any condition is compiled
/// - **Invariant**: scope and enumerations are not modified after construction
///
/// @implNote Safe for concurrent {@link #compile(String)} calls.
public final class FlowEnvironment {

    private final Scope scope;
    private final EnumRegistry enums;
    private final ConditionParser parser;
    private final PassPipeline pipeline;

    public FlowEnvironment(Scope scope, EnumRegistry enums, PassPipeline pipeline) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.enums = Objects.requireNonNull(enums, "enums");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.parser = new ConditionParser();
    }

    /// Creates the environment of a flow definition.
    ///
    /// Variables that only appear in enum declarations of a page are declared as
    /// {@link VariableType#ENUM}.
    ///
    /// @param flow flow definition, not null
    /// @param pipeline compilation passes, not null
    /// @return environment with one scope per variable and the `zofar` functions, never null
    /// @throws io.flowcheck.core.exception.ConfigurationException on invalid enum declarations
    public static FlowEnvironment of(FlowDefinition flow, PassPipeline pipeline) {
        Map<String, VariableDefinition> variables = new LinkedHashMap<>(flow.getVariables());
        for (Page page : flow.getPages().values()) {
            page.enumValues().forEach(values -> variables.putIfAbsent(
                    values.variable(), new VariableDefinition(values.variable(), VariableType.ENUM)));
        }
        MapScope scope = new MapScope();
        variables.values().forEach(v -> scope.register(v.name(), new VariableScope(v)));
        scope.register(FunctionLibrary.NAMESPACE, FunctionLibrary.create());
        return new FlowEnvironment(scope, EnumCatalog.fromPages(flow.getPages().values()), pipeline);
    }

    /// Parses and compiles one condition.
    ///
    /// @param condition condition text, not null
    /// @return simplified boolean expression, never null
    /// @throws io.flowcheck.core.exception.ConditionParseException on syntax errors
    /// @throws io.flowcheck.core.exception.SemanticException on unknown identifiers or members
    /// @throws io.flowcheck.core.exception.TypeMismatchException on ill-typed conditions
    public Expr compile(String condition) {
        return pipeline.run(parser.parse(condition), scope, enums);
    }

    public Scope getScope() {
        return scope;
    }

    public EnumRegistry getEnums() {
        return enums;
    }
}
