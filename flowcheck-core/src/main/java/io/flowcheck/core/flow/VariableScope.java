package io.flowcheck.core.flow;

import io.flowcheck.core.expr.Symbol;
import io.flowcheck.core.scope.Scope;
import java.util.Objects;
import java.util.Optional;

/// Scope of one questionnaire variable; `q1.value` resolves to the variable's symbol.
///
/// Looking up the bare name `q1` yields this scope itself, which only the
/// {@link FunctionLibrary} macros accept as an argument.
public final class VariableScope implements Scope {

    static final String VALUE = "value";

    private final VariableDefinition variable;

    public VariableScope(VariableDefinition variable) {
        this.variable = Objects.requireNonNull(variable, "variable");
    }

    public VariableDefinition variable() {
        return variable;
    }

    /// Returns the symbol standing for the variable's current value.
    ///
    /// @return symbol named after the variable with the kind of its value, never null
    public Symbol value() {
        return new Symbol(variable.name(), variable.type().valueKind());
    }

    @Override
    public Optional<Object> find(String name) {
        return VALUE.equals(name) ? Optional.of(value()) : Optional.empty();
    }

    @Override
    public String toString() {
        return "Variable[" + variable.name() + ": " + variable.type() + "]";
    }
}
