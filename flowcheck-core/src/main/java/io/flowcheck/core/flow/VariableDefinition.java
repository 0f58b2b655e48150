package io.flowcheck.core.flow;

import java.util.Objects;

/// Questionnaire variable a condition may refer to.
///
/// @param name variable name, not null
/// @param type declared type, not null
public record VariableDefinition(String name, VariableType type) {

    public VariableDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }
}
