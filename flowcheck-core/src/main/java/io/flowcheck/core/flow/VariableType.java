package io.flowcheck.core.flow;

import io.flowcheck.core.exception.ConfigurationException;
import io.flowcheck.core.expr.Kind;
import java.util.Locale;

/// Declared type of a questionnaire variable.
public enum VariableType {
    STRING(Kind.STRING),
    NUMBER(Kind.NUMBER),
    BOOLEAN(Kind.BOOLEAN),
    /// Single-choice answer; its value is the uid of the chosen option.
    ENUM(Kind.STRING);

    private final Kind valueKind;

    VariableType(Kind valueKind) {
        this.valueKind = valueKind;
    }

    /// Returns the kind of the symbol `<variable>.value` resolves to.
    ///
    /// @return value kind, never null
    public Kind valueKind() {
        return valueKind;
    }

    /// Parses a type name as written in flow documents.
    ///
    /// @param name `string`, `number`, `boolean` or `enum`, case-insensitive
    /// @return variable type, never null
    /// @throws ConfigurationException for unknown names
    public static VariableType fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown variable type: " + name, e);
        }
    }
}
