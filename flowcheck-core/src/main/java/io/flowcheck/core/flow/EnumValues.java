package io.flowcheck.core.flow;

import java.util.List;
import java.util.Objects;

/// Answer options a page declares for an enumeration variable.
///
/// @param variable name of the variable, not null
/// @param values options in display order
public record EnumValues(String variable, List<EnumValue> values) {

    public EnumValues {
        Objects.requireNonNull(variable, "variable");
        values = List.copyOf(values);
    }
}
