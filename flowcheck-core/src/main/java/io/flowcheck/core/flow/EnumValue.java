package io.flowcheck.core.flow;

import java.util.Objects;

/// One answer option of a single-choice question.
///
/// @param uid option identifier, the string value of the variable, not null
/// @param code numeric code of the option, the value of `<variable>_NUM`
public record EnumValue(String uid, long code) {

    public EnumValue {
        Objects.requireNonNull(uid, "uid");
    }
}
