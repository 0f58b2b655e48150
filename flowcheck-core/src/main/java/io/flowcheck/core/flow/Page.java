package io.flowcheck.core.flow;

import java.util.List;
import java.util.Objects;

/// Questionnaire page: a state of the flow.
///
/// @param uid unique page identifier, not null
/// @param transitions ordered outgoing transitions
/// @param enumValues answer options declared on this page
public record Page(String uid, List<PageTransition> transitions, List<EnumValues> enumValues) {

    public Page {
        Objects.requireNonNull(uid, "uid");
        transitions = List.copyOf(transitions);
        enumValues = List.copyOf(enumValues);
    }

    public Page(String uid, List<PageTransition> transitions) {
        this(uid, transitions, List.of());
    }
}
