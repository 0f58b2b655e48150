package io.flowcheck.core;

import java.util.Objects;

/// Transition condition that failed to compile. The transition is left out of the graph.
///
/// @param page uid of the page owning the transition, not null
/// @param target uid of the transition target, not null
/// @param condition condition text, not null
/// @param kind simple name of the failure type, e.g. `TypeMismatchException`
/// @param message failure message, not null
public record ConditionError(String page, String target, String condition, String kind, String message) {

    public ConditionError {
        Objects.requireNonNull(page, "page");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }
}
