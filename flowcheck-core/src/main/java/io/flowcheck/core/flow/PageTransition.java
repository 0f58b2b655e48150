package io.flowcheck.core.flow;

import java.util.Objects;

/// Guarded jump from a page to another page.
///
/// Transitions of a page are tried in order and the first whose condition holds is
/// taken.
///
/// @param condition condition text, or null for an unconditional transition
/// @param target uid of the target page, not null
public record PageTransition(String condition, String target) {

    public PageTransition {
        Objects.requireNonNull(target, "target");
    }

    public static PageTransition always(String target) {
        return new PageTransition(null, target);
    }

    public boolean isUnconditional() {
        return condition == null || condition.isBlank();
    }
}
