package io.flowcheck.core.graph;

/// How the recorded filter of a removed self-loop takes part in the soundness check.
///
/// Sibling edges are never narrowed by the self-loop filter under either policy.
public enum SelfLoopPolicy {
    /// The self-loop filter joins the outgoing disjunction: staying on a page counts as
    /// a covered case.
    COUNT_FOR_SOUNDNESS,
    /// The self-loop filter is ignored; only real out-edges must be exhaustive.
    DISCARD
}
