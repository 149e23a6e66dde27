package io.pipewright.core.visualizer;

/// Kind of a {@link GraphDescription.Edge}.
public enum EdgeKind {
    /// Consecutive steps of a sequence or loop body.
    SEQUENCE,
    /// Alternative or concurrent branch of a parallel, race, fallback or route rule.
    BRANCH,
    /// Container to the first step it wraps.
    BODY,
    /// Route to its default branch.
    DEFAULT
}
