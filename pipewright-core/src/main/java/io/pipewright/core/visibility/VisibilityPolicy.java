package io.pipewright.core.visibility;

/// Pipeline-level policy controlling how inferred visibility is applied.
///
/// ### Policies
/// - `FILTERED` (default): only terminal agents are user-facing; internal events are dropped
/// - `TRANSPARENT`: every agent is user-facing
/// - `ANNOTATE`: tiers are computed as for `FILTERED`, but events are tagged, not dropped
public enum VisibilityPolicy {
    FILTERED,
    TRANSPARENT,
    ANNOTATE
}
