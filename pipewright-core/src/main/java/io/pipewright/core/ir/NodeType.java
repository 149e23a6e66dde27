package io.pipewright.core.ir;

/// Discriminator for the closed set of IR node variants.
public enum NodeType {
    AGENT,
    SEQUENCE,
    PARALLEL,
    LOOP,
    ROUTE,
    FALLBACK,
    RACE,
    TIMEOUT,
    MAP_OVER,
    TRANSFORM,
    TAP,
    EXPECT,
    GATE;

    /// Returns whether nodes of this type only contain other nodes and do no work of their
    /// own.
    ///
    /// @return `true` for sequence, parallel, loop, fallback, race, timeout and map-over
    public boolean isComposite() {
        return switch (this) {
            case SEQUENCE, PARALLEL, LOOP, FALLBACK, RACE, TIMEOUT, MAP_OVER -> true;
            default -> false;
        };
    }
}
