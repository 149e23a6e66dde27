package io.pipewright.core.ir;

/// Kind of a pure state transform.
///
/// Built-in kinds can be rebuilt from their parameters alone. `TRANSFORM`, `COMPUTE`,
/// `GUARD` and `FUNCTION` wrap user code and need the callable itself.
public enum TransformKind {
    PICK,
    DROP,
    RENAME,
    DEFAULT,
    MERGE,
    TRANSFORM,
    COMPUTE,
    SET,
    GUARD,
    LOG,
    CAPTURE,
    FUNCTION;

    /// Returns whether this kind carries a user-supplied callable.
    ///
    /// @return `true` if the transform cannot be rebuilt from parameters alone
    public boolean wrapsUserCode() {
        return this == TRANSFORM || this == COMPUTE || this == GUARD || this == FUNCTION;
    }
}
