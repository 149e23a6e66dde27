package io.pipewright.core.execution;

/// Overall outcome of a run, derived from its errors.
public enum ExitStatus {
    COMPLETED,
    /// Stopped at a gate awaiting approval; rerun with the gate key set to resume.
    PAUSED,
    FAILED
}
