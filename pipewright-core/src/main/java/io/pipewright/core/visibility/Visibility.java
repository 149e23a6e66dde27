package io.pipewright.core.visibility;

/// Visibility tier of a pipeline node's output.
public enum Visibility {
    /// Shown to the end consumer.
    USER,
    /// Produced but suppressed from the consumer-facing event stream.
    INTERNAL,
    /// Makes no model call at all; never produces consumer-facing output.
    ZERO_COST
}
