package io.pipewright.core.contract;

/// The contract checker's passes, in execution order.
public enum CheckPass {
    /// Extract reads and writes of every agent.
    READS_WRITES,
    /// Track available keys in execution order; flags ambiguous parallel writes.
    OUTPUT_KEYS,
    /// Every required template read must be available.
    TEMPLATE_VARS,
    /// A key read through both the instruction and the input schema.
    CHANNEL_DUPLICATION,
    /// Route dispatch keys and other predicate reads must be available.
    ROUTE_KEYS,
    /// Written keys that nothing reads afterwards.
    DATA_LOSS,
    /// Visibility overrides that lose output.
    VISIBILITY
}
