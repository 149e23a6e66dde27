package io.pipewright.core.execution;

/// Classification of execution errors reported in {@link ExecutionResult#errors()}.
public enum ErrorType {
    /// The agent invoker or another backend component failed.
    BACKEND,
    /// A timeout wrapper's deadline expired.
    TIMEOUT,
    /// The step was cancelled, for example as a losing race branch.
    CANCELLED,
    /// A route, gate, expect or loop predicate threw.
    PREDICATE,
    /// An expect node's assertion was false.
    EXPECTATION,
    /// A gate is waiting for human approval.
    APPROVAL_REQUIRED,
    /// No route rule matched and no default branch exists.
    ROUTE_UNRESOLVED,
    /// State did not have the expected shape, or a transform rejected it.
    INVALID_STATE
}
