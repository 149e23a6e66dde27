package io.pipewright.core.contract;

/// Severity of a contract issue. Only errors abort a strict build.
public enum IssueLevel {
    ERROR,
    WARNING
}
