package io.pipewright.core.contract;

import java.util.Objects;

/// One finding of the contract checker.
///
/// @param level severity, not null
/// @param pass pass that produced the finding, not null
/// @param node name of the offending node, not null
/// @param message what is wrong, not null
/// @param hint suggested fix, not null (may be empty)
public record ContractIssue(
        IssueLevel level, CheckPass pass, String node, String message, String hint) {

    public ContractIssue {
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(pass, "pass must not be null");
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(message, "message must not be null");
        hint = hint != null ? hint : "";
    }

    public static ContractIssue error(CheckPass pass, String node, String message, String hint) {
        return new ContractIssue(IssueLevel.ERROR, pass, node, message, hint);
    }

    public static ContractIssue warning(CheckPass pass, String node, String message, String hint) {
        return new ContractIssue(IssueLevel.WARNING, pass, node, message, hint);
    }

    public boolean isError() {
        return level == IssueLevel.ERROR;
    }

    @Override
    public String toString() {
        return "[" + level + "] " + pass + " " + node + ": " + message;
    }
}
