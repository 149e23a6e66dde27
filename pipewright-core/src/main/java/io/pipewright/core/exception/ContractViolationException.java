package io.pipewright.core.exception;

import io.pipewright.core.contract.ContractIssue;
import io.pipewright.core.contract.IssueLevel;
import java.io.Serial;
import java.util.List;
import java.util.stream.Collectors;

/// Raised by strict builds when the contract checker reports at least one
/// error-level issue.
///
/// The full issue list (warnings included) stays available through {@link #getIssues()}
/// so callers can render a complete report.
public class ContractViolationException extends PipewrightException {
    @Serial private static final long serialVersionUID = -6623409514337710931L;

    private final transient List<ContractIssue> issues;

    public ContractViolationException(List<ContractIssue> issues) {
        super(buildMessage(issues));
        this.issues = List.copyOf(issues);
    }

    /// Returns every issue reported by the checker, in pass order.
    ///
    /// @return immutable issue list, never null
    public List<ContractIssue> getIssues() {
        return issues;
    }

    /// Returns only the error-level issues that caused the build to abort.
    ///
    /// @return immutable list of errors, never empty for a thrown instance
    public List<ContractIssue> getErrors() {
        return issues.stream().filter(i -> i.level() == IssueLevel.ERROR).toList();
    }

    private static String buildMessage(List<ContractIssue> issues) {
        List<ContractIssue> errors =
                issues.stream().filter(i -> i.level() == IssueLevel.ERROR).toList();
        return "Pipeline contract check failed with "
                + errors.size()
                + " error(s):\n"
                + errors.stream().map(i -> "  " + i).collect(Collectors.joining("\n"));
    }
}
