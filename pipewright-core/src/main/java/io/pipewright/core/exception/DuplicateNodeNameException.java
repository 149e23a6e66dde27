package io.pipewright.core.exception;

import java.io.Serial;

/// Raised when composing two sub-trees would place two agents with the same name in
/// one pipeline, or give an agent the name of another step.
public class DuplicateNodeNameException extends InvalidPipelineException {
    @Serial private static final long serialVersionUID = 8425018870410526623L;

    private final String nodeName;

    public DuplicateNodeNameException(String nodeName) {
        super("Duplicate agent name in pipeline: '" + nodeName + "' is already used by another node");
        this.nodeName = nodeName;
    }

    public String getNodeName() {
        return nodeName;
    }
}
