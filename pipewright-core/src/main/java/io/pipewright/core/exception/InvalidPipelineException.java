package io.pipewright.core.exception;

import java.io.Serial;

/// Raised at the call site of an algebra operator or node constructor when the
/// resulting tree would be malformed.
///
/// Typical causes: a route with neither rules nor a default branch, an empty fallback
/// or race chain, an invalid agent identifier, a non-positive loop bound.
public class InvalidPipelineException extends PipewrightException {
    @Serial private static final long serialVersionUID = -1402816953371937518L;

    public InvalidPipelineException(String message) {
        super(message);
    }
}
