package io.pipewright.core.exception;

import java.io.Serial;

/// Root of all unchecked exceptions raised by the pipeline core.
///
/// Construction errors, contract violations and step execution failures all extend this
/// type, so callers that only want to distinguish "pipeline problem" from unrelated
/// runtime failures can catch it once.
public class PipewrightException extends RuntimeException {
    @Serial private static final long serialVersionUID = 3172620945101735811L;

    public PipewrightException(String message) {
        super(message);
    }

    public PipewrightException(String message, Throwable cause) {
        super(message, cause);
    }
}
