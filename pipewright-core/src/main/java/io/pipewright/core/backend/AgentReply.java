package io.pipewright.core.backend;

import io.pipewright.core.state.StateMaps;
import java.util.Map;
import java.util.Objects;

/// Sealed hierarchy for agent replies.
///
/// - {@link Text}: text output, stored under the agent's output key
/// - {@link StateDelta}: structured writes merged into state as-is
/// - {@link Error}: the call failed; the step fails with a `BACKEND` error
public sealed interface AgentReply permits AgentReply.Text, AgentReply.StateDelta, AgentReply.Error {

    /// Text output.
    ///
    /// @param content the text, not null
    /// @param metadata runtime metadata (tokens, latency), not null
    record Text(String content, Map<String, Object> metadata) implements AgentReply {

        public Text {
            Objects.requireNonNull(content, "content must not be null");
            metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        }

        public static Text of(String content) {
            return new Text(content, Map.of());
        }
    }

    /// Direct state writes.
    ///
    /// @param values keys to write, not null
    record StateDelta(Map<String, Object> values) implements AgentReply {

        public StateDelta {
            values = values != null ? StateMaps.copyOf(values) : Map.of();
        }

        public static StateDelta of(Map<String, Object> values) {
            return new StateDelta(values);
        }
    }

    /// Failed call.
    ///
    /// @param message error description, not null
    /// @param cause underlying exception, may be null
    record Error(String message, Throwable cause) implements AgentReply {

        public Error {
            Objects.requireNonNull(message, "message must not be null");
        }

        public static Error of(String message) {
            return new Error(message, null);
        }

        public static Error from(Throwable cause) {
            return new Error(
                    cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(),
                    cause);
        }
    }
}
