package io.pipewright.core.execution;

import io.pipewright.core.state.StateMaps;
import io.pipewright.core.visibility.Visibility;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// Event emitted by a backend while running a pipeline.
///
/// Agent replies produce one event each. Errors produce an event with {@link #error()}
/// set; error events are always user-facing, whatever the visibility policy.
///
/// @param author name of the emitting step, not null
/// @param content text content, not null (may be empty)
/// @param stateDelta state written by the step, not null
/// @param visibility tier of the emitting step, not null
/// @param userFacing whether a consumer should show this event
/// @param finalResponse whether this is the step's final reply
/// @param error whether this event reports a failure
/// @param timestamp emission time, not null
public record AgentEvent(
        String author,
        String content,
        Map<String, Object> stateDelta,
        Visibility visibility,
        boolean userFacing,
        boolean finalResponse,
        boolean error,
        Instant timestamp) {

    public AgentEvent {
        Objects.requireNonNull(author, "author must not be null");
        Objects.requireNonNull(visibility, "visibility must not be null");
        content = content != null ? content : "";
        stateDelta = stateDelta != null ? StateMaps.copyOf(stateDelta) : Map.of();
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static AgentEvent reply(
            String author, String content, Map<String, Object> stateDelta, Visibility visibility) {
        return new AgentEvent(
                author, content, stateDelta, visibility, visibility == Visibility.USER, true, false, Instant.now());
    }

    public static AgentEvent failure(ExecutionError error) {
        return new AgentEvent(
                error.step(), error.message(), Map.of(), Visibility.USER, true, true, true, Instant.now());
    }

    /// Returns a copy marked as user-facing or not, keeping everything else.
    ///
    /// @param userFacing new flag
    /// @return adjusted event, never null
    public AgentEvent withUserFacing(boolean userFacing) {
        return new AgentEvent(
                author, content, stateDelta, visibility, userFacing, finalResponse, error, timestamp);
    }
}
