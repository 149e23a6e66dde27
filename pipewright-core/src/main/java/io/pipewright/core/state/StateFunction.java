package io.pipewright.core.state;

import java.util.Map;

/// Pure function from state to a {@link StateUpdate}.
///
/// Backs every state transform node. Implementations must not mutate the state they
/// receive; the update they return is applied by the backend.
@FunctionalInterface
public interface StateFunction {

    /// Computes the update for the given state.
    ///
    /// @param state read-only view of the current state, not null
    /// @return the update to apply, never null
    StateUpdate apply(Map<String, Object> state);
}
