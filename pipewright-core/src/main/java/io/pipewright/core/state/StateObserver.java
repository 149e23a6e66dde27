package io.pipewright.core.state;

import java.util.Map;

/// Side-effect-only callback over state. Used by tap nodes; cannot change state.
@FunctionalInterface
public interface StateObserver {

    void observe(Map<String, Object> state);
}
