package io.pipewright.core.state;

import java.util.Map;
import java.util.Objects;

/// Result of a state transform: either merged into state or replacing it.
///
/// ### Scoped keys
/// Keys prefixed with `app:`, `user:` or `temp:` live outside the session scope. A
/// {@link Replacement} never removes them, so a `pick` or `drop` cannot wipe
/// application-level or scratch data.
public sealed interface StateUpdate permits StateUpdate.Delta, StateUpdate.Replacement {

    /// Applies this update to a mutable state map.
    ///
    /// @param state the state to modify in place, not null
    void applyTo(Map<String, Object> state);

    /// Returns the key/value pairs this update writes.
    ///
    /// @return written values, never null
    Map<String, Object> values();

    static Delta delta(Map<String, Object> values) {
        return new Delta(values);
    }

    static Replacement replace(Map<String, Object> values) {
        return new Replacement(values);
    }

    /// Returns true for keys that a replacement must preserve.
    ///
    /// @param key state key, not null
    /// @return `true` if the key carries a scope prefix
    static boolean isScoped(String key) {
        return key.startsWith("app:") || key.startsWith("user:") || key.startsWith("temp:");
    }

    /// Additive update: every entry is written, nothing is removed.
    record Delta(Map<String, Object> values) implements StateUpdate {

        public Delta {
            Objects.requireNonNull(values, "values must not be null");
            values = StateMaps.copyOf(values);
        }

        @Override
        public void applyTo(Map<String, Object> state) {
            state.putAll(values);
        }
    }

    /// Replacing update: every unscoped key is removed, then the entries are written.
    record Replacement(Map<String, Object> values) implements StateUpdate {

        public Replacement {
            Objects.requireNonNull(values, "values must not be null");
            values = StateMaps.copyOf(values);
        }

        @Override
        public void applyTo(Map<String, Object> state) {
            state.keySet().removeIf(key -> !isScoped(key));
            state.putAll(values);
        }
    }
}
