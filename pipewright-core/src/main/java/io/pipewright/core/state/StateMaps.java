package io.pipewright.core.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Helpers for the plain `Map<String, Object>` state representation.
///
/// State values may be null, so these helpers use {@link LinkedHashMap} copies rather than
/// `Map.copyOf`, which rejects null values.
public final class StateMaps {

    private StateMaps() {}

    /// Returns an unmodifiable, insertion-ordered copy that tolerates null values.
    ///
    /// @param source map to copy, not null
    /// @return unmodifiable copy, never null
    public static Map<String, Object> copyOf(Map<String, Object> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /// Computes the changes that turned `before` into `after`.
    ///
    /// @param before state prior to a step, not null
    /// @param after state after the step, not null
    /// @return written entries and removed keys, never null
    public static Diff diff(Map<String, Object> before, Map<String, Object> after) {
        Map<String, Object> written = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : after.entrySet()) {
            if (!before.containsKey(entry.getKey())
                    || !Objects.equals(before.get(entry.getKey()), entry.getValue())) {
                written.put(entry.getKey(), entry.getValue());
            }
        }
        Set<String> removed = new LinkedHashSet<>();
        for (String key : before.keySet()) {
            if (!after.containsKey(key)) {
                removed.add(key);
            }
        }
        return new Diff(written, removed);
    }

    /// Writes and removals produced by one branch of execution.
    ///
    /// @param written keys that were added or changed, with their new values
    /// @param removed keys that were deleted
    public record Diff(Map<String, Object> written, Set<String> removed) {

        public Diff {
            written = copyOf(written);
            removed = Set.copyOf(removed);
        }

        /// Replays this diff onto another state map.
        ///
        /// @param state target map, modified in place, not null
        public void applyTo(Map<String, Object> state) {
            removed.forEach(state::remove);
            state.putAll(written);
        }

        public boolean isEmpty() {
            return written.isEmpty() && removed.isEmpty();
        }
    }
}
