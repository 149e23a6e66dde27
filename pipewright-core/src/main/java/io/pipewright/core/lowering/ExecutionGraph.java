package io.pipewright.core.lowering;

import io.pipewright.core.visibility.Visibility;
import io.pipewright.core.visibility.VisibilityPolicy;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Lowered pipeline ready for a {@link io.pipewright.core.backend.Backend}.
///
/// @param root root step, not null
/// @param policy how the backend treats events of internal agents, not null
/// @param visibility inferred visibility per agent name, not null
public record ExecutionGraph(
        ExecutionStep root, VisibilityPolicy policy, Map<String, Visibility> visibility) {

    public ExecutionGraph {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        visibility = visibility != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(visibility))
                : Map.of();
    }

    /// Returns every step in pre-order, synthetic checkpoints included.
    ///
    /// @return flattened steps, never null
    public List<ExecutionStep> steps() {
        List<ExecutionStep> steps = new ArrayList<>();
        Deque<ExecutionStep> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ExecutionStep step = stack.pop();
            steps.add(step);
            List<ExecutionStep> children = step.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return steps;
    }

    public Optional<ExecutionStep> find(String name) {
        return steps().stream().filter(step -> step.name().equals(name)).findFirst();
    }
}
