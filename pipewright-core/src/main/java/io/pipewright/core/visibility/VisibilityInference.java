package io.pipewright.core.visibility;

import io.pipewright.core.ir.AgentNode;
import io.pipewright.core.ir.Node;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Classifies every leaf of a pipeline tree into a {@link Visibility} tier.
///
/// Classification depends only on tree shape, explicit overrides and the policy; it runs
/// nothing and returns the same map for the same input.
///
/// ### Rules
/// - transforms, taps, expects, gates and the routes themselves are `ZERO_COST`
/// - an agent with an explicit `show()`/`hide()` override keeps it
/// - under `TRANSPARENT` every other agent is `USER`
/// - otherwise an agent is `INTERNAL` when something runs after it, `USER` when it sits in
///   terminal position
///
/// ### Successor propagation
/// | Container | Child has a successor when |
/// |---|---|
/// | sequence | it is not the last child, or the sequence itself has one |
/// | parallel, fallback, race, timeout, map-over | the container has one |
/// | loop | always (the next pass follows) |
/// | route | the route has one (each branch is terminal within the taken path) |
public final class VisibilityInference {

    private VisibilityInference() {}

    /// Infers tiers for a pipeline root under the default `FILTERED` policy.
    ///
    /// @param root pipeline root, not null
    /// @return node name to tier, in traversal order, never null
    public static Map<String, Visibility> infer(Node root) {
        return infer(root, false, VisibilityPolicy.FILTERED);
    }

    /// Infers tiers for a tree.
    ///
    /// @param root tree root, not null
    /// @param hasSuccessor whether anything runs after the tree
    /// @param policy visibility policy, not null
    /// @return node name to tier, in traversal order, never null
    public static Map<String, Visibility> infer(
            Node root, boolean hasSuccessor, VisibilityPolicy policy) {
        Map<String, Visibility> result = new LinkedHashMap<>();
        walk(root, hasSuccessor, policy, true, result);
        return result;
    }

    /// Infers the tiers implied by position alone, ignoring `show()`/`hide()` overrides.
    ///
    /// @param root tree root, not null
    /// @param hasSuccessor whether anything runs after the tree
    /// @param policy visibility policy, not null
    /// @return node name to structural tier, never null
    public static Map<String, Visibility> inferStructural(
            Node root, boolean hasSuccessor, VisibilityPolicy policy) {
        Map<String, Visibility> result = new LinkedHashMap<>();
        walk(root, hasSuccessor, policy, false, result);
        return result;
    }

    private static void walk(
            Node node,
            boolean hasSuccessor,
            VisibilityPolicy policy,
            boolean honorOverrides,
            Map<String, Visibility> result) {
        List<Node> children = node.children();
        switch (node.nodeType()) {
            case AGENT -> result.put(node.name(), classify((AgentNode) node, hasSuccessor, policy, honorOverrides));
            case TRANSFORM, TAP, EXPECT, GATE -> markZeroCost(node, result);
            case SEQUENCE -> {
                for (int i = 0; i < children.size(); i++) {
                    boolean childHasSuccessor = i < children.size() - 1 || hasSuccessor;
                    walk(children.get(i), childHasSuccessor, policy, honorOverrides, result);
                }
            }
            case LOOP -> children.forEach(child -> walk(child, true, policy, honorOverrides, result));
            case ROUTE -> {
                markZeroCost(node, result);
                children.forEach(child -> walk(child, hasSuccessor, policy, honorOverrides, result));
            }
            case PARALLEL, FALLBACK, RACE, TIMEOUT, MAP_OVER ->
                    children.forEach(child -> walk(child, hasSuccessor, policy, honorOverrides, result));
        }
    }

    // Never replaces an agent's tier with a step of the same name.
    private static void markZeroCost(Node node, Map<String, Visibility> result) {
        result.putIfAbsent(node.name(), Visibility.ZERO_COST);
    }

    private static Visibility classify(
            AgentNode agent, boolean hasSuccessor, VisibilityPolicy policy, boolean honorOverrides) {
        if (honorOverrides && agent.visibilityOverride() != null) {
            return agent.visibilityOverride();
        }
        if (policy == VisibilityPolicy.TRANSPARENT) {
            return Visibility.USER;
        }
        return hasSuccessor ? Visibility.INTERNAL : Visibility.USER;
    }
}
