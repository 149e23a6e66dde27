package io.pipewright.core.ir;

import io.pipewright.core.exception.InvalidPipelineException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Conditional dispatch: the first rule whose matcher holds selects the branch.
///
/// ### Contracts
/// - **Precondition**: at least one rule or a default branch
/// - **Invariant**: children are the rule targets in declaration order, then the default
/// - **Postcondition** (execution): exactly one branch runs, or the route fails; it never
///   silently does nothing
///
/// @param name node name, not null
/// @param dispatchKey state key the key-based rules compare, may be null for predicate-only
///     routes
/// @param rules ordered rules, not null
/// @param defaultBranch branch taken when no rule matches, may be null
public record RouteNode(String name, String dispatchKey, List<RouteRule> rules, Node defaultBranch)
        implements Node {

    public RouteNode {
        Objects.requireNonNull(name, "name must not be null");
        rules = rules != null ? List.copyOf(rules) : List.of();
        if (rules.isEmpty() && defaultBranch == null) {
            throw new InvalidPipelineException(
                    "Route '" + name + "' must declare at least one rule or a default branch");
        }
        NodeNames.requireUniqueAgentNames(branches(rules, defaultBranch));
    }

    @Override
    public NodeType nodeType() {
        return NodeType.ROUTE;
    }

    @Override
    public List<Node> children() {
        return branches(rules, defaultBranch);
    }

    public boolean hasDefault() {
        return defaultBranch != null;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRoute(this);
    }

    private static List<Node> branches(List<RouteRule> rules, Node defaultBranch) {
        List<Node> branches = new ArrayList<>(rules.size() + 1);
        rules.forEach(rule -> branches.add(rule.target()));
        if (defaultBranch != null) {
            branches.add(defaultBranch);
        }
        return List.copyOf(branches);
    }
}
