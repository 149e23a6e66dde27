package io.pipewright.core.algebra;

import io.pipewright.core.exception.InvalidPipelineException;
import io.pipewright.core.ir.Node;
import io.pipewright.core.ir.NodeNames;
import io.pipewright.core.ir.RouteNode;
import io.pipewright.core.ir.RouteRule;
import io.pipewright.core.state.StatePredicate;
import java.util.ArrayList;
import java.util.List;

/// Immutable route builder.
///
/// Rules are evaluated in declaration order and the first match wins; {@link #otherwise}
/// sets the default branch. Key comparisons (`eq`, `contains`, `gt`, `lt`) need a dispatch
/// key; {@link #when} rules work on any route and may read several keys.
///
/// {@snippet :
/// Route triage = Route.on("category")
///         .eq("billing", billingAgent)
///         .eq("tech", techAgent)
///         .when(StatePredicate.reading(s -> isVip(s), "tier"), vipAgent)
///         .otherwise(generalAgent);
/// }
///
/// @implNote {@link #toIr()} rejects a route with neither rules nor a default, so an
/// incomplete builder can be passed around but not composed.
public final class Route implements Flow {

    private final String name;
    private final String dispatchKey;
    private final List<RouteRule> rules;
    private final Node defaultBranch;

    private Route(String name, String dispatchKey, List<RouteRule> rules, Node defaultBranch) {
        this.name = name;
        this.dispatchKey = dispatchKey;
        this.rules = List.copyOf(rules);
        this.defaultBranch = defaultBranch;
    }

    /// Starts a route dispatching on a state key.
    ///
    /// @param dispatchKey state key compared by key rules, not null
    /// @return empty route named `route_<key>`, never null
    public static Route on(String dispatchKey) {
        if (dispatchKey == null || dispatchKey.isBlank()) {
            throw new InvalidPipelineException("Route dispatch key must not be blank");
        }
        return new Route("route_" + dispatchKey, dispatchKey, List.of(), null);
    }

    /// Starts a route that only uses {@link #when} rules.
    ///
    /// @return empty keyless route named `route`, never null
    public static Route keyless() {
        return new Route("route", null, List.of(), null);
    }

    public Route named(String newName) {
        return new Route(newName, dispatchKey, rules, defaultBranch);
    }

    public Route eq(Object value, Flow target) {
        return withRule(RouteRule.eq(requireKey("eq"), value, target.toIr()));
    }

    public Route contains(String substring, Flow target) {
        return withRule(RouteRule.contains(requireKey("contains"), substring, target.toIr()));
    }

    public Route gt(Number threshold, Flow target) {
        return withRule(RouteRule.gt(requireKey("gt"), threshold, target.toIr()));
    }

    public Route lt(Number threshold, Flow target) {
        return withRule(RouteRule.lt(requireKey("lt"), threshold, target.toIr()));
    }

    /// Adds a free-form predicate rule.
    ///
    /// Declare the keys the predicate reads with {@link StatePredicate#reading} so the
    /// contract checker can verify them.
    ///
    /// @param predicate rule condition, not null
    /// @param target branch, not null
    /// @return new route, never null
    public Route when(StatePredicate predicate, Flow target) {
        return withRule(RouteRule.when(predicate, target.toIr()));
    }

    public Route otherwise(Flow target) {
        Node branch = target.toIr();
        requireUniqueAgents(rules, branch);
        return new Route(name, dispatchKey, rules, branch);
    }

    @Override
    public RouteNode toIr() {
        return new RouteNode(name, dispatchKey, rules, defaultBranch);
    }

    private Route withRule(RouteRule rule) {
        List<RouteRule> next = new ArrayList<>(rules);
        next.add(rule);
        requireUniqueAgents(next, defaultBranch);
        return new Route(name, dispatchKey, next, defaultBranch);
    }

    private static void requireUniqueAgents(List<RouteRule> rules, Node defaultBranch) {
        List<Node> branches = new ArrayList<>();
        rules.forEach(rule -> branches.add(rule.target()));
        if (defaultBranch != null) {
            branches.add(defaultBranch);
        }
        NodeNames.requireUniqueAgentNames(branches);
    }

    private String requireKey(String operation) {
        if (dispatchKey == null) {
            throw new InvalidPipelineException(
                    operation + "() requires a dispatch key; use Route.on(key) or when()");
        }
        return dispatchKey;
    }
}
