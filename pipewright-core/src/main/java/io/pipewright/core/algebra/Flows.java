package io.pipewright.core.algebra;

import io.pipewright.core.ir.ExpectNode;
import io.pipewright.core.ir.GateNode;
import io.pipewright.core.ir.KeyEffect;
import io.pipewright.core.ir.MapOverNode;
import io.pipewright.core.ir.Node;
import io.pipewright.core.ir.RaceNode;
import io.pipewright.core.ir.TapNode;
import io.pipewright.core.ir.TimeoutNode;
import io.pipewright.core.ir.TransformKind;
import io.pipewright.core.ir.TransformNode;
import io.pipewright.core.state.StateFunction;
import io.pipewright.core.state.StateObserver;
import io.pipewright.core.state.StatePredicate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/// Static factories for pipeline primitives that are not naturally infix.
///
/// Control primitives without a fixed name (`gate`, `expect`, `tap`) get a generic name;
/// pass an explicit one when a pipeline contains several of the same kind.
public final class Flows {

    private Flows() {}

    public static Pipeline sequence(Flow first, Flow... rest) {
        return new Pipeline(Composition.sequence(snapshot(first, rest)));
    }

    public static Pipeline parallel(Flow first, Flow... rest) {
        return new Pipeline(Composition.parallel(snapshot(first, rest)));
    }

    public static Pipeline fallback(Flow first, Flow... rest) {
        return new Pipeline(Composition.fallback(snapshot(first, rest)));
    }

    /// Runs the flows concurrently; the first to complete wins and the rest are cancelled.
    ///
    /// @param first first contender, not null
    /// @param rest other contenders
    /// @return race pipeline named `race_<a>_vs_<b>`, never null
    public static Pipeline race(Flow first, Flow... rest) {
        List<Node> children = snapshot(first, rest);
        String name =
                "race_" + children.stream().map(Node::name).collect(Collectors.joining("_vs_"));
        return new Pipeline(new RaceNode(name, children));
    }

    public static Pipeline timeout(Flow body, Duration duration) {
        return body.timeout(duration);
    }

    /// Runs the body once per element of `state[listKey]`, collecting results under
    /// `results` with the current element under `_item`.
    ///
    /// @param listKey key of the input list, not null
    /// @param body per-item flow, not null
    /// @return map-over pipeline, never null
    public static Pipeline mapOver(String listKey, Flow body) {
        return mapOver(listKey, MapOverNode.DEFAULT_ITEM_KEY, MapOverNode.DEFAULT_OUTPUT_KEY, body);
    }

    public static Pipeline mapOver(String listKey, String itemKey, String outputKey, Flow body) {
        return new Pipeline(new MapOverNode("map_" + listKey, listKey, itemKey, outputKey, body.toIr()));
    }

    /// Pauses for human approval whenever the predicate holds.
    ///
    /// @param predicate condition requiring approval, not null
    /// @return gate pipeline, never null
    public static Pipeline gate(StatePredicate predicate) {
        return gate("gate", predicate, GateNode.DEFAULT_MESSAGE, null);
    }

    public static Pipeline gate(StatePredicate predicate, String message) {
        return gate("gate", predicate, message, null);
    }

    /// Pauses for approval whenever the predicate holds, approved through `state[gateKey]`.
    ///
    /// @param predicate condition requiring approval, not null
    /// @param message shown while waiting, may be null for the default
    /// @param gateKey approval flag key, may be null for `_gate_gate`
    /// @return gate pipeline named `gate`, never null
    public static Pipeline gate(StatePredicate predicate, String message, String gateKey) {
        return gate("gate", predicate, message, gateKey);
    }

    public static Pipeline gate(String name, StatePredicate predicate, String message, String gateKey) {
        return new Pipeline(new GateNode(name, predicate, message, gateKey));
    }

    public static Pipeline expect(StatePredicate predicate) {
        return expect(predicate, ExpectNode.DEFAULT_MESSAGE);
    }

    public static Pipeline expect(StatePredicate predicate, String message) {
        return new Pipeline(new ExpectNode("expect", predicate, message));
    }

    public static Pipeline tap(StateObserver observer) {
        return tap("tap", observer);
    }

    public static Pipeline tap(String name, StateObserver observer) {
        return new Pipeline(new TapNode(name, observer));
    }

    /// Wraps a state function as a named transform step.
    ///
    /// @param name node name, not null
    /// @param function the transform, not null
    /// @return single-step pipeline, never null
    public static Pipeline fn(String name, StateFunction function) {
        return new Pipeline(
                new TransformNode(name, TransformKind.FUNCTION, Map.of(), KeyEffect.NONE, function));
    }

    /// Like {@link #fn(String, StateFunction)} with a declared key effect, so the contract
    /// checker can follow the keys the function reads and writes.
    public static Pipeline fn(String name, StateFunction function, KeyEffect effect) {
        return new Pipeline(
                new TransformNode(name, TransformKind.FUNCTION, Map.of(), effect, function));
    }

    public static Until until(StatePredicate predicate) {
        return Until.until(predicate);
    }

    public static Until until(StatePredicate predicate, int maxIterations) {
        return Until.until(predicate, maxIterations);
    }

    private static List<Node> snapshot(Flow first, Flow... rest) {
        List<Node> nodes = new ArrayList<>(rest.length + 1);
        nodes.add(first.toIr());
        Arrays.stream(rest).map(Flow::toIr).forEach(nodes::add);
        return nodes;
    }
}
