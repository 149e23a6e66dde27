package io.pipewright.core.algebra;

import io.pipewright.core.exception.InvalidPipelineException;
import io.pipewright.core.ir.AgentNode;
import io.pipewright.core.ir.ExpectNode;
import io.pipewright.core.ir.FallbackNode;
import io.pipewright.core.ir.KeyEffect;
import io.pipewright.core.ir.Node;
import io.pipewright.core.ir.RouteNode;
import io.pipewright.core.ir.RouteRule;
import io.pipewright.core.ir.SequenceNode;
import io.pipewright.core.ir.TapNode;
import io.pipewright.core.ir.TimeoutNode;
import io.pipewright.core.ir.TransformKind;
import io.pipewright.core.ir.TransformNode;
import io.pipewright.core.state.StateFunction;
import io.pipewright.core.state.StateObserver;
import io.pipewright.core.state.StatePredicate;
import io.pipewright.core.state.StateUpdate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Composable pipeline fragment: anything that can produce an IR snapshot.
///
/// Every operator is pure. It snapshots both operands with {@link #toIr()} and returns a
/// new {@link Pipeline}; neither operand changes, so fragments can be shared between
/// pipelines.
///
/// ### Operators
/// | Method | Result |
/// |---|---|
/// | `then(b)` | sequence, flattened |
/// | `then(fn)` | sequence ending in a function transform |
/// | `then(Map)` | sequence followed by a route on the upstream output key |
/// | `fanOut(b)` | parallel, flattened |
/// | `repeat(n)`, `repeat(until)` | loop |
/// | `fallback(b)` | fallback chain, flattened |
///
/// {@snippet :
/// Flow pipeline = researcher.then(writer).then(reviewer.fanOut(factChecker));
/// Node ir = pipeline.toIr();
/// }
///
/// @see Flows for static factories
/// @see Agent
/// @see Route
public interface Flow {

    /// Snapshots this fragment as an immutable IR tree.
    ///
    /// Repeated calls return deep-equal trees.
    ///
    /// @return IR root, never null
    Node toIr();

    /// Sequences this fragment with another.
    ///
    /// @param next fragment run afterwards, not null
    /// @return new pipeline, never null
    /// @throws io.pipewright.core.exception.DuplicateNodeNameException if both sides
    ///     contain an agent with the same name
    default Pipeline then(Flow next) {
        return new Pipeline(Composition.sequence(List.of(toIr(), next.toIr())));
    }

    /// Sequences this fragment with an anonymous state function.
    ///
    /// The function becomes a transform named `fn_<position>`, where position is its
    /// zero-based index in the resulting sequence. Use {@link Flows#fn} to keep a name.
    ///
    /// @param function transform run afterwards, not null
    /// @return new pipeline, never null
    default Pipeline then(StateFunction function) {
        Node head = toIr();
        int position = Composition.sequenceLength(head);
        TransformNode step =
                new TransformNode(
                        "fn_" + position, TransformKind.FUNCTION, Map.of(), KeyEffect.NONE, function);
        return new Pipeline(Composition.sequence(List.of(head, step)));
    }

    /// Routes on this fragment's output key: each map entry becomes an equality rule.
    ///
    /// Entries are evaluated in the map's iteration order; pass an ordered map when
    /// order matters. There is no default branch.
    ///
    /// @param branches dispatch value to branch, not null, not empty
    /// @return `sequence(this, route)`, never null
    /// @throws InvalidPipelineException if this fragment does not end in an agent with an
    ///     output key
    default Pipeline then(Map<?, ? extends Flow> branches) {
        Node head = toIr();
        String key = upstreamOutputKey(head);
        if (key == null) {
            throw new InvalidPipelineException(
                    "Dict routing needs an upstream agent with an output key, but '"
                            + head.name()
                            + "' has none");
        }
        List<RouteRule> rules = new ArrayList<>();
        branches.forEach((value, flow) -> rules.add(RouteRule.eq(key, value, flow.toIr())));
        RouteNode route = new RouteNode("route_" + key, key, rules, null);
        return new Pipeline(Composition.sequence(List.of(head, route)));
    }

    default Pipeline fanOut(Flow other) {
        return new Pipeline(Composition.parallel(List.of(toIr(), other.toIr())));
    }

    /// Repeats this fragment a fixed number of times.
    ///
    /// @param times iteration count, at least 1
    /// @return loop pipeline named `<name>_x<times>`, never null
    default Pipeline repeat(int times) {
        return new Pipeline(Composition.loop(toIr(), times, null, "_x" + times));
    }

    /// Repeats this fragment until a condition holds, up to the given bound.
    ///
    /// @param until exit condition and bound, not null
    /// @return loop pipeline, never null
    default Pipeline repeat(Until until) {
        return new Pipeline(
                Composition.loop(toIr(), until.maxIterations(), until.predicate(), "_until"));
    }

    default Pipeline fallback(Flow other) {
        return new Pipeline(Composition.fallback(List.of(toIr(), other.toIr())));
    }

    /// Appends a static, always-succeeding terminal fallback.
    ///
    /// @param terminal function producing the fallback state update, not null
    /// @return fallback pipeline, never null
    default Pipeline fallback(StateFunction terminal) {
        Node head = toIr();
        int position = head instanceof FallbackNode ? head.children().size() : 1;
        TransformNode step =
                new TransformNode(
                        "fallback_fn_" + position,
                        TransformKind.FUNCTION,
                        Map.of(),
                        KeyEffect.NONE,
                        terminal);
        return new Pipeline(Composition.fallback(List.of(head, step)));
    }

    default Pipeline tap(StateObserver observer) {
        Node head = toIr();
        TapNode tap = new TapNode("tap_" + Composition.sequenceLength(head), observer);
        return new Pipeline(Composition.sequence(List.of(head, tap)));
    }

    default Pipeline expect(StatePredicate predicate, String message) {
        Node head = toIr();
        ExpectNode expect =
                new ExpectNode("expect_" + Composition.sequenceLength(head), predicate, message);
        return new Pipeline(Composition.sequence(List.of(head, expect)));
    }

    /// Runs this fragment only when the predicate holds; otherwise it is skipped.
    ///
    /// Desugars to a predicate route whose default branch is a no-op transform.
    ///
    /// @param predicate run condition, not null
    /// @return conditional pipeline named `proceed_if_<name>`, never null
    default Pipeline proceedIf(StatePredicate predicate) {
        Node body = toIr();
        TransformNode skip =
                new TransformNode(
                        "skip_" + body.name(),
                        TransformKind.SET,
                        Map.of("values", Map.of()),
                        KeyEffect.NONE,
                        state -> StateUpdate.delta(Map.of()));
        return new Pipeline(
                new RouteNode(
                        "proceed_if_" + body.name(),
                        null,
                        List.of(RouteRule.when(predicate, body)),
                        skip));
    }

    default Pipeline loopUntil(StatePredicate predicate, int maxIterations) {
        return repeat(Until.until(predicate, maxIterations));
    }

    default Pipeline loopUntil(StatePredicate predicate) {
        return repeat(Until.until(predicate));
    }

    /// Retries this fragment while the predicate holds.
    ///
    /// Defined as `loopUntil(predicate.negate(), maxRetries)`.
    ///
    /// @param predicate retry condition, not null
    /// @param maxRetries upper bound on attempts, at least 1
    /// @return loop pipeline, never null
    default Pipeline retryIf(StatePredicate predicate, int maxRetries) {
        return loopUntil(predicate.negate(), maxRetries);
    }

    default Pipeline retryIf(StatePredicate predicate) {
        return retryIf(predicate, Until.DEFAULT_MAX_RETRIES);
    }

    default Pipeline timeout(Duration duration) {
        Node body = toIr();
        return new Pipeline(new TimeoutNode("timeout_" + body.name(), body, duration));
    }

    private static String upstreamOutputKey(Node node) {
        Node last = node;
        if (node instanceof SequenceNode seq) {
            last = seq.children().get(seq.children().size() - 1);
        }
        return last instanceof AgentNode agent ? agent.outputKey() : null;
    }
}
