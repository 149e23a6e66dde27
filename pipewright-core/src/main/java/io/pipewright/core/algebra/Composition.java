package io.pipewright.core.algebra;

import io.pipewright.core.ir.FallbackNode;
import io.pipewright.core.ir.LoopNode;
import io.pipewright.core.ir.Node;
import io.pipewright.core.ir.ParallelNode;
import io.pipewright.core.ir.SequenceNode;
import io.pipewright.core.state.StatePredicate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/// Node-level composition rules shared by {@link Flow} and {@link Flows}.
///
/// Sequence, parallel and fallback operands of the same kind are spliced rather than
/// nested, so composition is associative. Generated names follow the operator:
/// `a_then_b`, `a_and_b`, `a_or_b`, `a_x3`, `a_until`.
final class Composition {

    private Composition() {}

    static SequenceNode sequence(List<Node> operands) {
        List<Node> children = flatten(operands, SequenceNode.class);
        return new SequenceNode(join(children, "_then_"), children);
    }

    static ParallelNode parallel(List<Node> operands) {
        List<Node> children = flatten(operands, ParallelNode.class);
        return new ParallelNode(join(children, "_and_"), children);
    }

    static FallbackNode fallback(List<Node> operands) {
        List<Node> children = flatten(operands, FallbackNode.class);
        return new FallbackNode(join(children, "_or_"), children);
    }

    static LoopNode loop(Node body, int maxIterations, StatePredicate until, String suffix) {
        List<Node> children = body instanceof SequenceNode seq ? seq.children() : List.of(body);
        return new LoopNode(body.name() + suffix, children, maxIterations, until);
    }

    /// Returns the number of top-level steps a node contributes to a sequence.
    static int sequenceLength(Node node) {
        return node instanceof SequenceNode seq ? seq.children().size() : 1;
    }

    private static List<Node> flatten(List<Node> operands, Class<? extends Node> kind) {
        List<Node> children = new ArrayList<>();
        for (Node operand : operands) {
            if (kind.isInstance(operand)) {
                children.addAll(operand.children());
            } else {
                children.add(operand);
            }
        }
        return children;
    }

    private static String join(List<Node> children, String separator) {
        return children.stream().map(Node::name).collect(Collectors.joining(separator));
    }
}
