package io.pipewright.core.ir;

import io.pipewright.core.exception.InvalidPipelineException;
import io.pipewright.core.state.StatePredicate;
import java.util.List;
import java.util.Objects;

/// Repeats its children sequentially, at most {@link #maxIterations()} times.
///
/// The until-predicate, when present, is evaluated only after a full pass over the
/// children; a true result ends the loop early.
///
/// @param name node name, not null
/// @param children loop body in order, not empty
/// @param maxIterations upper bound on passes, at least 1
/// @param untilPredicate early-exit condition, may be null
public record LoopNode(
        String name, List<Node> children, int maxIterations, StatePredicate untilPredicate)
        implements Node {

    public LoopNode {
        Objects.requireNonNull(name, "name must not be null");
        children = NodeNames.requireChildren(children, "Loop '" + name + "'");
        if (maxIterations < 1) {
            throw new InvalidPipelineException(
                    "Loop '" + name + "' needs maxIterations >= 1, got " + maxIterations);
        }
    }

    @Override
    public NodeType nodeType() {
        return NodeType.LOOP;
    }

    public boolean hasUntil() {
        return untilPredicate != null;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLoop(this);
    }
}
