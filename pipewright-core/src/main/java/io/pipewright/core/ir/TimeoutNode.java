package io.pipewright.core.ir;

import io.pipewright.core.exception.InvalidPipelineException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/// Runs its child under a deadline. On expiry the child is cancelled and a timeout error
/// is reported; the child is never retried.
///
/// @param name node name, not null
/// @param child wrapped node, not null
/// @param duration deadline, strictly positive
public record TimeoutNode(String name, Node child, Duration duration) implements Node {

    public TimeoutNode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(child, "child must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
        if (duration.isZero() || duration.isNegative()) {
            throw new InvalidPipelineException(
                    "Timeout '" + name + "' needs a positive duration, got " + duration);
        }
    }

    @Override
    public NodeType nodeType() {
        return NodeType.TIMEOUT;
    }

    @Override
    public List<Node> children() {
        return List.of(child);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTimeout(this);
    }
}
