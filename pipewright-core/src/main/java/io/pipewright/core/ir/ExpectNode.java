package io.pipewright.core.ir;

import io.pipewright.core.state.StatePredicate;
import java.util.List;
import java.util.Objects;

/// State assertion. Fails the run with {@link #message()} when the predicate is false.
///
/// @param name node name, not null
/// @param predicate asserted condition, not null
/// @param message failure message, defaults to {@value #DEFAULT_MESSAGE}
public record ExpectNode(String name, StatePredicate predicate, String message) implements Node {

    public static final String DEFAULT_MESSAGE = "state assertion failed";

    public ExpectNode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null");
        message = message != null ? message : DEFAULT_MESSAGE;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.EXPECT;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitExpect(this);
    }
}
