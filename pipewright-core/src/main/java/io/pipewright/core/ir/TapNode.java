package io.pipewright.core.ir;

import io.pipewright.core.state.StateObserver;
import java.util.List;
import java.util.Objects;

/// Observes state without changing it.
///
/// @param name node name, not null
/// @param observer callback, not null
public record TapNode(String name, StateObserver observer) implements Node {

    public TapNode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(observer, "observer must not be null");
    }

    @Override
    public NodeType nodeType() {
        return NodeType.TAP;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTap(this);
    }
}
