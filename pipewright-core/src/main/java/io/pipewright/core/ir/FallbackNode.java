package io.pipewright.core.ir;

import java.util.List;
import java.util.Objects;

/// Tries children left to right; the first child that completes without error wins and
/// the writes of failed attempts are discarded.
///
/// @param name node name, not null
/// @param children ordered children, not empty
public record FallbackNode(String name, List<Node> children) implements Node {

    public FallbackNode {
        Objects.requireNonNull(name, "name must not be null");
        children = NodeNames.requireChildren(children, "Fallback '" + name + "'");
    }

    @Override
    public NodeType nodeType() {
        return NodeType.FALLBACK;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFallback(this);
    }
}
