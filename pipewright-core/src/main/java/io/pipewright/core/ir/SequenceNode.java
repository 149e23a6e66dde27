package io.pipewright.core.ir;

import java.util.List;
import java.util.Objects;

/// Runs children one after another; each child sees the writes of all previous ones.
///
/// @param name node name, not null
/// @param children ordered children, not empty
public record SequenceNode(String name, List<Node> children) implements Node {

    public SequenceNode {
        Objects.requireNonNull(name, "name must not be null");
        children = NodeNames.requireChildren(children, "Sequence '" + name + "'");
    }

    @Override
    public NodeType nodeType() {
        return NodeType.SEQUENCE;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSequence(this);
    }
}
