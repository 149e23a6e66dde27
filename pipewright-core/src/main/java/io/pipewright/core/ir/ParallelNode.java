package io.pipewright.core.ir;

import java.util.List;
import java.util.Objects;

/// Runs children concurrently on isolated copies of the state and merges their writes
/// once all of them have completed.
///
/// @param name node name, not null
/// @param children ordered children, not empty
public record ParallelNode(String name, List<Node> children) implements Node {

    public ParallelNode {
        Objects.requireNonNull(name, "name must not be null");
        children = NodeNames.requireChildren(children, "Parallel '" + name + "'");
    }

    @Override
    public NodeType nodeType() {
        return NodeType.PARALLEL;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitParallel(this);
    }
}
