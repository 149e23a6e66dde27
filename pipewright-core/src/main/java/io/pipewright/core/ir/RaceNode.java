package io.pipewright.core.ir;

import java.util.List;
import java.util.Objects;

/// Runs children concurrently; the first to complete successfully wins and the others
/// are cancelled. Only the winner's writes become visible.
///
/// @param name node name, not null
/// @param children ordered children, not empty
public record RaceNode(String name, List<Node> children) implements Node {

    public RaceNode {
        Objects.requireNonNull(name, "name must not be null");
        children = NodeNames.requireChildren(children, "Race '" + name + "'");
    }

    @Override
    public NodeType nodeType() {
        return NodeType.RACE;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRace(this);
    }
}
