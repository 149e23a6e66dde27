package io.pipewright.core.ir;

import java.util.List;
import java.util.Objects;

/// Runs its child once per element of the list stored under {@link #listKey()}.
///
/// Each run sees the current element under {@link #itemKey()}. Per-item results are
/// collected, in order, into a list stored under {@link #outputKey()}; items run strictly
/// one after another.
///
/// @param name node name, not null
/// @param listKey state key holding the input list, not null
/// @param itemKey state key exposing the current element, not null
/// @param outputKey state key receiving the result list, not null
/// @param child body run per element, not null
public record MapOverNode(
        String name, String listKey, String itemKey, String outputKey, Node child)
        implements Node {

    public static final String DEFAULT_ITEM_KEY = "_item";
    public static final String DEFAULT_OUTPUT_KEY = "results";

    public MapOverNode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(listKey, "listKey must not be null");
        Objects.requireNonNull(child, "child must not be null");
        itemKey = itemKey != null ? itemKey : DEFAULT_ITEM_KEY;
        outputKey = outputKey != null ? outputKey : DEFAULT_OUTPUT_KEY;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.MAP_OVER;
    }

    @Override
    public List<Node> children() {
        return List.of(child);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMapOver(this);
    }
}
