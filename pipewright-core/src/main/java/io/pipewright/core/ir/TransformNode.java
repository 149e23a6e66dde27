package io.pipewright.core.ir;

import io.pipewright.core.state.StateFunction;
import io.pipewright.core.state.StateMaps;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Pure state transform: no model call, no visible output.
///
/// The {@link #keyEffect()} lets the contract checker follow keys through the transform
/// without running it.
///
/// @param name node name, not null
/// @param kind transform kind, not null
/// @param params kind-specific parameters (JSON-compatible values), not null
/// @param keyEffect static key effect, not null
/// @param function the transform itself, not null
public record TransformNode(
        String name,
        TransformKind kind,
        Map<String, Object> params,
        KeyEffect keyEffect,
        StateFunction function)
        implements Node {

    public TransformNode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(function, "function must not be null");
        params = params != null ? StateMaps.copyOf(params) : Map.of();
        keyEffect = keyEffect != null ? keyEffect : KeyEffect.NONE;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.TRANSFORM;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTransform(this);
    }
}
