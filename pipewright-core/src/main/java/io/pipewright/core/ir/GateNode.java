package io.pipewright.core.ir;

import io.pipewright.core.state.StatePredicate;
import java.util.List;
import java.util.Objects;

/// Human-in-the-loop checkpoint.
///
/// When the predicate holds, approval is needed: unless `state[gateKey]` is `true` (set by
/// whoever approved the pause), the run stops with an approval-required error and
/// `<gateKey>_pending` is set to `true`. When the predicate is false the gate passes.
///
/// @param name node name, not null
/// @param predicate condition under which approval is needed, not null
/// @param message message surfaced with the pause, defaults to {@value #DEFAULT_MESSAGE}
/// @param gateKey approval flag key, defaults to `_gate_<name>`
public record GateNode(String name, StatePredicate predicate, String message, String gateKey)
        implements Node {

    public static final String DEFAULT_MESSAGE = "Approval required";

    public GateNode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null");
        message = message != null ? message : DEFAULT_MESSAGE;
        gateKey = gateKey != null ? gateKey : "_gate_" + name;
    }

    /// Returns the key flagged while the gate waits for approval.
    ///
    /// @return `<gateKey>_pending`, never null
    public String pendingKey() {
        return gateKey + "_pending";
    }

    @Override
    public NodeType nodeType() {
        return NodeType.GATE;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitGate(this);
    }
}
