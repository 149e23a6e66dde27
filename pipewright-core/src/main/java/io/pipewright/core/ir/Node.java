package io.pipewright.core.ir;

import java.util.List;

/// One immutable unit of a pipeline tree.
///
/// The variant set is closed: every analysis and lowering pass dispatches through
/// {@link NodeVisitor} and handles each variant explicitly.
///
/// ### Contracts
/// - **Invariant**: nodes never change after construction; "modifying" a node means
///   building a replacement
/// - **Invariant**: {@link #children()} order is execution order
/// - **Invariant**: equality is structural over names, attributes and children; callables
///   compare by identity
///
/// @see NodeVisitor
/// @see NodeType
public sealed interface Node
        permits AgentNode,
                SequenceNode,
                ParallelNode,
                LoopNode,
                RouteNode,
                FallbackNode,
                RaceNode,
                TimeoutNode,
                MapOverNode,
                TransformNode,
                TapNode,
                ExpectNode,
                GateNode {

    /// Returns the node name.
    ///
    /// @return name, never null
    String name();

    /// Returns the variant discriminator.
    ///
    /// @return node type, never null
    NodeType nodeType();

    /// Returns the structural children in execution order.
    ///
    /// For routes these are the rule targets followed by the default branch, if any.
    ///
    /// @return immutable child list, never null (empty for leaves)
    List<Node> children();

    /// Dispatches to the visitor method for this variant.
    ///
    /// @param visitor the visitor, not null
    /// @param <R> visitor result type
    /// @return the visitor's result
    <R> R accept(NodeVisitor<R> visitor);
}
