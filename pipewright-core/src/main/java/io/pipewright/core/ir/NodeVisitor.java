package io.pipewright.core.ir;

/// Visitor over the closed set of IR node variants.
///
/// @param <R> result type produced for each node
public interface NodeVisitor<R> {

    R visitAgent(AgentNode node);

    R visitSequence(SequenceNode node);

    R visitParallel(ParallelNode node);

    R visitLoop(LoopNode node);

    R visitRoute(RouteNode node);

    R visitFallback(FallbackNode node);

    R visitRace(RaceNode node);

    R visitTimeout(TimeoutNode node);

    R visitMapOver(MapOverNode node);

    R visitTransform(TransformNode node);

    R visitTap(TapNode node);

    R visitExpect(ExpectNode node);

    R visitGate(GateNode node);
}
