package io.pipewright.core.lowering;

/// Visitor over the closed set of execution steps.
///
/// @param <R> result type produced for each step
public interface StepVisitor<R> {

    R visitAgent(ExecutionStep.AgentStep step);

    R visitSequence(ExecutionStep.SequenceStep step);

    R visitParallel(ExecutionStep.ParallelStep step);

    R visitLoop(ExecutionStep.LoopStep step);

    R visitCheckpoint(ExecutionStep.CheckpointStep step);

    R visitRoute(ExecutionStep.RouteStep step);

    R visitFallback(ExecutionStep.FallbackStep step);

    R visitRace(ExecutionStep.RaceStep step);

    R visitTimeout(ExecutionStep.TimeoutStep step);

    R visitMapOver(ExecutionStep.MapOverStep step);

    R visitTransform(ExecutionStep.TransformStep step);

    R visitTap(ExecutionStep.TapStep step);

    R visitExpect(ExecutionStep.ExpectStep step);

    R visitGate(ExecutionStep.GateStep step);
}
