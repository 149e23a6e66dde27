package io.pipewright.core.execution;

import io.pipewright.core.lowering.ExecutionStep;
import java.util.logging.Logger;

/// Listener that logs the execution lifecycle through `java.util.logging`.
///
/// Step boundaries are logged at `FINE`, agent calls at `INFO`, failures at `WARNING`.
public class LoggingExecutionListener implements ExecutionListener {

    private static final Logger logger = Logger.getLogger(LoggingExecutionListener.class.getName());

    @Override
    public void onStepStart(ExecutionStep step) {
        logger.fine("Step started: " + step.name() + " (" + step.kind() + ")");
    }

    @Override
    public void onStepComplete(ExecutionStep step) {
        logger.fine("Step completed: " + step.name());
    }

    @Override
    public void onStepFailed(ExecutionStep step, ExecutionError error) {
        logger.warning("Step failed: " + step.name() + " [" + error.type() + "] " + error.message());
    }

    @Override
    public void onAgentStart(String agentName, String instruction) {
        logger.info("Agent '" + agentName + "' invoked (" + instruction.length() + " chars)");
    }

    @Override
    public void onAgentComplete(String agentName, AgentEvent event) {
        logger.info("Agent '" + agentName + "' replied, visibility=" + event.visibility());
    }
}
