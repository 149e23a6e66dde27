package io.pipewright.core.algebra;

import io.pipewright.core.ir.AgentNode;
import io.pipewright.core.ir.Node;
import io.pipewright.core.ir.Schema;
import io.pipewright.core.visibility.Visibility;
import java.util.Objects;

/// Immutable agent builder and the usual entry point of the algebra.
///
/// Every configuration method returns a new {@code Agent}; the receiver is never
/// modified, so a base agent can be specialised several times.
///
/// {@snippet :
/// Agent classifier = Agent.named("classifier")
///         .model("gemini-2.5-flash")
///         .instruct("Classify the request: {request}")
///         .outputs("intent");
/// Agent typed = classifier.withOutputSchema(Schema.of(Intent.class)); // classifier unchanged
/// }
public final class Agent implements Flow {

    private final AgentNode node;

    private Agent(AgentNode node) {
        this.node = node;
    }

    /// Starts a new agent.
    ///
    /// @param name identifier, unique within the pipeline it ends up in, not null
    /// @return new agent, never null
    /// @throws io.pipewright.core.exception.InvalidPipelineException if the name is not an
    ///     identifier
    public static Agent named(String name) {
        return new Agent(AgentNode.builder(name).build());
    }

    /// Wraps an existing agent node.
    ///
    /// @param node agent node, not null
    /// @return agent builder over the node, never null
    public static Agent from(AgentNode node) {
        return new Agent(Objects.requireNonNull(node, "node must not be null"));
    }

    public Agent model(String model) {
        return new Agent(node.toBuilder().model(model).build());
    }

    public Agent instruct(String instruction) {
        return new Agent(node.toBuilder().instruction(instruction).build());
    }

    /// Stores the agent's text output under the given state key.
    ///
    /// @param outputKey state key, not null
    /// @return new agent, never null
    public Agent outputs(String outputKey) {
        return new Agent(node.toBuilder().outputKey(outputKey).build());
    }

    public Agent describe(String description) {
        return new Agent(node.toBuilder().description(description).build());
    }

    /// Binds a structured output schema; every schema field becomes a state write.
    ///
    /// @param schema output schema, not null
    /// @return new agent, never null
    public Agent withOutputSchema(Schema schema) {
        return new Agent(node.toBuilder().producesSchema(schema).build());
    }

    public Agent withOutputSchema(Class<?> recordType) {
        return withOutputSchema(Schema.of(recordType));
    }

    /// Binds a structured input schema; every schema field becomes a state read.
    ///
    /// @param schema input schema, not null
    /// @return new agent, never null
    public Agent withInputSchema(Schema schema) {
        return new Agent(node.toBuilder().consumesSchema(schema).build());
    }

    public Agent withInputSchema(Class<?> recordType) {
        return withInputSchema(Schema.of(recordType));
    }

    /// Forces this agent's output to be user-facing regardless of position.
    public Agent show() {
        return new Agent(node.toBuilder().visibilityOverride(Visibility.USER).build());
    }

    /// Forces this agent's output to be internal regardless of position.
    public Agent hide() {
        return new Agent(node.toBuilder().visibilityOverride(Visibility.INTERNAL).build());
    }

    /// Copies this agent under a new name, keeping every other attribute.
    ///
    /// @param newName identifier of the copy, not null
    /// @return the copy, never null
    public Agent clone(String newName) {
        return new Agent(node.toBuilder().name(newName).build());
    }

    public String name() {
        return node.name();
    }

    public String outputKey() {
        return node.outputKey();
    }

    @Override
    public Node toIr() {
        return node;
    }

    @Override
    public String toString() {
        return "Agent[" + node.name() + "]";
    }
}
