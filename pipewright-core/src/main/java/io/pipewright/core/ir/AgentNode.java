package io.pipewright.core.ir;

import io.pipewright.core.visibility.Visibility;
import java.util.List;
import java.util.Objects;

/// Leaf node that invokes one language-model agent.
///
/// The instruction is a template: `{key}` placeholders are state reads, `{key?}` marks
/// an optional read. Writes are the {@link #outputKey()} and every field of the
/// {@link #producesSchema()}.
///
/// @param name unique identifier within the tree, not null
/// @param model model reference passed to the backend, not null (may be empty)
/// @param instruction instruction template, not null (may be empty)
/// @param outputKey state key receiving the agent's text output, may be null
/// @param producesSchema structured output schema, may be null
/// @param consumesSchema structured input schema, may be null
/// @param visibilityOverride explicit `USER`/`INTERNAL` override, may be null
/// @param description free-form description, not null (may be empty)
public record AgentNode(
        String name,
        String model,
        String instruction,
        String outputKey,
        Schema producesSchema,
        Schema consumesSchema,
        Visibility visibilityOverride,
        String description)
        implements Node {

    public AgentNode {
        NodeNames.requireIdentifier(name, "Agent name");
        model = model != null ? model : "";
        instruction = instruction != null ? instruction : "";
        description = description != null ? description : "";
        if (visibilityOverride == Visibility.ZERO_COST) {
            throw new IllegalArgumentException("Agents cannot be overridden to ZERO_COST");
        }
    }

    @Override
    public NodeType nodeType() {
        return NodeType.AGENT;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAgent(this);
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    /// Returns a builder pre-populated with this node's attributes.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .model(model)
                .instruction(instruction)
                .outputKey(outputKey)
                .producesSchema(producesSchema)
                .consumesSchema(consumesSchema)
                .visibilityOverride(visibilityOverride)
                .description(description);
    }

    /// Mutable builder for {@link AgentNode}. Validation happens in {@link #build()}.
    public static final class Builder {
        private String name;
        private String model;
        private String instruction;
        private String outputKey;
        private Schema producesSchema;
        private Schema consumesSchema;
        private Visibility visibilityOverride;
        private String description;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder instruction(String instruction) {
            this.instruction = instruction;
            return this;
        }

        public Builder outputKey(String outputKey) {
            this.outputKey = outputKey;
            return this;
        }

        public Builder producesSchema(Schema producesSchema) {
            this.producesSchema = producesSchema;
            return this;
        }

        public Builder consumesSchema(Schema consumesSchema) {
            this.consumesSchema = consumesSchema;
            return this;
        }

        public Builder visibilityOverride(Visibility visibilityOverride) {
            this.visibilityOverride = visibilityOverride;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public AgentNode build() {
            Objects.requireNonNull(name, "name must not be null");
            return new AgentNode(
                    name,
                    model,
                    instruction,
                    outputKey,
                    producesSchema,
                    consumesSchema,
                    visibilityOverride,
                    description);
        }
    }
}
