package io.pipewright.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.pipewright.core.ir.AgentNode;
import io.pipewright.core.ir.ExpectNode;
import io.pipewright.core.ir.GateNode;
import io.pipewright.core.ir.KeyEffect;
import io.pipewright.core.ir.KeyMatcher;
import io.pipewright.core.ir.LoopNode;
import io.pipewright.core.ir.MapOverNode;
import io.pipewright.core.ir.Node;
import io.pipewright.core.ir.RouteNode;
import io.pipewright.core.ir.RouteRule;
import io.pipewright.core.ir.Schema;
import io.pipewright.core.ir.TapNode;
import io.pipewright.core.ir.TimeoutNode;
import io.pipewright.core.ir.TransformNode;
import java.io.IOException;
import java.io.Serial;
import java.util.Collection;
import java.util.TreeSet;

/// Serializes IR nodes to JSON with a `"nodeType"` discriminator field.
///
/// Every object begins with `"name"` and `"nodeType"`, followed by type-specific fields.
/// Optional fields are omitted when null.
///
/// ```
/// NodeType     Additional fields
/// -------------+------------------------------------------------------------------
/// AGENT        │ model, instruction, outputKey, producesSchema, consumesSchema,
///              │ visibility, description
/// SEQUENCE     │ children
/// PARALLEL     │ children
/// FALLBACK     │ children
/// RACE         │ children
/// LOOP         │ children, maxIterations, until
/// ROUTE        │ dispatchKey, rules[label, matcher | predicate, target], defaultBranch
/// TIMEOUT      │ duration (ISO-8601), child
/// MAP_OVER     │ listKey, itemKey, outputKey, child
/// TRANSFORM    │ kind, params, keyEffect, function (user-code kinds only)
/// TAP          │ observer
/// EXPECT       │ predicate, message
/// GATE         │ predicate, message, gateKey
/// ```
///
/// @implNote Package-private. Registered by {@link PipewrightJacksonModule}.
/// @see NodeDeserializer for the inverse operation
class NodeSerializer extends StdSerializer<Node> {

    @Serial private static final long serialVersionUID = -6031947368457290118L;

    private final transient CallableRegistry registry;

    NodeSerializer(CallableRegistry registry) {
        super(Node.class);
        this.registry = registry;
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", node.name());
        gen.writeStringField("nodeType", node.nodeType().name());

        switch (node.nodeType()) {
            case AGENT -> writeAgent((AgentNode) node, gen);
            case SEQUENCE, PARALLEL, FALLBACK, RACE -> writeChildren(node, gen, provider);
            case LOOP -> writeLoop((LoopNode) node, gen, provider);
            case ROUTE -> writeRoute((RouteNode) node, gen, provider);
            case TIMEOUT -> {
                TimeoutNode timeout = (TimeoutNode) node;
                gen.writeStringField("duration", timeout.duration().toString());
                gen.writeFieldName("child");
                serialize(timeout.child(), gen, provider);
            }
            case MAP_OVER -> {
                MapOverNode mapOver = (MapOverNode) node;
                gen.writeStringField("listKey", mapOver.listKey());
                gen.writeStringField("itemKey", mapOver.itemKey());
                gen.writeStringField("outputKey", mapOver.outputKey());
                gen.writeFieldName("child");
                serialize(mapOver.child(), gen, provider);
            }
            case TRANSFORM -> writeTransform((TransformNode) node, gen, provider);
            case TAP -> gen.writeStringField("observer", ref(((TapNode) node).observer(), node, "observer"));
            case EXPECT -> {
                ExpectNode expect = (ExpectNode) node;
                gen.writeStringField("predicate", ref(expect.predicate(), node, "predicate"));
                gen.writeStringField("message", expect.message());
            }
            case GATE -> {
                GateNode gate = (GateNode) node;
                gen.writeStringField("predicate", ref(gate.predicate(), node, "predicate"));
                gen.writeStringField("message", gate.message());
                gen.writeStringField("gateKey", gate.gateKey());
            }
        }

        gen.writeEndObject();
    }

    private void writeAgent(AgentNode agent, JsonGenerator gen) throws IOException {
        gen.writeStringField("model", agent.model());
        gen.writeStringField("instruction", agent.instruction());
        writeIfNotNull(gen, "outputKey", agent.outputKey());
        writeSchema(gen, "producesSchema", agent.producesSchema());
        writeSchema(gen, "consumesSchema", agent.consumesSchema());
        if (agent.visibilityOverride() != null) {
            gen.writeStringField("visibility", agent.visibilityOverride().name());
        }
        if (!agent.description().isEmpty()) {
            gen.writeStringField("description", agent.description());
        }
    }

    private void writeChildren(Node node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeArrayFieldStart("children");
        for (Node child : node.children()) {
            serialize(child, gen, provider);
        }
        gen.writeEndArray();
    }

    private void writeLoop(LoopNode loop, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeNumberField("maxIterations", loop.maxIterations());
        if (loop.hasUntil()) {
            gen.writeStringField("until", ref(loop.untilPredicate(), loop, "until"));
        }
        writeChildren(loop, gen, provider);
    }

    private void writeRoute(RouteNode route, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        writeIfNotNull(gen, "dispatchKey", route.dispatchKey());
        gen.writeArrayFieldStart("rules");
        int index = 0;
        for (RouteRule rule : route.rules()) {
            gen.writeStartObject();
            gen.writeStringField("label", rule.label());
            if (rule.matcher() instanceof KeyMatcher matcher) {
                gen.writeObjectFieldStart("matcher");
                gen.writeStringField("operation", matcher.operation().name());
                gen.writeStringField("key", matcher.key());
                provider.defaultSerializeField("operand", matcher.operand(), gen);
                gen.writeEndObject();
            } else {
                gen.writeStringField("predicate", ref(rule.matcher(), route, "rule" + index));
            }
            gen.writeFieldName("target");
            serialize(rule.target(), gen, provider);
            gen.writeEndObject();
            index++;
        }
        gen.writeEndArray();
        if (route.hasDefault()) {
            gen.writeFieldName("defaultBranch");
            serialize(route.defaultBranch(), gen, provider);
        }
    }

    private void writeTransform(TransformNode transform, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStringField("kind", transform.kind().name());
        provider.defaultSerializeField("params", transform.params(), gen);
        KeyEffect effect = transform.keyEffect();
        gen.writeObjectFieldStart("keyEffect");
        writeKeys(gen, "reads", effect.reads());
        writeKeys(gen, "writes", effect.writes());
        writeKeys(gen, "removes", effect.removes());
        if (effect.retains() != null) {
            writeKeys(gen, "retains", effect.retains());
        }
        gen.writeEndObject();
        if (transform.kind().wrapsUserCode()) {
            gen.writeStringField("function", ref(transform.function(), transform, "function"));
        }
    }

    private String ref(Object callable, Node owner, String role) {
        return registry.nameOf(callable).orElse(owner.name() + "#" + role);
    }

    private static void writeSchema(JsonGenerator gen, String field, Schema schema)
            throws IOException {
        if (schema == null) {
            return;
        }
        gen.writeObjectFieldStart(field);
        gen.writeStringField("name", schema.name());
        gen.writeArrayFieldStart("fields");
        for (String name : schema.fields()) {
            gen.writeString(name);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private static void writeKeys(JsonGenerator gen, String field, Collection<String> keys)
            throws IOException {
        gen.writeArrayFieldStart(field);
        for (String key : new TreeSet<>(keys)) {
            gen.writeString(key);
        }
        gen.writeEndArray();
    }

    private static void writeIfNotNull(JsonGenerator gen, String field, String value)
            throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }
}
