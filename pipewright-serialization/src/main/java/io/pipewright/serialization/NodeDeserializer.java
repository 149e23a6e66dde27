package io.pipewright.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.pipewright.core.algebra.StateTransforms;
import io.pipewright.core.ir.AgentNode;
import io.pipewright.core.ir.ExpectNode;
import io.pipewright.core.ir.FallbackNode;
import io.pipewright.core.ir.GateNode;
import io.pipewright.core.ir.KeyEffect;
import io.pipewright.core.ir.KeyMatcher;
import io.pipewright.core.ir.LoopNode;
import io.pipewright.core.ir.MapOverNode;
import io.pipewright.core.ir.Node;
import io.pipewright.core.ir.NodeType;
import io.pipewright.core.ir.ParallelNode;
import io.pipewright.core.ir.RaceNode;
import io.pipewright.core.ir.RouteNode;
import io.pipewright.core.ir.RouteRule;
import io.pipewright.core.ir.Schema;
import io.pipewright.core.ir.SequenceNode;
import io.pipewright.core.ir.TapNode;
import io.pipewright.core.ir.TimeoutNode;
import io.pipewright.core.ir.TransformKind;
import io.pipewright.core.ir.TransformNode;
import io.pipewright.core.visibility.Visibility;
import java.io.IOException;
import java.io.Serial;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Deserializes JSON to IR nodes using the `"nodeType"` discriminator field.
///
/// Callable references are resolved through the {@link CallableRegistry}; an unknown
/// reference fails the whole read. Built-in transforms (pick, drop, rename and so on) are
/// rebuilt from their parameters and need no registration.
///
/// @implNote Package-private. Registered by {@link PipewrightJacksonModule}.
/// @see NodeSerializer for the inverse operation
class NodeDeserializer extends StdDeserializer<Node> {

    @Serial private static final long serialVersionUID = 2718549106254437731L;

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final transient CallableRegistry registry;

    NodeDeserializer(CallableRegistry registry) {
        super(Node.class);
        this.registry = registry;
    }

    @Override
    public Node deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        try {
            return readNode(mapper, root);
        } catch (RuntimeException e) {
            throw ctxt.weirdStringException(root.path("name").asText(), Node.class, e.getMessage());
        }
    }

    private Node readNode(ObjectMapper mapper, JsonNode json) throws IOException {
        String name = required(json, "name").asText();
        NodeType nodeType = NodeType.valueOf(required(json, "nodeType").asText());

        return switch (nodeType) {
            case AGENT -> readAgent(json, name);
            case SEQUENCE -> new SequenceNode(name, readChildren(mapper, json));
            case PARALLEL -> new ParallelNode(name, readChildren(mapper, json));
            case FALLBACK -> new FallbackNode(name, readChildren(mapper, json));
            case RACE -> new RaceNode(name, readChildren(mapper, json));
            case LOOP -> new LoopNode(
                    name,
                    readChildren(mapper, json),
                    required(json, "maxIterations").asInt(),
                    json.has("until") ? registry.requirePredicate(json.get("until").asText()) : null);
            case ROUTE -> readRoute(mapper, json, name);
            case TIMEOUT -> new TimeoutNode(
                    name,
                    readNode(mapper, required(json, "child")),
                    Duration.parse(required(json, "duration").asText()));
            case MAP_OVER -> new MapOverNode(
                    name,
                    required(json, "listKey").asText(),
                    textOrNull(json, "itemKey"),
                    textOrNull(json, "outputKey"),
                    readNode(mapper, required(json, "child")));
            case TRANSFORM -> readTransform(mapper, json, name);
            case TAP -> new TapNode(name, registry.requireObserver(required(json, "observer").asText()));
            case EXPECT -> new ExpectNode(
                    name,
                    registry.requirePredicate(required(json, "predicate").asText()),
                    textOrNull(json, "message"));
            case GATE -> new GateNode(
                    name,
                    registry.requirePredicate(required(json, "predicate").asText()),
                    textOrNull(json, "message"),
                    textOrNull(json, "gateKey"));
        };
    }

    private AgentNode readAgent(JsonNode json, String name) {
        AgentNode.Builder builder = AgentNode.builder(name)
                .model(textOrNull(json, "model"))
                .instruction(textOrNull(json, "instruction"))
                .outputKey(textOrNull(json, "outputKey"))
                .producesSchema(readSchema(json.get("producesSchema")))
                .consumesSchema(readSchema(json.get("consumesSchema")))
                .description(textOrNull(json, "description"));
        if (json.has("visibility")) {
            builder.visibilityOverride(Visibility.valueOf(json.get("visibility").asText()));
        }
        return builder.build();
    }

    private RouteNode readRoute(ObjectMapper mapper, JsonNode json, String name)
            throws IOException {
        List<RouteRule> rules = new ArrayList<>();
        for (JsonNode rule : json.path("rules")) {
            Node target = readNode(mapper, required(rule, "target"));
            String label = required(rule, "label").asText();
            if (rule.has("matcher")) {
                JsonNode matcher = rule.get("matcher");
                KeyMatcher keyMatcher = new KeyMatcher(
                        KeyMatcher.Operation.valueOf(required(matcher, "operation").asText()),
                        required(matcher, "key").asText(),
                        mapper.treeToValue(matcher.get("operand"), Object.class));
                rules.add(new RouteRule(label, keyMatcher, target));
            } else {
                rules.add(new RouteRule(
                        label, registry.requirePredicate(required(rule, "predicate").asText()), target));
            }
        }
        Node defaultBranch =
                json.has("defaultBranch") ? readNode(mapper, json.get("defaultBranch")) : null;
        return new RouteNode(name, textOrNull(json, "dispatchKey"), rules, defaultBranch);
    }

    private TransformNode readTransform(ObjectMapper mapper, JsonNode json, String name) {
        TransformKind kind = TransformKind.valueOf(required(json, "kind").asText());
        Map<String, Object> params = json.has("params")
                ? mapper.convertValue(json.get("params"), OBJECT_MAP)
                : Map.of();
        if (!kind.wrapsUserCode()) {
            return StateTransforms.rebuild(name, kind, params);
        }
        JsonNode effect = json.path("keyEffect");
        KeyEffect keyEffect = new KeyEffect(
                keys(effect.get("reads")),
                keys(effect.get("writes")),
                keys(effect.get("removes")),
                effect.has("retains") ? keys(effect.get("retains")) : null);
        return new TransformNode(
                name, kind, params, keyEffect, registry.requireFunction(required(json, "function").asText()));
    }

    private List<Node> readChildren(ObjectMapper mapper, JsonNode json) throws IOException {
        List<Node> children = new ArrayList<>();
        for (JsonNode child : json.path("children")) {
            children.add(readNode(mapper, child));
        }
        return children;
    }

    private static Schema readSchema(JsonNode json) {
        if (json == null || json.isNull()) {
            return null;
        }
        List<String> fields = new ArrayList<>();
        json.path("fields").forEach(field -> fields.add(field.asText()));
        return new Schema(required(json, "name").asText(), fields);
    }

    private static Set<String> keys(JsonNode json) {
        Set<String> keys = new LinkedHashSet<>();
        if (json != null) {
            json.forEach(key -> keys.add(key.asText()));
        }
        return keys;
    }

    private static JsonNode required(JsonNode json, String field) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing required field '" + field + "'");
        }
        return value;
    }

    private static String textOrNull(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
