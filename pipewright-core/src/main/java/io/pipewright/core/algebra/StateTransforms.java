package io.pipewright.core.algebra;

import io.pipewright.core.ir.KeyEffect;
import io.pipewright.core.ir.TransformKind;
import io.pipewright.core.ir.TransformNode;
import io.pipewright.core.state.StateFunction;
import io.pipewright.core.state.StateKeys;
import io.pipewright.core.state.StatePredicate;
import io.pipewright.core.state.StateUpdate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Factories for pure state transforms.
///
/// Each factory returns a single-step {@link Pipeline} wrapping a {@link TransformNode}
/// whose {@link KeyEffect} describes the change to the available keys. `pick`, `drop` and
/// `rename` replace the session state (scoped `app:`/`user:`/`temp:` keys survive); every
/// other transform returns an additive delta.
///
/// {@snippet :
/// Flow flow = researcher
///         .then(StateTransforms.rename(Map.of("findings", "notes")))
///         .then(StateTransforms.defaults(Map.of("tone", "neutral")))
///         .then(writer);
/// }
public final class StateTransforms {

    private static final Logger logger = Logger.getLogger(StateTransforms.class.getName());

    public static final String DEFAULT_MERGE_SEPARATOR = "\n";
    public static final String DEFAULT_GUARD_MESSAGE = "State guard failed";

    private StateTransforms() {}

    /// Keeps only the given keys.
    public static Pipeline pick(String... keys) {
        List<String> list = List.of(keys);
        return Pipeline.of(pickNode(nameFor("pick", list), list));
    }

    /// Removes the given keys.
    public static Pipeline drop(String... keys) {
        List<String> list = List.of(keys);
        return Pipeline.of(dropNode(nameFor("drop", list), list));
    }

    /// Renames keys; keys not in the mapping are kept as they are.
    ///
    /// @param mapping old key to new key, not null
    /// @return transform pipeline, never null
    public static Pipeline rename(Map<String, String> mapping) {
        Map<String, String> ordered = new LinkedHashMap<>(mapping);
        return Pipeline.of(renameNode(nameFor("rename", ordered.keySet()), ordered));
    }

    /// Writes each value whose key is absent or null.
    public static Pipeline defaults(Map<String, Object> values) {
        Map<String, Object> ordered = new LinkedHashMap<>(values);
        return Pipeline.of(defaultNode(nameFor("default", ordered.keySet()), ordered));
    }

    public static Pipeline merge(List<String> keys, String into) {
        return merge(keys, into, DEFAULT_MERGE_SEPARATOR);
    }

    /// Joins the string forms of several keys into one key, skipping absent values.
    ///
    /// @param keys source keys in join order, not null
    /// @param into target key, not null
    /// @param separator join separator, not null
    /// @return transform pipeline, never null
    public static Pipeline merge(List<String> keys, String into, String separator) {
        return Pipeline.of(mergeNode("merge_" + into, List.copyOf(keys), into, separator));
    }

    /// Replaces one key's value with a function of it. Absent keys are left alone.
    ///
    /// @param key state key, not null
    /// @param fn value mapping, not null
    /// @return transform pipeline, never null
    public static Pipeline transform(String key, Function<Object, Object> fn) {
        Objects.requireNonNull(fn, "fn must not be null");
        StateFunction function =
                state ->
                        state.containsKey(key)
                                ? StateUpdate.delta(singleton(key, fn.apply(state.get(key))))
                                : StateUpdate.delta(Map.of());
        return Pipeline.of(
                new TransformNode(
                        "transform_" + key,
                        TransformKind.TRANSFORM,
                        Map.of("key", key),
                        KeyEffect.reading(Set.of(key)),
                        function));
    }

    /// Writes a key computed from the whole state.
    ///
    /// @param key target key, not null
    /// @param fn computation, not null
    /// @param reads keys the computation reads, for the contract checker
    /// @return transform pipeline, never null
    public static Pipeline compute(String key, Function<Map<String, Object>, Object> fn, String... reads) {
        Objects.requireNonNull(fn, "fn must not be null");
        StateFunction function = state -> StateUpdate.delta(singleton(key, fn.apply(state)));
        return Pipeline.of(
                new TransformNode(
                        "compute_" + key,
                        TransformKind.COMPUTE,
                        Map.of("key", key),
                        KeyEffect.readWrite(new LinkedHashSet<>(Arrays.asList(reads)), Set.of(key)),
                        function));
    }

    /// Writes fixed values.
    public static Pipeline set(Map<String, Object> values) {
        Map<String, Object> ordered = new LinkedHashMap<>(values);
        return Pipeline.of(setNode(nameFor("set", ordered.keySet()), ordered));
    }

    public static Pipeline guard(StatePredicate predicate) {
        return guard(predicate, DEFAULT_GUARD_MESSAGE);
    }

    /// Fails the step with the message when the predicate is false.
    ///
    /// @param predicate required condition, not null
    /// @param message failure message, not null
    /// @return transform pipeline, never null
    public static Pipeline guard(StatePredicate predicate, String message) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        StateFunction function =
                state -> {
                    if (!predicate.test(state)) {
                        throw new IllegalStateException(message);
                    }
                    return StateUpdate.delta(Map.of());
                };
        return Pipeline.of(
                new TransformNode(
                        "guard",
                        TransformKind.GUARD,
                        Map.of("message", message),
                        KeyEffect.reading(predicate.reads()),
                        function));
    }

    /// Logs the given keys at `INFO` without changing state.
    public static Pipeline log(String... keys) {
        List<String> list = List.of(keys);
        return Pipeline.of(logNode(nameFor("log", list), list));
    }

    /// Copies the most recent agent reply into a state key.
    ///
    /// @param key target key, not null
    /// @return transform pipeline, never null
    /// @see StateKeys#LAST_OUTPUT
    public static Pipeline capture(String key) {
        return Pipeline.of(captureNode("capture_" + key, key));
    }

    /// Rebuilds a parameter-only transform from its kind and parameters.
    ///
    /// Used by deserializers; transforms wrapping user code cannot be rebuilt this way.
    ///
    /// @param name node name, not null
    /// @param kind transform kind, not null
    /// @param params parameters as written by the factory, not null
    /// @return rebuilt node, never null
    /// @throws IllegalArgumentException if the kind wraps user code
    public static TransformNode rebuild(String name, TransformKind kind, Map<String, Object> params) {
        return switch (kind) {
            case PICK -> pickNode(name, stringList(params.get("keys")));
            case DROP -> dropNode(name, stringList(params.get("keys")));
            case RENAME -> renameNode(name, stringMap(params.get("mapping")));
            case DEFAULT -> defaultNode(name, objectMap(params.get("values")));
            case MERGE ->
                    mergeNode(
                            name,
                            stringList(params.get("keys")),
                            (String) params.get("into"),
                            (String) params.getOrDefault("separator", DEFAULT_MERGE_SEPARATOR));
            case SET -> setNode(name, objectMap(params.get("values")));
            case LOG -> logNode(name, stringList(params.get("keys")));
            case CAPTURE -> captureNode(name, (String) params.get("key"));
            case TRANSFORM, COMPUTE, GUARD, FUNCTION ->
                    throw new IllegalArgumentException(
                            "Transform '" + name + "' of kind " + kind + " wraps user code");
        };
    }

    private static TransformNode pickNode(String name, List<String> keys) {
        StateFunction function =
                state -> {
                    Map<String, Object> kept = new LinkedHashMap<>();
                    for (String key : keys) {
                        if (state.containsKey(key)) {
                            kept.put(key, state.get(key));
                        }
                    }
                    return StateUpdate.replace(kept);
                };
        Set<String> keySet = Set.copyOf(keys);
        return new TransformNode(
                name,
                TransformKind.PICK,
                Map.of("keys", keys),
                new KeyEffect(keySet, Set.of(), Set.of(), keySet),
                function);
    }

    private static TransformNode dropNode(String name, List<String> keys) {
        StateFunction function =
                state -> {
                    Map<String, Object> kept = new LinkedHashMap<>(state);
                    keys.forEach(kept::remove);
                    return StateUpdate.replace(kept);
                };
        return new TransformNode(
                name,
                TransformKind.DROP,
                Map.of("keys", keys),
                new KeyEffect(Set.of(), Set.of(), Set.copyOf(keys), null),
                function);
    }

    private static TransformNode renameNode(String name, Map<String, String> mapping) {
        StateFunction function =
                state -> {
                    Map<String, Object> renamed = new LinkedHashMap<>();
                    state.forEach((key, value) -> renamed.put(mapping.getOrDefault(key, key), value));
                    return StateUpdate.replace(renamed);
                };
        return new TransformNode(
                name,
                TransformKind.RENAME,
                Map.of("mapping", mapping),
                new KeyEffect(
                        mapping.keySet(),
                        new LinkedHashSet<>(mapping.values()),
                        mapping.keySet(),
                        null),
                function);
    }

    private static TransformNode defaultNode(String name, Map<String, Object> values) {
        StateFunction function =
                state -> {
                    Map<String, Object> missing = new LinkedHashMap<>();
                    values.forEach(
                            (key, value) -> {
                                if (state.get(key) == null) {
                                    missing.put(key, value);
                                }
                            });
                    return StateUpdate.delta(missing);
                };
        return new TransformNode(
                name,
                TransformKind.DEFAULT,
                Map.of("values", values),
                KeyEffect.readWrite(Set.of(), values.keySet()),
                function);
    }

    private static TransformNode mergeNode(
            String name, List<String> keys, String into, String separator) {
        Objects.requireNonNull(into, "into must not be null");
        StateFunction function =
                state -> {
                    String merged =
                            keys.stream()
                                    .map(state::get)
                                    .filter(Objects::nonNull)
                                    .map(Object::toString)
                                    .collect(Collectors.joining(separator));
                    return StateUpdate.delta(singleton(into, merged));
                };
        return new TransformNode(
                name,
                TransformKind.MERGE,
                Map.of("keys", keys, "into", into, "separator", separator),
                KeyEffect.readWrite(Set.copyOf(keys), Set.of(into)),
                function);
    }

    private static TransformNode setNode(String name, Map<String, Object> values) {
        Map<String, Object> snapshot = new LinkedHashMap<>(values);
        return new TransformNode(
                name,
                TransformKind.SET,
                Map.of("values", snapshot),
                KeyEffect.readWrite(Set.of(), snapshot.keySet()),
                state -> StateUpdate.delta(snapshot));
    }

    private static TransformNode logNode(String name, List<String> keys) {
        StateFunction function =
                state -> {
                    Map<String, Object> shown = new LinkedHashMap<>();
                    keys.forEach(key -> shown.put(key, state.get(key)));
                    logger.info("[" + name + "] " + shown);
                    return StateUpdate.delta(Map.of());
                };
        return new TransformNode(
                name, TransformKind.LOG, Map.of("keys", keys), KeyEffect.reading(Set.copyOf(keys)), function);
    }

    private static TransformNode captureNode(String name, String key) {
        Objects.requireNonNull(key, "key must not be null");
        StateFunction function =
                state -> StateUpdate.delta(singleton(key, state.get(StateKeys.LAST_OUTPUT)));
        return new TransformNode(
                name,
                TransformKind.CAPTURE,
                Map.of("key", key),
                KeyEffect.readWrite(Set.of(), Set.of(key)),
                function);
    }

    private static String nameFor(String prefix, Iterable<String> keys) {
        List<String> parts = new ArrayList<>();
        parts.add(prefix);
        keys.forEach(key -> parts.add(key.replaceAll("\\W", "_")));
        return String.join("_", parts);
    }

    private static List<String> stringList(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return Arrays.asList(String.valueOf(value));
    }

    private static Map<String, Object> objectMap(Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> source) {
            source.forEach((key, entry) -> map.put(String.valueOf(key), entry));
        }
        return map;
    }

    private static Map<String, String> stringMap(Object value) {
        Map<String, String> map = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> source) {
            source.forEach((key, entry) -> map.put(String.valueOf(key), String.valueOf(entry)));
        }
        return map;
    }

    // Map.of rejects null values; transforms may legitimately write null.
    private static Map<String, Object> singleton(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return map;
    }
}
