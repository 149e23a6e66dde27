package io.pipewright.serialization;

import io.pipewright.core.state.StateFunction;
import io.pipewright.core.state.StateObserver;
import io.pipewright.core.state.StatePredicate;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Named callables referenced from serialized pipelines.
///
/// Predicates, state functions and observers cannot be written as JSON. The serializer
/// writes the name under which a callable instance is registered here; callables that
/// are not registered are written as a generated reference `<nodeName>#<role>`
/// (for example `review_loop#until`), which can itself be registered before reading.
///
/// {@snippet :
/// CallableRegistry registry = new CallableRegistry()
///         .predicate("is_done", isDone)
///         .function("normalize", normalize);
/// String json = PipelineSerializer.toJson(root, registry);
/// Node restored = PipelineSerializer.fromJson(json, registry);
/// }
///
/// @implNote **Not thread-safe** for registration. Populate before use.
public class CallableRegistry {

    private final Map<String, StatePredicate> predicates = new LinkedHashMap<>();
    private final Map<String, StateFunction> functions = new LinkedHashMap<>();
    private final Map<String, StateObserver> observers = new LinkedHashMap<>();
    private final Map<Object, String> names = new IdentityHashMap<>();

    public CallableRegistry predicate(String name, StatePredicate predicate) {
        predicates.put(name, predicate);
        names.put(predicate, name);
        return this;
    }

    public CallableRegistry function(String name, StateFunction function) {
        functions.put(name, function);
        names.put(function, name);
        return this;
    }

    public CallableRegistry observer(String name, StateObserver observer) {
        observers.put(name, observer);
        names.put(observer, name);
        return this;
    }

    /// Returns the registered name of a callable instance.
    ///
    /// @param callable predicate, function or observer, not null
    /// @return name, or empty if this exact instance is not registered
    public Optional<String> nameOf(Object callable) {
        return Optional.ofNullable(names.get(callable));
    }

    public StatePredicate requirePredicate(String name) {
        return require(predicates, name, "predicate");
    }

    public StateFunction requireFunction(String name) {
        return require(functions, name, "function");
    }

    public StateObserver requireObserver(String name) {
        return require(observers, name, "observer");
    }

    public Set<String> names() {
        return Set.copyOf(names.values());
    }

    private static <T> T require(Map<String, T> entries, String name, String role) {
        T callable = entries.get(name);
        if (callable == null) {
            throw new IllegalArgumentException(
                    "Unknown " + role + " '" + name + "'. Registered: " + entries.keySet());
        }
        return callable;
    }
}
