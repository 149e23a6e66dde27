package io.pipewright.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.pipewright.core.execution.ExecutionResult;
import io.pipewright.core.ir.Node;
import io.pipewright.core.visualizer.GraphDescription;

/// Utility class for JSON export and import of pipelines.
///
/// ### Usage
/// {@snippet :
/// String json = PipelineSerializer.toJson(pipeline.toIr(), registry);
/// Node restored = PipelineSerializer.fromJson(json, registry);
///
/// String graph = PipelineSerializer.toJson(GraphDescriber.describe(root));
/// String run = PipelineSerializer.toJson(result);
/// }
///
/// @implNote Thread-safe. A mapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see PipewrightJacksonModule for the registered type handlers
public final class PipelineSerializer {

    private PipelineSerializer() {}

    /// Serializes an IR tree to pretty-printed JSON.
    ///
    /// @param root tree root, not null
    /// @param registry names for callables, not null
    /// @return JSON, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Node root, CallableRegistry registry) {
        try {
            return createMapper(registry).writerFor(Node.class).writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize pipeline: " + e.getMessage(), e);
        }
    }

    /// Serializes a callable-free tree; any callable is written as a generated reference.
    ///
    /// @param root tree root, not null
    /// @return JSON, never null
    public static String toJson(Node root) {
        return toJson(root, new CallableRegistry());
    }

    /// Reads an IR tree, resolving callable references through the registry.
    ///
    /// @param json JSON produced by {@link #toJson(Node, CallableRegistry)}, not null
    /// @param registry callables by name, not null
    /// @return rebuilt tree, never null
    /// @throws IllegalArgumentException if the JSON is invalid or names an unknown callable
    public static Node fromJson(String json, CallableRegistry registry) {
        try {
            return createMapper(registry).readValue(json, Node.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize pipeline: " + e.getMessage(), e);
        }
    }

    public static String toJson(GraphDescription description) {
        try {
            return createMapper(new CallableRegistry()).writeValueAsString(description);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize graph description: " + e.getMessage(), e);
        }
    }

    /// Serializes an execution result (state, events, errors) for logging or transport.
    ///
    /// Event timestamps are written as ISO-8601 strings.
    ///
    /// @param result execution result, not null
    /// @return JSON, never null
    /// @throws IllegalArgumentException if a state value cannot be serialized
    public static String toJson(ExecutionResult result) {
        try {
            return createMapper(new CallableRegistry()).writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize execution result: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for pipeline serialization.
    ///
    /// Registers:
    /// - `PipewrightJacksonModule` for the IR hierarchy
    /// - `JavaTimeModule` for event timestamps
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @param registry callables by name, not null
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper(CallableRegistry registry) {
        return new ObjectMapper()
                .registerModule(new PipewrightJacksonModule(registry))
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
