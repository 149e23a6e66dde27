package io.pipewright.core.ir;

import io.pipewright.core.exception.InvalidPipelineException;
import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Named list of state fields describing structured agent input or output.
///
/// When bound as an agent's produced schema, every field becomes a state write; when
/// bound as the consumed schema, every field becomes a state read.
///
/// @param name schema name, not null
/// @param fields ordered field names, not null, not empty
public record Schema(String name, List<String> fields) {

    public Schema {
        Objects.requireNonNull(name, "name must not be null");
        if (fields == null || fields.isEmpty()) {
            throw new InvalidPipelineException("Schema '" + name + "' must declare fields");
        }
        fields = List.copyOf(fields);
    }

    public static Schema of(String name, String... fields) {
        return new Schema(name, Arrays.asList(fields));
    }

    /// Derives a schema from a record class, one field per record component.
    ///
    /// @param recordType record class, not null
    /// @return schema named after the class, never null
    /// @throws InvalidPipelineException if the class is not a record
    public static Schema of(Class<?> recordType) {
        if (!recordType.isRecord()) {
            throw new InvalidPipelineException(
                    "Schema type must be a record: " + recordType.getName());
        }
        List<String> fields =
                Arrays.stream(recordType.getRecordComponents())
                        .map(RecordComponent::getName)
                        .toList();
        return new Schema(recordType.getSimpleName(), fields);
    }
}
