package io.pipewright.core.template;

import java.util.Objects;

/// One `{key}` or `{key?}` placeholder of an instruction template.
///
/// @param key state key referenced, not null
/// @param optional `true` for `{key?}`: a missing value renders as empty text
public record TemplateVariable(String key, boolean optional) {

    public TemplateVariable {
        Objects.requireNonNull(key, "key must not be null");
    }
}
