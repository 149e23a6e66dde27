package io.pipewright.core.template;

import java.util.List;
import java.util.Map;

/// Resolves `{key}` placeholders in agent instructions against pipeline state.
///
/// @see SimpleTemplateResolver
public interface TemplateResolver {

    /// Substitutes placeholders with state values.
    ///
    /// @param template instruction template, may be null (treated as empty)
    /// @param state current state, not null
    /// @return resolved text, never null
    String resolve(String template, Map<String, Object> state);

    /// Lists the placeholders of a template in order of appearance, without duplicates.
    ///
    /// @param template instruction template, may be null
    /// @return placeholders, never null
    List<TemplateVariable> variables(String template);
}
