package io.pipewright.core.template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Template resolver using regex.
///
/// Placeholders are `{identifier}` or `{identifier?}`. Text in braces that is not an
/// identifier (JSON snippets, `{ }`) is left untouched. Missing values render as empty
/// text for both required and optional placeholders; reporting missing required keys is
/// the contract checker's job.
public class SimpleTemplateResolver implements TemplateResolver {

    private static final Pattern TEMPLATE_PATTERN = Pattern.compile("\\{(\\w+)(\\?)?}");

    @Override
    public String resolve(String template, Map<String, Object> state) {
        if (template == null) {
            return "";
        }

        Matcher matcher = TEMPLATE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            Object value = state.get(matcher.group(1));
            String replacement = value != null ? value.toString() : "";
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    @Override
    public List<TemplateVariable> variables(String template) {
        if (template == null || template.isEmpty()) {
            return List.of();
        }
        // A key that appears both required and optional counts as required
        Map<String, Boolean> optionalByKey = new LinkedHashMap<>();
        Matcher matcher = TEMPLATE_PATTERN.matcher(template);
        while (matcher.find()) {
            boolean optional = matcher.group(2) != null;
            optionalByKey.merge(matcher.group(1), optional, Boolean::logicalAnd);
        }
        List<TemplateVariable> variables = new ArrayList<>(optionalByKey.size());
        optionalByKey.forEach((key, optional) -> variables.add(new TemplateVariable(key, optional)));
        return List.copyOf(variables);
    }
}
