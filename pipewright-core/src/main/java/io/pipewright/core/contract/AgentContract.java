package io.pipewright.core.contract;

import io.pipewright.core.template.TemplateVariable;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Reads and writes of one agent, as extracted by the first checker pass.
///
/// @param agent agent name, not null
/// @param templateReads placeholders of the instruction, in order
/// @param schemaReads fields of the consumed schema
/// @param writes output key and produced schema fields
record AgentContract(
        String agent, List<TemplateVariable> templateReads, Set<String> schemaReads, Set<String> writes) {

    AgentContract {
        templateReads = List.copyOf(templateReads);
        schemaReads = Set.copyOf(schemaReads);
        writes = Set.copyOf(writes);
    }

    /// Returns every key this agent reads, optional placeholders included.
    Set<String> allReads() {
        Set<String> reads = new LinkedHashSet<>();
        templateReads.forEach(variable -> reads.add(variable.key()));
        reads.addAll(schemaReads);
        return reads;
    }
}
