package io.pipewright.core;

import io.pipewright.core.backend.Backend;
import io.pipewright.core.contract.ContractIssue;
import io.pipewright.core.execution.ExecutionResult;
import io.pipewright.core.ir.Node;
import io.pipewright.core.lowering.ExecutionGraph;
import io.pipewright.core.visibility.Visibility;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Result of {@link PipelineCompiler#compile}: the checked IR and its lowered graph.
///
/// @param ir IR snapshot, not null
/// @param issues contract issues found (empty in unchecked mode), not null
/// @param visibility inferred visibility per agent, not null
/// @param graph lowered graph, not null
/// @param backend backend used by {@link #run}, may be null
public record CompiledPipeline(
        Node ir,
        List<ContractIssue> issues,
        Map<String, Visibility> visibility,
        ExecutionGraph graph,
        Backend backend) {

    public CompiledPipeline {
        Objects.requireNonNull(ir, "ir must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        issues = issues != null ? List.copyOf(issues) : List.of();
        visibility = visibility != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(visibility))
                : Map.of();
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(ContractIssue::isError);
    }

    /// Executes the pipeline.
    ///
    /// @param state initial state, not null
    /// @return execution result, never null
    /// @throws IllegalStateException if the compiler had no backend
    public ExecutionResult run(Map<String, Object> state) {
        if (backend == null) {
            throw new IllegalStateException(
                    "Pipeline '" + ir.name() + "' was compiled without a backend");
        }
        return backend.run(graph, state);
    }
}
