package io.pipewright.core;

import io.pipewright.core.algebra.Flow;
import io.pipewright.core.backend.Backend;
import io.pipewright.core.contract.ContractChecker;
import io.pipewright.core.contract.ContractIssue;
import io.pipewright.core.exception.ContractViolationException;
import io.pipewright.core.ir.Node;
import io.pipewright.core.lowering.ExecutionGraph;
import io.pipewright.core.lowering.GraphLowerer;
import io.pipewright.core.visibility.Visibility;
import io.pipewright.core.visibility.VisibilityInference;
import io.pipewright.core.visibility.VisibilityPolicy;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Turns a pipeline expression into a runnable {@link CompiledPipeline}.
///
/// ### Pipeline
/// 1. Snapshot the expression to IR
/// 2. Run the contract checker (skipped in {@link BuildMode#UNCHECKED})
/// 3. Apply the build mode: log in `ADVISORY`, throw on errors in `STRICT`
/// 4. Infer visibility and lower to an {@link ExecutionGraph}
///
/// @see BuildMode
public class PipelineCompiler {

    private static final Logger logger = Logger.getLogger(PipelineCompiler.class.getName());

    private final BuildMode mode;
    private final VisibilityPolicy policy;
    private final Backend backend;
    private final ContractChecker checker;

    /// Creates a compiler whose pipelines can be checked and lowered but not run.
    ///
    /// @param mode build mode, not null
    public PipelineCompiler(BuildMode mode) {
        this(mode, VisibilityPolicy.FILTERED, null);
    }

    /// Creates a compiler.
    ///
    /// @param mode build mode, not null
    /// @param policy visibility policy, not null
    /// @param backend backend used by {@link CompiledPipeline#run}, may be null
    public PipelineCompiler(BuildMode mode, VisibilityPolicy policy, Backend backend) {
        this(mode, policy, backend, new ContractChecker());
    }

    public PipelineCompiler(
            BuildMode mode, VisibilityPolicy policy, Backend backend, ContractChecker checker) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.checker = Objects.requireNonNull(checker, "checker must not be null");
        this.backend = backend;
    }

    public BuildMode getMode() {
        return mode;
    }

    public CompiledPipeline compile(Flow flow) {
        return compile(flow.toIr(), Set.of());
    }

    public CompiledPipeline compile(Node root) {
        return compile(root, Set.of());
    }

    /// Compiles an IR tree.
    ///
    /// @param root IR root, not null
    /// @param initialKeys state keys the caller guarantees before the first step, not null
    /// @return compiled pipeline, never null
    /// @throws ContractViolationException in `STRICT` mode when any issue is an error
    public CompiledPipeline compile(Node root, Set<String> initialKeys) {
        Objects.requireNonNull(root, "root must not be null");

        List<ContractIssue> issues = mode == BuildMode.UNCHECKED
                ? List.of()
                : checker.check(root, policy, initialKeys);

        if (mode == BuildMode.STRICT && issues.stream().anyMatch(ContractIssue::isError)) {
            throw new ContractViolationException(issues);
        }
        for (ContractIssue issue : issues) {
            if (issue.isError()) {
                logger.warning("Pipeline '" + root.name() + "': " + issue);
            } else {
                logger.info("Pipeline '" + root.name() + "': " + issue);
            }
        }

        Map<String, Visibility> visibility = VisibilityInference.infer(root, false, policy);
        ExecutionGraph graph = GraphLowerer.lower(root, visibility, policy);
        logger.fine("Compiled pipeline '" + root.name() + "' in " + mode + " mode with "
                + issues.size() + " issue(s)");
        return new CompiledPipeline(root, issues, visibility, graph, backend);
    }
}
