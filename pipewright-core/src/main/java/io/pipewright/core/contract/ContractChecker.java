package io.pipewright.core.contract;

import io.pipewright.core.ir.AgentNode;
import io.pipewright.core.ir.ExpectNode;
import io.pipewright.core.ir.GateNode;
import io.pipewright.core.ir.LoopNode;
import io.pipewright.core.ir.MapOverNode;
import io.pipewright.core.ir.Node;
import io.pipewright.core.ir.RouteNode;
import io.pipewright.core.ir.RouteRule;
import io.pipewright.core.template.SimpleTemplateResolver;
import io.pipewright.core.template.TemplateResolver;
import io.pipewright.core.template.TemplateVariable;
import io.pipewright.core.visibility.Visibility;
import io.pipewright.core.visibility.VisibilityInference;
import io.pipewright.core.visibility.VisibilityPolicy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Static analyser verifying state-key dataflow across a pipeline tree.
///
/// Runs seven passes in {@link CheckPass} order and returns their findings in that order.
/// The checker only reads the tree; it is safe to run concurrently on any number of trees.
///
/// ### Passes
/// 1. **Reads/writes**: `{key}` placeholders are reads (`{key?}` is optional); the output
///    key and produced schema fields are writes; consumed schema fields are reads
/// 2. **Output keys**: available keys are tracked in execution order (see
///    {@link KeyFlowAnalysis}); a key written by two parallel siblings is a warning
/// 3. **Template variables**: a required read that is not available is an error
/// 4. **Channel duplication**: a key read by both the instruction and the input schema is
///    a warning
/// 5. **Route keys**: route dispatch keys, `when` predicate reads, map-over list keys,
///    gate and expect reads, and loop exit reads must be available (errors)
/// 6. **Data loss**: an agent write that nothing reads later is a warning
/// 7. **Visibility**: hidden or internal agents whose output would be lost are warnings
///
/// {@snippet :
/// List<ContractIssue> issues = new ContractChecker().check(pipeline.toIr());
/// issues.stream().filter(ContractIssue::isError).forEach(System.out::println);
/// }
///
/// @see io.pipewright.core.PipelineCompiler for build modes built on this checker
public class ContractChecker {

    private static final Logger logger = Logger.getLogger(ContractChecker.class.getName());

    private final TemplateResolver templateResolver;

    public ContractChecker() {
        this(new SimpleTemplateResolver());
    }

    /// Creates a checker using the given resolver to extract template placeholders.
    ///
    /// @param templateResolver placeholder extractor, not null
    public ContractChecker(TemplateResolver templateResolver) {
        this.templateResolver = templateResolver;
    }

    public List<ContractIssue> check(Node root) {
        return check(root, VisibilityPolicy.FILTERED, Set.of());
    }

    public List<ContractIssue> check(Node root, VisibilityPolicy policy) {
        return check(root, policy, Set.of());
    }

    /// Checks a tree.
    ///
    /// @param root tree to check, not null
    /// @param policy visibility policy the pipeline will run under, not null
    /// @param initialKeys keys the caller guarantees in the initial state, not null
    /// @return findings in pass order, never null
    public List<ContractIssue> check(Node root, VisibilityPolicy policy, Set<String> initialKeys) {
        List<Node> nodes = preorder(root);
        List<ContractIssue> issues = new ArrayList<>();

        // Pass 1
        Map<String, AgentContract> contracts = extractContracts(nodes);

        // Pass 2
        KeyFlowAnalysis keyFlow = new KeyFlowAnalysis(contracts);
        keyFlow.analyze(root, initialKeys);
        issues.addAll(keyFlow.issues());

        issues.addAll(checkTemplateVariables(nodes, contracts, keyFlow));
        issues.addAll(checkChannelDuplication(contracts));
        issues.addAll(checkRouteKeys(nodes, keyFlow));
        issues.addAll(new DataLossAnalysis(contracts).analyze(root));
        issues.addAll(checkVisibility(root, nodes, contracts, policy));

        logger.fine(
                "Contract check of '"
                        + root.name()
                        + "' finished with "
                        + issues.size()
                        + " issue(s)");
        return List.copyOf(issues);
    }

    private Map<String, AgentContract> extractContracts(List<Node> nodes) {
        Map<String, AgentContract> contracts = new LinkedHashMap<>();
        for (Node node : nodes) {
            if (node instanceof AgentNode agent) {
                Set<String> writes = new LinkedHashSet<>();
                if (agent.outputKey() != null) {
                    writes.add(agent.outputKey());
                }
                if (agent.producesSchema() != null) {
                    writes.addAll(agent.producesSchema().fields());
                }
                Set<String> schemaReads =
                        agent.consumesSchema() != null
                                ? new LinkedHashSet<>(agent.consumesSchema().fields())
                                : Set.of();
                contracts.put(
                        agent.name(),
                        new AgentContract(
                                agent.name(),
                                templateResolver.variables(agent.instruction()),
                                schemaReads,
                                writes));
            }
        }
        return contracts;
    }

    private List<ContractIssue> checkTemplateVariables(
            List<Node> nodes, Map<String, AgentContract> contracts, KeyFlowAnalysis keyFlow) {
        List<ContractIssue> issues = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            if (!(node instanceof AgentNode)) {
                continue;
            }
            Set<String> available = keyFlow.availableBefore(i);
            for (TemplateVariable variable : contracts.get(node.name()).templateReads()) {
                if (!variable.optional() && !available.contains(variable.key())) {
                    issues.add(
                            ContractIssue.error(
                                    CheckPass.TEMPLATE_VARS,
                                    node.name(),
                                    "Agent '"
                                            + node.name()
                                            + "' reads {"
                                            + variable.key()
                                            + "} but no upstream step writes '"
                                            + variable.key()
                                            + "'",
                                    "Add outputs(\""
                                            + variable.key()
                                            + "\") to an upstream agent, or mark it optional with {"
                                            + variable.key()
                                            + "?}"));
                }
            }
        }
        return issues;
    }

    private List<ContractIssue> checkChannelDuplication(Map<String, AgentContract> contracts) {
        List<ContractIssue> issues = new ArrayList<>();
        for (AgentContract contract : contracts.values()) {
            for (TemplateVariable variable : contract.templateReads()) {
                if (contract.schemaReads().contains(variable.key())) {
                    issues.add(
                            ContractIssue.warning(
                                    CheckPass.CHANNEL_DUPLICATION,
                                    contract.agent(),
                                    "Key '"
                                            + variable.key()
                                            + "' reaches agent '"
                                            + contract.agent()
                                            + "' through both its instruction and its input schema",
                                    "Remove {" + variable.key() + "} from the instruction"));
                }
            }
        }
        return issues;
    }

    private List<ContractIssue> checkRouteKeys(List<Node> nodes, KeyFlowAnalysis keyFlow) {
        List<ContractIssue> issues = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            Set<String> available = keyFlow.availableBefore(i);
            switch (node.nodeType()) {
                case ROUTE -> {
                    RouteNode route = (RouteNode) node;
                    Set<String> required = new LinkedHashSet<>();
                    if (route.dispatchKey() != null) {
                        required.add(route.dispatchKey());
                    }
                    for (RouteRule rule : route.rules()) {
                        required.addAll(rule.matcher().reads());
                    }
                    requireKeys(issues, node, required, available, "Route '" + node.name() + "' dispatches on");
                }
                case MAP_OVER -> {
                    MapOverNode mapOver = (MapOverNode) node;
                    requireKeys(issues, node, Set.of(mapOver.listKey()), available, "Map-over '" + node.name() + "' iterates");
                }
                case GATE ->
                        requireKeys(issues, node, ((GateNode) node).predicate().reads(), available, "Gate '" + node.name() + "' reads");
                case EXPECT ->
                        requireKeys(issues, node, ((ExpectNode) node).predicate().reads(), available, "Assertion '" + node.name() + "' reads");
                case LOOP -> {
                    LoopNode loop = (LoopNode) node;
                    if (loop.hasUntil()) {
                        requireKeys(
                                issues,
                                node,
                                loop.untilPredicate().reads(),
                                keyFlow.availableAfterBody(i),
                                "Loop '" + node.name() + "' exit condition reads");
                    }
                }
                default -> {
                    // Other nodes have no dispatch data
                }
            }
        }
        return issues;
    }

    private static void requireKeys(
            List<ContractIssue> issues,
            Node node,
            Set<String> required,
            Set<String> available,
            String subject) {
        for (String key : required) {
            if (!available.contains(key)) {
                issues.add(
                        ContractIssue.error(
                                CheckPass.ROUTE_KEYS,
                                node.name(),
                                subject + " '" + key + "', which is not available at this point",
                                "Write '" + key + "' upstream or provide it in the initial state"));
            }
        }
    }

    private List<ContractIssue> checkVisibility(
            Node root,
            List<Node> nodes,
            Map<String, AgentContract> contracts,
            VisibilityPolicy policy) {
        List<ContractIssue> issues = new ArrayList<>();
        Map<String, Visibility> structural =
                VisibilityInference.inferStructural(root, false, VisibilityPolicy.FILTERED);
        for (Node node : nodes) {
            if (!(node instanceof AgentNode agent)) {
                continue;
            }
            boolean writesState = !contracts.get(agent.name()).writes().isEmpty();
            boolean terminal = structural.get(agent.name()) == Visibility.USER;
            if (agent.visibilityOverride() == Visibility.INTERNAL && terminal && !writesState) {
                issues.add(
                        ContractIssue.warning(
                                CheckPass.VISIBILITY,
                                agent.name(),
                                "Agent '"
                                        + agent.name()
                                        + "' is hidden in terminal position and writes no state key; its output is lost",
                                "Add an output key or remove hide()"));
            } else if (policy == VisibilityPolicy.FILTERED
                    && agent.visibilityOverride() == null
                    && !terminal
                    && !writesState) {
                issues.add(
                        ContractIssue.warning(
                                CheckPass.VISIBILITY,
                                agent.name(),
                                "Agent '"
                                        + agent.name()
                                        + "' is internal and writes no state key; later steps only see its output through conversation history",
                                "Add an output key so downstream steps can read it from state"));
            }
        }
        return issues;
    }

    // Positions match the occurrence numbers of KeyFlowAnalysis.
    private static List<Node> preorder(Node root) {
        List<Node> nodes = new ArrayList<>();
        collect(root, nodes);
        return nodes;
    }

    private static void collect(Node node, List<Node> nodes) {
        nodes.add(node);
        node.children().forEach(child -> collect(child, nodes));
    }
}
