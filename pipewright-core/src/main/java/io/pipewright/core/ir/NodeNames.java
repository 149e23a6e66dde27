package io.pipewright.core.ir;

import io.pipewright.core.exception.DuplicateNodeNameException;
import io.pipewright.core.exception.InvalidPipelineException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/// Name validation shared by node constructors.
public final class NodeNames {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private NodeNames() {}

    /// Checks that a name is a valid identifier.
    ///
    /// @param name candidate name, may be null
    /// @param what label used in the error message, not null
    /// @return the name, for chaining in compact constructors
    /// @throws InvalidPipelineException if the name is null or not an identifier
    public static String requireIdentifier(String name, String what) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new InvalidPipelineException(
                    what + " must be a valid identifier ([A-Za-z_][A-Za-z0-9_]*), got: " + name);
        }
        return name;
    }

    /// Checks that no agent name occurs twice across the given sub-trees, and that no agent
    /// shares its name with a transform, tap, expect, gate or route.
    ///
    /// The same agent node instance reached twice is still a collision: the checker and
    /// the visibility map key agents by name. Non-agent steps may repeat a name among
    /// themselves.
    ///
    /// @param roots sub-trees being combined, not null
    /// @throws DuplicateNodeNameException on the first clashing agent name
    public static void requireUniqueAgentNames(List<Node> roots) {
        Set<String> agents = new HashSet<>();
        Set<String> steps = new HashSet<>();
        Deque<Node> pending = new ArrayDeque<>(roots);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (node instanceof AgentNode agent) {
                if (!agents.add(agent.name()) || steps.contains(agent.name())) {
                    throw new DuplicateNodeNameException(agent.name());
                }
            } else if (!node.nodeType().isComposite()) {
                if (agents.contains(node.name())) {
                    throw new DuplicateNodeNameException(node.name());
                }
                steps.add(node.name());
            }
            node.children().forEach(pending::push);
        }
    }

    /// Checks that a composite node has at least one child.
    ///
    /// @param children the child list, may be null
    /// @param what label used in the error message, not null
    /// @return an immutable copy of the children
    /// @throws InvalidPipelineException if the list is null or empty
    static List<Node> requireChildren(List<Node> children, String what) {
        if (children == null || children.isEmpty()) {
            throw new InvalidPipelineException(what + " must have at least one child");
        }
        List<Node> copy = List.copyOf(children);
        requireUniqueAgentNames(copy);
        return copy;
    }
}
