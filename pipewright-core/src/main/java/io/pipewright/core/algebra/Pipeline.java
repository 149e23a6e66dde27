package io.pipewright.core.algebra;

import io.pipewright.core.ir.Node;
import java.util.Objects;

/// Flow wrapping an already-built IR tree. Every algebra operator returns one.
///
/// @param root the IR tree, not null
public record Pipeline(Node root) implements Flow {

    public Pipeline {
        Objects.requireNonNull(root, "root must not be null");
    }

    public static Pipeline of(Node root) {
        return new Pipeline(root);
    }

    @Override
    public Node toIr() {
        return root;
    }
}
