package io.pipewright.core.backend;

import java.util.concurrent.atomic.AtomicBoolean;

/// Cooperative cancellation flag shared down a branch of execution.
///
/// A child token reports cancelled when it or any ancestor was cancelled.
final class CancellationToken {

    private final CancellationToken parent;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    CancellationToken() {
        this(null);
    }

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    CancellationToken child() {
        return new CancellationToken(this);
    }

    void cancel() {
        cancelled.set(true);
    }

    boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }
}
