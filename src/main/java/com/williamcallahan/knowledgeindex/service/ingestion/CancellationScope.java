package com.williamcallahan.knowledgeindex.service.ingestion;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation token. A child observes its own cancellation and that of every ancestor.
 *
 * <p>Workers derive one child per job from the process-wide root scope, so shutdown cancels every
 * running job while cancelling a single job leaves its siblings alone.</p>
 */
public final class CancellationScope {

    private final CancellationScope parent;
    private final AtomicReference<String> cancellationReason = new AtomicReference<>();

    private CancellationScope(CancellationScope parent) {
        this.parent = parent;
    }

    public static CancellationScope root() {
        return new CancellationScope(null);
    }

    public CancellationScope child() {
        return new CancellationScope(this);
    }

    /**
     * Cancels this scope and its descendants. The first reason recorded wins.
     */
    public void cancel(String reason) {
        cancellationReason.compareAndSet(null, reason == null || reason.isBlank() ? "Cancelled" : reason);
    }

    public boolean isCancelled() {
        return cancellationReason.get() != null || (parent != null && parent.isCancelled());
    }

    /**
     * Returns the reason recorded on this scope or the nearest cancelled ancestor.
     */
    public String reason() {
        String ownReason = cancellationReason.get();
        if (ownReason != null) {
            return ownReason;
        }
        return parent == null ? "" : parent.reason();
    }

    /**
     * @throws IngestionCancelledException when this scope or an ancestor was cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new IngestionCancelledException(reason());
        }
    }
}
