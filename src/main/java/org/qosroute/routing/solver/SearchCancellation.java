package org.qosroute.routing.solver;

/**
 * Cooperative cancellation flag polled by solvers once per outer iteration.
 */
public final class SearchCancellation {
    private static final SearchCancellation NEVER = new SearchCancellation();

    private volatile boolean cancelled;

    public static SearchCancellation create() {
        return new SearchCancellation();
    }

    /**
     * Shared token that is never cancelled.
     */
    public static SearchCancellation never() {
        return NEVER;
    }

    public void cancel() {
        if (this == NEVER) {
            throw new UnsupportedOperationException("the shared never-cancelled token cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
