package dev.fumaz.instill.scope;

/**
 * Represents an active dependency scope that can be closed to restore the scope that was active before it.
 */
public interface ScopeHandle extends AutoCloseable {

    /**
     * Closes the scope.
     * <p>
     * A handle must be closed on the thread that opened it, and handles opened on one thread must be closed in the
     * reverse order they were opened in. Both violations throw {@link IllegalStateException}; a handle closed out of
     * order is still removed, but the scopes opened after it stay active. Closing an already closed handle on its
     * owning thread has no effect.
     *
     * @throws IllegalStateException if called from another thread, or while a scope opened later is still active
     */
    @Override
    void close();

}
