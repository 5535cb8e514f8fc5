package dev.fumaz.instill.scope;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Executor decorator that runs each task in the dependency scope active when it was submitted.
 */
final class PropagatingExecutor implements Executor {

    private final ScopeStack stack;
    private final Executor delegate;

    PropagatingExecutor(@NotNull ScopeStack stack, @NotNull Executor delegate) {
        this.stack = Objects.requireNonNull(stack, "stack");
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void execute(@NotNull Runnable command) {
        delegate.execute(stack.capture().wrap(command));
    }

    boolean belongsTo(ScopeStack other) {
        return stack == other;
    }

    @Override
    public String toString() {
        return "PropagatingExecutor[" + delegate + "]";
    }

}
