package dev.fumaz.instill.scope;

import dev.fumaz.instill.store.DependencyValues;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * A {@link DependencySnapshot} carries the dependency scope of one thread over to work running on another.
 * <p>
 * The recommended idiom for handing work to a pool looks like this:
 *
 * <pre>{@code
 * DependencySnapshot snapshot = container.capture();
 * pool.submit(snapshot.wrap(() -> {
 *     // reads here see the same values as the submitting thread
 * }));
 * }</pre>
 *
 * A wrapped task makes its own copy of the captured store current only while it runs, so a pooled thread returns to
 * whatever it saw before once the task ends. Values the task sets, and defaults it resolves, stay in that copy: the
 * capturing thread and sibling tasks never see them.
 */
public final class DependencySnapshot {

    private final @NotNull ScopeStack stack;
    private final @NotNull DependencyValues values;

    DependencySnapshot(@NotNull ScopeStack stack, @NotNull DependencyValues values) {
        this.stack = Objects.requireNonNull(stack, "stack");
        this.values = Objects.requireNonNull(values, "values");
    }

    /**
     * @return a copy of the values captured by this snapshot
     */
    public @NotNull DependencyValues values() {
        return values.copy();
    }

    /**
     * Makes a fresh copy of the captured values current on this thread until the handle is closed.
     */
    public @NotNull ScopeHandle adopt() {
        return stack.push(values.copy());
    }

    public <R, E extends Exception> R call(@NotNull Operation<R, E> operation) throws E {
        Objects.requireNonNull(operation, "operation");

        try (ScopeHandle ignored = adopt()) {
            return operation.run();
        }
    }

    public @NotNull Runnable wrap(@NotNull Runnable task) {
        Objects.requireNonNull(task, "task");

        return () -> {
            try (ScopeHandle ignored = adopt()) {
                task.run();
            }
        };
    }

    public <R> @NotNull Callable<R> wrap(@NotNull Callable<R> task) {
        Objects.requireNonNull(task, "task");

        return () -> call(task::call);
    }

    public <R> @NotNull Supplier<R> wrapSupplier(@NotNull Supplier<R> task) {
        Objects.requireNonNull(task, "task");

        return () -> {
            try (ScopeHandle ignored = adopt()) {
                return task.get();
            }
        };
    }

}
