package dev.fumaz.instill.scope;

import dev.fumaz.instill.store.DependencyValues;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * The dependency scope of one asynchronous unit of work.
 * <p>
 * Stages are bound to the scope through {@link #bind(CompletionStage)}. Their continuations then read the scope's
 * values wherever they run, for as long as they run, even after the thread that started the work has left the scope:
 *
 * <pre>{@code
 * container.withDependenciesAsync(values -> values.set(REGION, "eu-west"),
 *         scope -> scope.bind(client.fetch()).thenApply(response -> render(response, container.get(REGION))));
 * }</pre>
 */
public final class AsyncScope {

    private final @NotNull ScopeStack stack;
    private final @NotNull DependencyValues values;

    AsyncScope(@NotNull ScopeStack stack, @NotNull DependencyValues values) {
        this.stack = Objects.requireNonNull(stack, "stack");
        this.values = Objects.requireNonNull(values, "values");
    }

    public @NotNull DependencyValues values() {
        return values;
    }

    /**
     * @return an incomplete future whose continuations run in this scope
     */
    public <T> @NotNull ScopedFuture<T> newFuture() {
        return new ScopedFuture<>(stack, values);
    }

    /**
     * Returns a future that completes like {@code stage} and runs its continuations in this scope. A failure of
     * {@code stage} is passed on with its original cause.
     */
    public <T> @NotNull ScopedFuture<T> bind(@NotNull CompletionStage<T> stage) {
        Objects.requireNonNull(stage, "stage");

        ScopedFuture<T> future = newFuture();
        stage.whenComplete((result, failure) -> {
            if (failure == null) {
                future.complete(result);
            } else {
                future.completeExceptionally(unwrap(failure));
            }
        });

        return future;
    }

    /**
     * Forks {@code task} onto {@code executor}. The task runs on its own copy of this scope's values, and
     * continuations of the returned future run in this scope.
     */
    public <T> @NotNull ScopedFuture<T> supplyAsync(@NotNull Supplier<T> task, @NotNull Executor executor) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(executor, "executor");

        DependencySnapshot snapshot = new DependencySnapshot(stack, values.copy());
        return bind(CompletableFuture.supplyAsync(snapshot.wrapSupplier(task), executor));
    }

    static @NotNull Throwable unwrap(@NotNull Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }

        return failure;
    }

    @Override
    public String toString() {
        return "AsyncScope[" + values + "]";
    }

}
