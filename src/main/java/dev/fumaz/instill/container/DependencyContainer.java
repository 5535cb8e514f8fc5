package dev.fumaz.instill.container;

import dev.fumaz.instill.environment.Environment;
import dev.fumaz.instill.environment.EnvironmentProbe;
import dev.fumaz.instill.key.DependencyKey;
import dev.fumaz.instill.scope.AsyncScope;
import dev.fumaz.instill.scope.DependencySnapshot;
import dev.fumaz.instill.scope.Operation;
import dev.fumaz.instill.scope.ScopeHandle;
import dev.fumaz.instill.store.DependencyValues;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A {@link DependencyContainer} resolves dependency values and lets callers override them for a unit of work.
 * <p>
 * Overrides are dynamically scoped: everything the unit of work calls sees them, code running before or after it does
 * not, and neither does code on other threads unless the work is handed over through {@link #capture()} or
 * {@link #propagating(Executor)}.
 */
public interface DependencyContainer {

    static @NotNull DependencyContainer create() {
        return create(EnvironmentProbe.system());
    }

    static @NotNull DependencyContainer create(@NotNull EnvironmentProbe probe) {
        return new InstillContainer(probe);
    }

    /**
     * Reads the value of {@code key} in the current scope, computing and caching its default if it is unbound.
     */
    <V> @NotNull V get(@NotNull DependencyKey<V> key);

    /**
     * @return the store active on the calling thread, or the root store outside of any scope
     */
    @NotNull DependencyValues current();

    @NotNull Environment environment();

    /**
     * Opens a scope on the calling thread whose values are a copy of the current ones, edited by {@code mutator}.
     * The previous scope is restored when the handle is closed.
     */
    @NotNull ScopeHandle open(@NotNull Consumer<? super DependencyValues> mutator);

    /**
     * Runs {@code operation} with the current values edited by {@code mutator}, then restores the previous scope.
     * Failures from the operation are rethrown unchanged once the scope has been restored.
     */
    default <R, E extends Exception> R withDependencies(@NotNull Consumer<? super DependencyValues> mutator,
                                                        @NotNull Operation<R, E> operation) throws E {
        try (ScopeHandle ignored = open(mutator)) {
            return operation.run();
        }
    }

    default <E extends Exception> void runWithDependencies(@NotNull Consumer<? super DependencyValues> mutator,
                                                           @NotNull Operation.Action<E> action) throws E {
        try (ScopeHandle ignored = open(mutator)) {
            action.run();
        }
    }

    /**
     * Starts asynchronous work with the current values edited by {@code mutator}.
     * <p>
     * {@code operation} runs on the calling thread with the new scope open and receives it as an {@link AsyncScope}.
     * The calling thread leaves the scope as soon as the operation returns its stage. Continuations of stages bound
     * through {@link AsyncScope#bind(CompletionStage)} and tasks forked through
     * {@link AsyncScope#supplyAsync(Supplier, Executor)} keep the overridden values wherever they run, regardless of
     * what scope the completing thread has open. Continuations registered on the returned future run in the caller's
     * scope. A synchronous failure of the operation is rethrown unchanged once the scope has been restored; a failed
     * stage completes the returned future with the original cause.
     */
    <R> @NotNull CompletableFuture<R> withDependenciesAsync(@NotNull Consumer<? super DependencyValues> mutator,
                                                            @NotNull Function<? super AsyncScope, ? extends CompletionStage<R>> operation);

    @NotNull DependencySnapshot capture();

    @NotNull Executor propagating(@NotNull Executor executor);

    default <R> @NotNull CompletableFuture<R> supplyAsync(@NotNull Supplier<R> task, @NotNull Executor executor) {
        return CompletableFuture.supplyAsync(capture().wrapSupplier(task), executor);
    }

}
