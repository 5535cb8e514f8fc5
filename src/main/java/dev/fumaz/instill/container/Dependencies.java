package dev.fumaz.instill.container;

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
 * Public facade over the process-wide {@link DependencyContainer}, classified by the system environment probe.
 */
public final class Dependencies {

    private Dependencies() {
    }

    private static final class Holder {
        private static final DependencyContainer CONTAINER = DependencyContainer.create();
    }

    public static @NotNull DependencyContainer container() {
        return Holder.CONTAINER;
    }

    public static <V> @NotNull V get(@NotNull DependencyKey<V> key) {
        return container().get(key);
    }

    public static @NotNull DependencyValues current() {
        return container().current();
    }

    public static @NotNull ScopeHandle open(@NotNull Consumer<? super DependencyValues> mutator) {
        return container().open(mutator);
    }

    public static <R, E extends Exception> R withDependencies(@NotNull Consumer<? super DependencyValues> mutator,
                                                              @NotNull Operation<R, E> operation) throws E {
        return container().withDependencies(mutator, operation);
    }

    public static <E extends Exception> void runWithDependencies(@NotNull Consumer<? super DependencyValues> mutator,
                                                                 @NotNull Operation.Action<E> action) throws E {
        container().runWithDependencies(mutator, action);
    }

    public static <R> @NotNull CompletableFuture<R> withDependenciesAsync(@NotNull Consumer<? super DependencyValues> mutator,
                                                                          @NotNull Function<? super AsyncScope, ? extends CompletionStage<R>> operation) {
        return container().withDependenciesAsync(mutator, operation);
    }

    public static @NotNull DependencySnapshot capture() {
        return container().capture();
    }

    public static @NotNull Executor propagating(@NotNull Executor executor) {
        return container().propagating(executor);
    }

    public static <R> @NotNull CompletableFuture<R> supplyAsync(@NotNull Supplier<R> task, @NotNull Executor executor) {
        return container().supplyAsync(task, executor);
    }

}
