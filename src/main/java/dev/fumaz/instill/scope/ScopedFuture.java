package dev.fumaz.instill.scope;

import dev.fumaz.instill.store.DependencyValues;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A {@link CompletableFuture} whose continuations run with one {@link DependencyValues} store current.
 * <p>
 * Every callback registered on this future, and on the futures derived from it, is decorated so that it pushes the
 * bound store on whichever thread ends up running it and pops it once the callback returns. A continuation therefore
 * reads the values of the scope that created the future, even when the stage it waits on is completed from a thread
 * that has a different scope open.
 *
 * @param <T> the result type
 */
public class ScopedFuture<T> extends CompletableFuture<T> {

    private final @NotNull ScopeStack stack;
    private final @NotNull DependencyValues values;

    ScopedFuture(@NotNull ScopeStack stack, @NotNull DependencyValues values) {
        this.stack = Objects.requireNonNull(stack, "stack");
        this.values = Objects.requireNonNull(values, "values");
    }

    public @NotNull DependencyValues values() {
        return values;
    }

    @Override
    public <U> CompletableFuture<U> newIncompleteFuture() {
        return new ScopedFuture<>(stack, values);
    }

    @Override
    public <U> CompletableFuture<U> thenApply(Function<? super T, ? extends U> fn) {
        return super.thenApply(this.<T, U>bindFunction(fn));
    }

    @Override
    public <U> CompletableFuture<U> thenApplyAsync(Function<? super T, ? extends U> fn) {
        return super.thenApplyAsync(this.<T, U>bindFunction(fn));
    }

    @Override
    public <U> CompletableFuture<U> thenApplyAsync(Function<? super T, ? extends U> fn, Executor executor) {
        return super.thenApplyAsync(this.<T, U>bindFunction(fn), executor);
    }

    @Override
    public CompletableFuture<Void> thenAccept(Consumer<? super T> action) {
        return super.thenAccept(this.<T>bindConsumer(action));
    }

    @Override
    public CompletableFuture<Void> thenAcceptAsync(Consumer<? super T> action) {
        return super.thenAcceptAsync(this.<T>bindConsumer(action));
    }

    @Override
    public CompletableFuture<Void> thenAcceptAsync(Consumer<? super T> action, Executor executor) {
        return super.thenAcceptAsync(this.<T>bindConsumer(action), executor);
    }

    @Override
    public CompletableFuture<Void> thenRun(Runnable action) {
        return super.thenRun(bindRunnable(action));
    }

    @Override
    public CompletableFuture<Void> thenRunAsync(Runnable action) {
        return super.thenRunAsync(bindRunnable(action));
    }

    @Override
    public CompletableFuture<Void> thenRunAsync(Runnable action, Executor executor) {
        return super.thenRunAsync(bindRunnable(action), executor);
    }

    @Override
    public <U, V> CompletableFuture<V> thenCombine(CompletionStage<? extends U> other,
                                                   BiFunction<? super T, ? super U, ? extends V> fn) {
        return super.thenCombine(other, this.<T, U, V>bindBiFunction(fn));
    }

    @Override
    public <U, V> CompletableFuture<V> thenCombineAsync(CompletionStage<? extends U> other,
                                                        BiFunction<? super T, ? super U, ? extends V> fn) {
        return super.thenCombineAsync(other, this.<T, U, V>bindBiFunction(fn));
    }

    @Override
    public <U, V> CompletableFuture<V> thenCombineAsync(CompletionStage<? extends U> other,
                                                        BiFunction<? super T, ? super U, ? extends V> fn,
                                                        Executor executor) {
        return super.thenCombineAsync(other, this.<T, U, V>bindBiFunction(fn), executor);
    }

    @Override
    public <U> CompletableFuture<Void> thenAcceptBoth(CompletionStage<? extends U> other,
                                                      BiConsumer<? super T, ? super U> action) {
        return super.thenAcceptBoth(other, this.<T, U>bindBiConsumer(action));
    }

    @Override
    public <U> CompletableFuture<Void> thenAcceptBothAsync(CompletionStage<? extends U> other,
                                                           BiConsumer<? super T, ? super U> action) {
        return super.thenAcceptBothAsync(other, this.<T, U>bindBiConsumer(action));
    }

    @Override
    public <U> CompletableFuture<Void> thenAcceptBothAsync(CompletionStage<? extends U> other,
                                                           BiConsumer<? super T, ? super U> action,
                                                           Executor executor) {
        return super.thenAcceptBothAsync(other, this.<T, U>bindBiConsumer(action), executor);
    }

    @Override
    public CompletableFuture<Void> runAfterBoth(CompletionStage<?> other, Runnable action) {
        return super.runAfterBoth(other, bindRunnable(action));
    }

    @Override
    public CompletableFuture<Void> runAfterBothAsync(CompletionStage<?> other, Runnable action) {
        return super.runAfterBothAsync(other, bindRunnable(action));
    }

    @Override
    public CompletableFuture<Void> runAfterBothAsync(CompletionStage<?> other, Runnable action, Executor executor) {
        return super.runAfterBothAsync(other, bindRunnable(action), executor);
    }

    @Override
    public <U> CompletableFuture<U> applyToEither(CompletionStage<? extends T> other, Function<? super T, U> fn) {
        return super.applyToEither(other, this.<T, U>bindFunction(fn));
    }

    @Override
    public <U> CompletableFuture<U> applyToEitherAsync(CompletionStage<? extends T> other, Function<? super T, U> fn) {
        return super.applyToEitherAsync(other, this.<T, U>bindFunction(fn));
    }

    @Override
    public <U> CompletableFuture<U> applyToEitherAsync(CompletionStage<? extends T> other, Function<? super T, U> fn,
                                                       Executor executor) {
        return super.applyToEitherAsync(other, this.<T, U>bindFunction(fn), executor);
    }

    @Override
    public CompletableFuture<Void> acceptEither(CompletionStage<? extends T> other, Consumer<? super T> action) {
        return super.acceptEither(other, this.<T>bindConsumer(action));
    }

    @Override
    public CompletableFuture<Void> acceptEitherAsync(CompletionStage<? extends T> other, Consumer<? super T> action) {
        return super.acceptEitherAsync(other, this.<T>bindConsumer(action));
    }

    @Override
    public CompletableFuture<Void> acceptEitherAsync(CompletionStage<? extends T> other, Consumer<? super T> action,
                                                     Executor executor) {
        return super.acceptEitherAsync(other, this.<T>bindConsumer(action), executor);
    }

    @Override
    public CompletableFuture<Void> runAfterEither(CompletionStage<?> other, Runnable action) {
        return super.runAfterEither(other, bindRunnable(action));
    }

    @Override
    public CompletableFuture<Void> runAfterEitherAsync(CompletionStage<?> other, Runnable action) {
        return super.runAfterEitherAsync(other, bindRunnable(action));
    }

    @Override
    public CompletableFuture<Void> runAfterEitherAsync(CompletionStage<?> other, Runnable action, Executor executor) {
        return super.runAfterEitherAsync(other, bindRunnable(action), executor);
    }

    @Override
    public <U> CompletableFuture<U> thenCompose(Function<? super T, ? extends CompletionStage<U>> fn) {
        return super.thenCompose(this.<T, CompletionStage<U>>bindFunction(fn));
    }

    @Override
    public <U> CompletableFuture<U> thenComposeAsync(Function<? super T, ? extends CompletionStage<U>> fn) {
        return super.thenComposeAsync(this.<T, CompletionStage<U>>bindFunction(fn));
    }

    @Override
    public <U> CompletableFuture<U> thenComposeAsync(Function<? super T, ? extends CompletionStage<U>> fn,
                                                     Executor executor) {
        return super.thenComposeAsync(this.<T, CompletionStage<U>>bindFunction(fn), executor);
    }

    @Override
    public <U> CompletableFuture<U> handle(BiFunction<? super T, Throwable, ? extends U> fn) {
        return super.handle(this.<T, Throwable, U>bindBiFunction(fn));
    }

    @Override
    public <U> CompletableFuture<U> handleAsync(BiFunction<? super T, Throwable, ? extends U> fn) {
        return super.handleAsync(this.<T, Throwable, U>bindBiFunction(fn));
    }

    @Override
    public <U> CompletableFuture<U> handleAsync(BiFunction<? super T, Throwable, ? extends U> fn, Executor executor) {
        return super.handleAsync(this.<T, Throwable, U>bindBiFunction(fn), executor);
    }

    @Override
    public CompletableFuture<T> whenComplete(BiConsumer<? super T, ? super Throwable> action) {
        return super.whenComplete(this.<T, Throwable>bindBiConsumer(action));
    }

    @Override
    public CompletableFuture<T> whenCompleteAsync(BiConsumer<? super T, ? super Throwable> action) {
        return super.whenCompleteAsync(this.<T, Throwable>bindBiConsumer(action));
    }

    @Override
    public CompletableFuture<T> whenCompleteAsync(BiConsumer<? super T, ? super Throwable> action, Executor executor) {
        return super.whenCompleteAsync(this.<T, Throwable>bindBiConsumer(action), executor);
    }

    @Override
    public CompletableFuture<T> exceptionally(Function<Throwable, ? extends T> fn) {
        return super.exceptionally(this.<Throwable, T>bindFunction(fn));
    }

    @Override
    public CompletableFuture<T> exceptionallyAsync(Function<Throwable, ? extends T> fn) {
        return super.exceptionallyAsync(this.<Throwable, T>bindFunction(fn));
    }

    @Override
    public CompletableFuture<T> exceptionallyAsync(Function<Throwable, ? extends T> fn, Executor executor) {
        return super.exceptionallyAsync(this.<Throwable, T>bindFunction(fn), executor);
    }

    @Override
    public CompletableFuture<T> exceptionallyCompose(Function<Throwable, ? extends CompletionStage<T>> fn) {
        return super.exceptionallyCompose(this.<Throwable, CompletionStage<T>>bindFunction(fn));
    }

    @Override
    public CompletableFuture<T> exceptionallyComposeAsync(Function<Throwable, ? extends CompletionStage<T>> fn) {
        return super.exceptionallyComposeAsync(this.<Throwable, CompletionStage<T>>bindFunction(fn));
    }

    @Override
    public CompletableFuture<T> exceptionallyComposeAsync(Function<Throwable, ? extends CompletionStage<T>> fn,
                                                          Executor executor) {
        return super.exceptionallyComposeAsync(this.<Throwable, CompletionStage<T>>bindFunction(fn), executor);
    }

    @Override
    public String toString() {
        return "ScopedFuture[" + values + "] " + super.toString();
    }

    // Continuations of the same unit of work share its store, forks copy it.
    private <A, B> Function<A, B> bindFunction(Function<? super A, ? extends B> fn) {
        Objects.requireNonNull(fn, "fn");

        return argument -> {
            try (ScopeHandle ignored = stack.push(values)) {
                return fn.apply(argument);
            }
        };
    }

    private <A> Consumer<A> bindConsumer(Consumer<? super A> action) {
        Objects.requireNonNull(action, "action");

        return argument -> {
            try (ScopeHandle ignored = stack.push(values)) {
                action.accept(argument);
            }
        };
    }

    private Runnable bindRunnable(Runnable action) {
        Objects.requireNonNull(action, "action");

        return () -> {
            try (ScopeHandle ignored = stack.push(values)) {
                action.run();
            }
        };
    }

    private <A, B, C> BiFunction<A, B, C> bindBiFunction(BiFunction<? super A, ? super B, ? extends C> fn) {
        Objects.requireNonNull(fn, "fn");

        return (first, second) -> {
            try (ScopeHandle ignored = stack.push(values)) {
                return fn.apply(first, second);
            }
        };
    }

    private <A, B> BiConsumer<A, B> bindBiConsumer(BiConsumer<? super A, ? super B> action) {
        Objects.requireNonNull(action, "action");

        return (first, second) -> {
            try (ScopeHandle ignored = stack.push(values)) {
                action.accept(first, second);
            }
        };
    }

}
