package dev.fumaz.instill.container;

import dev.fumaz.instill.environment.DefaultValuePolicy;
import dev.fumaz.instill.environment.Environment;
import dev.fumaz.instill.environment.EnvironmentProbe;
import dev.fumaz.instill.key.DependencyKey;
import dev.fumaz.instill.scope.AsyncScope;
import dev.fumaz.instill.scope.DependencySnapshot;
import dev.fumaz.instill.scope.ScopeHandle;
import dev.fumaz.instill.scope.ScopeStack;
import dev.fumaz.instill.store.DependencyValues;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Logger;

public class InstillContainer implements DependencyContainer {

    private static final Logger LOGGER = Logger.getLogger(InstillContainer.class.getName());

    private final @NotNull DefaultValuePolicy policy;
    private final @NotNull ScopeStack scopes;

    public InstillContainer(@NotNull EnvironmentProbe probe) {
        this.policy = new DefaultValuePolicy(probe);
        this.scopes = new ScopeStack(new DependencyValues(policy));

        LOGGER.fine(() -> "Created dependency container with probe " + probe.getClass().getName());
    }

    @Override
    public <V> @NotNull V get(@NotNull DependencyKey<V> key) {
        return current().resolve(key);
    }

    @Override
    public @NotNull DependencyValues current() {
        return scopes.current();
    }

    @Override
    public @NotNull Environment environment() {
        return policy.environment();
    }

    @Override
    public @NotNull ScopeHandle open(@NotNull Consumer<? super DependencyValues> mutator) {
        Objects.requireNonNull(mutator, "mutator");

        DependencyValues values = current().copy();
        mutator.accept(values);

        return scopes.push(values);
    }

    @Override
    public <R> @NotNull CompletableFuture<R> withDependenciesAsync(@NotNull Consumer<? super DependencyValues> mutator,
                                                                   @NotNull Function<? super AsyncScope, ? extends CompletionStage<R>> operation) {
        Objects.requireNonNull(operation, "operation");

        AsyncScope caller = scopes.asyncScope();
        CompletionStage<R> stage;

        try (ScopeHandle ignored = open(mutator)) {
            stage = operation.apply(scopes.asyncScope());
        }

        if (stage == null) {
            throw new IllegalStateException("Asynchronous operation returned no completion stage");
        }

        return caller.bind(stage);
    }

    @Override
    public @NotNull DependencySnapshot capture() {
        return scopes.capture();
    }

    @Override
    public @NotNull Executor propagating(@NotNull Executor executor) {
        return scopes.propagating(executor);
    }

    public @NotNull DependencyValues root() {
        return scopes.root();
    }

    public int depth() {
        return scopes.depth();
    }

}
