package dev.fumaz.instill.environment;

import dev.fumaz.instill.key.DependencyKey;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A {@link DefaultValuePolicy} supplies the value a store is seeded with the first time a key is read.
 */
public final class DefaultValuePolicy {

    private final @NotNull EnvironmentProbe probe;

    public DefaultValuePolicy(@NotNull EnvironmentProbe probe) {
        this.probe = Objects.requireNonNull(probe, "probe");
    }

    public static @NotNull DefaultValuePolicy of(@NotNull Environment environment) {
        return new DefaultValuePolicy(EnvironmentProbe.fixed(environment));
    }

    public @NotNull Environment environment() {
        return Objects.requireNonNull(probe.classify(), "probe returned no environment");
    }

    public <V> @NotNull V defaultFor(@NotNull DependencyKey<V> key) {
        return select(key, environment());
    }

    public static <V> @NotNull V select(@NotNull DependencyKey<V> key, @NotNull Environment environment) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(environment, "environment");

        V value = environment.select(key);

        if (value == null) {
            throw new IllegalStateException("Dependency key " + key.describe() + " produced null for " + environment);
        }

        return value;
    }

}
