package dev.fumaz.instill.environment;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An {@link EnvironmentProbe} classifies the process as production, test or preview.
 */
@FunctionalInterface
public interface EnvironmentProbe {

    static @NotNull EnvironmentProbe fixed(@NotNull Environment environment) {
        Objects.requireNonNull(environment, "environment");

        return () -> environment;
    }

    static @NotNull EnvironmentProbe system() {
        return SystemEnvironmentProbe.shared();
    }

    @NotNull Environment classify();

}
