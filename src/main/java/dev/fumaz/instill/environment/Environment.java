package dev.fumaz.instill.environment;

import dev.fumaz.instill.exception.ConfigurationException;
import dev.fumaz.instill.key.DependencyKey;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Objects;

/**
 * The execution environment a default value is chosen for.
 */
public enum Environment {

    PRODUCTION {
        @Override
        public <V> V select(@NotNull DependencyKey<V> key) {
            return key.productionValue();
        }
    },
    TEST {
        @Override
        public <V> V select(@NotNull DependencyKey<V> key) {
            return key.testValue();
        }
    },
    PREVIEW {
        @Override
        public <V> V select(@NotNull DependencyKey<V> key) {
            return key.previewValue();
        }
    };

    /**
     * Picks the default value {@code key} declares for this environment.
     */
    public abstract <V> V select(@NotNull DependencyKey<V> key);

    public static @NotNull Environment parse(@NotNull String value) {
        Objects.requireNonNull(value, "value");

        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "production":
            case "prod":
                return PRODUCTION;
            case "test":
                return TEST;
            case "preview":
                return PREVIEW;
            default:
                throw new ConfigurationException("Unknown environment '" + value
                        + "', expected one of production, test or preview");
        }
    }

}
