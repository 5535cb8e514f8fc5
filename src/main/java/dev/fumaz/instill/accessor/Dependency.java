package dev.fumaz.instill.accessor;

import dev.fumaz.instill.container.Dependencies;
import dev.fumaz.instill.container.DependencyContainer;
import dev.fumaz.instill.key.DependencyKey;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A {@link Dependency} reads a dependency from the current scope every time it is accessed.
 *
 * <pre>{@code
 * class ReportService {
 *     private final Dependency<Clock> clock = Dependency.of(ClockKey.INSTANCE);
 *
 *     Instant stamp() {
 *         return clock.get().instant();
 *     }
 * }
 * }</pre>
 *
 * @param <V> the type of the dependency value
 */
public final class Dependency<V> implements Supplier<V> {

    private final @NotNull DependencyContainer container;
    private final @NotNull DependencyKey<V> key;

    private Dependency(@NotNull DependencyContainer container, @NotNull DependencyKey<V> key) {
        this.container = Objects.requireNonNull(container, "container");
        this.key = Objects.requireNonNull(key, "key");
    }

    public static <V> @NotNull Dependency<V> of(@NotNull DependencyKey<V> key) {
        return new Dependency<>(Dependencies.container(), key);
    }

    public static <V> @NotNull Dependency<V> of(@NotNull DependencyContainer container, @NotNull DependencyKey<V> key) {
        return new Dependency<>(container, key);
    }

    @Override
    public @NotNull V get() {
        return container.get(key);
    }

    public @NotNull DependencyKey<V> getKey() {
        return key;
    }

    @Override
    public String toString() {
        return "Dependency[" + key.describe() + "]";
    }

}
