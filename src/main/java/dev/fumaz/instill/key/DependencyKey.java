package dev.fumaz.instill.key;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A {@link DependencyKey} identifies a dependency and supplies its default values.
 * <p>
 * The identity of a key is its concrete class, so every dependency is defined by its own subclass:
 *
 * <pre>{@code
 * public final class ClockKey extends DependencyKey<Clock> {
 *     public static final ClockKey INSTANCE = new ClockKey();
 *
 *     private ClockKey() {
 *         super(Clock.class);
 *     }
 *
 *     public Clock productionValue() {
 *         return Clock.systemUTC();
 *     }
 *
 *     public Clock testValue() {
 *         return Clock.fixed(Instant.EPOCH, ZoneOffset.UTC);
 *     }
 * }
 * }</pre>
 * <p>
 * Anonymous subclasses held in a constant work the same way, each anonymous class being a distinct key.
 * Values must be safe to share between threads.
 *
 * @param <V> the type of the dependency value
 */
public abstract class DependencyKey<V> {

    private final @NotNull Class<V> valueType;

    protected DependencyKey(@NotNull Class<V> valueType) {
        this.valueType = Objects.requireNonNull(valueType, "valueType");
    }

    /**
     * @return the value used in production, and by default in every other environment
     */
    public abstract V productionValue();

    /**
     * @return the value used under an automated test harness
     */
    public V testValue() {
        return productionValue();
    }

    /**
     * @return the value used in an interactive preview environment
     */
    public V previewValue() {
        return productionValue();
    }

    public final @NotNull Class<V> getValueType() {
        return valueType;
    }

    public final @NotNull Class<?> identity() {
        return getClass();
    }

    public @NotNull String describe() {
        Class<?> identity = identity();
        String name = identity.isAnonymousClass() ? identity.getName() : identity.getSimpleName();

        return name + "<" + valueType.getSimpleName() + ">";
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof DependencyKey)) {
            return false;
        }

        return identity() == ((DependencyKey<?>) o).identity();
    }

    @Override
    public final int hashCode() {
        return identity().hashCode();
    }

    @Override
    public String toString() {
        return describe();
    }

}
