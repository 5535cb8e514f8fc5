package dev.fumaz.instill.store;

import dev.fumaz.instill.environment.DefaultValuePolicy;
import dev.fumaz.instill.key.DependencyKey;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link DependencyValues} holds the dependency values bound in one scope.
 * <p>
 * A key that has never been bound resolves to the default its {@link DefaultValuePolicy} selects, and that default
 * is cached so later reads in the same store observe the same value. Nested scopes work on a {@link #copy()}, never
 * on the parent's store. All operations are safe to call from several threads.
 */
public final class DependencyValues {

    private final @NotNull DefaultValuePolicy policy;
    private final @NotNull Map<Class<?>, BoundValue> values;
    private final Object lock = new Object();

    public DependencyValues(@NotNull DefaultValuePolicy policy) {
        this(policy, new HashMap<>());
    }

    private DependencyValues(@NotNull DefaultValuePolicy policy, @NotNull Map<Class<?>, BoundValue> values) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.values = values;
    }

    /**
     * Returns the value bound for {@code key} without computing a default.
     *
     * @return the bound value, or {@code null} if the key has not been bound or resolved in this store
     */
    public <V> @Nullable V get(@NotNull DependencyKey<V> key) {
        Objects.requireNonNull(key, "key");

        synchronized (lock) {
            BoundValue bound = values.get(key.identity());
            return bound == null ? null : bound.unwrap(key);
        }
    }

    /**
     * Returns the value bound for {@code key}, binding the environment default first if there is none.
     * <p>
     * The default is computed without holding the store lock, so it may read other keys of this store from any
     * thread. When two readers race, the value bound first is kept and returned to both.
     */
    public <V> @NotNull V resolve(@NotNull DependencyKey<V> key) {
        Objects.requireNonNull(key, "key");

        synchronized (lock) {
            BoundValue bound = values.get(key.identity());

            if (bound != null) {
                return bound.unwrap(key);
            }
        }

        BoundValue computed = BoundValue.bind(key, policy.defaultFor(key));

        synchronized (lock) {
            BoundValue existing = values.putIfAbsent(key.identity(), computed);
            return (existing == null ? computed : existing).unwrap(key);
        }
    }

    public <V> @NotNull DependencyValues set(@NotNull DependencyKey<V> key, @NotNull V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        BoundValue bound = BoundValue.bind(key, value);

        synchronized (lock) {
            values.put(key.identity(), bound);
        }

        return this;
    }

    public boolean contains(@NotNull DependencyKey<?> key) {
        Objects.requireNonNull(key, "key");

        synchronized (lock) {
            return values.containsKey(key.identity());
        }
    }

    public int size() {
        synchronized (lock) {
            return values.size();
        }
    }

    /**
     * Creates an independent store holding the same values; later changes to either store are not shared.
     */
    public @NotNull DependencyValues copy() {
        synchronized (lock) {
            return new DependencyValues(policy, new HashMap<>(values));
        }
    }

    public @NotNull DefaultValuePolicy getPolicy() {
        return policy;
    }

    @Override
    public String toString() {
        return "DependencyValues[" + size() + " bound]";
    }

}
