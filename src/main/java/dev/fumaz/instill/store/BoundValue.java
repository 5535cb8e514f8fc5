package dev.fumaz.instill.store;

import dev.fumaz.instill.exception.DependencyTypeException;
import dev.fumaz.instill.key.DependencyKey;
import org.jetbrains.annotations.NotNull;

/**
 * An erased dependency value together with the key it was bound under.
 */
final class BoundValue {

    private final @NotNull Class<?> identity;
    private final @NotNull Class<?> valueType;
    private final @NotNull Object value;

    private BoundValue(@NotNull Class<?> identity, @NotNull Class<?> valueType, @NotNull Object value) {
        this.identity = identity;
        this.valueType = valueType;
        this.value = value;
    }

    static <V> @NotNull BoundValue bind(@NotNull DependencyKey<V> key, @NotNull V value) {
        if (!key.getValueType().isInstance(value)) {
            throw new DependencyTypeException("Cannot bind " + value.getClass().getName() + " to " + key.describe());
        }

        return new BoundValue(key.identity(), key.getValueType(), value);
    }

    <V> @NotNull V unwrap(@NotNull DependencyKey<V> key) {
        if (identity != key.identity() || valueType != key.getValueType()) {
            throw new DependencyTypeException("Value bound under " + identity.getName() + "<"
                    + valueType.getSimpleName() + "> was read through " + key.describe());
        }

        Class<V> expected = key.getValueType();

        if (!expected.isInstance(value)) {
            throw new DependencyTypeException("Value of type " + value.getClass().getName() + " stored under "
                    + key.describe() + " is not a " + expected.getName());
        }

        return expected.cast(value);
    }

}
