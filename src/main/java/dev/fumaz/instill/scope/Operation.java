package dev.fumaz.instill.scope;

/**
 * A unit of work run inside a dependency scope.
 *
 * @param <R> the result type
 * @param <E> the checked exception the work may throw
 */
@FunctionalInterface
public interface Operation<R, E extends Exception> {

    R run() throws E;

    /**
     * A unit of work without a result.
     *
     * @param <E> the checked exception the work may throw
     */
    @FunctionalInterface
    interface Action<E extends Exception> {

        void run() throws E;

    }

}
