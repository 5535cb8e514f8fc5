package dev.fumaz.instill.scope;

import dev.fumaz.instill.store.DependencyValues;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * Tracks which {@link DependencyValues} are active on each thread.
 * <p>
 * Every thread starts out reading the root store. {@link #push(DependencyValues)} makes another store current until
 * the returned handle is closed, and the most recent push wins. Work handed to other threads only sees a scope when it
 * is wrapped by a {@link DependencySnapshot}, which carries a copy of the store active at the time it was captured, or
 * when it continues a {@link ScopedFuture}.
 */
public final class ScopeStack {

    private static final Logger LOGGER = Logger.getLogger(ScopeStack.class.getName());

    private final @NotNull DependencyValues root;
    private final ThreadLocal<Deque<Frame>> frames = new ThreadLocal<>();

    public ScopeStack(@NotNull DependencyValues root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public @NotNull DependencyValues root() {
        return root;
    }

    public @NotNull DependencyValues current() {
        Deque<Frame> stack = frames.get();

        if (stack == null || stack.isEmpty()) {
            return root;
        }

        return stack.peek().values;
    }

    public int depth() {
        Deque<Frame> stack = frames.get();
        return stack == null ? 0 : stack.size();
    }

    public @NotNull ScopeHandle push(@NotNull DependencyValues values) {
        Objects.requireNonNull(values, "values");
        Deque<Frame> stack = frames.get();

        if (stack == null) {
            stack = new ArrayDeque<>();
            frames.set(stack);
        }

        Frame frame = new Frame(values, stack);
        stack.push(frame);
        LOGGER.finer(() -> "Entered dependency scope at depth " + frame.stack.size() + " on "
                + Thread.currentThread().getName());

        return frame;
    }

    /**
     * Freezes the values active now. Later writes to the current store are not carried by the snapshot.
     */
    public @NotNull DependencySnapshot capture() {
        return new DependencySnapshot(this, current().copy());
    }

    /**
     * Binds asynchronous continuations to the store active now, without copying it.
     */
    public @NotNull AsyncScope asyncScope() {
        return new AsyncScope(this, current());
    }

    /**
     * Returns an executor that runs each task in the scope that was active when the task was submitted.
     */
    public @NotNull Executor propagating(@NotNull Executor executor) {
        if (executor instanceof PropagatingExecutor && ((PropagatingExecutor) executor).belongsTo(this)) {
            return executor;
        }

        return new PropagatingExecutor(this, executor);
    }

    private void release(Frame frame) {
        Deque<Frame> stack = frame.stack;

        if (stack.peek() == frame) {
            stack.pop();
            discardIfEmpty(stack);
            LOGGER.finer(() -> "Left dependency scope, depth now " + stack.size() + " on "
                    + Thread.currentThread().getName());
            return;
        }

        stack.removeFirstOccurrence(frame);
        discardIfEmpty(stack);
        LOGGER.warning(() -> "Dependency scope closed out of order on " + Thread.currentThread().getName());

        throw new IllegalStateException("Dependency scope closed while a nested scope is still active");
    }

    private void discardIfEmpty(Deque<Frame> stack) {
        if (stack.isEmpty() && frames.get() == stack) {
            frames.remove();
        }
    }

    private final class Frame implements ScopeHandle {

        private final DependencyValues values;
        private final Deque<Frame> stack;
        private final Thread owner;
        private boolean closed;

        private Frame(DependencyValues values, Deque<Frame> stack) {
            this.values = values;
            this.stack = stack;
            this.owner = Thread.currentThread();
        }

        @Override
        public void close() {
            if (Thread.currentThread() != owner) {
                throw new IllegalStateException("Dependency scope opened on " + owner.getName()
                        + " cannot be closed on " + Thread.currentThread().getName());
            }

            if (closed) {
                return;
            }

            closed = true;
            release(this);
        }
    }

}
