package dev.fumaz.instill.scope;

import dev.fumaz.instill.environment.DefaultValuePolicy;
import dev.fumaz.instill.environment.Environment;
import dev.fumaz.instill.key.DependencyKey;
import dev.fumaz.instill.store.DependencyValues;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ScopeStackTest {

    private static final LabelKey LABEL = new LabelKey();

    private final DependencyValues root = new DependencyValues(DefaultValuePolicy.of(Environment.TEST));
    private final ScopeStack stack = new ScopeStack(root);

    @Test
    void rootIsCurrentOutsideOfScopes() {
        assertSame(root, stack.current());
        assertEquals(0, stack.depth());
    }

    @Test
    void mostRecentPushWins() {
        DependencyValues outer = root.copy();
        DependencyValues inner = root.copy();

        try (ScopeHandle ignored = stack.push(outer)) {
            assertSame(outer, stack.current());

            try (ScopeHandle nested = stack.push(inner)) {
                assertSame(inner, stack.current());
                assertEquals(2, stack.depth());
            }

            assertSame(outer, stack.current(), "closing the inner scope should restore the outer one");
        }

        assertSame(root, stack.current());
        assertEquals(0, stack.depth());
    }

    @Test
    void closingTwiceHasNoEffect() {
        DependencyValues outer = root.copy();

        try (ScopeHandle ignored = stack.push(outer)) {
            ScopeHandle handle = stack.push(root.copy());
            handle.close();
            handle.close();

            assertSame(outer, stack.current(), "a second close should not pop the outer scope");
        }
    }

    @Test
    void closingOutOfOrderFails() {
        ScopeHandle outer = stack.push(root.copy());
        DependencyValues innerValues = root.copy();
        ScopeHandle inner = stack.push(innerValues);

        assertThrows(IllegalStateException.class, outer::close);
        assertSame(innerValues, stack.current(), "the inner scope should still be active");

        inner.close();
        assertSame(root, stack.current());
        assertEquals(0, stack.depth());
    }

    @Test
    void closingOnAnotherThreadFails() throws Exception {
        ScopeHandle handle = stack.push(root.copy());
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Future<?> result = executor.submit(handle::close);
            Exception failure = assertThrows(Exception.class, () -> result.get(5, TimeUnit.SECONDS));

            assertTrue(failure.getCause() instanceof IllegalStateException,
                    "closing from a foreign thread should be rejected");
        } finally {
            handle.close();
            executor.shutdownNow();
        }

        assertSame(root, stack.current());
    }

    @Test
    void scopesAreThreadConfined() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try (ScopeHandle ignored = stack.push(root.copy())) {
            Future<DependencyValues> seen = executor.submit(stack::current);

            assertSame(root, seen.get(5, TimeUnit.SECONDS),
                    "a thread that did not adopt the scope should read the root store");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void snapshotCarriesScopeToWorker() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        DependencyValues scoped = root.copy().set(LABEL, "scoped");

        try {
            DependencySnapshot snapshot;

            try (ScopeHandle ignored = stack.push(scoped)) {
                snapshot = stack.capture();
            }

            assertEquals("scoped", snapshot.values().get(LABEL));
            Callable<String> read = () -> stack.current().resolve(LABEL);

            assertEquals("scoped", executor.submit(snapshot.wrap(read)).get(5, TimeUnit.SECONDS));
            assertSame(root, executor.submit(stack::current).get(5, TimeUnit.SECONDS),
                    "the worker should return to the root store once the wrapped task ends");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void snapshotIgnoresWritesAfterCapture() {
        DependencyValues scoped = root.copy().set(LABEL, "before");
        DependencySnapshot snapshot;

        try (ScopeHandle ignored = stack.push(scoped)) {
            snapshot = stack.capture();
            stack.current().set(LABEL, "after");
        }

        assertEquals("before", snapshot.wrapSupplier(() -> stack.current().resolve(LABEL)).get());
    }

    @Test
    void adoptionsAreIndependentCopies() {
        DependencySnapshot snapshot;

        try (ScopeHandle ignored = stack.push(root.copy().set(LABEL, "parent"))) {
            snapshot = stack.capture();

            snapshot.wrap(() -> {
                stack.current().set(LABEL, "first child");
            }).run();

            assertEquals("parent", stack.current().resolve(LABEL), "a child's write should stay in the child");
        }

        assertEquals("parent", snapshot.wrapSupplier(() -> stack.current().resolve(LABEL)).get(),
                "a sibling should not see another child's write");
        assertEquals("parent", snapshot.values().get(LABEL));
        assertFalse(root.contains(LABEL), "the root store should be untouched");
    }

    @Test
    void wrappedRunnableAndSupplierAdoptSnapshot() {
        DependencySnapshot snapshot = new DependencySnapshot(stack, root.copy().set(LABEL, "scoped"));
        AtomicReference<String> seen = new AtomicReference<>();

        snapshot.wrap(() -> seen.set(stack.current().resolve(LABEL))).run();
        assertEquals("scoped", seen.get());

        assertEquals("scoped", snapshot.wrapSupplier(() -> stack.current().resolve(LABEL)).get());
        assertSame(root, stack.current());
    }

    @Test
    void callRestoresScopeWhenOperationFails() {
        DependencySnapshot snapshot = new DependencySnapshot(stack, root.copy());
        IllegalArgumentException failure = new IllegalArgumentException("boom");

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, () -> snapshot.call(() -> {
            throw failure;
        }));

        assertSame(failure, thrown, "the failure should be rethrown unchanged");
        assertSame(root, stack.current());
    }

    @Test
    void propagatingExecutorCapturesAtSubmission() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        Executor executor = stack.propagating(pool);

        try {
            CompletableFuture<String> inside;

            try (ScopeHandle ignored = stack.push(root.copy().set(LABEL, "scoped"))) {
                inside = CompletableFuture.supplyAsync(() -> stack.current().resolve(LABEL), executor);
            }

            CompletableFuture<DependencyValues> outside = CompletableFuture.supplyAsync(stack::current, executor);

            assertEquals("scoped", inside.get(5, TimeUnit.SECONDS));
            assertSame(root, outside.get(5, TimeUnit.SECONDS), "tasks submitted outside the scope should not see it");
            assertSame(executor, stack.propagating(executor), "an executor should not be wrapped twice");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void scopedFutureContinuationsReadBoundStore() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        CompletableFuture<String> gate = new CompletableFuture<>();

        try {
            CompletableFuture<String> continuation;

            try (ScopeHandle ignored = stack.push(root.copy().set(LABEL, "bound"))) {
                continuation = stack.asyncScope().bind(gate)
                        .thenApply(value -> value + ":" + stack.current().resolve(LABEL))
                        .thenApplyAsync(value -> value + ":" + stack.current().resolve(LABEL), pool);
            }

            DependencyValues foreign = root.copy().set(LABEL, "foreign");
            pool.submit(() -> {
                try (ScopeHandle ignored = stack.push(foreign)) {
                    gate.complete("go");
                }
            }).get(5, TimeUnit.SECONDS);

            assertEquals("go:bound:bound", continuation.get(5, TimeUnit.SECONDS));
            assertSame(root, pool.submit(stack::current).get(5, TimeUnit.SECONDS),
                    "the completing thread should be back in the root store");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void asyncScopeForksOnCopies() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();

        try {
            AsyncScope scope;

            try (ScopeHandle ignored = stack.push(root.copy().set(LABEL, "parent"))) {
                scope = stack.asyncScope();
            }

            String seen = scope.supplyAsync(() -> {
                String inherited = stack.current().resolve(LABEL);
                stack.current().set(LABEL, "child");
                return inherited;
            }, pool).get(5, TimeUnit.SECONDS);

            assertEquals("parent", seen);
            assertEquals("parent", scope.values().get(LABEL), "the fork should not write back into the scope");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void boundStageFailureKeepsOriginalCause() {
        CompletableFuture<String> failing = new CompletableFuture<>();
        IllegalStateException failure = new IllegalStateException("down");
        failing.completeExceptionally(failure);

        CompletableFuture<String> bound = stack.asyncScope().bind(failing);
        ExecutionException thrown = assertThrows(ExecutionException.class, () -> bound.get(5, TimeUnit.SECONDS));

        assertSame(failure, thrown.getCause());
    }

    public static final class LabelKey extends DependencyKey<String> {
        public LabelKey() {
            super(String.class);
        }

        @Override
        public String productionValue() {
            return "root";
        }
    }

}
