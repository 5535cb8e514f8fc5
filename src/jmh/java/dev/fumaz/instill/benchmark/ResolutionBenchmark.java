package dev.fumaz.instill.benchmark;

import dev.fumaz.instill.container.DependencyContainer;
import dev.fumaz.instill.environment.Environment;
import dev.fumaz.instill.environment.EnvironmentProbe;
import dev.fumaz.instill.key.DependencyKey;
import dev.fumaz.instill.scope.ScopeHandle;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ResolutionBenchmark {

    private static final GreetingKey GREETING = new GreetingKey();
    private static final CounterKey COUNTER = new CounterKey();

    @State(Scope.Benchmark)
    public static class ContainerState {

        DependencyContainer container;

        @Setup(Level.Trial)
        public void setUp() {
            container = DependencyContainer.create(EnvironmentProbe.fixed(Environment.PRODUCTION));
            container.get(GREETING);
        }
    }

    @Benchmark
    public Object resolveCachedRoot(ContainerState state) {
        return state.container.get(GREETING);
    }

    @Benchmark
    public Object resolveInsideScope(ContainerState state) {
        return state.container.withDependencies(values -> values.set(COUNTER, 42),
                () -> state.container.get(COUNTER));
    }

    @Benchmark
    public void openAndCloseNestedScopes(ContainerState state, Blackhole blackhole) {
        try (ScopeHandle outer = state.container.open(values -> values.set(GREETING, "outer"))) {
            try (ScopeHandle inner = state.container.open(values -> values.set(GREETING, "inner"))) {
                blackhole.consume(state.container.get(GREETING));
            }

            blackhole.consume(state.container.get(GREETING));
        }
    }

    @Benchmark
    public Object copyPopulatedStore(ContainerState state) {
        return state.container.current().copy();
    }

    public static final class GreetingKey extends DependencyKey<String> {
        public GreetingKey() {
            super(String.class);
        }

        @Override
        public String productionValue() {
            return "hello";
        }
    }

    public static final class CounterKey extends DependencyKey<Integer> {
        public CounterKey() {
            super(Integer.class);
        }

        @Override
        public Integer productionValue() {
            return 0;
        }
    }

}
