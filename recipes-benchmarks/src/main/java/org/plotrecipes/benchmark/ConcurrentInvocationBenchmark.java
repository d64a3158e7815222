package org.plotrecipes.benchmark;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.plotrecipes.RecipeEngine;
import org.plotrecipes.benchmark.domain.PriceSeries;
import org.plotrecipes.runtime.AttributeMap;
import org.plotrecipes.runtime.RecipeData;
import org.openjdk.jmh.annotations.*;

/**
 * Four threads applying the same registered recipes through one shared engine. Checks that compiled recipes and
 * the registry hold up under concurrent calls and gives a contention baseline.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = "-Dplotrecipes.debug=false")
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(4)
public class ConcurrentInvocationBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        RecipeEngine engine;

        @Setup(Level.Trial)
        public void init() {
            engine = PriceRecipes.engine();
            engine.define(PriceRecipes.candles());
        }
    }

    @State(Scope.Thread)
    public static class ThreadState {

        PriceSeries series;

        @Setup(Level.Trial)
        public void init() {
            series = PriceRecipes.randomSeries(100);
        }
    }

    @Benchmark
    public List<RecipeData> concurrentApply(SharedState shared, ThreadState local) {
        return shared.engine.apply(new AttributeMap(), local.series);
    }
}
