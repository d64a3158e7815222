package org.plotrecipes.benchmark;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.plotrecipes.RecipeEngine;
import org.plotrecipes.benchmark.domain.PriceSeries;
import org.plotrecipes.compiler.CompiledRecipe;
import org.plotrecipes.runtime.AttributeMap;
import org.plotrecipes.runtime.RecipeData;
import org.plotrecipes.runtime.Symbol;
import org.openjdk.jmh.annotations.*;

/**
 * Measures invocation of already defined recipes. Each call gets a fresh attribute map, as a plot call would.
 * Registry dispatch is measured separately from calling the compiled recipe directly.
 */
@BenchmarkMode({Mode.AverageTime, Mode.Throughput})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = "-Dplotrecipes.debug=false")
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 5, time = 2)
public class WarmInvocationBenchmark {

    @State(Scope.Thread)
    public static class SimpleState {

        CompiledRecipe recipe;
        PriceSeries series;

        @Setup(Level.Trial)
        public void define() {
            recipe = PriceRecipes.engine().define(PriceRecipes.simple());
        }

        @Setup(Level.Iteration)
        public void mutateSeries() {
            series = PriceRecipes.randomSeries(250);
        }
    }

    @State(Scope.Thread)
    public static class CandlesState {

        RecipeEngine engine;
        PriceSeries series;

        @Setup(Level.Trial)
        public void define() {
            engine = PriceRecipes.engine();
            engine.define(PriceRecipes.candles());
        }

        @Setup(Level.Iteration)
        public void mutateSeries() {
            series = PriceRecipes.randomSeries(250);
        }
    }

    @Benchmark
    public List<RecipeData> applySimpleDirect(SimpleState state) {
        return state.recipe.apply(new AttributeMap(), state.series);
    }

    @Benchmark
    public List<RecipeData> applyCandlesDispatched(CandlesState state) {
        return state.engine.apply(new AttributeMap(), state.series);
    }

    @Benchmark
    public List<RecipeData> applyCandlesWithUserAttributes(CandlesState state) {
        AttributeMap attributes = new AttributeMap()
                .with("linecolor", Symbol.of("red"))
                .with("shape", Symbol.of("circle"));
        return state.engine.apply(attributes, state.series);
    }
}
