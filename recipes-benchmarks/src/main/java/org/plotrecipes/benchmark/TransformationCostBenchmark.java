package org.plotrecipes.benchmark;

import java.util.concurrent.TimeUnit;

import org.plotrecipes.ast.Node;
import org.plotrecipes.benchmark.domain.PriceSeries;
import org.plotrecipes.compiler.CompiledRecipe;
import org.plotrecipes.compiler.RecipeCompiler;
import org.plotrecipes.compiler.TypeResolver;
import org.plotrecipes.printer.RecipeSourceRenderer;
import org.plotrecipes.runtime.Backends;
import org.plotrecipes.transformer.GeneratedRecipe;
import org.plotrecipes.transformer.RecipeTransformer;
import org.openjdk.jmh.annotations.*;

/**
 * Measures what defining a recipe costs: the tree rewrite alone, rewrite plus compilation, and rendering the
 * generated function as Java source.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = "-Dplotrecipes.debug=false")
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class TransformationCostBenchmark {

    @State(Scope.Thread)
    public static class DefinitionState {

        final RecipeTransformer transformer = new RecipeTransformer();
        final RecipeSourceRenderer renderer = new RecipeSourceRenderer();
        RecipeCompiler compiler;
        Node simple;
        Node candles;
        GeneratedRecipe generatedCandles;

        @Setup(Level.Trial)
        public void init() {
            compiler = new RecipeCompiler(PriceRecipes.functions(),
                                          new TypeResolver().register(PriceSeries.class),
                                          Backends.supportingAll());
            simple = PriceRecipes.simple();
            candles = PriceRecipes.candles();
            generatedCandles = transformer.transform(candles);
        }
    }

    @Benchmark
    public GeneratedRecipe transformSimple(DefinitionState state) {
        return state.transformer.transform(state.simple);
    }

    @Benchmark
    public GeneratedRecipe transformCandles(DefinitionState state) {
        return state.transformer.transform(state.candles);
    }

    @Benchmark
    public CompiledRecipe transformAndCompileCandles(DefinitionState state) {
        return state.compiler.compile(state.transformer.transform(state.candles));
    }

    @Benchmark
    public String renderCandles(DefinitionState state) {
        return state.renderer.render(state.generatedCandles);
    }
}
