package org.plotrecipes.benchmark;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

import org.plotrecipes.RecipeEngine;
import org.plotrecipes.ast.Node;
import org.plotrecipes.benchmark.domain.PriceSeries;
import org.plotrecipes.compiler.TypeResolver;
import org.plotrecipes.runtime.Backends;
import org.plotrecipes.runtime.FunctionTable;

import static org.plotrecipes.ast.Nodes.attr;
import static org.plotrecipes.ast.Nodes.block;
import static org.plotrecipes.ast.Nodes.call;
import static org.plotrecipes.ast.Nodes.flagged;
import static org.plotrecipes.ast.Nodes.force;
import static org.plotrecipes.ast.Nodes.function;
import static org.plotrecipes.ast.Nodes.ifThen;
import static org.plotrecipes.ast.Nodes.kw;
import static org.plotrecipes.ast.Nodes.literal;
import static org.plotrecipes.ast.Nodes.parameters;
import static org.plotrecipes.ast.Nodes.quote;
import static org.plotrecipes.ast.Nodes.series;
import static org.plotrecipes.ast.Nodes.signature;
import static org.plotrecipes.ast.Nodes.sym;
import static org.plotrecipes.ast.Nodes.typed;

/**
 * Recipe definitions and fixtures shared by the benchmarks.
 */
final class PriceRecipes {

    private PriceRecipes() {
    }

    /**
     * Single attribute and a single main series.
     */
    static Node simple() {
        return function(signature("closes", typed("s", "PriceSeries")),
                        block(attr("linecolor", quote("black")),
                              call("closes", sym("s"))));
    }

    /**
     * Keywords, flags and a volume series forked off the price series.
     */
    static Node candles() {
        return function(signature("candles",
                                  parameters(kw("shape", quote("auto")), kw("width", literal(1))),
                                  typed("s", "PriceSeries")),
                        block(attr("linecolor", quote("black")),
                              flagged(attr("markersize", literal(3)), "quiet"),
                              force("label", call("ticker", sym("s"))),
                              ifThen(call("adjusted", sym("s")), block(attr("linestyle", quote("dash")))),
                              series(force("seriestype", quote("bar")),
                                     force("fillcolor", quote("grey")),
                                     call("volumes", sym("s"))),
                              call("closes", sym("s"))));
    }

    static FunctionTable functions() {
        return FunctionTable.withBuiltins()
                .register("closes", 1, args -> ((PriceSeries) args[0]).getCloses())
                .register("volumes", 1, args -> ((PriceSeries) args[0]).getVolumes())
                .register("ticker", 1, args -> ((PriceSeries) args[0]).getTicker())
                .register("adjusted", 1, args -> ((PriceSeries) args[0]).isAdjusted());
    }

    static RecipeEngine engine() {
        return RecipeEngine.builder()
                .backend(Backends.supporting("lines", "linecolor", "label", "linestyle", "seriestype", "fillcolor", "shape"))
                .functions(functions())
                .typeResolver(new TypeResolver().register(PriceSeries.class))
                .build();
    }

    static PriceSeries randomSeries(int length) {
        ThreadLocalRandom rng = ThreadLocalRandom.current();
        List<Double> closes = new ArrayList<>(length);
        List<Double> volumes = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            closes.add(rng.nextDouble(50, 150));
            volumes.add(rng.nextDouble(0, 1_000_000));
        }
        PriceSeries series = new PriceSeries();
        series.setTicker("T" + rng.nextInt(100));
        series.setCloses(closes);
        series.setVolumes(volumes);
        series.setAdjusted(rng.nextBoolean());
        return series;
    }
}
