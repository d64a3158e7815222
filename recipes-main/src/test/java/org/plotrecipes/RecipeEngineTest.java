package org.plotrecipes;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.plotrecipes.ast.Node;
import org.plotrecipes.compiler.TypeResolver;
import org.plotrecipes.runtime.AttributeMap;
import org.plotrecipes.runtime.Backend;
import org.plotrecipes.runtime.Backends;
import org.plotrecipes.runtime.RecipeData;
import org.plotrecipes.runtime.Symbol;
import org.plotrecipes.runtime.Tuple;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.plotrecipes.ast.Nodes.attr;
import static org.plotrecipes.ast.Nodes.block;
import static org.plotrecipes.ast.Nodes.call;
import static org.plotrecipes.ast.Nodes.flagged;
import static org.plotrecipes.ast.Nodes.forEach;
import static org.plotrecipes.ast.Nodes.force;
import static org.plotrecipes.ast.Nodes.function;
import static org.plotrecipes.ast.Nodes.kw;
import static org.plotrecipes.ast.Nodes.literal;
import static org.plotrecipes.ast.Nodes.nothing;
import static org.plotrecipes.ast.Nodes.parameters;
import static org.plotrecipes.ast.Nodes.quote;
import static org.plotrecipes.ast.Nodes.series;
import static org.plotrecipes.ast.Nodes.signature;
import static org.plotrecipes.ast.Nodes.sym;
import static org.plotrecipes.ast.Nodes.tuple;
import static org.plotrecipes.ast.Nodes.typed;

class RecipeEngineTest {

    static class PriceHistory {
    }

    static class IntradayHistory extends PriceHistory {
    }

    private static Symbol s(String name) {
        return Symbol.of(name);
    }

    private static RecipeEngine engine(Backend backend) {
        return RecipeEngine.builder()
                .backend(backend)
                .typeResolver(new TypeResolver().register(PriceHistory.class).register(IntradayHistory.class))
                .build();
    }

    private static Node recipe(Node... body) {
        return function(signature("prices", typed("h", "PriceHistory")), block(body));
    }

    @Test
    void nonForcedSetPreservesCallerValueAndForceWins() {
        RecipeEngine engine = engine(Backends.supportingAll());
        engine.define(recipe(attr("linecolor", quote("red")),
                             force("fillcolor", quote("green")),
                             literal(1)));

        AttributeMap supplied = new AttributeMap().with("linecolor", s("blue")).with("fillcolor", s("yellow"));
        RecipeData record = engine.apply(supplied, new PriceHistory()).get(0);
        assertThat(record.attribute("linecolor")).isEqualTo(s("blue"));
        assertThat(record.attribute("fillcolor")).isEqualTo(s("green"));

        RecipeData defaults = engine.apply(new AttributeMap(), new PriceHistory()).get(0);
        assertThat(defaults.attribute("linecolor")).isEqualTo(s("red"));
    }

    @Test
    void quietSkipsUnsupportedWithoutError() {
        RecipeEngine engine = engine(Backends.supporting("lines", "linecolor"));
        engine.define(recipe(flagged(attr("markersize", literal(3)), "quiet"),
                             flagged(attr("linecolor", quote("red")), "quiet"),
                             literal(1)));

        AttributeMap attributes = new AttributeMap();
        List<RecipeData> series = engine.apply(attributes, new PriceHistory());

        assertThat(series).hasSize(1);
        assertThat(attributes.containsKey("markersize")).isFalse();
        assertThat(attributes.get("linecolor")).isEqualTo(s("red"));
    }

    @Test
    void requireFailsOnUnsupportedBeforeWriting() {
        RecipeEngine engine = engine(Backends.supporting("lines", "label"));
        engine.define(recipe(attr("label", literal("close")),
                             flagged(attr("markersize", literal(3)), "require"),
                             literal(1)));

        AttributeMap attributes = new AttributeMap();
        assertThatThrownBy(() -> engine.apply(attributes, new PriceHistory()))
                .isInstanceOf(UnsupportedAttributeException.class)
                .hasMessage("In recipe: required keyword :markersize is not supported by backend lines")
                .satisfies(e -> {
                    UnsupportedAttributeException uae = (UnsupportedAttributeException) e;
                    assertThat(uae.getKey()).isEqualTo(s("markersize"));
                    assertThat(uae.getBackendName()).isEqualTo("lines");
                });

        assertThat(attributes.containsKey("markersize")).isFalse();
        assertThat(attributes.get("label")).isEqualTo("close");
    }

    @Test
    void unflaggedWritesRegardlessOfSupport() {
        RecipeEngine engine = engine(Backends.supporting("none"));
        engine.define(recipe(attr("markersize", literal(3)), literal(1)));

        RecipeData record = engine.apply(new AttributeMap(), new PriceHistory()).get(0);
        assertThat(record.attribute("markersize")).isEqualTo(3L);
    }

    @Test
    void seriesBlocksForkIndependentMaps() {
        RecipeEngine engine = engine(Backends.supportingAll());
        engine.define(recipe(attr("linecolor", quote("red")),
                             series(force("linecolor", quote("green")), attr("label", literal("fork")), literal(1)),
                             force("fillcolor", quote("blue")),
                             literal(2)));

        AttributeMap attributes = new AttributeMap();
        List<RecipeData> series = engine.apply(attributes, new PriceHistory());

        assertThat(series).hasSize(2);
        RecipeData fork = series.get(0);
        assertThat(fork.attribute("linecolor")).isEqualTo(s("green"));
        assertThat(fork.attribute("label")).isEqualTo("fork");
        assertThat(fork.hasAttribute("fillcolor")).isFalse();
        assertThat(fork.args()).isEqualTo(Tuple.of(1L));

        RecipeData main = series.get(1);
        assertThat(main.attribute("linecolor")).isEqualTo(s("red"));
        assertThat(main.hasAttribute("label")).isFalse();
        assertThat(main.attribute("fillcolor")).isEqualTo(s("blue"));
        assertThat(main.args()).isEqualTo(Tuple.of(2L));

        assertThat(attributes.get("linecolor")).isEqualTo(s("red"));
    }

    @Test
    void recordCountFollowsSeriesBlocksAndTrailingValue() {
        RecipeEngine engine = engine(Backends.supportingAll());
        engine.define(recipe(forEach("i", call("range", literal(1), literal(3)), block(series(sym("i")))),
                             nothing()));

        List<RecipeData> series = engine.apply(new AttributeMap(), new PriceHistory());

        assertThat(series).extracting(RecipeData::args)
                .containsExactly(Tuple.of(1L), Tuple.of(2L), Tuple.of(3L));
    }

    @Test
    void trailingValueAddsMainSeries() {
        RecipeEngine engine = engine(Backends.supportingAll());
        engine.define(recipe(series(literal(1)), series(nothing()), tuple(literal(1), literal(2))));

        List<RecipeData> series = engine.apply(new AttributeMap(), new PriceHistory());

        assertThat(series).hasSize(3);
        assertThat(series.get(1).args()).isEqualTo(Tuple.of((Object) null));
        assertThat(series.get(2).args()).isEqualTo(Tuple.of(1L, 2L));
    }

    @Test
    void unsupportedKeywordIsRemovedButStillBound() {
        Node definition = function(signature("prices", parameters(kw("shape", quote("auto"))), typed("h", "PriceHistory")),
                                   block(sym("shape")));

        RecipeEngine rejecting = engine(Backends.supporting("lines", "linecolor"));
        rejecting.define(definition);

        RecipeData record = rejecting.apply(new AttributeMap(), new PriceHistory()).get(0);
        assertThat(record.hasAttribute("shape")).isFalse();
        assertThat(record.args()).isEqualTo(Tuple.of(s("auto")));

        RecipeData overridden = rejecting.apply(new AttributeMap().with("shape", s("circle")), new PriceHistory()).get(0);
        assertThat(overridden.hasAttribute("shape")).isFalse();
        assertThat(overridden.args()).isEqualTo(Tuple.of(s("circle")));

        RecipeEngine accepting = engine(Backends.supportingAll());
        accepting.define(definition);
        assertThat(accepting.apply(new AttributeMap(), new PriceHistory()).get(0).attribute("shape")).isEqualTo(s("auto"));
    }

    @Test
    void endToEndSeriesScenario() {
        RecipeEngine engine = engine(Backends.supportingAll());
        engine.define(recipe(series(force("fillcolor", quote("green")), call("rand", literal(10))),
                             call("rand", literal(100))));

        List<RecipeData> series = engine.apply(new AttributeMap().with("linecolor", s("black")), new PriceHistory());

        assertThat(series).hasSize(2);

        RecipeData first = series.get(0);
        assertThat(first.attribute("fillcolor")).isEqualTo(s("green"));
        assertThat(first.attribute("linecolor")).isEqualTo(s("black"));
        assertThat(first.args().size()).isEqualTo(1);
        assertThat((List<?>) first.args().get(0)).hasSize(10);

        RecipeData second = series.get(1);
        assertThat(second.hasAttribute("fillcolor")).isFalse();
        assertThat(second.attribute("linecolor")).isEqualTo(s("black"));
        assertThat((List<?>) second.args().get(0)).hasSize(100);
    }

    @Test
    void dispatchPicksMostSpecificRecipe() {
        RecipeEngine engine = engine(Backends.supportingAll());
        engine.define(function(signature("generic", sym("x")), block(quote("generic"))));
        engine.define(function(signature("daily", typed("h", "PriceHistory")), block(quote("daily"))));
        engine.define(function(signature("intraday", typed("h", "IntradayHistory")), block(quote("intraday"))));

        assertThat(engine.apply(new AttributeMap(), "text").get(0).args()).isEqualTo(Tuple.of(s("generic")));
        assertThat(engine.apply(new AttributeMap(), new PriceHistory()).get(0).args()).isEqualTo(Tuple.of(s("daily")));
        assertThat(engine.apply(new AttributeMap(), new IntradayHistory()).get(0).args()).isEqualTo(Tuple.of(s("intraday")));
        assertThat(engine.registry().size()).isEqualTo(3);
    }

    @Test
    void definitionTreeIsNotMutated() {
        Node definition = recipe(flagged(attr("linecolor", quote("red")), "quiet"), series(literal(1)), literal(2));
        Node before = definition.deepCopy();

        engine(Backends.supportingAll()).define(definition);

        assertThat(definition).isEqualTo(before);
    }

    @Test
    void expandRendersJavaSource() {
        String source = engine(Backends.supportingAll()).expand(recipe(attr("linecolor", quote("red")), literal(1)));

        assertThat(source).contains("applyRecipe(AttributeMap plotattributes, PriceHistory h)")
                .contains("plotattributes.getOrInsert(Symbol.of(\"linecolor\"), Symbol.of(\"red\"))");
    }
}
