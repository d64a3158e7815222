package org.plotrecipes.compiler;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.plotrecipes.FunctionResolutionException;
import org.plotrecipes.RecipeCompileException;
import org.plotrecipes.RecipeDispatchException;
import org.plotrecipes.RecipeEvaluationException;
import org.plotrecipes.RecipeTransformException;
import org.plotrecipes.ast.Node;
import org.plotrecipes.ast.NodeKind;
import org.plotrecipes.runtime.AttributeMap;
import org.plotrecipes.runtime.Backends;
import org.plotrecipes.runtime.FunctionTable;
import org.plotrecipes.runtime.RecipeData;
import org.plotrecipes.runtime.Symbol;
import org.plotrecipes.runtime.Tuple;
import org.plotrecipes.transformer.RecipeTransformer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.plotrecipes.ast.Nodes.assign;
import static org.plotrecipes.ast.Nodes.attr;
import static org.plotrecipes.ast.Nodes.block;
import static org.plotrecipes.ast.Nodes.call;
import static org.plotrecipes.ast.Nodes.curly;
import static org.plotrecipes.ast.Nodes.forEach;
import static org.plotrecipes.ast.Nodes.function;
import static org.plotrecipes.ast.Nodes.ifThen;
import static org.plotrecipes.ast.Nodes.ifThenElse;
import static org.plotrecipes.ast.Nodes.kw;
import static org.plotrecipes.ast.Nodes.literal;
import static org.plotrecipes.ast.Nodes.nothing;
import static org.plotrecipes.ast.Nodes.pair;
import static org.plotrecipes.ast.Nodes.quote;
import static org.plotrecipes.ast.Nodes.signature;
import static org.plotrecipes.ast.Nodes.subtype;
import static org.plotrecipes.ast.Nodes.sym;
import static org.plotrecipes.ast.Nodes.tuple;
import static org.plotrecipes.ast.Nodes.typed;
import static org.plotrecipes.ast.Nodes.whileLoop;

class RecipeCompilerTest {

    private final RecipeTransformer transformer = new RecipeTransformer();
    private final FunctionTable functions = FunctionTable.withBuiltins();
    private final RecipeCompiler compiler = new RecipeCompiler(functions, new TypeResolver(), Backends.supportingAll());

    private CompiledRecipe compile(Node definition) {
        return compiler.compile(transformer.transform(definition));
    }

    private static Tuple singleSeries(List<RecipeData> series) {
        assertThat(series).hasSize(1);
        return series.get(0).args();
    }

    @Test
    void missingPositionalArgumentsTakeTheirDefaults() {
        CompiledRecipe recipe = compile(function(signature("f", sym("x"), kw(sym("n"), literal(3))),
                                                 block(tuple(sym("x"), sym("n")))));

        assertThat(singleSeries(recipe.apply(new AttributeMap(), "a"))).isEqualTo(Tuple.of("a", 3L));
        assertThat(singleSeries(recipe.apply(new AttributeMap(), "a", 7L))).isEqualTo(Tuple.of("a", 7L));
    }

    @Test
    void defaultsMayReferToEarlierParameters() {
        CompiledRecipe recipe = compile(function(signature("f", typed("x", "Int"), kw(sym("y"), call("+", sym("x"), literal(1)))),
                                                 block(sym("y"))));

        assertThat(singleSeries(recipe.apply(new AttributeMap(), 2L))).isEqualTo(Tuple.of(3L));
    }

    @Test
    void loopsAccumulateIntoOuterVariables() {
        CompiledRecipe recipe = compile(function(signature("f", sym("n")),
                                                 block(assign("total", literal(0)),
                                                       forEach("i", call("range", literal(1), sym("n")),
                                                               block(assign("total", call("+", sym("total"), sym("i"))))),
                                                       sym("total"))));

        assertThat(singleSeries(recipe.apply(new AttributeMap(), 4L))).isEqualTo(Tuple.of(10L));
    }

    @Test
    void whileLoopRunsUntilConditionFails() {
        CompiledRecipe recipe = compile(function(signature("f", sym("n")),
                                                 block(assign("i", literal(0)),
                                                       whileLoop(call("<", sym("i"), sym("n")),
                                                                 block(assign("i", call("+", sym("i"), literal(1))))),
                                                       sym("i"))));

        assertThat(singleSeries(recipe.apply(new AttributeMap(), 3L))).isEqualTo(Tuple.of(3L));
    }

    @Test
    void conditionalPicksBranch() {
        CompiledRecipe recipe = compile(function(signature("f", sym("x")),
                                                 block(ifThenElse(call(">", sym("x"), literal(0)),
                                                                  quote("positive"),
                                                                  quote("other")))));

        assertThat(singleSeries(recipe.apply(new AttributeMap(), 5L))).isEqualTo(Tuple.of(Symbol.of("positive")));
        assertThat(singleSeries(recipe.apply(new AttributeMap(), -5L))).isEqualTo(Tuple.of(Symbol.of("other")));
    }

    @Test
    void bodyMayReadTheAttributeMap() {
        CompiledRecipe recipe = compile(function(signature("f", sym("x")),
                                                 block(attr("label", literal("close")),
                                                       call("get", sym("plotattributes"), quote("label"), nothing()))));

        assertThat(singleSeries(recipe.apply(new AttributeMap().with("label", "open"), 1L))).isEqualTo(Tuple.of("open"));
    }

    @Test
    void dictBuildsAttributeMapFromPairs() {
        CompiledRecipe recipe = compile(function(signature("f", sym("x")),
                                                 block(call("length", call("dict", pair(quote("a"), literal(1)),
                                                                           pair(quote("b"), sym("x")))))));

        assertThat(singleSeries(recipe.apply(new AttributeMap(), 1L))).isEqualTo(Tuple.of(2L));
    }

    @Test
    void dispatchKeyUsesTypeParameterBound() {
        CompiledRecipe recipe = compile(function(signature(curly("f", subtype("T", "Number")), typed("x", "T"), sym("y")),
                                                 block(nothing())));

        assertThat(recipe.dispatchKey().parameterTypes()).containsExactly(Number.class, Object.class);
        assertThat(recipe.dispatchKey().required()).isEqualTo(2);
    }

    @Test
    void undefinedVariableFailsAtCompileTime() {
        assertThatThrownBy(() -> compile(function(signature("prices", sym("x")), block(sym("missing")))))
                .isInstanceOf(RecipeCompileException.class)
                .hasMessage("Undefined variable 'missing'")
                .satisfies(e -> assertThat(((RecipeCompileException) e).getRecipeName()).isEqualTo("prices"));
    }

    @Test
    void unknownFunctionFailsAtCompileTime() {
        assertThatThrownBy(() -> compile(function(signature("prices", sym("x")), block(call("smooth", sym("x"))))))
                .isInstanceOf(FunctionResolutionException.class)
                .satisfies(e -> {
                    FunctionResolutionException fre = (FunctionResolutionException) e;
                    assertThat(fre.getFunctionName()).isEqualTo("smooth");
                    assertThat(fre.getArgCount()).isEqualTo(1);
                });
    }

    @Test
    void attributeSetInsideCallArgumentsIsRejected() {
        Node definition = function(signature("prices", sym("x")),
                                   block(call("length", attr("a", literal(1)))));

        assertThatThrownBy(() -> compile(definition))
                .isInstanceOf(RecipeCompileException.class)
                .hasMessageContaining("'-->' is not valid in a recipe body");
    }

    @Test
    void hostFunctionFailuresAreWrapped() {
        functions.register("boom", 1, args -> {
            throw new IllegalStateException("bad input");
        });
        CompiledRecipe recipe = compile(function(signature("f", sym("x")), block(call("boom", sym("x")))));

        assertThatThrownBy(() -> recipe.apply(new AttributeMap(), 1L))
                .isInstanceOf(RecipeEvaluationException.class)
                .hasMessage("Function 'boom' failed: bad input")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void nonBooleanConditionFails() {
        CompiledRecipe recipe = compile(function(signature("f", sym("x")),
                                                 block(ifThenElse(sym("x"), literal(1), literal(2)))));

        assertThatThrownBy(() -> recipe.apply(new AttributeMap(), 1L))
                .isInstanceOf(RecipeEvaluationException.class)
                .hasMessageContaining("Expected a boolean");
    }

    @Test
    void wrongArgumentCountIsADispatchError() {
        CompiledRecipe recipe = compile(function(signature("f", sym("x")), block(sym("x"))));

        assertThatThrownBy(() -> recipe.apply(new AttributeMap(), 1L, 2L))
                .isInstanceOf(RecipeDispatchException.class);
    }

    @Test
    void loopLocalsDoNotSurviveIntoTheNextIteration() {
        CompiledRecipe recipe = compile(function(signature("f", sym("n")),
                                                 block(assign("total", literal(0)),
                                                       forEach("i", call("range", literal(1), sym("n")),
                                                               block(ifThen(call("==", sym("i"), literal(1)),
                                                                            assign("y", literal(42))),
                                                                     assign("total", call("+", sym("total"), sym("y"))))),
                                                       sym("total"))));

        assertThat(singleSeries(recipe.apply(new AttributeMap(), 1L))).isEqualTo(Tuple.of(42L));
        assertThatThrownBy(() -> recipe.apply(new AttributeMap(), 2L))
                .isInstanceOf(RecipeEvaluationException.class)
                .hasMessage("Variable 'y' is not defined");
    }

    @Test
    void compiledRecipeKeepsItsSource() {
        CompiledRecipe recipe = compile(function(signature("prices", sym("x"), sym("y")), block(sym("x"))));

        assertThat(recipe.source().name()).isEqualTo("prices");
        assertThat(recipe.source().parameters()).hasSize(2);
    }

    @Test
    void callWithoutFunctionIsRejected() {
        assertMalformed(Node.of(NodeKind.CALL), "Call without a function");
    }

    @Test
    void pairNeedsKeyAndValue() {
        assertMalformed(Node.of(NodeKind.PAIR, literal(1)), "'=>' takes 2 operands, got 1");
    }

    @Test
    void whileNeedsConditionAndBody() {
        assertMalformed(Node.of(NodeKind.WHILE, literal(true)), "'while' takes 2 operands, got 1");
    }

    @Test
    void letNeedsNameValueAndBody() {
        assertMalformed(Node.of(NodeKind.LET, sym("a")), "Malformed let");
        assertMalformed(Node.of(NodeKind.LET, literal(1), literal(2), sym("a")), "Malformed let");
    }

    @Test
    void emptyAttributeKeyIsRejected() {
        assertThatThrownBy(() -> compile(function(signature("prices", sym("x")), block(attr("", literal(1))))))
                .isInstanceOf(RecipeTransformException.class)
                .hasMessage("Attribute key must not be empty");
        assertThatThrownBy(() -> compile(function(signature("prices", sym("x")),
                                                  block(Node.of(NodeKind.ATTRIBUTE_SET, literal(""), literal(1))))))
                .isInstanceOf(RecipeTransformException.class)
                .hasMessage("Attribute key must not be empty");
    }

    private void assertMalformed(Node statement, String message) {
        assertThatThrownBy(() -> compile(function(signature("prices", sym("x")), block(statement))))
                .isInstanceOf(RecipeCompileException.class)
                .hasMessageContaining(message)
                .satisfies(e -> assertThat(((RecipeCompileException) e).getRecipeName()).isEqualTo("prices"));
    }
}
