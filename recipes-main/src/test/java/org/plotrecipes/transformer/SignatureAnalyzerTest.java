package org.plotrecipes.transformer;

import org.junit.jupiter.api.Test;
import org.plotrecipes.RecipeSignatureException;
import org.plotrecipes.RecipeTransformException;
import org.plotrecipes.ast.Node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.plotrecipes.ast.Nodes.block;
import static org.plotrecipes.ast.Nodes.curly;
import static org.plotrecipes.ast.Nodes.function;
import static org.plotrecipes.ast.Nodes.kw;
import static org.plotrecipes.ast.Nodes.literal;
import static org.plotrecipes.ast.Nodes.parameters;
import static org.plotrecipes.ast.Nodes.quote;
import static org.plotrecipes.ast.Nodes.signature;
import static org.plotrecipes.ast.Nodes.subtype;
import static org.plotrecipes.ast.Nodes.sym;
import static org.plotrecipes.ast.Nodes.typed;

class SignatureAnalyzerTest {

    private final SignatureAnalyzer analyzer = new SignatureAnalyzer();

    @Test
    void splitsKeywordsAndPositionalParameters() {
        Node definition = function(signature(curly("prices", subtype("T", "Number")),
                                             parameters(kw("shape", quote("auto")), kw("width", literal(2))),
                                             typed("x", "T"),
                                             kw(typed("n", "Int"), literal(10))),
                                   block());

        RecipeSignature signature = analyzer.analyze(definition);

        assertThat(signature.name()).isEqualTo("prices");
        assertThat(signature.typeParameters()).containsExactly(new TypeParameter("T", sym("Number")));
        assertThat(signature.keywords()).extracting(KeywordParameter::name).containsExactly("shape", "width");
        assertThat(signature.keywords().get(0).defaultValue()).isEqualTo(quote("auto"));
        assertThat(signature.positional()).extracting(RecipeParameter::name).containsExactly("x", "n");
        assertThat(signature.positional().get(0).type()).isEqualTo(sym("T"));
        assertThat(signature.positional().get(0).isOptional()).isFalse();
        assertThat(signature.positional().get(1).defaultValue()).isEqualTo(literal(10));
    }

    @Test
    void anonymousParametersGetGeneratedNames() {
        RecipeSignature signature = analyzer.analyze(function(signature("f", typed("Int"), sym("y")), block()));

        assertThat(signature.positional()).extracting(RecipeParameter::name).containsExactly("#arg1", "y");
        assertThat(signature.positional().get(0).type()).isEqualTo(sym("Int"));
        assertThat(signature.positional().get(1).type()).isNull();
    }

    @Test
    void unboundedTypeParameter() {
        RecipeSignature signature = analyzer.analyze(function(signature(curly("f", sym("T")), typed("x", "T")), block()));
        assertThat(signature.typeParameters()).containsExactly(new TypeParameter("T", null));
    }

    @Test
    void rejectsNonFunction() {
        assertThatThrownBy(() -> analyzer.analyze(block()))
                .isInstanceOf(RecipeSignatureException.class)
                .hasMessage("Must wrap a valid function definition");
    }

    @Test
    void rejectsSignatureWithoutArguments() {
        assertThatThrownBy(() -> analyzer.analyze(function(signature("f"), block())))
                .isInstanceOf(RecipeSignatureException.class)
                .hasMessageContaining("need something to dispatch on");
    }

    @Test
    void rejectsNonCallSignature() {
        assertThatThrownBy(() -> analyzer.analyze(function(sym("f"), block())))
                .isInstanceOf(RecipeSignatureException.class)
                .hasMessageContaining("call-form signature")
                .satisfies(e -> assertThat(((RecipeSignatureException) e).getSignature()).isEqualTo("f"));
    }

    @Test
    void keywordParametersMustComeFirst() {
        Node definition = function(signature("f", sym("x"), parameters(kw("a", literal(1)))), block());
        assertThatThrownBy(() -> analyzer.analyze(definition))
                .isInstanceOf(RecipeSignatureException.class)
                .hasMessageContaining("must come first");
    }

    @Test
    void rejectsUnsupportedParameterForm() {
        Node definition = function(signature("f", literal(1)), block());
        assertThatThrownBy(() -> analyzer.analyze(definition))
                .isInstanceOf(RecipeTransformException.class)
                .hasMessageContaining("Unsupported parameter");
    }
}
