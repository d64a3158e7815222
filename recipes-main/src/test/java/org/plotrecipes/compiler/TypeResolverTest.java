package org.plotrecipes.compiler;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.plotrecipes.TypeResolutionException;
import org.plotrecipes.runtime.AttributeMap;
import org.plotrecipes.runtime.Symbol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.plotrecipes.ast.Nodes.curly;
import static org.plotrecipes.ast.Nodes.sym;

class TypeResolverTest {

    static class Candle {
    }

    private final TypeResolver resolver = new TypeResolver();

    @Test
    void resolvesAliases() {
        assertThat(resolver.resolve("Any")).isEqualTo(Object.class);
        assertThat(resolver.resolve("Int")).isEqualTo(Long.class);
        assertThat(resolver.resolve("Float")).isEqualTo(Double.class);
        assertThat(resolver.resolve("Bool")).isEqualTo(Boolean.class);
        assertThat(resolver.resolve("Symbol")).isEqualTo(Symbol.class);
        assertThat(resolver.resolve("AttributeMap")).isEqualTo(AttributeMap.class);
    }

    @Test
    void resolvesJavaLangAndQualifiedNames() {
        assertThat(resolver.resolve("Number")).isEqualTo(Number.class);
        assertThat(resolver.resolve("String")).isEqualTo(String.class);
        assertThat(resolver.resolve("java.util.List")).isEqualTo(List.class);
    }

    @Test
    void parameterizedTypesResolveToTheirBase() {
        assertThat(resolver.resolve(curly("java.util.List", sym("Int")))).isEqualTo(List.class);
    }

    @Test
    void registeredTypesResolveBySimpleName() {
        resolver.register(Candle.class);
        assertThat(resolver.resolve(sym("Candle"))).isEqualTo(Candle.class);
    }

    @Test
    void unknownTypeFails() {
        assertThatThrownBy(() -> resolver.resolve("Candlestick"))
                .isInstanceOf(TypeResolutionException.class)
                .hasMessage("Unable to resolve type 'Candlestick'")
                .satisfies(e -> assertThat(((TypeResolutionException) e).getTypeName()).isEqualTo("Candlestick"));
    }
}
