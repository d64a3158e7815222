package org.plotrecipes;

import java.util.List;

import org.plotrecipes.ast.Node;
import org.plotrecipes.compiler.CompiledRecipe;
import org.plotrecipes.compiler.RecipeCompiler;
import org.plotrecipes.compiler.TypeResolver;
import org.plotrecipes.printer.RecipeSourceRenderer;
import org.plotrecipes.runtime.AttributeMap;
import org.plotrecipes.runtime.Backend;
import org.plotrecipes.runtime.Backends;
import org.plotrecipes.runtime.FunctionTable;
import org.plotrecipes.runtime.RecipeData;
import org.plotrecipes.runtime.RecipeRegistry;
import org.plotrecipes.transformer.GeneratedRecipe;
import org.plotrecipes.transformer.RecipeTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: defines recipes from their trees and applies them through type-directed dispatch.
 *
 * <pre>
 * RecipeEngine engine = RecipeEngine.builder().backend(backend).build();
 * engine.define(recipeTree);
 * List&lt;RecipeData&gt; series = engine.apply(new AttributeMap(), myObject);
 * </pre>
 */
public class RecipeEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RecipeEngine.class);

    private final RecipeTransformer transformer = new RecipeTransformer();
    private final RecipeSourceRenderer renderer = new RecipeSourceRenderer();
    private final RecipeCompiler compiler;
    private final RecipeRegistry registry;

    private RecipeEngine(Builder builder) {
        this.compiler = new RecipeCompiler(builder.functions, builder.typeResolver, builder.backend);
        this.registry = builder.registry;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Transforms, compiles and registers a recipe definition.
     *
     * @throws RecipeTransformException if the definition is malformed
     * @throws RecipeCompileException   if the body refers to unknown names or types
     */
    public CompiledRecipe define(Node definition) {
        GeneratedRecipe generated = transformer.transform(definition);
        CompiledRecipe compiled = compiler.compile(generated);
        registry.register(compiled);
        LOG.debug("Defined recipe {}", compiled);
        return compiled;
    }

    public List<RecipeData> apply(AttributeMap attributes, Object... args) {
        return registry.apply(attributes, args);
    }

    /**
     * Renders the function a definition transforms into as Java source, without registering it.
     */
    public String expand(Node definition) {
        return renderer.render(transformer.transform(definition));
    }

    public RecipeRegistry registry() {
        return registry;
    }

    public static class Builder {

        private Backend backend = Backends.supportingAll();
        private FunctionTable functions = FunctionTable.withBuiltins();
        private TypeResolver typeResolver = new TypeResolver();
        private RecipeRegistry registry = new RecipeRegistry();

        public Builder backend(Backend backend) {
            this.backend = backend;
            return this;
        }

        public Builder functions(FunctionTable functions) {
            this.functions = functions;
            return this;
        }

        public Builder typeResolver(TypeResolver typeResolver) {
            this.typeResolver = typeResolver;
            return this;
        }

        public Builder registry(RecipeRegistry registry) {
            this.registry = registry;
            return this;
        }

        public RecipeEngine build() {
            return new RecipeEngine(this);
        }
    }
}
