package org.plotrecipes.transformer;

import java.util.List;

import org.plotrecipes.ast.Node;

/**
 * A recipe signature split into its dispatch target, positional parameters and keyword parameters.
 *
 * @param name   the recipe function name
 * @param target the dispatch target expression, a symbol or a curly expression carrying type parameters
 */
public record RecipeSignature(String name,
                              Node target,
                              List<TypeParameter> typeParameters,
                              List<RecipeParameter> positional,
                              List<KeywordParameter> keywords) {

    public RecipeSignature {
        typeParameters = List.copyOf(typeParameters);
        positional = List.copyOf(positional);
        keywords = List.copyOf(keywords);
    }
}
