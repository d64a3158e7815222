package org.plotrecipes.transformer;

import java.util.List;

import org.plotrecipes.ast.Node;

/**
 * The output of the transformer: a function taking the attribute map followed by the recipe's positional
 * parameters and returning the list of series it produced.
 *
 * @param dispatchTypes one type expression per positional parameter, type parameters replaced by their bounds
 * @param required      number of positional parameters without a default
 * @param body          the complete function body, preamble and series collection included
 */
public record GeneratedRecipe(String name,
                              Node target,
                              List<TypeParameter> typeParameters,
                              List<RecipeParameter> parameters,
                              List<KeywordParameter> keywords,
                              List<Node> dispatchTypes,
                              int required,
                              Node body) {

    public GeneratedRecipe {
        typeParameters = List.copyOf(typeParameters);
        parameters = List.copyOf(parameters);
        keywords = List.copyOf(keywords);
        dispatchTypes = List.copyOf(dispatchTypes);
    }
}
