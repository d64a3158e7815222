package org.plotrecipes.transformer;

import org.plotrecipes.ast.Node;

/**
 * A positional recipe parameter. Type and default expressions are kept exactly as written.
 *
 * @param type         type expression, or null when untyped
 * @param defaultValue default expression, or null when the parameter is required
 */
public record RecipeParameter(String name, Node type, Node defaultValue) {

    public boolean isOptional() {
        return defaultValue != null;
    }
}
