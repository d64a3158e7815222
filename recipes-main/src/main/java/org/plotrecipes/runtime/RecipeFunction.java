package org.plotrecipes.runtime;

/**
 * A host function callable from recipe code.
 */
@FunctionalInterface
public interface RecipeFunction {

    Object call(Object... args);
}
