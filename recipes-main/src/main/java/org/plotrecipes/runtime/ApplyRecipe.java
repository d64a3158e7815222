package org.plotrecipes.runtime;

import java.util.List;

/**
 * A generated recipe function: takes the caller's attribute map plus the recipe arguments and returns one
 * {@link RecipeData} per series, in evaluation order.
 */
public interface ApplyRecipe {

    String name();

    DispatchKey dispatchKey();

    List<RecipeData> apply(AttributeMap attributes, Object... args);
}
