package org.plotrecipes.runtime;

import java.util.Map;

/**
 * One plottable series: the attributes it was produced with and its positional data.
 *
 * @param attributes immutable snapshot of the attribute map at the moment the series completed
 * @param args       the series data
 */
public record RecipeData(Map<Symbol, Object> attributes, Tuple args) {

    public RecipeData(AttributeMap attributes, Tuple args) {
        this(attributes.snapshot(), args);
    }

    public Object attribute(String key) {
        return attributes.get(Symbol.of(key));
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(Symbol.of(key));
    }
}
