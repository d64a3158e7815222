package org.plotrecipes;

import org.plotrecipes.runtime.Symbol;

/**
 * Thrown by a generated recipe when an attribute flagged {@code require} is rejected by the backend.
 */
public class UnsupportedAttributeException extends RecipeEvaluationException {

    private final Symbol key;
    private final String backendName;

    public UnsupportedAttributeException(Symbol key, String backendName) {
        super("In recipe: required keyword " + key + " is not supported by backend " + backendName);
        this.key = key;
        this.backendName = backendName;
    }

    public Symbol getKey() {
        return key;
    }

    public String getBackendName() {
        return backendName;
    }
}
