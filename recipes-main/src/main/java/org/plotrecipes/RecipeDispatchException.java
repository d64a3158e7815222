package org.plotrecipes;

public class RecipeDispatchException extends RecipeEvaluationException {

    public RecipeDispatchException(String message) {
        super(message);
    }
}
