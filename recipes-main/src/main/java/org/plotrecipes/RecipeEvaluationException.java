package org.plotrecipes;

public class RecipeEvaluationException extends RecipeException {

    public RecipeEvaluationException(String message) {
        super(message);
    }

    public RecipeEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
