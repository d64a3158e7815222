package org.plotrecipes;

public class RecipeException extends RuntimeException {

    public RecipeException(String message) {
        super(message);
    }

    public RecipeException(String message, Throwable cause) {
        super(message, cause);
    }

    public RecipeException(Throwable cause) {
        super(cause);
    }
}
