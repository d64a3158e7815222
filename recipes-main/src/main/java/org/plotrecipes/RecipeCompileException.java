package org.plotrecipes;

public class RecipeCompileException extends RecipeException {

    private final String recipeName;

    public RecipeCompileException(String message, String recipeName) {
        super(message);
        this.recipeName = recipeName;
    }

    public RecipeCompileException(String message, String recipeName, Throwable cause) {
        super(message, cause);
        this.recipeName = recipeName;
    }

    public String getRecipeName() {
        return recipeName;
    }
}
