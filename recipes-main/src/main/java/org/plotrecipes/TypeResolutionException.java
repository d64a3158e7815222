package org.plotrecipes;

public class TypeResolutionException extends RecipeCompileException {

    private final String typeName;

    public TypeResolutionException(String typeName, Throwable cause) {
        super("Unable to resolve type '" + typeName + "'", null, cause);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
