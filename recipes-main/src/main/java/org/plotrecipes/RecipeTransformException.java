package org.plotrecipes;

public class RecipeTransformException extends RecipeException {

    private final String nodeDescription;

    public RecipeTransformException(String message, String nodeDescription) {
        super(message);
        this.nodeDescription = nodeDescription;
    }

    public RecipeTransformException(String message, String nodeDescription, Throwable cause) {
        super(message, cause);
        this.nodeDescription = nodeDescription;
    }

    public String getNodeDescription() {
        return nodeDescription;
    }
}
