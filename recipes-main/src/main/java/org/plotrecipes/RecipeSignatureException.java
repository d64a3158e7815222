package org.plotrecipes;

/**
 * Raised when a recipe definition does not have a usable call-form signature.
 */
public class RecipeSignatureException extends RecipeTransformException {

    public RecipeSignatureException(String message, String signature) {
        super(message, signature);
    }

    public String getSignature() {
        return getNodeDescription();
    }
}
