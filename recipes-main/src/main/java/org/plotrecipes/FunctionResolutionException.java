package org.plotrecipes;

public class FunctionResolutionException extends RecipeCompileException {

    private final String functionName;
    private final int argCount;

    public FunctionResolutionException(String recipeName, String functionName, int argCount) {
        super("No function '" + functionName + "' callable with " + argCount + " argument(s) in recipe '" + recipeName + "'",
              recipeName);
        this.functionName = functionName;
        this.argCount = argCount;
    }

    public String getFunctionName() {
        return functionName;
    }

    public int getArgCount() {
        return argCount;
    }
}
