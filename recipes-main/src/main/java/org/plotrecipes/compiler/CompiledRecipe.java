package org.plotrecipes.compiler;

import java.util.List;
import java.util.Objects;

import org.plotrecipes.RecipeDispatchException;
import org.plotrecipes.runtime.ApplyRecipe;
import org.plotrecipes.runtime.AttributeMap;
import org.plotrecipes.runtime.DispatchKey;
import org.plotrecipes.runtime.RecipeData;
import org.plotrecipes.transformer.GeneratedRecipe;

/**
 * A generated recipe compiled to closures. Immutable; every call runs in its own {@link Frame}.
 */
public final class CompiledRecipe implements ApplyRecipe {

    private final GeneratedRecipe source;
    private final DispatchKey dispatchKey;
    private final int[] parameterSlots;
    private final CompiledNode[] defaults;
    private final CompiledNode body;
    private final int frameSize;

    CompiledRecipe(GeneratedRecipe source, DispatchKey dispatchKey, int[] parameterSlots, CompiledNode[] defaults,
                   CompiledNode body, int frameSize) {
        this.source = source;
        this.dispatchKey = dispatchKey;
        this.parameterSlots = parameterSlots;
        this.defaults = defaults;
        this.body = body;
        this.frameSize = frameSize;
    }

    @Override
    public String name() {
        return source.name();
    }

    @Override
    public DispatchKey dispatchKey() {
        return dispatchKey;
    }

    public GeneratedRecipe source() {
        return source;
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<RecipeData> apply(AttributeMap attributes, Object... args) {
        Objects.requireNonNull(attributes, "attributes");
        if (!dispatchKey.isApplicable(args)) {
            throw new RecipeDispatchException("Recipe '" + name() + dispatchKey + "' cannot be applied to "
                                              + args.length + " argument(s)");
        }

        Frame frame = new Frame(frameSize);
        frame.store(0, attributes);
        for (int i = 0; i < parameterSlots.length; i++) {
            Object value = i < args.length ? args[i] : defaults[i].eval(frame);
            frame.store(parameterSlots[i], value);
        }
        return (List<RecipeData>) body.eval(frame);
    }

    @Override
    public String toString() {
        return "CompiledRecipe{" + name() + dispatchKey + '}';
    }
}
