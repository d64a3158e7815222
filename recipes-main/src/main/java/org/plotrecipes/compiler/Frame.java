package org.plotrecipes.compiler;

import java.util.Arrays;

import org.plotrecipes.RecipeEvaluationException;
import org.plotrecipes.runtime.Nothing;

/**
 * Local variable storage of one recipe invocation.
 */
public final class Frame {

    private final Object[] slots;

    Frame(int size) {
        this.slots = new Object[size];
    }

    public Object load(int slot, String name) {
        Object value = slots[slot];
        if (value == null) {
            throw new RecipeEvaluationException("Variable '" + name + "' is not defined");
        }
        return value;
    }

    public void store(int slot, Object value) {
        slots[slot] = Nothing.normalize(value);
    }

    /**
     * Undefine the slots in {@code [from, to)}.
     */
    void clear(int from, int to) {
        Arrays.fill(slots, from, to, null);
    }
}
