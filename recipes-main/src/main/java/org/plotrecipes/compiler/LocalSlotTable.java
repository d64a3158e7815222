package org.plotrecipes.compiler;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracks local variable name to frame slot mappings while a recipe is compiled.
 * <p>
 * Slot 0 is always the attribute map parameter. {@code let} and loop bodies open nested scopes; a name declared in
 * a nested scope shadows the outer one until the scope is closed. Slots are never reused.
 */
public final class LocalSlotTable {

    private final Deque<Map<String, Integer>> scopes = new ArrayDeque<>();
    private int nextSlot;

    /**
     * Create a slot table with the attribute map parameter in slot 0.
     *
     * @param attributesName the name generated code uses for the attribute map
     */
    public LocalSlotTable(String attributesName) {
        scopes.push(new LinkedHashMap<>());
        allocate(attributesName);
    }

    /**
     * Allocate a new slot for {@code name} in the innermost scope.
     *
     * @return the allocated slot index
     */
    public int allocate(String name) {
        int slot = nextSlot++;
        scopes.peek().put(name, slot);
        return slot;
    }

    /**
     * Look up the slot of the innermost visible variable named {@code name}.
     *
     * @throws IllegalArgumentException if the variable is not visible
     */
    public int slot(String name) {
        for (Iterator<Map<String, Integer>> it = scopes.iterator(); it.hasNext(); ) {
            Integer slot = it.next().get(name);
            if (slot != null) {
                return slot;
            }
        }
        throw new IllegalArgumentException("Unknown variable: " + name);
    }

    public boolean contains(String name) {
        for (Map<String, Integer> scope : scopes) {
            if (scope.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Slot an assignment to {@code name} writes to: the visible variable if there is one, else a new local in the
     * innermost scope.
     */
    public int assignmentSlot(String name) {
        return contains(name) ? slot(name) : allocate(name);
    }

    public void pushScope() {
        scopes.push(new LinkedHashMap<>());
    }

    public void popScope() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Cannot pop the function scope");
        }
        scopes.pop();
    }

    public int depth() {
        return scopes.size();
    }

    /**
     * Number of slots a frame needs.
     */
    public int frameSize() {
        return nextSlot;
    }
}
