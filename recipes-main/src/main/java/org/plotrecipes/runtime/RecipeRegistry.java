package org.plotrecipes.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.plotrecipes.RecipeDispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatch table of generated recipes, keyed by their positional parameter types.
 * <p>
 * Resolution picks the most specific applicable recipe, the way overload resolution would. A call with no
 * arguments that matches nothing yields no series.
 */
public class RecipeRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(RecipeRegistry.class);

    private final Map<DispatchKey, ApplyRecipe> recipes = new ConcurrentHashMap<>();

    public void register(ApplyRecipe recipe) {
        ApplyRecipe previous = recipes.put(recipe.dispatchKey(), recipe);
        if (previous != null) {
            LOG.debug("Recipe '{}' replaces '{}' for {}", recipe.name(), previous.name(), recipe.dispatchKey());
        } else {
            LOG.debug("Registered recipe '{}' for {}", recipe.name(), recipe.dispatchKey());
        }
    }

    public boolean unregister(DispatchKey key) {
        return recipes.remove(key) != null;
    }

    public Collection<ApplyRecipe> recipes() {
        return Collections.unmodifiableCollection(recipes.values());
    }

    public int size() {
        return recipes.size();
    }

    public void clear() {
        recipes.clear();
    }

    public List<RecipeData> apply(AttributeMap attributes, Object... args) {
        ApplyRecipe recipe = resolve(args);
        if (recipe == null) {
            return Collections.emptyList();
        }
        return recipe.apply(attributes, args);
    }

    /**
     * @return the most specific recipe for {@code args}, or null for the no-argument case with no recipe
     * @throws RecipeDispatchException when no recipe applies or several are equally specific
     */
    public ApplyRecipe resolve(Object... args) {
        List<ApplyRecipe> applicable = new ArrayList<>();
        for (ApplyRecipe recipe : recipes.values()) {
            if (recipe.dispatchKey().isApplicable(args)) {
                applicable.add(recipe);
            }
        }
        if (applicable.isEmpty()) {
            if (args.length == 0) {
                return null;
            }
            throw new RecipeDispatchException("No recipe matches argument types " + describe(args));
        }

        List<ApplyRecipe> mostSpecific = new ArrayList<>();
        for (ApplyRecipe candidate : applicable) {
            boolean dominates = true;
            for (ApplyRecipe other : applicable) {
                if (other != candidate && !candidate.dispatchKey().isAtLeastAsSpecificAs(other.dispatchKey(), args.length)) {
                    dominates = false;
                    break;
                }
            }
            if (dominates) {
                mostSpecific.add(candidate);
            }
        }
        if (mostSpecific.size() != 1) {
            throw new RecipeDispatchException("Ambiguous recipe dispatch for argument types " + describe(args) + ": "
                    + applicable.stream().map(r -> r.name() + r.dispatchKey()).collect(Collectors.joining(", ")));
        }
        return mostSpecific.get(0);
    }

    private static String describe(Object[] args) {
        List<String> names = new ArrayList<>();
        for (Object arg : args) {
            names.add(arg == null ? "null" : arg.getClass().getSimpleName());
        }
        return names.stream().collect(Collectors.joining(", ", "(", ")"));
    }
}
