package org.plotrecipes.runtime;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The positional parameter types a recipe dispatches on.
 *
 * @param parameterTypes one class per positional parameter
 * @param required       how many leading parameters have no default
 */
public record DispatchKey(List<Class<?>> parameterTypes, int required) {

    public DispatchKey {
        parameterTypes = List.copyOf(parameterTypes);
        if (required < 0 || required > parameterTypes.size()) {
            throw new IllegalArgumentException("required must be between 0 and " + parameterTypes.size());
        }
    }

    public boolean isApplicable(Object[] args) {
        if (args.length < required || args.length > parameterTypes.size()) {
            return false;
        }
        for (int i = 0; i < args.length; i++) {
            if (args[i] == null || !parameterTypes.get(i).isInstance(args[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when every type in this key's first {@code argCount} positions is assignable to the other key's type
     * at the same position.
     */
    public boolean isAtLeastAsSpecificAs(DispatchKey other, int argCount) {
        for (int i = 0; i < argCount; i++) {
            if (!other.parameterTypes.get(i).isAssignableFrom(parameterTypes.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return parameterTypes.stream()
                .map(Class::getSimpleName)
                .collect(Collectors.joining(", ", "(", ")")) + (required < parameterTypes.size() ? "/" + required : "");
    }
}
