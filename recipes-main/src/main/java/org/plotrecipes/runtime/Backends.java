package org.plotrecipes.runtime;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

public final class Backends {

    private Backends() {
    }

    public static Backend supportingAll() {
        return named("all", key -> true);
    }

    public static Backend supporting(String name, String... keys) {
        Set<Symbol> supported = Arrays.stream(keys).map(Symbol::of).collect(Collectors.toUnmodifiableSet());
        return named(name, supported::contains);
    }

    public static Backend named(String name, Backend predicate) {
        return new Backend() {
            @Override
            public boolean isKeySupported(Symbol key) {
                return predicate.isKeySupported(key);
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public String toString() {
                return "Backend{" + name + '}';
            }
        };
    }
}
