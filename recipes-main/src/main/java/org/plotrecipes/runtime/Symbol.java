package org.plotrecipes.runtime;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An interned symbolic name such as {@code :linecolor}. Attribute keys and symbolic attribute values are symbols.
 * <p>
 * Symbols with the same name are the same instance, so identity and equality agree.
 */
public final class Symbol implements Comparable<Symbol> {

    private static final Map<String, Symbol> TABLE = new ConcurrentHashMap<>();

    private final String name;

    private Symbol(String name) {
        this.name = name;
    }

    public static Symbol of(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Symbol name must not be empty");
        }
        return TABLE.computeIfAbsent(name, Symbol::new);
    }

    public String name() {
        return name;
    }

    @Override
    public int compareTo(Symbol o) {
        return name.compareTo(o.name);
    }

    @Override
    public String toString() {
        return ":" + name;
    }
}
