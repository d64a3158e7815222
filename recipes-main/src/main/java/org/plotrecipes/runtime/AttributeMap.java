package org.plotrecipes.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Mutable mapping from attribute key to value, passed into a generated recipe and mutated in place.
 * <p>
 * Each series block works on its own {@link #copy()}; nothing is shared between a fork and its parent.
 * Null values are stored as {@link Nothing#NOTHING}.
 */
public final class AttributeMap {

    private final Map<Symbol, Object> entries;

    public AttributeMap() {
        this.entries = new LinkedHashMap<>();
    }

    private AttributeMap(Map<Symbol, Object> entries) {
        this.entries = entries;
    }

    public static AttributeMap of(Map<Symbol, ?> initial) {
        AttributeMap map = new AttributeMap();
        initial.forEach(map::put);
        return map;
    }

    public Object get(Symbol key) {
        return entries.get(key);
    }

    public Object get(String key) {
        return entries.get(Symbol.of(key));
    }

    public boolean containsKey(Symbol key) {
        return entries.containsKey(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(Symbol.of(key));
    }

    /**
     * Unconditional write, overwriting any existing value.
     */
    public Object put(Symbol key, Object value) {
        Object normalized = Nothing.normalize(value);
        entries.put(key, normalized);
        return normalized;
    }

    public AttributeMap with(String key, Object value) {
        put(Symbol.of(key), value);
        return this;
    }

    /**
     * Returns the value already stored under {@code key}, or stores and returns {@code defaultValue}.
     */
    public Object getOrInsert(Symbol key, Object defaultValue) {
        return entries.computeIfAbsent(key, k -> Nothing.normalize(defaultValue));
    }

    public Object remove(Symbol key) {
        return entries.remove(key);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Set<Symbol> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Map<Symbol, Object> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    public AttributeMap copy() {
        return new AttributeMap(new LinkedHashMap<>(entries));
    }

    /**
     * An immutable copy of the current entries.
     */
    public Map<Symbol, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return entries.equals(((AttributeMap) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "AttributeMap" + entries;
    }
}
