package org.plotrecipes.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable ordered list of positional values, the data half of a {@link RecipeData}.
 */
public final class Tuple implements Iterable<Object> {

    public static final Tuple EMPTY = new Tuple(Collections.emptyList());

    private final List<Object> values;

    private Tuple(List<Object> values) {
        this.values = values;
    }

    public static Tuple of(Object... values) {
        if (values.length == 0) {
            return EMPTY;
        }
        List<Object> copy = new ArrayList<>(values.length);
        for (Object value : values) {
            copy.add(Nothing.normalize(value));
        }
        return new Tuple(Collections.unmodifiableList(copy));
    }

    /**
     * Tuples pass through unchanged, any other value becomes a one-element tuple.
     */
    public static Tuple wrap(Object value) {
        if (value instanceof Tuple) {
            return (Tuple) value;
        }
        return of(value);
    }

    public int size() {
        return values.size();
    }

    public Object get(int index) {
        return values.get(index);
    }

    public List<Object> asList() {
        return values;
    }

    @Override
    public Iterator<Object> iterator() {
        return values.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return values.equals(((Tuple) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        if (values.size() == 1) {
            return "(" + values.get(0) + ",)";
        }
        return values.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
