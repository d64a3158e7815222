package org.plotrecipes.runtime;

/**
 * The rendering backend's capability query, consulted for {@code quiet} and {@code require} attributes
 * and for keyword parameter cleanup.
 */
public interface Backend {

    boolean isKeySupported(Symbol key);

    default String name() {
        return getClass().getSimpleName();
    }
}
