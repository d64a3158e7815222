package org.plotrecipes.runtime;

public record Pair(Object key, Object value) {

    @Override
    public String toString() {
        return key + " => " + value;
    }
}
