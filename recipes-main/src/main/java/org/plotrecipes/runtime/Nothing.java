package org.plotrecipes.runtime;

/**
 * The "no value" sentinel. A recipe body whose trailing value is nothing contributes no main series.
 */
public enum Nothing {
    NOTHING;

    public static Object normalize(Object value) {
        return value == null ? NOTHING : value;
    }

    public static boolean isNothing(Object value) {
        return value == null || value == NOTHING;
    }

    @Override
    public String toString() {
        return "nothing";
    }
}
