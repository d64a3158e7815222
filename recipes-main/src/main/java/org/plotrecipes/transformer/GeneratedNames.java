package org.plotrecipes.transformer;

/**
 * Variable names used by generated code. Names starting with {@code #} cannot be written in recipe source.
 */
public final class GeneratedNames {

    /** The attribute map parameter; recipe code may read it by this name. */
    public static final String ATTRIBUTES = "plotattributes";

    public static final String SERIES_LIST = "#series_list";
    public static final String SERIES_ARGS = "#series_args";
    public static final String RESULT = "#result";
    public static final String ANONYMOUS_ARG = "#arg";

    private GeneratedNames() {
    }

    public static boolean isGenerated(String name) {
        return name.startsWith("#");
    }
}
