package org.plotrecipes;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide debug toggle read at the start of every generated recipe call. When enabled each call traces its
 * positional arguments.
 * <p>
 * The initial value comes from the {@value #DEBUG_PROPERTY} system property. Traces go to the SLF4J logger of this
 * class unless redirected with {@link #traceTo(Consumer)}.
 */
public final class RecipeDebug {

    public static final String DEBUG_PROPERTY = "plotrecipes.debug";

    private static final Logger LOG = LoggerFactory.getLogger(RecipeDebug.class);
    private static final Consumer<String> LOGGER_SINK = LOG::info;

    private static volatile boolean enabled = Boolean.getBoolean(DEBUG_PROPERTY);
    private static volatile Consumer<String> sink = LOGGER_SINK;

    private RecipeDebug() {
    }

    public static void debug() {
        debug(true);
    }

    public static void debug(boolean value) {
        enabled = value;
    }

    public static boolean isEnabled() {
        return enabled;
    }

    /**
     * Redirects trace output; null restores the logger.
     *
     * @return the previous sink
     */
    public static Consumer<String> traceTo(Consumer<String> newSink) {
        Consumer<String> previous = sink;
        sink = newSink == null ? LOGGER_SINK : newSink;
        return previous;
    }

    public static void trace(String message) {
        sink.accept(message);
    }
}
