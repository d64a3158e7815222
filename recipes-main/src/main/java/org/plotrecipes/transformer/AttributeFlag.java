package org.plotrecipes.transformer;

import java.util.Optional;

import org.plotrecipes.ast.Node;
import org.plotrecipes.ast.NodeKind;
import org.plotrecipes.runtime.Symbol;

/**
 * Trailing flags of an attribute-set statement, {@code key --> value, :quiet, :force}.
 */
public enum AttributeFlag {
    /** Skip the write when the backend does not support the key. */
    QUIET,
    /** Fail when the backend does not support the key. */
    REQUIRE,
    /** Overwrite a value the caller already supplied. */
    FORCE;

    /**
     * Reads a flag from a symbol or quoted symbol; anything else, including unknown names, yields empty.
     */
    public static Optional<AttributeFlag> fromNode(Node node) {
        String name;
        if (node.is(NodeKind.SYMBOL)) {
            name = node.name();
        } else if (node.is(NodeKind.QUOTE)) {
            name = ((Symbol) node.value()).name();
        } else {
            return Optional.empty();
        }
        switch (name) {
            case "quiet":
                return Optional.of(QUIET);
            case "require":
                return Optional.of(REQUIRE);
            case "force":
                return Optional.of(FORCE);
            default:
                return Optional.empty();
        }
    }
}
