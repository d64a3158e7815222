package org.plotrecipes.transformer;

import org.plotrecipes.ast.Node;

/**
 * A type parameter of the dispatch target, {@code T} or {@code T <: Bound}.
 *
 * @param bound upper bound type expression, or null when unbounded
 */
public record TypeParameter(String name, Node bound) {
}
