package org.plotrecipes.transformer;

import org.plotrecipes.ast.Node;

public record KeywordParameter(String name, Node defaultValue) {
}
