package org.plotrecipes.compiler;

@FunctionalInterface
public interface CompiledNode {

    Object eval(Frame frame);
}
