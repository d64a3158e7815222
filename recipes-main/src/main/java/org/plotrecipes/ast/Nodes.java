package org.plotrecipes.ast;

import java.util.ArrayList;
import java.util.List;

import org.plotrecipes.runtime.Nothing;
import org.plotrecipes.runtime.Symbol;

/**
 * Factory methods for building recipe trees by hand.
 */
public final class Nodes {

    private Nodes() {
    }

    public static Node literal(Object value) {
        if (value instanceof Integer) {
            value = ((Integer) value).longValue();
        }
        return Node.leaf(NodeKind.LITERAL, Nothing.normalize(value));
    }

    public static Node nothing() {
        return Node.leaf(NodeKind.LITERAL, Nothing.NOTHING);
    }

    public static Node sym(String name) {
        return Node.leaf(NodeKind.SYMBOL, name);
    }

    public static Node quote(String name) {
        return Node.leaf(NodeKind.QUOTE, Symbol.of(name));
    }

    public static Node call(String function, Node... args) {
        List<Node> children = new ArrayList<>();
        children.add(sym(function));
        children.addAll(List.of(args));
        return Node.of(NodeKind.CALL, children);
    }

    public static Node tuple(Node... elements) {
        return Node.of(NodeKind.TUPLE, elements);
    }

    public static Node pair(Node key, Node value) {
        return Node.of(NodeKind.PAIR, key, value);
    }

    public static Node block(Node... statements) {
        return Node.of(NodeKind.BLOCK, statements);
    }

    public static Node ifThen(Node condition, Node then) {
        return Node.of(NodeKind.IF, condition, then);
    }

    public static Node ifThenElse(Node condition, Node then, Node otherwise) {
        return Node.of(NodeKind.IF, condition, then, otherwise);
    }

    public static Node forEach(String variable, Node iterable, Node body) {
        return Node.of(NodeKind.FOR, sym(variable), iterable, body);
    }

    public static Node whileLoop(Node condition, Node body) {
        return Node.of(NodeKind.WHILE, condition, body);
    }

    public static Node assign(String variable, Node value) {
        return Node.of(NodeKind.ASSIGN, sym(variable), value);
    }

    /**
     * {@code key --> value}
     */
    public static Node attr(String key, Node value) {
        return Node.of(NodeKind.ATTRIBUTE_SET, sym(key), value);
    }

    /**
     * {@code key := value}
     */
    public static Node force(String key, Node value) {
        return Node.of(NodeKind.FORCE_SET, sym(key), value);
    }

    /**
     * {@code statement, :flag1, :flag2...}
     */
    public static Node flagged(Node statement, String... flags) {
        List<Node> children = new ArrayList<>();
        children.add(statement);
        for (String flag : flags) {
            children.add(quote(flag));
        }
        return Node.of(NodeKind.TUPLE, children);
    }

    public static Node series(Node... statements) {
        return Node.of(NodeKind.SERIES, block(statements));
    }

    public static Node function(Node signature, Node body) {
        return Node.of(NodeKind.FUNCTION, signature, body);
    }

    /**
     * Call-form signature: {@code target(params...)}.
     */
    public static Node signature(Node target, Node... params) {
        List<Node> children = new ArrayList<>();
        children.add(target);
        children.addAll(List.of(params));
        return Node.of(NodeKind.CALL, children);
    }

    public static Node signature(String name, Node... params) {
        return signature(sym(name), params);
    }

    public static Node parameters(Node... keywords) {
        return Node.of(NodeKind.PARAMETERS, keywords);
    }

    public static Node kw(String name, Node defaultValue) {
        return Node.of(NodeKind.KW, sym(name), defaultValue);
    }

    public static Node kw(Node parameter, Node defaultValue) {
        return Node.of(NodeKind.KW, parameter, defaultValue);
    }

    public static Node typed(String name, String type) {
        return Node.of(NodeKind.TYPED, sym(name), sym(type));
    }

    public static Node typed(String name, Node type) {
        return Node.of(NodeKind.TYPED, sym(name), type);
    }

    /**
     * Anonymous typed parameter, {@code ::T}.
     */
    public static Node typed(String type) {
        return Node.of(NodeKind.TYPED, sym(type));
    }

    public static Node curly(String name, Node... parameters) {
        List<Node> children = new ArrayList<>();
        children.add(sym(name));
        children.addAll(List.of(parameters));
        return Node.of(NodeKind.CURLY, children);
    }

    public static Node subtype(String name, String bound) {
        return Node.of(NodeKind.SUBTYPE, sym(name), sym(bound));
    }
}
