package org.plotrecipes.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.plotrecipes.runtime.Nothing;
import org.plotrecipes.runtime.Symbol;

/**
 * A recipe tree node: a kind tag, an ordered list of children and, for leaves, a value.
 * <p>
 * The child list is mutable; the transformer rewrites blocks in place. Leaf values are a {@link String} name for
 * {@link NodeKind#SYMBOL}, a {@link Symbol} for {@link NodeKind#QUOTE}, and a literal (number, string, boolean or
 * {@link Nothing#NOTHING}) for {@link NodeKind#LITERAL}.
 */
public final class Node {

    private final NodeKind kind;
    private final Object value;
    private final List<Node> children;

    private Node(NodeKind kind, Object value, List<Node> children) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = value;
        this.children = children;
    }

    public static Node of(NodeKind kind, Node... children) {
        return of(kind, Arrays.asList(children));
    }

    public static Node of(NodeKind kind, List<Node> children) {
        if (kind.isLeaf()) {
            throw new IllegalArgumentException(kind + " is a leaf kind");
        }
        for (Node child : children) {
            Objects.requireNonNull(child, "child of " + kind);
        }
        return new Node(kind, null, new ArrayList<>(children));
    }

    public static Node leaf(NodeKind kind, Object value) {
        if (!kind.isLeaf()) {
            throw new IllegalArgumentException(kind + " is not a leaf kind");
        }
        return new Node(kind, value, new ArrayList<>());
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean is(NodeKind kind) {
        return this.kind == kind;
    }

    public Object value() {
        return value;
    }

    /**
     * The name of a {@link NodeKind#SYMBOL} leaf.
     */
    public String name() {
        if (kind != NodeKind.SYMBOL) {
            throw new IllegalStateException("Not a symbol: " + this);
        }
        return (String) value;
    }

    public List<Node> children() {
        return children;
    }

    public Node child(int index) {
        return children.get(index);
    }

    public int size() {
        return children.size();
    }

    public Node setChild(int index, Node child) {
        return children.set(index, Objects.requireNonNull(child));
    }

    public Node deepCopy() {
        if (kind.isLeaf()) {
            return new Node(kind, value, new ArrayList<>());
        }
        List<Node> copies = new ArrayList<>(children.size());
        for (Node child : children) {
            copies.add(child.deepCopy());
        }
        return new Node(kind, null, copies);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Node node = (Node) o;
        return kind == node.kind && Objects.equals(value, node.value) && children.equals(node.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, children);
    }

    @Override
    public String toString() {
        switch (kind) {
            case SYMBOL:
                return (String) value;
            case QUOTE:
                return String.valueOf(value);
            case LITERAL:
                return value instanceof String ? '"' + (String) value + '"' : String.valueOf(value);
            default:
                StringBuilder sb = new StringBuilder("(").append(kind.label());
                for (Node child : children) {
                    sb.append(' ').append(child);
                }
                return sb.append(')').toString();
        }
    }
}
