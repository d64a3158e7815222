package org.plotrecipes.transformer;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.plotrecipes.RecipeTransformException;
import org.plotrecipes.ast.Node;
import org.plotrecipes.ast.NodeKind;
import org.plotrecipes.ast.Nodes;
import org.plotrecipes.runtime.Symbol;

/**
 * Rewrites attribute-set statements into attribute map operations, walking the tree in place.
 * <p>
 * {@code key --> value} only fills in a missing key; {@code key := value} and the {@code force} flag overwrite.
 * {@code quiet} skips keys the backend does not support and {@code require} fails on them. Series blocks are
 * handed to the {@link SeriesBlockExtractor}. Call arguments are never walked, so data expressions that merely
 * look like attribute-set statements survive untouched.
 */
public class AttributeRewriter {

    private final SeriesBlockExtractor seriesBlockExtractor = new SeriesBlockExtractor(this);

    /**
     * Rewrites every child of {@code node}, in order.
     */
    public void rewrite(Node node) {
        List<Node> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            Node rewritten = rewriteStatement(child);
            if (rewritten != child) {
                children.set(i, rewritten);
            }
        }
    }

    Node rewriteStatement(Node e) {
        if (e.kind().isLeaf()) {
            return e;
        }

        Set<AttributeFlag> flags = EnumSet.noneOf(AttributeFlag.class);
        if (isFlaggedStatement(e)) {
            for (Node flag : e.children().subList(1, e.size())) {
                AttributeFlag.fromNode(flag).ifPresent(flags::add);
            }
            e = e.child(0);
        }

        if (e.is(NodeKind.FORCE_SET)) {
            flags.add(AttributeFlag.FORCE);
        }

        if (e.is(NodeKind.ATTRIBUTE_SET) || e.is(NodeKind.FORCE_SET)) {
            return rewriteAttributeSet(e, flags);
        }
        if (e.is(NodeKind.SERIES)) {
            return seriesBlockExtractor.extract(e);
        }
        if (!e.is(NodeKind.CALL)) {
            rewrite(e);
        }
        return e;
    }

    private static boolean isFlaggedStatement(Node e) {
        return e.is(NodeKind.TUPLE) && e.size() > 0
                && (e.child(0).is(NodeKind.ATTRIBUTE_SET) || e.child(0).is(NodeKind.FORCE_SET));
    }

    private Node rewriteAttributeSet(Node e, Set<AttributeFlag> flags) {
        if (e.size() != 2) {
            throw new RecipeTransformException("Attribute-set statement needs exactly a key and a value: " + e,
                                               e.toString());
        }
        Node key = attributeKey(e.child(0));
        Node value = e.child(1);

        NodeKind writeKind = flags.contains(AttributeFlag.FORCE) ? NodeKind.MAP_PUT : NodeKind.MAP_GET_OR_INSERT;
        Node write = Node.of(writeKind, Nodes.sym(GeneratedNames.ATTRIBUTES), key, value);

        if (flags.contains(AttributeFlag.REQUIRE)) {
            return Nodes.ifThenElse(Node.of(NodeKind.KEY_SUPPORTED, key.deepCopy()),
                                    write,
                                    Node.of(NodeKind.FAIL_UNSUPPORTED, key.deepCopy()));
        }
        if (flags.contains(AttributeFlag.QUIET)) {
            return Nodes.ifThenElse(Node.of(NodeKind.KEY_SUPPORTED, key.deepCopy()), write, Nodes.nothing());
        }
        return write;
    }

    private static Node attributeKey(Node key) {
        if (key.is(NodeKind.SYMBOL)) {
            return Node.leaf(NodeKind.QUOTE, Symbol.of(keyName(key, key.name())));
        }
        if (key.is(NodeKind.QUOTE)) {
            return key;
        }
        if (key.is(NodeKind.LITERAL) && key.value() instanceof String) {
            return Node.leaf(NodeKind.QUOTE, Symbol.of(keyName(key, (String) key.value())));
        }
        throw new RecipeTransformException("Attribute key must be a name, got: " + key, key.toString());
    }

    private static String keyName(Node key, String name) {
        if (name.isEmpty()) {
            throw new RecipeTransformException("Attribute key must not be empty", key.toString());
        }
        return name;
    }
}
