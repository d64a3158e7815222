package org.plotrecipes.transformer;

import org.plotrecipes.RecipeTransformException;
import org.plotrecipes.ast.Node;
import org.plotrecipes.ast.NodeKind;
import org.plotrecipes.ast.Nodes;

/**
 * Turns a series block into a fork of the attribute map that records its own series:
 * <pre>
 * let plotattributes = copy(plotattributes)
 *     #series_args = &lt;rewritten block&gt;
 *     emit(#series_list, plotattributes, #series_args)
 *     nothing
 * end
 * </pre>
 * The block is rewritten completely, nested blocks included, before the fork is built.
 */
public class SeriesBlockExtractor {

    private final AttributeRewriter attributeRewriter;

    public SeriesBlockExtractor(AttributeRewriter attributeRewriter) {
        this.attributeRewriter = attributeRewriter;
    }

    public Node extract(Node series) {
        if (!series.is(NodeKind.SERIES) || series.size() != 1) {
            throw new RecipeTransformException("Series block must wrap exactly one block: " + series,
                                               series.toString());
        }
        Node body = series.child(0);
        if (!body.is(NodeKind.BLOCK)) {
            body = Nodes.block(body);
        }
        attributeRewriter.rewrite(body);

        return Node.of(NodeKind.LET,
                       Nodes.sym(GeneratedNames.ATTRIBUTES),
                       Node.of(NodeKind.MAP_COPY, Nodes.sym(GeneratedNames.ATTRIBUTES)),
                       Nodes.block(
                               Nodes.assign(GeneratedNames.SERIES_ARGS, body),
                               Node.of(NodeKind.EMIT_SERIES,
                                       Nodes.sym(GeneratedNames.SERIES_LIST),
                                       Nodes.sym(GeneratedNames.ATTRIBUTES),
                                       Nodes.sym(GeneratedNames.SERIES_ARGS)),
                               Nodes.nothing()));
    }
}
