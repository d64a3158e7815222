package org.plotrecipes.transformer;

import org.plotrecipes.ast.Node;
import org.plotrecipes.ast.NodeKind;
import org.plotrecipes.ast.Nodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transforms a recipe definition into a {@link GeneratedRecipe}. The input tree is left untouched; all rewriting
 * happens on a copy.
 */
public class RecipeTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(RecipeTransformer.class);

    private final SignatureAnalyzer signatureAnalyzer = new SignatureAnalyzer();
    private final AttributeRewriter attributeRewriter = new AttributeRewriter();
    private final CodeAssembler codeAssembler = new CodeAssembler();

    public GeneratedRecipe transform(Node definition) {
        Node copy = definition.deepCopy();
        RecipeSignature signature = signatureAnalyzer.analyze(copy);

        Node body = copy.child(1);
        if (!body.is(NodeKind.BLOCK)) {
            body = Nodes.block(body);
        }
        attributeRewriter.rewrite(body);

        GeneratedRecipe recipe = codeAssembler.assemble(signature, body);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Transformed recipe '{}' {}: {}", recipe.name(), recipe.dispatchTypes(), recipe.body());
        }
        return recipe;
    }
}
