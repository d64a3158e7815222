package org.plotrecipes.transformer;

import java.util.ArrayList;
import java.util.List;

import org.plotrecipes.RecipeSignatureException;
import org.plotrecipes.ast.Node;
import org.plotrecipes.ast.NodeKind;
import org.plotrecipes.ast.Nodes;

/**
 * Wraps a rewritten recipe body into the generated function: debug trace, keyword defaults, cleanup of keywords
 * the backend does not support, series collection and the final main-body series.
 */
public class CodeAssembler {

    static final String ANY = "Any";

    public GeneratedRecipe assemble(RecipeSignature signature, Node body) {
        List<Node> statements = new ArrayList<>();

        List<Node> traced = new ArrayList<>();
        for (RecipeParameter parameter : signature.positional()) {
            traced.add(Nodes.sym(parameter.name()));
        }
        statements.add(Node.of(NodeKind.DEBUG_TRACE, traced));

        for (KeywordParameter keyword : signature.keywords()) {
            statements.add(Nodes.assign(keyword.name(),
                                        Node.of(NodeKind.MAP_GET_OR_INSERT,
                                                Nodes.sym(GeneratedNames.ATTRIBUTES),
                                                Nodes.quote(keyword.name()),
                                                keyword.defaultValue().deepCopy())));
        }
        for (KeywordParameter keyword : signature.keywords()) {
            statements.add(Nodes.ifThenElse(Node.of(NodeKind.KEY_SUPPORTED, Nodes.quote(keyword.name())),
                                            Nodes.nothing(),
                                            Node.of(NodeKind.MAP_REMOVE,
                                                    Nodes.sym(GeneratedNames.ATTRIBUTES),
                                                    Nodes.quote(keyword.name()))));
        }

        statements.add(Nodes.assign(GeneratedNames.SERIES_LIST, Node.of(NodeKind.NEW_SERIES_LIST)));
        statements.add(Nodes.assign(GeneratedNames.RESULT, body));
        statements.add(Nodes.ifThen(Node.of(NodeKind.IS_SOMETHING, Nodes.sym(GeneratedNames.RESULT)),
                                    Node.of(NodeKind.EMIT_SERIES,
                                            Nodes.sym(GeneratedNames.SERIES_LIST),
                                            Nodes.sym(GeneratedNames.ATTRIBUTES),
                                            Nodes.sym(GeneratedNames.RESULT))));
        statements.add(Nodes.sym(GeneratedNames.SERIES_LIST));

        return new GeneratedRecipe(signature.name(),
                                   signature.target(),
                                   signature.typeParameters(),
                                   signature.positional(),
                                   signature.keywords(),
                                   dispatchTypes(signature),
                                   required(signature),
                                   Node.of(NodeKind.BLOCK, statements));
    }

    /**
     * Type expressions to dispatch on, with each type parameter replaced by its bound ({@code Any} if unbounded).
     */
    List<Node> dispatchTypes(RecipeSignature signature) {
        List<Node> types = new ArrayList<>();
        for (RecipeParameter parameter : signature.positional()) {
            Node type = parameter.type();
            if (type == null) {
                types.add(Nodes.sym(ANY));
                continue;
            }
            TypeParameter typeParameter = typeParameter(signature, type);
            if (typeParameter != null) {
                types.add(typeParameter.bound() == null ? Nodes.sym(ANY) : typeParameter.bound());
            } else {
                types.add(type);
            }
        }
        return types;
    }

    private static TypeParameter typeParameter(RecipeSignature signature, Node type) {
        if (!type.is(NodeKind.SYMBOL)) {
            return null;
        }
        for (TypeParameter typeParameter : signature.typeParameters()) {
            if (typeParameter.name().equals(type.name())) {
                return typeParameter;
            }
        }
        return null;
    }

    private static int required(RecipeSignature signature) {
        int required = 0;
        boolean seenOptional = false;
        for (RecipeParameter parameter : signature.positional()) {
            if (parameter.isOptional()) {
                seenOptional = true;
            } else if (seenOptional) {
                throw new RecipeSignatureException("Parameter '" + parameter.name() + "' without a default follows an optional parameter",
                                                   signature.target().toString());
            } else {
                required++;
            }
        }
        return required;
    }
}
