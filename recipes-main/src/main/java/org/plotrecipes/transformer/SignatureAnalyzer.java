package org.plotrecipes.transformer;

import java.util.ArrayList;
import java.util.List;

import org.plotrecipes.RecipeSignatureException;
import org.plotrecipes.RecipeTransformException;
import org.plotrecipes.ast.Node;
import org.plotrecipes.ast.NodeKind;

/**
 * Splits a recipe definition's call-form signature into dispatch target, positional parameters and keyword
 * parameters.
 */
public class SignatureAnalyzer {

    public RecipeSignature analyze(Node definition) {
        if (!definition.is(NodeKind.FUNCTION) || definition.size() != 2) {
            throw new RecipeSignatureException("Must wrap a valid function definition", definition.toString());
        }
        Node signature = definition.child(0);
        if (!signature.is(NodeKind.CALL)) {
            throw new RecipeSignatureException("Expected a call-form signature, got: " + signature, signature.toString());
        }
        if (signature.size() < 2) {
            throw new RecipeSignatureException("Missing function arguments... need something to dispatch on!",
                                               signature.toString());
        }

        Node target = signature.child(0);
        String name = targetName(target);
        List<TypeParameter> typeParameters = typeParameters(target);

        List<Node> params = signature.children().subList(1, signature.size());
        List<KeywordParameter> keywords = new ArrayList<>();
        int start = 0;
        if (params.get(0).is(NodeKind.PARAMETERS)) {
            for (Node entry : params.get(0).children()) {
                keywords.add(keyword(entry));
            }
            start = 1;
        }

        List<RecipeParameter> positional = new ArrayList<>();
        for (int i = start; i < params.size(); i++) {
            Node param = params.get(i);
            if (param.is(NodeKind.PARAMETERS)) {
                throw new RecipeSignatureException("Keyword parameters must come first in the parameter list",
                                                   signature.toString());
            }
            positional.add(positional(param, positional.size() + 1));
        }
        return new RecipeSignature(name, target, typeParameters, positional, keywords);
    }

    private String targetName(Node target) {
        if (target.is(NodeKind.SYMBOL)) {
            return target.name();
        }
        if (target.is(NodeKind.CURLY) && target.size() > 0 && target.child(0).is(NodeKind.SYMBOL)) {
            return target.child(0).name();
        }
        throw new RecipeSignatureException("Unsupported dispatch target: " + target, target.toString());
    }

    private List<TypeParameter> typeParameters(Node target) {
        List<TypeParameter> result = new ArrayList<>();
        if (!target.is(NodeKind.CURLY)) {
            return result;
        }
        for (Node param : target.children().subList(1, target.size())) {
            if (param.is(NodeKind.SYMBOL)) {
                result.add(new TypeParameter(param.name(), null));
            } else if (param.is(NodeKind.SUBTYPE) && param.size() == 2 && param.child(0).is(NodeKind.SYMBOL)) {
                result.add(new TypeParameter(param.child(0).name(), param.child(1)));
            } else {
                throw new RecipeSignatureException("Unsupported type parameter: " + param, target.toString());
            }
        }
        return result;
    }

    private KeywordParameter keyword(Node entry) {
        if (!entry.is(NodeKind.KW) || entry.size() != 2 || !entry.child(0).is(NodeKind.SYMBOL)) {
            throw new RecipeTransformException("Keyword parameter must be `name = default`, got: " + entry,
                                               entry.toString());
        }
        return new KeywordParameter(entry.child(0).name(), entry.child(1));
    }

    private RecipeParameter positional(Node param, int position) {
        Node defaultValue = null;
        if (param.is(NodeKind.KW)) {
            if (param.size() != 2) {
                throw new RecipeTransformException("Optional parameter must be `param = default`, got: " + param,
                                                   param.toString());
            }
            defaultValue = param.child(1);
            param = param.child(0);
        }
        if (param.is(NodeKind.SYMBOL)) {
            return new RecipeParameter(param.name(), null, defaultValue);
        }
        if (param.is(NodeKind.TYPED)) {
            if (param.size() == 2 && param.child(0).is(NodeKind.SYMBOL)) {
                return new RecipeParameter(param.child(0).name(), param.child(1), defaultValue);
            }
            if (param.size() == 1) {
                return new RecipeParameter(GeneratedNames.ANONYMOUS_ARG + position, param.child(0), defaultValue);
            }
        }
        throw new RecipeTransformException("Unsupported parameter: " + param, param.toString());
    }
}
