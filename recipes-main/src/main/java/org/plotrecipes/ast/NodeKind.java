package org.plotrecipes.ast;

/**
 * Tag of a {@link Node}. Surface kinds describe recipe definitions as written; generated kinds are produced
 * only by the transformer and describe attribute map operations.
 */
public enum NodeKind {

    // leaves
    LITERAL("literal", false),
    SYMBOL("symbol", false),
    QUOTE("quote", false),

    // expressions and statements
    CALL("call", false),
    TUPLE("tuple", false),
    PAIR("=>", false),
    BLOCK("block", false),
    IF("if", false),
    FOR("for", false),
    WHILE("while", false),
    ASSIGN("=", false),

    // definitions
    FUNCTION("function", false),
    PARAMETERS("parameters", false),
    KW("kw", false),
    TYPED("::", false),
    CURLY("curly", false),
    SUBTYPE("<:", false),

    // recipe surface syntax
    ATTRIBUTE_SET("-->", false),
    FORCE_SET(":=", false),
    SERIES("series", false),

    // generated
    LET("let", true),
    MAP_GET_OR_INSERT("get!", true),
    MAP_PUT("setindex!", true),
    MAP_REMOVE("delete!", true),
    MAP_COPY("copy", true),
    KEY_SUPPORTED("supported", true),
    FAIL_UNSUPPORTED("unsupported", true),
    NEW_SERIES_LIST("series_list", true),
    EMIT_SERIES("emit", true),
    IS_SOMETHING("something", true),
    DEBUG_TRACE("trace", true);

    private final String label;
    private final boolean generated;

    NodeKind(String label, boolean generated) {
        this.label = label;
        this.generated = generated;
    }

    public String label() {
        return label;
    }

    public boolean isGenerated() {
        return generated;
    }

    public boolean isLeaf() {
        return this == LITERAL || this == SYMBOL || this == QUOTE;
    }
}
