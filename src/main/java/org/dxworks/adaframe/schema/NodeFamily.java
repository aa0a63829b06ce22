package org.dxworks.adaframe.schema;

/**
 * Abstract node families. No node has a family as its kind; families only
 * group concrete {@link NodeKind}s for field ownership and kind queries.
 */
public enum NodeFamily implements NodeType {
    ADA_NODE("AdaNode", null, false),
    ADA_LIST("AdaList", ADA_NODE, false),
    BASIC_DECL("BasicDecl", ADA_NODE, false),
    BODY("Body", BASIC_DECL, false),
    BASIC_SUBP_DECL("BasicSubpDecl", BASIC_DECL, false),
    BASE_DECLARATIVE_PART("BaseDeclarativePart", ADA_NODE, false),
    EXPR("Expr", ADA_NODE, false),
    NAME("Name", EXPR, false),
    SINGLE_TOK_NODE("SingleTokNode", NAME, false),
    BASE_ID("BaseId", SINGLE_TOK_NODE, false),
    NUM_LITERAL("NumLiteral", SINGLE_TOK_NODE, false),
    STMT("Stmt", ADA_NODE, false),
    SIMPLE_STMT("SimpleStmt", STMT, false),

    LIMITED("Limited", ADA_NODE, true),
    PRIVATE("Private", ADA_NODE, true),
    ALIASED("Aliased", ADA_NODE, true),
    CONSTANT("Constant", ADA_NODE, true),

    OVERRIDING("Overriding", ADA_NODE, false),
    SUBP_KIND("SubpKind", ADA_NODE, false),
    MODE("Mode", ADA_NODE, false),
    OP("Op", ADA_NODE, false);

    private final String kindName;
    private final NodeFamily parent;
    private final boolean qualifier;

    NodeFamily(String kindName, NodeFamily parent, boolean qualifier) {
        this.kindName = kindName;
        this.parent = parent;
        this.qualifier = qualifier;
    }

    @Override
    public String kindName() {
        return kindName;
    }

    @Override
    public NodeFamily parent() {
        return parent;
    }

    /**
     * Qualifier families encode a boolean through the kind of their members:
     * exactly one "absent" and one "present" kind each.
     */
    public boolean isQualifier() {
        return qualifier;
    }
}
