package org.dxworks.adaframe.schema;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed enumeration of concrete syntax node kinds. Every node of a parsed
 * tree carries exactly one of these as its kind for its whole lifetime.
 */
public enum NodeKind implements NodeType {
    COMPILATION_UNIT("CompilationUnit", NodeFamily.ADA_NODE, NodeShape.FIELDS),
    LIBRARY_ITEM("LibraryItem", NodeFamily.ADA_NODE, NodeShape.FIELDS),
    WITH_CLAUSE("WithClause", NodeFamily.ADA_NODE, NodeShape.FIELDS),
    USE_PACKAGE_CLAUSE("UsePackageClause", NodeFamily.ADA_NODE, NodeShape.FIELDS),
    PRAGMA("Pragma", NodeFamily.ADA_NODE, NodeShape.FIELDS),

    SUBP_DECL("SubpDecl", NodeFamily.BASIC_SUBP_DECL, NodeShape.FIELDS),
    SUBP_BODY("SubpBody", NodeFamily.BODY, NodeShape.FIELDS),
    PACKAGE_DECL("PackageDecl", NodeFamily.BASIC_DECL, NodeShape.FIELDS),
    PACKAGE_BODY("PackageBody", NodeFamily.BODY, NodeShape.FIELDS),
    OBJECT_DECL("ObjectDecl", NodeFamily.BASIC_DECL, NodeShape.FIELDS),
    PARAM_SPEC("ParamSpec", NodeFamily.BASIC_DECL, NodeShape.FIELDS),

    SUBP_SPEC("SubpSpec", NodeFamily.ADA_NODE, NodeShape.FIELDS),
    PARAMS("Params", NodeFamily.ADA_NODE, NodeShape.FIELDS),
    DECLARATIVE_PART("DeclarativePart", NodeFamily.BASE_DECLARATIVE_PART, NodeShape.FIELDS),
    PUBLIC_PART("PublicPart", NodeFamily.BASE_DECLARATIVE_PART, NodeShape.FIELDS),
    PRIVATE_PART("PrivatePart", NodeFamily.BASE_DECLARATIVE_PART, NodeShape.FIELDS),
    HANDLED_STMTS("HandledStmts", NodeFamily.ADA_NODE, NodeShape.FIELDS),

    NULL_STMT("NullStmt", NodeFamily.SIMPLE_STMT, NodeShape.FIELDS),
    CALL_STMT("CallStmt", NodeFamily.SIMPLE_STMT, NodeShape.FIELDS),
    ASSIGN_STMT("AssignStmt", NodeFamily.SIMPLE_STMT, NodeShape.FIELDS),
    RETURN_STMT("ReturnStmt", NodeFamily.SIMPLE_STMT, NodeShape.FIELDS),

    IDENTIFIER("Identifier", NodeFamily.BASE_ID, NodeShape.TOKEN),
    STRING_LITERAL("StringLiteral", NodeFamily.BASE_ID, NodeShape.TOKEN),
    CHAR_LITERAL("CharLiteral", NodeFamily.BASE_ID, NodeShape.TOKEN),
    INT_LITERAL("IntLiteral", NodeFamily.NUM_LITERAL, NodeShape.TOKEN),
    NULL_LITERAL("NullLiteral", NodeFamily.SINGLE_TOK_NODE, NodeShape.TOKEN),
    DOTTED_NAME("DottedName", NodeFamily.NAME, NodeShape.FIELDS),
    CALL_EXPR("CallExpr", NodeFamily.NAME, NodeShape.FIELDS),
    BIN_OP("BinOp", NodeFamily.EXPR, NodeShape.FIELDS),
    UN_OP("UnOp", NodeFamily.EXPR, NodeShape.FIELDS),
    PAREN_EXPR("ParenExpr", NodeFamily.EXPR, NodeShape.FIELDS),

    LIMITED_ABSENT("LimitedAbsent", NodeFamily.LIMITED, false),
    LIMITED_PRESENT("LimitedPresent", NodeFamily.LIMITED, true),
    PRIVATE_ABSENT("PrivateAbsent", NodeFamily.PRIVATE, false),
    PRIVATE_PRESENT("PrivatePresent", NodeFamily.PRIVATE, true),
    ALIASED_ABSENT("AliasedAbsent", NodeFamily.ALIASED, false),
    ALIASED_PRESENT("AliasedPresent", NodeFamily.ALIASED, true),
    CONSTANT_ABSENT("ConstantAbsent", NodeFamily.CONSTANT, false),
    CONSTANT_PRESENT("ConstantPresent", NodeFamily.CONSTANT, true),

    OVERRIDING_NOT_OVERRIDING("OverridingNotOverriding", NodeFamily.OVERRIDING, NodeShape.FIELDS),
    OVERRIDING_OVERRIDING("OverridingOverriding", NodeFamily.OVERRIDING, NodeShape.FIELDS),
    OVERRIDING_UNSPECIFIED("OverridingUnspecified", NodeFamily.OVERRIDING, NodeShape.FIELDS),
    SUBP_KIND_PROCEDURE("SubpKindProcedure", NodeFamily.SUBP_KIND, NodeShape.FIELDS),
    SUBP_KIND_FUNCTION("SubpKindFunction", NodeFamily.SUBP_KIND, NodeShape.FIELDS),
    MODE_DEFAULT("ModeDefault", NodeFamily.MODE, NodeShape.FIELDS),
    MODE_IN("ModeIn", NodeFamily.MODE, NodeShape.FIELDS),
    MODE_OUT("ModeOut", NodeFamily.MODE, NodeShape.FIELDS),
    MODE_IN_OUT("ModeInOut", NodeFamily.MODE, NodeShape.FIELDS),

    OP_AND("OpAnd", NodeFamily.OP, NodeShape.FIELDS),
    OP_OR("OpOr", NodeFamily.OP, NodeShape.FIELDS),
    OP_EQ("OpEq", NodeFamily.OP, NodeShape.FIELDS),
    OP_NEQ("OpNeq", NodeFamily.OP, NodeShape.FIELDS),
    OP_LT("OpLt", NodeFamily.OP, NodeShape.FIELDS),
    OP_LTE("OpLte", NodeFamily.OP, NodeShape.FIELDS),
    OP_GT("OpGt", NodeFamily.OP, NodeShape.FIELDS),
    OP_GTE("OpGte", NodeFamily.OP, NodeShape.FIELDS),
    OP_PLUS("OpPlus", NodeFamily.OP, NodeShape.FIELDS),
    OP_MINUS("OpMinus", NodeFamily.OP, NodeShape.FIELDS),
    OP_CONCAT("OpConcat", NodeFamily.OP, NodeShape.FIELDS),
    OP_MULT("OpMult", NodeFamily.OP, NodeShape.FIELDS),
    OP_DIV("OpDiv", NodeFamily.OP, NodeShape.FIELDS),

    // Lists come last so that their element kinds are already initialized.
    ADA_NODE_LIST("AdaNodeList", NodeFamily.ADA_NODE),
    NAME_LIST("NameList", NodeFamily.NAME),
    EXPR_LIST("ExprList", NodeFamily.EXPR),
    PRAGMA_LIST("PragmaList", PRAGMA),
    PARAM_SPEC_LIST("ParamSpecList", PARAM_SPEC),
    IDENTIFIER_LIST("IdentifierList", IDENTIFIER),
    STMT_LIST("StmtList", NodeFamily.STMT);

    private static final Map<String, NodeKind> BY_KIND_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(NodeKind::kindName, Function.identity()));

    private final String kindName;
    private final NodeFamily parent;
    private final NodeShape shape;
    private final NodeType elementType;
    private final Boolean qualifierValue;

    NodeKind(String kindName, NodeFamily parent, NodeShape shape) {
        this(kindName, parent, shape, null, null);
    }

    NodeKind(String kindName, NodeFamily qualifierFamily, boolean qualifierValue) {
        this(kindName, qualifierFamily, NodeShape.FIELDS, null, qualifierValue);
    }

    NodeKind(String kindName, NodeType elementType) {
        this(kindName, NodeFamily.ADA_LIST, NodeShape.LIST, elementType, null);
    }

    NodeKind(String kindName, NodeFamily parent, NodeShape shape, NodeType elementType, Boolean qualifierValue) {
        this.kindName = kindName;
        this.parent = parent;
        this.shape = shape;
        this.elementType = elementType;
        this.qualifierValue = qualifierValue;
    }

    @Override
    public String kindName() {
        return kindName;
    }

    @Override
    public NodeFamily parent() {
        return parent;
    }

    public NodeShape shape() {
        return shape;
    }

    public boolean isList() {
        return shape == NodeShape.LIST;
    }

    public boolean isTokenNode() {
        return shape == NodeShape.TOKEN;
    }

    /**
     * Type every child of a list kind must conform to; {@code null} for non-list kinds.
     */
    public NodeType elementType() {
        return elementType;
    }

    public boolean isQualifier() {
        return qualifierValue != null;
    }

    /**
     * The boolean a qualifier kind stands for.
     *
     * @throws IllegalStateException if this kind is not a qualifier kind
     */
    public boolean qualifierValue() {
        if (qualifierValue == null) {
            throw new IllegalStateException(kindName + " is not a qualifier kind");
        }
        return qualifierValue;
    }

    /**
     * Fields this kind declares (own and inherited), in offset order.
     */
    public List<Field> fields() {
        return Field.declaredOn(this);
    }

    /**
     * Number of generic children of a {@link NodeShape#FIELDS} kind; -1 for lists, 0 for token kinds.
     */
    public int arity() {
        switch (shape) {
            case FIELDS:
                return fields().size();
            case TOKEN:
                return 0;
            default:
                return -1;
        }
    }

    public static Optional<NodeKind> fromKindName(String kindName) {
        return Optional.ofNullable(BY_KIND_NAME.get(kindName));
    }

    /**
     * All concrete kinds that belong to the given type, in declaration order.
     */
    public static List<NodeKind> membersOf(NodeType type) {
        return Collections.unmodifiableList(Arrays.stream(values())
                .filter(k -> k.isA(type))
                .collect(Collectors.toList()));
    }
}
