package org.dxworks.adaframe.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Named node-valued fields of the schema. A field is declared on an owner type
 * and maps to a fixed child offset in every concrete kind that is a member of
 * that owner.
 */
public enum Field {
    COMPILATION_UNIT_F_PRELUDE(NodeKind.COMPILATION_UNIT, "prelude", 0, NodeKind.ADA_NODE_LIST, false),
    COMPILATION_UNIT_F_BODY(NodeKind.COMPILATION_UNIT, "body", 1, NodeKind.LIBRARY_ITEM, false),
    COMPILATION_UNIT_F_PRAGMAS(NodeKind.COMPILATION_UNIT, "pragmas", 2, NodeKind.PRAGMA_LIST, false),

    LIBRARY_ITEM_F_HAS_PRIVATE(NodeKind.LIBRARY_ITEM, "has_private", 0, NodeFamily.PRIVATE, false),
    LIBRARY_ITEM_F_ITEM(NodeKind.LIBRARY_ITEM, "item", 1, NodeFamily.BASIC_DECL, false),

    WITH_CLAUSE_F_HAS_LIMITED(NodeKind.WITH_CLAUSE, "has_limited", 0, NodeFamily.LIMITED, false),
    WITH_CLAUSE_F_HAS_PRIVATE(NodeKind.WITH_CLAUSE, "has_private", 1, NodeFamily.PRIVATE, false),
    WITH_CLAUSE_F_PACKAGES(NodeKind.WITH_CLAUSE, "packages", 2, NodeKind.NAME_LIST, false),

    USE_PACKAGE_CLAUSE_F_PACKAGES(NodeKind.USE_PACKAGE_CLAUSE, "packages", 0, NodeKind.NAME_LIST, false),

    PRAGMA_F_ID(NodeKind.PRAGMA, "id", 0, NodeKind.IDENTIFIER, false),
    PRAGMA_F_ARGS(NodeKind.PRAGMA, "args", 1, NodeKind.EXPR_LIST, false),

    SUBP_DECL_F_OVERRIDING(NodeKind.SUBP_DECL, "overriding", 0, NodeFamily.OVERRIDING, false),
    SUBP_DECL_F_SUBP_SPEC(NodeKind.SUBP_DECL, "subp_spec", 1, NodeKind.SUBP_SPEC, false),

    SUBP_BODY_F_OVERRIDING(NodeKind.SUBP_BODY, "overriding", 0, NodeFamily.OVERRIDING, false),
    SUBP_BODY_F_SUBP_SPEC(NodeKind.SUBP_BODY, "subp_spec", 1, NodeKind.SUBP_SPEC, false),
    SUBP_BODY_F_DECLS(NodeKind.SUBP_BODY, "decls", 2, NodeKind.DECLARATIVE_PART, false),
    SUBP_BODY_F_STMTS(NodeKind.SUBP_BODY, "stmts", 3, NodeKind.HANDLED_STMTS, false),
    SUBP_BODY_F_END_NAME(NodeKind.SUBP_BODY, "end_name", 4, NodeFamily.NAME, true),

    SUBP_SPEC_F_SUBP_KIND(NodeKind.SUBP_SPEC, "subp_kind", 0, NodeFamily.SUBP_KIND, false),
    SUBP_SPEC_F_SUBP_NAME(NodeKind.SUBP_SPEC, "subp_name", 1, NodeFamily.NAME, false),
    SUBP_SPEC_F_SUBP_PARAMS(NodeKind.SUBP_SPEC, "subp_params", 2, NodeKind.PARAMS, true),
    SUBP_SPEC_F_SUBP_RETURNS(NodeKind.SUBP_SPEC, "subp_returns", 3, NodeFamily.NAME, true),

    PARAMS_F_PARAMS(NodeKind.PARAMS, "params", 0, NodeKind.PARAM_SPEC_LIST, false),

    PARAM_SPEC_F_IDS(NodeKind.PARAM_SPEC, "ids", 0, NodeKind.IDENTIFIER_LIST, false),
    PARAM_SPEC_F_HAS_ALIASED(NodeKind.PARAM_SPEC, "has_aliased", 1, NodeFamily.ALIASED, false),
    PARAM_SPEC_F_MODE(NodeKind.PARAM_SPEC, "mode", 2, NodeFamily.MODE, false),
    PARAM_SPEC_F_TYPE_EXPR(NodeKind.PARAM_SPEC, "type_expr", 3, NodeFamily.NAME, false),
    PARAM_SPEC_F_DEFAULT_EXPR(NodeKind.PARAM_SPEC, "default_expr", 4, NodeFamily.EXPR, true),

    PACKAGE_DECL_F_PACKAGE_NAME(NodeKind.PACKAGE_DECL, "package_name", 0, NodeFamily.NAME, false),
    PACKAGE_DECL_F_PUBLIC_PART(NodeKind.PACKAGE_DECL, "public_part", 1, NodeKind.PUBLIC_PART, false),
    PACKAGE_DECL_F_PRIVATE_PART(NodeKind.PACKAGE_DECL, "private_part", 2, NodeKind.PRIVATE_PART, true),
    PACKAGE_DECL_F_END_NAME(NodeKind.PACKAGE_DECL, "end_name", 3, NodeFamily.NAME, true),

    PACKAGE_BODY_F_PACKAGE_NAME(NodeKind.PACKAGE_BODY, "package_name", 0, NodeFamily.NAME, false),
    PACKAGE_BODY_F_DECLS(NodeKind.PACKAGE_BODY, "decls", 1, NodeKind.DECLARATIVE_PART, false),
    PACKAGE_BODY_F_STMTS(NodeKind.PACKAGE_BODY, "stmts", 2, NodeKind.HANDLED_STMTS, true),
    PACKAGE_BODY_F_END_NAME(NodeKind.PACKAGE_BODY, "end_name", 3, NodeFamily.NAME, true),

    OBJECT_DECL_F_IDS(NodeKind.OBJECT_DECL, "ids", 0, NodeKind.IDENTIFIER_LIST, false),
    OBJECT_DECL_F_HAS_ALIASED(NodeKind.OBJECT_DECL, "has_aliased", 1, NodeFamily.ALIASED, false),
    OBJECT_DECL_F_HAS_CONSTANT(NodeKind.OBJECT_DECL, "has_constant", 2, NodeFamily.CONSTANT, false),
    OBJECT_DECL_F_TYPE_EXPR(NodeKind.OBJECT_DECL, "type_expr", 3, NodeFamily.NAME, true),
    OBJECT_DECL_F_DEFAULT_EXPR(NodeKind.OBJECT_DECL, "default_expr", 4, NodeFamily.EXPR, true),

    DECLARATIVE_PART_F_DECLS(NodeFamily.BASE_DECLARATIVE_PART, "decls", 0, NodeKind.ADA_NODE_LIST, false),

    HANDLED_STMTS_F_STMTS(NodeKind.HANDLED_STMTS, "stmts", 0, NodeKind.STMT_LIST, false),

    CALL_STMT_F_CALL(NodeKind.CALL_STMT, "call", 0, NodeFamily.NAME, false),

    ASSIGN_STMT_F_DEST(NodeKind.ASSIGN_STMT, "dest", 0, NodeFamily.NAME, false),
    ASSIGN_STMT_F_EXPR(NodeKind.ASSIGN_STMT, "expr", 1, NodeFamily.EXPR, false),

    RETURN_STMT_F_RETURN_EXPR(NodeKind.RETURN_STMT, "return_expr", 0, NodeFamily.EXPR, true),

    DOTTED_NAME_F_PREFIX(NodeKind.DOTTED_NAME, "prefix", 0, NodeFamily.NAME, false),
    DOTTED_NAME_F_SUFFIX(NodeKind.DOTTED_NAME, "suffix", 1, NodeFamily.BASE_ID, false),

    CALL_EXPR_F_NAME(NodeKind.CALL_EXPR, "name", 0, NodeFamily.NAME, false),
    CALL_EXPR_F_SUFFIX(NodeKind.CALL_EXPR, "suffix", 1, NodeKind.EXPR_LIST, false),

    BIN_OP_F_LEFT(NodeKind.BIN_OP, "left", 0, NodeFamily.EXPR, false),
    BIN_OP_F_OP(NodeKind.BIN_OP, "op", 1, NodeFamily.OP, false),
    BIN_OP_F_RIGHT(NodeKind.BIN_OP, "right", 2, NodeFamily.EXPR, false),

    UN_OP_F_OP(NodeKind.UN_OP, "op", 0, NodeFamily.OP, false),
    UN_OP_F_EXPR(NodeKind.UN_OP, "expr", 1, NodeFamily.EXPR, false),

    PAREN_EXPR_F_EXPR(NodeKind.PAREN_EXPR, "expr", 0, NodeFamily.EXPR, false);

    private static final Map<NodeKind, List<Field>> BY_KIND = indexByKind();

    private final NodeType owner;
    private final String fieldName;
    private final int index;
    private final NodeType valueType;
    private final boolean optional;

    Field(NodeType owner, String fieldName, int index, NodeType valueType, boolean optional) {
        this.owner = owner;
        this.fieldName = fieldName;
        this.index = index;
        this.valueType = valueType;
        this.optional = optional;
    }

    /**
     * Type declaring this field; applicable to every kind that {@link NodeType#isA is a} member of it.
     */
    public NodeType owner() {
        return owner;
    }

    public String fieldName() {
        return fieldName;
    }

    /**
     * Offset of this field in the generic child list of its owner's kinds.
     */
    public int index() {
        return index;
    }

    public NodeType valueType() {
        return valueType;
    }

    /**
     * Whether the syntactic slot may legitimately be empty.
     */
    public boolean isOptional() {
        return optional;
    }

    public boolean isApplicableTo(NodeKind kind) {
        return kind != null && kind.isA(owner);
    }

    static List<Field> declaredOn(NodeKind kind) {
        return BY_KIND.getOrDefault(kind, List.of());
    }

    private static Map<NodeKind, List<Field>> indexByKind() {
        Map<NodeKind, List<Field>> result = new EnumMap<>(NodeKind.class);
        for (NodeKind kind : NodeKind.values()) {
            List<Field> fields = new ArrayList<>();
            for (Field field : values()) {
                if (field.isApplicableTo(kind)) {
                    fields.add(field);
                }
            }
            if (!fields.isEmpty()) {
                fields.sort(Comparator.comparingInt(Field::index));
                result.put(kind, Collections.unmodifiableList(fields));
            }
        }
        return result;
    }
}
