package org.dxworks.adaframe.ast;

import org.dxworks.adaframe.schema.Field;
import org.dxworks.adaframe.schema.NodeFamily;
import org.dxworks.adaframe.schema.NodeKind;

/**
 * Typed field accessors.
 * <p>
 * Every accessor applies to the kinds that declare the field, derived kinds
 * included. Asking a node of another kind yields a slot that is
 * {@link Slot.State#UNAVAILABLE unavailable} with
 * {@link SlotError#FIELD_NOT_APPLICABLE}; asking an applicable node whose slot
 * is empty yields an {@link Slot.State#EMPTY empty} slot holding
 * {@link Node#NULL}. The two cases are never conflated.
 * <p>
 * All accessors raise {@link InvalidNodeException} when given {@link Node#NULL}
 * or a node whose context has been destroyed.
 */
public final class Fields {

    private Fields() {
        // utility class
    }

    public static Slot<Node> get(Node node, Field field) {
        NodeKind kind = node.kind();
        if (!field.isApplicableTo(kind)) {
            return Slot.unavailable(SlotError.FIELD_NOT_APPLICABLE);
        }
        return node.childAt(field.index());
    }

    /**
     * The token wrapped by a single-token node (identifiers, literals).
     */
    public static Slot<Token> singleTokNodeTok(Node node) {
        if (!node.isA(NodeFamily.SINGLE_TOK_NODE)) {
            return Slot.unavailable(SlotError.FIELD_NOT_APPLICABLE);
        }
        return Slot.present(node.tokenStart());
    }

    public static Slot<Node> compilationUnitPrelude(Node node) {
        return get(node, Field.COMPILATION_UNIT_F_PRELUDE);
    }

    public static Slot<Node> compilationUnitBody(Node node) {
        return get(node, Field.COMPILATION_UNIT_F_BODY);
    }

    public static Slot<Node> compilationUnitPragmas(Node node) {
        return get(node, Field.COMPILATION_UNIT_F_PRAGMAS);
    }

    public static Slot<Node> libraryItemHasPrivate(Node node) {
        return get(node, Field.LIBRARY_ITEM_F_HAS_PRIVATE);
    }

    public static Slot<Node> libraryItemItem(Node node) {
        return get(node, Field.LIBRARY_ITEM_F_ITEM);
    }

    public static Slot<Node> withClauseHasLimited(Node node) {
        return get(node, Field.WITH_CLAUSE_F_HAS_LIMITED);
    }

    public static Slot<Node> withClauseHasPrivate(Node node) {
        return get(node, Field.WITH_CLAUSE_F_HAS_PRIVATE);
    }

    public static Slot<Node> withClausePackages(Node node) {
        return get(node, Field.WITH_CLAUSE_F_PACKAGES);
    }

    public static Slot<Node> usePackageClausePackages(Node node) {
        return get(node, Field.USE_PACKAGE_CLAUSE_F_PACKAGES);
    }

    public static Slot<Node> pragmaId(Node node) {
        return get(node, Field.PRAGMA_F_ID);
    }

    public static Slot<Node> pragmaArgs(Node node) {
        return get(node, Field.PRAGMA_F_ARGS);
    }

    public static Slot<Node> subpDeclOverriding(Node node) {
        return get(node, Field.SUBP_DECL_F_OVERRIDING);
    }

    public static Slot<Node> subpDeclSubpSpec(Node node) {
        return get(node, Field.SUBP_DECL_F_SUBP_SPEC);
    }

    public static Slot<Node> subpBodyOverriding(Node node) {
        return get(node, Field.SUBP_BODY_F_OVERRIDING);
    }

    public static Slot<Node> subpBodySubpSpec(Node node) {
        return get(node, Field.SUBP_BODY_F_SUBP_SPEC);
    }

    public static Slot<Node> subpBodyDecls(Node node) {
        return get(node, Field.SUBP_BODY_F_DECLS);
    }

    public static Slot<Node> subpBodyStmts(Node node) {
        return get(node, Field.SUBP_BODY_F_STMTS);
    }

    /** Empty when the optional {@code end_name} is omitted in the source. */
    public static Slot<Node> subpBodyEndName(Node node) {
        return get(node, Field.SUBP_BODY_F_END_NAME);
    }

    public static Slot<Node> subpSpecSubpKind(Node node) {
        return get(node, Field.SUBP_SPEC_F_SUBP_KIND);
    }

    public static Slot<Node> subpSpecSubpName(Node node) {
        return get(node, Field.SUBP_SPEC_F_SUBP_NAME);
    }

    /** Empty when the optional {@code subp_params} is omitted in the source. */
    public static Slot<Node> subpSpecSubpParams(Node node) {
        return get(node, Field.SUBP_SPEC_F_SUBP_PARAMS);
    }

    /** Empty when the optional {@code subp_returns} is omitted in the source. */
    public static Slot<Node> subpSpecSubpReturns(Node node) {
        return get(node, Field.SUBP_SPEC_F_SUBP_RETURNS);
    }

    public static Slot<Node> paramsParams(Node node) {
        return get(node, Field.PARAMS_F_PARAMS);
    }

    public static Slot<Node> paramSpecIds(Node node) {
        return get(node, Field.PARAM_SPEC_F_IDS);
    }

    public static Slot<Node> paramSpecHasAliased(Node node) {
        return get(node, Field.PARAM_SPEC_F_HAS_ALIASED);
    }

    public static Slot<Node> paramSpecMode(Node node) {
        return get(node, Field.PARAM_SPEC_F_MODE);
    }

    public static Slot<Node> paramSpecTypeExpr(Node node) {
        return get(node, Field.PARAM_SPEC_F_TYPE_EXPR);
    }

    /** Empty when the optional {@code default_expr} is omitted in the source. */
    public static Slot<Node> paramSpecDefaultExpr(Node node) {
        return get(node, Field.PARAM_SPEC_F_DEFAULT_EXPR);
    }

    public static Slot<Node> packageDeclPackageName(Node node) {
        return get(node, Field.PACKAGE_DECL_F_PACKAGE_NAME);
    }

    public static Slot<Node> packageDeclPublicPart(Node node) {
        return get(node, Field.PACKAGE_DECL_F_PUBLIC_PART);
    }

    /** Empty when the optional {@code private_part} is omitted in the source. */
    public static Slot<Node> packageDeclPrivatePart(Node node) {
        return get(node, Field.PACKAGE_DECL_F_PRIVATE_PART);
    }

    /** Empty when the optional {@code end_name} is omitted in the source. */
    public static Slot<Node> packageDeclEndName(Node node) {
        return get(node, Field.PACKAGE_DECL_F_END_NAME);
    }

    public static Slot<Node> packageBodyPackageName(Node node) {
        return get(node, Field.PACKAGE_BODY_F_PACKAGE_NAME);
    }

    public static Slot<Node> packageBodyDecls(Node node) {
        return get(node, Field.PACKAGE_BODY_F_DECLS);
    }

    /** Empty when the optional {@code stmts} is omitted in the source. */
    public static Slot<Node> packageBodyStmts(Node node) {
        return get(node, Field.PACKAGE_BODY_F_STMTS);
    }

    /** Empty when the optional {@code end_name} is omitted in the source. */
    public static Slot<Node> packageBodyEndName(Node node) {
        return get(node, Field.PACKAGE_BODY_F_END_NAME);
    }

    public static Slot<Node> objectDeclIds(Node node) {
        return get(node, Field.OBJECT_DECL_F_IDS);
    }

    public static Slot<Node> objectDeclHasAliased(Node node) {
        return get(node, Field.OBJECT_DECL_F_HAS_ALIASED);
    }

    public static Slot<Node> objectDeclHasConstant(Node node) {
        return get(node, Field.OBJECT_DECL_F_HAS_CONSTANT);
    }

    /** Empty when the optional {@code type_expr} is omitted in the source. */
    public static Slot<Node> objectDeclTypeExpr(Node node) {
        return get(node, Field.OBJECT_DECL_F_TYPE_EXPR);
    }

    /** Empty when the optional {@code default_expr} is omitted in the source. */
    public static Slot<Node> objectDeclDefaultExpr(Node node) {
        return get(node, Field.OBJECT_DECL_F_DEFAULT_EXPR);
    }

    public static Slot<Node> declarativePartDecls(Node node) {
        return get(node, Field.DECLARATIVE_PART_F_DECLS);
    }

    public static Slot<Node> handledStmtsStmts(Node node) {
        return get(node, Field.HANDLED_STMTS_F_STMTS);
    }

    public static Slot<Node> callStmtCall(Node node) {
        return get(node, Field.CALL_STMT_F_CALL);
    }

    public static Slot<Node> assignStmtDest(Node node) {
        return get(node, Field.ASSIGN_STMT_F_DEST);
    }

    public static Slot<Node> assignStmtExpr(Node node) {
        return get(node, Field.ASSIGN_STMT_F_EXPR);
    }

    /** Empty when the optional {@code return_expr} is omitted in the source. */
    public static Slot<Node> returnStmtReturnExpr(Node node) {
        return get(node, Field.RETURN_STMT_F_RETURN_EXPR);
    }

    public static Slot<Node> dottedNamePrefix(Node node) {
        return get(node, Field.DOTTED_NAME_F_PREFIX);
    }

    public static Slot<Node> dottedNameSuffix(Node node) {
        return get(node, Field.DOTTED_NAME_F_SUFFIX);
    }

    public static Slot<Node> callExprName(Node node) {
        return get(node, Field.CALL_EXPR_F_NAME);
    }

    public static Slot<Node> callExprSuffix(Node node) {
        return get(node, Field.CALL_EXPR_F_SUFFIX);
    }

    public static Slot<Node> binOpLeft(Node node) {
        return get(node, Field.BIN_OP_F_LEFT);
    }

    public static Slot<Node> binOpOp(Node node) {
        return get(node, Field.BIN_OP_F_OP);
    }

    public static Slot<Node> binOpRight(Node node) {
        return get(node, Field.BIN_OP_F_RIGHT);
    }

    public static Slot<Node> unOpOp(Node node) {
        return get(node, Field.UN_OP_F_OP);
    }

    public static Slot<Node> unOpExpr(Node node) {
        return get(node, Field.UN_OP_F_EXPR);
    }

    public static Slot<Node> parenExprExpr(Node node) {
        return get(node, Field.PAREN_EXPR_F_EXPR);
    }
}
