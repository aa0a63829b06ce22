package org.dxworks.adaframe.parser;

import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.dxworks.adaframe.parser.generated.AdaBaseVisitor;
import org.dxworks.adaframe.parser.generated.AdaParser;
import org.dxworks.adaframe.schema.NodeKind;

import java.util.List;

/**
 * Maps an ANTLR parse tree onto the node schema. Every visit method returns
 * the arena index of the node it built, or {@link SyntaxTree#NO_NODE}.
 * <p>
 * Ghost nodes (absent qualifiers, empty lists, default mode, unspecified
 * overriding) are anchored on the token where they would have started and
 * span no token.
 */
class TreeBuilder extends AdaBaseVisitor<Integer> {

    private final CommonTokenStream tokens;
    private final SyntaxTree.Builder tree = SyntaxTree.builder();

    TreeBuilder(CommonTokenStream tokens) {
        this.tokens = tokens;
    }

    SyntaxTree build(AdaParser.CompilationUnitContext unit) {
        return tree.build(visit(unit));
    }

    // --- Compilation unit and context clauses ---

    @Override
    public Integer visitCompilationUnit(AdaParser.CompilationUnitContext ctx) {
        int prelude = list(NodeKind.ADA_NODE_LIST, ctx.contextItem(), start(ctx.libraryItem()));
        int body = visit(ctx.libraryItem());
        int eof = ctx.EOF().getSymbol().getTokenIndex();
        int pragmas = list(NodeKind.PRAGMA_LIST, ctx.pragma(), eof);
        return tree.add(NodeKind.COMPILATION_UNIT, start(ctx), previousOnChannel(eof), prelude, body, pragmas);
    }

    @Override
    public Integer visitContextItem(AdaParser.ContextItemContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public Integer visitWithClause(AdaParser.WithClauseContext ctx) {
        int hasLimited = qualifier(ctx.LIMITED(), NodeKind.LIMITED_PRESENT, NodeKind.LIMITED_ABSENT, start(ctx));
        int hasPrivate = qualifier(ctx.PRIVATE(), NodeKind.PRIVATE_PRESENT, NodeKind.PRIVATE_ABSENT,
                ctx.WITH().getSymbol().getTokenIndex());
        int packages = list(NodeKind.NAME_LIST, ctx.name(), start(ctx));
        return node(NodeKind.WITH_CLAUSE, ctx, hasLimited, hasPrivate, packages);
    }

    @Override
    public Integer visitUseClause(AdaParser.UseClauseContext ctx) {
        int packages = list(NodeKind.NAME_LIST, ctx.name(), start(ctx));
        return node(NodeKind.USE_PACKAGE_CLAUSE, ctx, packages);
    }

    @Override
    public Integer visitPragma(AdaParser.PragmaContext ctx) {
        int id = visit(ctx.identifier());
        int args = list(NodeKind.EXPR_LIST, ctx.expression(), ctx.SEMICOLON().getSymbol().getTokenIndex());
        return node(NodeKind.PRAGMA, ctx, id, args);
    }

    @Override
    public Integer visitLibraryItem(AdaParser.LibraryItemContext ctx) {
        int hasPrivate = qualifier(ctx.PRIVATE(), NodeKind.PRIVATE_PRESENT, NodeKind.PRIVATE_ABSENT,
                start(ctx.libraryUnit()));
        int item = visit(ctx.libraryUnit());
        return node(NodeKind.LIBRARY_ITEM, ctx, hasPrivate, item);
    }

    @Override
    public Integer visitLibraryUnit(AdaParser.LibraryUnitContext ctx) {
        return visit(ctx.getChild(0));
    }

    // --- Subprograms ---

    @Override
    public Integer visitSubprogramDecl(AdaParser.SubprogramDeclContext ctx) {
        int overriding = overriding(ctx.overridingIndicator(), start(ctx.subprogramSpec()));
        int spec = visit(ctx.subprogramSpec());
        return node(NodeKind.SUBP_DECL, ctx, overriding, spec);
    }

    @Override
    public Integer visitSubprogramBody(AdaParser.SubprogramBodyContext ctx) {
        int overriding = overriding(ctx.overridingIndicator(), start(ctx.subprogramSpec()));
        int spec = visit(ctx.subprogramSpec());
        int decls = visit(ctx.declarativePart());
        int stmts = visit(ctx.handledStatements());
        int endName = optional(ctx.name());
        return node(NodeKind.SUBP_BODY, ctx, overriding, spec, decls, stmts, endName);
    }

    @Override
    public Integer visitSubprogramSpec(AdaParser.SubprogramSpecContext ctx) {
        int kind = ctx.PROCEDURE() != null
                ? token(NodeKind.SUBP_KIND_PROCEDURE, ctx.PROCEDURE().getSymbol())
                : token(NodeKind.SUBP_KIND_FUNCTION, ctx.FUNCTION().getSymbol());
        int name = visit(ctx.name(0));
        int params = optional(ctx.params());
        int returns = ctx.FUNCTION() != null ? visit(ctx.name(1)) : SyntaxTree.NO_NODE;
        return node(NodeKind.SUBP_SPEC, ctx, kind, name, params, returns);
    }

    @Override
    public Integer visitParams(AdaParser.ParamsContext ctx) {
        int params = list(NodeKind.PARAM_SPEC_LIST, ctx.paramSpec(), start(ctx));
        return node(NodeKind.PARAMS, ctx, params);
    }

    @Override
    public Integer visitParamSpec(AdaParser.ParamSpecContext ctx) {
        int ids = list(NodeKind.IDENTIFIER_LIST, ctx.identifier(), start(ctx));
        int afterColon = nextOnChannel(ctx.COLON().getSymbol().getTokenIndex());
        int hasAliased = qualifier(ctx.ALIASED(), NodeKind.ALIASED_PRESENT, NodeKind.ALIASED_ABSENT, afterColon);
        int mode = visit(ctx.paramMode());
        int typeExpr = visit(ctx.name());
        int defaultExpr = optional(ctx.expression());
        return node(NodeKind.PARAM_SPEC, ctx, ids, hasAliased, mode, typeExpr, defaultExpr);
    }

    @Override
    public Integer visitParamMode(AdaParser.ParamModeContext ctx) {
        NodeKind kind;
        if (ctx.IN() != null && ctx.OUT() != null) {
            kind = NodeKind.MODE_IN_OUT;
        } else if (ctx.IN() != null) {
            kind = NodeKind.MODE_IN;
        } else if (ctx.OUT() != null) {
            kind = NodeKind.MODE_OUT;
        } else {
            kind = NodeKind.MODE_DEFAULT;
        }
        return node(kind, ctx);
    }

    // --- Packages and declarations ---

    @Override
    public Integer visitPackageDecl(AdaParser.PackageDeclContext ctx) {
        int name = visit(ctx.name(0));
        int end = ctx.END().getSymbol().getTokenIndex();
        int publicAnchor = ctx.PRIVATE() != null ? ctx.PRIVATE().getSymbol().getTokenIndex() : end;
        int publicPart = part(NodeKind.PUBLIC_PART, ctx.publicDecls, publicAnchor);
        int privatePart = ctx.PRIVATE() != null
                ? part(NodeKind.PRIVATE_PART, ctx.privateDecls, end)
                : SyntaxTree.NO_NODE;
        int endName = ctx.name().size() > 1 ? visit(ctx.name(1)) : SyntaxTree.NO_NODE;
        return node(NodeKind.PACKAGE_DECL, ctx, name, publicPart, privatePart, endName);
    }

    @Override
    public Integer visitPackageBody(AdaParser.PackageBodyContext ctx) {
        int name = visit(ctx.name(0));
        int decls = visit(ctx.declarativePart());
        int stmts = optional(ctx.handledStatements());
        int endName = ctx.name().size() > 1 ? visit(ctx.name(1)) : SyntaxTree.NO_NODE;
        return node(NodeKind.PACKAGE_BODY, ctx, name, decls, stmts, endName);
    }

    @Override
    public Integer visitDeclarativePart(AdaParser.DeclarativePartContext ctx) {
        int decls = list(NodeKind.ADA_NODE_LIST, ctx.declaration(), start(ctx));
        return node(NodeKind.DECLARATIVE_PART, ctx, decls);
    }

    @Override
    public Integer visitDeclaration(AdaParser.DeclarationContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public Integer visitObjectDecl(AdaParser.ObjectDeclContext ctx) {
        int ids = list(NodeKind.IDENTIFIER_LIST, ctx.identifier(), start(ctx));
        int afterColon = nextOnChannel(ctx.COLON().getSymbol().getTokenIndex());
        int hasAliased = qualifier(ctx.ALIASED(), NodeKind.ALIASED_PRESENT, NodeKind.ALIASED_ABSENT, afterColon);
        int constantAnchor = ctx.ALIASED() != null
                ? nextOnChannel(ctx.ALIASED().getSymbol().getTokenIndex())
                : afterColon;
        int hasConstant = qualifier(ctx.CONSTANT(), NodeKind.CONSTANT_PRESENT, NodeKind.CONSTANT_ABSENT,
                constantAnchor);
        int typeExpr = optional(ctx.name());
        int defaultExpr = optional(ctx.expression());
        return node(NodeKind.OBJECT_DECL, ctx, ids, hasAliased, hasConstant, typeExpr, defaultExpr);
    }

    // --- Statements ---

    @Override
    public Integer visitHandledStatements(AdaParser.HandledStatementsContext ctx) {
        int stmts = list(NodeKind.STMT_LIST, ctx.statement(), start(ctx));
        return node(NodeKind.HANDLED_STMTS, ctx, stmts);
    }

    @Override
    public Integer visitNullStatement(AdaParser.NullStatementContext ctx) {
        return node(NodeKind.NULL_STMT, ctx);
    }

    @Override
    public Integer visitAssignStatement(AdaParser.AssignStatementContext ctx) {
        int dest = visit(ctx.name());
        int expr = visit(ctx.expression());
        return node(NodeKind.ASSIGN_STMT, ctx, dest, expr);
    }

    @Override
    public Integer visitReturnStatement(AdaParser.ReturnStatementContext ctx) {
        return node(NodeKind.RETURN_STMT, ctx, optional(ctx.expression()));
    }

    @Override
    public Integer visitCallStatement(AdaParser.CallStatementContext ctx) {
        return node(NodeKind.CALL_STMT, ctx, visit(ctx.name()));
    }

    // --- Expressions and names ---

    @Override
    public Integer visitUnaryExpression(AdaParser.UnaryExpressionContext ctx) {
        int op = token(operatorKind(ctx.op), ctx.op);
        int operand = visit(ctx.expression());
        return node(NodeKind.UN_OP, ctx, op, operand);
    }

    @Override
    public Integer visitBinaryExpression(AdaParser.BinaryExpressionContext ctx) {
        int left = visit(ctx.left);
        int op = token(operatorKind(ctx.op), ctx.op);
        int right = visit(ctx.right);
        return node(NodeKind.BIN_OP, ctx, left, op, right);
    }

    @Override
    public Integer visitPrimaryExpression(AdaParser.PrimaryExpressionContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public Integer visitIntegerLiteral(AdaParser.IntegerLiteralContext ctx) {
        return token(NodeKind.INT_LITERAL, ctx.INTEGER_LITERAL().getSymbol());
    }

    @Override
    public Integer visitStringLiteral(AdaParser.StringLiteralContext ctx) {
        return token(NodeKind.STRING_LITERAL, ctx.STRING_LITERAL().getSymbol());
    }

    @Override
    public Integer visitCharacterLiteral(AdaParser.CharacterLiteralContext ctx) {
        return token(NodeKind.CHAR_LITERAL, ctx.CHARACTER_LITERAL().getSymbol());
    }

    @Override
    public Integer visitNullLiteral(AdaParser.NullLiteralContext ctx) {
        return token(NodeKind.NULL_LITERAL, ctx.NULL().getSymbol());
    }

    @Override
    public Integer visitNamePrimary(AdaParser.NamePrimaryContext ctx) {
        return visit(ctx.name());
    }

    @Override
    public Integer visitParenthesized(AdaParser.ParenthesizedContext ctx) {
        return node(NodeKind.PAREN_EXPR, ctx, visit(ctx.expression()));
    }

    @Override
    public Integer visitDottedName(AdaParser.DottedNameContext ctx) {
        int prefix = visit(ctx.name());
        int suffix = visit(ctx.identifier());
        return node(NodeKind.DOTTED_NAME, ctx, prefix, suffix);
    }

    @Override
    public Integer visitCallName(AdaParser.CallNameContext ctx) {
        int name = visit(ctx.name());
        int suffix = list(NodeKind.EXPR_LIST, ctx.expression(), start(ctx));
        return node(NodeKind.CALL_EXPR, ctx, name, suffix);
    }

    @Override
    public Integer visitSimpleName(AdaParser.SimpleNameContext ctx) {
        return visit(ctx.identifier());
    }

    @Override
    public Integer visitIdentifier(AdaParser.IdentifierContext ctx) {
        return token(NodeKind.IDENTIFIER, ctx.IDENTIFIER().getSymbol());
    }

    // --- Helpers ---

    private int node(NodeKind kind, ParserRuleContext ctx, int... children) {
        Token stop = ctx.getStop();
        int start = start(ctx);
        int end = stop == null ? start - 1 : stop.getTokenIndex();
        return tree.add(kind, start, end, children);
    }

    private int token(NodeKind kind, Token token) {
        int index = token.getTokenIndex();
        return tree.add(kind, index, index);
    }

    private int ghost(NodeKind kind, int anchor) {
        return tree.add(kind, anchor, anchor - 1);
    }

    private int qualifier(TerminalNode keyword, NodeKind present, NodeKind absent, int anchor) {
        return keyword != null ? token(present, keyword.getSymbol()) : ghost(absent, anchor);
    }

    private int overriding(AdaParser.OverridingIndicatorContext ctx, int anchor) {
        if (ctx == null) {
            return ghost(NodeKind.OVERRIDING_UNSPECIFIED, anchor);
        }
        return node(ctx.NOT() != null ? NodeKind.OVERRIDING_NOT_OVERRIDING : NodeKind.OVERRIDING_OVERRIDING, ctx);
    }

    private int optional(ParserRuleContext ctx) {
        return ctx == null ? SyntaxTree.NO_NODE : visit(ctx);
    }

    private int list(NodeKind kind, List<? extends ParserRuleContext> items, int anchor) {
        if (items.isEmpty()) {
            return ghost(kind, anchor);
        }
        int[] children = new int[items.size()];
        for (int i = 0; i < children.length; i++) {
            children[i] = visit(items.get(i));
        }
        int start = tree.tokenStart(children[0]);
        int end = tree.tokenEnd(children[children.length - 1]);
        return tree.add(kind, start, end, children);
    }

    /**
     * A declarative part with no rule context of its own spans exactly its declaration list.
     */
    private int part(NodeKind kind, List<AdaParser.DeclarationContext> decls, int anchor) {
        int list = list(NodeKind.ADA_NODE_LIST, decls, anchor);
        return tree.add(kind, tree.tokenStart(list), tree.tokenEnd(list), list);
    }

    private static int start(ParserRuleContext ctx) {
        return ctx.getStart().getTokenIndex();
    }

    private int nextOnChannel(int index) {
        int i = index + 1;
        while (i < tokens.size() - 1 && tokens.get(i).getChannel() != Token.DEFAULT_CHANNEL) {
            i++;
        }
        return i;
    }

    private int previousOnChannel(int index) {
        int i = index - 1;
        while (i > 0 && tokens.get(i).getChannel() != Token.DEFAULT_CHANNEL) {
            i--;
        }
        return i;
    }

    private static NodeKind operatorKind(Token op) {
        switch (op.getType()) {
            case AdaParser.AND:
                return NodeKind.OP_AND;
            case AdaParser.OR:
                return NodeKind.OP_OR;
            case AdaParser.EQ:
                return NodeKind.OP_EQ;
            case AdaParser.NEQ:
                return NodeKind.OP_NEQ;
            case AdaParser.LT:
                return NodeKind.OP_LT;
            case AdaParser.LTE:
                return NodeKind.OP_LTE;
            case AdaParser.GT:
                return NodeKind.OP_GT;
            case AdaParser.GTE:
                return NodeKind.OP_GTE;
            case AdaParser.PLUS:
                return NodeKind.OP_PLUS;
            case AdaParser.MINUS:
                return NodeKind.OP_MINUS;
            case AdaParser.AMPERSAND:
                return NodeKind.OP_CONCAT;
            case AdaParser.STAR:
                return NodeKind.OP_MULT;
            case AdaParser.SLASH:
                return NodeKind.OP_DIV;
            default:
                throw new IllegalArgumentException("not an operator: " + op.getText());
        }
    }
}
