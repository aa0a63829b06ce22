package org.dxworks.adaframe.parser;

import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.dxworks.adaframe.model.Diagnostic;
import org.dxworks.adaframe.model.SourceLocationRange;
import org.dxworks.adaframe.parser.generated.AdaLexer;
import org.dxworks.adaframe.parser.generated.AdaParser;
import org.dxworks.adaframe.schema.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexes and parses one Ada buffer into a {@link ParseResult}. A buffer with
 * syntax errors yields its tokens and diagnostics but no tree.
 */
public final class UnitParser {

    private final int tabStop;

    public UnitParser(int tabStop) {
        this.tabStop = tabStop;
    }

    public ParseResult parse(String sourceName, String source) {
        int[] codePoints = source.codePoints().toArray();
        LineMap lines = new LineMap(codePoints, tabStop);

        AdaParserFactory.ParserWithTokens parserWithTokens = AdaParserFactory.createAdaParser(source, sourceName);
        CommonTokenStream stream = parserWithTokens.getTokens();
        List<LexedToken> tokens = convertTokens(stream.getTokens(), lines);

        AdaParser.CompilationUnitContext unit = parserWithTokens.getParser().compilationUnit();
        List<Diagnostic> diagnostics = toDiagnostics(parserWithTokens.getErrors(), tokens, lines);

        SyntaxTree tree = diagnostics.isEmpty() ? new TreeBuilder(stream).build(unit) : null;
        return new ParseResult(codePoints, tokens, tree, diagnostics);
    }

    private static List<LexedToken> convertTokens(List<Token> antlrTokens, LineMap lines) {
        List<LexedToken> tokens = new ArrayList<>(antlrTokens.size());
        for (Token t : antlrTokens) {
            int start = t.getStartIndex();
            int end = t.getStopIndex() + 1;
            SourceLocationRange range = new SourceLocationRange(lines.locationOf(start), lines.locationOf(end));
            tokens.add(new LexedToken(tokenKind(t.getType()), start, end, range));
        }
        return tokens;
    }

    private static List<Diagnostic> toDiagnostics(List<AdaParserFactory.SyntaxError> errors, List<LexedToken> tokens,
                                                 LineMap lines) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (AdaParserFactory.SyntaxError error : errors) {
            Token offending = error.getOffendingToken();
            SourceLocationRange range;
            if (offending != null && offending.getTokenIndex() >= 0 && offending.getTokenIndex() < tokens.size()) {
                range = tokens.get(offending.getTokenIndex()).getRange();
            } else {
                range = SourceLocationRange.at(lines.locationOf(error.getLine(), error.getCharPositionInLine()));
            }
            diagnostics.add(new Diagnostic(range, error.getMessage()));
        }
        return diagnostics;
    }

    static TokenKind tokenKind(int type) {
        switch (type) {
            case Token.EOF:
                return TokenKind.TERMINATION;
            case AdaLexer.IDENTIFIER:
                return TokenKind.IDENTIFIER;
            case AdaLexer.STRING_LITERAL:
                return TokenKind.STRING;
            case AdaLexer.CHARACTER_LITERAL:
                return TokenKind.CHARACTER;
            case AdaLexer.INTEGER_LITERAL:
                return TokenKind.INTEGER;
            case AdaLexer.COMMENT:
                return TokenKind.COMMENT;
            case AdaLexer.ERROR_CHAR:
                return TokenKind.LEXING_FAILURE;
            case AdaLexer.EQ:
            case AdaLexer.NEQ:
            case AdaLexer.LT:
            case AdaLexer.LTE:
            case AdaLexer.GT:
            case AdaLexer.GTE:
            case AdaLexer.PLUS:
            case AdaLexer.MINUS:
            case AdaLexer.STAR:
            case AdaLexer.SLASH:
            case AdaLexer.AMPERSAND:
                return TokenKind.OPERATOR;
            case AdaLexer.ASSIGN:
            case AdaLexer.LPAREN:
            case AdaLexer.RPAREN:
            case AdaLexer.COMMA:
            case AdaLexer.SEMICOLON:
            case AdaLexer.COLON:
            case AdaLexer.DOT:
                return TokenKind.PUNCTUATION;
            default:
                return TokenKind.KEYWORD;
        }
    }
}
