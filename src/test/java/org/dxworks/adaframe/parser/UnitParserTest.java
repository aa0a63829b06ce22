package org.dxworks.adaframe.parser;

import org.dxworks.adaframe.model.SourceLocation;
import org.dxworks.adaframe.model.SourceLocationRange;
import org.dxworks.adaframe.schema.NodeKind;
import org.dxworks.adaframe.schema.TokenKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class UnitParserTest {

    private final UnitParser parser = new UnitParser(8);

    private static List<TokenKind> kinds(ParseResult result) {
        return result.getTokens().stream().map(LexedToken::getKind).collect(Collectors.toList());
    }

    @Test
    void parsesMinimalProcedure() {
        ParseResult result = parser.parse("foo.adb", "procedure Foo is begin null; end Foo;");

        assertTrue(result.isSuccess());
        assertTrue(result.getDiagnostics().isEmpty());
        SyntaxTree tree = result.getTree();
        assertNotNull(tree);
        assertEquals(NodeKind.COMPILATION_UNIT, tree.kind(tree.root()));
        assertEquals(3, tree.childCount(tree.root()));
        assertEquals(SyntaxTree.NO_NODE, tree.parent(tree.root()));
        assertEquals(10, result.getTokens().size());
        assertEquals(TokenKind.TERMINATION, result.getTokens().get(9).getKind());
    }

    @Test
    void keywordsAreCaseInsensitive() {
        ParseResult result = parser.parse("foo.adb", "PROCEDURE Foo IS Begin NULL; eNd Foo;");

        assertTrue(result.isSuccess());
        assertEquals(List.of(TokenKind.KEYWORD, TokenKind.IDENTIFIER, TokenKind.KEYWORD, TokenKind.KEYWORD,
                TokenKind.KEYWORD, TokenKind.PUNCTUATION, TokenKind.KEYWORD, TokenKind.IDENTIFIER,
                TokenKind.PUNCTUATION, TokenKind.TERMINATION), kinds(result));
    }

    @Test
    void commentsAreKeptAsTrivia() {
        ParseResult result = parser.parse("p.adb", "-- header\nprocedure P is begin null; end;");

        assertTrue(result.isSuccess());
        LexedToken comment = result.getTokens().get(0);
        assertEquals(TokenKind.COMMENT, comment.getKind());
        assertEquals(0, comment.getStartOffset());
        assertEquals(9, comment.getEndOffset());
        assertEquals(new SourceLocationRange(new SourceLocation(1, 1), new SourceLocation(1, 10)), comment.getRange());
        assertEquals(TokenKind.KEYWORD, result.getTokens().get(1).getKind());
    }

    @Test
    void classifiesLiteralsAndOperators() {
        ParseResult result = parser.parse("p.ads",
                "package P is S : String := \"a\" & 'b'; N : Integer := 1_000 + 2; end P;");

        assertTrue(result.isSuccess(), () -> result.getDiagnostics().toString());
        List<TokenKind> kinds = kinds(result);
        assertTrue(kinds.contains(TokenKind.STRING));
        assertTrue(kinds.contains(TokenKind.CHARACTER));
        assertTrue(kinds.contains(TokenKind.INTEGER));
        assertTrue(kinds.contains(TokenKind.OPERATOR));
    }

    @Test
    void rangesUseCodePointColumns() {
        ParseResult result = parser.parse("cafe.adb", "procedure Café is begin null; end Café;");

        assertTrue(result.isSuccess());
        LexedToken name = result.getTokens().get(1);
        assertEquals(TokenKind.IDENTIFIER, name.getKind());
        assertEquals(new SourceLocationRange(new SourceLocation(1, 11), new SourceLocation(1, 15)), name.getRange());
        LexedToken is = result.getTokens().get(2);
        assertEquals(new SourceLocation(1, 16), is.getRange().getStart());
    }

    @Test
    void syntaxErrorYieldsDiagnosticsAndNoTree() {
        ParseResult result = parser.parse("bad.adb", "procedure Bad is begin end Bad;");

        assertFalse(result.isSuccess());
        assertNull(result.getTree());
        assertFalse(result.getDiagnostics().isEmpty());
        assertEquals(1, result.getDiagnostics().get(0).getRange().getStart().getLine());
        assertFalse(result.getTokens().isEmpty());
    }

    @Test
    void unknownCharacterIsALexingFailure() {
        ParseResult result = parser.parse("bad.adb", "procedure Bad is begin null; end Bad; $");

        assertFalse(result.isSuccess());
        assertTrue(kinds(result).contains(TokenKind.LEXING_FAILURE));
        assertEquals(new SourceLocation(1, 39), result.getDiagnostics().get(0).getRange().getStart());
    }

    @Test
    void emptyBufferIsASyntaxError() {
        ParseResult result = parser.parse("empty.adb", "");

        assertFalse(result.isSuccess());
        assertEquals(List.of(TokenKind.TERMINATION), kinds(result));
    }
}
