package org.dxworks.adaframe.parser;

import org.dxworks.adaframe.model.Diagnostic;

import java.util.List;

/**
 * Everything the engine hands over for one unit: the decoded buffer, its
 * token stream, the tree (absent when parsing failed) and the diagnostics.
 */
public final class ParseResult {
    private final int[] codePoints;
    private final List<LexedToken> tokens;
    private final SyntaxTree tree;
    private final List<Diagnostic> diagnostics;

    public ParseResult(int[] codePoints, List<LexedToken> tokens, SyntaxTree tree, List<Diagnostic> diagnostics) {
        this.codePoints = codePoints;
        this.tokens = List.copyOf(tokens);
        this.tree = tree;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public int[] getCodePoints() {
        return codePoints;
    }

    public List<LexedToken> getTokens() {
        return tokens;
    }

    /**
     * @return the tree, or {@code null} when the unit could not be parsed
     */
    public SyntaxTree getTree() {
        return tree;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean isSuccess() {
        return tree != null;
    }
}
