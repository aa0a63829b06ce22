package org.dxworks.adaframe.schema;

public enum TokenKind {
    IDENTIFIER,
    KEYWORD,
    STRING,
    CHARACTER,
    INTEGER,
    PUNCTUATION,
    OPERATOR,
    COMMENT(true),
    LEXING_FAILURE,
    TERMINATION;

    private final boolean trivia;

    TokenKind() {
        this(false);
    }

    TokenKind(boolean trivia) {
        this.trivia = trivia;
    }

    /**
     * Trivia tokens are kept in the token stream but never belong to a node.
     */
    public boolean isTrivia() {
        return trivia;
    }
}
