package org.dxworks.adaframe.parser;

import org.dxworks.adaframe.model.SourceLocationRange;
import org.dxworks.adaframe.schema.TokenKind;

/**
 * A token as produced by the engine: code point offsets into the decoded
 * buffer ({@code end} exclusive) and the matching source range.
 */
public final class LexedToken {
    private final TokenKind kind;
    private final int startOffset;
    private final int endOffset;
    private final SourceLocationRange range;

    public LexedToken(TokenKind kind, int startOffset, int endOffset, SourceLocationRange range) {
        this.kind = kind;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.range = range;
    }

    public TokenKind getKind() {
        return kind;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public SourceLocationRange getRange() {
        return range;
    }
}
