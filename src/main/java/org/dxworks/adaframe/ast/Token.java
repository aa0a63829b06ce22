package org.dxworks.adaframe.ast;

import org.dxworks.adaframe.model.SourceLocationRange;
import org.dxworks.adaframe.parser.LexedToken;
import org.dxworks.adaframe.schema.TokenKind;

import java.util.Locale;
import java.util.Optional;

/**
 * One lexical unit of an analysis unit. Tokens are owned by their unit and
 * must not be used once the unit is released or its context destroyed.
 */
public final class Token {

    private final AnalysisUnit unit;
    private final int index;
    private final LexedToken data;

    Token(AnalysisUnit unit, int index, LexedToken data) {
        this.unit = unit;
        this.index = index;
        this.data = data;
    }

    public TokenKind kind() {
        checkAlive();
        return data.getKind();
    }

    public Text text() {
        checkAlive();
        return unit.textSpan(data.getStartOffset(), data.getEndOffset());
    }

    public SourceLocationRange sourceRange() {
        checkAlive();
        return data.getRange();
    }

    /**
     * Position in the unit's token stream, trivia included.
     */
    public int index() {
        return index;
    }

    public boolean isTrivia() {
        return kind().isTrivia();
    }

    public AnalysisUnit unit() {
        return unit;
    }

    public Optional<Token> next() {
        checkAlive();
        return index + 1 < unit.getTokenCount() ? Optional.of(unit.tokenAt(index + 1)) : Optional.empty();
    }

    public Optional<Token> previous() {
        checkAlive();
        return index > 0 ? Optional.of(unit.tokenAt(index - 1)) : Optional.empty();
    }

    /**
     * Canonical form of an identifier: Ada identifiers are case-insensitive.
     */
    public Optional<String> symbol() {
        if (kind() != TokenKind.IDENTIFIER) {
            return Optional.empty();
        }
        return Optional.of(text().toString().toLowerCase(Locale.ROOT));
    }

    private void checkAlive() {
        if (!unit.isAlive()) {
            throw new ContextDestroyedException("token " + index + " of " + unit.getFilename() + " is no longer valid");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token that = (Token) o;
        return unit == that.unit && index == that.index;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(unit) + index;
    }

    @Override
    public String toString() {
        if (!unit.isAlive()) {
            return "<Token #" + index + " (released)>";
        }
        StringBuilder sb = new StringBuilder("<Token ").append(data.getKind());
        if (data.getKind() != TokenKind.TERMINATION) {
            sb.append(' ');
            TextPrinter.appendQuoted(sb, text());
        }
        return sb.append(" at ").append(data.getRange()).append('>').toString();
    }
}
