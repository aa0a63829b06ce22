package org.dxworks.adaframe.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.dxworks.adaframe.parser.generated.AdaLexer;
import org.dxworks.adaframe.parser.generated.AdaParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Factory for ANTLR lexers and parsers whose syntax errors are collected
 * instead of printed.
 */
public final class AdaParserFactory {

    private AdaParserFactory() {
        // utility class
    }

    /**
     * Creates an Ada parser over {@code source}; the returned holder exposes
     * the token stream and the errors reported while parsing.
     */
    public static ParserWithTokens createAdaParser(String source, String sourceName) {
        CollectingErrorListener errors = new CollectingErrorListener();
        AdaLexer lexer = new AdaLexer(CharStreams.fromString(source, sourceName));
        configureLexer(lexer, errors);
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        AdaParser parser = new AdaParser(tokens);
        configureParser(parser, errors);
        return new ParserWithTokens(parser, tokens, errors);
    }

    private static void configureLexer(Lexer lexer, CollectingErrorListener errors) {
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
    }

    private static void configureParser(Parser parser, CollectingErrorListener errors) {
        parser.removeErrorListeners();
        parser.addErrorListener(errors);
        parser.setErrorHandler(new DefaultErrorStrategy());
    }

    /**
     * A syntax error as reported by ANTLR; {@code offendingToken} is null for lexer errors.
     */
    public static final class SyntaxError {
        private final Token offendingToken;
        private final int line;
        private final int charPositionInLine;
        private final String message;

        SyntaxError(Token offendingToken, int line, int charPositionInLine, String message) {
            this.offendingToken = offendingToken;
            this.line = line;
            this.charPositionInLine = charPositionInLine;
            this.message = message;
        }

        public Token getOffendingToken() {
            return offendingToken;
        }

        public int getLine() {
            return line;
        }

        public int getCharPositionInLine() {
            return charPositionInLine;
        }

        public String getMessage() {
            return message;
        }
    }

    static final class CollectingErrorListener extends BaseErrorListener {
        private final List<SyntaxError> errors = new ArrayList<>();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg,
                                RecognitionException e) {
            Token token = offendingSymbol instanceof Token ? (Token) offendingSymbol : null;
            errors.add(new SyntaxError(token, line, charPositionInLine, msg));
        }

        List<SyntaxError> errors() {
            return Collections.unmodifiableList(errors);
        }
    }

    /**
     * Container for a parser, its filled token stream and its error sink.
     */
    public static final class ParserWithTokens {
        private final AdaParser parser;
        private final CommonTokenStream tokens;
        private final CollectingErrorListener errors;

        ParserWithTokens(AdaParser parser, CommonTokenStream tokens, CollectingErrorListener errors) {
            this.parser = parser;
            this.tokens = tokens;
            this.errors = errors;
        }

        public AdaParser getParser() {
            return parser;
        }

        public CommonTokenStream getTokens() {
            return tokens;
        }

        public List<SyntaxError> getErrors() {
            return errors.errors();
        }
    }
}
