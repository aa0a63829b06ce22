package org.dxworks.adaframe.ast;

import org.dxworks.adaframe.model.Diagnostic;
import org.dxworks.adaframe.parser.ParseResult;
import org.dxworks.adaframe.parser.SyntaxTree;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * One parsed source buffer, owned by an {@link AnalysisContext}. A unit either
 * holds a tree or is in a failed state with a {@link Node#NULL} root and
 * diagnostics explaining why. Units are immutable after creation.
 */
public final class AnalysisUnit {

    private final AnalysisContext context;
    private final String filename;
    private final ParseResult result;
    private final Token[] tokens;
    private boolean released;

    AnalysisUnit(AnalysisContext context, String filename, ParseResult result) {
        this.context = context;
        this.filename = filename;
        this.result = result;
        this.tokens = new Token[result.getTokens().size()];
    }

    public AnalysisContext getContext() {
        return context;
    }

    public String getFilename() {
        return filename;
    }

    public String getBaseName() {
        Path name = Paths.get(filename).getFileName();
        return name == null ? filename : name.toString();
    }

    /**
     * @return the root node, or {@link Node#NULL} if the unit could not be parsed
     */
    public Node root() {
        checkAlive();
        SyntaxTree tree = result.getTree();
        return tree == null || tree.root() == SyntaxTree.NO_NODE ? Node.NULL : new Node(this, tree.root());
    }

    /**
     * @throws UnitParseException if the unit could not be parsed
     */
    public Node rootOrThrow() {
        Node root = root();
        if (root.isNull()) {
            throw new UnitParseException(filename, result.getDiagnostics());
        }
        return root;
    }

    public boolean isParsed() {
        return result.isSuccess();
    }

    public boolean hasDiagnostics() {
        return !result.getDiagnostics().isEmpty();
    }

    public List<Diagnostic> getDiagnostics() {
        return result.getDiagnostics();
    }

    /**
     * Number of tokens in the stream, trivia and the termination token included.
     */
    public int getTokenCount() {
        return tokens.length;
    }

    public Optional<Token> firstToken() {
        checkAlive();
        return tokens.length == 0 ? Optional.empty() : Optional.of(tokenAt(0));
    }

    public Optional<Token> lastToken() {
        checkAlive();
        return tokens.length == 0 ? Optional.empty() : Optional.of(tokenAt(tokens.length - 1));
    }

    /**
     * The whole decoded buffer.
     */
    public Text text() {
        checkAlive();
        return textSpan(0, result.getCodePoints().length);
    }

    /**
     * Whether handles derived from this unit may still be dereferenced.
     */
    public boolean isAlive() {
        return !released && !context.isDestroyed();
    }

    void release() {
        released = true;
    }

    SyntaxTree tree() {
        return result.getTree();
    }

    Token tokenAt(int index) {
        Token token = tokens[index];
        if (token == null) {
            token = new Token(this, index, result.getTokens().get(index));
            tokens[index] = token;
        }
        return token;
    }

    int tokenStartOffset(int index) {
        return result.getTokens().get(index).getStartOffset();
    }

    int tokenEndOffset(int index) {
        return result.getTokens().get(index).getEndOffset();
    }

    Text textSpan(int start, int end) {
        return new Text(this, result.getCodePoints(), start, end);
    }

    private void checkAlive() {
        if (!isAlive()) {
            throw new ContextDestroyedException(filename + " is no longer valid");
        }
    }

    @Override
    public String toString() {
        return "<AnalysisUnit " + getBaseName() + ">";
    }
}
