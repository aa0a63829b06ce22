package org.dxworks.adaframe.ast;

import org.dxworks.adaframe.model.Diagnostic;
import org.dxworks.adaframe.model.SourceLocation;
import org.dxworks.adaframe.model.SourceLocationRange;
import org.dxworks.adaframe.parser.ParseResult;
import org.dxworks.adaframe.parser.UnitParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owner of analysis units. Destroying the context releases every unit and
 * invalidates all nodes, tokens and texts obtained from them.
 * <p>
 * A context is not thread-safe: sharing one across threads needs external
 * synchronization, and concurrent traversals are not supported.
 */
public final class AnalysisContext implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisContext.class);

    public static final String DEFAULT_CHARSET = StandardCharsets.UTF_8.name();
    public static final int DEFAULT_TAB_STOP = 8;

    private final Charset charset;
    private final int tabStop;
    private final UnitParser parser;
    private final Map<String, AnalysisUnit> units = new LinkedHashMap<>();
    private boolean destroyed;

    private AnalysisContext(Charset charset, int tabStop) {
        this.charset = charset;
        this.tabStop = tabStop;
        this.parser = new UnitParser(tabStop);
    }

    public static AnalysisContext create() {
        return create(DEFAULT_CHARSET, DEFAULT_TAB_STOP);
    }

    public static AnalysisContext create(String charsetName) {
        return create(charsetName, DEFAULT_TAB_STOP);
    }

    /**
     * @throws ContextCreationException for an unknown charset or a tab stop below 1
     */
    public static AnalysisContext create(String charsetName, int tabStop) {
        Adaframe.initialize();
        if (tabStop < 1) {
            throw new ContextCreationException("Invalid tab stop: " + tabStop);
        }
        Charset charset;
        try {
            charset = Charset.forName(charsetName == null ? DEFAULT_CHARSET : charsetName);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ContextCreationException("Unsupported charset: " + charsetName, e);
        }
        LOG.debug("Created analysis context (charset={}, tabStop={})", charset.name(), tabStop);
        return new AnalysisContext(charset, tabStop);
    }

    public Charset getCharset() {
        return charset;
    }

    public int getTabStop() {
        return tabStop;
    }

    /**
     * Returns the unit already created for {@code filename}, or reads, decodes
     * and parses the file. A file that cannot be read or decoded yields a
     * failed unit carrying a diagnostic.
     */
    public AnalysisUnit getUnitFromFile(String filename) {
        checkAlive();
        AnalysisUnit existing = units.get(filename);
        if (existing != null) {
            return existing;
        }
        ParseResult result;
        try {
            byte[] bytes = Files.readAllBytes(Paths.get(filename));
            result = parser.parse(filename, decode(bytes));
        } catch (IOException | InvalidPathException e) {
            LOG.warn("Cannot read {}: {}", filename, e.toString());
            result = failure("Cannot read " + filename + ": " + e);
        }
        return register(filename, result);
    }

    public AnalysisUnit getUnitFromFile(Path path) {
        return getUnitFromFile(path.toString());
    }

    /**
     * Parses {@code buffer} as the content of {@code filename}, replacing any
     * unit previously registered under that name.
     */
    public AnalysisUnit getUnitFromBuffer(String filename, String buffer) {
        checkAlive();
        return register(filename, parser.parse(filename, buffer));
    }

    /**
     * Same as {@link #getUnitFromBuffer(String, String)} for raw bytes in the context's charset.
     */
    public AnalysisUnit getUnitFromBuffer(String filename, byte[] buffer) {
        checkAlive();
        ParseResult result;
        try {
            result = parser.parse(filename, decode(buffer));
        } catch (CharacterCodingException e) {
            result = failure("Cannot decode " + filename + " as " + charset.name() + ": " + e);
        }
        return register(filename, result);
    }

    public boolean hasUnit(String filename) {
        return units.containsKey(filename);
    }

    public List<AnalysisUnit> getUnits() {
        return List.copyOf(units.values());
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    /**
     * Releases every unit. Destroying an already destroyed context has no effect.
     */
    public void destroy() {
        if (destroyed) {
            return;
        }
        for (AnalysisUnit unit : units.values()) {
            unit.release();
        }
        LOG.debug("Destroyed analysis context with {} unit(s)", units.size());
        units.clear();
        destroyed = true;
    }

    @Override
    public void close() {
        destroy();
    }

    private AnalysisUnit register(String filename, ParseResult result) {
        AnalysisUnit unit = new AnalysisUnit(this, filename, result);
        AnalysisUnit previous = units.put(filename, unit);
        if (previous != null) {
            previous.release();
        }
        if (!result.isSuccess()) {
            LOG.warn("{} could not be parsed ({} diagnostic(s))", filename, result.getDiagnostics().size());
        }
        return unit;
    }

    private String decode(byte[] bytes) throws CharacterCodingException {
        String text = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        // Drop a leading byte order mark
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    private static ParseResult failure(String message) {
        Diagnostic diagnostic = new Diagnostic(SourceLocationRange.at(new SourceLocation(1, 1)), message);
        return new ParseResult(new int[0], List.of(), null, List.of(diagnostic));
    }

    private void checkAlive() {
        if (destroyed) {
            throw new ContextDestroyedException("analysis context has been destroyed");
        }
    }
}
