package org.dxworks.adaframe.ast;

import org.dxworks.adaframe.model.SourceLocation;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AnalysisContextTest {

    private static final Path SAMPLES = Paths.get("src/test/resources/samples/ada");
    private static final String PROC = "procedure P is\nbegin\n\tnull;\nend P;\n";

    @Test
    void defaults() {
        try (AnalysisContext context = AnalysisContext.create()) {
            assertEquals(StandardCharsets.UTF_8, context.getCharset());
            assertEquals(8, context.getTabStop());
            assertTrue(Adaframe.isInitialized());
        }
    }

    @Test
    void rejectsUnknownCharset() {
        assertThrows(ContextCreationException.class, () -> AnalysisContext.create("no-such-charset"));
        assertThrows(ContextCreationException.class, () -> AnalysisContext.create("bad name!"));
    }

    @Test
    void rejectsNonPositiveTabStop() {
        assertThrows(ContextCreationException.class, () -> AnalysisContext.create("UTF-8", 0));
    }

    @Test
    void tabStopDrivesColumns() {
        try (AnalysisContext context = AnalysisContext.create("UTF-8", 4)) {
            Node root = context.getUnitFromBuffer("p.adb", PROC).rootOrThrow();
            Node stmt = root.lookup(new SourceLocation(3, 5));
            assertEquals("NullStmt", stmt.kindName());
            assertEquals("3:5-3:10", stmt.sourceRange().toString());
        }
    }

    @Test
    void fileUnitsAreCached() {
        try (AnalysisContext context = AnalysisContext.create()) {
            AnalysisUnit first = context.getUnitFromFile(SAMPLES.resolve("foo.adb"));
            AnalysisUnit second = context.getUnitFromFile(SAMPLES.resolve("foo.adb").toString());

            assertSame(first, second);
            assertTrue(first.isParsed());
            assertEquals("foo.adb", first.getBaseName());
            assertTrue(context.hasUnit(SAMPLES.resolve("foo.adb").toString()));
            assertEquals(1, context.getUnits().size());
        }
    }

    @Test
    void reparsingABufferReleasesThePreviousUnit() {
        try (AnalysisContext context = AnalysisContext.create()) {
            AnalysisUnit old = context.getUnitFromBuffer("p.adb", PROC);
            Node oldRoot = old.root();

            AnalysisUnit fresh = context.getUnitFromBuffer("p.adb", PROC.replace("null", "return"));

            assertNotSame(old, fresh);
            assertFalse(old.isAlive());
            assertTrue(fresh.isAlive());
            assertThrows(InvalidNodeException.class, oldRoot::kind);
            assertThrows(ContextDestroyedException.class, old::root);
            assertEquals("ReturnStmt", fresh.root().lookup(new SourceLocation(3, 9)).kindName());
        }
    }

    @Test
    void decodesWithTheContextCharset() {
        try (AnalysisContext context = AnalysisContext.create("ISO-8859-1")) {
            AnalysisUnit unit = context.getUnitFromFile(SAMPLES.resolve("latin1.adb"));
            assertTrue(unit.isParsed(), () -> unit.getDiagnostics().toString());
            Node name = unit.root().lookup(new SourceLocation(1, 11));
            assertEquals("Café", name.text().toString());
        }
    }

    @Test
    void undecodableFileYieldsAFailedUnit() {
        try (AnalysisContext context = AnalysisContext.create()) {
            AnalysisUnit unit = context.getUnitFromFile(SAMPLES.resolve("latin1.adb"));
            assertFalse(unit.isParsed());
            assertTrue(unit.root().isNull());
            assertTrue(unit.getDiagnostics().get(0).getMessage().startsWith("Cannot read"));
        }
    }

    @Test
    void byteBuffersUseTheContextCharset() {
        try (AnalysisContext context = AnalysisContext.create("ISO-8859-1")) {
            byte[] bytes = "procedure Olé is begin null; end;".getBytes(StandardCharsets.ISO_8859_1);
            AnalysisUnit unit = context.getUnitFromBuffer("ole.adb", bytes);
            assertTrue(unit.isParsed());
            assertEquals("Olé", unit.root().lookup(new SourceLocation(1, 12)).text().toString());
        }
    }

    @Test
    void leadingByteOrderMarkIsDropped() {
        try (AnalysisContext context = AnalysisContext.create()) {
            byte[] source = "procedure B is begin null; end;".getBytes(StandardCharsets.UTF_8);
            byte[] bytes = new byte[source.length + 3];
            bytes[0] = (byte) 0xEF;
            bytes[1] = (byte) 0xBB;
            bytes[2] = (byte) 0xBF;
            System.arraycopy(source, 0, bytes, 3, source.length);

            AnalysisUnit unit = context.getUnitFromBuffer("b.adb", bytes);
            assertTrue(unit.isParsed());
            assertEquals(new SourceLocation(1, 1), unit.firstToken().get().sourceRange().getStart());
        }
    }

    @Test
    void failedUnitHasNoRoot() {
        try (AnalysisContext context = AnalysisContext.create()) {
            AnalysisUnit unit = context.getUnitFromFile(SAMPLES.resolve("broken.adb"));

            assertFalse(unit.isParsed());
            assertTrue(unit.hasDiagnostics());
            assertTrue(unit.root().isNull());
            UnitParseException e = assertThrows(UnitParseException.class, unit::rootOrThrow);
            assertEquals(unit.getDiagnostics(), e.getDiagnostics());
            assertTrue(unit.getTokenCount() > 0);
        }
    }

    @Test
    void missingFileYieldsAFailedUnit() {
        try (AnalysisContext context = AnalysisContext.create()) {
            AnalysisUnit unit = context.getUnitFromFile(SAMPLES.resolve("missing.adb"));
            assertFalse(unit.isParsed());
            assertEquals(0, unit.getTokenCount());
            assertFalse(unit.firstToken().isPresent());
        }
    }

    @Test
    void malformedFileNameYieldsAFailedUnit() {
        try (AnalysisContext context = AnalysisContext.create()) {
            AnalysisUnit unit = context.getUnitFromFile("bad\u0000name.adb");
            assertFalse(unit.isParsed());
            assertEquals(1, unit.getDiagnostics().size());
            assertTrue(unit.getDiagnostics().get(0).toString().contains("Cannot read"));
        }
    }

    @Test
    void destroyIsIdempotentAndInvalidatesEverything() {
        AnalysisContext context = AnalysisContext.create();
        AnalysisUnit unit = context.getUnitFromBuffer("p.adb", PROC);
        Node root = unit.root();
        Token token = unit.firstToken().get();

        context.destroy();
        assertDoesNotThrow(context::destroy);
        assertDoesNotThrow(context::close);

        assertTrue(context.isDestroyed());
        assertFalse(unit.isAlive());
        assertThrows(InvalidNodeException.class, root::childCount);
        assertThrows(ContextDestroyedException.class, token::kind);
        assertThrows(ContextDestroyedException.class, unit::text);
        assertThrows(ContextDestroyedException.class, () -> context.getUnitFromBuffer("q.adb", PROC));
        assertTrue(root.toString().endsWith("(released)>"));
    }

    @Test
    void initializationIsIdempotentAcrossThreads() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(Adaframe::initialize));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdown();
        }
        assertTrue(Adaframe.isInitialized());
    }
}
