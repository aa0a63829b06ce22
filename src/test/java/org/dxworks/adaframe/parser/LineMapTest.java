package org.dxworks.adaframe.parser;

import org.dxworks.adaframe.model.SourceLocation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class LineMapTest {

    private static LineMap lines(String source, int tabStop) {
        return new LineMap(source.codePoints().toArray(), tabStop);
    }

    @Test
    void locatesOffsetsOnSeveralLines() {
        LineMap map = lines("ab\ncd\n", 8);
        assertEquals(3, map.lineCount());
        assertEquals(new SourceLocation(1, 1), map.locationOf(0));
        assertEquals(new SourceLocation(1, 3), map.locationOf(2));
        assertEquals(new SourceLocation(2, 1), map.locationOf(3));
        assertEquals(new SourceLocation(2, 2), map.locationOf(4));
        assertEquals(new SourceLocation(3, 1), map.locationOf(6));
    }

    @Test
    void tabsAdvanceToTheNextStop() {
        LineMap map = lines("\tx\n a\tb", 8);
        assertEquals(new SourceLocation(1, 9), map.locationOf(1));
        assertEquals(new SourceLocation(2, 3), map.locationOf(5));
        assertEquals(new SourceLocation(2, 9), map.locationOf(6));
    }

    @Test
    void tabStopIsConfigurable() {
        LineMap map = lines("\t\tx", 3);
        assertEquals(new SourceLocation(1, 4), map.locationOf(1));
        assertEquals(new SourceLocation(1, 7), map.locationOf(2));
    }

    @Test
    void columnsCountCodePoints() {
        // U+1D11E takes two UTF-16 units but one column
        LineMap map = lines("𝄞x", 8);
        assertEquals(new SourceLocation(1, 2), map.locationOf(1));
    }

    @Test
    void rejectsOutOfRangeOffsets() {
        LineMap map = lines("abc", 8);
        assertEquals(new SourceLocation(1, 4), map.locationOf(3));
        assertThrows(IndexOutOfBoundsException.class, () -> map.locationOf(4));
        assertThrows(IndexOutOfBoundsException.class, () -> map.locationOf(-1));
        assertThrows(IllegalArgumentException.class, () -> new LineMap(new int[0], 0));
    }

    @Test
    void runtimePositionsExpandTabs() {
        LineMap map = lines("x\n\tX := ;\n", 8);
        // ANTLR reports ';' on line 2 at position 6
        assertEquals(new SourceLocation(2, 14), map.locationOf(2, 6));
        assertEquals(new SourceLocation(1, 1), map.locationOf(1, 0));
        assertEquals(new SourceLocation(3, 1), map.locationOf(7, 40));
    }
}
