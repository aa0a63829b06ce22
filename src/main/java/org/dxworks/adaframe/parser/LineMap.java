package org.dxworks.adaframe.parser;

import org.dxworks.adaframe.model.SourceLocation;

import java.util.Arrays;

/**
 * Maps code point offsets of a source buffer to line/column locations.
 * Columns are 1-based; a tab advances to the next multiple of the tab stop.
 */
public final class LineMap {

    private final int[] codePoints;
    private final int[] lineStarts;
    private final int tabStop;

    public LineMap(int[] codePoints, int tabStop) {
        if (tabStop < 1) {
            throw new IllegalArgumentException("tab stop must be positive: " + tabStop);
        }
        this.codePoints = codePoints;
        this.tabStop = tabStop;
        this.lineStarts = computeLineStarts(codePoints);
    }

    private static int[] computeLineStarts(int[] codePoints) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < codePoints.length; i++) {
            if (codePoints[i] == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, count);
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * @param offset code point offset in {@code [0, length]}
     */
    public SourceLocation locationOf(int offset) {
        if (offset < 0 || offset > codePoints.length) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside [0, " + codePoints.length + "]");
        }
        int line = Arrays.binarySearch(lineStarts, offset);
        if (line < 0) {
            line = -line - 2;
        }
        int column = 1;
        for (int i = lineStarts[line]; i < offset; i++) {
            if (codePoints[i] == '\t') {
                column = ((column - 1) / tabStop + 1) * tabStop + 1;
            } else {
                column++;
            }
        }
        return new SourceLocation(line + 1, column);
    }

    /**
     * Location of a 1-based line and a 0-based code point position within it,
     * as reported by the ANTLR runtime. Positions past the end are clamped.
     */
    public SourceLocation locationOf(int line, int charPositionInLine) {
        int lineIndex = Math.max(0, Math.min(line, lineStarts.length) - 1);
        int offset = lineStarts[lineIndex] + Math.max(0, charPositionInLine);
        return locationOf(Math.min(offset, codePoints.length));
    }
}
