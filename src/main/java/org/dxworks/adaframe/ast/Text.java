package org.dxworks.adaframe.ast;

import java.util.Arrays;

/**
 * Immutable, non-owning view over a span of decoded code points. A text
 * obtained from a unit shares the unit's buffer and is readable only while
 * that unit is alive.
 */
public final class Text {

    private static final int[] NO_CODE_POINTS = new int[0];

    private final AnalysisUnit owner;
    private final int[] codePoints;
    private final int start;
    private final int end;

    Text(AnalysisUnit owner, int[] codePoints, int start, int end) {
        this.owner = owner;
        this.codePoints = codePoints;
        this.start = start;
        this.end = end;
    }

    /**
     * A text that is not backed by any unit, e.g. for kind names.
     */
    public static Text of(String value) {
        int[] codePoints = value.isEmpty() ? NO_CODE_POINTS : value.codePoints().toArray();
        return new Text(null, codePoints, 0, codePoints.length);
    }

    /**
     * Number of code points.
     */
    public int length() {
        checkAlive();
        return end - start;
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    public int codePointAt(int index) {
        checkAlive();
        if (index < 0 || index >= end - start) {
            throw new IndexOutOfBoundsException("index " + index + " outside [0, " + (end - start) + ")");
        }
        return codePoints[start + index];
    }

    public int[] toCodePoints() {
        checkAlive();
        return Arrays.copyOfRange(codePoints, start, end);
    }

    private void checkAlive() {
        if (owner != null && !owner.isAlive()) {
            throw new ContextDestroyedException("text of " + owner.getFilename() + " is no longer valid");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Text)) return false;
        Text that = (Text) o;
        return Arrays.equals(codePoints, start, end, that.codePoints, that.start, that.end);
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (int i = start; i < end; i++) {
            h = 31 * h + codePoints[i];
        }
        return h;
    }

    @Override
    public String toString() {
        checkAlive();
        return new String(codePoints, start, end - start);
    }
}
