package org.dxworks.adaframe.model;

import java.util.Objects;

/**
 * Half-open range of source locations: {@code end} is the location right after the last code point.
 */
public final class SourceLocationRange {
    private final SourceLocation start;
    private final SourceLocation end;

    public SourceLocationRange(SourceLocation start, SourceLocation end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
    }

    public static SourceLocationRange at(SourceLocation location) {
        return new SourceLocationRange(location, location);
    }

    public SourceLocation getStart() {
        return start;
    }

    public SourceLocation getEnd() {
        return end;
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    /**
     * Whether {@code location} falls inside this range. An empty range contains nothing.
     */
    public boolean contains(SourceLocation location) {
        return start.compareTo(location) <= 0 && location.compareTo(end) < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocationRange)) return false;
        SourceLocationRange that = (SourceLocationRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
