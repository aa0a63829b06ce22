package org.dxworks.adaframe.model;

import java.util.Objects;

public final class Diagnostic {
    private final SourceLocationRange range;
    private final String message;

    public Diagnostic(SourceLocationRange range, String message) {
        this.range = Objects.requireNonNull(range, "range");
        this.message = Objects.requireNonNull(message, "message");
    }

    public SourceLocationRange getRange() {
        return range;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return range.equals(that.range) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(range, message);
    }

    /**
     * GNU-style rendering without the filename, e.g. {@code 3:5: mismatched input}.
     */
    @Override
    public String toString() {
        return range.getStart() + ": " + message;
    }
}
