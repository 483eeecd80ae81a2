package io.github.tclast.analyzer;

/**
 * Source span of a node. {@code end} is the cursor position just after the last character that belongs to the node,
 * so an empty span has {@code start.equals(end)}.
 */
public record Range(Position start, Position end) {

    public Range {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Range start " + start + " is after end " + end);
        }
    }

    public static Range of(int startLine, int startColumn, int endLine, int endColumn) {
        return new Range(new Position(startLine, startColumn), new Position(endLine, endColumn));
    }

    public static Range empty(Position at) {
        return new Range(at, at);
    }

    public boolean contains(Range other) {
        return start.compareTo(other.start) <= 0 && end.compareTo(other.end) >= 0;
    }

    @Override
    public String toString() {
        return "[" + start + "-" + end + ")";
    }
}
