package io.github.tclast.analyzer;

/**
 * A 1-based line/column location in a source document.
 *
 * <p>Columns count code points, so a supplementary character advances the column by one.
 * Callers that need 0-based LSP positions convert at the boundary.
 */
public record Position(int line, int column) implements Comparable<Position> {

    public static final Position START = new Position(1, 1);

    public Position {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Position is 1-based, got " + line + ":" + column);
        }
    }

    public boolean isAfter(Position other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(Position other) {
        int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
