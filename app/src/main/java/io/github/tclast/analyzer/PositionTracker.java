package io.github.tclast.analyzer;

import java.util.Arrays;

/**
 * Converts character offsets of one source text into 1-based line/column positions.
 *
 * <p>A running cursor is advanced over the raw characters; {@code '\n'} increments the line and resets the column,
 * a surrogate pair counts as one column. Line starts are recorded as the cursor passes them, so asking for an offset
 * behind the cursor (a parent's start after its children were stamped) costs one binary search plus a scan of that
 * line.
 */
public final class PositionTracker {
    private final String text;

    private int offset;
    private int line = 1;
    private int column = 1;

    // offsets at which each line starts, index 0 = line 1
    private int[] lineStarts = new int[16];
    private int lineCount = 1;

    // last position answered behind the cursor; lookups there tend to move forward
    private int backOffset = -1;
    private int backLine;
    private int backColumn;

    public PositionTracker(String text) {
        this.text = text;
    }

    /**
     * Offsets outside {@code [0, length]} are clamped. An offset between the two halves of a surrogate pair is moved
     * back to the start of the pair.
     */
    public Position positionAt(int target) {
        int clamped = Math.max(0, Math.min(target, text.length()));
        if (clamped > 0
                && clamped < text.length()
                && Character.isHighSurrogate(text.charAt(clamped - 1))
                && Character.isLowSurrogate(text.charAt(clamped))) {
            clamped--;
        }
        if (clamped >= offset) {
            advanceTo(clamped);
            return new Position(line, column);
        }
        return lookBack(clamped);
    }

    public Range rangeOf(int start, int end) {
        var startPos = positionAt(start);
        var endPos = positionAt(Math.max(start, end));
        return new Range(startPos, endPos);
    }

    private void advanceTo(int target) {
        while (offset < target) {
            char c = text.charAt(offset);
            if (c == '\n') {
                offset++;
                line++;
                column = 1;
                recordLineStart(offset);
            } else if (Character.isHighSurrogate(c)
                    && offset + 1 < target
                    && Character.isLowSurrogate(text.charAt(offset + 1))) {
                offset += 2;
                column++;
            } else {
                offset++;
                column++;
            }
        }
    }

    private Position lookBack(int target) {
        int idx = Arrays.binarySearch(lineStarts, 0, lineCount, target);
        int lineIdx = idx >= 0 ? idx : -idx - 2;
        int col;
        if (backOffset >= lineStarts[lineIdx] && backOffset <= target && backLine == lineIdx + 1) {
            col = backColumn + Character.codePointCount(text, backOffset, target);
        } else {
            col = 1 + Character.codePointCount(text, lineStarts[lineIdx], target);
        }
        backOffset = target;
        backLine = lineIdx + 1;
        backColumn = col;
        return new Position(backLine, col);
    }

    private void recordLineStart(int start) {
        if (lineCount == lineStarts.length) {
            lineStarts = Arrays.copyOf(lineStarts, lineStarts.length * 2);
        }
        lineStarts[lineCount++] = start;
    }
}
