package io.github.tclast.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class PositionTrackerTest {

    @Test
    void advancesLinesAndColumns() {
        var tracker = new PositionTracker("ab\ncd");
        assertEquals(new Position(1, 1), tracker.positionAt(0));
        assertEquals(new Position(1, 3), tracker.positionAt(2));
        assertEquals(new Position(2, 1), tracker.positionAt(3));
        assertEquals(new Position(2, 3), tracker.positionAt(5));
    }

    @Test
    void answersOffsetsBehindTheCursor() {
        var tracker = new PositionTracker("ab\ncd\nef");
        tracker.positionAt(8);
        assertEquals(new Position(1, 2), tracker.positionAt(1));
        assertEquals(new Position(2, 1), tracker.positionAt(3));
        assertEquals(new Position(2, 2), tracker.positionAt(4));
        assertEquals(new Position(3, 2), tracker.positionAt(7));
    }

    @Test
    void clampsOutOfRangeOffsets() {
        var tracker = new PositionTracker("ab\ncd");
        assertEquals(new Position(2, 3), tracker.positionAt(100));
        assertEquals(new Position(1, 1), tracker.positionAt(-5));
    }

    @Test
    void surrogatePairIsOneColumn() {
        var text = "a😀b";
        assertEquals(new Position(1, 3), new PositionTracker(text).positionAt(3));

        var tracker = new PositionTracker(text);
        tracker.positionAt(4);
        assertEquals(new Position(1, 3), tracker.positionAt(3));
    }

    @Test
    void offsetInsideSurrogatePairSnapsToPairStart() {
        var text = "a😀b";
        assertEquals(new Position(1, 2), new PositionTracker(text).positionAt(2));

        var tracker = new PositionTracker(text);
        tracker.positionAt(4);
        assertEquals(new Position(1, 2), tracker.positionAt(2));
        assertEquals(new Position(1, 3), tracker.positionAt(3));
    }

    @Test
    void crlfIsOneLineBreak() {
        var tracker = new PositionTracker("a\r\nb");
        assertEquals(new Position(2, 1), tracker.positionAt(3));
        assertEquals(new Position(2, 2), tracker.positionAt(4));
    }

    @Test
    void rangeNeverEndsBeforeItStarts() {
        var tracker = new PositionTracker("abcdef");
        var range = tracker.rangeOf(4, 2);
        assertEquals(range.start(), range.end());
        assertEquals(new Position(1, 5), range.start());
    }
}
