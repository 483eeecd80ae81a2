package io.github.tclast.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RangeTest {

    @Test
    void startMayNotFollowEnd() {
        assertThrows(IllegalArgumentException.class, () -> Range.of(2, 1, 1, 5));
        assertDoesNotThrow(() -> Range.of(1, 5, 1, 5));
    }

    @Test
    void emptyRangeStartsAndEndsAtSamePosition() {
        var at = new Position(4, 2);
        var empty = Range.empty(at);
        assertEquals(at, empty.start());
        assertEquals(at, empty.end());
    }

    @Test
    void containsNestedRanges() {
        var outer = Range.of(1, 1, 5, 2);
        assertTrue(outer.contains(Range.of(2, 3, 4, 1)));
        assertTrue(outer.contains(outer));
        assertFalse(outer.contains(Range.of(1, 1, 5, 3)));
    }
}
