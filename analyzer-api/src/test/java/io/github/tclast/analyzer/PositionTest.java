package io.github.tclast.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class PositionTest {

    @Test
    void ordersByLineThenColumn() {
        var a = new Position(1, 9);
        var b = new Position(2, 1);
        var c = new Position(2, 4);

        assertTrue(a.compareTo(b) < 0);
        assertTrue(c.isAfter(b));
        assertFalse(a.isAfter(a));
        assertEquals(0, new Position(2, 4).compareTo(c));
    }

    @Test
    void rejectsZeroBasedValues() {
        assertThrows(IllegalArgumentException.class, () -> new Position(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new Position(1, 0));
    }

    @Test
    void printsAsLineColon() {
        assertEquals("3:7", new Position(3, 7).toString());
        assertEquals(new Position(1, 1), Position.START);
    }
}
