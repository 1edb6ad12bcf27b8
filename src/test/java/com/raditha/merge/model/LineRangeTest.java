package com.raditha.merge.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineRangeTest {

    @Test
    void testContainsAndEncloses() {
        LineRange range = LineRange.of(3, 7);

        assertTrue(range.contains(3));
        assertTrue(range.contains(7));
        assertFalse(range.contains(8));
        assertTrue(range.encloses(LineRange.of(4, 6)));
        assertFalse(range.encloses(LineRange.of(2, 6)));
        assertEquals(5, range.lineCount());
    }

    @Test
    void testOverlapsIsNullSafe() {
        LineRange range = LineRange.of(3, 7);

        assertTrue(range.overlaps(LineRange.of(7, 9)));
        assertFalse(range.overlaps(LineRange.of(8, 9)));
        assertFalse(range.overlaps(null));
    }

    @Test
    void testOfNullableRejectsEmptyRanges() {
        assertNull(LineRange.ofNullable(5, 4));
        assertEquals(LineRange.of(5, 5), LineRange.ofNullable(5, 5));
        assertThrows(IllegalArgumentException.class, () -> LineRange.of(5, 4));
    }

    @Test
    void testDisplayString() {
        assertEquals("L4-5", LineRange.of(4, 5).toDisplayString());
    }
}
