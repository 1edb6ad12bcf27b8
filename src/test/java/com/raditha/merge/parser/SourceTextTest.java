package com.raditha.merge.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceTextTest {

    @Test
    void testSplitLinesDropsFinalTerminator() {
        assertEquals(List.of("a", "b"), SourceText.splitLines("a\nb\n"));
        assertEquals(List.of("a", "", "b"), SourceText.splitLines("a\r\n\r\nb"));
        assertEquals(List.of(), SourceText.splitLines(""));
    }

    @Test
    void testNormalizeCollapsesWhitespace() {
        assertEquals("int x = 1;", SourceText.normalize("  int   x =\n\t1;  "));
    }

    @Test
    void testLineOutOfRangeIsEmpty() {
        SourceText text = new SourceText("first\nsecond\n");

        assertEquals(2, text.lineCount());
        assertEquals("second", text.line(2));
        assertEquals("", text.line(0));
        assertEquals("", text.line(3));
    }
}
