package com.raditha.merge.result;

import com.raditha.merge.analysis.FileAnalysis;
import com.raditha.merge.config.MergeOptions;
import com.raditha.merge.model.Decision;
import com.raditha.merge.model.LineRange;
import com.raditha.merge.model.Side;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MergeResultTest {

    @Test
    void testEmptyResultHasEmptyContent() {
        MergeResult result = new MergeResult();

        assertTrue(result.isEmpty());
        assertEquals("", result.content());
        assertTrue(result.statistics().isEmpty());
        assertEquals(0, result.trailingBlankLines());
    }

    @Test
    void testContentEndsWithNewline() {
        MergeResult result = new MergeResult();
        result.addLine("class A {", Decision.KEPT_TEMPLATE, Side.TEMPLATE, 1);
        result.addLine("}", Decision.KEPT_DESTINATION, Side.DESTINATION, 4);

        assertEquals("class A {\n}\n", result.content());
        assertEquals(1, result.getProvenance().get(0).templateLine());
        assertNull(result.getProvenance().get(0).destLine());
        assertEquals(4, result.getProvenance().get(1).destLine());
    }

    @Test
    void testStatisticsCountLinesPerDecision() {
        MergeResult result = new MergeResult();
        result.addLine("a", Decision.REPLACED, Side.TEMPLATE, 3);
        result.addLine("b", Decision.REPLACED, Side.TEMPLATE, 4);
        result.addLine("", Decision.APPENDED, Side.DESTINATION, 7);
        result.addLine("", Decision.APPENDED, Side.DESTINATION, 8);

        assertEquals(Map.of(Decision.REPLACED, 2, Decision.APPENDED, 2), result.statistics());
        assertEquals(0, result.count(Decision.FREEZE_BLOCK));
        assertEquals(2, result.trailingBlankLines());
        assertEquals(4, result.getProvenance().get(1).templateLine());
        assertEquals(2, result.linesByDecision(Decision.APPENDED).size());
    }

    @Test
    void testAddLinesCopiesRangeFromAnalysis() {
        FileAnalysis analysis = new FileAnalysis("""
                class A {
                    int x;
                }
                """, MergeOptions.defaults());
        MergeResult result = new MergeResult();

        result.addLines(analysis, LineRange.of(2, 3), Decision.KEPT_DESTINATION, Side.DESTINATION);

        assertEquals(List.of("    int x;", "}"), result.getLines());
        assertEquals(2, result.getProvenance().get(0).destLine());
    }

    @Test
    void testDebugOutput() {
        MergeResult result = new MergeResult();
        result.addLine("import java.util.List;", Decision.KEPT_TEMPLATE, Side.TEMPLATE, 1);

        String debug = result.debugOutput();

        assertTrue(debug.startsWith("=== Merge Result Debug ==="));
        assertTrue(debug.contains("Total lines: 1"));
        assertTrue(debug.contains("kept_template=1"));
        assertTrue(debug.contains("T:1"));
        assertTrue(debug.contains("| import java.util.List;"));
    }
}
