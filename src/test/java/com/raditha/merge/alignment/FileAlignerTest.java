package com.raditha.merge.alignment;

import com.raditha.merge.analysis.FileAnalysis;
import com.raditha.merge.config.MergeOptions;
import com.raditha.merge.model.Anchor;
import com.raditha.merge.model.AnchorType;
import com.raditha.merge.model.Boundary;
import com.raditha.merge.model.LineRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FileAligner - anchors and the boundaries between them.
 */
class FileAlignerTest {

    private static FileAligner aligner(String template, String dest) {
        return new FileAligner(new FileAnalysis(template, MergeOptions.defaults()),
                new FileAnalysis(dest, MergeOptions.defaults()));
    }

    @Test
    void testIdenticalDocumentsGiveOneAnchorAndNoBoundaries() {
        String source = """
                package com.example;

                public class A {
                    int x;
                }
                """;
        FileAligner aligner = aligner(source, source);

        List<Boundary> boundaries = aligner.align();

        assertTrue(boundaries.isEmpty());
        assertEquals(1, aligner.getAnchors().size());
        Anchor anchor = aligner.getAnchors().get(0);
        assertEquals(AnchorType.EXACT_LINE, anchor.type());
        assertEquals(LineRange.of(1, 5), anchor.templateRange());
    }

    @Test
    void testNoAnchorsGiveOneBoundary() {
        FileAligner aligner = aligner("class A {\n}\n", "class B {\n}\n");

        List<Boundary> boundaries = aligner.align();

        assertTrue(aligner.getAnchors().isEmpty());
        assertEquals(1, boundaries.size());
        assertEquals(LineRange.of(1, 2), boundaries.get(0).templateRange());
        assertEquals(LineRange.of(1, 2), boundaries.get(0).destRange());
        assertNull(boundaries.get(0).prevAnchor());
        assertNull(boundaries.get(0).nextAnchor());
    }

    @Test
    void testSignatureAnchorIncludesLeadingComments() {
        FileAligner aligner = aligner("""
                import java.util.List;

                // the type
                class A {
                    int x;
                }
                """, """
                // the type
                class A {
                    int y;
                }
                """);

        List<Boundary> boundaries = aligner.align();

        assertEquals(1, aligner.getAnchors().size());
        Anchor anchor = aligner.getAnchors().get(0);
        assertEquals(AnchorType.SIGNATURE_MATCH, anchor.type());
        assertEquals(LineRange.of(3, 6), anchor.templateRange());
        assertEquals(LineRange.of(1, 4), anchor.destRange());

        assertEquals(1, boundaries.size());
        Boundary leading = boundaries.get(0);
        assertEquals(LineRange.of(1, 2), leading.templateRange());
        assertNull(leading.destRange());
        assertSame(anchor, leading.nextAnchor());
    }

    @Test
    void testCommentOnlyExactLinesAnchorBySignature() {
        FileAligner aligner = aligner("""
                // Header A

                // Header B
                """, """
                // Header A
                // Local note

                // Header B
                """);

        aligner.align();

        assertEquals(1, aligner.getAnchors().size());
        assertEquals(LineRange.of(3, 3), aligner.getAnchors().get(0).templateRange());
        assertEquals(LineRange.of(4, 4), aligner.getAnchors().get(0).destRange());
    }

    @Test
    void testMatchingFreezeRegionsSeedFreezeAnchor() {
        FileAligner aligner = aligner("""
                class A {
                }

                // jmerge:freeze
                class F {
                }
                // jmerge:unfreeze
                """, """
                class B {
                }

                // jmerge:freeze
                class G {
                }
                // jmerge:unfreeze
                """);

        List<Boundary> boundaries = aligner.align();

        assertEquals(1, aligner.getAnchors().size());
        Anchor anchor = aligner.getAnchors().get(0);
        assertEquals(AnchorType.FREEZE_BLOCK, anchor.type());
        assertEquals(Anchor.FREEZE_SCORE, anchor.score());
        assertEquals(LineRange.of(4, 7), anchor.templateRange());
        assertEquals(LineRange.of(4, 7), anchor.destRange());

        assertEquals(1, boundaries.size());
        assertEquals(LineRange.of(1, 3), boundaries.get(0).templateRange());
        assertSame(anchor, boundaries.get(0).nextAnchor());
    }

    @Test
    void testUnpairedFreezeRegionStaysInBoundary() {
        FileAligner aligner = aligner("""
                class A {
                }
                """, """
                class A {
                }

                // jmerge:freeze
                class G {
                }
                // jmerge:unfreeze
                """);

        List<Boundary> boundaries = aligner.align();

        assertTrue(aligner.getAnchors().stream().noneMatch(anchor -> anchor.type() == AnchorType.FREEZE_BLOCK));
        assertEquals(1, boundaries.size());
        assertNull(boundaries.get(0).templateRange());
        assertEquals(LineRange.of(3, 7), boundaries.get(0).destRange());
    }

    @Test
    void testExactLineAnchorsCompareWholeLines() {
        String dest = """
                // note
                class B {
                }
                """;

        FileAligner same = aligner("""
                // note
                class A {
                }
                """, dest);
        same.align();
        assertEquals(1, same.getAnchors().size());
        assertEquals(AnchorType.EXACT_LINE, same.getAnchors().get(0).type());

        FileAligner indented = aligner("""
                    // note
                class A {
                }
                """, dest);
        indented.align();
        assertTrue(indented.getAnchors().isEmpty());
    }
}
