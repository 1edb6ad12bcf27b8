package com.raditha.merge.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    @Test
    void testFreezeBlockFactory() {
        Node block = Node.freezeBlock(LineRange.of(2, 4), "// jmerge:freeze\nint x;\n// jmerge:unfreeze",
                "// jmerge:freeze int x; // jmerge:unfreeze", List.of());

        assertTrue(block.isFreezeBlock());
        assertFalse(block.isMergeable());
        assertEquals(NodeKind.FREEZE_BLOCK, block.kind());
        assertEquals("FreezeBlock at lines 2-4", block.toString());
    }

    @Test
    void testCommentBlockKeywords() {
        Node directive = Node.commentBlock(LineRange.of(1, 1), "// NOSONAR", "NOSONAR", "NOSONAR");
        Node plain = Node.commentBlock(LineRange.of(1, 1), "// hello", "hello", null);

        assertEquals("directive", directive.keyword());
        assertEquals("comment", plain.keyword());
        assertEquals(NodeKind.COMMENT, plain.kind());
    }

    @Test
    void testKindTags() {
        assertEquals("type_declaration", NodeKind.TYPE_DECLARATION.tag());
        assertEquals(NodeKind.TYPE_DECLARATION, NodeKind.fromTag("type-declaration"));
        assertEquals(NodeKind.DEFINITION, NodeKind.fromTag("Definition"));
        assertThrows(IllegalArgumentException.class, () -> NodeKind.fromTag("widget"));
    }

    @Test
    void testSideParsing() {
        assertEquals(Side.DESTINATION, Side.fromString("dest"));
        assertEquals(Side.TEMPLATE, Side.fromString("TEMPLATE"));
        assertThrows(IllegalArgumentException.class, () -> Side.fromString("both"));
    }

    @Test
    void testAnchorOverlap() {
        Anchor first = new Anchor(LineRange.of(1, 3), LineRange.of(1, 3), AnchorType.EXACT_LINE, 3);
        Anchor second = new Anchor(LineRange.of(5, 6), LineRange.of(3, 4), AnchorType.EXACT_LINE, 2);
        Anchor third = new Anchor(LineRange.of(7, 8), LineRange.of(7, 8), AnchorType.SIGNATURE_MATCH, 2);

        assertTrue(first.overlaps(second), "Destination ranges share line 3");
        assertFalse(first.overlaps(third));
    }
}
