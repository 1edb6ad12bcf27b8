package com.raditha.merge.analysis;

import com.raditha.merge.config.MergeOptions;
import com.raditha.merge.model.Node;
import com.raditha.merge.model.NodeKind;
import com.raditha.merge.parser.ParsedSource;
import com.raditha.merge.parser.SourceParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for FileAnalysis - units, comment attachment and the directive prefix.
 */
class FileAnalysisTest {

    private static FileAnalysis analyze(String source) {
        return new FileAnalysis(source, MergeOptions.defaults());
    }

    @Test
    void testDirectivePrefixAndLeadingJavadoc() {
        FileAnalysis analysis = analyze("""
                // @formatter:off

                package com.example;

                import java.util.List;

                /** Greets people. */
                public class Greeter {
                    // the name to greet
                    private String name;
                }
                """);

        assertEquals(2, analysis.prefixEnd());
        List<NodeInfo> units = analysis.statements();
        assertEquals(3, units.size());
        assertEquals(NodeKind.PACKAGE, units.get(0).node().kind());
        assertEquals(NodeKind.IMPORT, units.get(1).node().kind());

        NodeInfo type = units.get(2);
        assertEquals(1, type.leadingComments().size());
        assertEquals(7, type.firstLine());
        assertEquals(8, type.node().startLine());

        FileAnalysis body = analysis.forBody(type.node());
        assertFalse(body.isRoot());
        assertEquals(1, body.statements().size());
        assertEquals("the name to greet", body.statements().get(0).leadingComments().get(0).content().trim());
    }

    @Test
    void testNoPrefixWithoutDirectives() {
        FileAnalysis analysis = analyze("""
                // Licensed to someone
                package com.example;
                """);

        assertEquals(0, analysis.prefixEnd());
        assertEquals(1, analysis.statements().get(0).leadingComments().size());
    }

    @Test
    void testInlineAndTrailingComments() {
        FileAnalysis analysis = analyze("""
                public class Counter {
                    int count = 0; // starts at zero
                    // nothing after this
                }
                """);

        FileAnalysis body = analysis.forBody(analysis.statements().get(0).node());
        NodeInfo field = body.statements().get(0);

        assertEquals(1, field.inlineComments().size());
        assertEquals(1, field.trailingComments().size());
        assertEquals(2, field.contentEndLine());
        assertEquals(3, field.lastLine());
    }

    @Test
    void testCommentOnlyDocumentGroupsByBlankLines() {
        FileAnalysis analysis = analyze("""
                // first

                // second
                // third
                """);

        assertTrue(analysis.isCommentOnly());
        assertEquals(2, analysis.statements().size());
        Node second = analysis.statements().get(1).node();
        assertEquals(NodeKind.COMMENT, second.kind());
        assertEquals(3, second.startLine());
        assertEquals(4, second.endLine());
    }

    @Test
    void testFreezeRegionReplacesEnclosedNodes() {
        FileAnalysis analysis = analyze("""
                public class Service {
                    // jmerge:freeze
                    public int limit() {
                        return 99;
                    }
                    // jmerge:unfreeze

                    public String name() {
                        return "dest";
                    }
                }
                """);

        Node type = analysis.statements().get(0).node();
        assertTrue(analysis.containsFreezeRegion(type));

        FileAnalysis body = analysis.forBody(type);
        assertEquals(2, body.statements().size());
        assertTrue(body.statements().get(0).node().isFreezeBlock());
        assertEquals(1, body.freezeBlocks().size());
        assertEquals("name", body.statements().get(1).node().name());
        assertTrue(body.inFreezeRegion(4));
        assertFalse(body.inFreezeRegion(8));
    }

    @Test
    void testFreezeDisabled() {
        FileAnalysis analysis = new FileAnalysis("""
                // jmerge:unfreeze
                public class A {
                }
                """, MergeOptions.defaults().withFreezeToken(null));

        assertTrue(analysis.freezeRegions().isEmpty());
    }

    @Test
    void testBlankLineCounting() {
        FileAnalysis analysis = analyze("""
                package com.example;


                import java.util.List;
                """);

        assertEquals(2, analysis.blankLinesAbove(4, 0));
        assertEquals(1, analysis.blankLinesAbove(4, 2));
        assertEquals(2, analysis.blankLinesBelow(1, 5));
    }

    @Test
    void testUsesInjectedParser() {
        SourceParser parser = mock(SourceParser.class);
        when(parser.parse("broken")).thenReturn(ParsedSource.invalid("broken", List.of("syntax error")));

        FileAnalysis analysis = new FileAnalysis("broken", parser, MergeOptions.defaults());

        assertFalse(analysis.isValid());
        assertEquals(List.of("syntax error"), analysis.diagnostics());
        verify(parser).parse("broken");
    }
}
