package com.raditha.merge.parser;

import com.raditha.merge.model.Node;
import com.raditha.merge.model.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JavaSourceParser - conversion of JavaParser trees into merge nodes.
 */
class JavaSourceParserTest {

    private JavaSourceParser parser;

    @BeforeEach
    void setUp() {
        parser = new JavaSourceParser();
    }

    @Test
    void testTopLevelNodes() {
        ParsedSource parsed = parser.parse("""
                package com.example;

                import java.util.List;
                import static java.util.Map.entry;

                public class Greeter {
                }
                """);

        assertTrue(parsed.valid());
        List<Node> nodes = parsed.nodes();
        assertEquals(4, nodes.size());
        assertEquals(NodeKind.PACKAGE, nodes.get(0).kind());
        assertEquals("java.util.List", nodes.get(1).discriminant());
        assertEquals("static java.util.Map.entry", nodes.get(2).discriminant());
        assertEquals(NodeKind.TYPE_DECLARATION, nodes.get(3).kind());
        assertEquals("class", nodes.get(3).keyword());
    }

    @Test
    void testClassMembersAndBody() {
        ParsedSource parsed = parser.parse("""
                public class Service {
                    static final String VERSION = "1.0";
                    private int count;

                    static {
                        init();
                    }

                    public Service(int count) {
                        this.count = count;
                    }

                    public int add(int a, int b) {
                        return a + b;
                    }
                }
                """);

        Node type = parsed.nodes().get(0);
        assertTrue(type.hasBody());
        assertEquals(1, type.body().openLine());
        assertEquals(16, type.body().closeLine());
        assertTrue(type.body().isWindowed());

        List<Node> members = type.body().children();
        assertEquals(5, members.size());
        assertEquals(NodeKind.CONSTANT, members.get(0).kind());
        assertEquals("VERSION", members.get(0).name());
        assertEquals(NodeKind.VARIABLE, members.get(1).kind());
        assertEquals(NodeKind.INITIALIZER, members.get(2).kind());
        assertEquals("static", members.get(2).keyword());
        assertEquals("constructor", members.get(3).keyword());
        assertEquals(List.of("a", "b"), members.get(4).parameters());
    }

    @Test
    void testCallWithBlockLambdaHasBody() {
        ParsedSource parsed = parser.parse("""
                public class Routes {
                    void routes() {
                        get("/users", (req) -> {
                            list(req);
                        });
                    }
                }
                """);

        Node method = parsed.nodes().get(0).body().children().get(0);
        Node call = method.children().get(0);
        assertEquals(NodeKind.CALL, call.kind());
        assertEquals("get(\"/users\", (req) -> {})", call.discriminant());
        assertTrue(call.hasBody());
        assertEquals(1, call.body().children().size());
    }

    @Test
    void testEnumIsAtomic() {
        ParsedSource parsed = parser.parse("""
                enum Color {
                    RED,
                    GREEN
                }
                """);

        Node type = parsed.nodes().get(0);
        assertEquals("enum", type.keyword());
        assertFalse(type.hasBody());
        assertEquals(2, type.children().size());
    }

    @Test
    void testCommentsAreCollectedInOrder() {
        ParsedSource parsed = parser.parse("""
                // first
                public class A {
                    /** second */
                    int x; // third
                }
                """);

        assertEquals(3, parsed.comments().size());
        assertEquals("first", parsed.comments().get(0).content().trim());
        assertEquals("third", parsed.comments().get(2).content().trim());
    }

    @Test
    void testInvalidSourceReportsDiagnostics() {
        ParsedSource parsed = parser.parse("public class {");

        assertFalse(parsed.valid());
        assertFalse(parsed.diagnostics().isEmpty());
        assertTrue(parsed.nodes().isEmpty());
    }
}
