package com.raditha.merge.merger;

import com.raditha.merge.config.MergeOptions;
import com.raditha.merge.exception.DestinationParseException;
import com.raditha.merge.exception.FreezeStructureException;
import com.raditha.merge.exception.TemplateParseException;
import com.raditha.merge.model.Decision;
import com.raditha.merge.model.Side;
import com.raditha.merge.similarity.MethodMatchRefiner;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SmartMerger - structural merge of whole Java files.
 */
class SmartMergerTest {

    private static final String CONFIG_TEMPLATE = """
            public class Config {
                static final String VERSION = "2.0.0";
            }
            """;

    private static final String CONFIG_DEST = """
            public class Config {
                static final String VERSION = "1.0.0";
            }
            """;

    private static final String WIDGET_TEMPLATE = """
            public class Widget {
                void a() {
                    // template a
                }

                void b() {
                    // template b
                }
            }
            """;

    private static final String WIDGET_DEST = """
            public class Widget {
                void a() {
                    // dest a
                }

                void b() {
                    // dest b
                }

                void c() {
                    // dest c
                }
            }
            """;

    @Nested
    class PreferenceTests {

        @Test
        void testDestinationWinsByDefault() {
            assertEquals(CONFIG_DEST, SmartMerger.merge(CONFIG_TEMPLATE, CONFIG_DEST, MergeOptions.defaults()));
        }

        @Test
        void testTemplatePreferenceUpdatesValue() {
            String merged = SmartMerger.merge(CONFIG_TEMPLATE, CONFIG_DEST,
                    MergeOptions.defaults().withPreference(Side.TEMPLATE));

            assertEquals(CONFIG_TEMPLATE, merged);
            assertFalse(merged.contains("1.0.0"));
        }
    }

    @Nested
    class TemplateOnlyTests {

        private static final String TEMPLATE = """
                public class Greeter {
                    void hello() {
                        System.out.println("hello");
                    }

                    void bye() {
                        System.out.println("bye");
                    }
                }
                """;

        private static final String DEST = """
                public class Greeter {
                    void hello() {
                        System.out.println("hi");
                    }
                }
                """;

        @Test
        void testTemplateOnlyMethodIsDroppedByDefault() {
            assertEquals(DEST, SmartMerger.merge(TEMPLATE, DEST, MergeOptions.defaults()));
        }

        @Test
        void testTemplateOnlyMethodIsPlacedAfterItsPredecessor() {
            String merged = SmartMerger.merge(TEMPLATE, DEST,
                    MergeOptions.defaults().withIncludeTemplateOnlyNodes(true));

            assertEquals("""
                    public class Greeter {
                        void hello() {
                            System.out.println("hi");
                        }

                        void bye() {
                            System.out.println("bye");
                        }
                    }
                    """, merged);
        }
    }

    @Nested
    class RecursionTests {

        @Test
        void testClassBodyIsMergedMemberByMember() {
            String merged = SmartMerger.merge(WIDGET_TEMPLATE, WIDGET_DEST, MergeOptions.defaults()
                    .withPreference(Side.TEMPLATE)
                    .withIncludeTemplateOnlyNodes(true));

            assertEquals("""
                    public class Widget {
                        void a() {
                            // template a
                        }

                        void b() {
                            // template b
                        }

                        void c() {
                            // dest c
                        }
                    }
                    """, merged);
        }

        @Test
        void testDepthZeroTreatsTopLevelNodesAtomically() {
            String merged = SmartMerger.merge(WIDGET_TEMPLATE, WIDGET_DEST, MergeOptions.defaults()
                    .withPreference(Side.TEMPLATE)
                    .withIncludeTemplateOnlyNodes(true)
                    .withMaxRecursionDepth(0));

            assertEquals(WIDGET_TEMPLATE, merged);
            assertFalse(merged.contains("dest c"));
        }

        @Test
        void testStaticInitializerMergesStatements() {
            String template = """
                    public class Registry {
                        static {
                            init("a");
                            init("b");
                        }
                    }
                    """;
            String dest = """
                    public class Registry {
                        static {
                            init("a");
                            custom();
                        }
                    }
                    """;

            String merged = SmartMerger.merge(template, dest,
                    MergeOptions.defaults().withIncludeTemplateOnlyNodes(true));

            assertEquals("""
                    public class Registry {
                        static {
                            init("a");
                            init("b");
                            custom();
                        }
                    }
                    """, merged);
        }
    }

    @Nested
    class FreezeTests {

        private static final String TEMPLATE = """
                public class Service {
                    int limit() {
                        return 10;
                    }

                    String name() {
                        return "template";
                    }
                }
                """;

        private static final String DEST = """
                public class Service {
                    // jmerge:freeze
                    int limit() {
                        return 99;
                    }
                    // jmerge:unfreeze

                    String name() {
                        return "dest";
                    }
                }
                """;

        @Test
        void testFrozenMethodSurvivesTemplatePreference() {
            String merged = SmartMerger.merge(TEMPLATE, DEST, MergeOptions.defaults()
                    .withPreference(Side.TEMPLATE)
                    .withIncludeTemplateOnlyNodes(true));

            assertEquals(DEST, merged);
            assertFalse(merged.contains("return 10;"));
        }

        @Test
        void testContainerHoldingFreezeRegionIsKeptWhole() {
            String template = """
                    public class Settings {
                        static final String VERSION = "2.0.0";

                        void m() {
                        }
                    }
                    """;
            String dest = """
                    public class Settings {
                        static final String VERSION = "1.0.0";

                        // jmerge:freeze
                        void m() {
                            custom();
                        }
                        // jmerge:unfreeze
                    }
                    """;

            String merged = SmartMerger.merge(template, dest, MergeOptions.defaults()
                    .withPreference(Side.TEMPLATE)
                    .withIncludeTemplateOnlyNodes(true));

            assertEquals(dest, merged);
            assertTrue(merged.contains("\"1.0.0\""));
            assertFalse(merged.contains("\"2.0.0\""));
        }

        @Test
        void testFrozenLinesAreReported() {
            MergeOutcome outcome = new SmartMerger(TEMPLATE, DEST,
                    MergeOptions.defaults().withPreference(Side.TEMPLATE)).mergeWithDebug();

            assertEquals(11, outcome.statistics().get(Decision.FREEZE_BLOCK));
            assertFalse(outcome.statistics().containsKey(Decision.KEPT_TEMPLATE));
        }

        @Test
        void testUnclosedMarkerFailsAtConstruction() {
            String broken = """
                    public class Service {
                        // jmerge:freeze
                        int limit() {
                            return 99;
                        }
                    }
                    """;

            assertThrows(FreezeStructureException.class, () -> new SmartMerger(TEMPLATE, broken));
        }

        @Test
        void testMarkersAreIgnoredWhenFreezeIsDisabled() {
            String merged = SmartMerger.merge(TEMPLATE, DEST, MergeOptions.defaults()
                    .withPreference(Side.TEMPLATE)
                    .withFreezeToken(null));

            assertTrue(merged.contains("return 10;"));
            assertFalse(merged.contains("return 99;"));
        }
    }

    @Test
    void testDirectivePrefixIsKeptOnceAcrossRuns() {
        String template = """
                package com.example;

                public class A {
                    int x;
                    int y;
                }
                """;
        String dest = """
                // @formatter:off
                package com.example;

                public class A {
                    int x;
                }
                """;
        MergeOptions options = MergeOptions.defaults().withIncludeTemplateOnlyNodes(true);

        String first = SmartMerger.merge(template, dest, options);
        String second = SmartMerger.merge(template, first, options);

        assertEquals(first, second);
        assertTrue(first.startsWith("// @formatter:off\npackage com.example;\n"));
        assertEquals(first.indexOf("@formatter:off"), first.lastIndexOf("@formatter:off"));
        assertTrue(first.contains("int y;"));
    }

    @Test
    void testFuzzyMatchingPairsRenamedMethod() {
        String template = """
                public class Calc {
                    int addNumbers(int a, int b) {
                        return a + b;
                    }
                }
                """;
        String dest = """
                public class Calc {
                    int addNumber(int a, int b) {
                        return a + b + 0;
                    }
                }
                """;
        MergeOptions options = MergeOptions.defaults().withIncludeTemplateOnlyNodes(true);

        String plain = SmartMerger.merge(template, dest, options);
        assertTrue(plain.contains("addNumbers"));
        assertTrue(plain.contains("addNumber("));

        String fuzzy = SmartMerger.merge(template, dest, options.withMatchRefiner(new MethodMatchRefiner()));
        assertEquals(dest, fuzzy);
    }

    @Test
    void testParseErrorsNameTheSide() {
        SmartMerger badTemplate = new SmartMerger("public class {", CONFIG_DEST);
        assertThrows(TemplateParseException.class, badTemplate::merge);

        SmartMerger badDest = new SmartMerger(CONFIG_TEMPLATE, "public class {");
        assertThrows(DestinationParseException.class, badDest::merge);
    }

    @Test
    void testMergeWithDebug() {
        MergeOutcome outcome = new SmartMerger(CONFIG_TEMPLATE, CONFIG_DEST).mergeWithDebug();

        assertEquals(CONFIG_DEST, outcome.content());
        assertEquals(1, outcome.debugInfo().templateStatements());
        assertEquals(1, outcome.debugInfo().destinationStatements());
        assertEquals("jmerge", outcome.debugInfo().freezeToken());
        assertFalse(outcome.debugInfo().addTemplateOnlyNodes());
        assertTrue(outcome.debugInfo().provenanceReport().startsWith("=== Merge Result Debug ==="));
        assertEquals(3, outcome.statistics().values().stream().mapToInt(Integer::intValue).sum());
    }

    @Test
    void testIsRecursableHonoursDepth() {
        SmartMerger merger = new SmartMerger(WIDGET_TEMPLATE, WIDGET_DEST,
                MergeOptions.defaults().withMaxRecursionDepth(1));
        var templateClass = merger.getTemplateAnalysis().statements().get(0).node();
        var destClass = merger.getDestinationAnalysis().statements().get(0).node();

        assertTrue(merger.isRecursable(templateClass, destClass, 0));
        assertFalse(merger.isRecursable(templateClass, destClass, 1));
        assertFalse(merger.isRecursable(templateClass.body().children().get(0),
                destClass.body().children().get(0), 0));
    }

    @Property(tries = 50)
    void mergingAFileWithItselfIsIdentity(@ForAll("classes") String source) {
        assertEquals(source, SmartMerger.merge(source, source, MergeOptions.defaults()));
    }

    @Property(tries = 30)
    void frozenLinesSurviveAnyPreference(@ForAll @IntRange(min = 0, max = 999) int frozenValue,
                                         @ForAll boolean templateWins, @ForAll boolean includeTemplateOnly) {
        String frozen = """
                    // jmerge:freeze
                    int limit() {
                        return %d;
                    }
                    // jmerge:unfreeze
                """.formatted(frozenValue);
        String dest = "public class Service {\n" + frozen + "}\n";
        String template = """
                public class Service {
                    int limit() {
                        return -1;
                    }

                    int extra() {
                        return 0;
                    }
                }
                """;
        MergeOptions options = MergeOptions.defaults()
                .withPreference(templateWins ? Side.TEMPLATE : Side.DESTINATION)
                .withIncludeTemplateOnlyNodes(includeTemplateOnly);

        String merged = SmartMerger.merge(template, dest, options);

        assertTrue(merged.contains(frozen));
        assertFalse(merged.contains("return -1;"));
        assertFalse(merged.contains("int extra()"));
    }

    @Property(tries = 30)
    void destinationOnlyMethodsAreNeverLost(@ForAll @IntRange(min = 1, max = 4) int localMethods,
                                            @ForAll boolean templateWins) {
        StringBuilder dest = new StringBuilder("public class Local {\n    int shared() {\n        return 1;\n    }\n");
        for (int i = 0; i < localMethods; i++) {
            dest.append("\n    int local").append(i)
                    .append("() {\n        return ").append(1000 + i).append(";\n    }\n");
        }
        dest.append("}\n");
        String template = """
                public class Local {
                    int shared() {
                        return 2;
                    }
                }
                """;

        String merged = SmartMerger.merge(template, dest.toString(),
                MergeOptions.defaults().withPreference(templateWins ? Side.TEMPLATE : Side.DESTINATION));

        for (int i = 0; i < localMethods; i++) {
            assertTrue(merged.contains("int local" + i + "() {"));
        }
        assertEquals(templateWins, merged.contains("return 2;"));
    }

    @Provide
    Arbitrary<String> classes() {
        Arbitrary<Integer> fields = Arbitraries.integers().between(0, 3);
        Arbitrary<Integer> methods = Arbitraries.integers().between(0, 3);
        Arbitrary<Boolean> withPackage = Arbitraries.of(true, false);
        return Combinators.combine(fields, methods, withPackage).as(SmartMergerTest::buildClass);
    }

    private static String buildClass(int fields, int methods, boolean withPackage) {
        StringBuilder sb = new StringBuilder();
        if (withPackage) {
            sb.append("package com.example;\n\n");
        }
        sb.append("public class Generated {\n");
        for (int i = 0; i < fields; i++) {
            sb.append("    private int field").append(i).append(" = ").append(i).append(";\n");
        }
        for (int i = 0; i < methods; i++) {
            if (fields > 0 || i > 0) {
                sb.append("\n");
            }
            sb.append("    int method").append(i).append("(int value) {\n");
            sb.append("        return value + ").append(i).append(";\n");
            sb.append("    }\n");
        }
        sb.append("}\n");
        return sb.toString();
    }
}
