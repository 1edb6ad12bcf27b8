package com.raditha.merge.cli;

import com.raditha.merge.config.MergeOptions;
import com.raditha.merge.exception.FreezeStructureException;
import com.raditha.merge.model.NodeKind;
import com.raditha.merge.model.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JavaMergeCLITest {

    private static final String TEMPLATE = """
            public class Config {
                static final String VERSION = "2.0.0";
            }
            """;

    private static final String DEST = """
            public class Config {
                static final String VERSION = "1.0.0";
            }
            """;

    @TempDir
    Path tempDir;

    private Path template;
    private Path destination;
    private StringWriter out;
    private StringWriter err;
    private CommandLine cmd;

    @BeforeEach
    void setUp() throws IOException {
        template = tempDir.resolve("Template.java");
        destination = tempDir.resolve("Config.java");
        Files.writeString(template, TEMPLATE);
        Files.writeString(destination, DEST);

        out = new StringWriter();
        err = new StringWriter();
        cmd = JavaMergeCLI.createCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    private int run(String... args) {
        return cmd.execute(args);
    }

    @Test
    void testMergedContentGoesToStdout() {
        int exitCode = run(template.toString(), destination.toString());

        assertEquals(0, exitCode);
        assertEquals(DEST, out.toString());
    }

    @Test
    void testOutputFile() throws IOException {
        Path output = tempDir.resolve("out/Merged.java");
        Files.createDirectories(output.getParent());

        int exitCode = run(template.toString(), destination.toString(),
                "--preference", "template", "--output", output.toString());

        assertEquals(0, exitCode);
        assertEquals(TEMPLATE, Files.readString(output));
        assertEquals("", out.toString());
        assertEquals(DEST, Files.readString(destination));
    }

    @Test
    void testInPlace() throws IOException {
        int exitCode = run(template.toString(), destination.toString(), "--preference=template", "--in-place");

        assertEquals(0, exitCode);
        assertEquals(TEMPLATE, Files.readString(destination));
    }

    @Test
    void testDiffOutput() {
        int exitCode = run(template.toString(), destination.toString(), "--preference", "template", "--diff");

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("--- a/Config.java"));
        assertTrue(out.toString().contains("+    static final String VERSION = \"2.0.0\";"));
    }

    @Test
    void testDebugOutput() {
        int exitCode = run(template.toString(), destination.toString(), "--debug");

        assertEquals(0, exitCode);
        assertTrue(out.toString().startsWith("=== Merge Result Debug ==="));
    }

    @Test
    void testStatsJson() throws IOException {
        Path stats = tempDir.resolve("stats.json");

        int exitCode = run(template.toString(), destination.toString(), "--stats-json", stats.toString());

        assertEquals(0, exitCode);
        assertTrue(Files.readString(stats).contains("\"totalLines\" : 3"));
    }

    @Test
    void testMissingFileIsAnIoError() {
        int exitCode = run(tempDir.resolve("Missing.java").toString(), destination.toString());

        assertEquals(JavaMergeCLI.EXIT_IO, exitCode);
        assertTrue(err.toString().contains("I/O error"));
    }

    @Test
    void testUnknownPreferenceIsAUsageError() {
        int exitCode = run(template.toString(), destination.toString(), "--preference", "sideways");

        assertEquals(JavaMergeCLI.EXIT_USAGE, exitCode);
    }

    @Test
    void testConflictingOptions() {
        Path output = tempDir.resolve("Merged.java");

        assertEquals(JavaMergeCLI.EXIT_USAGE,
                run(template.toString(), destination.toString(), "--in-place", "--output", output.toString()));
        assertEquals(JavaMergeCLI.EXIT_USAGE,
                run(template.toString(), destination.toString(), "--no-freeze", "--freeze-token", "keep"));
        assertEquals(JavaMergeCLI.EXIT_USAGE,
                run(template.toString(), destination.toString(), "--fuzzy-threshold", "1.5"));
        assertFalse(Files.exists(output));
    }

    @Test
    void testMalformedFreezeMarkersAreAMergeError() throws IOException {
        Files.writeString(destination, """
                public class Config {
                    // jmerge:unfreeze
                }
                """);

        int exitCode = run(template.toString(), destination.toString());

        assertEquals(JavaMergeCLI.EXIT_MERGE, exitCode);
        assertTrue(err.toString().contains("Merge error"));
    }

    @Test
    void testCommandLineOverridesSettingsFile() throws IOException {
        Path config = tempDir.resolve("jmerge.yml");
        Files.writeString(config, """
                jmerge:
                  preference: template
                  max_recursion_depth: 1
                """);
        JavaMergeCLI cli = new JavaMergeCLI();
        new CommandLine(cli).parseArgs("--config-file", config.toString(), "--max-depth", "4",
                "--prefer", "constant=destination", "--add-template-only",
                template.toString(), destination.toString());

        MergeOptions options = cli.buildOptions();

        assertEquals(4, options.maxRecursionDepth());
        assertEquals(Side.TEMPLATE, options.preference().defaultSide());
        assertEquals(Side.DESTINATION, options.preference().forMergeType("constant"));
        assertTrue(options.nodeTyping().containsKey(NodeKind.CONSTANT));
        assertTrue(options.includeTemplateOnlyNodes());
    }

    @Test
    void testExitCodeMapping() {
        assertEquals(JavaMergeCLI.EXIT_MERGE, JavaMergeCLI.exitCodeFor(
                new FreezeStructureException(FreezeStructureException.Kind.UNMATCHED_END, "bad")));
        assertEquals(JavaMergeCLI.EXIT_USAGE, JavaMergeCLI.exitCodeFor(new IllegalArgumentException("x")));
        assertEquals(JavaMergeCLI.EXIT_IO, JavaMergeCLI.exitCodeFor(new IOException("x")));
        assertEquals(JavaMergeCLI.EXIT_ERROR, JavaMergeCLI.exitCodeFor(new IllegalStateException("x")));
    }
}
