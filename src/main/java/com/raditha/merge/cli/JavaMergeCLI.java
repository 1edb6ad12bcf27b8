package com.raditha.merge.cli;

import ch.qos.logback.classic.Level;
import com.raditha.merge.config.FuzzyMatchWeights;
import com.raditha.merge.config.MergeOptions;
import com.raditha.merge.config.MergePreference;
import com.raditha.merge.config.MergeSettings;
import com.raditha.merge.exception.MergeException;
import com.raditha.merge.merger.SmartMerger;
import com.raditha.merge.model.NodeKind;
import com.raditha.merge.model.Side;
import com.raditha.merge.report.DiffGenerator;
import com.raditha.merge.report.StatisticsExporter;
import com.raditha.merge.result.MergeResult;
import com.raditha.merge.signature.NodeTyping;
import com.raditha.merge.similarity.MethodMatchRefiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for jmerge.
 * <p>
 * Usage:
 * java -jar jmerge.jar [options] &lt;template&gt; &lt;destination&gt;
 * <p>
 * Configuration priority: CLI arguments > jmerge.yml > defaults
 */
@Command(name = "jmerge", mixinStandardHelpOptions = true, version = "jmerge v1.0.0",
        description = "Merges a template Java file into a destination Java file, keeping local customizations")
public class JavaMergeCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(JavaMergeCLI.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_MERGE = 4;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<template>", description = "Template file")
    private Path templateFile;

    @Parameters(index = "1", paramLabel = "<destination>", description = "Destination file")
    private Path destinationFile;

    @Option(names = "--config-file", description = "Settings file (YAML)", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--preference", description = "Side that wins for matched nodes: template or destination",
            paramLabel = "<side>", converter = SideConverter.class)
    private Side preference;

    @Option(names = "--prefer", description = "Per-kind preference, e.g. definition=template (repeatable)",
            paramLabel = "<kind>=<side>")
    private Map<String, String> preferByKind = new LinkedHashMap<>();

    @Option(names = "--add-template-only", description = "Add nodes that exist only in the template")
    private boolean addTemplateOnly;

    @Option(names = "--freeze-token", description = "Freeze marker token (default: jmerge)", paramLabel = "<token>")
    private String freezeToken;

    @Option(names = "--no-freeze", description = "Disable freeze regions")
    private boolean noFreeze;

    @Option(names = "--max-depth", description = "Maximum recursion depth, 0 merges top-level nodes atomically",
            paramLabel = "<n>")
    private Integer maxDepth;

    @Option(names = "--fuzzy-methods", description = "Pair renamed methods by name and parameter similarity")
    private boolean fuzzyMethods;

    @Option(names = "--fuzzy-threshold", description = "Minimum similarity for fuzzy pairing (default: 0.5)",
            paramLabel = "<x>")
    private Double fuzzyThreshold;

    @Option(names = "--output", description = "Write the merged file here instead of stdout", paramLabel = "<path>")
    private Path outputFile;

    @Option(names = "--in-place", description = "Overwrite the destination file")
    private boolean inPlace;

    @Option(names = "--diff", description = "Print a unified diff against the destination")
    private boolean diff;

    @Option(names = "--debug", description = "Print line provenance")
    private boolean debug;

    @Option(names = "--stats-json", description = "Write merge statistics as JSON", paramLabel = "<path>")
    private Path statsJson;

    @Option(names = "--verbose", description = "Enable debug logging")
    private boolean verbose;

    /**
     * Picocli call method - executes the merge.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws IOException {
        validateConfiguration();
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.raditha.merge")).setLevel(Level.DEBUG);
        }

        MergeOptions options = buildOptions();
        String template = Files.readString(templateFile);
        String destination = Files.readString(destinationFile);
        logger.debug("Merging {} into {}", templateFile, destinationFile);

        MergeResult result = new SmartMerger(template, destination, options).mergeResult();
        String merged = result.content();
        PrintWriter out = spec.commandLine().getOut();

        if (inPlace) {
            Files.writeString(destinationFile, merged);
        } else if (outputFile != null) {
            Files.writeString(outputFile, merged);
        } else if (!diff && !debug) {
            out.print(merged);
        }

        if (diff) {
            out.println(new DiffGenerator().generateUnifiedDiff(
                    destinationFile.getFileName().toString(), destination, merged));
        }
        if (debug) {
            out.println(result.debugOutput());
        }
        if (statsJson != null) {
            StatisticsExporter exporter = new StatisticsExporter();
            exporter.exportToJson(exporter.buildStatistics(templateFile.getFileName().toString(),
                    destinationFile.getFileName().toString(), result, destination), statsJson);
        }
        out.flush();
        return EXIT_OK;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (inPlace && outputFile != null) {
            throw new IllegalArgumentException("Cannot use both --in-place and --output");
        }
        if (noFreeze && freezeToken != null) {
            throw new IllegalArgumentException("Cannot use both --no-freeze and --freeze-token");
        }
        if (maxDepth != null && maxDepth < 0) {
            throw new IllegalArgumentException("Max depth must not be negative, got: " + maxDepth);
        }
        if (fuzzyThreshold != null && (fuzzyThreshold < 0.0 || fuzzyThreshold > 1.0)) {
            throw new IllegalArgumentException("Fuzzy threshold must be between 0 and 1, got: " + fuzzyThreshold);
        }
        if (configFile != null && !Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
    }

    /**
     * Defaults, then the settings file, then the command line.
     */
    MergeOptions buildOptions() throws IOException {
        MergeOptions options = configFile != null ? MergeSettings.load(configFile) : MergeOptions.defaults();

        if (preference != null) {
            options = options.withPreference(preference);
        }
        if (!preferByKind.isEmpty()) {
            options = withKindPreferences(options);
        }
        if (addTemplateOnly) {
            options = options.withIncludeTemplateOnlyNodes(true);
        }
        if (noFreeze) {
            options = options.withFreezeToken(null);
        } else if (freezeToken != null) {
            options = options.withFreezeToken(freezeToken);
        }
        if (maxDepth != null) {
            options = options.withMaxRecursionDepth(maxDepth);
        }
        if (fuzzyMethods || fuzzyThreshold != null) {
            double threshold = fuzzyThreshold != null ? fuzzyThreshold : MethodMatchRefiner.DEFAULT_THRESHOLD;
            options = options.withMatchRefiner(new MethodMatchRefiner(threshold, FuzzyMatchWeights.balanced()));
        }
        return options;
    }

    private MergeOptions withKindPreferences(MergeOptions options) {
        Map<String, Side> sides = new LinkedHashMap<>(options.preference().byMergeType());
        Map<NodeKind, NodeTyping> typing = new EnumMap<>(NodeKind.class);
        typing.putAll(options.nodeTyping());
        for (Map.Entry<String, String> entry : preferByKind.entrySet()) {
            NodeKind kind = NodeKind.fromTag(entry.getKey());
            sides.put(kind.tag(), Side.fromString(entry.getValue()));
            typing.putIfAbsent(kind, NodeTyping.byKind());
        }
        return options
                .withPreference(MergePreference.perType(sides, options.preference().defaultSide()))
                .withNodeTyping(typing);
    }

    /**
     * Exit code for an exception raised while merging.
     */
    static int exitCodeFor(Exception ex) {
        if (ex instanceof MergeException) {
            return EXIT_MERGE;
        } else if (ex instanceof IllegalArgumentException) {
            return EXIT_USAGE;
        } else if (ex instanceof IOException) {
            return EXIT_IO;
        }
        return EXIT_ERROR;
    }

    /**
     * Command line with the exit-code mapping installed.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new JavaMergeCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            int code = exitCodeFor(ex);
            switch (code) {
                case EXIT_MERGE -> commandLine.getErr().println("Merge error: " + ex.getMessage());
                case EXIT_USAGE -> commandLine.getErr().println("Configuration error: " + ex.getMessage());
                case EXIT_IO -> commandLine.getErr().println("I/O error: " + ex.getMessage());
                default -> {
                    commandLine.getErr().println("Error: " + ex.getMessage());
                    ex.printStackTrace(commandLine.getErr());
                }
            }
            return code;
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_USAGE;
        });
        return cmd;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Converter for side names.
     */
    static class SideConverter implements ITypeConverter<Side> {
        @Override
        public Side convert(String value) {
            return Side.fromString(value);
        }
    }
}
