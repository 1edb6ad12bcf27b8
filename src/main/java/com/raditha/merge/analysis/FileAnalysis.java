package com.raditha.merge.analysis;

import com.raditha.merge.config.MergeOptions;
import com.raditha.merge.freeze.FreezeRegion;
import com.raditha.merge.freeze.FreezeRegionExtractor;
import com.raditha.merge.model.LineRange;
import com.raditha.merge.model.Node;
import com.raditha.merge.model.NodeKind;
import com.raditha.merge.model.Signature;
import com.raditha.merge.model.SourceComment;
import com.raditha.merge.parser.JavaSourceParser;
import com.raditha.merge.parser.ParsedSource;
import com.raditha.merge.parser.SourceParser;
import com.raditha.merge.parser.SourceText;
import com.raditha.merge.signature.DefaultSignatureGenerator;
import com.raditha.merge.signature.SignatureGenerator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One merge level of a parsed document.
 * <p>
 * The root level covers the whole file. {@link #forBody(Node)} opens the level
 * between the braces of a container. Each level lists its units in source
 * order: nodes with their comments, where freeze regions bound to the level
 * stand in for the nodes they enclose.
 */
public class FileAnalysis {

    private final ParsedSource parsed;
    private final MergeOptions options;
    private final SignatureGenerator signatureGenerator;
    private final DirectiveComments directives;
    private final List<FreezeRegion> freezeRegions;
    private final Node owner;
    private final LineRange window;
    private final int prefixEnd;
    private final List<NodeInfo> statements;

    /**
     * Parse and analyse a Java document.
     */
    public FileAnalysis(String content, MergeOptions options) {
        this(content, new JavaSourceParser(), options);
    }

    public FileAnalysis(String content, SourceParser parser, MergeOptions options) {
        this(parser.parse(content), options);
    }

    /**
     * Analyse an already parsed document.
     *
     * @throws com.raditha.merge.exception.FreezeStructureException when freeze markers are malformed
     */
    public FileAnalysis(ParsedSource parsed, MergeOptions options) {
        this.parsed = parsed;
        this.options = options;
        this.signatureGenerator = SignatureGenerator.withFallback(
                options.signatureGenerator(), new DefaultSignatureGenerator());
        this.directives = new DirectiveComments(options.directivePatterns());
        this.freezeRegions = parsed.valid() && options.freezeEnabled()
                ? new FreezeRegionExtractor(options.freezeToken()).extract(parsed)
                : List.of();
        this.owner = null;
        this.window = LineRange.ofNullable(1, parsed.lines().size());
        this.prefixEnd = parsed.valid() ? computePrefixEnd() : 0;
        this.statements = buildStatements(parsed.nodes());
    }

    private FileAnalysis(FileAnalysis parent, Node owner, LineRange window) {
        this.parsed = parent.parsed;
        this.options = parent.options;
        this.signatureGenerator = parent.signatureGenerator;
        this.directives = parent.directives;
        this.freezeRegions = parent.freezeRegions;
        this.owner = owner;
        this.window = window;
        this.prefixEnd = window == null ? 0 : window.startLine() - 1;
        this.statements = buildStatements(owner.body().children());
    }

    /**
     * The level between the braces of a container node of this document.
     */
    public FileAnalysis forBody(Node container) {
        if (!container.hasBody()) {
            throw new IllegalArgumentException(container + " has no body");
        }
        return new FileAnalysis(this, container, container.body().window());
    }

    private List<NodeInfo> buildStatements(List<Node> levelNodes) {
        if (window == null) {
            return List.of();
        }
        List<FreezeRegion> bound = regionsBoundHere();
        List<Node> units = new ArrayList<>();
        for (Node node : levelNodes) {
            if (bound.stream().noneMatch(region -> region.encloses(node))) {
                units.add(node);
            }
        }
        for (FreezeRegion region : bound) {
            String text = text(region.range());
            units.add(Node.freezeBlock(region.range(), text, SourceText.normalize(text), region.enclosed()));
        }
        units.sort(Comparator.comparingInt(Node::startLine));

        CommentAttacher attacher = new CommentAttacher(parsed.lines(), directives);
        List<SourceComment> comments = CommentAttacher.commentsWithin(
                parsed.comments(), prefixEnd + 1, window.endLine());
        if (units.isEmpty()) {
            units = attacher.commentBlocks(comments);
        }
        return attacher.attach(units, comments, signatureGenerator);
    }

    private List<FreezeRegion> regionsBoundHere() {
        return freezeRegions.stream()
                .filter(region -> region.owner() == owner && window.encloses(region.range()))
                .toList();
    }

    /**
     * Last line of the leading run of blank lines and directive comments.
     */
    private int computePrefixEnd() {
        int end = 0;
        for (int line = 1; line <= lineCount(); line++) {
            if (isBlank(line) || isDirectiveLine(line)) {
                end = line;
            } else {
                break;
            }
        }
        return end;
    }

    private boolean isDirectiveLine(int line) {
        String text = lineAt(line).trim();
        for (SourceComment comment : parsed.comments()) {
            if (comment.startLine() == line && comment.endLine() == line) {
                return text.equals(comment.text().trim()) && directives.isDirective(comment);
            }
        }
        return false;
    }

    public boolean isValid() {
        return parsed.valid();
    }

    public List<String> diagnostics() {
        return parsed.diagnostics();
    }

    public String content() {
        return parsed.content();
    }

    public List<String> lines() {
        return parsed.lines();
    }

    public int lineCount() {
        return parsed.lines().size();
    }

    /**
     * Text of a 1-indexed line, empty when out of range.
     */
    public String lineAt(int line) {
        if (line < 1 || line > lineCount()) {
            return "";
        }
        return parsed.lines().get(line - 1);
    }

    /**
     * Trimmed text of a line, used for exact-line comparisons.
     */
    public String normalizedLine(int line) {
        return lineAt(line).trim();
    }

    public boolean isBlank(int line) {
        return lineAt(line).isBlank();
    }

    /**
     * Lines of a range joined with newlines.
     */
    public String text(LineRange range) {
        List<String> slice = new ArrayList<>();
        for (int line = range.startLine(); line <= range.endLine(); line++) {
            slice.add(lineAt(line));
        }
        return String.join("\n", slice);
    }

    /**
     * Number of consecutive blank lines directly above {@code line}, not
     * looking at or above {@code floor}.
     */
    public int blankLinesAbove(int line, int floor) {
        int count = 0;
        for (int current = line - 1; current > floor && isBlank(current); current--) {
            count++;
        }
        return count;
    }

    /**
     * Number of consecutive blank lines directly below {@code line}, not
     * looking at or below {@code ceiling}.
     */
    public int blankLinesBelow(int line, int ceiling) {
        int count = 0;
        for (int current = line + 1; current < ceiling && isBlank(current); current++) {
            count++;
        }
        return count;
    }

    public List<NodeInfo> statements() {
        return statements;
    }

    public Signature signatureOf(Node node) {
        return signatureGenerator.signature(node);
    }

    /**
     * Every freeze region of the document, at any level.
     */
    public List<FreezeRegion> freezeRegions() {
        return freezeRegions;
    }

    /**
     * Freeze regions that stand in for nodes at this level.
     */
    public List<NodeInfo> freezeBlocks() {
        return statements.stream().filter(info -> info.node().isFreezeBlock()).toList();
    }

    public boolean inFreezeRegion(int line) {
        return freezeRegionAt(line).isPresent();
    }

    public Optional<FreezeRegion> freezeRegionAt(int line) {
        return freezeRegions.stream().filter(region -> region.range().contains(line)).findFirst();
    }

    /**
     * Whether a freeze region lies inside the node.
     */
    public boolean containsFreezeRegion(Node node) {
        if (node.isFreezeBlock()) {
            return true;
        }
        return freezeRegions.stream().anyMatch(region -> node.range().encloses(region.range()));
    }

    /**
     * Whether the level holds nothing but comments.
     */
    public boolean isCommentOnly() {
        return statements.stream().allMatch(info -> info.node().kind() == NodeKind.COMMENT);
    }

    /**
     * Non-blank normalized lines covered by the units, comments included.
     */
    public Set<String> normalizedLines(Collection<NodeInfo> units) {
        Set<String> lines = new HashSet<>();
        for (NodeInfo info : units) {
            for (int line = info.firstLine(); line <= info.lastLine(); line++) {
                if (!isBlank(line)) {
                    lines.add(normalizedLine(line));
                }
            }
        }
        return lines;
    }

    /**
     * Whether a standalone comment unit only repeats lines found in
     * {@code otherLines}.
     */
    public boolean isRepeatedComment(NodeInfo unit, Set<String> otherLines) {
        return unit.node().kind() == NodeKind.COMMENT
                && otherLines.containsAll(normalizedLines(List.of(unit)));
    }

    public boolean isRoot() {
        return owner == null;
    }

    /**
     * Container whose body this level covers, null at the root.
     */
    public Node owner() {
        return owner;
    }

    /**
     * Lines covered by this level, null when the level is empty.
     */
    public LineRange window() {
        return window;
    }

    /**
     * Last line of the directive prefix at the root, or the line before the
     * window for nested levels.
     */
    public int prefixEnd() {
        return prefixEnd;
    }

    public MergeOptions options() {
        return options;
    }
}
