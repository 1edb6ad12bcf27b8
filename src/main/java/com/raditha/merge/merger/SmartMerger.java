package com.raditha.merge.merger;

import com.raditha.merge.analysis.FileAnalysis;
import com.raditha.merge.analysis.NodeInfo;
import com.raditha.merge.config.MergeOptions;
import com.raditha.merge.exception.DestinationParseException;
import com.raditha.merge.exception.TemplateParseException;
import com.raditha.merge.model.Decision;
import com.raditha.merge.model.LineRange;
import com.raditha.merge.model.MatchResult;
import com.raditha.merge.model.Node;
import com.raditha.merge.model.NodeKind;
import com.raditha.merge.model.Side;
import com.raditha.merge.model.Signature;
import com.raditha.merge.parser.JavaSourceParser;
import com.raditha.merge.parser.SourceParser;
import com.raditha.merge.resolution.PreferenceResolver;
import com.raditha.merge.result.MergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges a template Java file into a destination Java file.
 * <p>
 * Units of each level are matched by signature. The output follows the
 * destination's order: matched units come from the preferred side,
 * destination-only units are always kept and template-only units are added
 * when the options ask for it. Matched containers such as classes,
 * initializers, calls with a lambda block and try statements are merged
 * member by member down to {@link MergeOptions#maxRecursionDepth()}.
 * <p>
 * Destination lines inside a freeze region are never changed.
 *
 * <pre>
 * String merged = SmartMerger.merge(template, destination,
 *         MergeOptions.defaults().withIncludeTemplateOnlyNodes(true));
 * </pre>
 */
public class SmartMerger {

    private static final Logger logger = LoggerFactory.getLogger(SmartMerger.class);

    private final MergeOptions options;
    private final FileAnalysis template;
    private final FileAnalysis dest;
    private final PreferenceResolver preferences;

    public SmartMerger(String templateContent, String destContent) {
        this(templateContent, destContent, MergeOptions.defaults());
    }

    public SmartMerger(String templateContent, String destContent, MergeOptions options) {
        this(templateContent, destContent, options, new JavaSourceParser());
    }

    /**
     * Parse and analyse both documents.
     *
     * @throws com.raditha.merge.exception.FreezeStructureException when freeze markers are malformed
     */
    public SmartMerger(String templateContent, String destContent, MergeOptions options, SourceParser parser) {
        this.options = options;
        this.template = new FileAnalysis(templateContent, parser, options);
        this.dest = new FileAnalysis(destContent, parser, options);
        this.preferences = new PreferenceResolver(options);
    }

    /**
     * Convenience entry point.
     */
    public static String merge(String templateContent, String destContent, MergeOptions options) {
        return new SmartMerger(templateContent, destContent, options).merge();
    }

    /**
     * The merged document.
     *
     * @throws TemplateParseException    when the template does not parse
     * @throws DestinationParseException when the destination does not parse
     */
    public String merge() {
        return mergeResult().content();
    }

    /**
     * The merged document with the provenance of every line.
     */
    public MergeResult mergeResult() {
        if (!template.isValid()) {
            throw new TemplateParseException(template.content(), template.diagnostics());
        }
        if (!dest.isValid()) {
            throw new DestinationParseException(dest.content(), dest.diagnostics());
        }

        long start = System.currentTimeMillis();
        MergeResult result = new MergeResult();
        if (template.isCommentOnly() && dest.isCommentOnly()) {
            logger.debug("Both documents hold only comments, using line alignment");
            new AnchorMerger(template, dest, options).mergeInto(result);
        } else {
            new LevelMerge(result).merge(template, dest, 0);
        }
        logger.debug("Merged {} template and {} destination unit(s) into {} line(s) in {} ms",
                template.statements().size(), dest.statements().size(), result.size(),
                System.currentTimeMillis() - start);
        return result;
    }

    /**
     * Merge and report the inputs alongside the statistics.
     */
    public MergeOutcome mergeWithDebug() {
        MergeResult result = mergeResult();
        DebugInfo debugInfo = new DebugInfo(
                template.statements().size(),
                dest.statements().size(),
                options.preference(),
                options.includeTemplateOnlyNodes(),
                options.freezeToken(),
                result.debugOutput());
        return new MergeOutcome(result.content(), result.statistics(), debugInfo);
    }

    public FileAnalysis getTemplateAnalysis() {
        return template;
    }

    public FileAnalysis getDestinationAnalysis() {
        return dest;
    }

    /**
     * Whether a matched pair can be merged member by member.
     */
    boolean isRecursable(Node templateNode, Node destNode, int depth) {
        if (depth >= options.maxRecursionDepth()) {
            return false;
        }
        if (templateNode.kind() != destNode.kind()
                || !Objects.equals(templateNode.syntaxType(), destNode.syntaxType())) {
            return false;
        }
        if (!isContainerKind(templateNode.kind())) {
            return false;
        }
        if (!templateNode.hasBody() || !destNode.hasBody()
                || !templateNode.body().isWindowed() || !destNode.body().isWindowed()) {
            return false;
        }
        boolean needsMergeableChild = templateNode.kind() == NodeKind.CALL
                || templateNode.kind() == NodeKind.TRY;
        if (needsMergeableChild
                && (!templateNode.body().hasMergeableChild() || !destNode.body().hasMergeableChild())) {
            return false;
        }
        return !template.containsFreezeRegion(templateNode) && !dest.containsFreezeRegion(destNode);
    }

    private static boolean isContainerKind(NodeKind kind) {
        return kind == NodeKind.TYPE_DECLARATION || kind == NodeKind.INITIALIZER
                || kind == NodeKind.CALL || kind == NodeKind.TRY;
    }

    /**
     * A unit scheduled for output at one level.
     */
    private record Emission(NodeInfo templateInfo, NodeInfo destInfo) {

        boolean isMatched() {
            return templateInfo != null && destInfo != null;
        }
    }

    /**
     * State of one merge call: the result being built and the last source
     * line copied from each side.
     */
    private final class LevelMerge {

        private final MergeResult result;
        private int lastTemplateLine;
        private int lastDestLine;

        LevelMerge(MergeResult result) {
            this.result = result;
        }

        void merge(FileAnalysis templateLevel, FileAnalysis destLevel, int depth) {
            if (destLevel.isRoot() && destLevel.prefixEnd() > 0) {
                copy(destLevel, Side.DESTINATION, 1, destLevel.prefixEnd(), Decision.KEPT_DESTINATION);
            }

            List<Emission> plan = plan(templateLevel, destLevel);
            logger.debug("Level {} at depth {}: {} unit(s) to emit",
                    destLevel.isRoot() ? "root" : destLevel.owner().describe(), depth, plan.size());

            if (plan.isEmpty()) {
                LineRange window = destLevel.window();
                if (window != null && window.endLine() > destLevel.prefixEnd()) {
                    copy(destLevel, Side.DESTINATION, destLevel.prefixEnd() + 1, window.endLine(),
                            Decision.KEPT_DESTINATION);
                }
                return;
            }

            Emission last = null;
            for (Emission emission : plan) {
                emit(emission, templateLevel, destLevel, depth);
                last = emission;
            }
            copyTrailingBlanks(last, templateLevel, destLevel);
        }

        /**
         * Order the units of a level: destination order, with template-only
         * units placed after the nearest preceding matched or frozen template unit.
         */
        private List<Emission> plan(FileAnalysis templateLevel, FileAnalysis destLevel) {
            Map<NodeInfo, NodeInfo> matches = match(templateLevel, destLevel);
            Map<NodeInfo, NodeInfo> byDest = new IdentityHashMap<>();
            matches.forEach((t, d) -> byDest.put(d, t));
            Map<NodeInfo, NodeInfo> claimed = claimedByFreeze(templateLevel, destLevel, matches);

            List<NodeInfo> atStart = new ArrayList<>();
            Map<NodeInfo, List<NodeInfo>> after = new IdentityHashMap<>();
            if (options.includeTemplateOnlyNodes()) {
                NodeInfo anchor = null;
                for (NodeInfo templateInfo : templateLevel.statements()) {
                    NodeInfo destInfo = matches.get(templateInfo);
                    if (destInfo != null) {
                        anchor = destInfo;
                    } else if (claimed.containsKey(templateInfo)) {
                        anchor = claimed.get(templateInfo);
                    } else if (anchor == null) {
                        atStart.add(templateInfo);
                    } else {
                        after.computeIfAbsent(anchor, key -> new ArrayList<>()).add(templateInfo);
                    }
                }
            }

            List<Emission> plan = new ArrayList<>();
            atStart.forEach(info -> plan.add(new Emission(info, null)));
            for (NodeInfo destInfo : destLevel.statements()) {
                plan.add(new Emission(byDest.get(destInfo), destInfo));
                after.getOrDefault(destInfo, List.of()).forEach(info -> plan.add(new Emission(info, null)));
            }
            return plan;
        }

        private Map<NodeInfo, NodeInfo> match(FileAnalysis templateLevel, FileAnalysis destLevel) {
            Map<NodeInfo, NodeInfo> matches = new IdentityHashMap<>();
            Set<NodeInfo> usedDest = Collections.newSetFromMap(new IdentityHashMap<>());

            for (NodeInfo templateInfo : templateLevel.statements()) {
                if (templateInfo.signature() == null) {
                    continue;
                }
                for (NodeInfo destInfo : destLevel.statements()) {
                    if (!usedDest.contains(destInfo) && templateInfo.signature().equals(destInfo.signature())) {
                        matches.put(templateInfo, destInfo);
                        usedDest.add(destInfo);
                        break;
                    }
                }
            }

            if (options.matchRefiner() != null) {
                List<NodeInfo> leftoverTemplate = templateLevel.statements().stream()
                        .filter(info -> !matches.containsKey(info) && info.node().kind() == NodeKind.DEFINITION)
                        .toList();
                List<NodeInfo> leftoverDest = destLevel.statements().stream()
                        .filter(info -> !usedDest.contains(info) && info.node().kind() == NodeKind.DEFINITION)
                        .toList();
                List<MatchResult> refined = options.matchRefiner().refine(
                        leftoverTemplate.stream().map(NodeInfo::node).toList(),
                        leftoverDest.stream().map(NodeInfo::node).toList());
                for (MatchResult pair : refined) {
                    logger.debug("Fuzzy match {} -> {} ({})", pair.templateNode().describe(),
                            pair.destNode().describe(), pair.score());
                    matches.put(infoFor(leftoverTemplate, pair.templateNode()),
                            infoFor(leftoverDest, pair.destNode()));
                }
            }
            logger.debug("Matched {} of {} template unit(s)", matches.size(), templateLevel.statements().size());
            return matches;
        }

        /**
         * Unmatched template units whose signature equals a node enclosed by a
         * destination freeze region, mapped to that region's unit. The region
         * already stands for them.
         */
        private Map<NodeInfo, NodeInfo> claimedByFreeze(FileAnalysis templateLevel, FileAnalysis destLevel,
                Map<NodeInfo, NodeInfo> matches) {
            Map<NodeInfo, NodeInfo> claimed = new IdentityHashMap<>();
            List<NodeInfo> frozen = destLevel.freezeBlocks();
            if (frozen.isEmpty()) {
                return claimed;
            }
            for (NodeInfo templateInfo : templateLevel.statements()) {
                Signature signature = templateInfo.signature();
                if (matches.containsKey(templateInfo) || signature == null) {
                    continue;
                }
                frozen.stream()
                        .filter(block -> block.node().children().stream()
                                .anyMatch(node -> signature.equals(destLevel.signatureOf(node))))
                        .findFirst()
                        .ifPresent(block -> claimed.put(templateInfo, block));
            }
            return claimed;
        }

        private NodeInfo infoFor(List<NodeInfo> infos, Node node) {
            return infos.stream()
                    .filter(info -> info.node() == node)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No unit for " + node));
        }

        private void emit(Emission emission, FileAnalysis templateLevel, FileAnalysis destLevel, int depth) {
            NodeInfo templateInfo = emission.templateInfo();
            NodeInfo destInfo = emission.destInfo();

            if (!emission.isMatched()) {
                if (destInfo != null) {
                    Decision decision = destInfo.node().isFreezeBlock()
                            ? Decision.FREEZE_BLOCK
                            : Decision.KEPT_DESTINATION;
                    emitUnit(destInfo, destLevel, Side.DESTINATION, decision);
                } else {
                    emitUnit(templateInfo, templateLevel, Side.TEMPLATE, Decision.APPENDED);
                }
                return;
            }

            if (destLevel.containsFreezeRegion(destInfo.node())) {
                emitUnit(destInfo, destLevel, Side.DESTINATION, Decision.FREEZE_BLOCK);
                return;
            }

            Side winner = preferences.resolve(templateInfo.node(), destInfo.node(), destLevel);
            if (isRecursable(templateInfo.node(), destInfo.node(), depth)) {
                recurse(templateInfo, destInfo, winner, templateLevel, destLevel, depth);
            } else if (winner == Side.TEMPLATE) {
                emitGap(templateLevel, Side.TEMPLATE, templateInfo.firstLine(), Decision.KEPT_TEMPLATE);
                copy(templateLevel, Side.TEMPLATE, templateInfo.firstLine(), templateInfo.contentEndLine(),
                        Decision.KEPT_TEMPLATE);
                emitTrailing(templateInfo, destInfo, winner, templateLevel, destLevel, Decision.KEPT_TEMPLATE);
            } else {
                emitUnit(destInfo, destLevel, Side.DESTINATION, Decision.KEPT_DESTINATION);
            }
        }

        private void emitUnit(NodeInfo info, FileAnalysis source, Side side, Decision decision) {
            emitGap(source, side, info.firstLine(), decision);
            copy(source, side, info.firstLine(), info.lastLine(), decision);
        }

        /**
         * Merge two containers member by member: the header and footer come
         * from the winning side, the body is merged as a nested level.
         */
        private void recurse(NodeInfo templateInfo, NodeInfo destInfo, Side winner,
                FileAnalysis templateLevel, FileAnalysis destLevel, int depth) {
            NodeInfo win = winner == Side.TEMPLATE ? templateInfo : destInfo;
            FileAnalysis winLevel = winner == Side.TEMPLATE ? templateLevel : destLevel;
            Node node = win.node();
            logger.debug("Recursing into {} at depth {}", node.describe(), depth + 1);

            boolean commentsFromDest = winner == Side.TEMPLATE && templateInfo.leadingComments().isEmpty();
            NodeInfo commentInfo = commentsFromDest ? destInfo : win;
            FileAnalysis commentLevel = commentsFromDest ? destLevel : winLevel;
            Side commentSide = commentsFromDest ? Side.DESTINATION : winner;

            emitGap(commentLevel, commentSide, commentInfo.firstLine(), Decision.REPLACED);
            if (commentInfo.firstLine() < commentInfo.node().startLine()) {
                copy(commentLevel, commentSide, commentInfo.firstLine(), commentInfo.node().startLine() - 1,
                        Decision.REPLACED);
            }
            copy(winLevel, winner, node.startLine(), node.body().openLine(), Decision.REPLACED);

            merge(templateLevel.forBody(templateInfo.node()), destLevel.forBody(destInfo.node()), depth + 1);

            copy(winLevel, winner, node.body().closeLine(), win.contentEndLine(), Decision.REPLACED);
            emitTrailing(templateInfo, destInfo, winner, templateLevel, destLevel, Decision.REPLACED);
        }

        /**
         * Comments after the last unit of a level. The destination's are kept
         * whenever it has any.
         */
        private void emitTrailing(NodeInfo templateInfo, NodeInfo destInfo, Side winner,
                FileAnalysis templateLevel, FileAnalysis destLevel, Decision decision) {
            if (winner == Side.DESTINATION || !destInfo.trailingComments().isEmpty()) {
                copy(destLevel, Side.DESTINATION, destInfo.contentEndLine() + 1, destInfo.lastLine(), decision);
            } else {
                copy(templateLevel, Side.TEMPLATE, templateInfo.contentEndLine() + 1, templateInfo.lastLine(),
                        decision);
            }
        }

        /**
         * Copy the blank lines above {@code firstLine} in its source, less the
         * blank lines the output already ends with.
         */
        private void emitGap(FileAnalysis source, Side side, int firstLine, Decision decision) {
            if (result.isEmpty()) {
                return;
            }
            int gap = source.blankLinesAbove(firstLine, source.prefixEnd()) - result.trailingBlankLines();
            for (int i = gap; i > 0; i--) {
                result.addLine("", decision, side, firstLine - i);
            }
        }

        private void copyTrailingBlanks(Emission last, FileAnalysis templateLevel, FileAnalysis destLevel) {
            boolean fromDest = last.destInfo() != null;
            FileAnalysis source = fromDest ? destLevel : templateLevel;
            NodeInfo info = fromDest ? last.destInfo() : last.templateInfo();
            LineRange window = source.window();
            if (window == null) {
                return;
            }
            int lastLine = info.lastLine();
            int blanks = source.blankLinesBelow(lastLine, window.endLine() + 1) - result.trailingBlankLines();
            Decision decision = fromDest ? Decision.KEPT_DESTINATION : Decision.APPENDED;
            for (int i = 1; i <= blanks; i++) {
                result.addLine("", decision, fromDest ? Side.DESTINATION : Side.TEMPLATE, lastLine + i);
            }
        }

        /**
         * Copy source lines. A line shared by two units, such as two
         * statements on one line, is copied once.
         */
        private void copy(FileAnalysis source, Side side, int from, int to, Decision decision) {
            int last = side == Side.TEMPLATE ? lastTemplateLine : lastDestLine;
            int start = from == last ? from + 1 : from;
            if (start > to) {
                return;
            }
            result.addLines(source, LineRange.of(start, to), decision, side);
            if (side == Side.TEMPLATE) {
                lastTemplateLine = to;
            } else {
                lastDestLine = to;
            }
        }
    }
}
