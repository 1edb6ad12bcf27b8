package com.raditha.merge.resolution;

import com.raditha.merge.analysis.FileAnalysis;
import com.raditha.merge.analysis.NodeInfo;
import com.raditha.merge.config.MergeOptions;
import com.raditha.merge.model.Boundary;
import com.raditha.merge.model.Decision;
import com.raditha.merge.model.LineRange;
import com.raditha.merge.model.MatchResult;
import com.raditha.merge.model.Node;
import com.raditha.merge.model.NodeKind;
import com.raditha.merge.model.Side;
import com.raditha.merge.result.MergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the lines of one boundary, the stretch between two anchors where
 * template and destination disagree.
 * <p>
 * Units in the boundary are matched by signature and emitted in destination
 * order. Matched units come from the preferred side, destination-only units
 * and freeze regions stay where they are. Template-only units are kept only
 * when the options ask for them, placed after their nearest preceding match. Lines that
 * belong to no unit are orphans; the destination's are always kept.
 */
public class ConflictResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConflictResolver.class);

    private final FileAnalysis template;
    private final FileAnalysis dest;
    private final MergeOptions options;
    private final PreferenceResolver preferences;

    public ConflictResolver(FileAnalysis template, FileAnalysis dest, MergeOptions options) {
        this.template = template;
        this.dest = dest;
        this.options = options;
        this.preferences = new PreferenceResolver(options);
    }

    /**
     * Append the resolved lines of a boundary to the result.
     */
    public void resolve(Boundary boundary, MergeResult result) {
        LineRange templateRange = boundary.templateRange();
        LineRange destRange = boundary.destRange();

        if (templateRange == null && destRange == null) {
            return;
        }
        if (templateRange == null) {
            result.addLines(dest, destRange, Decision.KEPT_DESTINATION, Side.DESTINATION);
            return;
        }
        if (destRange == null) {
            if (options.includeTemplateOnlyNodes()) {
                result.addLines(template, templateRange, Decision.KEPT_TEMPLATE, Side.TEMPLATE);
            }
            return;
        }

        List<NodeInfo> templateUnits = unitsIn(template, templateRange);
        List<NodeInfo> destUnits = unitsIn(dest, destRange);
        Map<NodeInfo, NodeInfo> matches = match(templateUnits, destUnits);
        logger.debug("Boundary {} / {}: {} template unit(s), {} destination unit(s), {} matched",
                templateRange, destRange, templateUnits.size(), destUnits.size(), matches.size());

        Map<NodeInfo, NodeInfo> byDest = new IdentityHashMap<>();
        matches.forEach((templateInfo, destInfo) -> byDest.put(destInfo, templateInfo));

        List<NodeInfo> atStart = new ArrayList<>();
        Map<NodeInfo, List<NodeInfo>> after = new IdentityHashMap<>();
        if (options.includeTemplateOnlyNodes()) {
            Set<String> destLines = dest.normalizedLines(destUnits);
            NodeInfo anchor = null;
            for (NodeInfo templateInfo : templateUnits) {
                NodeInfo destInfo = matches.get(templateInfo);
                if (destInfo != null) {
                    anchor = destInfo;
                } else if (templateInfo.node().isFreezeBlock() || template.isRepeatedComment(templateInfo, destLines)) {
                    continue;
                } else if (anchor == null) {
                    atStart.add(templateInfo);
                } else {
                    after.computeIfAbsent(anchor, key -> new ArrayList<>()).add(templateInfo);
                }
            }
        }

        for (NodeInfo templateInfo : atStart) {
            emit(result, templateInfo, template, templateRange, Decision.KEPT_TEMPLATE, Side.TEMPLATE);
        }
        for (NodeInfo destInfo : destUnits) {
            NodeInfo templateInfo = byDest.get(destInfo);
            if (destInfo.node().isFreezeBlock()) {
                emit(result, destInfo, dest, destRange, Decision.FREEZE_BLOCK, Side.DESTINATION);
            } else if (templateInfo == null) {
                emit(result, destInfo, dest, destRange, Decision.APPENDED, Side.DESTINATION);
            } else if (preferences.resolve(templateInfo.node(), destInfo.node(), dest) == Side.TEMPLATE) {
                emit(result, templateInfo, template, templateRange, Decision.REPLACED, Side.TEMPLATE);
            } else {
                emit(result, destInfo, dest, destRange, Decision.REPLACED, Side.DESTINATION);
            }
            for (NodeInfo placed : after.getOrDefault(destInfo, List.of())) {
                emit(result, placed, template, templateRange, Decision.KEPT_TEMPLATE, Side.TEMPLATE);
            }
        }

        emitOrphans(result, templateRange, templateUnits, destRange, destUnits);
    }

    private static List<NodeInfo> unitsIn(FileAnalysis analysis, LineRange range) {
        return analysis.statements().stream()
                .filter(info -> range.overlaps(info.lineRange()))
                .toList();
    }

    /**
     * Pair template units with destination units: first by equal signature,
     * then, for leftover definitions, through the fuzzy refiner when one is set.
     */
    private Map<NodeInfo, NodeInfo> match(List<NodeInfo> templateUnits, List<NodeInfo> destUnits) {
        Map<NodeInfo, NodeInfo> matches = new IdentityHashMap<>();
        Set<Integer> usedDest = new HashSet<>();

        for (NodeInfo templateInfo : templateUnits) {
            if (templateInfo.signature() == null || templateInfo.node().isFreezeBlock()) {
                continue;
            }
            for (NodeInfo destInfo : destUnits) {
                if (!usedDest.contains(destInfo.index()) && !destInfo.node().isFreezeBlock()
                        && templateInfo.signature().equals(destInfo.signature())) {
                    matches.put(templateInfo, destInfo);
                    usedDest.add(destInfo.index());
                    break;
                }
            }
        }

        if (options.matchRefiner() != null) {
            List<NodeInfo> leftoverTemplate = templateUnits.stream()
                    .filter(info -> !matches.containsKey(info) && info.node().kind() == NodeKind.DEFINITION)
                    .toList();
            List<NodeInfo> leftoverDest = destUnits.stream()
                    .filter(info -> !usedDest.contains(info.index()) && info.node().kind() == NodeKind.DEFINITION)
                    .toList();
            List<MatchResult> fuzzy = options.matchRefiner().refine(
                    leftoverTemplate.stream().map(NodeInfo::node).toList(),
                    leftoverDest.stream().map(NodeInfo::node).toList());
            for (MatchResult pair : fuzzy) {
                matches.put(infoFor(leftoverTemplate, pair.templateNode()), infoFor(leftoverDest, pair.destNode()));
            }
        }
        return matches;
    }

    private static NodeInfo infoFor(List<NodeInfo> infos, Node node) {
        return infos.stream()
                .filter(info -> info.node() == node)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No unit for " + node));
    }

    /**
     * Emit a unit, limited to the boundary. Blank lines above the unit are
     * copied from its own source without stacking on blanks already emitted.
     */
    private static void emit(MergeResult result, NodeInfo info, FileAnalysis source, LineRange range,
            Decision decision, Side side) {
        Node node = info.node();
        int start = Math.min(Math.max(info.firstLine(), range.startLine()), node.startLine());
        int end = Math.max(Math.min(info.lastLine(), range.endLine()), node.endLine());

        if (!result.isEmpty()) {
            int gap = source.blankLinesAbove(start, range.startLine() - 1) - result.trailingBlankLines();
            for (int i = 0; i < gap; i++) {
                result.addLine("", decision, side, start - gap + i);
            }
        }
        result.addLines(source, LineRange.of(start, end), decision, side);
    }

    /**
     * Non-blank lines inside the boundary that no unit covers.
     */
    private void emitOrphans(MergeResult result, LineRange templateRange, List<NodeInfo> templateUnits,
            LineRange destRange, List<NodeInfo> destUnits) {
        List<Integer> destOrphans = orphanLines(dest, destRange, destUnits);
        Set<String> seen = new HashSet<>();
        for (int line : destOrphans) {
            result.addLine(dest.lineAt(line), Decision.KEPT_DESTINATION, Side.DESTINATION, line);
            seen.add(dest.normalizedLine(line));
        }

        if (!options.includeTemplateOnlyNodes()) {
            return;
        }
        for (int line : orphanLines(template, templateRange, templateUnits)) {
            if (seen.add(template.normalizedLine(line))) {
                result.addLine(template.lineAt(line), Decision.KEPT_TEMPLATE, Side.TEMPLATE, line);
            }
        }
    }

    private static List<Integer> orphanLines(FileAnalysis analysis, LineRange range, List<NodeInfo> units) {
        List<Integer> orphans = new ArrayList<>();
        for (int line = range.startLine(); line <= range.endLine(); line++) {
            final int current = line;
            if (analysis.isBlank(line)) {
                continue;
            }
            boolean covered = units.stream().anyMatch(info -> info.fullRange().contains(current));
            if (!covered) {
                orphans.add(line);
            }
        }
        return orphans;
    }
}
