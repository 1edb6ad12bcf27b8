package com.raditha.merge.alignment;

import com.raditha.merge.analysis.FileAnalysis;
import com.raditha.merge.analysis.NodeInfo;
import com.raditha.merge.freeze.FreezeRegion;
import com.raditha.merge.model.Anchor;
import com.raditha.merge.model.AnchorType;
import com.raditha.merge.model.Boundary;
import com.raditha.merge.model.LineRange;
import com.raditha.merge.model.Signature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds corresponding line ranges ("anchors") between a template and a
 * destination level, and the gaps between them ("boundaries").
 * <p>
 * Anchors are seeded in three passes: freeze regions present on both sides,
 * units with equal signatures, and runs of identical lines outside any unit.
 * Matching is greedy and first-come-first-served in template order.
 */
public class FileAligner {

    private static final Logger logger = LoggerFactory.getLogger(FileAligner.class);

    /**
     * Lines too common to anchor anything on their own.
     */
    private static final Set<String> GENERIC_LINES = Set.of(
            "}", "{", "});", "};", ")", ");", "else", "} else {", "]", "];");

    private final FileAnalysis template;
    private final FileAnalysis dest;
    private List<Anchor> anchors = List.of();

    public FileAligner(FileAnalysis template, FileAnalysis dest) {
        this.template = template;
        this.dest = dest;
    }

    /**
     * Compute anchors and boundaries.
     *
     * @return boundaries in template order
     */
    public List<Boundary> align() {
        anchors = findAnchors();
        List<Boundary> boundaries = computeBoundaries();
        logger.debug("Aligned {} anchor(s) and {} boundary(ies)", anchors.size(), boundaries.size());
        return boundaries;
    }

    public List<Anchor> getAnchors() {
        return anchors;
    }

    private List<Anchor> findAnchors() {
        LineRange templateWindow = template.window();
        LineRange destWindow = dest.window();
        if (templateWindow == null || destWindow == null) {
            return List.of();
        }

        if (linesOf(template, templateWindow).equals(linesOf(dest, destWindow))) {
            return List.of(new Anchor(templateWindow, destWindow, AnchorType.EXACT_LINE,
                    templateWindow.lineCount()));
        }

        List<Anchor> found = new ArrayList<>();
        addFreezeAnchors(found);
        addSignatureAnchors(found);
        addExactLineAnchors(found, templateWindow, destWindow);

        return mergeAdjacent(dropCrossing(found));
    }

    private static List<String> linesOf(FileAnalysis analysis, LineRange range) {
        return analysis.lines().subList(range.startLine() - 1, range.endLine());
    }

    /**
     * Destination freeze regions paired with a template region that has the
     * same start marker. Unpaired regions stay inside their boundary.
     */
    private void addFreezeAnchors(List<Anchor> found) {
        Set<Integer> usedTemplate = new HashSet<>();
        for (NodeInfo destBlock : dest.freezeBlocks()) {
            String marker = startMarkerOf(dest, destBlock);
            for (NodeInfo templateBlock : template.freezeBlocks()) {
                if (usedTemplate.contains(templateBlock.index())) {
                    continue;
                }
                if (marker != null && marker.equals(startMarkerOf(template, templateBlock))) {
                    usedTemplate.add(templateBlock.index());
                    found.add(new Anchor(templateBlock.lineRange(), destBlock.lineRange(),
                            AnchorType.FREEZE_BLOCK, Anchor.FREEZE_SCORE));
                    break;
                }
            }
        }
    }

    private static String startMarkerOf(FileAnalysis analysis, NodeInfo block) {
        Optional<FreezeRegion> region = analysis.freezeRegionAt(block.node().startLine());
        return region.map(FreezeRegion::startMarkerText).orElse(null);
    }

    private void addSignatureAnchors(List<Anchor> found) {
        Map<Signature, List<NodeInfo>> destBySignature = new LinkedHashMap<>();
        for (NodeInfo info : dest.statements()) {
            if (info.signature() != null && !info.node().isFreezeBlock()) {
                destBySignature.computeIfAbsent(info.signature(), key -> new ArrayList<>()).add(info);
            }
        }

        Set<Integer> matchedDest = new HashSet<>();
        for (NodeInfo templateInfo : template.statements()) {
            if (templateInfo.signature() == null || templateInfo.node().isFreezeBlock()) {
                continue;
            }
            List<NodeInfo> candidates = destBySignature.getOrDefault(templateInfo.signature(), List.of());
            Optional<NodeInfo> match = candidates.stream()
                    .filter(info -> !matchedDest.contains(info.index()))
                    .findFirst();
            if (match.isEmpty()) {
                continue;
            }
            NodeInfo destInfo = match.get();
            Anchor anchor = new Anchor(
                    LineRange.of(templateInfo.firstLine(), templateInfo.contentEndLine()),
                    LineRange.of(destInfo.firstLine(), destInfo.contentEndLine()),
                    AnchorType.SIGNATURE_MATCH,
                    templateInfo.contentEndLine() - templateInfo.firstLine() + 1);
            if (found.stream().noneMatch(anchor::overlaps)) {
                found.add(anchor);
                matchedDest.add(destInfo.index());
            }
        }
    }

    private void addExactLineAnchors(List<Anchor> found, LineRange templateWindow, LineRange destWindow) {
        Map<Integer, String> templateLines = candidateLines(template, templateWindow, found, true);
        Map<Integer, String> destLines = candidateLines(dest, destWindow, found, false);

        Map<String, List<Integer>> destByContent = new HashMap<>();
        destLines.forEach((line, content) ->
                destByContent.computeIfAbsent(content, key -> new ArrayList<>()).add(line));

        Set<Integer> usedDest = new HashSet<>();
        List<int[]> matches = new ArrayList<>();
        for (Map.Entry<Integer, String> entry : templateLines.entrySet()) {
            List<Integer> candidates = destByContent.get(entry.getValue());
            if (candidates == null) {
                continue;
            }
            candidates.stream().filter(line -> !usedDest.contains(line)).findFirst().ifPresent(destLine -> {
                usedDest.add(destLine);
                matches.add(new int[] { entry.getKey(), destLine });
            });
        }

        for (Anchor run : runsOf(matches)) {
            if (found.stream().noneMatch(run::overlaps)) {
                found.add(run);
            }
        }
    }

    /**
     * Lines that no unit, freeze region or anchor covers, keyed by line number
     * with their exact text. Blank and generic lines are skipped.
     */
    private static Map<Integer, String> candidateLines(FileAnalysis analysis, LineRange window,
            List<Anchor> found, boolean templateSide) {
        Set<Integer> covered = new HashSet<>();
        for (NodeInfo info : analysis.statements()) {
            for (int line = info.node().startLine(); line <= info.node().endLine(); line++) {
                covered.add(line);
            }
        }
        for (Anchor anchor : found) {
            LineRange range = templateSide ? anchor.templateRange() : anchor.destRange();
            for (int line = range.startLine(); line <= range.endLine(); line++) {
                covered.add(line);
            }
        }

        Map<Integer, String> candidates = new LinkedHashMap<>();
        for (int line = window.startLine(); line <= window.endLine(); line++) {
            String normalized = analysis.normalizedLine(line);
            if (normalized.isEmpty() || GENERIC_LINES.contains(normalized) || covered.contains(line)
                    || analysis.inFreezeRegion(line)) {
                continue;
            }
            candidates.put(line, analysis.lineAt(line));
        }
        return candidates;
    }

    private static List<Anchor> runsOf(List<int[]> matches) {
        List<Anchor> runs = new ArrayList<>();
        if (matches.isEmpty()) {
            return runs;
        }
        int startT = matches.get(0)[0];
        int startD = matches.get(0)[1];
        int endT = startT;
        int endD = startD;
        for (int i = 1; i < matches.size(); i++) {
            int t = matches.get(i)[0];
            int d = matches.get(i)[1];
            if (t != endT + 1 || d != endD + 1) {
                runs.add(exactAnchor(startT, endT, startD, endD));
                startT = t;
                startD = d;
            }
            endT = t;
            endD = d;
        }
        runs.add(exactAnchor(startT, endT, startD, endD));
        return runs;
    }

    private static Anchor exactAnchor(int startT, int endT, int startD, int endD) {
        return new Anchor(LineRange.of(startT, endT), LineRange.of(startD, endD), AnchorType.EXACT_LINE,
                endT - startT + 1);
    }

    /**
     * Keep anchors in a consistent order on both sides. Freeze anchors are
     * kept first; other anchors that would cross a kept one are dropped,
     * greedily in template order.
     */
    private static List<Anchor> dropCrossing(List<Anchor> found) {
        Comparator<Anchor> byPosition = Comparator.comparingInt(Anchor::templateStart)
                .thenComparingInt(Anchor::destStart);
        List<Anchor> ordered = new ArrayList<>(found);
        ordered.sort(byPosition);

        List<Anchor> kept = new ArrayList<>();
        for (Anchor anchor : ordered) {
            if (anchor.type() == AnchorType.FREEZE_BLOCK && kept.stream().noneMatch(k -> crosses(k, anchor))) {
                kept.add(anchor);
            }
        }
        for (Anchor anchor : ordered) {
            if (anchor.type() != AnchorType.FREEZE_BLOCK && kept.stream().noneMatch(k -> crosses(k, anchor))) {
                kept.add(anchor);
            }
        }
        kept.sort(byPosition);
        return kept;
    }

    private static boolean crosses(Anchor a, Anchor b) {
        if (a.overlaps(b)) {
            return true;
        }
        return (a.templateStart() < b.templateStart()) != (a.destStart() < b.destStart());
    }

    /**
     * Join directly adjacent anchors of the same type. Freeze anchors are never joined.
     */
    private static List<Anchor> mergeAdjacent(List<Anchor> ordered) {
        List<Anchor> merged = new ArrayList<>();
        for (Anchor anchor : ordered) {
            if (!merged.isEmpty()) {
                Anchor last = merged.get(merged.size() - 1);
                if (last.type() == anchor.type() && anchor.type() != AnchorType.FREEZE_BLOCK
                        && anchor.templateStart() == last.templateEnd() + 1
                        && anchor.destStart() == last.destEnd() + 1) {
                    merged.set(merged.size() - 1, new Anchor(
                            LineRange.of(last.templateStart(), anchor.templateEnd()),
                            LineRange.of(last.destStart(), anchor.destEnd()),
                            last.type(),
                            last.score() + anchor.score()));
                    continue;
                }
            }
            merged.add(anchor);
        }
        return merged;
    }

    private List<Boundary> computeBoundaries() {
        LineRange templateWindow = template.window();
        LineRange destWindow = dest.window();
        List<Boundary> result = new ArrayList<>();

        if (anchors.isEmpty()) {
            if (templateWindow != null || destWindow != null) {
                result.add(new Boundary(templateWindow, destWindow, null, null));
            }
            return result;
        }

        int templateFloor = templateWindow.startLine();
        int destFloor = destWindow.startLine();
        Anchor previous = null;
        for (Anchor anchor : anchors) {
            addBoundary(result,
                    LineRange.ofNullable(templateFloor, anchor.templateStart() - 1),
                    LineRange.ofNullable(destFloor, anchor.destStart() - 1),
                    previous, anchor);
            templateFloor = anchor.templateEnd() + 1;
            destFloor = anchor.destEnd() + 1;
            previous = anchor;
        }
        addBoundary(result,
                LineRange.ofNullable(templateFloor, templateWindow.endLine()),
                LineRange.ofNullable(destFloor, destWindow.endLine()),
                previous, null);
        return result;
    }

    private static void addBoundary(List<Boundary> result, LineRange templateRange, LineRange destRange,
            Anchor previous, Anchor next) {
        if (templateRange != null || destRange != null) {
            result.add(new Boundary(templateRange, destRange, previous, next));
        }
    }
}
