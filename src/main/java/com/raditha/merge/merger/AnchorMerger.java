package com.raditha.merge.merger;

import com.raditha.merge.alignment.FileAligner;
import com.raditha.merge.analysis.FileAnalysis;
import com.raditha.merge.analysis.NodeInfo;
import com.raditha.merge.config.MergeOptions;
import com.raditha.merge.model.Anchor;
import com.raditha.merge.model.AnchorType;
import com.raditha.merge.model.Boundary;
import com.raditha.merge.model.Decision;
import com.raditha.merge.model.Side;
import com.raditha.merge.resolution.ConflictResolver;
import com.raditha.merge.resolution.PreferenceResolver;
import com.raditha.merge.result.MergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Line based merge of two levels: anchors are copied, the boundaries between
 * them are resolved unit by unit.
 * Used for documents that hold nothing but comments, where the structural
 * merge has no nodes to walk.
 */
public class AnchorMerger {

    private static final Logger logger = LoggerFactory.getLogger(AnchorMerger.class);

    private final FileAnalysis template;
    private final FileAnalysis dest;
    private final MergeOptions options;
    private final PreferenceResolver preferences;

    public AnchorMerger(FileAnalysis template, FileAnalysis dest, MergeOptions options) {
        this.template = template;
        this.dest = dest;
        this.options = options;
        this.preferences = new PreferenceResolver(options);
    }

    public MergeResult merge() {
        MergeResult result = new MergeResult();
        mergeInto(result);
        return result;
    }

    /**
     * Append the merged lines of the two levels to {@code result}.
     */
    public void mergeInto(MergeResult result) {
        FileAligner aligner = new FileAligner(template, dest);
        List<Boundary> boundaries = aligner.align();
        List<Anchor> anchors = aligner.getAnchors();
        ConflictResolver resolver = new ConflictResolver(template, dest, options);
        logger.debug("Anchor merge: {} anchor(s), {} boundary(ies)", anchors.size(), boundaries.size());

        resolveAfter(null, boundaries, resolver, result);
        for (Anchor anchor : anchors) {
            emitAnchor(anchor, result);
            resolveAfter(anchor, boundaries, resolver, result);
        }
    }

    private static void resolveAfter(Anchor anchor, List<Boundary> boundaries, ConflictResolver resolver,
            MergeResult result) {
        for (Boundary boundary : boundaries) {
            if (boundary.prevAnchor() == anchor) {
                resolver.resolve(boundary, result);
            }
        }
    }

    private void emitAnchor(Anchor anchor, MergeResult result) {
        Side source = anchor.type() == AnchorType.SIGNATURE_MATCH ? signatureWinner(anchor) : Side.DESTINATION;
        emitGap(anchor, source, result);
        switch (anchor.type()) {
            case EXACT_LINE -> result.addLines(dest, anchor.destRange(), Decision.KEPT_DESTINATION, Side.DESTINATION);
            case FREEZE_BLOCK -> result.addLines(dest, anchor.destRange(), Decision.FREEZE_BLOCK, Side.DESTINATION);
            case SIGNATURE_MATCH -> {
                if (source == Side.TEMPLATE) {
                    result.addLines(template, anchor.templateRange(), Decision.KEPT_TEMPLATE, Side.TEMPLATE);
                } else {
                    result.addLines(dest, anchor.destRange(), Decision.KEPT_DESTINATION, Side.DESTINATION);
                }
            }
        }
    }

    /**
     * Blank lines above the anchor in the side it is copied from, less the
     * blank lines the output already ends with.
     */
    private void emitGap(Anchor anchor, Side source, MergeResult result) {
        if (result.isEmpty()) {
            return;
        }
        FileAnalysis analysis = source == Side.TEMPLATE ? template : dest;
        int start = source == Side.TEMPLATE ? anchor.templateStart() : anchor.destStart();
        Decision decision = source == Side.TEMPLATE ? Decision.KEPT_TEMPLATE : Decision.KEPT_DESTINATION;
        int gap = analysis.blankLinesAbove(start, analysis.prefixEnd()) - result.trailingBlankLines();
        for (int i = gap; i > 0; i--) {
            result.addLine("", decision, source, start - i);
        }
    }

    private Side signatureWinner(Anchor anchor) {
        Optional<NodeInfo> templateUnit = unitStartingIn(template, anchor.templateRange().endLine(),
                anchor.templateStart());
        Optional<NodeInfo> destUnit = unitStartingIn(dest, anchor.destRange().endLine(), anchor.destStart());
        if (templateUnit.isEmpty() || destUnit.isEmpty()) {
            return options.preference().defaultSide();
        }
        return preferences.resolve(templateUnit.get().node(), destUnit.get().node(), dest);
    }

    private static Optional<NodeInfo> unitStartingIn(FileAnalysis analysis, int endLine, int startLine) {
        return analysis.statements().stream()
                .filter(info -> info.firstLine() >= startLine && info.node().startLine() <= endLine)
                .findFirst();
    }
}
