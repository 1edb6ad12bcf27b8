package com.raditha.merge.freeze;

import com.raditha.merge.exception.FreezeStructureException;
import com.raditha.merge.exception.FreezeStructureException.Kind;
import com.raditha.merge.model.LineRange;
import com.raditha.merge.model.Node;
import com.raditha.merge.model.SourceComment;
import com.raditha.merge.parser.ParsedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds freeze regions in a parsed document and validates them against the
 * node tree.
 * <p>
 * Regions are built greedily in document order. A start marker without an end
 * marker is only legal at the document root, where the region runs to the end
 * of the file. A region must never cut through a node: every node is either
 * completely inside the region, completely outside, or a block-bearing node
 * that completely surrounds it.
 */
public class FreezeRegionExtractor {

    private static final Logger logger = LoggerFactory.getLogger(FreezeRegionExtractor.class);

    private final FreezeMarkers markers;

    public FreezeRegionExtractor(String token) {
        this(new FreezeMarkers(token));
    }

    public FreezeRegionExtractor(FreezeMarkers markers) {
        this.markers = markers;
    }

    public FreezeMarkers getMarkers() {
        return markers;
    }

    /**
     * Extract and validate all freeze regions.
     *
     * @param source a valid parse
     * @return regions in document order
     * @throws FreezeStructureException when the markers are not well formed
     */
    public List<FreezeRegion> extract(ParsedSource source) {
        List<FreezeRegion> regions = new ArrayList<>();
        for (MarkerPair pair : pairMarkers(source)) {
            regions.add(bind(pair, source.nodes()));
        }
        if (!regions.isEmpty()) {
            logger.debug("Found {} freeze region(s): {}", regions.size(), regions);
        }
        return regions;
    }

    private List<MarkerPair> pairMarkers(ParsedSource source) {
        List<MarkerPair> pairs = new ArrayList<>();
        SourceComment open = null;
        for (SourceComment comment : source.comments()) {
            if (markers.isEnd(comment)) {
                if (open == null) {
                    throw new FreezeStructureException(Kind.UNMATCHED_END, String.format(
                            "Freeze end marker at line %d without matching freeze start marker",
                            comment.startLine()));
                }
                pairs.add(new MarkerPair(open, comment, LineRange.of(open.startLine(), comment.endLine())));
                open = null;
            } else if (markers.isStart(comment)) {
                if (open != null) {
                    throw new FreezeStructureException(Kind.NESTED_START, String.format(
                            "Nested freeze block at line %d (already inside freeze block starting at line %d)",
                            comment.startLine(), open.startLine()));
                }
                open = comment;
            }
        }

        if (open != null) {
            Node container = containerOf(source.nodes(), open.startLine());
            if (container != null) {
                throw new FreezeStructureException(Kind.UNCLOSED_NESTED, String.format(
                        "Unclosed freeze block at line %d inside a nested structure (%s at lines %d-%d). "
                                + "Only a freeze block at the document root may omit its end marker",
                        open.startLine(), container.describe(), container.startLine(), container.endLine()));
            }
            int lastLine = Math.max(source.lines().size(), open.endLine());
            pairs.add(new MarkerPair(open, null, LineRange.of(open.startLine(), lastLine)));
        }
        return pairs;
    }

    /**
     * Outermost multi-line node that contains the line.
     */
    private static Node containerOf(List<Node> nodes, int line) {
        for (Node node : nodes) {
            if (node.startLine() != node.endLine() && node.range().contains(line)) {
                return node;
            }
        }
        return null;
    }

    private FreezeRegion bind(MarkerPair pair, List<Node> roots) {
        LineRange region = pair.range();
        Node owner = null;
        List<Node> level = roots;
        while (true) {
            Node encompassing = null;
            for (Node node : level) {
                if (region.encloses(node.range()) || !region.overlaps(node.range())) {
                    continue;
                }
                if (node.startLine() <= region.startLine() && node.endLine() >= region.endLine()) {
                    if (!node.canEncompassFreezeRegion()) {
                        throw incomplete(region, node, String.format(
                                "cannot contain a freeze block (lines %d-%d)",
                                region.startLine(), region.endLine()));
                    }
                    encompassing = node;
                } else if (node.startLine() < region.startLine()) {
                    throw incomplete(region, node, String.format(
                            "starts before freeze block (line %d) and ends inside (line %d)",
                            region.startLine(), node.endLine()));
                } else {
                    throw incomplete(region, node, String.format(
                            "starts inside freeze block (lines %d-%d) and ends after (line %d)",
                            region.startLine(), region.endLine(), node.endLine()));
                }
            }
            if (encompassing == null) {
                break;
            }
            owner = encompassing;
            level = encompassing.children();
        }

        List<Node> enclosed = level.stream().filter(node -> region.encloses(node.range())).toList();
        return new FreezeRegion(region, pair.start(), pair.end(), owner, enclosed);
    }

    private static FreezeStructureException incomplete(LineRange region, Node node, String detail) {
        return new FreezeStructureException(Kind.PARTIAL_OVERLAP, String.format(
                "Freeze block at lines %d-%d contains incomplete nodes: %s at lines %d-%d (%s)",
                region.startLine(), region.endLine(), node.describe(), node.startLine(), node.endLine(),
                detail));
    }

    private record MarkerPair(SourceComment start, SourceComment end, LineRange range) {
    }
}
