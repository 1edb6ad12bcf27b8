package com.raditha.merge.freeze;

import com.raditha.merge.model.LineRange;
import com.raditha.merge.model.Node;
import com.raditha.merge.model.SourceComment;
import com.raditha.merge.parser.SourceText;

import java.util.List;

/**
 * A marker-delimited span of the destination that must survive a merge unchanged.
 *
 * @param range       lines from the start marker to the end marker (or end of file)
 * @param startMarker the start marker comment
 * @param endMarker   the end marker comment, null when the region runs to end of file
 * @param owner       deepest node that encloses the region, null at the document root
 * @param enclosed    nodes at the owner's level that lie completely inside the region
 */
public record FreezeRegion(
        LineRange range,
        SourceComment startMarker,
        SourceComment endMarker,
        Node owner,
        List<Node> enclosed) {

    public FreezeRegion {
        enclosed = enclosed == null ? List.of() : List.copyOf(enclosed);
    }

    public int startLine() {
        return range.startLine();
    }

    public int endLine() {
        return range.endLine();
    }

    public boolean isClosed() {
        return endMarker != null;
    }

    /**
     * Normalized start marker, used to pair regions across documents.
     */
    public String startMarkerText() {
        return SourceText.normalize(startMarker.text());
    }

    /**
     * Whether a node sits entirely inside the region.
     */
    public boolean encloses(Node node) {
        return range.encloses(node.range());
    }

    @Override
    public String toString() {
        return "FreezeRegion" + range;
    }
}
