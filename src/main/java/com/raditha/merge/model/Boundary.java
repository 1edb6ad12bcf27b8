package com.raditha.merge.model;

/**
 * A gap between two consecutive anchors. Either range may be null when one
 * side has no content in the gap.
 *
 * @param templateRange template lines in the gap, or null
 * @param destRange     destination lines in the gap, or null
 * @param prevAnchor    anchor before the gap, or null for a leading boundary
 * @param nextAnchor    anchor after the gap, or null for a trailing boundary
 */
public record Boundary(LineRange templateRange, LineRange destRange, Anchor prevAnchor, Anchor nextAnchor) {

    public boolean isEmpty() {
        return templateRange == null && destRange == null;
    }
}
