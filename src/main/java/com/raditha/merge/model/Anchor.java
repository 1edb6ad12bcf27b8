package com.raditha.merge.model;

/**
 * A pair of corresponding line ranges in the template and destination.
 *
 * @param templateRange lines in the template
 * @param destRange     lines in the destination
 * @param type          how the correspondence was found
 * @param score         strength of the anchor, maximal for freeze blocks
 */
public record Anchor(LineRange templateRange, LineRange destRange, AnchorType type, int score) {

    public static final int FREEZE_SCORE = Integer.MAX_VALUE;

    public Anchor {
        if (templateRange == null || destRange == null) {
            throw new IllegalArgumentException("anchor ranges cannot be null");
        }
    }

    public int templateStart() {
        return templateRange.startLine();
    }

    public int templateEnd() {
        return templateRange.endLine();
    }

    public int destStart() {
        return destRange.startLine();
    }

    public int destEnd() {
        return destRange.endLine();
    }

    /**
     * True when either side shares a line with the other anchor.
     */
    public boolean overlaps(Anchor other) {
        return templateRange.overlaps(other.templateRange) || destRange.overlaps(other.destRange);
    }
}
