package com.raditha.merge.model;

/**
 * How the two sides of an anchor were found to correspond.
 */
public enum AnchorType {
    EXACT_LINE,
    SIGNATURE_MATCH,
    FREEZE_BLOCK
}
