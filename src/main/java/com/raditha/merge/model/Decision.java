package com.raditha.merge.model;

/**
 * Why a line ended up in the merged output.
 */
public enum Decision {
    KEPT_TEMPLATE,
    KEPT_DESTINATION,
    APPENDED,
    REPLACED,
    FREEZE_BLOCK;

    public String label() {
        return name().toLowerCase();
    }
}
