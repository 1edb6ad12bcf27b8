package com.raditha.merge.exception;

/**
 * Freeze markers do not form a valid structure.
 */
public class FreezeStructureException extends MergeException {

    /**
     * The specific violation.
     */
    public enum Kind {
        /** A start marker without end marker inside a nested structure. */
        UNCLOSED_NESTED,
        /** An end marker with no open region. */
        UNMATCHED_END,
        /** A start marker while a region is already open. */
        NESTED_START,
        /** A region boundary cuts through a node. */
        PARTIAL_OVERLAP
    }

    private final Kind kind;

    public FreezeStructureException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
