package com.raditha.merge.parser;

/**
 * Turns source text into typed nodes and comments.
 * The merge engine depends only on this contract.
 */
public interface SourceParser {

    /**
     * Parse a document. Never throws for invalid source; the returned
     * {@link ParsedSource} carries the validity flag and diagnostics instead.
     *
     * @param content the document text
     * @return the parse outcome
     */
    ParsedSource parse(String content);
}
